/*
 * どこで: Document expiry API
 * 何を: 通知サイクルの起動と集計の参照を提供する
 * なぜ: 外部 cron や運用者が HTTP で 1 サイクルを起動し、その結果をそのまま受け取るため
 */
package com.example.docexpiry.api;

import com.example.docexpiry.model.CycleStatus;
import com.example.docexpiry.model.CycleSummary;
import com.example.docexpiry.service.ExpiryCycleOrchestrator;
import com.example.docexpiry.service.ExpiryStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ExpiryCycleController {

  private final ExpiryCycleOrchestrator orchestrator;
  private final ExpiryStatsService statsService;

  // 個別の送信失敗があっても 200。別サイクル実行中は 409
  @PostMapping("/cycle")
  public ResponseEntity<CycleSummary> runCycle() {
    final CycleSummary summary = orchestrator.runCycle();
    if (summary.status() == CycleStatus.REJECTED) {
      return ResponseEntity.status(HttpStatus.CONFLICT).body(summary);
    }
    return ResponseEntity.ok(summary);
  }

  @GetMapping("/stats")
  public StatsResponse stats() {
    return statsService.stats();
  }
}
