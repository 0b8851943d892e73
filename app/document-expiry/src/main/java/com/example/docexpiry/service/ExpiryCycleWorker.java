/*
 * どこで: Document expiry サイクルワーカー
 * 何を: 日次 cron で通知サイクルを起動する
 * なぜ: 外部スケジューラを置けない環境でもプロセス内で日次実行できるようにするため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.CycleSummary;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docexpiry.notification.scheduler-enabled", havingValue = "true")
public class ExpiryCycleWorker {

  private static final Logger logger = LoggerFactory.getLogger(ExpiryCycleWorker.class);

  private final ExpiryCycleOrchestrator orchestrator;

  @Scheduled(cron = "${docexpiry.notification.cron}", zone = "${app.time-zone:UTC}")
  public void run() {
    final CycleSummary summary = orchestrator.runCycle();
    logger.info(
        "scheduled expiry cycle status={} sent={} failed={}",
        summary.status(),
        summary.notificationsSent(),
        summary.notificationsFailed());
  }
}
