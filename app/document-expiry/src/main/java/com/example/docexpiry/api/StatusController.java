/*
 * どこで: Document expiry API
 * 何を: ルートで疎通とサイクルの実行状態を返す
 * なぜ: cron から次の起動前に前回サイクルが走り続けていないかを確かめられるようにするため
 */
package com.example.docexpiry.api;

import com.example.docexpiry.service.ExpiryCycleOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final ExpiryCycleOrchestrator orchestrator;

  @GetMapping("/")
  public String home() {
    return "document-expiry: ok cycle=" + orchestrator.state();
  }
}
