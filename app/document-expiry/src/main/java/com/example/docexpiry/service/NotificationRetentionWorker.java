/*
 * Where: Document expiry cleanup worker
 * What: Runs audit retention cleanup on a fixed delay, skipping rounds that overlap a cycle
 * Why: The dispatcher writes audit rows throughout a cycle and cleanup can wait for the next round
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.CycleState;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docexpiry.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionWorker.class);

  private final NotificationRetentionService retentionService;
  private final ExpiryCycleOrchestrator orchestrator;
  private final ExpiryNotificationMetrics metrics;

  @Scheduled(fixedDelayString = "${docexpiry.retention.cleanup-interval}")
  public void run() {
    if (orchestrator.state() == CycleState.RUNNING) {
      logger.info("notification retention skipped because an expiry cycle is running");
      return;
    }
    metrics.recordRetentionDeleted(retentionService.cleanup());
  }
}
