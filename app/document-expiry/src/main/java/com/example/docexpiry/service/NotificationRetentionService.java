/*
 * Where: Document expiry service layer
 * What: Applies the retention policy to notification audit records
 * Why: Prevent unbounded growth while keeping anomalous pending records for investigation
 */
package com.example.docexpiry.service;

import com.example.docexpiry.config.NotificationRetentionProperties;
import com.example.docexpiry.repository.NotificationAuditStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationAuditStore auditStore;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  /** @return deleted record count */
  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int stalePending = auditStore.countStalePending(threshold);
    if (stalePending > 0) {
      // A PENDING record this old means a cycle died between create and send
      logger.error(
          "notification retention found stale pending records count={} threshold={}",
          stalePending,
          threshold);
    }
    final int deleted = auditStore.deleteSentOrFailedOlderThan(threshold);
    logger.info(
        "notification retention cleanup deleted notifications={} threshold={}", deleted, threshold);
    return deleted;
  }
}
