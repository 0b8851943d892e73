/*
 * どこで: Document expiry サービス層
 * 何を: サイクル状態/監査集計/書類種別ごとの期限状況をまとめて返す
 * なぜ: 送信を起こさずに運用状況を 1 リクエストで確認できるようにするため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.api.StatsResponse;
import com.example.docexpiry.model.DocumentExpiryStats;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.NotificationStats;
import com.example.docexpiry.repository.DocumentExpiryStatsRepository;
import com.example.docexpiry.repository.NotificationAuditStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpiryStatsService {

  static final int EXPIRING_SOON_DAYS = 30;
  private static final Duration WEEK = Duration.ofDays(7);

  private final ExpiryCycleOrchestrator orchestrator;
  private final NotificationAuditStore auditStore;
  private final DocumentExpiryStatsRepository documentExpiryStatsRepository;
  private final Clock clock;

  public StatsResponse stats() {
    final Instant now = Instant.now(clock);
    final LocalDate today = LocalDate.now(clock);
    final Instant todayStart = today.atStartOfDay(clock.getZone()).toInstant();
    final NotificationStats notificationStats = auditStore.stats(todayStart, now.minus(WEEK));
    final List<DocumentExpiryStats> documents = new ArrayList<>();
    for (DocumentType documentType : DocumentType.values()) {
      documents.add(
          documentExpiryStatsRepository.findStats(documentType, today, EXPIRING_SOON_DAYS));
    }
    return new StatsResponse(orchestrator.state(), today, notificationStats, documents);
  }
}
