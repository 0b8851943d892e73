/*
 * どこで: Document expiry API モデル
 * 何を: 監査レコード一覧の 1 件分
 * なぜ: 本文(HTML 由来のテキスト)を除いた運用向けの項目だけを返すため
 */
package com.example.docexpiry.api;

import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.FailureKind;
import com.example.docexpiry.model.NotificationCategory;
import com.example.docexpiry.model.NotificationRecord;
import com.example.docexpiry.model.NotificationSeverity;
import com.example.docexpiry.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String title,
    NotificationSeverity severity,
    NotificationCategory category,
    NotificationStatus status,
    String recipient,
    String employeeId,
    DocumentType documentType,
    Integer thresholdDays,
    LocalDate expiryDate,
    FailureKind failureKind,
    String errorMessage,
    Instant createdAt,
    Instant sentAt) {

  public static NotificationSummary from(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.title(),
        record.severity(),
        record.category(),
        record.status(),
        record.recipient(),
        record.employeeId(),
        record.documentType(),
        record.thresholdDays(),
        record.expiryDate(),
        record.failureKind(),
        record.errorMessage(),
        record.createdAt(),
        record.sentAt());
  }
}
