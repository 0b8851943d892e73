/*
 * どこで: Document expiry モデル
 * 何を: notifications テーブルの監査レコード
 * なぜ: 送信ごとの結果を PENDING から SENT/FAILED へ一方向に記録するため
 */
package com.example.docexpiry.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String title,
    String message,
    NotificationSeverity severity,
    String recipient,
    NotificationCategory category,
    NotificationStatus status,
    String employeeId,
    DocumentType documentType,
    Integer thresholdDays,
    LocalDate expiryDate,
    FailureKind failureKind,
    Instant createdAt,
    Instant sentAt,
    String errorMessage) {

  public static NotificationRecord pending(
      DedupKey key,
      LocalDate expiryDate,
      EmailMessage email,
      NotificationSeverity severity,
      Instant createdAt) {
    return new NotificationRecord(
        UUID.randomUUID(),
        email.subject(),
        email.textBody(),
        severity,
        email.to(),
        key.documentType().category(),
        NotificationStatus.PENDING,
        key.employeeId(),
        key.documentType(),
        key.thresholdDays(),
        expiryDate,
        null,
        createdAt,
        null,
        null);
  }
}
