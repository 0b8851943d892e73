/*
 * どこで: Document expiry モデル
 * 何を: document_expiry_monitoring_mv から読んだ期限間近書類 1 件
 * なぜ: 残日数と警告段階をスナップショットから一覧表示するため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExpiringDocument(
    String employeeId,
    String name,
    String companyName,
    DocumentType documentType,
    LocalDate expiryDate,
    int daysRemaining,
    AlertLevel alertLevel) {}
