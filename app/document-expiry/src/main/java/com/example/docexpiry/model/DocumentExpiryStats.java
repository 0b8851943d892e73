/*
 * どこで: Document expiry モデル
 * 何を: 書類種別ごとの期限状況の件数
 * なぜ: 送信を伴わずに現在の期限切れ/期限間近の規模を確認するため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentExpiryStats(
    DocumentType documentType,
    long totalEmployees,
    long expiringSoon,
    long expired,
    long notificationsSent) {}
