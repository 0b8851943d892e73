/*
 * どこで: Document expiry モデル
 * 何を: 監査レコード一覧の絞り込み条件
 * なぜ: 運用者が FAILED などを状態/カテゴリ/期間で追えるようにするため
 */
package com.example.docexpiry.model;

import java.time.Instant;

public record NotificationQuery(
    NotificationStatus status,
    NotificationCategory category,
    Instant createdFrom,
    Instant createdTo,
    int limit,
    int offset) {}
