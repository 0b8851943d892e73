/*
 * どこで: Document expiry モデル
 * 何を: 文面生成の結果 (メール本体 + 監査用の重要度 + 警告段階)
 * なぜ: 送信と監査レコード作成で同じ生成結果を使うため
 */
package com.example.docexpiry.model;

public record ExpiryNotice(EmailMessage email, NotificationSeverity severity, AlertLevel level) {}
