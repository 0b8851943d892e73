/*
 * どこで: Document expiry モデル
 * 何を: 期限何日前に通知するかと、その時点のラベルの組
 * なぜ: 書類種別ごとの通知タイミングを表として扱うため
 */
package com.example.docexpiry.model;

public record ThresholdDefinition(int days, AlertLevel label) {}
