/*
 * どこで: Document expiry モデル
 * 何を: 残日数から決まる緊急度の段階を表す
 * なぜ: 通知文面とダッシュボード集計で同じ段階名を使うため
 */
package com.example.docexpiry.model;

public enum AlertLevel {
  CRITICAL,
  URGENT,
  WARNING,
  NOTICE,
  OK,
  // 期限日が未登録で判定できない
  UNKNOWN
}
