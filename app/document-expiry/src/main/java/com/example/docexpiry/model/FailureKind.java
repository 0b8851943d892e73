/*
 * どこで: Document expiry モデル
 * 何を: 送信失敗の分類
 * なぜ: 次サイクルで再送するか、運用者の手当てを待つかを分けるため
 */
package com.example.docexpiry.model;

public enum FailureKind {
  // 通信断やプロバイダ一時障害。次サイクルで再送する
  TRANSIENT,
  // 宛先不正や拒否。自動再送しない
  PERMANENT
}
