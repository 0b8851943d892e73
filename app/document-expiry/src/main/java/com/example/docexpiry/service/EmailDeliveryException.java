/*
 * どこで: Document expiry サービス層
 * 何を: 送信失敗を一時的/恒久的に分類して表現する
 * なぜ: 一時的な失敗は次サイクルで再送し、恒久的な失敗は運用者の対応まで再送しないため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.FailureKind;

public class EmailDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final FailureKind kind;

  public EmailDeliveryException(FailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public EmailDeliveryException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public FailureKind kind() {
    return kind;
  }

  public boolean isPermanent() {
    return kind == FailureKind.PERMANENT;
  }
}
