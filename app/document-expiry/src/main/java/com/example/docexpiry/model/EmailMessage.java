/*
 * どこで: Document expiry モデル
 * 何を: 1 通分の送信内容 (宛先/件名/HTML 本文/テキスト本文)
 * なぜ: 文面生成と送信トランスポートを分離するため
 */
package com.example.docexpiry.model;

public record EmailMessage(String to, String subject, String htmlBody, String textBody) {

  public boolean hasRecipient() {
    return to != null && !to.isBlank();
  }
}
