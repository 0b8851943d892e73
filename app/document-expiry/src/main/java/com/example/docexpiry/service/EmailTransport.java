/*
 * どこで: Document expiry サービス層
 * 何を: 期限通知メールの送信口
 * なぜ: SMTP 実送信とログのみの擬似送信を差し替え可能にするため。SMS など他チャネルもここで足す
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.EmailMessage;

public interface EmailTransport {

  /**
   * 1 通送信する。
   *
   * @throws EmailDeliveryException 送信に失敗した場合。一時的か恒久的かを分類して投げる
   */
  void send(EmailMessage message);
}
