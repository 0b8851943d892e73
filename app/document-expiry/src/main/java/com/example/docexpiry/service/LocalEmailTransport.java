/*
 * どこで: Document expiry サービス層
 * 何を: メール送信を模擬する実装
 * なぜ: 外部送信を止めたまま (送信停止スイッチ) 状態遷移と文面を確認するため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.EmailMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "docexpiry.mail",
    name = "transport",
    havingValue = "local",
    matchIfMissing = true)
public class LocalEmailTransport implements EmailTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalEmailTransport.class);

  @Override
  public void send(EmailMessage message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info("email simulated send to={} subject={}", message.to(), message.subject());
  }
}
