/*
 * どこで: Document expiry サービス層
 * 何を: CI/Test 専用で送信失敗を注入する Transport
 * なぜ: 実コード経路を汚さずに一時失敗の再送と恒久失敗の除外を再現するため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.EmailMessage;
import com.example.docexpiry.model.FailureKind;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "docexpiry.mail.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingEmailTransport implements EmailTransport {

  private final LocalEmailTransport delegate;

  @Value("${docexpiry.mail.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  @Value("${docexpiry.mail.failure-injection.kind:TRANSIENT}")
  private FailureKind kind;

  @Override
  public void send(EmailMessage message) {
    if (shouldInjectFailure(message.to())) {
      throw new EmailDeliveryException(
          kind, "email delivery failure injection matched to=" + message.to());
    }
    delegate.send(message);
  }

  private boolean shouldInjectFailure(String recipient) {
    if (recipientPrefix == null || recipientPrefix.isBlank() || recipient == null) {
      return false;
    }
    return recipient.startsWith(recipientPrefix);
  }
}
