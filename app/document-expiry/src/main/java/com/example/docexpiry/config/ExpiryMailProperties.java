/*
 * どこで: Document expiry アプリの設定バインド
 * 何を: 送信元/運用宛先/送信タイムアウトとトランスポート種別を保持する
 * なぜ: 実送信(smtp)とログのみ(local)を環境で切り替え、1 通ごとの待ち時間を制限するため
 */
package com.example.docexpiry.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "docexpiry.mail")
@Validated
public record ExpiryMailProperties(
    @NotBlank String transport,
    @NotBlank String from,
    String fromName,
    String recipient,
    @NotNull Duration sendTimeout) {

  @AssertTrue(message = "docexpiry.mail.transport must be local or smtp")
  public boolean isTransportSupported() {
    return "local".equals(transport) || "smtp".equals(transport);
  }

  @AssertTrue(message = "docexpiry.mail.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    return sendTimeout != null && !sendTimeout.isZero() && !sendTimeout.isNegative();
  }

  /** 運用窓口の宛先が設定されていれば従業員本人ではなくそちらへ送る。 */
  public boolean hasRecipientOverride() {
    return recipient != null && !recipient.isBlank();
  }
}
