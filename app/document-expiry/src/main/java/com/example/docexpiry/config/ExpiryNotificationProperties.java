/*
 * どこで: Document expiry アプリの設定バインド
 * 何を: 通知サイクルの起動方法/送信間隔/全体期限/claim リース/エラー文字数上限を保持する
 * なぜ: プロバイダのレート制限やサイクル時間を環境ごとに調整し、起動時に妥当性を検証するため
 */
package com.example.docexpiry.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "docexpiry.notification")
@Validated
public record ExpiryNotificationProperties(
    boolean schedulerEnabled,
    @NotBlank String cron,
    @NotNull Duration sendInterval,
    @NotNull Duration cycleTimeout,
    @NotNull Duration claimLease,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "docexpiry.notification.send-interval must not be negative")
  public boolean isSendIntervalValid() {
    // 0 は間隔なし(テスト用途)として許容する
    return sendInterval != null && !sendInterval.isNegative();
  }

  @AssertTrue(message = "docexpiry.notification.cycle-timeout must be positive")
  public boolean isCycleTimeoutPositive() {
    return isPositiveDuration(cycleTimeout);
  }

  @AssertTrue(message = "docexpiry.notification.claim-lease must be positive")
  public boolean isClaimLeasePositive() {
    return isPositiveDuration(claimLease);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
