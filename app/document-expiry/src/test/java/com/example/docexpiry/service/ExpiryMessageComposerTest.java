/*
 * どこで: 期限通知メールの組み立てのユニットテスト
 * 何を: 件名/本文/宛先/重要度の決定を検証する
 * なぜ: 利用者入力が HTML に混ざる経路と、しきい値ごとの重要度を固定するため
 */
package com.example.docexpiry.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.docexpiry.config.ExpiryMailProperties;
import com.example.docexpiry.model.AlertLevel;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.EligibleEmployee;
import com.example.docexpiry.model.ExpiryNotice;
import com.example.docexpiry.model.NotificationSeverity;
import com.example.docexpiry.model.ThresholdDefinition;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ExpiryMessageComposerTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
  private static final ThresholdEvaluator EVALUATOR =
      new ThresholdEvaluator(Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));

  private static ExpiryMailProperties mail(String recipient) {
    return new ExpiryMailProperties(
        "local",
        "noreply@example.com",
        "Document Expiry Monitor",
        recipient,
        Duration.ofSeconds(10));
  }

  private static EligibleEmployee employee(String name, int daysAhead) {
    return new EligibleEmployee(
        "E100", name, "worker@example.com", "Acme & Sons", TODAY.plusDays(daysAhead));
  }

  @Test
  void composesSubjectWithLevelAndRemainingDays() {
    final ExpiryMessageComposer composer = new ExpiryMessageComposer(mail(null), EVALUATOR);

    final ExpiryNotice notice =
        composer.compose(
            DocumentType.VISA,
            new ThresholdDefinition(7, AlertLevel.CRITICAL),
            employee("Ali Hassan", 7),
            TODAY);

    assertThat(notice.email().subject())
        .isEqualTo("[CRITICAL] Visa expiry: Ali Hassan - 7 days remaining");
    assertThat(notice.email().to()).isEqualTo("worker@example.com");
    assertThat(notice.level()).isEqualTo(AlertLevel.CRITICAL);
    assertThat(notice.severity()).isEqualTo(NotificationSeverity.ERROR);
    assertThat(notice.email().textBody())
        .contains("Employee: Ali Hassan (E100)")
        .contains("Expiry date: 8 Mar 2026");
  }

  @Test
  void singularDayPhrase() {
    final ExpiryMessageComposer composer = new ExpiryMessageComposer(mail(null), EVALUATOR);

    final ExpiryNotice notice =
        composer.compose(
            DocumentType.VISA,
            new ThresholdDefinition(1, AlertLevel.CRITICAL),
            employee("Sara", 1),
            TODAY);

    assertThat(notice.email().subject()).endsWith("- 1 day remaining");
  }

  @Test
  void escapesEmployeeValuesInHtmlBody() {
    final ExpiryMessageComposer composer = new ExpiryMessageComposer(mail(null), EVALUATOR);

    final ExpiryNotice notice =
        composer.compose(
            DocumentType.PASSPORT,
            new ThresholdDefinition(30, AlertLevel.WARNING),
            employee("<script>alert(1)</script>", 30),
            TODAY);

    assertThat(notice.email().htmlBody())
        .doesNotContain("<script>")
        .contains("&lt;script&gt;")
        .contains("Acme &amp; Sons");
  }

  @Test
  void recipientOverrideReplacesEmployeeAddress() {
    final ExpiryMessageComposer composer =
        new ExpiryMessageComposer(mail("hr-ops@example.com"), EVALUATOR);

    final ExpiryNotice notice =
        composer.compose(
            DocumentType.LABOUR_CARD,
            new ThresholdDefinition(60, AlertLevel.NOTICE),
            employee("Omar", 60),
            TODAY);

    assertThat(notice.email().to()).isEqualTo("hr-ops@example.com");
    assertThat(notice.level()).isEqualTo(AlertLevel.NOTICE);
  }

  @Test
  void missingEmployeeAddressLeavesNoRecipient() {
    final ExpiryMessageComposer composer = new ExpiryMessageComposer(mail(null), EVALUATOR);
    final EligibleEmployee noEmail =
        new EligibleEmployee("E200", "No Mail", null, null, TODAY.plusDays(30));

    final ExpiryNotice notice =
        composer.compose(
            DocumentType.VISA, new ThresholdDefinition(30, AlertLevel.WARNING), noEmail, TODAY);

    assertThat(notice.email().hasRecipient()).isFalse();
  }

  @ParameterizedTest
  @CsvSource({"1, ERROR", "7, ERROR", "8, WARNING", "15, WARNING", "30, INFO", "60, INFO"})
  void severityFollowsThresholdDays(int days, NotificationSeverity expected) {
    assertThat(ExpiryMessageComposer.severityFor(days)).isEqualTo(expected);
  }
}
