/*
 * どこで: Document expiry サービス層
 * 何を: 期限通知メールの件名/HTML/テキスト本文と監査用の重要度を組み立てる
 * なぜ: 送信処理から文面の都合を切り離し、しきい値に応じた文面を一箇所で決めるため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.config.ExpiryMailProperties;
import com.example.docexpiry.model.AlertLevel;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.EligibleEmployee;
import com.example.docexpiry.model.EmailMessage;
import com.example.docexpiry.model.ExpiryEvaluation;
import com.example.docexpiry.model.ExpiryNotice;
import com.example.docexpiry.model.NotificationSeverity;
import com.example.docexpiry.model.ThresholdDefinition;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class ExpiryMessageComposer {

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH);

  private static final String HTML_TEMPLATE =
      """
      <!DOCTYPE html>
      <html>
      <body style="font-family: Arial, sans-serif; color: #1f2937;">
        <div style="background-color: %1$s; color: #ffffff; padding: 16px;">
          <h2 style="margin: 0;">%2$s expiry %3$s</h2>
          <p style="margin: 4px 0 0 0;">%4$s remaining</p>
        </div>
        <table style="border-collapse: collapse; margin: 16px 0;">
          <tr><th align="left">Employee</th><td>%5$s</td></tr>
          <tr><th align="left">Employee ID</th><td>%6$s</td></tr>
          <tr><th align="left">Company</th><td>%7$s</td></tr>
          <tr><th align="left">Email</th><td>%8$s</td></tr>
          <tr><th align="left">Expiry date</th><td>%9$s</td></tr>
          <tr><th align="left">Days remaining</th><td style="color: %1$s;">%10$s</td></tr>
        </table>
        <h3>Required actions</h3>
        <ol>
          <li>Review the current %11$s status.</li>
          <li>Contact the employee about renewal.</li>
          <li>Start the renewal process if needed.</li>
          <li>Update the employee record once renewed.</li>
        </ol>
        <p style="font-size: 12px; color: #6b7280;">Sent automatically by the document expiry monitor.</p>
      </body>
      </html>
      """;

  private static final String TEXT_TEMPLATE =
      """
      %1$s expiry %2$s: %3$s remaining

      Employee: %4$s (%5$s)
      Company: %6$s
      Expiry date: %7$s

      Required actions:
      1. Review the current %8$s status.
      2. Contact the employee about renewal.
      3. Start the renewal process if needed.
      4. Update the employee record once renewed.
      """;

  private final ExpiryMailProperties mailProperties;
  private final ThresholdEvaluator thresholdEvaluator;

  public ExpiryNotice compose(
      DocumentType documentType,
      ThresholdDefinition threshold,
      EligibleEmployee employee,
      LocalDate today) {
    final ExpiryEvaluation evaluation =
        thresholdEvaluator.evaluate(documentType, today, employee.expiryDate());
    final int daysRemaining = evaluation.daysRemaining().orElse(threshold.days());
    final AlertLevel level = evaluation.level();
    final String remaining = daysPhrase(daysRemaining);
    final String documentName = documentType.displayName();
    final String subject =
        "[%s] %s expiry: %s - %s remaining"
            .formatted(level, documentName, employee.name(), remaining);
    final String expiry =
        employee.expiryDate() == null ? "-" : DATE_FORMAT.format(employee.expiryDate());
    final String company = employee.companyName() == null ? "-" : employee.companyName();
    final String html =
        HTML_TEMPLATE.formatted(
            colorFor(level),
            escape(documentName),
            escape(level.name()),
            escape(remaining),
            escape(employee.name()),
            escape(employee.employeeId()),
            escape(company),
            escape(employee.email() == null ? "-" : employee.email()),
            escape(expiry),
            daysRemaining,
            escape(documentName.toLowerCase(Locale.ENGLISH)));
    final String text =
        TEXT_TEMPLATE.formatted(
            documentName,
            level,
            remaining,
            employee.name(),
            employee.employeeId(),
            company,
            expiry,
            documentName.toLowerCase(Locale.ENGLISH));
    final EmailMessage email = new EmailMessage(resolveRecipient(employee), subject, html, text);
    return new ExpiryNotice(email, severityFor(threshold.days()), level);
  }

  /** しきい値が近いほど重い重要度にする: 7 日以内 ERROR、15 日以内 WARNING、それ以外 INFO。 */
  public static NotificationSeverity severityFor(int thresholdDays) {
    if (thresholdDays <= ThresholdEvaluator.CRITICAL_DAYS) {
      return NotificationSeverity.ERROR;
    }
    if (thresholdDays <= ThresholdEvaluator.URGENT_DAYS) {
      return NotificationSeverity.WARNING;
    }
    return NotificationSeverity.INFO;
  }

  private String resolveRecipient(EligibleEmployee employee) {
    if (mailProperties.hasRecipientOverride()) {
      return mailProperties.recipient();
    }
    return employee.email();
  }

  private static String daysPhrase(int days) {
    return Math.abs(days) == 1 ? days + " day" : days + " days";
  }

  private static String colorFor(AlertLevel level) {
    return switch (level) {
      case CRITICAL -> "#dc2626";
      case URGENT -> "#ea580c";
      case WARNING -> "#d97706";
      case NOTICE -> "#2563eb";
      case OK, UNKNOWN -> "#16a34a";
    };
  }

  private static String escape(String value) {
    return HtmlUtils.htmlEscape(value == null ? "" : value);
  }
}
