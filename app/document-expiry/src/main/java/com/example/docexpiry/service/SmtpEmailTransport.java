/*
 * どこで: Document expiry サービス層
 * 何を: JavaMailSender で HTML メールを送信し、失敗を一時的/恒久的に分類する
 * なぜ: 宛先不正やプロバイダ拒否は再送しても成功しないため、通信障害と分けて扱うため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.config.ExpiryMailProperties;
import com.example.docexpiry.model.EmailMessage;
import com.example.docexpiry.model.FailureKind;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "docexpiry.mail", name = "transport", havingValue = "smtp")
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JavaMailSender は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SmtpEmailTransport implements EmailTransport {

  private static final Logger logger = LoggerFactory.getLogger(SmtpEmailTransport.class);

  private final JavaMailSender mailSender;
  private final ExpiryMailProperties properties;

  public SmtpEmailTransport(JavaMailSender mailSender, ExpiryMailProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
    applySendTimeout(mailSender, properties);
  }

  @Override
  public void send(EmailMessage message) {
    try {
      final MimeMessage mimeMessage = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(mimeMessage, true, StandardCharsets.UTF_8.name());
      if (properties.fromName() == null || properties.fromName().isBlank()) {
        helper.setFrom(properties.from());
      } else {
        helper.setFrom(properties.from(), properties.fromName());
      }
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      helper.setText(message.textBody(), message.htmlBody());
      mailSender.send(mimeMessage);
      logger.info("email sent to={} subject={}", message.to(), message.subject());
    } catch (MessagingException | UnsupportedEncodingException ex) {
      throw classify(message, ex);
    } catch (MailException ex) {
      throw classify(message, ex);
    }
  }

  @VisibleForTesting
  EmailDeliveryException classify(EmailMessage message, Exception ex) {
    final FailureKind kind = isPermanent(ex) ? FailureKind.PERMANENT : FailureKind.TRANSIENT;
    return new EmailDeliveryException(
        kind, "email delivery failed to=" + message.to() + ": " + ex.getMessage(), ex);
  }

  private boolean isPermanent(Exception ex) {
    final List<Throwable> candidates = new ArrayList<>(Throwables.getCausalChain(ex));
    if (ex instanceof MailSendException sendException) {
      for (Exception messageException : sendException.getMessageExceptions()) {
        candidates.addAll(Throwables.getCausalChain(messageException));
      }
    }
    // 宛先の構文不正/拒否は恒久的、それ以外(接続断/タイムアウト/認証)は一時的とみなす
    return candidates.stream()
        .anyMatch(
            cause ->
                cause instanceof SendFailedException
                    || cause instanceof AddressException
                    || cause instanceof MailParseException);
  }

  private static void applySendTimeout(JavaMailSender mailSender, ExpiryMailProperties properties) {
    if (!(mailSender instanceof JavaMailSenderImpl impl)) {
      return;
    }
    final String timeoutMillis = String.valueOf(properties.sendTimeout().toMillis());
    // spring.mail.properties で明示された値を優先する
    impl.getJavaMailProperties().putIfAbsent("mail.smtp.connectiontimeout", timeoutMillis);
    impl.getJavaMailProperties().putIfAbsent("mail.smtp.timeout", timeoutMillis);
    impl.getJavaMailProperties().putIfAbsent("mail.smtp.writetimeout", timeoutMillis);
  }
}
