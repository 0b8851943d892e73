/*
 * どこで: Document expiry サービス層
 * 何を: 1 つの (書類種別, しきい値) について対象者へ間隔を空けて通知し、監査と送信済みフラグを更新する
 * なぜ: 1 人の失敗でバッチを止めず、送信成功を確認できた場合だけフラグを立てるため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.config.ExpiryNotificationProperties;
import com.example.docexpiry.model.DedupKey;
import com.example.docexpiry.model.DispatchError;
import com.example.docexpiry.model.DispatchErrorKind;
import com.example.docexpiry.model.DispatchResult;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.EligibleEmployee;
import com.example.docexpiry.model.ExpiryNotice;
import com.example.docexpiry.model.FailureKind;
import com.example.docexpiry.model.NotificationRecord;
import com.example.docexpiry.model.ThresholdDefinition;
import com.example.docexpiry.repository.DedupFlagStore;
import com.example.docexpiry.repository.NotificationAuditStore;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ExpiryBatchDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ExpiryBatchDispatcher.class);

  private final DedupFlagStore dedupFlagStore;
  private final NotificationAuditStore auditStore;
  private final EmailTransport emailTransport;
  private final ExpiryMessageComposer messageComposer;
  private final SendThrottle sendThrottle;
  private final ExpiryNotificationProperties properties;
  private final ExpiryNotificationMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * 対象者を順番に処理する。対象抽出自体の永続化失敗は呼び出し元へ伝播する。
   *
   * @param deadline サイクル全体の期限。過ぎた時点で残りを未処理として返す
   * @param claimedBy claim の所有者識別子
   */
  public DispatchResult dispatch(
      DocumentType documentType,
      ThresholdDefinition threshold,
      LocalDate today,
      Instant deadline,
      String claimedBy) {
    final List<EligibleEmployee> eligible =
        dedupFlagStore.findEligible(documentType, threshold.days(), today, Instant.now(clock));
    final BatchTally tally = new BatchTally(documentType, threshold.days());
    for (int i = 0; i < eligible.size(); i++) {
      final EligibleEmployee employee = eligible.get(i);
      if (deadline != null && !Instant.now(clock).isBefore(deadline)) {
        tally.timedOut = true;
        tally.notAttempted(eligible.subList(i, eligible.size()), "cycle deadline reached");
        break;
      }
      final DedupKey key = new DedupKey(employee.employeeId(), documentType, threshold.days());
      try {
        dispatchOne(key, threshold, employee, today, claimedBy, tally);
      } catch (DataAccessException ex) {
        // 永続層が落ちている間は後続も失敗するため、このバッチを打ち切る
        logger.error("dispatch aborted by persistence failure key={}", key, ex);
        tally.failed(employee, DispatchErrorKind.PERSISTENCE, truncateError(ex.getMessage()));
        releaseAfterAbort(key, claimedBy);
        tally.notAttempted(
            eligible.subList(i + 1, eligible.size()), "batch aborted after persistence failure");
        tally.aborted = true;
        break;
      }
    }
    final DispatchResult result = tally.toResult(eligible.size());
    logger.info(
        "dispatch finished documentType={} thresholdDays={} eligible={} sent={} failed={}"
            + " skipped={}",
        documentType,
        threshold.days(),
        result.eligible(),
        result.sent(),
        result.failed(),
        result.skipped());
    return result;
  }

  private void dispatchOne(
      DedupKey key,
      ThresholdDefinition threshold,
      EligibleEmployee employee,
      LocalDate today,
      String claimedBy,
      BatchTally tally) {
    final Instant now = Instant.now(clock);
    // 送信前に claim を取り、別プロセスとの二重送信を防ぐ
    final boolean claimed =
        dedupFlagStore.claim(
            key, employee.expiryDate(), claimedBy, now, now.plus(properties.claimLease()));
    if (!claimed) {
      logger.info("notification skipped because key is already claimed or sent key={}", key);
      metrics.recordDeliveryResult(key.documentType(), "skipped");
      tally.skipped++;
      return;
    }
    final ExpiryNotice notice =
        messageComposer.compose(key.documentType(), threshold, employee, today);
    final NotificationRecord record =
        NotificationRecord.pending(
            key, employee.expiryDate(), notice.email(), notice.severity(), now);
    auditStore.create(record);
    if (!notice.email().hasRecipient()) {
      handleFailure(
          key,
          record,
          new EmailDeliveryException(FailureKind.PERMANENT, "no recipient address"),
          claimedBy,
          tally,
          employee);
      return;
    }
    sendThrottle.acquire();
    try {
      emailTransport.send(notice.email());
    } catch (EmailDeliveryException ex) {
      handleFailure(key, record, ex, claimedBy, tally, employee);
      return;
    } catch (RuntimeException ex) {
      handleFailure(
          key,
          record,
          new EmailDeliveryException(FailureKind.TRANSIENT, ex.getMessage(), ex),
          claimedBy,
          tally,
          employee);
      return;
    }
    confirmSent(key, record, claimedBy);
    metrics.recordDeliveryResult(key.documentType(), "sent");
    tally.sent++;
  }

  private void confirmSent(DedupKey key, NotificationRecord record, String claimedBy) {
    final Instant sentAt = Instant.now(clock);
    // 監査の SENT とフラグを同一トランザクションにまとめ、監査なしのフラグを残さない
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    transactionTemplate.executeWithoutResult(
        status -> {
          final int auditUpdated = auditStore.markSent(record.notificationId(), sentAt);
          if (auditUpdated == 0) {
            logger.warn(
                "notification sent but audit record was not pending id={} key={}",
                record.notificationId(),
                key);
          }
          final boolean flagged =
              dedupFlagStore.markSent(key, record.notificationId(), sentAt, claimedBy);
          if (!flagged) {
            logger.warn(
                "notification sent but claim was lost id={} key={}", record.notificationId(), key);
          }
        });
  }

  private void handleFailure(
      DedupKey key,
      NotificationRecord record,
      EmailDeliveryException ex,
      String claimedBy,
      BatchTally tally,
      EligibleEmployee employee) {
    final String errorMessage = truncateError(ex.getMessage());
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    transactionTemplate.executeWithoutResult(
        status -> {
          final int updated =
              auditStore.markFailed(record.notificationId(), errorMessage, ex.kind());
          if (updated == 0) {
            logger.warn(
                "notification failure not recorded because audit record was not pending id={}",
                record.notificationId());
          }
          // フラグは立てず claim だけ外す。恒久失敗は監査側の FAILED/PERMANENT で対象外になる
          dedupFlagStore.release(key, claimedBy);
        });
    logger.warn(
        "notification send failed key={} kind={} id={}",
        key,
        ex.kind(),
        record.notificationId(),
        ex);
    metrics.recordDeliveryResult(
        key.documentType(), ex.isPermanent() ? "failed_permanent" : "failed_transient");
    tally.failed(
        employee,
        ex.isPermanent() ? DispatchErrorKind.PERMANENT_SEND : DispatchErrorKind.TRANSIENT_SEND,
        errorMessage);
  }

  private void releaseAfterAbort(DedupKey key, String claimedBy) {
    try {
      dedupFlagStore.release(key, claimedBy);
    } catch (DataAccessException ex) {
      // 解放できなくてもリース切れで再取得できる
      logger.warn("claim release failed after abort key={} claimedBy={}", key, claimedBy, ex);
    }
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private static final class BatchTally {
    private final DocumentType documentType;
    private final int thresholdDays;
    private final List<DispatchError> errors = new ArrayList<>();
    private int sent;
    private int failed;
    private int skipped;
    private boolean aborted;
    private boolean timedOut;

    private BatchTally(DocumentType documentType, int thresholdDays) {
      this.documentType = documentType;
      this.thresholdDays = thresholdDays;
    }

    private void failed(EligibleEmployee employee, DispatchErrorKind kind, String message) {
      failed++;
      errors.add(
          new DispatchError(employee.employeeId(), documentType, thresholdDays, kind, message));
    }

    private void notAttempted(List<EligibleEmployee> remaining, String reason) {
      for (EligibleEmployee employee : remaining) {
        skipped++;
        errors.add(
            new DispatchError(
                employee.employeeId(),
                documentType,
                thresholdDays,
                DispatchErrorKind.NOT_ATTEMPTED,
                reason));
      }
    }

    private DispatchResult toResult(int eligible) {
      return new DispatchResult(
          documentType, thresholdDays, eligible, sent, failed, skipped, errors, aborted, timedOut);
    }
  }
}
