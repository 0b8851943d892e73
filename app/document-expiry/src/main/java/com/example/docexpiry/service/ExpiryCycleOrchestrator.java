/*
 * どこで: Document expiry サービス層
 * 何を: 全書類種別 x 全しきい値のバッチ送信を 1 サイクルとして順に実行し、結果を集約する
 * なぜ: 同一プロセス内でサイクルを重ねず、全体期限を超えた分は次回の起動へ回すため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.config.ExpiryNotificationProperties;
import com.example.docexpiry.model.CycleState;
import com.example.docexpiry.model.CycleStatus;
import com.example.docexpiry.model.CycleSummary;
import com.example.docexpiry.model.DispatchError;
import com.example.docexpiry.model.DispatchResult;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.ThresholdDefinition;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpiryCycleOrchestrator {

  static final String CYCLE_ID_KEY = "cycle_id";
  private static final Logger logger = LoggerFactory.getLogger(ExpiryCycleOrchestrator.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final ExpiryBatchDispatcher dispatcher;
  private final ExpiryNotificationProperties properties;
  private final ExpiryNotificationMetrics metrics;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public CycleState state() {
    return running.get() ? CycleState.RUNNING : CycleState.IDLE;
  }

  public CycleSummary runCycle() {
    final Instant startedAt = Instant.now(clock);
    if (!running.compareAndSet(false, true)) {
      logger.warn("expiry cycle rejected because another cycle is running");
      metrics.recordCycleRejected();
      return CycleSummary.rejected(startedAt);
    }
    final String cycleId = UUID.randomUUID().toString();
    MDC.put(CYCLE_ID_KEY, cycleId);
    try {
      return execute(cycleId, startedAt);
    } catch (DataAccessException ex) {
      logger.error("expiry cycle aborted by persistence failure cycleId={}", cycleId, ex);
      throw ex;
    } finally {
      metrics.recordCycleDuration(Duration.between(startedAt, Instant.now(clock)));
      MDC.remove(CYCLE_ID_KEY);
      running.set(false);
    }
  }

  private CycleSummary execute(String cycleId, Instant startedAt) {
    final LocalDate today = LocalDate.now(clock);
    final Instant deadline = startedAt.plus(properties.cycleTimeout());
    final String claimedBy = resolveWorkerId() + ":" + cycleId;
    logger.info("expiry cycle started today={} deadline={}", today, deadline);

    final List<DispatchResult> batches = new ArrayList<>();
    final List<String> deferred = new ArrayList<>();
    final Map<String, List<String>> errorsByEmployee = new LinkedHashMap<>();
    boolean timedOut = false;
    int sent = 0;
    int failed = 0;
    int skipped = 0;
    for (PlannedBatch batch : plan()) {
      if (timedOut || !Instant.now(clock).isBefore(deadline)) {
        timedOut = true;
        deferred.add(batch.label());
        continue;
      }
      final DispatchResult result =
          dispatcher.dispatch(batch.documentType(), batch.threshold(), today, deadline, claimedBy);
      batches.add(result);
      sent += result.sent();
      failed += result.failed();
      skipped += result.skipped();
      timedOut = result.timedOut();
      for (DispatchError error : result.errors()) {
        errorsByEmployee
            .computeIfAbsent(error.employeeId(), ignored -> new ArrayList<>())
            .add(error.describe());
      }
    }

    final CycleStatus status = timedOut ? CycleStatus.TIMED_OUT : CycleStatus.COMPLETED;
    final CycleSummary summary =
        new CycleSummary(
            cycleId,
            status,
            startedAt,
            Instant.now(clock),
            sent,
            failed,
            skipped,
            batches,
            deferred,
            errorsByEmployee);
    if (timedOut) {
      logger.warn("expiry cycle reached its deadline; deferred thresholds={}", deferred);
    }
    logger.info(
        "expiry cycle finished status={} sent={} failed={} skipped={}",
        status,
        sent,
        failed,
        skipped);
    return summary;
  }

  /** 書類種別の定義順に、しきい値は残日数の少ない(緊急な)順に並べる。 */
  @VisibleForTesting
  static List<PlannedBatch> plan() {
    final List<PlannedBatch> batches = new ArrayList<>();
    for (DocumentType documentType : DocumentType.values()) {
      documentType.thresholds().stream()
          .sorted(Comparator.comparingInt(ThresholdDefinition::days))
          .forEach(threshold -> batches.add(new PlannedBatch(documentType, threshold)));
    }
    return batches;
  }

  @VisibleForTesting
  String resolveWorkerId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  record PlannedBatch(DocumentType documentType, ThresholdDefinition threshold) {
    String label() {
      return documentType + "/" + threshold.days();
    }
  }
}
