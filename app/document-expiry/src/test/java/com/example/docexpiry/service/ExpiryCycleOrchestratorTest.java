/*
 * どこで: 通知サイクル制御のユニットテスト
 * 何を: バッチの実行順/多重起動の拒否/全体期限での打ち切り/永続層障害の伝播を検証する
 * なぜ: 同一プロセスでサイクルが重ならず、期限超過分が次回へ回ることを保証するため
 */
package com.example.docexpiry.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.docexpiry.config.ExpiryNotificationProperties;
import com.example.docexpiry.model.CycleState;
import com.example.docexpiry.model.CycleStatus;
import com.example.docexpiry.model.CycleSummary;
import com.example.docexpiry.model.DispatchError;
import com.example.docexpiry.model.DispatchErrorKind;
import com.example.docexpiry.model.DispatchResult;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.ThresholdDefinition;
import com.example.docexpiry.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ExpiryCycleOrchestratorTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T04:00:00Z");
  private static final ExpiryNotificationProperties PROPERTIES =
      new ExpiryNotificationProperties(
          false,
          "0 0 8 * * *",
          Duration.ofSeconds(1),
          Duration.ofMinutes(30),
          Duration.ofMinutes(5),
          1000);

  @Mock private ExpiryBatchDispatcher dispatcher;
  @Mock private ExpiryNotificationMetrics metrics;

  private MutableClock clock;
  private ExpiryCycleOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(FIXED_NOW);
    orchestrator = new ExpiryCycleOrchestrator(dispatcher, PROPERTIES, metrics, clock);
  }

  private static DispatchResult emptyResult(InvocationOnMock invocation) {
    final DocumentType documentType = invocation.getArgument(0);
    final ThresholdDefinition threshold = invocation.getArgument(1);
    return new DispatchResult(documentType, threshold.days(), 0, 0, 0, 0, List.of(), false, false);
  }

  @Test
  void planRunsMostUrgentThresholdFirstForEachDocumentType() {
    assertThat(ExpiryCycleOrchestrator.plan())
        .extracting(ExpiryCycleOrchestrator.PlannedBatch::label)
        .containsExactly(
            "VISA/1",
            "VISA/7",
            "VISA/15",
            "VISA/30",
            "VISA/60",
            "PASSPORT/30",
            "PASSPORT/60",
            "LABOUR_CARD/30",
            "LABOUR_CARD/60");
  }

  @Test
  void cycleAggregatesBatchResults() {
    final List<String> seenCycleIds = new ArrayList<>();
    final List<String> seenClaimedBy = new ArrayList<>();
    when(dispatcher.dispatch(any(), any(), any(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              seenCycleIds.add(MDC.get(ExpiryCycleOrchestrator.CYCLE_ID_KEY));
              seenClaimedBy.add(invocation.getArgument(4));
              final DocumentType documentType = invocation.getArgument(0);
              final ThresholdDefinition threshold = invocation.getArgument(1);
              if (documentType == DocumentType.VISA && threshold.days() == 30) {
                return new DispatchResult(
                    documentType,
                    30,
                    3,
                    1,
                    1,
                    1,
                    List.of(
                        new DispatchError(
                            "E2", documentType, 30, DispatchErrorKind.TRANSIENT_SEND, "timeout"),
                        new DispatchError(
                            "E3", documentType, 30, DispatchErrorKind.NOT_ATTEMPTED, "claimed")),
                    false,
                    false);
              }
              return emptyResult(invocation);
            });

    final CycleSummary summary = orchestrator.runCycle();

    assertThat(summary.status()).isEqualTo(CycleStatus.COMPLETED);
    assertThat(summary.batches()).hasSize(9);
    assertThat(summary.deferred()).isEmpty();
    assertThat(summary.notificationsSent()).isEqualTo(1);
    assertThat(summary.notificationsFailed()).isEqualTo(1);
    assertThat(summary.notificationsSkipped()).isEqualTo(1);
    assertThat(summary.errorsByEmployee()).containsOnlyKeys("E2", "E3");
    assertThat(summary.errorsByEmployee().get("E2"))
        .containsExactly("VISA/30 TRANSIENT_SEND: timeout");
    assertThat(seenCycleIds).hasSize(9).containsOnly(summary.cycleId());
    assertThat(seenClaimedBy)
        .containsOnly(orchestrator.resolveWorkerId() + ":" + summary.cycleId());
    assertThat(MDC.get(ExpiryCycleOrchestrator.CYCLE_ID_KEY)).isNull();
    assertThat(orchestrator.state()).isEqualTo(CycleState.IDLE);
    verify(dispatcher, times(9))
        .dispatch(any(), any(), any(LocalDate.class), any(), anyString());
    verify(metrics).recordCycleDuration(any());
  }

  @Test
  void overlappingTriggerIsRejectedWhileCycleRuns() throws Exception {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    when(dispatcher.dispatch(any(), any(), any(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return emptyResult(invocation);
            });
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<CycleSummary> first = executor.submit(orchestrator::runCycle);
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(orchestrator.state()).isEqualTo(CycleState.RUNNING);
      final CycleSummary rejected = orchestrator.runCycle();

      assertThat(rejected.status()).isEqualTo(CycleStatus.REJECTED);
      assertThat(rejected.cycleId()).isNull();
      assertThat(rejected.batches()).isEmpty();
      verify(metrics).recordCycleRejected();

      release.countDown();
      assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(CycleStatus.COMPLETED);
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
    assertThat(orchestrator.state()).isEqualTo(CycleState.IDLE);
  }

  @Test
  void deadlineDefersRemainingThresholds() {
    when(dispatcher.dispatch(any(), any(), any(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              // 最初のバッチで全体期限を使い切る
              clock.advance(Duration.ofMinutes(31));
              return emptyResult(invocation);
            });

    final CycleSummary summary = orchestrator.runCycle();

    assertThat(summary.status()).isEqualTo(CycleStatus.TIMED_OUT);
    assertThat(summary.batches()).hasSize(1);
    assertThat(summary.deferred())
        .hasSize(8)
        .first()
        .isEqualTo("VISA/7");
    verify(dispatcher, times(1)).dispatch(any(), any(), any(), any(), anyString());
  }

  @Test
  void dispatcherTimeoutStopsTheCycle() {
    when(dispatcher.dispatch(any(), any(), any(), any(), anyString()))
        .thenAnswer(
            invocation -> {
              final DocumentType documentType = invocation.getArgument(0);
              final ThresholdDefinition threshold = invocation.getArgument(1);
              return new DispatchResult(
                  documentType, threshold.days(), 2, 0, 0, 2, List.of(), false, true);
            });

    final CycleSummary summary = orchestrator.runCycle();

    assertThat(summary.status()).isEqualTo(CycleStatus.TIMED_OUT);
    assertThat(summary.notificationsSkipped()).isEqualTo(2);
    assertThat(summary.deferred()).hasSize(8);
  }

  @Test
  void persistenceFailureIsPropagatedAndStateIsReset() {
    when(dispatcher.dispatch(any(), any(), any(), any(), anyString()))
        .thenThrow(new DataAccessResourceFailureException("database unavailable"));

    assertThatThrownBy(orchestrator::runCycle)
        .isInstanceOf(DataAccessResourceFailureException.class);

    assertThat(orchestrator.state()).isEqualTo(CycleState.IDLE);
    assertThat(MDC.get(ExpiryCycleOrchestrator.CYCLE_ID_KEY)).isNull();
    verify(metrics).recordCycleDuration(any());
    verify(metrics, never()).recordCycleRejected();
  }
}
