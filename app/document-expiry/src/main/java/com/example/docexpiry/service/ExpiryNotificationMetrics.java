/*
 * どこで: Document expiry サービス層
 * 何を: 送信結果/サイクル所要時間/多重起動の拒否/集計ビュー再集計/保持期間削除の結果をメトリクスとして記録する
 * なぜ: 個別の送信失敗は HTTP 200 に埋もれるため、Prometheus から失敗率を直接監視できるようにするため
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.AggregateView;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.RefreshStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ExpiryNotificationMetrics {

  static final String METRIC_DELIVERY_TOTAL = "docexpiry.notification.delivery.total";
  static final String METRIC_CYCLE_DURATION = "docexpiry.cycle.duration";
  static final String METRIC_CYCLE_REJECTED = "docexpiry.cycle.rejected.total";
  static final String METRIC_REFRESH_TOTAL = "docexpiry.aggregate.refresh.total";
  static final String METRIC_RETENTION_DELETED = "docexpiry.retention.deleted.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter cycleRejectedCounter;
  private final Timer cycleDurationTimer;
  private final Counter retentionDeletedCounter;

  public ExpiryNotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.cycleRejectedCounter =
        Counter.builder(METRIC_CYCLE_REJECTED)
            .description("Cycle triggers rejected because a cycle was already running")
            .register(meterRegistry);
    this.cycleDurationTimer =
        Timer.builder(METRIC_CYCLE_DURATION)
            .description("Wall time of one notification cycle")
            .register(meterRegistry);
    this.retentionDeletedCounter =
        Counter.builder(METRIC_RETENTION_DELETED)
            .description("Audit records removed by retention cleanup")
            .register(meterRegistry);
  }

  /** result は sent / failed_transient / failed_permanent / skipped のいずれか。 */
  public void recordDeliveryResult(DocumentType documentType, String result) {
    final Tags tags = Tags.of("result", result, "document_type", lower(documentType.name()));
    counters
        .computeIfAbsent(
            METRIC_DELIVERY_TOTAL + tags,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Expiry notification delivery outcomes")
                    .tags(tags)
                    .register(meterRegistry))
        .increment();
  }

  public void recordCycleDuration(Duration duration) {
    cycleDurationTimer.record(duration);
  }

  public void recordCycleRejected() {
    cycleRejectedCounter.increment();
  }

  public void recordRefresh(AggregateView view, RefreshStatus status) {
    final Tags tags = Tags.of("view", view.viewName(), "result", lower(status.name()));
    counters
        .computeIfAbsent(
            METRIC_REFRESH_TOTAL + tags,
            ignored ->
                Counter.builder(METRIC_REFRESH_TOTAL)
                    .description("Aggregate snapshot refresh outcomes")
                    .tags(tags)
                    .register(meterRegistry))
        .increment();
  }

  public void recordRetentionDeleted(int deleted) {
    retentionDeletedCounter.increment(deleted);
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
