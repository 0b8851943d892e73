/*
 * どこで: Document expiry モデル
 * 何を: 1 サイクル分の集計結果
 * なぜ: 個別の送信失敗を HTTP エラーではなくデータとして呼び出し元へ返すため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CycleSummary(
    String cycleId,
    CycleStatus status,
    Instant startedAt,
    Instant finishedAt,
    int notificationsSent,
    int notificationsFailed,
    int notificationsSkipped,
    List<DispatchResult> batches,
    List<String> deferred,
    Map<String, List<String>> errorsByEmployee) {

  public CycleSummary {
    // SpotBugs の EI_EXPOSE_REP 対応: コレクションは防御的コピーして不変化する
    batches = batches == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(batches));
    deferred =
        deferred == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(deferred));
    final Map<String, List<String>> errors = new LinkedHashMap<>();
    if (errorsByEmployee != null) {
      errorsByEmployee.forEach((key, value) -> errors.put(key, List.copyOf(value)));
    }
    errorsByEmployee = Collections.unmodifiableMap(errors);
  }

  public static CycleSummary rejected(Instant now) {
    return new CycleSummary(
        null, CycleStatus.REJECTED, now, now, 0, 0, 0, List.of(), List.of(), Map.of());
  }
}
