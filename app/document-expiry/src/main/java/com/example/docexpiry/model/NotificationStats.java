/*
 * どこで: Document expiry モデル
 * 何を: 監査レコードの集計値
 * なぜ: ダッシュボードと /stats で状態別・期間別・カテゴリ別の件数を返すため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationStats(
    long total,
    long pending,
    long sent,
    long failed,
    long today,
    long thisWeek,
    Map<NotificationCategory, Long> byCategory) {

  public NotificationStats {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったマップを防御的コピーして不変化する
    final Map<NotificationCategory, Long> copy = new EnumMap<>(NotificationCategory.class);
    for (NotificationCategory category : NotificationCategory.values()) {
      copy.put(category, 0L);
    }
    if (byCategory != null) {
      copy.putAll(byCategory);
    }
    byCategory = Collections.unmodifiableMap(copy);
  }

  public long countFor(NotificationCategory category) {
    return byCategory.getOrDefault(category, 0L);
  }
}
