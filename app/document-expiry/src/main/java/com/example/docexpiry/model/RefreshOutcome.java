/*
 * どこで: Document expiry モデル
 * 何を: 集計ビュー 1 件分の再集計結果
 * なぜ: 一括再集計でもビュー単位で成否を返すため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RefreshOutcome(
    AggregateView view, RefreshStatus status, Long rowCount, String error, Instant refreshedAt) {

  public static RefreshOutcome success(AggregateView view, long rowCount, Instant refreshedAt) {
    return new RefreshOutcome(view, RefreshStatus.SUCCESS, rowCount, null, refreshedAt);
  }

  public static RefreshOutcome failed(AggregateView view, String error, Instant refreshedAt) {
    return new RefreshOutcome(view, RefreshStatus.FAILED, null, error, refreshedAt);
  }
}
