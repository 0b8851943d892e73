/*
 * どこで: Document expiry API モデル
 * 何を: /stats のレスポンス
 * なぜ: サイクル状態と監査/期限の集計を 1 つの形に固定するため
 */
package com.example.docexpiry.api;

import com.example.docexpiry.model.CycleState;
import com.example.docexpiry.model.DocumentExpiryStats;
import com.example.docexpiry.model.NotificationStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatsResponse(
    CycleState cycleState,
    LocalDate today,
    NotificationStats notifications,
    List<DocumentExpiryStats> documents) {

  public StatsResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    documents =
        documents == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(documents));
  }
}
