/*
 * どこで: Document expiry API モデル
 * 何を: 監査レコード一覧のレスポンス
 * なぜ: ページング条件と結果をまとめて返すため
 */
package com.example.docexpiry.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(
    int limit, int offset, List<NotificationSummary> notifications) {

  public NotificationListResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    notifications =
        notifications == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
