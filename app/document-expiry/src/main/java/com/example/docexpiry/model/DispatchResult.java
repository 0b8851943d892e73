/*
 * どこで: Document expiry モデル
 * 何を: 1 しきい値分のバッチ送信結果
 * なぜ: sent + failed + skipped が対象件数と一致する形でサイクルへ返すため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchResult(
    DocumentType documentType,
    int thresholdDays,
    int eligible,
    int sent,
    int failed,
    int skipped,
    List<DispatchError> errors,
    boolean aborted,
    boolean timedOut) {

  public DispatchResult {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    errors = errors == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(errors));
  }
}
