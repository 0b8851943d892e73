/*
 * どこで: Document expiry モデル
 * 何を: 従業員 1 人分の送信失敗/未処理の記録
 * なぜ: バッチを止めずに失敗をサマリへ集約するため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchError(
    String employeeId,
    DocumentType documentType,
    int thresholdDays,
    DispatchErrorKind kind,
    String message) {

  public String describe() {
    return documentType + "/" + thresholdDays + " " + kind + ": " + message;
  }
}
