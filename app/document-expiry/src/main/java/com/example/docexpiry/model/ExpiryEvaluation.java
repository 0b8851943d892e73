/*
 * どこで: Document expiry モデル
 * 何を: 残日数と警告段階の評価結果
 * なぜ: 期限未登録(残日数なし)を null ではなく UNKNOWN として明示するため
 */
package com.example.docexpiry.model;

import java.util.OptionalInt;

public record ExpiryEvaluation(OptionalInt daysRemaining, AlertLevel level) {

  public static ExpiryEvaluation unknown() {
    return new ExpiryEvaluation(OptionalInt.empty(), AlertLevel.UNKNOWN);
  }

  public static ExpiryEvaluation of(int daysRemaining, AlertLevel level) {
    return new ExpiryEvaluation(OptionalInt.of(daysRemaining), level);
  }

  public boolean expired() {
    return daysRemaining.isPresent() && daysRemaining.getAsInt() < 0;
  }
}
