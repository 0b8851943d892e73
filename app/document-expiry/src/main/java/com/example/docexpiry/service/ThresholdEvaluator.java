/*
 * どこで: Document expiry サービス層
 * 何を: (今日, 期限日) から残日数と警告段階を求める
 * なぜ: 通知文面/ダッシュボード/集計ビューで同じ境界値を使うため。副作用を持たない
 */
package com.example.docexpiry.service;

import com.example.docexpiry.model.AlertLevel;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.ExpiryEvaluation;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ThresholdEvaluator {

  static final int CRITICAL_DAYS = 7;
  static final int URGENT_DAYS = 15;
  static final int WARNING_DAYS = 30;
  static final int NOTICE_DAYS = 60;

  private final Clock clock;

  /** 業務タイムゾーンでの今日。 */
  public LocalDate today() {
    return LocalDate.now(clock);
  }

  public ExpiryEvaluation evaluate(DocumentType documentType, LocalDate expiryDate) {
    return evaluate(documentType, today(), expiryDate);
  }

  public ExpiryEvaluation evaluate(
      DocumentType documentType, LocalDate today, LocalDate expiryDate) {
    if (expiryDate == null) {
      return ExpiryEvaluation.unknown();
    }
    final int daysRemaining = Math.toIntExact(ChronoUnit.DAYS.between(today, expiryDate));
    return ExpiryEvaluation.of(daysRemaining, levelFor(documentType, daysRemaining));
  }

  /** 期限切れ(負値)は最も近い境界と同じく最上位の段階に入る。 */
  public static AlertLevel levelFor(DocumentType documentType, int daysRemaining) {
    if (documentType.fullAlertScale()) {
      if (daysRemaining <= CRITICAL_DAYS) {
        return AlertLevel.CRITICAL;
      }
      if (daysRemaining <= URGENT_DAYS) {
        return AlertLevel.URGENT;
      }
    }
    if (daysRemaining <= WARNING_DAYS) {
      return AlertLevel.WARNING;
    }
    if (daysRemaining <= NOTICE_DAYS) {
      return AlertLevel.NOTICE;
    }
    return AlertLevel.OK;
  }
}
