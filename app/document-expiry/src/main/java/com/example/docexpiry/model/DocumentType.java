/*
 * どこで: Document expiry モデル
 * 何を: 監視対象の書類種別と、その期限列/通知しきい値/警告段階を定義する
 * なぜ: ビザは法的期限が厳しいため段階が細かく、旅券と労働許可証は 60/30 日の 2 段階に留めるため
 */
package com.example.docexpiry.model;

import java.util.List;

public enum DocumentType {
  VISA(
      "visa_expiry_date",
      "Visa",
      NotificationCategory.VISA,
      List.of(
          new ThresholdDefinition(60, AlertLevel.NOTICE),
          new ThresholdDefinition(30, AlertLevel.WARNING),
          new ThresholdDefinition(15, AlertLevel.URGENT),
          new ThresholdDefinition(7, AlertLevel.CRITICAL),
          new ThresholdDefinition(1, AlertLevel.CRITICAL)),
      true),
  PASSPORT(
      "passport_expiry_date",
      "Passport",
      NotificationCategory.DOCUMENT,
      List.of(
          new ThresholdDefinition(60, AlertLevel.NOTICE),
          new ThresholdDefinition(30, AlertLevel.WARNING)),
      false),
  LABOUR_CARD(
      "labour_card_expiry_date",
      "Labour card",
      NotificationCategory.DOCUMENT,
      List.of(
          new ThresholdDefinition(60, AlertLevel.NOTICE),
          new ThresholdDefinition(30, AlertLevel.WARNING)),
      false);

  private final String expiryColumn;
  private final String displayName;
  private final NotificationCategory category;
  private final List<ThresholdDefinition> thresholds;
  private final boolean fullAlertScale;

  DocumentType(
      String expiryColumn,
      String displayName,
      NotificationCategory category,
      List<ThresholdDefinition> thresholds,
      boolean fullAlertScale) {
    this.expiryColumn = expiryColumn;
    this.displayName = displayName;
    this.category = category;
    this.thresholds = thresholds;
    this.fullAlertScale = fullAlertScale;
  }

  // SQL に埋め込む列名。利用者入力ではなく enum 定数からのみ来る
  public String expiryColumn() {
    return expiryColumn;
  }

  // 集計ビューの列接頭辞 (visa_days_remaining など)
  public String columnPrefix() {
    return expiryColumn.substring(0, expiryColumn.length() - "_expiry_date".length());
  }

  public String displayName() {
    return displayName;
  }

  public NotificationCategory category() {
    return category;
  }

  /** 通知しきい値を日数の降順で返す。 */
  public List<ThresholdDefinition> thresholds() {
    return thresholds;
  }

  /** CRITICAL/URGENT まで使う 5 段階なら true、WARNING/NOTICE のみなら false。 */
  public boolean fullAlertScale() {
    return fullAlertScale;
  }
}
