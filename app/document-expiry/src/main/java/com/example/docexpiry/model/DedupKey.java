/*
 * どこで: Document expiry モデル
 * 何を: 重複送信防止の単位 (従業員, 書類種別, しきい値日数)
 * なぜ: sent_notifications の主キーと 1 対 1 に対応させるため
 */
package com.example.docexpiry.model;

public record DedupKey(String employeeId, DocumentType documentType, int thresholdDays) {

  @Override
  public String toString() {
    return employeeId + "/" + documentType + "/" + thresholdDays;
  }
}
