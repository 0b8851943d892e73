/*
 * どこで: Document expiry データアクセス境界
 * 何を: (従業員, 書類種別, しきい値) 単位の送信済みフラグを読み書きする
 * なぜ: 同じしきい値で二重に通知しないため。送信前に claim し、成功確認後にだけ SENT にする
 */
package com.example.docexpiry.repository;

import com.example.docexpiry.model.DedupKey;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.EligibleEmployee;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface DedupFlagStore {

  /**
   * 期限日がちょうど {@code today + thresholdDays} の在籍従業員のうち、未送信かつ有効な claim を持たない者を返す。
   * 同じ期限日で恒久失敗した従業員は除外する。
   */
  List<EligibleEmployee> findEligible(
      DocumentType documentType, int thresholdDays, LocalDate today, Instant now);

  /**
   * 送信権を取得する。未登録ならば挿入し、リース切れの claim ならば奪い直す。
   *
   * @return 取得できた場合 true。SENT 済みや他者の有効な claim があれば false
   */
  boolean claim(
      DedupKey key, LocalDate expiryDate, String claimedBy, Instant now, Instant leaseUntil);

  /** 送信成功を確定する。自分の claim が残っている場合だけ更新する。 */
  boolean markSent(DedupKey key, UUID notificationId, Instant sentAt, String claimedBy);

  /** 送信失敗時に自分の claim を破棄し、次サイクルで再評価させる。 */
  void release(DedupKey key, String claimedBy);
}
