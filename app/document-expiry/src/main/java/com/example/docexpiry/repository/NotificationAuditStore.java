/*
 * どこで: Document expiry データアクセス境界
 * 何を: notifications 監査レコードの登録/状態遷移/集計を担う
 * なぜ: 送信結果を運用者が後から確認できるようにするため。終端状態のレコードは二度と更新しない
 */
package com.example.docexpiry.repository;

import com.example.docexpiry.model.FailureKind;
import com.example.docexpiry.model.NotificationQuery;
import com.example.docexpiry.model.NotificationRecord;
import com.example.docexpiry.model.NotificationStats;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface NotificationAuditStore {

  /** PENDING のレコードを登録する。 */
  UUID create(NotificationRecord record);

  /** @return 更新件数。PENDING 以外なら 0 */
  int markSent(UUID notificationId, Instant sentAt);

  /** @return 更新件数。PENDING 以外なら 0 */
  int markFailed(UUID notificationId, String errorMessage, FailureKind failureKind);

  NotificationStats stats(Instant todayStart, Instant weekStart);

  List<NotificationRecord> find(NotificationQuery query);

  int deleteSentOrFailedOlderThan(Instant threshold);

  int countStalePending(Instant threshold);
}
