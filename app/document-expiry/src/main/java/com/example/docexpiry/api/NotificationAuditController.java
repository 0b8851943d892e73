/*
 * どこで: Document expiry API
 * 何を: 通知監査レコードを状態/カテゴリ/期間で絞り込んで返す
 * なぜ: 恒久失敗など自動再送されない通知を運用者が追跡できるようにするため
 */
package com.example.docexpiry.api;

import com.example.docexpiry.model.NotificationCategory;
import com.example.docexpiry.model.NotificationQuery;
import com.example.docexpiry.model.NotificationStatus;
import com.example.docexpiry.repository.NotificationAuditStore;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class NotificationAuditController {

  static final int MAX_LIMIT = 200;

  private final NotificationAuditStore auditStore;

  @GetMapping("/notifications")
  public NotificationListResponse list(
      @RequestParam(name = "status", required = false) NotificationStatus status,
      @RequestParam(name = "category", required = false) NotificationCategory category,
      @RequestParam(name = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(name = "to", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
    }
    if (offset < 0) {
      throw new InvalidRequestException("offset must not be negative");
    }
    if (from != null && to != null && !from.isBefore(to)) {
      throw new InvalidRequestException("from must be before to");
    }
    final NotificationQuery query =
        new NotificationQuery(status, category, from, to, limit, offset);
    return new NotificationListResponse(
        limit,
        offset,
        auditStore.find(query).stream().map(NotificationSummary::from).toList());
  }
}
