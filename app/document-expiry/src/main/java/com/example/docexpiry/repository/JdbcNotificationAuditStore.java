/*
 * どこで: Document expiry データアクセス
 * 何を: notifications テーブルの登録/状態遷移/集計/保持期間削除を担う
 * なぜ: 状態遷移を WHERE status = 'PENDING' の条件付き更新に限定し、終端レコードを書き換えないため
 */
package com.example.docexpiry.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.FailureKind;
import com.example.docexpiry.model.NotificationCategory;
import com.example.docexpiry.model.NotificationQuery;
import com.example.docexpiry.model.NotificationRecord;
import com.example.docexpiry.model.NotificationSeverity;
import com.example.docexpiry.model.NotificationStats;
import com.example.docexpiry.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationAuditStore implements NotificationAuditStore {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, title, message, severity, recipient, category, status,
             employee_id, document_type, threshold_days, expiry_date, failure_kind,
             created_at, sent_at, error_message
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public UUID create(NotificationRecord record) {
    if (record.status() != NotificationStatus.PENDING) {
      throw new IllegalArgumentException(
          "notification must be created as PENDING id=" + record.notificationId());
    }
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          title,
          message,
          severity,
          recipient,
          category,
          status,
          employee_id,
          document_type,
          threshold_days,
          expiry_date,
          created_at
        ) VALUES (
          :notificationId,
          :title,
          :message,
          :severity,
          :recipient,
          :category,
          'PENDING',
          :employeeId,
          :documentType,
          :thresholdDays,
          :expiryDate,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("severity", record.severity().name())
            .addValue("recipient", record.recipient() == null ? "" : record.recipient())
            .addValue("category", record.category().name())
            .addValue("employeeId", record.employeeId())
            .addValue(
                "documentType", record.documentType() == null ? null : record.documentType().name())
            .addValue("thresholdDays", record.thresholdDays())
            .addValue("expiryDate", toSqlDate(record.expiryDate()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  @Override
  public int markSent(UUID notificationId, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'SENT',
            sent_at = :sentAt
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("sentAt", toTimestamp(sentAt));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markFailed(UUID notificationId, String errorMessage, FailureKind failureKind) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'FAILED',
            error_message = :errorMessage,
            failure_kind = :failureKind
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("errorMessage", errorMessage)
            .addValue("failureKind", failureKind.name());
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public NotificationStats stats(Instant todayStart, Instant weekStart) {
    final String totalsSql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE status = 'PENDING') AS pending,
               COUNT(*) FILTER (WHERE status = 'SENT') AS sent,
               COUNT(*) FILTER (WHERE status = 'FAILED') AS failed,
               COUNT(*) FILTER (WHERE created_at >= :todayStart) AS today,
               COUNT(*) FILTER (WHERE created_at >= :weekStart) AS this_week
        FROM notifications
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("todayStart", toTimestamp(todayStart))
            .addValue("weekStart", toTimestamp(weekStart));
    final Map<NotificationCategory, Long> byCategory = new EnumMap<>(NotificationCategory.class);
    jdbcTemplate.query(
        "SELECT category, COUNT(*) AS total FROM notifications GROUP BY category",
        new MapSqlParameterSource(),
        rs -> {
          byCategory.put(
              NotificationCategory.valueOf(rs.getString("category")), rs.getLong("total"));
        });
    return jdbcTemplate.queryForObject(
        totalsSql,
        params,
        (rs, rowNum) ->
            new NotificationStats(
                rs.getLong("total"),
                rs.getLong("pending"),
                rs.getLong("sent"),
                rs.getLong("failed"),
                rs.getLong("today"),
                rs.getLong("this_week"),
                byCategory));
  }

  @Override
  public List<NotificationRecord> find(NotificationQuery query) {
    // 未指定の条件は IS NULL で素通しにする
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE (CAST(:status AS TEXT) IS NULL OR status = :status)
              AND (CAST(:category AS TEXT) IS NULL OR category = :category)
              AND (CAST(:createdFrom AS TIMESTAMPTZ) IS NULL OR created_at >= :createdFrom)
              AND (CAST(:createdTo AS TIMESTAMPTZ) IS NULL OR created_at < :createdTo)
            ORDER BY created_at DESC, notification_id
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", query.status() == null ? null : query.status().name())
            .addValue("category", query.category() == null ? null : query.category().name())
            .addValue("createdFrom", toTimestamp(query.createdFrom()))
            .addValue("createdTo", toTimestamp(query.createdTo()))
            .addValue("limit", query.limit())
            .addValue("offset", query.offset());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public int deleteSentOrFailedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE status IN ('SENT', 'FAILED')
          AND created_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  @Override
  public int countStalePending(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE status = 'PENDING'
          AND created_at < :threshold
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)), Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String documentType = rs.getString("document_type");
    final String failureKind = rs.getString("failure_kind");
    final Integer thresholdDays = rs.getObject("threshold_days", Integer.class);
    return new NotificationRecord(
        rs.getObject("notification_id", UUID.class),
        rs.getString("title"),
        rs.getString("message"),
        NotificationSeverity.valueOf(rs.getString("severity")),
        rs.getString("recipient"),
        NotificationCategory.valueOf(rs.getString("category")),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getString("employee_id"),
        documentType == null ? null : DocumentType.valueOf(documentType),
        thresholdDays,
        toLocalDate(rs.getDate("expiry_date")),
        failureKind == null ? null : FailureKind.valueOf(failureKind),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")),
        rs.getString("error_message"));
  }
}
