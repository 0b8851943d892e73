/*
 * どこで: Document expiry データアクセス
 * 何を: sent_notifications テーブルで送信済みフラグと claim を管理する
 * なぜ: 主キー (employee_id, document_type, threshold_days) への INSERT を原子的な重複防止にするため
 */
package com.example.docexpiry.repository;

import static com.example.common.JdbcTimestampUtils.toLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.docexpiry.model.DedupKey;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.EligibleEmployee;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcDedupFlagStore implements DedupFlagStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<EligibleEmployee> findEligible(
      DocumentType documentType, int thresholdDays, LocalDate today, Instant now) {
    // 期限列名は enum 定数由来のため文字列連結で埋め込む
    final String sql =
        """
        SELECT e.employee_id, e.name, e.email, e.company_name, e.%1$s AS expiry_date
        FROM employees e
        WHERE e.is_active = TRUE
          AND e.%1$s = :targetDate
          AND NOT EXISTS (
            SELECT 1
            FROM sent_notifications s
            WHERE s.employee_id = e.employee_id
              AND s.document_type = :documentType
              AND s.threshold_days = :thresholdDays
              AND (s.status = 'SENT' OR s.lease_until > :now)
          )
          AND NOT EXISTS (
            SELECT 1
            FROM notifications n
            WHERE n.employee_id = e.employee_id
              AND n.document_type = :documentType
              AND n.threshold_days = :thresholdDays
              AND n.expiry_date = e.%1$s
              AND n.status = 'FAILED'
              AND n.failure_kind = 'PERMANENT'
          )
        ORDER BY e.employee_id
        """
            .formatted(documentType.expiryColumn());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("targetDate", toSqlDate(today.plusDays(thresholdDays)))
            .addValue("documentType", documentType.name())
            .addValue("thresholdDays", thresholdDays)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapEmployee);
  }

  @Override
  public boolean claim(
      DedupKey key, LocalDate expiryDate, String claimedBy, Instant now, Instant leaseUntil) {
    // 競合時の UPDATE はリース切れ CLAIMED のみ。SENT 行と有効な claim は 0 件更新になる
    final String sql =
        """
        INSERT INTO sent_notifications (
          employee_id,
          document_type,
          threshold_days,
          expiry_date,
          status,
          claimed_by,
          claimed_at,
          lease_until
        ) VALUES (
          :employeeId,
          :documentType,
          :thresholdDays,
          :expiryDate,
          'CLAIMED',
          :claimedBy,
          :now,
          :leaseUntil
        )
        ON CONFLICT (employee_id, document_type, threshold_days) DO UPDATE
        SET expiry_date = EXCLUDED.expiry_date,
            claimed_by = EXCLUDED.claimed_by,
            claimed_at = EXCLUDED.claimed_at,
            lease_until = EXCLUDED.lease_until
        WHERE sent_notifications.status = 'CLAIMED'
          AND sent_notifications.lease_until <= :now
        """;
    final MapSqlParameterSource params =
        keyParams(key)
            .addValue("expiryDate", toSqlDate(expiryDate))
            .addValue("claimedBy", claimedBy)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public boolean markSent(DedupKey key, UUID notificationId, Instant sentAt, String claimedBy) {
    final String sql =
        """
        UPDATE sent_notifications
        SET status = 'SENT',
            notification_id = :notificationId,
            sent_at = :sentAt,
            lease_until = NULL
        WHERE employee_id = :employeeId
          AND document_type = :documentType
          AND threshold_days = :thresholdDays
          AND status = 'CLAIMED'
          AND claimed_by = :claimedBy
        """;
    final MapSqlParameterSource params =
        keyParams(key)
            .addValue("notificationId", notificationId)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("claimedBy", claimedBy);
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public void release(DedupKey key, String claimedBy) {
    final String sql =
        """
        DELETE FROM sent_notifications
        WHERE employee_id = :employeeId
          AND document_type = :documentType
          AND threshold_days = :thresholdDays
          AND status = 'CLAIMED'
          AND claimed_by = :claimedBy
        """;
    jdbcTemplate.update(sql, keyParams(key).addValue("claimedBy", claimedBy));
  }

  private MapSqlParameterSource keyParams(DedupKey key) {
    return new MapSqlParameterSource()
        .addValue("employeeId", key.employeeId())
        .addValue("documentType", key.documentType().name())
        .addValue("thresholdDays", key.thresholdDays());
  }

  private EligibleEmployee mapEmployee(ResultSet rs, int rowNum) throws SQLException {
    return new EligibleEmployee(
        rs.getString("employee_id"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("company_name"),
        toLocalDate(rs.getDate("expiry_date")));
  }
}
