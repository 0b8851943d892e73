/*
 * どこで: Document expiry データアクセス
 * 何を: 基底テーブルから書類種別ごとの期限状況件数を読む
 * なぜ: /stats を送信なしで即時に返すため
 */
package com.example.docexpiry.repository;

import static com.example.common.JdbcTimestampUtils.toSqlDate;

import com.example.docexpiry.model.DocumentExpiryStats;
import com.example.docexpiry.model.DocumentType;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DocumentExpiryStatsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public DocumentExpiryStats findStats(
      DocumentType documentType, LocalDate today, int expiringWithinDays) {
    final String sql =
        """
        SELECT COUNT(e.%1$s) AS total_employees,
               COUNT(*) FILTER (WHERE e.%1$s BETWEEN :today AND :soonLimit) AS expiring_soon,
               COUNT(*) FILTER (WHERE e.%1$s < :today) AS expired,
               (
                 SELECT COUNT(*)
                 FROM sent_notifications s
                 WHERE s.document_type = :documentType
                   AND s.status = 'SENT'
               ) AS notifications_sent
        FROM employees e
        WHERE e.is_active = TRUE
        """
            .formatted(documentType.expiryColumn());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("today", toSqlDate(today))
            .addValue("soonLimit", toSqlDate(today.plusDays(expiringWithinDays)))
            .addValue("documentType", documentType.name());
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new DocumentExpiryStats(
                documentType,
                rs.getLong("total_employees"),
                rs.getLong("expiring_soon"),
                rs.getLong("expired"),
                rs.getLong("notifications_sent")));
  }
}
