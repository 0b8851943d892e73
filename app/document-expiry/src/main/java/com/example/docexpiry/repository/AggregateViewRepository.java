/*
 * どこで: Document expiry データアクセス
 * 何を: 集計スナップショット(マテリアライズドビュー)の再集計と読み取りを担う
 * なぜ: 再集計は DB 側の refresh 関数に任せ、読み手は常に完成済みのスナップショットだけを見るため
 */
package com.example.docexpiry.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toLocalDate;

import com.example.docexpiry.model.AggregateView;
import com.example.docexpiry.model.AlertLevel;
import com.example.docexpiry.model.CompanyStatistics;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.ExpiringDocument;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AggregateViewRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // refresh 関数は REFRESH MATERIALIZED VIEW CONCURRENTLY を実行する
  public void refresh(AggregateView view) {
    jdbcTemplate.getJdbcTemplate().execute("SELECT " + view.refreshFunction() + "()");
  }

  public long countRows(AggregateView view) {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + view.viewName(), new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  public List<CompanyStatistics> findCompanyStatistics() {
    final String sql =
        """
        SELECT company_name, total_employees, active_employees, inactive_employees,
               visa_expiring_30_days, visa_expiring_60_days,
               passport_expiring_60_days, labour_card_expiring_60_days, last_updated
        FROM company_statistics_mv
        ORDER BY company_name
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new CompanyStatistics(
                rs.getString("company_name"),
                rs.getLong("total_employees"),
                rs.getLong("active_employees"),
                rs.getLong("inactive_employees"),
                rs.getLong("visa_expiring_30_days"),
                rs.getLong("visa_expiring_60_days"),
                rs.getLong("passport_expiring_60_days"),
                rs.getLong("labour_card_expiring_60_days"),
                toInstant(rs.getTimestamp("last_updated"))));
  }

  /** 残日数が {@code withinDays} 以下(期限切れを含む)の書類を緊急度の高い順に返す。 */
  public List<ExpiringDocument> findExpiringDocuments(DocumentType documentType, int withinDays) {
    final String sql =
        """
        SELECT employee_id, name, company_name,
               %1$s_expiry_date AS expiry_date,
               %1$s_days_remaining AS days_remaining,
               %1$s_alert_level AS alert_level
        FROM document_expiry_monitoring_mv
        WHERE %1$s_days_remaining IS NOT NULL
          AND %1$s_days_remaining <= :withinDays
        ORDER BY %1$s_days_remaining, employee_id
        """
            .formatted(documentType.columnPrefix());
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("withinDays", withinDays),
        (rs, rowNum) ->
            new ExpiringDocument(
                rs.getString("employee_id"),
                rs.getString("name"),
                rs.getString("company_name"),
                documentType,
                toLocalDate(rs.getDate("expiry_date")),
                rs.getInt("days_remaining"),
                AlertLevel.valueOf(rs.getString("alert_level"))));
  }
}
