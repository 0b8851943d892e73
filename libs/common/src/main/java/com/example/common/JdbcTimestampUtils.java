/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant / LocalDate を java.sql 型に明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを回避し、DATE 列を日付のまま扱うため
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // DATE 列はタイムゾーンを持たないため、暦日のまま変換する
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
