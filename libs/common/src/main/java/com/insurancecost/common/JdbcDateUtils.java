/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う LocalDate を java.sql.Date に明示変換する
 * なぜ: 複数行 VALUES 展開時に PostgreSQL JDBC の型推論へ依存しないため
 */
package com.insurancecost.common;

import java.sql.Date;
import java.time.LocalDate;

public final class JdbcDateUtils {
  private JdbcDateUtils() {}

  // 前提: tariffs.date はタイムゾーンを持たない暦日なので、時刻成分は常に 00:00 になる
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
