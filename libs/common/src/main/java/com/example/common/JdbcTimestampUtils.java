/*
 * Where: shared JDBC helpers
 * What: converts between java.time values and the java.sql types bound by repositories
 * Why: the PostgreSQL driver cannot always infer a SQL type for Instant/LocalDate parameters
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps the epoch value regardless of the DB time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
