package com.farmcrm.db.util;

import com.farmcrm.common.status.Status;
import com.google.common.base.Strings;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Utility methods for reading rows and classifying database failures. */
public final class DbUtil {

  /** SQLState class for connection exceptions (SQL:2011 and PostgreSQL). */
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  private DbUtil() {
    // Utility class, no instances
  }

  /**
   * Converts a SQL failure into a {@link Status}.
   *
   * <p>Failures to reach the store (SQLState class {@code 08}, or a pool timeout) become {@code
   * UNAVAILABLE}; everything else, including constraint violations and malformed SQL, becomes
   * {@code INTERNAL}.
   */
  @Nonnull
  public static Status toStatus(SQLException e) {
    if (isConnectivityFailure(e)) {
      return Status.unavailable("Database unavailable: " + e.getMessage(), e);
    }
    return Status.internal("Statement failed: " + e.getMessage(), e);
  }

  static boolean isConnectivityFailure(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current instanceof SQLTransientConnectionException) {
        return true;
      }
      String state = current.getSQLState();
      if (state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS)) {
        return true;
      }
    }
    return false;
  }

  /** Gets a timestamp column as an Instant, or null when the column is null. */
  @Nullable
  public static Instant getNullableInstant(ResultSet rs, String columnName) throws SQLException {
    java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
    return timestamp == null ? null : timestamp.toInstant();
  }

  /** Gets a decimal column, substituting zero for null. */
  @Nonnull
  public static BigDecimal getDecimalOrZero(ResultSet rs, String columnName) throws SQLException {
    BigDecimal value = rs.getBigDecimal(columnName);
    return value == null ? BigDecimal.ZERO : value;
  }

  /** Gets a date column rendered as {@code yyyy-MM-dd}, or null when the column is null. */
  @Nullable
  public static String getIsoDate(ResultSet rs, String columnName) throws SQLException {
    java.sql.Date date = rs.getDate(columnName);
    return date == null ? null : formatIsoDate(date.toLocalDate());
  }

  @Nonnull
  public static String formatIsoDate(LocalDate date) {
    return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
  }

  /**
   * Shortens a string to {@code maxLength} code points followed by {@code marker} when it is longer
   * than {@code maxLength}. Null becomes the empty string.
   *
   * <p>Lengths count code points rather than {@code char}s, so a surrogate pair is never split.
   */
  @Nonnull
  public static String truncate(@Nullable String str, int maxLength, String marker) {
    if (str == null) {
      return "";
    }
    if (str.codePointCount(0, str.length()) <= maxLength) {
      return str;
    }
    return str.substring(0, str.offsetByCodePoints(0, maxLength)) + marker;
  }

  /** Returns the first argument that is neither null nor empty, or the empty string. */
  @Nonnull
  public static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (!Strings.isNullOrEmpty(value)) {
        return value;
      }
    }
    return "";
  }
}
