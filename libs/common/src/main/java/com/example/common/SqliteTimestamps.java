/*
 * Where: Common utilities
 * What: Converts Instant values to and from the TEXT timestamps SQLite stores
 * Why: Rows written by CURRENT_TIMESTAMP and rows written by the application must sort and parse alike
 */
package com.example.common;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

public final class SqliteTimestamps {
  private SqliteTimestamps() {}

  // CURRENT_TIMESTAMP writes "yyyy-MM-dd HH:mm:ss" in UTC; the application adds milliseconds.
  private static final DateTimeFormatter WRITE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter READ_FORMAT =
      new DateTimeFormatterBuilder()
          .appendPattern("yyyy-MM-dd")
          .optionalStart()
          .appendLiteral(' ')
          .optionalEnd()
          .optionalStart()
          .appendLiteral('T')
          .optionalEnd()
          .appendPattern("HH:mm:ss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .optionalStart()
          .appendLiteral('Z')
          .optionalEnd()
          .toFormatter();

  public static String toText(Instant instant) {
    return instant == null ? null : WRITE_FORMAT.format(instant);
  }

  public static Instant fromText(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    return LocalDateTime.parse(text.trim(), READ_FORMAT).toInstant(ZoneOffset.UTC);
  }
}
