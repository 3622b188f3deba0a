package com.flamingo.ai.timelineqa.service.episode;

import com.flamingo.ai.timelineqa.exception.MalformedRecordException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/** Parses record timestamps into timezone-aware values. */
public final class TimestampParser {

  private TimestampParser() {}

  /**
   * Parses an ISO-8601 timestamp. Values with an offset or zone keep it; local date-times and
   * plain dates are placed in {@code defaultZone}.
   *
   * @throws MalformedRecordException if the value is missing or not ISO-8601
   */
  public static OffsetDateTime parse(String raw, ZoneId defaultZone) {
    if (raw == null || raw.isBlank()) {
      throw new MalformedRecordException("Missing timestamp", "timestamp");
    }
    String value = raw.strip();
    try {
      return OffsetDateTime.parse(value);
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      return ZonedDateTime.parse(value).toOffsetDateTime();
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      return LocalDateTime.parse(value).atZone(defaultZone).toOffsetDateTime();
    } catch (DateTimeParseException ignored) {
      // try the next form
    }
    try {
      return LocalDate.parse(value).atStartOfDay(defaultZone).toOffsetDateTime();
    } catch (DateTimeParseException e) {
      throw new MalformedRecordException("Unparseable timestamp: " + value, "timestamp", e);
    }
  }
}
