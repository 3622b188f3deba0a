package com.flamingo.ai.timelineqa.service.retrieval;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/** Half-open date range named in a question, e.g. {@code April 2019}. */
public record TemporalRange(LocalDate start, LocalDate endExclusive, String label) {

  /** Whether the timestamp's local date falls inside the range. */
  public boolean contains(OffsetDateTime timestamp) {
    LocalDate date = timestamp.toLocalDate();
    return !date.isBefore(start) && date.isBefore(endExclusive);
  }
}
