package com.flamingo.ai.timelineqa.service.structured;

import java.util.List;

/**
 * Rows returned by a structured query.
 *
 * @param truncated whether the store's row cap cut the result short
 */
public record TabularResult(List<String> columns, List<List<Object>> rows, boolean truncated) {

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Whether the result is a single value, such as a count. */
  public boolean isScalar() {
    return rows.size() == 1 && columns.size() == 1;
  }
}
