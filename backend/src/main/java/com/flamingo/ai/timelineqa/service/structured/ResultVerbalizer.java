package com.flamingo.ai.timelineqa.service.structured;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Renders a tabular result as a single sentence. */
@Component
public class ResultVerbalizer {

  private static final int MAX_LISTED_ROWS = 5;

  /**
   * Verbalizes a result, e.g. {@code Based on your books records, the book count is 7.}
   *
   * @param view view that was queried
   * @param result rows returned
   */
  public String verbalize(StructuredView view, TabularResult result) {
    String prefix = "Based on your " + humanize(view.name()) + " records";
    if (result.isEmpty()) {
      return prefix + ", no matching rows were found.";
    }
    if (result.isScalar()) {
      return prefix
          + ", the "
          + describeColumn(result.columns().get(0))
          + " is "
          + format(result.rows().get(0).get(0))
          + ".";
    }
    if (result.rows().size() == 1) {
      return prefix + ": " + describeRow(result.columns(), result.rows().get(0)) + ".";
    }

    int rowCount = result.rows().size();
    List<String> listed = new ArrayList<>();
    for (List<Object> row : result.rows().subList(0, Math.min(MAX_LISTED_ROWS, rowCount))) {
      listed.add(describeRow(result.columns(), row));
    }
    int remaining = rowCount - listed.size();
    String count = result.truncated() ? "at least " + rowCount : String.valueOf(rowCount);
    return prefix
        + ", "
        + count
        + " rows matched: "
        + String.join("; ", listed)
        + (remaining > 0 ? "; and " + remaining + " more" : "")
        + ".";
  }

  private static String describeRow(List<String> columns, List<Object> row) {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      parts.add(describeColumn(columns.get(i)) + " " + format(row.get(i)));
    }
    return String.join(", ", parts);
  }

  private static String describeColumn(String column) {
    if (!column.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      return "result";
    }
    return humanize(column);
  }

  private static String humanize(String identifier) {
    return identifier.replace('_', ' ').strip().toLowerCase(Locale.ROOT);
  }

  static String format(Object value) {
    if (value == null) {
      return "none";
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return value.toString();
      }
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
    }
    return value.toString();
  }
}
