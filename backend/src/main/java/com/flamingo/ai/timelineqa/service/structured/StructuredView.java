package com.flamingo.ai.timelineqa.service.structured;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Schema contract of a read-only aggregate view. The view's contents are produced by an external
 * aggregation job; only its name and columns are known here.
 */
public record StructuredView(String name, String description, List<ViewColumn> columns) {

  public StructuredView {
    columns = List.copyOf(columns);
  }

  /** Finds a column by name, ignoring case. */
  public Optional<ViewColumn> column(String columnName) {
    return columns.stream().filter(c -> c.name().equalsIgnoreCase(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return column(columnName).isPresent();
  }

  /** One-line schema description handed to the query generator. */
  public String describe() {
    String columnList =
        columns.stream()
            .map(
                c ->
                    c.name()
                        + " "
                        + c.type().toUpperCase(Locale.ROOT)
                        + (c.description() == null || c.description().isBlank()
                            ? ""
                            : " -- " + c.description()))
            .collect(Collectors.joining(", "));
    String about = description == null || description.isBlank() ? "" : ": " + description;
    return "- " + name + "(" + columnList + ")" + about;
  }
}
