package com.flamingo.ai.timelineqa.service.structured;

import com.flamingo.ai.timelineqa.config.QaConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Views declared under {@code qa.structured.views}, the only relations queries may touch. */
@Component
@Slf4j
public class StructuredViewRegistry {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final List<StructuredView> views;

  public StructuredViewRegistry(QaConfig qaConfig) {
    List<StructuredView> declared = new ArrayList<>();
    for (QaConfig.Structured.View view : qaConfig.getStructured().getViews()) {
      if (!isIdentifier(view.getName())) {
        throw new IllegalStateException("Invalid structured view name: " + view.getName());
      }
      if (view.getColumns().isEmpty()) {
        throw new IllegalStateException("Structured view " + view.getName() + " has no columns");
      }
      List<ViewColumn> columns = new ArrayList<>();
      for (QaConfig.Structured.Column column : view.getColumns()) {
        if (!isIdentifier(column.getName())) {
          throw new IllegalStateException(
              "Invalid column name " + column.getName() + " in view " + view.getName());
        }
        columns.add(new ViewColumn(column.getName(), column.getType(), column.getDescription()));
      }
      declared.add(new StructuredView(view.getName(), view.getDescription(), columns));
    }
    this.views = List.copyOf(declared);
    log.info(
        "Registered {} structured views: {}",
        views.size(),
        views.stream().map(StructuredView::name).collect(Collectors.joining(", ")));
  }

  public List<StructuredView> views() {
    return views;
  }

  public boolean isEmpty() {
    return views.isEmpty();
  }

  /** Finds a view by name, ignoring case. */
  public Optional<StructuredView> find(String viewName) {
    if (viewName == null) {
      return Optional.empty();
    }
    return views.stream().filter(v -> v.name().equalsIgnoreCase(viewName.strip())).findFirst();
  }

  /** Schema listing for the query generator, one view per line. */
  public String describeSchemas() {
    return views.stream().map(StructuredView::describe).collect(Collectors.joining("\n"));
  }

  /** Names of registered views mentioned in the text, matched on word boundaries. */
  public List<String> mentionedIn(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    return views.stream()
        .map(StructuredView::name)
        .filter(
            name -> {
              String singular = name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
              return Pattern.compile(
                      "\\b" + Pattern.quote(singular.toLowerCase(Locale.ROOT).replace('_', ' ')))
                  .matcher(lower)
                  .find();
            })
        .toList();
  }

  private static boolean isIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }
}
