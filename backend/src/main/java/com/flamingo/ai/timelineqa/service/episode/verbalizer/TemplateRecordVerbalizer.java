package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import com.flamingo.ai.timelineqa.exception.MalformedRecordException;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Base class for verbalizers driven by a required/optional field table. Sentences start with the
 * record's local date, e.g. {@code On 2019-04-02, I visited Tokyo.}
 */
public abstract class TemplateRecordVerbalizer implements RecordVerbalizer {

  private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

  private final SourceType sourceType;
  private final List<String> requiredFields;
  private final Map<String, String> optionalDefaults;
  private final Set<String> numericFields;

  /**
   * @param optionalDefaults optional field names mapped to their default, or to {@code null} when
   *     the field has none
   */
  protected TemplateRecordVerbalizer(
      SourceType sourceType,
      List<String> requiredFields,
      Map<String, String> optionalDefaults,
      Set<String> numericFields) {
    this.sourceType = sourceType;
    this.requiredFields = List.copyOf(requiredFields);
    this.optionalDefaults = new LinkedHashMap<>(optionalDefaults);
    this.numericFields = Set.copyOf(numericFields);
  }

  @Override
  public boolean supports(SourceType type) {
    return sourceType == type;
  }

  @Override
  public SortedMap<String, String> normalize(Map<String, ?> fields) {
    SortedMap<String, String> normalized = new TreeMap<>();
    for (String name : requiredFields) {
      String value = text(fields.get(name));
      if (value == null) {
        throw new MalformedRecordException(
            "Missing required field '" + name + "' for " + sourceType + " record", name);
      }
      normalized.put(name, value);
    }
    optionalDefaults.forEach(
        (name, defaultValue) -> {
          String value = text(fields.get(name));
          if (value == null) {
            value = defaultValue;
          }
          if (value != null) {
            normalized.put(name, value);
          }
        });
    for (String name : numericFields) {
      String value = normalized.get(name);
      if (value != null) {
        normalized.put(name, number(name, value));
      }
    }
    return normalized;
  }

  @Override
  public String render(OffsetDateTime timestamp, SortedMap<String, String> fields) {
    return "On " + DAY.format(timestamp) + ", " + describe(fields) + ".";
  }

  /** Describes the event in the first person, without the leading date or final period. */
  protected abstract String describe(SortedMap<String, String> fields);

  /** Appends {@code prefix + value} when the field is present. */
  protected static String optional(Map<String, String> fields, String name, String prefix) {
    String value = fields.get(name);
    return value == null ? "" : prefix + value;
  }

  /**
   * Canonical text form of a payload value: collections are joined with commas, numbers lose
   * trailing zeros, whitespace is collapsed and trailing periods are dropped. Blank values map to
   * {@code null}.
   */
  static String text(Object value) {
    if (value == null) {
      return null;
    }
    String text;
    if (value instanceof Collection<?> collection) {
      text =
          collection.stream()
              .map(TemplateRecordVerbalizer::text)
              .filter(Objects::nonNull)
              .collect(Collectors.joining(", "));
    } else if (value instanceof Number) {
      text = new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
    } else {
      text = value.toString();
    }
    text = text.strip().replaceAll("\\s+", " ");
    while (text.endsWith(".")) {
      text = text.substring(0, text.length() - 1).stripTrailing();
    }
    return text.isEmpty() ? null : text;
  }

  private String number(String name, String value) {
    try {
      BigDecimal parsed = new BigDecimal(value.replace(",", ""));
      if (parsed.signum() < 0) {
        throw new MalformedRecordException(
            "Negative value for '" + name + "' in " + sourceType + " record", name);
      }
      return parsed.stripTrailingZeros().toPlainString();
    } catch (NumberFormatException e) {
      throw new MalformedRecordException(
          "Field '" + name + "' of " + sourceType + " record is not a number: " + value, name, e);
    }
  }

  protected static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
