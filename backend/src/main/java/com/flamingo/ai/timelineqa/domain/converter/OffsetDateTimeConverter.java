package com.flamingo.ai.timelineqa.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * JPA converter for persisting {@link OffsetDateTime} as an ISO-8601 string in a TEXT column, so
 * the original offset survives the round trip through SQLite.
 */
@Converter
public class OffsetDateTimeConverter implements AttributeConverter<OffsetDateTime, String> {

  @Override
  public String convertToDatabaseColumn(OffsetDateTime attribute) {
    return attribute == null ? null : attribute.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }

  @Override
  public OffsetDateTime convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    return OffsetDateTime.parse(dbData, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }
}
