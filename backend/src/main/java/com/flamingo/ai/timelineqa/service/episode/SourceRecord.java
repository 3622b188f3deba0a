package com.flamingo.ai.timelineqa.service.episode;

import java.util.Map;

/**
 * A raw record handed over by an importer, before verbalization.
 *
 * @param sourceType source type name, e.g. {@code PLACE_VISIT}
 * @param timestamp ISO-8601 timestamp, with or without offset
 * @param provenanceRef optional reference back to the importer's record
 * @param fields type-specific payload
 */
public record SourceRecord(
    String sourceType, String timestamp, String provenanceRef, Map<String, Object> fields) {

  public SourceRecord {
    fields = fields == null ? Map.of() : fields;
  }
}
