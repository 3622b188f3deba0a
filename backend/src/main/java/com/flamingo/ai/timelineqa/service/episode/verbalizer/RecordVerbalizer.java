package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.SortedMap;

/**
 * Per-source-type normalization and sentence template.
 *
 * <p>{@link EpisodeVerbalizer} depends only on this interface. Supporting a new source type means
 * adding a {@link SourceType} constant and a new implementation registered as a Spring bean.
 */
public interface RecordVerbalizer {

  /**
   * Returns {@code true} if this verbalizer handles the given source type.
   *
   * @param sourceType parsed source type
   * @return {@code true} if supported
   */
  boolean supports(SourceType sourceType);

  /**
   * Validates required fields, applies defaults and canonicalizes values.
   *
   * @param fields raw payload of the record
   * @return normalized fields keyed by name, sorted
   * @throws com.flamingo.ai.timelineqa.exception.MalformedRecordException if a required field is
   *     missing or a value has the wrong shape
   */
  SortedMap<String, String> normalize(Map<String, ?> fields);

  /**
   * Renders the sentence for an already normalized record.
   *
   * @param timestamp record timestamp
   * @param fields output of {@link #normalize(Map)}
   * @return deterministic natural-language description
   */
  String render(OffsetDateTime timestamp, SortedMap<String, String> fields);
}
