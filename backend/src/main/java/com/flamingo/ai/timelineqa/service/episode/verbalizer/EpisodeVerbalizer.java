package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import com.flamingo.ai.timelineqa.exception.MalformedRecordException;
import com.flamingo.ai.timelineqa.service.episode.EpisodeHashing;
import com.flamingo.ai.timelineqa.service.episode.SourceRecord;
import com.flamingo.ai.timelineqa.service.episode.TimestampParser;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link SourceRecord} into an {@link Episode} by routing it to the {@link
 * RecordVerbalizer} for its source type.
 *
 * <p>Verbalization is a pure function of the record: the same record always yields the same id
 * and text, across calls and restarts.
 */
@Component
@RequiredArgsConstructor
public class EpisodeVerbalizer {

  private final List<RecordVerbalizer> verbalizers;
  private final QaConfig qaConfig;

  /**
   * Verbalizes one record.
   *
   * @throws MalformedRecordException if the source type is unknown, the timestamp cannot be
   *     parsed or a required field is missing
   */
  public Episode verbalize(SourceRecord record) {
    SourceType sourceType =
        SourceType.fromName(record.sourceType())
            .orElseThrow(
                () ->
                    new MalformedRecordException(
                        "Unknown source type: " + record.sourceType(), "sourceType"));
    ZoneId defaultZone = ZoneId.of(qaConfig.getIngestion().getDefaultZone());
    OffsetDateTime timestamp = TimestampParser.parse(record.timestamp(), defaultZone);
    RecordVerbalizer verbalizer = route(sourceType);

    SortedMap<String, String> fields = verbalizer.normalize(record.fields());
    String id = EpisodeHashing.episodeId(sourceType, timestamp.toInstant(), fields);
    String provenanceRef =
        record.provenanceRef() == null || record.provenanceRef().isBlank()
            ? sourceType.name().toLowerCase(Locale.ROOT) + ":" + id
            : record.provenanceRef().strip();

    return Episode.builder()
        .id(id)
        .timestamp(timestamp)
        .verbalizedText(verbalizer.render(timestamp, fields))
        .sourceType(sourceType)
        .provenanceRef(provenanceRef)
        .build();
  }

  private RecordVerbalizer route(SourceType sourceType) {
    return verbalizers.stream()
        .filter(v -> v.supports(sourceType))
        .findFirst()
        .orElseThrow(
            () ->
                new MalformedRecordException(
                    "No verbalizer registered for source type " + sourceType, "sourceType"));
  }
}
