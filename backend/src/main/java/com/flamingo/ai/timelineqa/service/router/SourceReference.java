package com.flamingo.ai.timelineqa.service.router;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.SourceKind;
import java.time.OffsetDateTime;
import lombok.Builder;
import lombok.Getter;

/** Evidence backing an answer: an episode, or the row set of a structured view. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceReference {

  private final SourceKind kind;

  /** Episode id, or view name for structured sources. */
  private final String id;

  private final OffsetDateTime timestamp;

  private final String excerpt;

  private final Double similarity;

  private final Integer rowCount;

  public static SourceReference episode(Episode episode, Double similarity) {
    return SourceReference.builder()
        .kind(SourceKind.EPISODE)
        .id(episode.getId())
        .timestamp(episode.getTimestamp())
        .excerpt(episode.getVerbalizedText())
        .similarity(similarity)
        .build();
  }

  public static SourceReference view(String viewName, int rowCount, String query) {
    return SourceReference.builder()
        .kind(SourceKind.STRUCTURED_VIEW)
        .id(viewName)
        .excerpt(query)
        .rowCount(rowCount)
        .build();
  }
}
