package com.flamingo.ai.timelineqa.api.dto.response;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for episode data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpisodeResponse {

  private String id;
  private OffsetDateTime timestamp;
  private SourceType sourceType;
  private String verbalizedText;
  private String provenanceRef;
  private LocalDateTime createdAt;

  /** Creates an EpisodeResponse from an Episode entity. */
  public static EpisodeResponse fromEntity(Episode episode) {
    return EpisodeResponse.builder()
        .id(episode.getId())
        .timestamp(episode.getTimestamp())
        .sourceType(episode.getSourceType())
        .verbalizedText(episode.getVerbalizedText())
        .provenanceRef(episode.getProvenanceRef())
        .createdAt(episode.getCreatedAt())
        .build();
  }
}
