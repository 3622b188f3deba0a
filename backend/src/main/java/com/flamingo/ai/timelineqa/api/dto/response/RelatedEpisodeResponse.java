package com.flamingo.ai.timelineqa.api.dto.response;

import com.flamingo.ai.timelineqa.domain.enums.RelationType;
import com.flamingo.ai.timelineqa.service.retrieval.RelatedEpisode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an episode related to another. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelatedEpisodeResponse {

  private EpisodeResponse episode;
  private RelationType relation;
  private double score;

  public static RelatedEpisodeResponse from(RelatedEpisode related) {
    return RelatedEpisodeResponse.builder()
        .episode(EpisodeResponse.fromEntity(related.episode()))
        .relation(related.relation())
        .score(related.score())
        .build();
  }
}
