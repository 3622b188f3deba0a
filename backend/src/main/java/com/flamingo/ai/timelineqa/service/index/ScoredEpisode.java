package com.flamingo.ai.timelineqa.service.index;

import com.flamingo.ai.timelineqa.domain.entity.Episode;

/** An episode returned by a similarity search together with its cosine similarity. */
public record ScoredEpisode(Episode episode, double similarity) {

  public String episodeId() {
    return episode.getId();
  }
}
