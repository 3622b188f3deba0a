package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when an episode is not found. */
public class EpisodeNotFoundException extends RuntimeException {

  private final String episodeId;

  public EpisodeNotFoundException(String episodeId) {
    super("Episode not found: " + episodeId);
    this.episodeId = episodeId;
  }

  public String getEpisodeId() {
    return episodeId;
  }
}
