package com.flamingo.ai.timelineqa.service.episode;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Outcome of ingesting one batch of source records. */
@Getter
@Builder
public class IngestionReport {

  /** Records that produced a new episode. */
  private final int accepted;

  /** Records whose episode already existed. */
  private final int unchanged;

  /** Older episodes replaced because their source record changed. */
  private final int superseded;

  @Builder.Default private final List<String> acceptedIds = List.of();

  @Builder.Default private final List<Rejection> rejected = List.of();

  /** Content hash of the episode set after the batch. */
  private final String contentHash;

  public boolean hasChanges() {
    return accepted > 0 || superseded > 0;
  }

  /** A record that could not be verbalized. */
  public record Rejection(int index, String provenanceRef, String field, String reason) {}
}
