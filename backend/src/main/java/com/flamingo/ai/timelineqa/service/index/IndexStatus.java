package com.flamingo.ai.timelineqa.service.index;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of the index subsystem. */
@Getter
@Builder
public class IndexStatus {

  private final boolean ready;

  /** Whether the served index matches the current episode set. */
  private final boolean current;

  private final long generation;
  private final String indexContentHash;
  private final String episodeContentHash;
  private final int entryCount;
  private final int episodeCount;
  private final int dimension;
  private final String embeddingModelId;
  private final Instant builtAt;
  private final boolean rebuildInProgress;
  private final boolean lastBuildFailed;
  private final String lastError;
}
