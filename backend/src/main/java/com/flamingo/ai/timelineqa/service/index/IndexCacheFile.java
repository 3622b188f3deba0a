package com.flamingo.ai.timelineqa.service.index;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** JSON layout of a persisted index artifact. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexCacheFile {

  public static final int FORMAT_VERSION = 1;

  private int formatVersion;
  private String contentHash;
  private long generation;
  private String embeddingModelId;
  private int dimension;
  private String builtAt;

  @Builder.Default private List<Entry> entries = new ArrayList<>();

  /** One persisted vector. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Entry {
    private String episodeId;
    private float[] vector;
  }
}
