package com.flamingo.ai.timelineqa.service.index;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.time.OffsetDateTime;

/** One indexed episode: its unit-length vector plus the metadata used for ranking. */
public record IndexEntry(
    String episodeId, float[] vector, OffsetDateTime timestamp, SourceType sourceType) {}
