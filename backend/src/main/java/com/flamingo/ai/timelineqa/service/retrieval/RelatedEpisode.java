package com.flamingo.ai.timelineqa.service.retrieval;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.RelationType;

/**
 * An episode related to an anchor episode.
 *
 * @param score cosine similarity for semantic relations; for temporal relations, 1 at the same
 *     instant falling to 0 at the edge of the window
 */
public record RelatedEpisode(Episode episode, RelationType relation, double score) {}
