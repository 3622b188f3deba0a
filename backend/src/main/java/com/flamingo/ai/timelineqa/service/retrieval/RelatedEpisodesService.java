package com.flamingo.ai.timelineqa.service.retrieval;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.RelationType;
import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.index.EmbeddingService;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.index.IndexView;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Finds episodes related to a given episode by meaning or by time. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelatedEpisodesService {

  private final EpisodeService episodeService;
  private final EpisodeIndexService indexService;
  private final EmbeddingService embeddingService;
  private final QaConfig qaConfig;

  /**
   * Finds related episodes, excluding the anchor itself.
   *
   * @param episodeId anchor episode
   * @param relation semantic similarity or temporal proximity
   * @param limit maximum number of results; non-positive means the configured default
   */
  public List<RelatedEpisode> findRelated(String episodeId, RelationType relation, int limit) {
    Episode anchor = episodeService.getEpisode(episodeId);
    int k = limit > 0 ? limit : qaConfig.getRetrieval().getRelatedTopK();
    return relation == RelationType.SEMANTIC ? semantic(anchor, k) : temporal(anchor, k);
  }

  private List<RelatedEpisode> semantic(Episode anchor, int k) {
    IndexView view = indexService.ensureCurrent();
    float[] vector =
        view.vectorOf(anchor.getId())
            .orElseGet(() -> embeddingService.embed(anchor.getVerbalizedText()));
    List<RelatedEpisode> related =
        view.search(vector, k + 1).stream()
            .filter(e -> !e.episodeId().equals(anchor.getId()))
            .limit(k)
            .map(e -> new RelatedEpisode(e.episode(), RelationType.SEMANTIC, e.similarity()))
            .toList();
    log.debug("Found {} semantically related episodes for {}", related.size(), anchor.getId());
    return related;
  }

  private List<RelatedEpisode> temporal(Episode anchor, int k) {
    Duration window = Duration.ofDays(Math.max(1, qaConfig.getRetrieval().getTemporalWindowDays()));
    List<RelatedEpisode> related =
        episodeService.findTemporalNeighbors(anchor.getId(), k).stream()
            .map(
                e -> {
                  Duration gap = Duration.between(anchor.getTimestamp(), e.getTimestamp()).abs();
                  double score = 1.0 - (double) gap.toMinutes() / window.toMinutes();
                  return new RelatedEpisode(e, RelationType.TEMPORAL, score);
                })
            .filter(r -> r.score() >= 0.0)
            .toList();
    log.debug("Found {} temporally related episodes for {}", related.size(), anchor.getId());
    return related;
  }
}
