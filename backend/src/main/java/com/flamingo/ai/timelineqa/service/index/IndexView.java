package com.flamingo.ai.timelineqa.service.index;

import com.flamingo.ai.timelineqa.service.episode.EpisodeSet;
import java.util.List;
import java.util.Optional;

/**
 * An index paired with the episode snapshot it is queried against. Hits are resolved through the
 * snapshot, so an id that is no longer live is never returned, even from a stale index.
 *
 * @param stale whether the index was built for a different episode set
 */
public record IndexView(EpisodeIndex index, EpisodeSet episodes, boolean stale) {

  /** The {@code k} live episodes most similar to {@code query}. */
  public List<ScoredEpisode> search(float[] query, int k) {
    return index.search(query, k, episodes::contains).stream()
        .map(
            hit ->
                new ScoredEpisode(episodes.find(hit.episodeId()).orElseThrow(), hit.similarity()))
        .toList();
  }

  /** Indexed vector of a live episode. */
  public Optional<float[]> vectorOf(String episodeId) {
    return episodes.contains(episodeId) ? index.vectorOf(episodeId) : Optional.empty();
  }

  public long generation() {
    return index.getGeneration();
  }
}
