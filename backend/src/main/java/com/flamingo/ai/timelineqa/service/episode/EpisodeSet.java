package com.flamingo.ai.timelineqa.service.episode;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;

/** Immutable snapshot of all live episodes together with its content hash. */
@Getter
public final class EpisodeSet {

  private static final EpisodeSet EMPTY = of(List.of());

  /** Episodes ordered by id. */
  private final List<Episode> episodes;

  private final String contentHash;

  @Getter(AccessLevel.NONE)
  private final Map<String, Episode> byId;

  private EpisodeSet(List<Episode> episodes, String contentHash) {
    this.episodes = episodes;
    this.contentHash = contentHash;
    Map<String, Episode> index = new LinkedHashMap<>();
    episodes.forEach(e -> index.put(e.getId(), e));
    this.byId = Collections.unmodifiableMap(index);
  }

  public static EpisodeSet of(Collection<Episode> episodes) {
    List<Episode> sorted =
        episodes.stream().sorted(Comparator.comparing(Episode::getId)).toList();
    return new EpisodeSet(
        sorted, EpisodeHashing.contentHash(sorted.stream().map(Episode::getId).toList()));
  }

  public static EpisodeSet empty() {
    return EMPTY;
  }

  public int size() {
    return episodes.size();
  }

  public boolean isEmpty() {
    return episodes.isEmpty();
  }

  public boolean contains(String episodeId) {
    return byId.containsKey(episodeId);
  }

  public Optional<Episode> find(String episodeId) {
    return Optional.ofNullable(byId.get(episodeId));
  }

  /** Id-keyed view of the snapshot. */
  public Map<String, Episode> asMap() {
    return byId;
  }
}
