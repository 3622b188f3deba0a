package com.flamingo.ai.timelineqa.service.index;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Immutable in-memory vector index over one episode set. Vectors are stored normalized, so cosine
 * similarity is a dot product. Search is exhaustive, which is exact and fast enough for a personal
 * timeline.
 */
@Getter
public final class EpisodeIndex {

  private final long generation;
  private final String contentHash;
  private final String embeddingModelId;
  private final int dimension;
  private final List<IndexEntry> entries;
  private final Instant builtAt;

  @Getter(AccessLevel.NONE)
  private final Map<String, IndexEntry> byId;

  private EpisodeIndex(
      long generation,
      String contentHash,
      String embeddingModelId,
      int dimension,
      List<IndexEntry> entries,
      Instant builtAt) {
    this.generation = generation;
    this.contentHash = contentHash;
    this.embeddingModelId = embeddingModelId;
    this.dimension = dimension;
    this.entries = entries;
    this.builtAt = builtAt;
    Map<String, IndexEntry> index = new LinkedHashMap<>();
    entries.forEach(e -> index.put(e.episodeId(), e));
    this.byId = index;
  }

  /**
   * Creates an index, normalizing every vector.
   *
   * @throws IllegalArgumentException if vectors differ in dimension or an id repeats
   */
  public static EpisodeIndex of(
      long generation,
      String contentHash,
      String embeddingModelId,
      List<IndexEntry> entries,
      Instant builtAt) {
    int dimension = entries.isEmpty() ? 0 : entries.get(0).vector().length;
    List<IndexEntry> normalized = new ArrayList<>(entries.size());
    Set<String> seen = new HashSet<>();
    for (IndexEntry entry : entries) {
      if (entry.vector().length != dimension) {
        throw new IllegalArgumentException(
            "Vector for "
                + entry.episodeId()
                + " has dimension "
                + entry.vector().length
                + ", expected "
                + dimension);
      }
      if (!seen.add(entry.episodeId())) {
        throw new IllegalArgumentException("Duplicate index entry " + entry.episodeId());
      }
      normalized.add(
          new IndexEntry(
              entry.episodeId(), normalize(entry.vector()), entry.timestamp(), entry.sourceType()));
    }
    return new EpisodeIndex(
        generation, contentHash, embeddingModelId, dimension, List.copyOf(normalized), builtAt);
  }

  /**
   * Entries in insertion order. The list is unmodifiable; the vectors are shared with the index
   * and must be treated as read-only.
   */
  public List<IndexEntry> getEntries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean contains(String episodeId) {
    return byId.containsKey(episodeId);
  }

  /** Copy of the normalized vector of an indexed episode. */
  public Optional<float[]> vectorOf(String episodeId) {
    return Optional.ofNullable(byId.get(episodeId)).map(e -> e.vector().clone());
  }

  /**
   * Returns the {@code k} entries most similar to {@code query}, by descending cosine similarity;
   * ties go to the most recent timestamp, then to the smaller id.
   *
   * @param filter only entries whose id passes are considered
   */
  public List<Hit> search(float[] query, int k, Predicate<String> filter) {
    if (k <= 0 || entries.isEmpty()) {
      return List.of();
    }
    if (query.length != dimension) {
      throw new IllegalArgumentException(
          "Query dimension " + query.length + " does not match index dimension " + dimension);
    }
    float[] unit = normalize(query);
    return entries.stream()
        .filter(e -> filter.test(e.episodeId()))
        .map(e -> new Hit(e.episodeId(), dot(unit, e.vector()), e.timestamp()))
        .sorted(
            Comparator.comparingDouble(Hit::similarity)
                .reversed()
                .thenComparing(Hit::timestamp, Comparator.reverseOrder())
                .thenComparing(Hit::episodeId))
        .limit(k)
        .toList();
  }

  static float[] normalize(float[] vector) {
    double norm = 0;
    for (float v : vector) {
      norm += (double) v * v;
    }
    if (norm == 0) {
      return vector.clone();
    }
    double scale = 1.0 / Math.sqrt(norm);
    float[] unit = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      unit[i] = (float) (vector[i] * scale);
    }
    return unit;
  }

  private static double dot(float[] a, float[] b) {
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }

  /** A raw search hit. */
  public record Hit(String episodeId, double similarity, OffsetDateTime timestamp) {}
}
