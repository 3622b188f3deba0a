package com.flamingo.ai.timelineqa.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EpisodeIndexTest {

  private static IndexEntry entry(String id, String date, float... vector) {
    return new IndexEntry(
        id, vector, OffsetDateTime.parse(date + "T00:00:00Z"), SourceType.PLACE_VISIT);
  }

  @Test
  @DisplayName("should rank by cosine similarity")
  void shouldRankBySimilarity() {
    EpisodeIndex index =
        EpisodeIndex.of(
            1,
            "hash",
            "model",
            List.of(
                entry("ep_a", "2019-01-01", 1, 0),
                entry("ep_b", "2019-01-01", 1, 1),
                entry("ep_c", "2019-01-01", 0, 1)),
            Instant.now());

    List<EpisodeIndex.Hit> hits = index.search(new float[] {2, 0}, 3, id -> true);

    assertThat(hits)
        .extracting(EpisodeIndex.Hit::episodeId)
        .containsExactly("ep_a", "ep_b", "ep_c");
    assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    assertThat(hits.get(1).similarity()).isCloseTo(Math.sqrt(0.5), within(1e-6));
    assertThat(hits.get(2).similarity()).isCloseTo(0.0, within(1e-6));
  }

  @Test
  @DisplayName("should break ties by most recent timestamp, then by id")
  void shouldBreakTies() {
    EpisodeIndex index =
        EpisodeIndex.of(
            1,
            "hash",
            "model",
            List.of(
                entry("ep_old", "2018-05-01", 1, 0),
                entry("ep_z", "2020-05-01", 1, 0),
                entry("ep_y", "2020-05-01", 1, 0)),
            Instant.now());

    List<EpisodeIndex.Hit> hits = index.search(new float[] {1, 0}, 3, id -> true);

    assertThat(hits)
        .extracting(EpisodeIndex.Hit::episodeId)
        .containsExactly("ep_y", "ep_z", "ep_old");
  }

  @Test
  @DisplayName("should honor k and the id filter")
  void shouldHonorKAndFilter() {
    EpisodeIndex index =
        EpisodeIndex.of(
            1,
            "hash",
            "model",
            List.of(
                entry("ep_a", "2019-01-01", 1, 0),
                entry("ep_b", "2019-01-02", 1, 0.1f),
                entry("ep_c", "2019-01-03", 1, 0.2f)),
            Instant.now());

    assertThat(index.search(new float[] {1, 0}, 1, id -> true)).hasSize(1);
    assertThat(index.search(new float[] {1, 0}, 0, id -> true)).isEmpty();
    assertThat(index.search(new float[] {1, 0}, 3, id -> !id.equals("ep_a")))
        .extracting(EpisodeIndex.Hit::episodeId)
        .containsExactly("ep_b", "ep_c");
  }

  @Test
  @DisplayName("should store normalized vectors")
  void shouldNormalize() {
    EpisodeIndex index =
        EpisodeIndex.of(
            1, "hash", "model", List.of(entry("ep_a", "2019-01-01", 3, 4)), Instant.now());

    float[] vector = index.vectorOf("ep_a").orElseThrow();

    assertThat(vector[0]).isCloseTo(0.6f, within(1e-6f));
    assertThat(vector[1]).isCloseTo(0.8f, within(1e-6f));
    assertThat(index.getDimension()).isEqualTo(2);
  }

  @Test
  @DisplayName("should hand out copies of stored vectors")
  void shouldNotExposeStoredVectors() {
    EpisodeIndex index =
        EpisodeIndex.of(
            1,
            "hash",
            "model",
            List.of(entry("ep_a", "2019-01-01", 1, 0), entry("ep_b", "2019-01-01", 0, 1)),
            Instant.now());

    float[] vector = index.vectorOf("ep_a").orElseThrow();
    vector[0] = 0;
    vector[1] = 1;

    assertThat(index.vectorOf("ep_a").orElseThrow()).containsExactly(1f, 0f);
    assertThat(index.search(new float[] {1, 0}, 1, id -> true))
        .extracting(EpisodeIndex.Hit::episodeId)
        .containsExactly("ep_a");
  }

  @Test
  @DisplayName("should reject mixed dimensions and duplicate ids")
  void shouldRejectInconsistentEntries() {
    assertThatThrownBy(
            () ->
                EpisodeIndex.of(
                    1,
                    "hash",
                    "model",
                    List.of(entry("ep_a", "2019-01-01", 1, 0), entry("ep_b", "2019-01-01", 1)),
                    Instant.now()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                EpisodeIndex.of(
                    1,
                    "hash",
                    "model",
                    List.of(entry("ep_a", "2019-01-01", 1, 0), entry("ep_a", "2019-01-02", 0, 1)),
                    Instant.now()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should reject a query of the wrong dimension")
  void shouldRejectWrongQueryDimension() {
    EpisodeIndex index =
        EpisodeIndex.of(
            1, "hash", "model", List.of(entry("ep_a", "2019-01-01", 1, 0)), Instant.now());

    assertThatThrownBy(() -> index.search(new float[] {1, 0, 0}, 1, id -> true))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
