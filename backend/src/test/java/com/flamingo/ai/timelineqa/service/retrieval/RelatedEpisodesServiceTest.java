package com.flamingo.ai.timelineqa.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.RelationType;
import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.episode.EpisodeSet;
import com.flamingo.ai.timelineqa.service.index.EmbeddingService;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndex;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.index.IndexEntry;
import com.flamingo.ai.timelineqa.service.index.IndexView;
import com.flamingo.ai.timelineqa.support.TestEpisodes;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RelatedEpisodesServiceTest {

  @Mock private EpisodeService episodeService;
  @Mock private EpisodeIndexService indexService;
  @Mock private EmbeddingService embeddingService;

  private RelatedEpisodesService relatedService;

  private final Episode tokyo = TestEpisodes.episode("a1", "2019-04-02", "I visited Tokyo.");
  private final Episode kyoto = TestEpisodes.episode("b2", "2019-04-05", "I visited Kyoto.");
  private final Episode seoul = TestEpisodes.episode("c3", "2023-08-01", "I visited Seoul.");

  @BeforeEach
  void setUp() {
    relatedService =
        new RelatedEpisodesService(episodeService, indexService, embeddingService, new QaConfig());
    when(episodeService.getEpisode(tokyo.getId())).thenReturn(tokyo);

    EpisodeSet episodes = EpisodeSet.of(List.of(tokyo, kyoto, seoul));
    EpisodeIndex index =
        EpisodeIndex.of(
            1,
            episodes.getContentHash(),
            "test",
            List.of(entry(tokyo, 1, 0), entry(kyoto, 1, 1), entry(seoul, 0, 1)),
            Instant.now());
    when(indexService.ensureCurrent()).thenReturn(new IndexView(index, episodes, false));
  }

  private static IndexEntry entry(Episode episode, float x, float y) {
    return new IndexEntry(
        episode.getId(), new float[] {x, y}, episode.getTimestamp(), episode.getSourceType());
  }

  @Test
  @DisplayName("should find semantically related episodes excluding the anchor")
  void shouldFindSemanticNeighbors() {
    List<RelatedEpisode> related =
        relatedService.findRelated(tokyo.getId(), RelationType.SEMANTIC, 2);

    assertThat(related)
        .extracting(r -> r.episode().getId())
        .containsExactly(kyoto.getId(), seoul.getId());
    assertThat(related.get(0).score()).isCloseTo(Math.sqrt(0.5), within(1e-6));
    assertThat(related).allMatch(r -> r.relation() == RelationType.SEMANTIC);
  }

  @Test
  @DisplayName("should score temporal neighbors by closeness within the window")
  void shouldFindTemporalNeighbors() {
    when(episodeService.findTemporalNeighbors(tokyo.getId(), 5))
        .thenReturn(List.of(kyoto, seoul));

    List<RelatedEpisode> related =
        relatedService.findRelated(tokyo.getId(), RelationType.TEMPORAL, 0);

    assertThat(related).hasSize(1);
    assertThat(related.get(0).episode()).isEqualTo(kyoto);
    assertThat(related.get(0).score()).isCloseTo(0.9, within(1e-9));
  }
}
