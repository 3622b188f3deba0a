package com.flamingo.ai.timelineqa.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.timelineqa.agent.EpisodeAnswerAgent;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.exception.InsufficientEvidenceException;
import com.flamingo.ai.timelineqa.exception.LlmServiceException;
import com.flamingo.ai.timelineqa.service.episode.EpisodeSet;
import com.flamingo.ai.timelineqa.service.index.EmbeddingService;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndex;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.index.IndexEntry;
import com.flamingo.ai.timelineqa.service.index.IndexView;
import com.flamingo.ai.timelineqa.service.index.ScoredEpisode;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import com.flamingo.ai.timelineqa.service.router.SourceReference;
import com.flamingo.ai.timelineqa.support.HashingEmbeddingModel;
import com.flamingo.ai.timelineqa.support.TestEpisodes;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetrievalServiceTest {

  @Mock private EpisodeIndexService indexService;
  @Mock private EpisodeAnswerAgent answerAgent;

  private QaConfig qaConfig;
  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;
  private RetrievalService retrievalService;

  private final Episode tokyo =
      TestEpisodes.episode("a1", "2019-04-02", "On 2019-04-02, I visited Tokyo.");
  private final Episode kyoto =
      TestEpisodes.episode("b2", "2019-04-05", "On 2019-04-05, I visited Kyoto.");
  private final Episode tokyoAgain =
      TestEpisodes.episode("c3", "2016-11-20", "On 2016-11-20, I visited Tokyo.");

  @BeforeEach
  void setUp() {
    qaConfig = new QaConfig();
    meterRegistry = new SimpleMeterRegistry();
    embeddingService =
        new EmbeddingService(new HashingEmbeddingModel(), qaConfig, meterRegistry);
    retrievalService =
        new RetrievalService(
            indexService,
            embeddingService,
            answerAgent,
            new CitationParser(),
            new RetrievalConfidenceService(qaConfig, meterRegistry),
            new TemporalHintExtractor(),
            qaConfig,
            meterRegistry);

    EpisodeSet episodes = EpisodeSet.of(List.of(tokyo, kyoto, tokyoAgain));
    List<float[]> vectors =
        embeddingService.embedAll(
            episodes.getEpisodes().stream().map(Episode::getVerbalizedText).toList());
    List<IndexEntry> entries = new ArrayList<>();
    for (int i = 0; i < episodes.size(); i++) {
      Episode episode = episodes.getEpisodes().get(i);
      entries.add(
          new IndexEntry(
              episode.getId(), vectors.get(i), episode.getTimestamp(), episode.getSourceType()));
    }
    EpisodeIndex index =
        EpisodeIndex.of(1, episodes.getContentHash(), "test", entries, Instant.now());
    when(indexService.ensureCurrent()).thenReturn(new IndexView(index, episodes, false));
  }

  @Nested
  @DisplayName("answer")
  class AnswerTests {

    @Test
    @DisplayName("should return the generated answer with only the cited episodes as sources")
    void shouldAnswerWithCitedSources() {
      when(answerAgent.answer(anyString(), anyString()))
          .thenReturn("You last visited Tokyo on 2019-04-02.\nSOURCES: " + tokyo.getId());

      QueryResult result = retrievalService.answer("When did I last visit Tokyo?", 5);

      assertThat(result.getEngineUsed()).isEqualTo(EngineType.RETRIEVAL);
      assertThat(result.getAnswer()).isEqualTo("You last visited Tokyo on 2019-04-02.");
      assertThat(result.getSources())
          .extracting(SourceReference::getId)
          .containsExactly(tokyo.getId());
      assertThat(result.getConfidence()).isBetween(0.0, 1.0);
      assertThat(result.isDegraded()).isFalse();
      verify(answerAgent, never()).answerStrictly(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("should retry once with the strict prompt when the citation line is missing")
    void shouldRetryStrictly() {
      when(answerAgent.answer(anyString(), anyString())).thenReturn("You went to Tokyo.");
      when(answerAgent.answerStrictly(anyString(), anyString(), anyString()))
          .thenReturn("You went to Tokyo.\nSOURCES: " + tokyo.getId());

      QueryResult result = retrievalService.answer("When did I last visit Tokyo?", 5);

      assertThat(result.isDegraded()).isFalse();
      assertThat(result.getSources())
          .extracting(SourceReference::getId)
          .containsExactly(tokyo.getId());
      assertThat(meterRegistry.counter("retrieval.format.retries").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return a degraded low-confidence answer when the retry is malformed too")
    void shouldDegradeAfterSecondMalformedOutput() {
      when(answerAgent.answer(anyString(), anyString())).thenReturn("Tokyo, I think.");
      when(answerAgent.answerStrictly(anyString(), anyString(), anyString()))
          .thenReturn("Tokyo, I think.\nSOURCES: none");

      QueryResult result = retrievalService.answer("When did I last visit Tokyo?", 5);

      assertThat(result.isDegraded()).isTrue();
      assertThat(result.getAnswer()).isEqualTo("Tokyo, I think.");
      assertThat(result.getSources()).isNotEmpty();
      assertThat(result.getConfidence()).isLessThan(0.5);
    }

    @Test
    @DisplayName("should report insufficient evidence when nothing clears the threshold")
    void shouldReportInsufficientEvidence() {
      qaConfig.getRetrieval().setMinSimilarity(0.99);

      assertThatThrownBy(() -> retrievalService.answer("When did I last visit Tokyo?", 5))
          .isInstanceOf(InsufficientEvidenceException.class);
      verify(answerAgent, never()).answer(anyString(), anyString());
    }

    @Test
    @DisplayName("should surface generation failures as provider errors")
    void shouldWrapGenerationFailure() {
      when(answerAgent.answer(anyString(), anyString()))
          .thenThrow(new RuntimeException("503 Service Unavailable"));

      assertThatThrownBy(() -> retrievalService.answer("When did I last visit Tokyo?", 5))
          .isInstanceOf(LlmServiceException.class);
    }
  }

  @Nested
  @DisplayName("retrieve")
  class RetrieveTests {

    @Test
    @DisplayName("should rank episodes sharing the question's words first")
    void shouldRankBySimilarity() {
      List<String> ids =
          retrievalService.retrieve("When did I last visit Tokyo?", 3).stream()
              .map(ScoredEpisode::episodeId)
              .toList();

      assertThat(ids.subList(0, 2)).containsExactlyInAnyOrder(tokyo.getId(), tokyoAgain.getId());
      assertThat(ids.get(2)).isEqualTo(kyoto.getId());
    }

    @Test
    @DisplayName("should keep only episodes inside an explicit month when some match")
    void shouldApplyTemporalHint() {
      when(answerAgent.answer(anyString(), anyString()))
          .thenReturn("Tokyo and Kyoto.\nSOURCES: " + tokyo.getId() + ", " + kyoto.getId());
      ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);

      retrievalService.answer("Which places did I visit in April 2019?", 5);

      verify(answerAgent).answer(eq("Which places did I visit in April 2019?"), context.capture());
      assertThat(context.getValue()).contains(tokyo.getId(), kyoto.getId());
      assertThat(context.getValue()).doesNotContain(tokyoAgain.getId());
    }

    @Test
    @DisplayName("should format context lines with id, date, type and text")
    void shouldBuildContext() {
      String context =
          retrievalService.buildContext(
              List.of(new ScoredEpisode(tokyo, 0.9)));

      assertThat(context)
          .isEqualTo(
              "[" + tokyo.getId() + "] 2019-04-02 | PLACE_VISIT | " + tokyo.getVerbalizedText());
    }
  }
}
