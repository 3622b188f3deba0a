package com.flamingo.ai.timelineqa.service.retrieval;

import com.flamingo.ai.timelineqa.agent.EpisodeAnswerAgent;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.exception.EmbeddingProviderException;
import com.flamingo.ai.timelineqa.exception.GenerationFormatException;
import com.flamingo.ai.timelineqa.exception.InsufficientEvidenceException;
import com.flamingo.ai.timelineqa.exception.ProviderErrors;
import com.flamingo.ai.timelineqa.service.index.EmbeddingService;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.index.IndexView;
import com.flamingo.ai.timelineqa.service.index.ScoredEpisode;
import com.flamingo.ai.timelineqa.service.router.AnswerEngine;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import com.flamingo.ai.timelineqa.service.router.SourceReference;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers questions by nearest-neighbor retrieval over the episode index followed by grounded,
 * source-cited generation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService implements AnswerEngine {

  private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

  private final EpisodeIndexService indexService;
  private final EmbeddingService embeddingService;
  private final EpisodeAnswerAgent answerAgent;
  private final CitationParser citationParser;
  private final RetrievalConfidenceService confidenceService;
  private final TemporalHintExtractor temporalHintExtractor;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public EngineType type() {
    return EngineType.RETRIEVAL;
  }

  /**
   * Retrieves the {@code k} most similar episodes and generates a cited answer from those above
   * the similarity threshold.
   *
   * @throws InsufficientEvidenceException if no episode clears the threshold
   * @throws EmbeddingProviderException if the question cannot be embedded or no index exists
   */
  @Override
  @Timed(value = "retrieval.answer", description = "Time to answer through retrieval")
  public QueryResult answer(String question, int k) {
    int topK = effectiveTopK(k);
    List<ScoredEpisode> retrieved = retrieve(question, topK);

    double threshold = qaConfig.getRetrieval().getMinSimilarity();
    List<ScoredEpisode> relevant =
        retrieved.stream().filter(e -> e.similarity() >= threshold).toList();
    if (relevant.isEmpty()) {
      double best = retrieved.isEmpty() ? 0.0 : retrieved.get(0).similarity();
      meterRegistry.counter("retrieval.insufficient_evidence").increment();
      throw new InsufficientEvidenceException(best, threshold);
    }

    Map<String, ScoredEpisode> byId = new LinkedHashMap<>();
    relevant.forEach(e -> byId.put(e.episodeId(), e));
    Set<String> allowedIds = new LinkedHashSet<>(byId.keySet());
    String context = buildContext(relevant);

    boolean malformed = false;
    ParsedAnswer parsed;
    String raw = generate(() -> answerAgent.answer(question, context));
    try {
      parsed = citationParser.parse(raw, allowedIds);
    } catch (GenerationFormatException first) {
      log.warn("Generation output malformed ({}), retrying with strict format", first.getMessage());
      meterRegistry.counter("retrieval.format.retries").increment();
      String retried =
          generate(
              () -> answerAgent.answerStrictly(question, context, String.join(", ", allowedIds)));
      try {
        parsed = citationParser.parse(retried, allowedIds);
      } catch (GenerationFormatException second) {
        log.warn("Generation output still malformed, returning low-confidence answer");
        meterRegistry.counter("retrieval.format.degraded").increment();
        malformed = true;
        parsed =
            new ParsedAnswer(
                fallbackAnswer(retried, relevant), List.copyOf(allowedIds), List.of());
      }
    }
    if (!parsed.droppedIds().isEmpty()) {
      log.warn("Dropped {} cited ids that were not retrieved", parsed.droppedIds().size());
      meterRegistry.counter("retrieval.citations.dropped").increment(parsed.droppedIds().size());
    }

    List<ScoredEpisode> cited = parsed.citedIds().stream().map(byId::get).toList();
    RetrievalConfidenceService.ConfidenceScore confidence =
        confidenceService.calculateConfidence(
            cited.stream().map(ScoredEpisode::similarity).toList(),
            relevant.size(),
            topK,
            malformed);

    meterRegistry.counter("retrieval.answers").increment();
    return QueryResult.builder()
        .question(question)
        .engineUsed(EngineType.RETRIEVAL)
        .answer(parsed.answer())
        .confidence(confidence.score())
        .sources(
            cited.stream().map(e -> SourceReference.episode(e.episode(), e.similarity())).toList())
        .degraded(malformed)
        .build();
  }

  /**
   * Returns the top {@code k} live episodes for the question. When the question names a year or
   * month and some candidates fall inside it, candidates outside it are dropped.
   */
  public List<ScoredEpisode> retrieve(String question, int k) {
    IndexView view = indexService.ensureCurrent();
    float[] query = embeddingService.embed(question);

    Optional<TemporalRange> range =
        qaConfig.getRetrieval().isTemporalFilterEnabled()
            ? temporalHintExtractor.extract(question)
            : Optional.empty();
    try {
      if (range.isEmpty()) {
        return view.search(query, k);
      }
      List<ScoredEpisode> all = view.search(query, view.index().size());
      List<ScoredEpisode> inRange =
          all.stream().filter(e -> range.get().contains(e.episode().getTimestamp())).toList();
      if (inRange.isEmpty()) {
        log.debug("No episodes inside {}, ignoring temporal hint", range.get().label());
        return all.stream().limit(k).toList();
      }
      log.debug(
          "Temporal hint {} kept {} of {} episodes",
          range.get().label(),
          inRange.size(),
          all.size());
      return inRange.stream().limit(k).toList();
    } catch (IllegalArgumentException e) {
      throw new EmbeddingProviderException(
          "Question embedding does not match the index: " + e.getMessage(), e);
    }
  }

  /** Formats retrieved episodes as context lines: {@code [id] date | TYPE | text}. */
  String buildContext(List<ScoredEpisode> episodes) {
    return episodes.stream()
        .map(
            e ->
                "["
                    + e.episodeId()
                    + "] "
                    + DAY.format(e.episode().getTimestamp())
                    + " | "
                    + e.episode().getSourceType()
                    + " | "
                    + e.episode().getVerbalizedText())
        .collect(Collectors.joining("\n"));
  }

  private int effectiveTopK(int k) {
    QaConfig.Retrieval config = qaConfig.getRetrieval();
    int requested = k <= 0 ? config.getDefaultTopK() : k;
    return Math.max(1, Math.min(requested, config.getMaxTopK()));
  }

  private String generate(Supplier<String> call) {
    meterRegistry.counter("generation.requests", "agent", "episode_answer").increment();
    try {
      return call.get();
    } catch (RuntimeException e) {
      meterRegistry.counter("generation.failures", "agent", "episode_answer").increment();
      throw ProviderErrors.generationFailure("Answer generation", e);
    }
  }

  private String fallbackAnswer(String rawOutput, List<ScoredEpisode> relevant) {
    String stripped = citationParser.stripCitations(rawOutput);
    if (!stripped.isBlank()) {
      return stripped;
    }
    return "The closest entry in your timeline: " + relevant.get(0).episode().getVerbalizedText();
  }
}
