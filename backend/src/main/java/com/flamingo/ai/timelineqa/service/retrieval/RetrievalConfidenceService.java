package com.flamingo.ai.timelineqa.service.retrieval;

import com.flamingo.ai.timelineqa.config.QaConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for calculating confidence scores of retrieval answers from the similarity of the cited
 * episodes and how many retrieved episodes cleared the similarity threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalConfidenceService {

  private static final double HIGH_THRESHOLD = 0.7;
  private static final double MEDIUM_THRESHOLD = 0.4;

  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Calculates confidence for a retrieval answer.
   *
   * @param citedSimilarities similarity of every cited episode
   * @param relevantHits retrieved episodes above the similarity threshold
   * @param k number of episodes requested
   * @param malformed whether the answer is a fallback for malformed generation output
   * @return confidence score with level and explanation
   */
  public ConfidenceScore calculateConfidence(
      List<Double> citedSimilarities, int relevantHits, int k, boolean malformed) {
    QaConfig.Retrieval config = qaConfig.getRetrieval();

    double meanSimilarity =
        citedSimilarities.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    double coverage = k <= 0 ? 0.0 : Math.min(1.0, (double) relevantHits / k);

    double score =
        clamp(
            config.getSimilarityWeight() * meanSimilarity
                + config.getCoverageWeight() * coverage);
    if (malformed) {
      score = clamp(score * config.getMalformedConfidencePenalty());
    }

    ConfidenceLevel level = getLevel(score);
    meterRegistry
        .counter("retrieval.confidence." + level.name().toLowerCase(Locale.ROOT))
        .increment();

    log.debug(
        "Confidence score: {} (level: {}) - meanSimilarity={}, coverage={}, malformed={}",
        String.format("%.3f", score),
        level,
        String.format("%.3f", meanSimilarity),
        String.format("%.3f", coverage),
        malformed);

    return new ConfidenceScore(
        score, level, buildExplanation(meanSimilarity, coverage, malformed, score));
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  /** Determines confidence level based on score. */
  private ConfidenceLevel getLevel(double score) {
    if (score >= HIGH_THRESHOLD) {
      return ConfidenceLevel.HIGH;
    } else if (score >= MEDIUM_THRESHOLD) {
      return ConfidenceLevel.MEDIUM;
    } else {
      return ConfidenceLevel.LOW;
    }
  }

  private String buildExplanation(
      double meanSimilarity, double coverage, boolean malformed, double finalScore) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("Confidence: %.1f%% | ", finalScore * 100));

    if (meanSimilarity > 0.8) {
      sb.append("Strong match with cited episodes");
    } else if (meanSimilarity > 0.5) {
      sb.append("Moderate match with cited episodes");
    } else {
      sb.append("Weak match with cited episodes");
    }

    if (coverage < 0.3) {
      sb.append(", few relevant episodes");
    }
    if (malformed) {
      sb.append(", answer format could not be verified");
    }
    return sb.toString();
  }

  /** Confidence level enum. */
  public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
  }

  /** Confidence score result. */
  public record ConfidenceScore(double score, ConfidenceLevel level, String explanation) {}
}
