package com.flamingo.ai.timelineqa.exception;

/** Exception thrown when no indexed episode is similar enough to support an answer. */
public class InsufficientEvidenceException extends RuntimeException {

  private final double bestSimilarity;
  private final double threshold;

  public InsufficientEvidenceException(double bestSimilarity, double threshold) {
    super(
        String.format(
            "No episode cleared the similarity threshold %.2f (best %.3f)",
            threshold, bestSimilarity));
    this.bestSimilarity = bestSimilarity;
    this.threshold = threshold;
  }

  public double getBestSimilarity() {
    return bestSimilarity;
  }

  public double getThreshold() {
    return threshold;
  }
}
