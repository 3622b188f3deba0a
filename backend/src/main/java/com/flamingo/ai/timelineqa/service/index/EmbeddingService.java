package com.flamingo.ai.timelineqa.service.index;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.exception.EmbeddingProviderException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating text embeddings. The same instance embeds episodes at index time and
 * questions at query time, so both live in one vector space.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // OpenAI text-embedding-3-small has 8192 token limit; episodes are one sentence, questions short
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a single text.
   *
   * @throws EmbeddingProviderException if the provider fails or returns an empty vector
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  @Retry(name = "openai")
  public float[] embed(String text) {
    log.debug("embed called, input length: {} chars", text.length());
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text, 0));
      float[] vector = vectorOf(response == null ? null : response.content());
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedding generated, vector dimension: {}", vector.length);
      return vector;
    } catch (EmbeddingProviderException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new EmbeddingProviderException("Embedding request failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /**
   * Embeds texts in provider batches of {@code qa.index.embedding-batch-size}. The result has one
   * vector per input, in input order, all of the same dimension.
   *
   * @throws EmbeddingProviderException if any batch fails or the vectors are inconsistent
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedAllFallback")
  @Retry(name = "openai")
  public List<float[]> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    int batchSize = Math.max(1, qaConfig.getIndex().getEmbeddingBatchSize());
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<float[]> results = new ArrayList<>(texts.size());
      for (int start = 0; start < texts.size(); start += batchSize) {
        List<TextSegment> segments = new ArrayList<>();
        for (int i = start; i < Math.min(texts.size(), start + batchSize); i++) {
          segments.add(TextSegment.from(truncate(texts.get(i), i)));
        }
        Response<List<Embedding>> response = embeddingModel.embedAll(segments);
        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != segments.size()) {
          throw new EmbeddingProviderException(
              "Embedding provider returned "
                  + (embeddings == null ? 0 : embeddings.size())
                  + " vectors for "
                  + segments.size()
                  + " texts");
        }
        for (Embedding embedding : embeddings) {
          results.add(vectorOf(embedding));
        }
      }
      int dimension = results.get(0).length;
      if (results.stream().anyMatch(v -> v.length != dimension)) {
        throw new EmbeddingProviderException("Embedding provider returned mixed dimensions");
      }
      meterRegistry.counter("embedding.requests.success").increment();
      meterRegistry.counter("embedding.texts").increment(texts.size());
      return results;
    } catch (EmbeddingProviderException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new EmbeddingProviderException("Batch embedding failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker fallback: {}", t.getMessage());
    throw asProviderException(t);
  }

  @SuppressWarnings("unused")
  private List<float[]> embedAllFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    throw asProviderException(t);
  }

  private static EmbeddingProviderException asProviderException(Throwable t) {
    if (t instanceof EmbeddingProviderException e) {
      return e;
    }
    return new EmbeddingProviderException("Embedding provider unavailable: " + t.getMessage(), t);
  }

  private static float[] vectorOf(Embedding embedding) {
    if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
      throw new EmbeddingProviderException("Embedding provider returned an empty vector");
    }
    return embedding.vector();
  }

  private static String truncate(String text, int position) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        position,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }
}
