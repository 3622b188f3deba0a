package com.flamingo.ai.timelineqa.service.index;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.exception.EmbeddingProviderException;
import com.flamingo.ai.timelineqa.exception.ProviderTimeoutException;
import com.flamingo.ai.timelineqa.exception.QueryCancelledException;
import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.episode.EpisodeSet;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Owns the live {@link EpisodeIndex}. Readers go through one {@link AtomicReference} and never
 * block; builds are serialized by a lock and run on a single-thread executor, and a new index is
 * swapped in only after it is complete.
 */
@Service
@Slf4j
public class EpisodeIndexService {

  private final EpisodeService episodeService;
  private final EmbeddingService embeddingService;
  private final IndexCacheRepository cacheRepository;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;
  private final Executor rebuildExecutor;

  private final AtomicReference<EpisodeIndex> current = new AtomicReference<>();
  private final AtomicReference<CompletableFuture<EpisodeIndex>> inFlight =
      new AtomicReference<>();
  private final AtomicLong generations = new AtomicLong();
  private final ReentrantLock buildLock = new ReentrantLock();

  private volatile boolean lastBuildFailed;
  private volatile String lastError;

  public EpisodeIndexService(
      EpisodeService episodeService,
      EmbeddingService embeddingService,
      IndexCacheRepository cacheRepository,
      QaConfig qaConfig,
      MeterRegistry meterRegistry,
      @Qualifier("indexRebuildExecutor") Executor rebuildExecutor) {
    this.episodeService = episodeService;
    this.embeddingService = embeddingService;
    this.cacheRepository = cacheRepository;
    this.qaConfig = qaConfig;
    this.meterRegistry = meterRegistry;
    this.rebuildExecutor = rebuildExecutor;
  }

  /**
   * Builds an index for {@code episodes} from scratch, re-embedding every episode, and swaps it
   * in.
   *
   * @throws EmbeddingProviderException if embedding fails; the previous index stays live
   */
  public EpisodeIndex build(EpisodeSet episodes) {
    buildLock.lock();
    try {
      return buildFrom(episodes, Map.of(), "full");
    } finally {
      buildLock.unlock();
    }
  }

  /**
   * Brings the index in line with {@code episodes}, reusing the vectors of episodes that are
   * already indexed and embedding only the missing ones. Returns the live index unchanged when it
   * already matches.
   */
  public EpisodeIndex refresh(EpisodeSet episodes) {
    buildLock.lock();
    try {
      EpisodeIndex previous = current.get();
      if (previous != null
          && compatible(previous)
          && previous.getContentHash().equals(episodes.getContentHash())) {
        return previous;
      }
      Map<String, float[]> reusable = new HashMap<>();
      if (previous != null && compatible(previous)) {
        previous.getEntries().stream()
            .filter(e -> episodes.contains(e.episodeId()))
            .forEach(e -> reusable.put(e.episodeId(), e.vector()));
      }
      return buildFrom(episodes, reusable, "incremental");
    } finally {
      buildLock.unlock();
    }
  }

  /** Indexes one newly stored episode, together with any other pending changes. */
  public EpisodeIndex addOrUpdate(Episode episode) {
    EpisodeSet snapshot = episodeService.snapshot();
    if (!snapshot.contains(episode.getId())) {
      throw new IllegalArgumentException("Episode " + episode.getId() + " is not stored");
    }
    return refresh(snapshot);
  }

  /**
   * Returns an index view for the current episode set, refreshing first when the set changed.
   * Waits at most {@code qa.index.stale-wait-ms} for the refresh; if it fails or is still running
   * and an older index exists, the older index is served, filtered to live episodes.
   *
   * @throws EmbeddingProviderException if no index exists and the build failed
   * @throws ProviderTimeoutException if no index exists and the build is still running
   */
  public IndexView ensureCurrent() {
    EpisodeSet episodes = episodeService.snapshot();
    EpisodeIndex live = current.get();
    if (live != null && live.getContentHash().equals(episodes.getContentHash())) {
      return new IndexView(live, episodes, false);
    }

    log.debug("Index is stale for content hash {}, requesting refresh", episodes.getContentHash());
    CompletableFuture<EpisodeIndex> pending = requestRebuild(false);
    try {
      EpisodeIndex rebuilt =
          pending.get(qaConfig.getIndex().getStaleWaitMs(), TimeUnit.MILLISECONDS);
      EpisodeSet latest = episodeService.snapshot();
      return new IndexView(
          rebuilt, latest, !rebuilt.getContentHash().equals(latest.getContentHash()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException("waiting for index refresh", e);
    } catch (TimeoutException e) {
      if (live != null) {
        log.warn("Index refresh still running, serving generation {}", live.getGeneration());
        meterRegistry.counter("index.stale.served").increment();
        return new IndexView(live, episodes, true);
      }
      throw new ProviderTimeoutException(
          "embedding", "Index was not built within " + qaConfig.getIndex().getStaleWaitMs() + "ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (live != null) {
        log.warn(
            "Index refresh failed ({}), serving generation {}",
            cause.getMessage(),
            live.getGeneration());
        meterRegistry.counter("index.stale.served").increment();
        return new IndexView(live, episodes, true);
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new EmbeddingProviderException("Index build failed: " + cause.getMessage(), cause);
    }
  }

  /**
   * Schedules a rebuild on the rebuild executor. Concurrent requests share the pending rebuild.
   *
   * @param full re-embed everything instead of reusing vectors
   */
  public CompletableFuture<EpisodeIndex> requestRebuild(boolean full) {
    while (true) {
      CompletableFuture<EpisodeIndex> existing = inFlight.get();
      if (existing != null && !existing.isDone()) {
        return existing;
      }
      CompletableFuture<EpisodeIndex> created = new CompletableFuture<>();
      if (!inFlight.compareAndSet(existing, created)) {
        continue;
      }
      Function<EpisodeSet, EpisodeIndex> task = full ? this::build : this::refresh;
      try {
        rebuildExecutor.execute(
            () -> {
              try {
                created.complete(task.apply(episodeService.snapshot()));
              } catch (RuntimeException e) {
                created.completeExceptionally(e);
              }
            });
      } catch (RejectedExecutionException e) {
        created.completeExceptionally(e);
      }
      return created;
    }
  }

  /**
   * Restores the index from the cache when an artifact matches the current episode set.
   *
   * @return {@code true} if an index was restored
   */
  public boolean loadFromCache() {
    EpisodeSet episodes = episodeService.snapshot();
    Optional<EpisodeIndex> cached = cacheRepository.load(episodes);
    if (cached.isEmpty()) {
      return false;
    }
    EpisodeIndex index = cached.get();
    buildLock.lock();
    try {
      generations.accumulateAndGet(index.getGeneration(), Math::max);
      current.set(index);
    } finally {
      buildLock.unlock();
    }
    log.info(
        "Restored index generation {} from cache ({} entries)",
        index.getGeneration(),
        index.size());
    return true;
  }

  /** The live index, if one has been built or restored. */
  public Optional<EpisodeIndex> currentIndex() {
    return Optional.ofNullable(current.get());
  }

  /** Whether the most recent build attempt failed. */
  public boolean isDegraded() {
    return lastBuildFailed;
  }

  public IndexStatus status() {
    EpisodeSet episodes = episodeService.snapshot();
    EpisodeIndex live = current.get();
    CompletableFuture<EpisodeIndex> pending = inFlight.get();
    IndexStatus.IndexStatusBuilder status =
        IndexStatus.builder()
            .ready(live != null)
            .episodeContentHash(episodes.getContentHash())
            .episodeCount(episodes.size())
            .embeddingModelId(qaConfig.getIndex().getEmbeddingModelId())
            .rebuildInProgress(pending != null && !pending.isDone())
            .lastBuildFailed(lastBuildFailed)
            .lastError(lastError);
    if (live != null) {
      status
          .current(live.getContentHash().equals(episodes.getContentHash()))
          .generation(live.getGeneration())
          .indexContentHash(live.getContentHash())
          .entryCount(live.size())
          .dimension(live.getDimension())
          .builtAt(live.getBuiltAt());
    }
    return status.build();
  }

  private EpisodeIndex buildFrom(
      EpisodeSet episodes, Map<String, float[]> reusable, String mode) {
    Timer.Sample sample = Timer.start(meterRegistry);
    String buildMode = mode;
    try {
      List<Episode> missing =
          episodes.getEpisodes().stream().filter(e -> !reusable.containsKey(e.getId())).toList();
      List<float[]> embedded = embed(missing);

      Map<String, float[]> vectors = new HashMap<>(reusable);
      if (!reusable.isEmpty()
          && !embedded.isEmpty()
          && embedded.get(0).length != reusable.values().iterator().next().length) {
        log.warn("Embedding dimension changed, re-embedding all episodes");
        meterRegistry.counter("index.rebuild.failure", "mode", buildMode).increment();
        buildMode = "full";
        vectors.clear();
        missing = episodes.getEpisodes();
        embedded = embed(missing);
      }
      for (int i = 0; i < missing.size(); i++) {
        vectors.put(missing.get(i).getId(), embedded.get(i));
      }

      List<IndexEntry> entries = new ArrayList<>(episodes.size());
      for (Episode episode : episodes.getEpisodes()) {
        entries.add(
            new IndexEntry(
                episode.getId(),
                vectors.get(episode.getId()),
                episode.getTimestamp(),
                episode.getSourceType()));
      }
      EpisodeIndex index =
          EpisodeIndex.of(
              generations.incrementAndGet(),
              episodes.getContentHash(),
              qaConfig.getIndex().getEmbeddingModelId(),
              entries,
              Instant.now());

      cacheRepository.save(index);
      current.set(index);
      lastBuildFailed = false;
      lastError = null;

      meterRegistry.counter("index.rebuild.success", "mode", buildMode).increment();
      log.info(
          "Index generation {} swapped in ({} build): {} entries, {} embedded, {} reused",
          index.getGeneration(),
          buildMode,
          index.size(),
          missing.size(),
          episodes.size() - missing.size());
      return index;
    } catch (EmbeddingProviderException e) {
      lastBuildFailed = true;
      lastError = e.getMessage();
      meterRegistry.counter("index.rebuild.failure", "mode", buildMode).increment();
      log.warn("Index build failed, keeping previous index: {}", e.getMessage());
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("index.rebuild.duration"));
    }
  }

  private List<float[]> embed(List<Episode> episodes) {
    return embeddingService.embedAll(episodes.stream().map(Episode::getVerbalizedText).toList());
  }

  private boolean compatible(EpisodeIndex index) {
    return index.getEmbeddingModelId().equals(qaConfig.getIndex().getEmbeddingModelId());
  }
}
