package com.flamingo.ai.timelineqa.service.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.service.episode.EpisodeSet;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Persists built indexes as {@code index-<contentHash>.json} under {@code qa.index.cache-dir}.
 * Artifacts are written to a temporary file and moved into place, so a reader never sees a
 * partial file. Artifacts that do not match the requested episode set are deleted on load.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexCacheRepository {

  private static final String PREFIX = "index-";
  private static final String SUFFIX = ".json";

  private final ObjectMapper objectMapper;
  private final QaConfig qaConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Writes the index and prunes older artifacts. A failed write is logged and counted; the
   * in-memory index stays valid.
   */
  public void save(EpisodeIndex index) {
    Path dir = cacheDir();
    Path target = fileFor(index.getContentHash());
    try {
      Files.createDirectories(dir);
      Path temp = Files.createTempFile(dir, PREFIX, ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), toFile(index));
        moveIntoPlace(temp, target);
      } finally {
        Files.deleteIfExists(temp);
      }
      Files.setLastModifiedTime(target, FileTime.from(Instant.now()));
      meterRegistry.counter("index.cache.writes").increment();
      log.debug("Wrote index cache {} ({} entries)", target.getFileName(), index.size());
      prune(target);
    } catch (IOException e) {
      meterRegistry.counter("index.cache.write.failures").increment();
      log.warn("Failed to write index cache {}: {}", target, e.getMessage());
    }
  }

  /**
   * Loads the artifact for the episode set's content hash if it exists and is compatible with the
   * set and the configured embedding model.
   */
  public Optional<EpisodeIndex> load(EpisodeSet episodes) {
    Path file = fileFor(episodes.getContentHash());
    if (!Files.isRegularFile(file)) {
      log.debug("No index cache for content hash {}", episodes.getContentHash());
      return Optional.empty();
    }
    try {
      IndexCacheFile cached = objectMapper.readValue(file.toFile(), IndexCacheFile.class);
      Optional<String> problem = validate(cached, episodes);
      if (problem.isPresent()) {
        discard(file, problem.get());
        return Optional.empty();
      }
      List<IndexEntry> entries = new ArrayList<>(cached.getEntries().size());
      for (IndexCacheFile.Entry entry : cached.getEntries()) {
        Episode episode = episodes.find(entry.getEpisodeId()).orElseThrow();
        entries.add(
            new IndexEntry(
                entry.getEpisodeId(),
                entry.getVector(),
                episode.getTimestamp(),
                episode.getSourceType()));
      }
      meterRegistry.counter("index.cache.hits").increment();
      return Optional.of(
          EpisodeIndex.of(
              cached.getGeneration(),
              cached.getContentHash(),
              cached.getEmbeddingModelId(),
              entries,
              parseInstant(cached.getBuiltAt())));
    } catch (IOException | RuntimeException e) {
      discard(file, "unreadable: " + e.getMessage());
      return Optional.empty();
    }
  }

  /** Paths of all artifacts currently on disk, newest first. */
  public List<Path> listArtifacts() {
    Path dir = cacheDir();
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(p -> p.getFileName().toString().startsWith(PREFIX))
          .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
          .sorted(Comparator.comparing(IndexCacheRepository::lastModified).reversed())
          .toList();
    } catch (IOException e) {
      log.warn("Failed to list index cache directory {}: {}", dir, e.getMessage());
      return List.of();
    }
  }

  Path fileFor(String contentHash) {
    return cacheDir().resolve(PREFIX + contentHash + SUFFIX);
  }

  private Optional<String> validate(IndexCacheFile cached, EpisodeSet episodes) {
    if (cached.getFormatVersion() != IndexCacheFile.FORMAT_VERSION) {
      return Optional.of("format version " + cached.getFormatVersion());
    }
    if (!episodes.getContentHash().equals(cached.getContentHash())) {
      return Optional.of("content hash mismatch");
    }
    String modelId = qaConfig.getIndex().getEmbeddingModelId();
    if (!modelId.equals(cached.getEmbeddingModelId())) {
      return Optional.of("built with embedding model " + cached.getEmbeddingModelId());
    }
    List<IndexCacheFile.Entry> entries = cached.getEntries();
    if (entries == null || entries.size() != episodes.size()) {
      return Optional.of("entry count does not match episode count");
    }
    for (IndexCacheFile.Entry entry : entries) {
      if (!episodes.contains(entry.getEpisodeId())) {
        return Optional.of("unknown episode " + entry.getEpisodeId());
      }
      if (entry.getVector() == null || entry.getVector().length != cached.getDimension()) {
        return Optional.of("vector dimension mismatch for " + entry.getEpisodeId());
      }
    }
    if (entries.stream().map(IndexCacheFile.Entry::getEpisodeId).distinct().count()
        != entries.size()) {
      return Optional.of("duplicate entries");
    }
    return Optional.empty();
  }

  private void discard(Path file, String reason) {
    meterRegistry.counter("index.cache.discarded").increment();
    log.warn("Discarding index cache {}: {}", file.getFileName(), reason);
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete index cache {}: {}", file, e.getMessage());
    }
  }

  private void prune(Path keep) throws IOException {
    int retainedOthers = Math.max(1, qaConfig.getIndex().getRetainedCacheFiles()) - 1;
    List<Path> others = listArtifacts().stream().filter(p -> !p.equals(keep)).toList();
    for (Path stale : others.subList(Math.min(retainedOthers, others.size()), others.size())) {
      Files.deleteIfExists(stale);
      log.debug("Pruned index cache {}", stale.getFileName());
    }
  }

  private IndexCacheFile toFile(EpisodeIndex index) {
    List<IndexCacheFile.Entry> entries =
        index.getEntries().stream()
            .map(e -> new IndexCacheFile.Entry(e.episodeId(), e.vector()))
            .toList();
    return IndexCacheFile.builder()
        .formatVersion(IndexCacheFile.FORMAT_VERSION)
        .contentHash(index.getContentHash())
        .generation(index.getGeneration())
        .embeddingModelId(index.getEmbeddingModelId())
        .dimension(index.getDimension())
        .builtAt(index.getBuiltAt().toString())
        .entries(new ArrayList<>(entries))
        .build();
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static FileTime lastModified(Path path) {
    try {
      return Files.getLastModifiedTime(path);
    } catch (IOException e) {
      return FileTime.fromMillis(0);
    }
  }

  private static Instant parseInstant(String value) {
    return value == null ? Instant.EPOCH : Instant.parse(value);
  }

  private Path cacheDir() {
    return Path.of(qaConfig.getIndex().getCacheDir());
  }
}
