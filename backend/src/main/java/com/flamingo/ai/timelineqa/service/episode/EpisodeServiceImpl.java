package com.flamingo.ai.timelineqa.service.episode;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.repository.EpisodeRepository;
import com.flamingo.ai.timelineqa.exception.EpisodeNotFoundException;
import com.flamingo.ai.timelineqa.exception.MalformedRecordException;
import com.flamingo.ai.timelineqa.service.episode.verbalizer.EpisodeVerbalizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Implementation of EpisodeService backed by the {@code episodes} table and an in-memory snapshot
 * that readers access without locking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EpisodeServiceImpl implements EpisodeService {

  private final EpisodeRepository episodeRepository;
  private final EpisodeVerbalizer verbalizer;
  private final MeterRegistry meterRegistry;

  private final AtomicReference<EpisodeSet> current = new AtomicReference<>();
  private final ReentrantLock writeLock = new ReentrantLock();

  @Override
  @Transactional
  public IngestionReport ingest(List<SourceRecord> records) {
    writeLock.lock();
    try {
      Map<String, Episode> working = new LinkedHashMap<>(loadedSnapshot().asMap());
      Map<String, Episode> byProvenance = new HashMap<>();
      working.values().forEach(e -> byProvenance.put(e.getProvenanceRef(), e));

      List<String> acceptedIds = new ArrayList<>();
      List<IngestionReport.Rejection> rejected = new ArrayList<>();
      int unchanged = 0;
      int superseded = 0;

      for (int i = 0; i < records.size(); i++) {
        SourceRecord record = records.get(i);
        if (record == null) {
          log.warn("Rejected record #{}: empty entry", i);
          rejected.add(new IngestionReport.Rejection(i, null, "record", "Record is missing"));
          continue;
        }
        Episode episode;
        try {
          episode = verbalizer.verbalize(record);
        } catch (MalformedRecordException e) {
          log.warn("Rejected record #{} ({}): {}", i, record.provenanceRef(), e.getMessage());
          rejected.add(
              new IngestionReport.Rejection(
                  i, record.provenanceRef(), e.getField(), e.getMessage()));
          continue;
        }

        if (working.containsKey(episode.getId())) {
          unchanged++;
          continue;
        }

        Episode previous = byProvenance.get(episode.getProvenanceRef());
        if (previous != null) {
          episodeRepository.deleteById(previous.getId());
          // the unique provenance column requires the delete to reach the database first
          episodeRepository.flush();
          working.remove(previous.getId());
          superseded++;
          log.debug("Episode {} superseded by {}", previous.getId(), episode.getId());
        }

        episodeRepository.save(episode);
        working.put(episode.getId(), episode);
        byProvenance.put(episode.getProvenanceRef(), episode);
        acceptedIds.add(episode.getId());
      }

      EpisodeSet updated = EpisodeSet.of(working.values());
      current.set(updated);

      meterRegistry.counter("episodes.ingested").increment(acceptedIds.size());
      meterRegistry.counter("episodes.superseded").increment(superseded);
      meterRegistry.counter("episodes.rejected").increment(rejected.size());
      log.info(
          "Ingested {} records: {} accepted, {} unchanged, {} superseded, {} rejected",
          records.size(),
          acceptedIds.size(),
          unchanged,
          superseded,
          rejected.size());

      return IngestionReport.builder()
          .accepted(acceptedIds.size())
          .unchanged(unchanged)
          .superseded(superseded)
          .acceptedIds(List.copyOf(acceptedIds))
          .rejected(List.copyOf(rejected))
          .contentHash(updated.getContentHash())
          .build();
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public Episode getEpisode(String episodeId) {
    return loadedSnapshot()
        .find(episodeId)
        .orElseThrow(() -> new EpisodeNotFoundException(episodeId));
  }

  @Override
  @Transactional
  public void delete(String episodeId) {
    writeLock.lock();
    try {
      EpisodeSet snapshot = loadedSnapshot();
      if (!snapshot.contains(episodeId)) {
        throw new EpisodeNotFoundException(episodeId);
      }
      episodeRepository.deleteById(episodeId);

      Map<String, Episode> working = new LinkedHashMap<>(snapshot.asMap());
      working.remove(episodeId);
      current.set(EpisodeSet.of(working.values()));
      meterRegistry.counter("episodes.deleted").increment();
      log.info("Deleted episode {}", episodeId);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public EpisodeSet snapshot() {
    return loadedSnapshot();
  }

  @Override
  public List<Episode> findTemporalNeighbors(String episodeId, int limit) {
    Episode anchor = getEpisode(episodeId);
    return loadedSnapshot().getEpisodes().stream()
        .filter(e -> !e.getId().equals(episodeId))
        .sorted(
            Comparator.comparing(
                    (Episode e) ->
                        Duration.between(anchor.getTimestamp(), e.getTimestamp()).abs())
                .thenComparing(Episode::getId))
        .limit(Math.max(0, limit))
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public EpisodeSet reload() {
    writeLock.lock();
    try {
      EpisodeSet loaded = EpisodeSet.of(episodeRepository.findAll());
      current.set(loaded);
      log.info("Loaded {} episodes (content hash {})", loaded.size(), shortHash(loaded));
      return loaded;
    } finally {
      writeLock.unlock();
    }
  }

  private EpisodeSet loadedSnapshot() {
    EpisodeSet snapshot = current.get();
    return snapshot != null ? snapshot : reload();
  }

  private static String shortHash(EpisodeSet set) {
    return set.getContentHash().substring(0, 12);
  }
}
