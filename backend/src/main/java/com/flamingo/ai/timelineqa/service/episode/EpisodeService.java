package com.flamingo.ai.timelineqa.service.episode;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import java.util.List;

/** Service for ingesting source records and reading the live episode set. */
public interface EpisodeService {

  /**
   * Verbalizes and stores a batch of records. A malformed record is rejected and reported without
   * aborting the batch; re-ingesting an unchanged record is a no-op.
   *
   * @param records records in importer order
   * @return counts of accepted, unchanged, superseded and rejected records
   */
  IngestionReport ingest(List<SourceRecord> records);

  /**
   * Gets an episode by id.
   *
   * @throws com.flamingo.ai.timelineqa.exception.EpisodeNotFoundException if it does not exist
   */
  Episode getEpisode(String episodeId);

  /** Deletes an episode. */
  void delete(String episodeId);

  /** Returns the current immutable snapshot of all episodes. */
  EpisodeSet snapshot();

  /**
   * Finds the episodes closest in time to the given one, nearest first.
   *
   * @param episodeId anchor episode
   * @param limit maximum number of neighbors
   */
  List<Episode> findTemporalNeighbors(String episodeId, int limit);

  /** Reloads the snapshot from the database. */
  EpisodeSet reload();
}
