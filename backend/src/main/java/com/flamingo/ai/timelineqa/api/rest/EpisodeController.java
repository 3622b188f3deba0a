package com.flamingo.ai.timelineqa.api.rest;

import com.flamingo.ai.timelineqa.api.dto.request.IngestRequest;
import com.flamingo.ai.timelineqa.api.dto.response.EpisodeResponse;
import com.flamingo.ai.timelineqa.api.dto.response.IngestionResponse;
import com.flamingo.ai.timelineqa.api.dto.response.RelatedEpisodeResponse;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.enums.RelationType;
import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.episode.IngestionReport;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.retrieval.RelatedEpisodesService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for ingesting and inspecting episodes. */
@RestController
@RequestMapping("/api/episodes")
@RequiredArgsConstructor
@Slf4j
public class EpisodeController {

  private final EpisodeService episodeService;
  private final EpisodeIndexService indexService;
  private final RelatedEpisodesService relatedEpisodesService;
  private final QaConfig qaConfig;

  /**
   * Ingests a batch of source records. When the episode set changed, an index refresh is
   * scheduled in the background; queries pick it up through the content hash either way.
   *
   * @param request the records to ingest
   * @return per-batch counts and per-record rejections
   */
  @PostMapping("/ingest")
  public ResponseEntity<IngestionResponse> ingest(@Valid @RequestBody IngestRequest request) {
    log.info("Ingesting batch of {} records", request.getRecords().size());
    IngestionReport report =
        episodeService.ingest(
            request.getRecords().stream()
                .map(r -> r == null ? null : r.toSourceRecord())
                .toList());

    boolean refreshScheduled = false;
    if (report.hasChanges()) {
      indexService
          .requestRebuild(false)
          .whenComplete(
              (index, error) -> {
                if (error != null) {
                  log.warn("Index refresh after ingestion failed: {}", error.getMessage());
                }
              });
      refreshScheduled = true;
    }
    return ResponseEntity.ok(IngestionResponse.fromReport(report, refreshScheduled));
  }

  /**
   * Gets an episode.
   *
   * @param episodeId the episode id
   * @return the episode
   */
  @GetMapping("/{episodeId}")
  public ResponseEntity<EpisodeResponse> getEpisode(@PathVariable String episodeId) {
    return ResponseEntity.ok(EpisodeResponse.fromEntity(episodeService.getEpisode(episodeId)));
  }

  /**
   * Deletes an episode and schedules an index refresh.
   *
   * @param episodeId the episode id
   * @return 204 No Content on success
   */
  @DeleteMapping("/{episodeId}")
  public ResponseEntity<Void> deleteEpisode(@PathVariable String episodeId) {
    episodeService.delete(episodeId);
    indexService.requestRebuild(false);
    return ResponseEntity.noContent().build();
  }

  /**
   * Finds episodes related to the given one.
   *
   * @param episodeId the anchor episode id
   * @param relation SEMANTIC (vector similarity) or TEMPORAL (closeness in time)
   * @param k maximum number of related episodes
   */
  @GetMapping("/{episodeId}/related")
  public ResponseEntity<List<RelatedEpisodeResponse>> related(
      @PathVariable String episodeId,
      @RequestParam(defaultValue = "SEMANTIC") RelationType relation,
      @RequestParam(required = false) Integer k) {
    int limit = k != null && k > 0 ? k : qaConfig.getRetrieval().getRelatedTopK();
    List<RelatedEpisodeResponse> response =
        relatedEpisodesService.findRelated(episodeId, relation, limit).stream()
            .map(RelatedEpisodeResponse::from)
            .toList();
    return ResponseEntity.ok(response);
  }
}
