package com.flamingo.ai.timelineqa.api.rest;

import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.index.IndexStatus;
import com.flamingo.ai.timelineqa.service.router.QueryAuditLog;
import com.flamingo.ai.timelineqa.service.structured.StructuredViewRegistry;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final EpisodeService episodeService;
  private final EpisodeIndexService indexService;
  private final StructuredViewRegistry viewRegistry;
  private final QueryAuditLog auditLog;

  /** Returns UP, or DEGRADED when the last index build failed. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", indexService.isDegraded() ? "DEGRADED" : "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "timeline-qa");
    health.put("episodes", episodeService.snapshot().size());
    health.put("indexReady", indexService.currentIndex().isPresent());
    return ResponseEntity.ok(health);
  }

  /** Returns system statistics. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    IndexStatus index = indexService.status();
    Map<String, Object> stats = new HashMap<>();
    stats.put("totalEpisodes", episodeService.snapshot().size());
    stats.put("indexedEpisodes", index.getEntryCount());
    stats.put("indexCurrent", index.isCurrent());
    stats.put("structuredViews", viewRegistry.views().size());
    stats.put("recentQueries", auditLog.size());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
