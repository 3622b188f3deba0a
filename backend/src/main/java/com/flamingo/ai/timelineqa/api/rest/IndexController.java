package com.flamingo.ai.timelineqa.api.rest;

import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.index.IndexStatus;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the vector index lifecycle. */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

  private final EpisodeIndexService indexService;

  @GetMapping("/status")
  public ResponseEntity<IndexStatus> status() {
    return ResponseEntity.ok(indexService.status());
  }

  /**
   * Schedules a rebuild. Returns immediately; progress is visible through the status endpoint.
   *
   * @param full re-embed every episode instead of reusing cached vectors
   */
  @PostMapping("/rebuild")
  public ResponseEntity<Map<String, Object>> rebuild(
      @RequestParam(defaultValue = "false") boolean full) {
    log.info("Index rebuild requested (full={})", full);
    indexService
        .requestRebuild(full)
        .whenComplete(
            (index, error) -> {
              if (error != null) {
                log.warn("Requested index rebuild failed: {}", error.getMessage());
              }
            });
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(Map.of("status", "SCHEDULED", "full", full));
  }
}
