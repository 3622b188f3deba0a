package com.flamingo.ai.timelineqa.config;

import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.episode.EpisodeSet;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.structured.StructuredStore;
import com.flamingo.ai.timelineqa.service.structured.StructuredView;
import com.flamingo.ai.timelineqa.service.structured.StructuredViewRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that brings the timeline online.
 *
 * <p>Runs once on application startup and:
 *
 * <ul>
 *   <li>Loads the episode snapshot from SQLite
 *   <li>Restores the vector index from the cache when an artifact matches the episode set
 *   <li>Otherwise schedules a background rebuild
 *   <li>Checks that every configured structured view exists in the view store
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimelineStartupBean implements CommandLineRunner {

  private final EpisodeService episodeService;
  private final EpisodeIndexService indexService;
  private final StructuredViewRegistry viewRegistry;
  private final StructuredStore structuredStore;
  private final QaConfig qaConfig;

  @Override
  public void run(String... args) {
    try {
      EpisodeSet episodes = episodeService.reload();
      log.info("Loaded {} episodes (content hash {})", episodes.size(), episodes.getContentHash());

      if (indexService.loadFromCache()) {
        log.info("Index restored from cache, no rebuild needed");
      } else if (episodes.isEmpty()) {
        log.info("No episodes yet, index will be built on first ingestion");
      } else if (qaConfig.getIndex().isBuildOnStartup()) {
        log.info("No matching index cache, scheduling background rebuild");
        indexService
            .requestRebuild(false)
            .whenComplete(
                (index, error) -> {
                  if (error != null) {
                    log.error("Startup index build failed: {}", error.getMessage());
                  }
                });
      } else {
        log.warn("No matching index cache and startup build disabled; first query will wait");
      }
    } catch (Exception e) {
      // Startup must not fail; queries report the missing index instead.
      log.error("Timeline startup failed: {}", e.getMessage(), e);
    }

    checkViews();
  }

  private void checkViews() {
    if (viewRegistry.isEmpty()) {
      log.info("No structured views configured, structured engine disabled");
      return;
    }
    for (StructuredView view : viewRegistry.views()) {
      if (!structuredStore.viewExists(view.name())) {
        log.warn("Configured view '{}' does not exist in the view store", view.name());
      }
    }
  }
}
