package com.flamingo.ai.timelineqa.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.timelineqa.api.rest.EpisodeController;
import com.flamingo.ai.timelineqa.api.rest.HealthController;
import com.flamingo.ai.timelineqa.api.rest.IndexController;
import com.flamingo.ai.timelineqa.api.rest.QueryController;
import com.flamingo.ai.timelineqa.api.rest.ViewController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the controller base paths:
 *
 * <ul>
 *   <li>POST /api/qa/query - Ask a question
 *   <li>GET /api/qa/audit - Recent route traces
 *   <li>POST /api/episodes/ingest - Ingest source records
 *   <li>GET /api/episodes/{id}/related - Related episodes
 *   <li>GET /api/index/status, POST /api/index/rebuild - Index lifecycle
 *   <li>GET /api/views - Structured views
 *   <li>GET /health - Health check
 * </ul>
 */
class ApiContractTest {

  private static String[] basePath(Class<?> controller) {
    RequestMapping mapping = controller.getAnnotation(RequestMapping.class);
    assertThat(mapping).isNotNull();
    return mapping.value();
  }

  @Nested
  @DisplayName("QueryController API contract")
  class QueryControllerContract {

    @Test
    @DisplayName("should be mapped to /api/qa")
    void shouldBeMappedToApiQa() {
      assertThat(basePath(QueryController.class)).containsExactly("/api/qa");
    }
  }

  @Nested
  @DisplayName("EpisodeController API contract")
  class EpisodeControllerContract {

    @Test
    @DisplayName("should be mapped to /api/episodes")
    void shouldBeMappedToApiEpisodes() {
      assertThat(basePath(EpisodeController.class)).containsExactly("/api/episodes");
    }
  }

  @Nested
  @DisplayName("IndexController API contract")
  class IndexControllerContract {

    @Test
    @DisplayName("should be mapped to /api/index")
    void shouldBeMappedToApiIndex() {
      assertThat(basePath(IndexController.class)).containsExactly("/api/index");
    }
  }

  @Nested
  @DisplayName("ViewController API contract")
  class ViewControllerContract {

    @Test
    @DisplayName("should be mapped to /api/views")
    void shouldBeMappedToApiViews() {
      assertThat(basePath(ViewController.class)).containsExactly("/api/views");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      assertThat(basePath(HealthController.class)).containsExactly("/health");
    }
  }
}
