package com.flamingo.ai.timelineqa;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.retrieval.RetrievalService;
import com.flamingo.ai.timelineqa.service.router.AnswerEngine;
import com.flamingo.ai.timelineqa.service.router.QueryRouter;
import com.flamingo.ai.timelineqa.service.structured.StructuredQueryService;
import com.flamingo.ai.timelineqa.service.structured.StructuredViewRegistry;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The model providers are mocked so the test runs
 * without API keys.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean(name = "chatModel")
  private ChatModel chatModel;

  @MockitoBean(name = "textChatModel")
  private ChatModel textChatModel;

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(EpisodeService.class)).isNotNull();
    assertThat(applicationContext.getBean(EpisodeIndexService.class)).isNotNull();
    assertThat(applicationContext.getBean(RetrievalService.class)).isNotNull();
    assertThat(applicationContext.getBean(StructuredQueryService.class)).isNotNull();
    assertThat(applicationContext.getBean(QueryRouter.class)).isNotNull();
  }

  @Test
  @DisplayName("Every engine type should be registered once, with configured views")
  void enginesShouldBeRegistered() {
    assertThat(applicationContext.getBeansOfType(AnswerEngine.class)).hasSize(3);
    assertThat(applicationContext.getBean(StructuredViewRegistry.class).find("books"))
        .isPresent();
  }
}
