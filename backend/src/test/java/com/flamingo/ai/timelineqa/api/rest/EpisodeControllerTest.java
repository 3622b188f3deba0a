package com.flamingo.ai.timelineqa.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.timelineqa.api.dto.request.IngestRequest;
import com.flamingo.ai.timelineqa.api.dto.request.SourceRecordRequest;
import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.RelationType;
import com.flamingo.ai.timelineqa.exception.ApiError;
import com.flamingo.ai.timelineqa.exception.EpisodeNotFoundException;
import com.flamingo.ai.timelineqa.exception.GlobalExceptionHandler;
import com.flamingo.ai.timelineqa.service.episode.EpisodeService;
import com.flamingo.ai.timelineqa.service.episode.IngestionReport;
import com.flamingo.ai.timelineqa.service.episode.SourceRecord;
import com.flamingo.ai.timelineqa.service.index.EpisodeIndexService;
import com.flamingo.ai.timelineqa.service.retrieval.RelatedEpisode;
import com.flamingo.ai.timelineqa.service.retrieval.RelatedEpisodesService;
import com.flamingo.ai.timelineqa.support.TestEpisodes;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EpisodeController Tests")
class EpisodeControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private EpisodeService episodeService;
  @Mock private EpisodeIndexService indexService;
  @Mock private RelatedEpisodesService relatedEpisodesService;

  private final Episode tokyo = TestEpisodes.episode("a1", "2019-04-02", "I visited Tokyo.");

  @BeforeEach
  void setUp() {
    EpisodeController controller =
        new EpisodeController(
            episodeService, indexService, relatedEpisodesService, new QaConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
    when(indexService.requestRebuild(anyBoolean())).thenReturn(new CompletableFuture<>());
  }

  private String ingestBody() throws Exception {
    return objectMapper.writeValueAsString(
        IngestRequest.builder()
            .records(
                List.of(
                    SourceRecordRequest.builder()
                        .sourceType("PLACE_VISIT")
                        .timestamp("2019-04-02T12:00:00Z")
                        .provenanceRef("maps:1")
                        .fields(Map.of("place", "Tokyo"))
                        .build()))
            .build());
  }

  @Nested
  @DisplayName("ingest")
  class Ingest {

    @Test
    @DisplayName("Should ingest records and schedule an index refresh")
    void shouldIngestAndScheduleRefresh() throws Exception {
      when(episodeService.ingest(anyList()))
          .thenReturn(
              IngestionReport.builder()
                  .accepted(1)
                  .acceptedIds(List.of(tokyo.getId()))
                  .contentHash("abc")
                  .build());

      mockMvc
          .perform(
              post("/api/episodes/ingest")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(ingestBody()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.accepted").value(1))
          .andExpect(jsonPath("$.acceptedIds[0]").value(tokyo.getId()))
          .andExpect(jsonPath("$.indexRefreshScheduled").value(true));

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<SourceRecord>> records = ArgumentCaptor.forClass(List.class);
      verify(episodeService).ingest(records.capture());
      assertThat(records.getValue())
          .singleElement()
          .satisfies(
              r -> {
                assertThat(r.sourceType()).isEqualTo("PLACE_VISIT");
                assertThat(r.fields()).containsEntry("place", "Tokyo");
              });
      verify(indexService).requestRebuild(false);
    }

    @Test
    @DisplayName("Should not refresh the index when nothing changed")
    void shouldSkipRefreshWhenUnchanged() throws Exception {
      when(episodeService.ingest(anyList()))
          .thenReturn(IngestionReport.builder().unchanged(1).contentHash("abc").build());

      mockMvc
          .perform(
              post("/api/episodes/ingest")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(ingestBody()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.unchanged").value(1))
          .andExpect(jsonPath("$.indexRefreshScheduled").value(false));

      verify(indexService, never()).requestRebuild(anyBoolean());
    }

    @Test
    @DisplayName("Should pass a null entry through so it is rejected on its own")
    void shouldKeepNullEntryInBatch() throws Exception {
      when(episodeService.ingest(anyList()))
          .thenReturn(
              IngestionReport.builder()
                  .accepted(1)
                  .acceptedIds(List.of(tokyo.getId()))
                  .rejected(
                      List.of(
                          new IngestionReport.Rejection(0, null, "record", "Record is missing")))
                  .contentHash("abc")
                  .build());
      String body =
          "{\"records\":[null,{\"sourceType\":\"PLACE_VISIT\","
              + "\"timestamp\":\"2019-04-02T12:00:00Z\",\"fields\":{\"place\":\"Tokyo\"}}]}";

      mockMvc
          .perform(
              post("/api/episodes/ingest").contentType(MediaType.APPLICATION_JSON).content(body))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.accepted").value(1))
          .andExpect(jsonPath("$.rejected[0].index").value(0))
          .andExpect(jsonPath("$.rejected[0].field").value("record"));

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<SourceRecord>> records = ArgumentCaptor.forClass(List.class);
      verify(episodeService).ingest(records.capture());
      assertThat(records.getValue()).hasSize(2);
      assertThat(records.getValue().get(0)).isNull();
      assertThat(records.getValue().get(1).fields()).containsEntry("place", "Tokyo");
    }

    @Test
    @DisplayName("Should reject an empty batch")
    void shouldRejectEmptyBatch() throws Exception {
      mockMvc
          .perform(
              post("/api/episodes/ingest")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"records\":[]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }
  }

  @Nested
  @DisplayName("episodes")
  class Episodes {

    @Test
    @DisplayName("Should return an episode")
    void shouldGetEpisode() throws Exception {
      when(episodeService.getEpisode(tokyo.getId())).thenReturn(tokyo);

      mockMvc
          .perform(get("/api/episodes/{id}", tokyo.getId()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.id").value(tokyo.getId()))
          .andExpect(jsonPath("$.verbalizedText").value("I visited Tokyo."))
          .andExpect(jsonPath("$.sourceType").value("PLACE_VISIT"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown episode")
    void shouldReturnNotFound() throws Exception {
      when(episodeService.getEpisode("ep_missing"))
          .thenThrow(new EpisodeNotFoundException("ep_missing"));

      mockMvc
          .perform(get("/api/episodes/{id}", "ep_missing"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value(ApiError.EPISODE_NOT_FOUND));
    }

    @Test
    @DisplayName("Should delete an episode and schedule an index refresh")
    void shouldDeleteEpisode() throws Exception {
      mockMvc
          .perform(delete("/api/episodes/{id}", tokyo.getId()))
          .andExpect(status().isNoContent());

      verify(episodeService).delete(tokyo.getId());
      verify(indexService).requestRebuild(false);
    }
  }

  @Nested
  @DisplayName("related episodes")
  class Related {

    @Test
    @DisplayName("Should return temporally related episodes")
    void shouldReturnRelated() throws Exception {
      Episode kyoto = TestEpisodes.episode("b2", "2019-04-05", "I visited Kyoto.");
      when(relatedEpisodesService.findRelated(tokyo.getId(), RelationType.TEMPORAL, 2))
          .thenReturn(List.of(new RelatedEpisode(kyoto, RelationType.TEMPORAL, 0.9)));

      mockMvc
          .perform(
              get("/api/episodes/{id}/related", tokyo.getId())
                  .param("relation", "TEMPORAL")
                  .param("k", "2"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$[0].episode.id").value(kyoto.getId()))
          .andExpect(jsonPath("$[0].relation").value("TEMPORAL"))
          .andExpect(jsonPath("$[0].score").value(0.9));
    }

    @Test
    @DisplayName("Should reject an unknown relation")
    void shouldRejectUnknownRelation() throws Exception {
      mockMvc
          .perform(get("/api/episodes/{id}/related", tokyo.getId()).param("relation", "SPATIAL"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }
  }
}
