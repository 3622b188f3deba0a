package com.flamingo.ai.timelineqa.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.service.router.EngineAttempt;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import com.flamingo.ai.timelineqa.service.router.RouteTrace;
import com.flamingo.ai.timelineqa.service.router.SourceReference;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

  private String question;
  private EngineType engineUsed;
  private String answer;
  private double confidence;
  private List<SourceReference> sources;
  private String generatedQuery;
  private boolean degraded;
  private String traceId;
  private Long durationMs;
  private List<EngineAttempt> attempts;

  public static QueryResponse fromResult(QueryResult result) {
    QueryResponseBuilder response =
        QueryResponse.builder()
            .question(result.getQuestion())
            .engineUsed(result.getEngineUsed())
            .answer(result.getAnswer())
            .confidence(result.getConfidence())
            .sources(result.getSources())
            .generatedQuery(result.getGeneratedQuery())
            .degraded(result.isDegraded());
    RouteTrace trace = result.getTrace();
    if (trace != null) {
      response
          .traceId(trace.getTraceId())
          .durationMs(trace.getDurationMs())
          .attempts(trace.getAttempts());
    }
    return response.build();
  }
}
