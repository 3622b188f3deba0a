package com.flamingo.ai.timelineqa.api.rest;

import com.flamingo.ai.timelineqa.api.dto.request.QueryRequest;
import com.flamingo.ai.timelineqa.api.dto.response.QueryResponse;
import com.flamingo.ai.timelineqa.service.router.QueryAuditLog;
import com.flamingo.ai.timelineqa.service.router.QueryResult;
import com.flamingo.ai.timelineqa.service.router.QueryRouter;
import com.flamingo.ai.timelineqa.service.router.RouteTrace;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for asking questions about the timeline. */
@RestController
@RequestMapping("/api/qa")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

  private final QueryRouter queryRouter;
  private final QueryAuditLog auditLog;

  /**
   * Answers a question.
   *
   * @param request the question and optional retrieval depth
   * @return the answer with its sources and route
   */
  @PostMapping("/query")
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    log.debug("Received question ({} chars)", request.getQuestion().length());
    int k = request.getK() != null ? request.getK() : 0;
    QueryResult result = queryRouter.route(request.getQuestion(), k);
    return ResponseEntity.ok(QueryResponse.fromResult(result));
  }

  /** Returns the most recent route traces, newest first. */
  @GetMapping("/audit")
  public ResponseEntity<List<RouteTrace>> audit(
      @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(auditLog.recent(Math.max(0, Math.min(limit, 200))));
  }
}
