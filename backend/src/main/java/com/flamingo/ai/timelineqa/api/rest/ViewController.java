package com.flamingo.ai.timelineqa.api.rest;

import com.flamingo.ai.timelineqa.api.dto.response.ViewResponse;
import com.flamingo.ai.timelineqa.service.structured.StructuredStore;
import com.flamingo.ai.timelineqa.service.structured.StructuredViewRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller listing the structured views the query engine may read. */
@RestController
@RequestMapping("/api/views")
@RequiredArgsConstructor
public class ViewController {

  private final StructuredViewRegistry viewRegistry;
  private final StructuredStore structuredStore;

  @GetMapping
  public ResponseEntity<List<ViewResponse>> listViews() {
    List<ViewResponse> views =
        viewRegistry.views().stream()
            .map(v -> ViewResponse.from(v, structuredStore.viewExists(v.name())))
            .toList();
    return ResponseEntity.ok(views);
  }
}
