package com.flamingo.ai.timelineqa.api.dto.response;

import com.flamingo.ai.timelineqa.service.structured.StructuredView;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a registered structured view. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViewResponse {

  private String name;
  private String description;
  private List<Column> columns;

  /** Whether the view exists in the view store. */
  private boolean present;

  public static ViewResponse from(StructuredView view, boolean present) {
    return ViewResponse.builder()
        .name(view.name())
        .description(view.description())
        .columns(
            view.columns().stream()
                .map(c -> new Column(c.name(), c.type(), c.description()))
                .toList())
        .present(present)
        .build();
  }

  /** One column of a view. */
  public record Column(String name, String type, String description) {}
}
