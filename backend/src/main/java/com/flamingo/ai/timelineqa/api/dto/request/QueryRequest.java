package com.flamingo.ai.timelineqa.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 2000, message = "Question must not exceed 2000 characters")
  private String question;

  /** Retrieval depth; the configured default applies when absent. */
  @Min(value = 1, message = "k must be at least 1")
  private Integer k;
}
