package com.flamingo.ai.timelineqa.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a batch of source records. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

  @NotEmpty(message = "At least one record is required")
  @Size(max = 10000, message = "A batch must not exceed 10000 records")
  private List<@Valid SourceRecordRequest> records;
}
