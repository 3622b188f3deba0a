package com.flamingo.ai.timelineqa.api.dto.response;

import com.flamingo.ai.timelineqa.service.episode.IngestionReport;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private int accepted;
  private int unchanged;
  private int superseded;
  private List<String> acceptedIds;
  private List<IngestionReport.Rejection> rejected;
  private String contentHash;

  /** Whether a background index refresh was scheduled for this batch. */
  private boolean indexRefreshScheduled;

  public static IngestionResponse fromReport(IngestionReport report, boolean refreshScheduled) {
    return IngestionResponse.builder()
        .accepted(report.getAccepted())
        .unchanged(report.getUnchanged())
        .superseded(report.getSuperseded())
        .acceptedIds(report.getAcceptedIds())
        .rejected(report.getRejected())
        .contentHash(report.getContentHash())
        .indexRefreshScheduled(refreshScheduled)
        .build();
  }
}
