package com.flamingo.ai.timelineqa.api.dto.request;

import com.flamingo.ai.timelineqa.service.episode.SourceRecord;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One raw record from an importer. Fields are validated per record during ingestion so that a
 * malformed record is reported without rejecting the whole batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecordRequest {

  private String sourceType;
  private String timestamp;
  private String provenanceRef;
  private Map<String, Object> fields;

  public SourceRecord toSourceRecord() {
    return new SourceRecord(sourceType, timestamp, provenanceRef, fields);
  }
}
