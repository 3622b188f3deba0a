package com.flamingo.ai.timelineqa.support;

import com.flamingo.ai.timelineqa.domain.entity.Episode;
import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.time.OffsetDateTime;

/** Episode fixtures. */
public final class TestEpisodes {

  private TestEpisodes() {}

  /** A place-visit episode with the given id suffix, ISO date and text. */
  public static Episode episode(String idSuffix, String date, String text) {
    String id = id(idSuffix);
    return Episode.builder()
        .id(id)
        .timestamp(OffsetDateTime.parse(date + "T12:00:00Z"))
        .verbalizedText(text)
        .sourceType(SourceType.PLACE_VISIT)
        .provenanceRef("test:" + id)
        .build();
  }

  /** Well-formed episode id starting with the given hex suffix. */
  public static String id(String idSuffix) {
    return "ep_" + (idSuffix + "0".repeat(32)).substring(0, 32);
  }
}
