package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Photos: {@code On 2019-04-03, I took a photo of cherry blossoms at Ueno Park with Ken.} */
@Component
@Order(2)
public class PhotoVerbalizer extends TemplateRecordVerbalizer {

  public PhotoVerbalizer() {
    super(SourceType.PHOTO, List.of("caption"), defaults(), Set.of());
  }

  private static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("place", null);
    defaults.put("people", null);
    return defaults;
  }

  @Override
  protected String describe(SortedMap<String, String> fields) {
    return "I took a photo of "
        + fields.get("caption")
        + optional(fields, "place", " at ")
        + optional(fields, "people", " with ");
  }
}
