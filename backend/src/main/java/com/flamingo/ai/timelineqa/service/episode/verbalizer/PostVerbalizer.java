package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Social media posts: {@code On 2021-06-01, I posted "Finally summer" for friends.} */
@Component
@Order(1)
public class PostVerbalizer extends TemplateRecordVerbalizer {

  public PostVerbalizer() {
    super(SourceType.POST, List.of("text"), defaults(), Set.of());
  }

  private static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("audience", null);
    defaults.put("people", null);
    return defaults;
  }

  @Override
  protected String describe(SortedMap<String, String> fields) {
    return "I posted \""
        + fields.get("text")
        + "\""
        + optional(fields, "audience", " for ")
        + optional(fields, "people", " mentioning ");
  }
}
