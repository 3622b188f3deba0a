package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Workouts: {@code On 2022-09-10, I did a running workout for 45 minutes covering 8.2 km.} */
@Component
@Order(4)
public class WorkoutVerbalizer extends TemplateRecordVerbalizer {

  public WorkoutVerbalizer() {
    super(
        SourceType.WORKOUT,
        List.of("activity"),
        defaults(),
        Set.of("durationMinutes", "distanceKm"));
  }

  private static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("durationMinutes", null);
    defaults.put("distanceKm", null);
    return defaults;
  }

  @Override
  protected String describe(SortedMap<String, String> fields) {
    return "I did a "
        + lower(fields.get("activity"))
        + " workout"
        + optional(fields, "durationMinutes", " for ")
        + (fields.containsKey("durationMinutes") ? " minutes" : "")
        + optional(fields, "distanceKm", " covering ")
        + (fields.containsKey("distanceKm") ? " km" : "");
  }
}
