package com.flamingo.ai.timelineqa.service.episode.verbalizer;

import com.flamingo.ai.timelineqa.domain.enums.SourceType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Place visits: {@code On 2019-04-02, I visited Tokyo.} */
@Component
@Order(5)
public class PlaceVisitVerbalizer extends TemplateRecordVerbalizer {

  public PlaceVisitVerbalizer() {
    super(SourceType.PLACE_VISIT, List.of("place"), defaults(), Set.of());
  }

  private static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("city", null);
    defaults.put("country", null);
    defaults.put("purpose", null);
    return defaults;
  }

  @Override
  protected String describe(SortedMap<String, String> fields) {
    String place = fields.get("place");
    String location =
        Stream.of(fields.get("city"), fields.get("country"))
            .filter(Objects::nonNull)
            .filter(part -> !part.equalsIgnoreCase(place))
            .collect(Collectors.joining(", "));
    return "I visited "
        + place
        + (location.isEmpty() ? "" : " in " + location)
        + optional(fields, "purpose", " for ");
  }
}
