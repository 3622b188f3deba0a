package com.flamingo.ai.timelineqa.service.retrieval;

import com.flamingo.ai.timelineqa.exception.GenerationFormatException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Splits generated text into the answer and its trailing {@code SOURCES:} citation line. */
@Component
public class CitationParser {

  private static final Pattern SOURCES_LINE =
      Pattern.compile("(?im)^[ \\t*_#>-]*sources?[ \\t*_]*:(.*)$");

  private static final Pattern EPISODE_ID = Pattern.compile("ep_[0-9a-f]{32}");

  /**
   * Parses generated text.
   *
   * @param raw generated text
   * @param retrievedIds ids of the episodes that were given as context
   * @throws GenerationFormatException if there is no citation line or it cites no retrieved id
   */
  public ParsedAnswer parse(String raw, Set<String> retrievedIds) {
    if (raw == null || raw.isBlank()) {
      throw new GenerationFormatException("Empty generation output", raw);
    }
    Matcher matcher = SOURCES_LINE.matcher(raw);
    int lineStart = -1;
    String citationText = null;
    while (matcher.find()) {
      lineStart = matcher.start();
      citationText = matcher.group(1);
    }
    if (citationText == null) {
      throw new GenerationFormatException("Missing SOURCES line", raw);
    }

    Set<String> cited = new LinkedHashSet<>();
    List<String> dropped = new ArrayList<>();
    Matcher ids = EPISODE_ID.matcher(citationText);
    while (ids.find()) {
      String id = ids.group();
      if (retrievedIds.contains(id)) {
        cited.add(id);
      } else if (!dropped.contains(id)) {
        dropped.add(id);
      }
    }
    if (cited.isEmpty()) {
      throw new GenerationFormatException("SOURCES line cites no retrieved episode", raw);
    }

    String answer = raw.substring(0, lineStart).strip();
    if (answer.isEmpty()) {
      throw new GenerationFormatException("Answer text is empty", raw);
    }
    return new ParsedAnswer(answer, List.copyOf(cited), List.copyOf(dropped));
  }

  /** Removes any citation lines, for reusing malformed output as a degraded answer. */
  public String stripCitations(String raw) {
    return raw == null ? "" : SOURCES_LINE.matcher(raw).replaceAll("").strip();
  }
}
