package com.flamingo.ai.timelineqa.service.router;

import com.flamingo.ai.timelineqa.domain.enums.EngineType;
import com.flamingo.ai.timelineqa.service.structured.StructuredViewRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keyword classifier deciding which engine a question should try first.
 *
 * <p>Aggregate questions (counts, totals, averages, date ranges over a named view) prefer the
 * structured engine when at least one view is registered. Everything else prefers retrieval. The
 * personal flag decides whether general knowledge may answer when the timeline cannot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuestionClassifier {

  private static final List<Pattern> AGGREGATE_MARKERS =
      phrases(
          "how many",
          "how much",
          "how often",
          "number of",
          "count",
          "total",
          "average",
          "sum",
          "per (?:day|week|month|year)",
          "january",
          "february",
          "march",
          "april",
          "may \\d{4}",
          "june",
          "july",
          "august",
          "september",
          "october",
          "november",
          "december");

  private static final List<Pattern> DESCRIPTIVE_MARKERS =
      phrases(
          "when did",
          "when was",
          "where",
          "who",
          "why",
          "describe",
          "tell me about",
          "remember",
          "what happened",
          "what did",
          "last time",
          "how did",
          "what was");

  private static final Pattern PERSONAL =
      Pattern.compile("\\b(?:i|i'm|i've|my|me|mine|myself|we|our)\\b");

  // case-sensitive, so "the US" stays non-personal
  private static final Pattern PERSONAL_US = Pattern.compile("\\b[Uu]s\\b");

  private final StructuredViewRegistry viewRegistry;

  public Classification classify(String question) {
    String lower = question.toLowerCase(Locale.ROOT);
    List<String> views = viewRegistry.mentionedIn(question);

    int aggregate = count(AGGREGATE_MARKERS, lower) + views.size();
    int descriptive = count(DESCRIPTIVE_MARKERS, lower);
    boolean personal = PERSONAL.matcher(lower).find() || PERSONAL_US.matcher(question).find();

    EngineType preferred =
        aggregate > descriptive && !viewRegistry.isEmpty()
            ? EngineType.STRUCTURED
            : EngineType.RETRIEVAL;

    log.debug(
        "Classified question: preferred={}, personal={}, aggregate={}, descriptive={}, views={}",
        preferred,
        personal,
        aggregate,
        descriptive,
        views);
    return new Classification(preferred, personal, aggregate, descriptive, views);
  }

  private static int count(List<Pattern> markers, String text) {
    int hits = 0;
    for (Pattern marker : markers) {
      if (marker.matcher(text).find()) {
        hits++;
      }
    }
    return hits;
  }

  private static List<Pattern> phrases(String... phrases) {
    return Arrays.stream(phrases)
        .map(p -> Pattern.compile("\\b" + p + "\\b"))
        .toList();
  }
}
