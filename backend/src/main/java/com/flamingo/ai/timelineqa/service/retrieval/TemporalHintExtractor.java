package com.flamingo.ai.timelineqa.service.retrieval;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts explicit calendar ranges from a question. Only a month with a year ({@code April 2019})
 * or bare years ({@code 2019}, {@code between 2018 and 2020}) are recognized; relative phrases
 * such as "last summer" are left to the generation step.
 */
@Component
public class TemporalHintExtractor {

  private static final Pattern MONTH_YEAR =
      Pattern.compile(
          "(?i)\\b(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
              + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)"
              + "\\.?,?\\s+(?:of\\s+)?((?:19|20)\\d{2})\\b");

  private static final Pattern YEAR = Pattern.compile("\\b((?:19|20)\\d{2})\\b");

  private static final Map<String, Month> MONTHS =
      Map.ofEntries(
          Map.entry("jan", Month.JANUARY),
          Map.entry("feb", Month.FEBRUARY),
          Map.entry("mar", Month.MARCH),
          Map.entry("apr", Month.APRIL),
          Map.entry("may", Month.MAY),
          Map.entry("jun", Month.JUNE),
          Map.entry("jul", Month.JULY),
          Map.entry("aug", Month.AUGUST),
          Map.entry("sep", Month.SEPTEMBER),
          Map.entry("oct", Month.OCTOBER),
          Map.entry("nov", Month.NOVEMBER),
          Map.entry("dec", Month.DECEMBER));

  /** Returns the range named in the question, if any. */
  public Optional<TemporalRange> extract(String question) {
    if (question == null || question.isBlank()) {
      return Optional.empty();
    }
    Matcher monthYear = MONTH_YEAR.matcher(question);
    if (monthYear.find()) {
      Month month = MONTHS.get(monthYear.group(1).substring(0, 3).toLowerCase(Locale.ROOT));
      YearMonth yearMonth = YearMonth.of(Integer.parseInt(monthYear.group(2)), month);
      return Optional.of(
          new TemporalRange(
              yearMonth.atDay(1), yearMonth.plusMonths(1).atDay(1), yearMonth.toString()));
    }

    TreeSet<Integer> years = new TreeSet<>();
    Matcher year = YEAR.matcher(question);
    while (year.find()) {
      years.add(Integer.parseInt(year.group(1)));
    }
    if (years.isEmpty()) {
      return Optional.empty();
    }
    String label = years.size() == 1 ? "" + years.first() : years.first() + "-" + years.last();
    return Optional.of(
        new TemporalRange(
            LocalDate.of(years.first(), 1, 1), LocalDate.of(years.last() + 1, 1, 1), label));
  }
}
