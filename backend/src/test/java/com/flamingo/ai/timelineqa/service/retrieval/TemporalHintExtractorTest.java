package com.flamingo.ai.timelineqa.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TemporalHintExtractorTest {

  private final TemporalHintExtractor extractor = new TemporalHintExtractor();

  @Test
  @DisplayName("should extract a month with its year")
  void shouldExtractMonthYear() {
    TemporalRange range =
        extractor.extract("How many books did I read in April 2024?").orElseThrow();

    assertThat(range.start()).isEqualTo(LocalDate.of(2024, 4, 1));
    assertThat(range.endExclusive()).isEqualTo(LocalDate.of(2024, 5, 1));
    assertThat(range.label()).isEqualTo("2024-04");
    assertThat(range.contains(OffsetDateTime.parse("2024-04-30T23:00:00Z"))).isTrue();
    assertThat(range.contains(OffsetDateTime.parse("2024-05-01T00:00:00Z"))).isFalse();
  }

  @Test
  @DisplayName("should accept abbreviated months")
  void shouldExtractAbbreviatedMonth() {
    assertThat(extractor.extract("Where was I in Sept. 2019?"))
        .hasValueSatisfying(r -> assertThat(r.label()).isEqualTo("2019-09"));
  }

  @Test
  @DisplayName("should extract a year and a span of years")
  void shouldExtractYears() {
    TemporalRange single = extractor.extract("What did I do in 2019?").orElseThrow();
    TemporalRange span = extractor.extract("Trips between 2018 and 2020").orElseThrow();

    assertThat(single.start()).isEqualTo(LocalDate.of(2019, 1, 1));
    assertThat(single.endExclusive()).isEqualTo(LocalDate.of(2020, 1, 1));
    assertThat(span.label()).isEqualTo("2018-2020");
    assertThat(span.endExclusive()).isEqualTo(LocalDate.of(2021, 1, 1));
  }

  @Test
  @DisplayName("should ignore questions without explicit dates")
  void shouldIgnoreRelativeDates() {
    assertThat(extractor.extract("When did I last visit Tokyo?")).isEmpty();
    assertThat(extractor.extract("What happened last summer?")).isEmpty();
    assertThat(extractor.extract("May I ask about my runs?")).isEmpty();
  }
}
