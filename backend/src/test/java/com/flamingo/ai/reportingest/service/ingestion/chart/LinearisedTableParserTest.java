package com.flamingo.ai.reportingest.service.ingestion.chart;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link LinearisedTableParser}. */
class LinearisedTableParserTest {

  @Test
  void shouldParseRowTokens_intoHeaderAndRows() {
    Optional<SeriesData> series =
        LinearisedTableParser.parse("Year | GDP <0x0A> 2022 | 1.9 <0x0A> 2023 | 2.5");

    assertThat(series).isPresent();
    assertThat(series.get().columns()).containsExactly("Year", "GDP");
    assertThat(series.get().rows())
        .containsExactly(List.of("2022", "1.9"), List.of("2023", "2.5"));
  }

  @Test
  void shouldAcceptNewlines_andSkipBlankLines() {
    Optional<SeriesData> series = LinearisedTableParser.parse("Year | CPI\n\n2024 | 3.1\r\n");

    assertThat(series.get().rows()).containsExactly(List.of("2024", "3.1"));
  }

  @Test
  void shouldReturnEmpty_withoutDataRows() {
    assertThat(LinearisedTableParser.parse("Year | GDP")).isEmpty();
    assertThat(LinearisedTableParser.parse("  ")).isEmpty();
    assertThat(LinearisedTableParser.parse(null)).isEmpty();
  }
}
