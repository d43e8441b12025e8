package com.flamingo.ai.reportingest.service.ingestion.table;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TableFormatter Tests")
class TableFormatterTest {

  @Test
  @DisplayName("Should render header, separator and padded ragged rows")
  void shouldRenderMarkdown_withPaddedRows() {
    List<List<String>> rows =
        List.of(
            List.of("Country", "2023", "2024"), List.of("US", "2.5"), List.of("EU", "0.4", "0.9"));

    String markdown = TableFormatter.toMarkdown(rows);

    assertThat(markdown)
        .isEqualTo(
            "| Country | 2023 | 2024 |\n"
                + "| --- | --- | --- |\n"
                + "| US | 2.5 |  |\n"
                + "| EU | 0.4 | 0.9 |");
  }

  @Test
  void shouldReturnEmptyMarkdown_forNoRows() {
    assertThat(TableFormatter.toMarkdown(List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should quote CSV fields containing commas, quotes and newlines")
  void shouldQuoteCsvFields_whenNeeded() {
    List<List<String>> rows =
        List.of(
            List.of("Item", "Note"),
            List.of("Debt, gross", "say \"high\""),
            List.of("a\nb", "ok"));

    String csv = TableFormatter.toCsv(rows);

    assertThat(csv)
        .isEqualTo(
            "Item,Note\r\n" + "\"Debt, gross\",\"say \"\"high\"\"\"\r\n" + "\"a\nb\",ok\r\n");
  }
}
