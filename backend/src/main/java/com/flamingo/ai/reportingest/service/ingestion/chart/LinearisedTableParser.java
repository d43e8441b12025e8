package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parses linearised chart tables such as {@code "Year | GDP <0x0A> 2020 | 1.2 <0x0A> 2021 | 3.4"}:
 * rows separated by {@code <0x0A>} or newlines, cells by {@code |}, first row as header.
 */
public final class LinearisedTableParser {

  private static final String ROW_TOKEN = "<0x0A>";

  private LinearisedTableParser() {}

  public static Optional<SeriesData> parse(String linearised) {
    if (linearised == null || linearised.isBlank()) {
      return Optional.empty();
    }
    List<String> lines =
        Arrays.stream(linearised.replace(ROW_TOKEN, "\n").split("\\R"))
            .map(String::trim)
            .filter(l -> !l.isEmpty())
            .toList();
    if (lines.size() < 2) {
      return Optional.empty();
    }
    List<String> columns = cells(lines.get(0));
    List<List<String>> rows =
        lines.subList(1, lines.size()).stream().map(LinearisedTableParser::cells).toList();
    return Optional.of(new SeriesData(columns, rows));
  }

  private static List<String> cells(String line) {
    return Arrays.stream(line.split("\\|")).map(String::trim).toList();
  }
}
