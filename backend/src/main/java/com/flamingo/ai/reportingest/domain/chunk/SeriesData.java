package com.flamingo.ai.reportingest.domain.chunk;

import java.util.List;

/** Data series recovered from a chart: column headers and row-major values. */
public record SeriesData(List<String> columns, List<List<String>> rows) {

  public SeriesData {
    columns = List.copyOf(columns);
    rows = rows.stream().map(List::copyOf).toList();
  }
}
