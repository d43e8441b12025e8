package com.flamingo.ai.reportingest.service.ingestion.model;

import com.flamingo.ai.reportingest.domain.enums.ExtractionMethod;
import java.util.List;

/** Table recovered from a page; rows are row-major cell text. */
public record ExtractedTable(
    int pageNumber,
    BoundingBox bbox,
    List<List<String>> rows,
    String markdown,
    String csv,
    ExtractionMethod method) {

  public ExtractedTable {
    rows = rows.stream().map(List::copyOf).toList();
  }

  public int rowCount() {
    return rows.size();
  }
}
