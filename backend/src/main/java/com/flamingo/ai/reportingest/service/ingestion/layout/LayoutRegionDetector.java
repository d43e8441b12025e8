package com.flamingo.ai.reportingest.service.ingestion.layout;

import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import java.util.List;

/** Model-based layout detection (tables, figures, titles) over a rendered page. */
public interface LayoutRegionDetector {

  /**
   * Detects labelled regions on a page.
   *
   * @param page the page, including its raster
   * @return regions in page coordinates with detector confidence
   */
  List<LayoutBlock> detect(PageRecord page);
}
