package com.flamingo.ai.reportingest.service.ingestion.chunking;

import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedTable;
import com.flamingo.ai.reportingest.service.ingestion.model.FigureAnalysis;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import java.util.List;

/**
 * Everything extracted from one page, ready to chunk.
 *
 * @param blocks layout blocks with paragraphs already grouped
 * @param analyses one analysis per figure, same order as {@code figures}
 */
public record PageContent(
    PageRecord page,
    List<LayoutBlock> blocks,
    List<ExtractedTable> tables,
    List<ExtractedFigure> figures,
    List<FigureAnalysis> analyses) {

  public PageContent {
    if (analyses.size() != figures.size()) {
      throw new IllegalArgumentException(
          "Expected one analysis per figure: " + figures.size() + " != " + analyses.size());
    }
  }
}
