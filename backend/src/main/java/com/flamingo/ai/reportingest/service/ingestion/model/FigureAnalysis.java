package com.flamingo.ai.reportingest.service.ingestion.model;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import com.flamingo.ai.reportingest.domain.enums.FigureType;

/** Output of the figure analyzer for one figure; series data may be null. */
public record FigureAnalysis(
    String ocrText, FigureType figureType, String description, SeriesData seriesData) {

  public FigureAnalysis {
    ocrText = ocrText == null ? "" : ocrText;
    description = description == null ? "" : description;
    figureType = figureType == null ? FigureType.UNKNOWN : figureType;
  }

  public static FigureAnalysis empty() {
    return new FigureAnalysis("", FigureType.UNKNOWN, "", null);
  }
}
