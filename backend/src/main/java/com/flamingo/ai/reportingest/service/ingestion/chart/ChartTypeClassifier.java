package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.domain.enums.FigureType;

/** Assigns a chart type to a figure from the text around and inside it. */
public interface ChartTypeClassifier {

  /**
   * Classifies a figure.
   *
   * @param caption linked caption, may be empty
   * @param ocrText text recognized inside the figure, may be empty
   * @return the chart type, {@link FigureType#UNKNOWN} when nothing matches
   */
  FigureType classify(String caption, String ocrText);
}
