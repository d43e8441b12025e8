package com.flamingo.ai.reportingest.service.ingestion.chart;

/** Produces a prose description of a chart. */
public interface ChartDescriber {

  /**
   * Describes a chart image.
   *
   * @param png the figure crop
   * @param caption linked caption, may be empty
   * @param ocrText text recognized inside the figure, may be empty
   * @return the description, empty when nothing can be said
   */
  String describe(byte[] png, String caption, String ocrText);
}
