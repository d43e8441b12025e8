package com.flamingo.ai.reportingest.domain.chunk;

import com.flamingo.ai.reportingest.domain.enums.FigureType;

/**
 * Chart or image with the text recovered around and inside it.
 *
 * @param representation text built at creation from caption, description and OCR overlay
 * @param seriesData digitized values, null when the chart was not digitized
 * @param imagePath saved crop relative to the storage root
 */
public record FigureChunk(
    ChunkMetadata metadata,
    String caption,
    String ocrText,
    String description,
    FigureType figureType,
    SeriesData seriesData,
    String imagePath,
    String representation)
    implements Chunk {

  @Override
  public String canonicalText() {
    return representation;
  }

  /** Caption, description and OCR overlay flattened; what the quality gate measures. */
  public String flattenedText() {
    return (nullToEmpty(caption) + " " + nullToEmpty(description) + " " + nullToEmpty(ocrText))
        .trim();
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
