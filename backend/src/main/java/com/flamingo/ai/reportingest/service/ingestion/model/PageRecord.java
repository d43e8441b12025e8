package com.flamingo.ai.reportingest.service.ingestion.model;

import java.util.List;
import lombok.Builder;

/**
 * Everything the pipeline needs to know about one page. Lists are never null.
 *
 * @param pageNumber 1-based page number
 * @param raster page rendered as PNG, or null when rendering failed or was dropped
 */
@Builder(toBuilder = true)
public record PageRecord(
    int pageNumber,
    double width,
    double height,
    List<TextSpan> spans,
    List<ImageRegion> images,
    List<DrawingCluster> drawings,
    List<RulingLine> rulings,
    String rawText,
    byte[] raster) {

  private static final int MIN_TEXT_LAYER_CHARS = 20;

  public PageRecord {
    spans = spans == null ? List.of() : List.copyOf(spans);
    images = images == null ? List.of() : List.copyOf(images);
    drawings = drawings == null ? List.of() : List.copyOf(drawings);
    rulings = rulings == null ? List.of() : List.copyOf(rulings);
    rawText = rawText == null ? "" : rawText;
  }

  public double area() {
    return width * height;
  }

  /** True when the native text layer carries more than a few stray characters. */
  public boolean hasTextLayer() {
    return rawText.strip().length() > MIN_TEXT_LAYER_CHARS;
  }

  public boolean hasRaster() {
    return raster != null && raster.length > 0;
  }

  public PageRecord withoutRaster() {
    return toBuilder().raster(null).build();
  }
}
