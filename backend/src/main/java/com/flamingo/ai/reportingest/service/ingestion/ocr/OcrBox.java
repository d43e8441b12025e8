package com.flamingo.ai.reportingest.service.ingestion.ocr;

import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import java.util.Comparator;

/**
 * One recognized word.
 *
 * @param confidence recognition confidence in [0, 1]
 * @param bbox position in pixels of the recognized image
 */
public record OcrBox(String text, double confidence, BoundingBox bbox) {

  /** Top-to-bottom, then left-to-right. */
  public static final Comparator<OcrBox> READING_ORDER =
      Comparator.comparingDouble((OcrBox b) -> b.bbox().y0())
          .thenComparingDouble(b -> b.bbox().x0());
}
