package com.flamingo.ai.reportingest.service.ingestion.model;

import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;

/**
 * A classified region of a page.
 *
 * @param text source text, empty for image-only figures
 * @param confidence 1.0 for rule-based blocks, detector score otherwise
 */
public record LayoutBlock(
    LayoutLabel label, BoundingBox bbox, String text, int pageNumber, double confidence) {

  public LayoutBlock {
    text = text == null ? "" : text;
  }

  public static LayoutBlock of(LayoutLabel label, BoundingBox bbox, String text, int pageNumber) {
    return new LayoutBlock(label, bbox, text, pageNumber, 1.0);
  }
}
