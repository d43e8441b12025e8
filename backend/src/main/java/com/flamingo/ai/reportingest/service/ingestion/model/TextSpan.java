package com.flamingo.ai.reportingest.service.ingestion.model;

/** A run of glyphs on one line sharing font name and size. */
public record TextSpan(
    String text, BoundingBox bbox, double fontSize, String fontName, boolean bold) {

  public int wordCount() {
    String trimmed = text == null ? "" : text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
