package com.flamingo.ai.reportingest.domain.enums;

/** How a table was recovered from its page. */
public enum ExtractionMethod {
  /** Ruled-line detection over the native drawing and text layer. */
  PRIMARY("primary"),

  /** OCR over the rendered table region. */
  OCR_FALLBACK("ocr-fallback");

  private final String value;

  ExtractionMethod(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
