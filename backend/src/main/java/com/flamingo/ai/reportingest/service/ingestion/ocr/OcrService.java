package com.flamingo.ai.reportingest.service.ingestion.ocr;

import java.util.List;
import java.util.stream.Collectors;

/** Text recognition over rendered images. */
public interface OcrService {

  /**
   * Recognizes words in a PNG image.
   *
   * @param png encoded image
   * @param confidenceThreshold boxes below this confidence are dropped
   * @return boxes in reading order
   */
  List<OcrBox> recognize(byte[] png, double confidenceThreshold);

  /** Joins box texts with single spaces. */
  static String joinText(List<OcrBox> boxes) {
    return boxes.stream()
        .map(OcrBox::text)
        .filter(t -> t != null && !t.isBlank())
        .map(String::trim)
        .collect(Collectors.joining(" "));
  }
}
