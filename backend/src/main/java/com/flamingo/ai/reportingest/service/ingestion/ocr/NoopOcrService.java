package com.flamingo.ai.reportingest.service.ingestion.ocr;

import java.util.List;

/** Used when OCR is disabled; recognizes nothing. */
public class NoopOcrService implements OcrService {

  @Override
  public List<OcrBox> recognize(byte[] png, double confidenceThreshold) {
    return List.of();
  }
}
