package com.flamingo.ai.reportingest.config;

import com.flamingo.ai.reportingest.service.ingestion.ocr.NoopOcrService;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrService;
import com.flamingo.ai.reportingest.service.ingestion.ocr.TesseractOcrService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the OCR engine. */
@Configuration
@Slf4j
public class OcrConfig {

  @Bean
  public OcrService ocrService(IngestConfig ingestConfig) {
    IngestConfig.Ocr ocr = ingestConfig.getOcr();
    if (!ocr.isEnabled()) {
      log.info("OCR disabled; scanned pages and OCR table fallback will yield no text");
      return new NoopOcrService();
    }
    log.info(
        "Using Tesseract OCR (language={}, datapath={})", ocr.getLanguage(), ocr.getDataPath());
    return new TesseractOcrService(ocr);
  }
}
