package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import com.flamingo.ai.reportingest.domain.enums.FigureType;
import com.flamingo.ai.reportingest.service.ingestion.CollaboratorInvoker;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.FigureAnalysis;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs OCR, chart-type classification, description and digitization over one figure. Each step
 * degrades to an empty value on its own; digitization is attempted only for recognized chart
 * types.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FigureAnalyzer {

  private final IngestConfig ingestConfig;
  private final OcrService ocrService;
  private final ChartTypeClassifier chartTypeClassifier;
  private final ChartDescriber chartDescriber;
  private final ChartDigitizer chartDigitizer;
  private final CollaboratorInvoker collaboratorInvoker;

  public FigureAnalysis analyze(ExtractedFigure figure) {
    byte[] png = figure.imageBytes();
    String caption = figure.caption();
    double threshold = ingestConfig.getOcr().getFigureConfidenceThreshold();

    String ocrText =
        collaboratorInvoker.invoke(
            "ocr", () -> OcrService.joinText(ocrService.recognize(png, threshold)), "");
    FigureType type =
        collaboratorInvoker.invoke(
            "classifier",
            () -> chartTypeClassifier.classify(caption, ocrText),
            FigureType.UNKNOWN);
    String description =
        collaboratorInvoker.invoke(
            "describer", () -> chartDescriber.describe(png, caption, ocrText), "");
    SeriesData series = null;
    if (type != FigureType.UNKNOWN) {
      series =
          collaboratorInvoker.invoke(
              "digitizer", () -> chartDigitizer.digitize(png).orElse(null), null);
    }

    log.debug(
        "Figure {} on page {}: type={}, ocr={} chars, series={}",
        figure.index(),
        figure.pageNumber(),
        type,
        ocrText.length(),
        series != null);
    return new FigureAnalysis(ocrText, type, description, series);
  }
}
