package com.flamingo.ai.reportingest.service.ingestion.chart;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Describes a chart from its caption and OCR overlay only.
 *
 * <p>Active when {@code ingest.charts.llm-enabled=false} (default).
 */
@Component
@ConditionalOnProperty(
    name = "ingest.charts.llm-enabled",
    havingValue = "false",
    matchIfMissing = true)
public class CaptionChartDescriber implements ChartDescriber {

  @Override
  public String describe(byte[] png, String caption, String ocrText) {
    List<String> parts = new ArrayList<>();
    if (caption != null && !caption.isBlank()) {
      parts.add("This figure is captioned: \"" + caption.trim() + "\".");
    }
    if (ocrText != null && !ocrText.isBlank()) {
      parts.add("Text visible in the chart: " + ocrText.trim());
    }
    return String.join(" ", parts);
  }
}
