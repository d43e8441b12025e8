package com.flamingo.ai.reportingest.service.ingestion.chart;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import com.flamingo.ai.reportingest.domain.enums.FigureType;
import com.flamingo.ai.reportingest.service.ingestion.CollaboratorInvoker;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.FigureAnalysis;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrBox;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FigureAnalyzer Tests")
class FigureAnalyzerTest {

  private static final byte[] PNG = {1, 2, 3};

  @Mock private OcrService ocrService;
  @Mock private ChartTypeClassifier chartTypeClassifier;
  @Mock private ChartDescriber chartDescriber;
  @Mock private ChartDigitizer chartDigitizer;

  private SimpleMeterRegistry meterRegistry;
  private FigureAnalyzer figureAnalyzer;

  @BeforeEach
  void setUp() {
    IngestConfig ingestConfig = new IngestConfig();
    meterRegistry = new SimpleMeterRegistry();
    CollaboratorInvoker invoker =
        new CollaboratorInvoker(ingestConfig, Runnable::run, meterRegistry);
    figureAnalyzer =
        new FigureAnalyzer(
            ingestConfig, ocrService, chartTypeClassifier, chartDescriber, chartDigitizer, invoker);
  }

  @Test
  @DisplayName("Should combine OCR, type, description and series")
  void shouldRunEveryCollaborator() {
    SeriesData series = new SeriesData(List.of("Year", "GDP"), List.of(List.of("2024", "2.1")));
    when(ocrService.recognize(PNG, 0.30)).thenReturn(List.of(word("GDP"), word("growth")));
    when(chartTypeClassifier.classify("Figure 1: Growth", "GDP growth"))
        .thenReturn(FigureType.BAR_CHART);
    when(chartDescriber.describe(PNG, "Figure 1: Growth", "GDP growth"))
        .thenReturn("Bars rising.");
    when(chartDigitizer.digitize(PNG)).thenReturn(Optional.of(series));

    FigureAnalysis analysis = figureAnalyzer.analyze(figure("Figure 1: Growth"));

    assertThat(analysis.ocrText()).isEqualTo("GDP growth");
    assertThat(analysis.figureType()).isEqualTo(FigureType.BAR_CHART);
    assertThat(analysis.description()).isEqualTo("Bars rising.");
    assertThat(analysis.seriesData()).isEqualTo(series);
  }

  @Test
  void shouldSkipDigitizer_forUnknownFigureType() {
    when(ocrService.recognize(any(), anyDouble())).thenReturn(List.of());
    when(chartTypeClassifier.classify(anyString(), anyString())).thenReturn(FigureType.UNKNOWN);
    when(chartDescriber.describe(any(), anyString(), anyString())).thenReturn("");

    FigureAnalysis analysis = figureAnalyzer.analyze(figure("Photo of the board"));

    assertThat(analysis.seriesData()).isNull();
    verify(chartDigitizer, never()).digitize(any());
  }

  @Test
  @DisplayName("Should degrade failing collaborators to empty values and count them")
  void shouldDegradeFailures_toEmptyValues() {
    when(ocrService.recognize(any(), anyDouble()))
        .thenThrow(new IllegalStateException("no tessdata"));
    when(chartTypeClassifier.classify(eq("Chart 2: Pie chart"), eq("")))
        .thenReturn(FigureType.PIE_CHART);
    when(chartDescriber.describe(any(), anyString(), anyString()))
        .thenThrow(new RuntimeException("model down"));
    when(chartDigitizer.digitize(any())).thenReturn(Optional.empty());

    FigureAnalysis analysis = figureAnalyzer.analyze(figure("Chart 2: Pie chart"));

    assertThat(analysis.ocrText()).isEmpty();
    assertThat(analysis.description()).isEmpty();
    assertThat(analysis.figureType()).isEqualTo(FigureType.PIE_CHART);
    assertThat(analysis.seriesData()).isNull();
    assertThat(failures("ocr")).isEqualTo(1.0);
    assertThat(failures("describer")).isEqualTo(1.0);
  }

  private double failures(String collaborator) {
    return meterRegistry
        .counter("ingest.collaborator.failure", "collaborator", collaborator)
        .count();
  }

  private static ExtractedFigure figure(String caption) {
    return new ExtractedFigure(1, new BoundingBox(0, 0, 100, 100), PNG, "", caption, 1);
  }

  private static OcrBox word(String text) {
    return new OcrBox(text, 0.9, new BoundingBox(0, 0, 10, 10));
  }
}
