package com.flamingo.ai.reportingest.service.ingestion.chart;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportingest.domain.enums.FigureType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for {@link KeywordChartTypeClassifier}. */
class KeywordChartTypeClassifierTest {

  private final KeywordChartTypeClassifier classifier = new KeywordChartTypeClassifier();

  @ParameterizedTest
  @CsvSource(
      delimiter = ';',
      value = {
        "Figure 2: Pie chart of export destinations; PIE_CHART",
        "Stacked column chart of spending; STACKED_BAR_CHART",
        "Column chart: fiscal balance; BAR_CHART",
        "Box plot of bond returns; BOX_WHISKER",
        "Heat map of regional unemployment; HEATMAP",
        "Area chart of reserves; AREA_CHART",
        "Line chart: headline line vs core line; MULTI_LINE_CHART",
        "Policy rate, line; LINE_CHART",
        "Chart 4: Inflation expectations; UNKNOWN"
      })
  void shouldClassifyCaption(String caption, FigureType expected) {
    assertThat(classifier.classify(caption, "")).isEqualTo(expected);
  }

  @Test
  void shouldApplyRulesInOrder_whenSeveralMatch() {
    assertThat(classifier.classify("Pie and bar comparison", "")).isEqualTo(FigureType.PIE_CHART);
  }

  @Test
  void shouldUseOcrText_whenCaptionIsSilent() {
    assertThat(classifier.classify(null, "scatter of debt vs growth"))
        .isEqualTo(FigureType.SCATTER_CHART);
    assertThat(classifier.classify(null, null)).isEqualTo(FigureType.UNKNOWN);
  }

  @Test
  void shouldMatchWholeWordsOnly() {
    assertThat(classifier.classify("Barometer of confidence", "")).isEqualTo(FigureType.UNKNOWN);
  }
}
