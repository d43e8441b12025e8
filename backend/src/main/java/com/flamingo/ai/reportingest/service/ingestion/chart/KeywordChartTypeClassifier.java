package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.domain.enums.FigureType;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Keyword rules over caption and OCR text; the first matching rule wins. */
@Component
public class KeywordChartTypeClassifier implements ChartTypeClassifier {

  private static final List<Map.Entry<Pattern, FigureType>> RULES =
      List.of(
          rule("\\bpie\\b", FigureType.PIE_CHART),
          rule("\\bdonut\\b", FigureType.DONUT_CHART),
          rule("\\bscatter\\b", FigureType.SCATTER_CHART),
          rule("\\bbubble\\b", FigureType.BUBBLE_CHART),
          rule("\\bcandle|ohlc\\b", FigureType.CANDLESTICK),
          rule("\\bwaterfall\\b", FigureType.WATERFALL),
          rule("\\bheat\\s*map\\b", FigureType.HEATMAP),
          rule("\\bbox\\b.*\\bwhisker|box\\s*plot\\b", FigureType.BOX_WHISKER),
          rule("\\bhistogram\\b", FigureType.HISTOGRAM),
          rule("\\bnetwork\\b", FigureType.NETWORK_GRAPH),
          rule("\\bparallel\\s*coord", FigureType.PARALLEL_COORDINATES),
          rule("\\bstacked\\s*(bar|column)\\b", FigureType.STACKED_BAR_CHART),
          rule("\\bbar\\b|\\bcolumn\\b", FigureType.BAR_CHART),
          rule("\\barea\\b", FigureType.AREA_CHART),
          rule("\\bline\\b.*\\bline\\b|\\bmulti.?line\\b", FigureType.MULTI_LINE_CHART),
          rule("\\bline\\b", FigureType.LINE_CHART));

  @Override
  public FigureType classify(String caption, String ocrText) {
    String combined = nullToEmpty(caption) + " " + nullToEmpty(ocrText);
    for (Map.Entry<Pattern, FigureType> rule : RULES) {
      if (rule.getKey().matcher(combined).find()) {
        return rule.getValue();
      }
    }
    return FigureType.UNKNOWN;
  }

  private static Map.Entry<Pattern, FigureType> rule(String regex, FigureType type) {
    return Map.entry(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
