package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Active when {@code ingest.charts.llm-enabled=false} (default); recovers no series. */
@Component
@ConditionalOnProperty(
    name = "ingest.charts.llm-enabled",
    havingValue = "false",
    matchIfMissing = true)
public class NoopChartDigitizer implements ChartDigitizer {

  @Override
  public Optional<SeriesData> digitize(byte[] png) {
    return Optional.empty();
  }
}
