package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import java.util.Optional;

/** Recovers the data series plotted in a chart. */
public interface ChartDigitizer {

  Optional<SeriesData> digitize(byte[] png);
}
