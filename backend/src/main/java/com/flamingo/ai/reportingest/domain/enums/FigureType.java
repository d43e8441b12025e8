package com.flamingo.ai.reportingest.domain.enums;

/** Chart taxonomy assigned to extracted figures. */
public enum FigureType {
  LINE_CHART,
  MULTI_LINE_CHART,
  AREA_CHART,
  BAR_CHART,
  STACKED_BAR_CHART,
  PIE_CHART,
  DONUT_CHART,
  SCATTER_CHART,
  BUBBLE_CHART,
  BOX_WHISKER,
  WATERFALL,
  HEATMAP,
  CANDLESTICK,
  HISTOGRAM,
  NETWORK_GRAPH,
  PARALLEL_COORDINATES,
  PHOTO,
  DIAGRAM,
  LOGO,
  UNKNOWN
}
