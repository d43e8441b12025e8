package com.flamingo.ai.reportingest.domain.enums;

/** Kind of content a stored chunk carries. */
public enum BlockType {
  TEXT,
  TABLE,
  FIGURE,

  /** Whole-page overview text emitted alongside the windowed text chunks. */
  PAGE_SUMMARY
}
