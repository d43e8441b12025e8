package com.flamingo.ai.reportingest.domain.enums;

import java.util.Locale;

/** Semantic role of a region on a page. */
public enum LayoutLabel {
  HEADING,
  PARAGRAPH,
  TABLE,
  FIGURE,
  CAPTION,
  FOOTNOTE,
  HEADER,
  FOOTER,
  OTHER;

  /**
   * Maps a detector label such as "Table" or "section-header" onto a layout label.
   *
   * @param raw label reported by a layout-region detector
   * @return the matching label, or {@link #OTHER}
   */
  public static LayoutLabel fromDetectorLabel(String raw) {
    if (raw == null) {
      return OTHER;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "title", "heading", "section-header", "section_header" -> HEADING;
      case "text", "paragraph", "list-item", "list_item" -> PARAGRAPH;
      case "table" -> TABLE;
      case "figure", "picture", "chart", "image" -> FIGURE;
      case "caption" -> CAPTION;
      case "footnote" -> FOOTNOTE;
      case "page-header", "page_header", "header" -> HEADER;
      case "page-footer", "page_footer", "footer" -> FOOTER;
      default -> OTHER;
    };
  }
}
