package com.flamingo.ai.reportingest.service.ingestion.layout;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.ImageRegion;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.model.TextSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rule-based page segmentation.
 *
 * <p>Spans are classified by vertical position first (page header band, footnote band), then by
 * caption keyword, then by font size and weight relative to the page's median font size.
 * Embedded images large enough to matter become figure blocks, and detector regions above the
 * confidence threshold are appended as reported.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LayoutSegmenter {

  static final double HEADER_BAND = 0.06;
  static final double FOOTNOTE_BAND = 0.92;
  static final double HEADING_SIZE_RATIO = 1.25;
  static final int BOLD_HEADING_MAX_WORDS = 15;
  static final double MIN_IMAGE_AREA_RATIO = 0.01;
  static final double DEFAULT_FONT_SIZE = 12.0;

  private static final Pattern CAPTION_PATTERN =
      Pattern.compile(
          "^(figure|fig\\.?|table|exhibit|chart|graph|source|note)\\s", Pattern.CASE_INSENSITIVE);

  private final IngestConfig ingestConfig;
  private final LayoutRegionDetector layoutRegionDetector;

  /**
   * Classifies a page into layout blocks: spans in reading order, then image figures, then
   * detector regions.
   *
   * @param page the page to segment
   * @return the page's blocks
   */
  public List<LayoutBlock> segment(PageRecord page) {
    double median = medianFontSize(page.spans());
    List<LayoutBlock> blocks = new ArrayList<>();

    for (TextSpan span : page.spans()) {
      LayoutLabel label = classify(span, page.height(), median);
      blocks.add(LayoutBlock.of(label, span.bbox(), span.text(), page.pageNumber()));
    }

    double pageArea = page.area();
    for (ImageRegion image : page.images()) {
      if (pageArea > 0 && image.bbox().area() / pageArea >= MIN_IMAGE_AREA_RATIO) {
        blocks.add(LayoutBlock.of(LayoutLabel.FIGURE, image.bbox(), "", page.pageNumber()));
      }
    }

    double threshold = ingestConfig.getLayout().getConfidenceThreshold();
    for (LayoutBlock detected : layoutRegionDetector.detect(page)) {
      if (detected.confidence() >= threshold) {
        blocks.add(detected);
      }
    }

    log.debug(
        "Segmented page {}: {} blocks (median font {})", page.pageNumber(), blocks.size(), median);
    return blocks;
  }

  /**
   * Merges runs of consecutive paragraph blocks. Any other block ends the current run and passes
   * through unchanged.
   */
  public List<LayoutBlock> groupParagraphs(List<LayoutBlock> blocks) {
    List<LayoutBlock> grouped = new ArrayList<>();
    LayoutBlock run = null;
    for (LayoutBlock block : blocks) {
      if (block.label() != LayoutLabel.PARAGRAPH) {
        if (run != null) {
          grouped.add(run);
          run = null;
        }
        grouped.add(block);
        continue;
      }
      if (run == null) {
        run = block;
      } else {
        run =
            new LayoutBlock(
                LayoutLabel.PARAGRAPH,
                run.bbox().union(block.bbox()),
                run.text() + " " + block.text(),
                run.pageNumber(),
                Math.min(run.confidence(), block.confidence()));
      }
    }
    if (run != null) {
      grouped.add(run);
    }
    return grouped;
  }

  LayoutLabel classify(TextSpan span, double pageHeight, double medianFontSize) {
    if (pageHeight > 0) {
      double relY = span.bbox().centerY() / pageHeight;
      if (relY < HEADER_BAND) {
        return LayoutLabel.HEADER;
      }
      if (relY > FOOTNOTE_BAND) {
        return LayoutLabel.FOOTNOTE;
      }
    }
    if (CAPTION_PATTERN.matcher(span.text()).find()) {
      return LayoutLabel.CAPTION;
    }
    if (span.fontSize() >= medianFontSize * HEADING_SIZE_RATIO
        || (span.bold() && span.wordCount() < BOLD_HEADING_MAX_WORDS)) {
      return LayoutLabel.HEADING;
    }
    return LayoutLabel.PARAGRAPH;
  }

  /** Upper median of positive span font sizes, 12.0 when there are none. */
  static double medianFontSize(List<TextSpan> spans) {
    double[] sizes =
        spans.stream().mapToDouble(TextSpan::fontSize).filter(s -> s > 0).sorted().toArray();
    if (sizes.length == 0) {
      return DEFAULT_FONT_SIZE;
    }
    return sizes[sizes.length / 2];
  }

  /**
   * Folds a page's heading blocks into the running section.
   *
   * @param current section in effect before the page
   * @param blocks the page's blocks in reading order
   * @return the text of the page's last heading, or {@code current} when it has none
   */
  public static String updateSection(String current, List<LayoutBlock> blocks) {
    String section = current;
    for (LayoutBlock block : blocks) {
      if (block.label() == LayoutLabel.HEADING && !block.text().isBlank()) {
        section = block.text();
      }
    }
    return section;
  }

  /** Bounding box covering the whole page. */
  public static BoundingBox pageBox(PageRecord page) {
    return new BoundingBox(0, 0, page.width(), page.height());
  }
}
