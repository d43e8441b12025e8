package com.flamingo.ai.reportingest.service.ingestion.table;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.enums.ExtractionMethod;
import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;
import com.flamingo.ai.reportingest.service.ingestion.CollaboratorInvoker;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedTable;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrBox;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrService;
import com.flamingo.ai.reportingest.service.ingestion.parsing.RasterCropper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts tables from a page: ruled-line detection first, OCR over table regions tagged by the
 * segmenter when that finds nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TableExtractor {

  private final IngestConfig ingestConfig;
  private final RuledTableDetector ruledTableDetector;
  private final RasterCropper rasterCropper;
  private final OcrService ocrService;
  private final CollaboratorInvoker collaboratorInvoker;

  public List<ExtractedTable> extract(PageRecord page, List<LayoutBlock> blocks) {
    List<ExtractedTable> tables = extractRuled(page);
    if (!tables.isEmpty()) {
      return tables;
    }

    List<LayoutBlock> tableRegions =
        blocks.stream().filter(b -> b.label() == LayoutLabel.TABLE).toList();
    if (tableRegions.isEmpty() || !page.hasRaster()) {
      return List.of();
    }
    List<ExtractedTable> fallback = new ArrayList<>();
    for (LayoutBlock region : tableRegions) {
      extractWithOcr(page, region.bbox()).ifPresent(fallback::add);
    }
    log.debug(
        "Page {}: OCR fallback recovered {} of {} table regions",
        page.pageNumber(),
        fallback.size(),
        tableRegions.size());
    return fallback;
  }

  private List<ExtractedTable> extractRuled(PageRecord page) {
    IngestConfig.Table config = ingestConfig.getTable();
    try {
      List<ExtractedTable> tables = new ArrayList<>();
      for (RuledTableDetector.Candidate candidate :
          ruledTableDetector.detect(page.rulings(), page.spans())) {
        if (candidate.rows().size() < config.getMinRows()
            || candidate.columnCount() < config.getMinCols()) {
          continue;
        }
        tables.add(
            build(
                page.pageNumber(), candidate.bbox(), candidate.rows(), ExtractionMethod.PRIMARY));
      }
      return tables;
    } catch (RuntimeException e) {
      log.warn("Ruled table detection failed on page {}: {}", page.pageNumber(), e.getMessage());
      return List.of();
    }
  }

  private Optional<ExtractedTable> extractWithOcr(PageRecord page, BoundingBox region) {
    Optional<byte[]> crop =
        rasterCropper.crop(page.raster(), region, ingestConfig.getRender().getDpi(), 1);
    if (crop.isEmpty()) {
      return Optional.empty();
    }
    double threshold = ingestConfig.getOcr().getConfidenceThreshold();
    List<OcrBox> boxes =
        collaboratorInvoker.invoke(
            "ocr", () -> ocrService.recognize(crop.get(), threshold), List.of());
    IngestConfig.Table config = ingestConfig.getTable();
    List<List<String>> rows = clusterRows(boxes, config.getOcrRowTolerancePx());
    int columns = rows.stream().mapToInt(List::size).max().orElse(0);
    if (rows.size() < config.getMinRows() || columns < config.getMinCols()) {
      log.debug(
          "OCR table on page {} rejected ({} rows, {} columns)",
          page.pageNumber(),
          rows.size(),
          columns);
      return Optional.empty();
    }
    return Optional.of(build(page.pageNumber(), region, rows, ExtractionMethod.OCR_FALLBACK));
  }

  /**
   * Groups OCR boxes into rows by integer vertical centre. A box joins the first existing row whose
   * key is closer than {@code tolerance}; rows run top-to-bottom and cells left-to-right.
   */
  static List<List<String>> clusterRows(List<OcrBox> boxes, int tolerance) {
    Map<Integer, List<OcrBox>> rowsByKey = new LinkedHashMap<>();
    for (OcrBox box : boxes) {
      int centre = (int) Math.floor((box.bbox().y0() + box.bbox().y1()) / 2.0);
      Integer key = null;
      for (Integer existing : rowsByKey.keySet()) {
        if (Math.abs(existing - centre) < tolerance) {
          key = existing;
          break;
        }
      }
      rowsByKey.computeIfAbsent(key != null ? key : centre, k -> new ArrayList<>()).add(box);
    }
    return rowsByKey.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .map(
            e ->
                e.getValue().stream()
                    .sorted(Comparator.comparingDouble(b -> b.bbox().x0()))
                    .map(OcrBox::text)
                    .toList())
        .toList();
  }

  private static ExtractedTable build(
      int pageNumber, BoundingBox bbox, List<List<String>> rows, ExtractionMethod method) {
    return new ExtractedTable(
        pageNumber,
        bbox,
        rows,
        TableFormatter.toMarkdown(rows),
        TableFormatter.toCsv(rows),
        method);
  }
}
