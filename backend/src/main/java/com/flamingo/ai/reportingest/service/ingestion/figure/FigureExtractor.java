package com.flamingo.ai.reportingest.service.ingestion.figure;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.DrawingCluster;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.ImageRegion;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.parsing.RasterCropper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts figures from a page.
 *
 * <p>Candidates come from figure layout blocks, then embedded images, then vector-drawing
 * clusters. A candidate overlapping an already accepted one (IoU above the threshold) is dropped,
 * so the same chart found by several sources is extracted once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FigureExtractor {

  private final IngestConfig ingestConfig;
  private final RasterCropper rasterCropper;
  private final FigureImageStorage figureImageStorage;

  public List<ExtractedFigure> extract(PageRecord page, List<LayoutBlock> blocks, String docId) {
    if (!page.hasRaster()) {
      return List.of();
    }
    IngestConfig.Figure config = ingestConfig.getFigure();
    List<BoundingBox> accepted = mergeCandidates(page, blocks, config);
    List<LayoutBlock> captions =
        blocks.stream().filter(b -> b.label() == LayoutLabel.CAPTION).toList();

    List<ExtractedFigure> figures = new ArrayList<>();
    for (int i = 0; i < accepted.size(); i++) {
      int index = i + 1;
      BoundingBox bbox = accepted.get(i);
      Optional<byte[]> crop =
          rasterCropper.crop(
              page.raster(), bbox, ingestConfig.getRender().getDpi(), config.getMinCropPx());
      if (crop.isEmpty()) {
        log.debug("Page {}: figure {} crop below minimum size", page.pageNumber(), index);
        continue;
      }
      String imagePath =
          figureImageStorage.save(docId, page.pageNumber(), index, crop.get()).orElse("");
      figures.add(
          new ExtractedFigure(
              page.pageNumber(),
              bbox,
              crop.get(),
              imagePath,
              nearestCaption(bbox, captions),
              index));
    }
    return figures;
  }

  List<BoundingBox> mergeCandidates(
      PageRecord page, List<LayoutBlock> blocks, IngestConfig.Figure config) {
    List<BoundingBox> candidates = new ArrayList<>();
    for (LayoutBlock block : blocks) {
      if (block.label() == LayoutLabel.FIGURE) {
        candidates.add(block.bbox());
      }
    }
    double pageArea = page.area();
    for (ImageRegion image : page.images()) {
      if (areaRatio(image.bbox(), pageArea) >= config.getMinAreaRatio()) {
        candidates.add(image.bbox());
      }
    }
    for (DrawingCluster cluster : page.drawings()) {
      if (cluster.pathCount() >= config.getMinPaths()
          && areaRatio(cluster.bbox(), pageArea) >= config.getMinAreaRatio()) {
        candidates.add(cluster.bbox());
      }
    }

    List<BoundingBox> accepted = new ArrayList<>();
    for (BoundingBox candidate : candidates) {
      boolean duplicate =
          accepted.stream().anyMatch(a -> a.iou(candidate) > config.getIouThreshold());
      if (!duplicate) {
        accepted.add(candidate);
      }
    }
    return accepted;
  }

  /** Caption whose centroid is closest; ties keep the earlier caption. */
  static String nearestCaption(BoundingBox figure, List<LayoutBlock> captions) {
    String best = "";
    double bestDistance = Double.MAX_VALUE;
    for (LayoutBlock caption : captions) {
      double distance = figure.centroidDistance(caption.bbox());
      if (distance < bestDistance) {
        bestDistance = distance;
        best = caption.text();
      }
    }
    return best;
  }

  private static double areaRatio(BoundingBox bbox, double pageArea) {
    return pageArea > 0 ? bbox.area() / pageArea : 0.0;
  }
}
