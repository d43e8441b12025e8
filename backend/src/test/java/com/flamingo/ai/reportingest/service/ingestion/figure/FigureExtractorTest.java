package com.flamingo.ai.reportingest.service.ingestion.figure;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.DrawingCluster;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.ImageRegion;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.parsing.RasterCropper;
import com.flamingo.ai.reportingest.support.TestRasters;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FigureExtractor Tests")
class FigureExtractorTest {

  private static final String DOC_ID =
      "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

  @TempDir Path storageDir;

  private FigureExtractor figureExtractor;

  @BeforeEach
  void setUp() {
    IngestConfig ingestConfig = new IngestConfig();
    ingestConfig.getRender().setDpi(72);
    ingestConfig.getPaths().setStorageDir(storageDir.toString());
    ingestConfig.getPaths().setResourcesDir(storageDir.resolve("resources").toString());
    figureExtractor =
        new FigureExtractor(
            ingestConfig, new RasterCropper(), new FigureImageStorage(ingestConfig));
  }

  @Test
  @DisplayName("Should collapse two images with IoU 0.5 into one figure")
  void shouldCollapseOverlappingImages_intoSingleFigure() {
    BoundingBox first = new BoundingBox(0, 0, 300, 300);
    BoundingBox second = new BoundingBox(0, 0, 300, 150);
    assertThat(first.iou(second)).isEqualTo(0.5);

    PageRecord page =
        page()
            .images(List.of(new ImageRegion(first, 600, 600), new ImageRegion(second, 600, 300)))
            .build();

    List<ExtractedFigure> figures = figureExtractor.extract(page, List.of(), DOC_ID);

    assertThat(figures).hasSize(1);
    assertThat(figures.get(0).bbox()).isEqualTo(first);
    assertThat(figures.get(0).index()).isEqualTo(1);
  }

  @Test
  void shouldDedupeAcrossSources_layoutBlockWins() {
    BoundingBox blockBox = new BoundingBox(50, 50, 350, 350);
    PageRecord page =
        page()
            .images(List.of(new ImageRegion(new BoundingBox(55, 55, 345, 345), 400, 400)))
            .drawings(
                List.of(new DrawingCluster(new BoundingBox(60, 60, 340, 340), 12, true, true)))
            .build();
    List<LayoutBlock> blocks = List.of(LayoutBlock.of(LayoutLabel.FIGURE, blockBox, "", 1));

    List<ExtractedFigure> figures = figureExtractor.extract(page, blocks, DOC_ID);

    assertThat(figures).extracting(ExtractedFigure::bbox).containsExactly(blockBox);
  }

  @Test
  void shouldIgnoreSmallImagesAndSparseDrawings() {
    PageRecord page =
        page()
            .images(List.of(new ImageRegion(new BoundingBox(0, 0, 50, 50), 50, 50)))
            .drawings(
                List.of(new DrawingCluster(new BoundingBox(100, 100, 500, 500), 3, false, true)))
            .build();

    assertThat(figureExtractor.extract(page, List.of(), DOC_ID)).isEmpty();
  }

  @Test
  @DisplayName("Should save crop and link nearest caption")
  void shouldSaveCropAndLinkNearestCaption() {
    BoundingBox chart = new BoundingBox(100, 100, 400, 300);
    PageRecord page = page().images(List.of(new ImageRegion(chart, 600, 400))).build();
    List<LayoutBlock> blocks =
        List.of(
            LayoutBlock.of(
                LayoutLabel.CAPTION, new BoundingBox(100, 700, 400, 720), "Source: IMF", 1),
            LayoutBlock.of(
                LayoutLabel.CAPTION,
                new BoundingBox(100, 310, 400, 330),
                "Figure 1: Real GDP growth",
                1));

    List<ExtractedFigure> figures = figureExtractor.extract(page, blocks, DOC_ID);

    assertThat(figures).hasSize(1);
    ExtractedFigure figure = figures.get(0);
    assertThat(figure.caption()).isEqualTo("Figure 1: Real GDP growth");
    assertThat(figure.imagePath()).isEqualTo("resources/0123456789abcdef/page_1_fig_1.png");
    assertThat(storageDir.resolve(figure.imagePath())).exists();
    assertThat(figure.imageBytes()).isNotEmpty();
  }

  @Test
  void shouldKeepIndexGap_whenCropTooSmall() {
    BoundingBox tiny = new BoundingBox(590, 790, 640, 840);
    BoundingBox chart = new BoundingBox(0, 0, 200, 200);
    PageRecord page =
        page()
            .images(List.of(new ImageRegion(tiny, 50, 50), new ImageRegion(chart, 200, 200)))
            .build();
    List<LayoutBlock> blocks = List.of(LayoutBlock.of(LayoutLabel.FIGURE, tiny, "", 1));

    List<ExtractedFigure> figures = figureExtractor.extract(page, blocks, DOC_ID);

    assertThat(figures).extracting(ExtractedFigure::index).containsExactly(2);
  }

  @Test
  void shouldReturnNothing_withoutRaster() {
    PageRecord page =
        page()
            .raster(null)
            .images(List.of(new ImageRegion(new BoundingBox(0, 0, 300, 300), 300, 300)))
            .build();

    assertThat(figureExtractor.extract(page, List.of(), DOC_ID)).isEmpty();
  }

  @Test
  void shouldKeepFirstCaption_onDistanceTie() {
    BoundingBox figure = new BoundingBox(100, 100, 200, 200);
    List<LayoutBlock> captions =
        List.of(
            LayoutBlock.of(LayoutLabel.CAPTION, new BoundingBox(100, 210, 200, 230), "below", 1),
            LayoutBlock.of(LayoutLabel.CAPTION, new BoundingBox(100, 70, 200, 90), "above", 1));

    assertThat(FigureExtractor.nearestCaption(figure, captions)).isEqualTo("below");
    assertThat(FigureExtractor.nearestCaption(figure, List.of())).isEmpty();
  }

  @Test
  void shouldWriteFilesUnderDocumentDirectory() throws Exception {
    PageRecord page =
        page()
            .images(
                List.of(
                    new ImageRegion(new BoundingBox(0, 0, 200, 200), 200, 200),
                    new ImageRegion(new BoundingBox(300, 300, 500, 500), 200, 200)))
            .build();

    figureExtractor.extract(page, List.of(), DOC_ID);

    Path figureDir = storageDir.resolve("resources").resolve("0123456789abcdef");
    try (Stream<Path> files = Files.list(figureDir)) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .containsExactlyInAnyOrder("page_1_fig_1.png", "page_1_fig_2.png");
    }
  }

  private static PageRecord.PageRecordBuilder page() {
    return PageRecord.builder()
        .pageNumber(1)
        .width(600)
        .height(800)
        .raster(TestRasters.whitePng(600, 800));
  }
}
