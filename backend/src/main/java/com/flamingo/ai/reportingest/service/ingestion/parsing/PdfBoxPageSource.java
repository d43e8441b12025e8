package com.flamingo.ai.reportingest.service.ingestion.parsing;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.exception.DocumentProcessingException;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.ImageRegion;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.model.RulingLine;
import com.flamingo.ai.reportingest.service.ingestion.model.TextSpan;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

/**
 * {@link PageSource} backed by Apache PDFBox 3.x.
 *
 * <p>Per page it collects:
 *
 * <ul>
 *   <li><strong>Text spans</strong>: glyphs on one line sharing font and size, split at wide
 *       horizontal gaps so table cells stay separate.
 *   <li><strong>Images</strong>: placement of every image draw, from the CTM.
 *   <li><strong>Vector paths</strong>: painted path boxes for {@link DrawingClusterer}, and
 *       axis-aligned segments as ruling lines for table detection.
 *   <li><strong>Raster</strong>: the page rendered to PNG.
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PdfBoxPageSource implements PageSource {

  private static final double MIN_RULING_LENGTH = 10.0;

  private final IngestConfig ingestConfig;
  private final DrawingClusterer drawingClusterer;

  @Override
  public PageCursor open(Path file) throws IOException {
    PDDocument document = Loader.loadPDF(file.toFile());
    int total = document.getNumberOfPages();
    int maxPages = ingestConfig.getRender().getMaxPages();
    if (maxPages > 0) {
      total = Math.min(total, maxPages);
    }
    log.debug("Opened {} ({} pages to read)", file.getFileName(), total);
    return new PdfBoxPageCursor(document, file.getFileName().toString(), total);
  }

  private final class PdfBoxPageCursor implements PageCursor {

    private final PDDocument document;
    private final String fileName;
    private final int total;
    private final PDFRenderer renderer;
    private int nextIndex;

    PdfBoxPageCursor(PDDocument document, String fileName, int total) {
      this.document = document;
      this.fileName = fileName;
      this.total = total;
      this.renderer = new PDFRenderer(document);
    }

    @Override
    public int pageCount() {
      return total;
    }

    @Override
    public boolean hasNext() {
      return nextIndex < total;
    }

    @Override
    public PageRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int index = nextIndex++;
      try {
        return readPage(index);
      } catch (IOException e) {
        throw new DocumentProcessingException(
            fileName, "Failed to read page " + (index + 1) + " of " + fileName, e);
      }
    }

    @Override
    public void close() throws IOException {
      document.close();
    }

    private PageRecord readPage(int index) throws IOException {
      PDPage page = document.getPage(index);
      PDRectangle box = page.getMediaBox();
      int pageNumber = index + 1;

      SpanStripper stripper = new SpanStripper();
      stripper.setStartPage(pageNumber);
      stripper.setEndPage(pageNumber);
      String rawText = stripper.getText(document);

      GraphicsCollector graphics = new GraphicsCollector(page, box.getHeight());
      try {
        graphics.processPage(page);
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Could not read drawings and images on page {} of {}: {}",
            pageNumber,
            fileName,
            e.getMessage());
        graphics = new GraphicsCollector(page, box.getHeight());
      }

      IngestConfig.Figure figure = ingestConfig.getFigure();
      return PageRecord.builder()
          .pageNumber(pageNumber)
          .width(box.getWidth())
          .height(box.getHeight())
          .spans(stripper.getSpans())
          .images(graphics.images)
          .drawings(
              drawingClusterer.cluster(graphics.paths, figure.getMinPaths(), figure.getMergeGap()))
          .rulings(graphics.rulings)
          .rawText(rawText)
          .raster(render(index))
          .build();
    }

    private byte[] render(int index) {
      try {
        BufferedImage image =
            renderer.renderImageWithDPI(index, ingestConfig.getRender().getDpi(), ImageType.RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
      } catch (IOException | RuntimeException e) {
        log.warn("Could not render page {} of {}: {}", index + 1, fileName, e.getMessage());
        return null;
      }
    }
  }

  // ---- inner types ----

  /** Groups glyphs into spans during PDFTextStripper traversal. */
  static final class SpanStripper extends PDFTextStripper {

    private final List<TextSpan> spans = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private String fontName = "";
    private float fontSize;
    private float lastY = Float.NaN;
    private float lastRight;
    private double x0;
    private double y0;
    private double x1;
    private double y1;
    private boolean pendingSpace;

    SpanStripper() {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      for (TextPosition pos : textPositions) {
        String font = pos.getFont() != null && pos.getFont().getName() != null
            ? pos.getFont().getName()
            : "";
        float size = pos.getFontSizeInPt();
        float y = pos.getYDirAdj();
        float x = pos.getXDirAdj();
        boolean newLine = Float.isNaN(lastY) || Math.abs(y - lastY) > 2.0f;
        boolean fontChange = !font.equals(fontName) || Math.abs(size - fontSize) > 0.1f;
        boolean wideGap = !newLine && x - lastRight > Math.max(size, 1.0f) * 0.8f;
        if (newLine || fontChange || wideGap) {
          flushSpan();
          fontName = font;
          fontSize = size;
          lastY = y;
          x0 = x;
          y0 = y - pos.getHeightDir();
          x1 = x + pos.getWidthDirAdj();
          y1 = y;
        } else if (pendingSpace) {
          current.append(' ');
        }
        pendingSpace = false;
        current.append(pos.getUnicode());
        x0 = Math.min(x0, x);
        y0 = Math.min(y0, y - pos.getHeightDir());
        x1 = Math.max(x1, x + pos.getWidthDirAdj());
        y1 = Math.max(y1, y);
        lastRight = x + pos.getWidthDirAdj();
      }
      super.writeString(text, textPositions);
    }

    @Override
    protected void writeWordSeparator() throws IOException {
      pendingSpace = true;
      super.writeWordSeparator();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushSpan();
      lastY = Float.NaN;
      super.endPage(page);
    }

    private void flushSpan() {
      String text = current.toString().trim();
      if (!text.isEmpty()) {
        boolean bold = fontName.toLowerCase(Locale.ROOT).contains("bold");
        spans.add(new TextSpan(text, new BoundingBox(x0, y0, x1, y1), fontSize, fontName, bold));
      }
      current.setLength(0);
      pendingSpace = false;
    }

    List<TextSpan> getSpans() {
      return spans;
    }
  }

  /**
   * Records image placements, painted path boxes and ruling lines. PDF user space has its origin
   * at the bottom-left, so y values are flipped against the page height.
   */
  private static final class GraphicsCollector extends PDFGraphicsStreamEngine {

    private final float pageHeight;
    private final List<ImageRegion> images = new ArrayList<>();
    private final List<DrawingClusterer.PathBox> paths = new ArrayList<>();
    private final List<RulingLine> rulings = new ArrayList<>();

    private final List<double[]> segments = new ArrayList<>();
    private Point2D.Float currentPoint = new Point2D.Float();
    private Point2D.Float subpathStart = new Point2D.Float();
    private double minX = Double.MAX_VALUE;
    private double minY = Double.MAX_VALUE;
    private double maxX = -Double.MAX_VALUE;
    private double maxY = -Double.MAX_VALUE;

    GraphicsCollector(PDPage page, float pageHeight) {
      super(page);
      this.pageHeight = pageHeight;
    }

    @Override
    public void drawImage(PDImage pdImage) {
      Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
      double x = ctm.getTranslateX();
      double y = ctm.getTranslateY();
      double w = ctm.getScalingFactorX();
      double h = ctm.getScalingFactorY();
      BoundingBox bbox = new BoundingBox(x, pageHeight - (y + h), x + w, pageHeight - y);
      images.add(new ImageRegion(bbox, pdImage.getWidth(), pdImage.getHeight()));
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
      moveTo((float) p0.getX(), (float) p0.getY());
      lineTo((float) p1.getX(), (float) p1.getY());
      lineTo((float) p2.getX(), (float) p2.getY());
      lineTo((float) p3.getX(), (float) p3.getY());
      closePath();
    }

    @Override
    public void clip(int windingRule) {
      // clipping paths are not painted
    }

    @Override
    public void moveTo(float x, float y) {
      currentPoint = new Point2D.Float(x, y);
      subpathStart = currentPoint;
      extend(x, y);
    }

    @Override
    public void lineTo(float x, float y) {
      segments.add(new double[] {currentPoint.x, currentPoint.y, x, y});
      currentPoint = new Point2D.Float(x, y);
      extend(x, y);
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
      extend(x1, y1);
      extend(x2, y2);
      extend(x3, y3);
      currentPoint = new Point2D.Float(x3, y3);
    }

    @Override
    public Point2D getCurrentPoint() {
      return currentPoint;
    }

    @Override
    public void closePath() {
      if (!currentPoint.equals(subpathStart)) {
        lineTo(subpathStart.x, subpathStart.y);
      }
    }

    @Override
    public void endPath() {
      resetPath();
    }

    @Override
    public void strokePath() {
      paint(false, true);
    }

    @Override
    public void fillPath(int windingRule) {
      paint(true, false);
    }

    @Override
    public void fillAndStrokePath(int windingRule) {
      paint(true, true);
    }

    @Override
    public void shadingFill(COSName shadingName) {
      // shading fills carry no path geometry
    }

    private void extend(double x, double y) {
      minX = Math.min(minX, x);
      minY = Math.min(minY, y);
      maxX = Math.max(maxX, x);
      maxY = Math.max(maxY, y);
    }

    private void paint(boolean filled, boolean stroked) {
      if (minX > maxX) {
        resetPath();
        return;
      }
      BoundingBox bbox = new BoundingBox(minX, pageHeight - maxY, maxX, pageHeight - minY);
      boolean hairline =
          bbox.width() < DrawingClusterer.MIN_PATH_EXTENT
              || bbox.height() < DrawingClusterer.MIN_PATH_EXTENT;
      if (hairline) {
        addThinRuling(bbox);
      } else {
        paths.add(new DrawingClusterer.PathBox(bbox, filled, stroked));
        if (stroked) {
          addSegmentRulings();
        }
      }
      resetPath();
    }

    private void addThinRuling(BoundingBox bbox) {
      if (bbox.width() >= bbox.height() && bbox.width() >= MIN_RULING_LENGTH) {
        rulings.add(RulingLine.horizontal(bbox.centerY(), bbox.x0(), bbox.x1()));
      } else if (bbox.height() > bbox.width() && bbox.height() >= MIN_RULING_LENGTH) {
        rulings.add(RulingLine.vertical(bbox.centerX(), bbox.y0(), bbox.y1()));
      }
    }

    private void addSegmentRulings() {
      for (double[] s : segments) {
        double dx = Math.abs(s[2] - s[0]);
        double dy = Math.abs(s[3] - s[1]);
        if (dy < 1.0 && dx >= MIN_RULING_LENGTH) {
          rulings.add(RulingLine.horizontal(pageHeight - s[1], s[0], s[2]));
        } else if (dx < 1.0 && dy >= MIN_RULING_LENGTH) {
          rulings.add(RulingLine.vertical(s[0], pageHeight - s[1], pageHeight - s[3]));
        }
      }
    }

    private void resetPath() {
      segments.clear();
      minX = Double.MAX_VALUE;
      minY = Double.MAX_VALUE;
      maxX = -Double.MAX_VALUE;
      maxY = -Double.MAX_VALUE;
    }
  }
}
