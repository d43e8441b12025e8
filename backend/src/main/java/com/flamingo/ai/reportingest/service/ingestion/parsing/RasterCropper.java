package com.flamingo.ai.reportingest.service.ingestion.parsing;

import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Cuts regions given in PDF points out of a page raster rendered at a known dpi. */
@Component
@Slf4j
public class RasterCropper {

  private static final double POINTS_PER_INCH = 72.0;

  /**
   * Crops a region.
   *
   * @param png the page raster
   * @param bbox region in points
   * @param dpi resolution the raster was rendered at
   * @param minPx crops narrower or shorter than this are discarded
   * @return the crop as PNG, empty when too small or the raster is unreadable
   */
  public Optional<byte[]> crop(byte[] png, BoundingBox bbox, int dpi, int minPx) {
    if (png == null || png.length == 0) {
      return Optional.empty();
    }
    try {
      BufferedImage page = ImageIO.read(new ByteArrayInputStream(png));
      if (page == null) {
        return Optional.empty();
      }
      BoundingBox px = bbox.scale(dpi / POINTS_PER_INCH);
      int x0 = clamp((int) Math.floor(px.x0()), page.getWidth());
      int y0 = clamp((int) Math.floor(px.y0()), page.getHeight());
      int x1 = clamp((int) Math.ceil(px.x1()), page.getWidth());
      int y1 = clamp((int) Math.ceil(px.y1()), page.getHeight());
      if (x1 - x0 < minPx || y1 - y0 < minPx || x1 <= x0 || y1 <= y0) {
        return Optional.empty();
      }
      BufferedImage region = page.getSubimage(x0, y0, x1 - x0, y1 - y0);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(region, "png", out);
      return Optional.of(out.toByteArray());
    } catch (IOException e) {
      log.warn("Could not crop region {}: {}", bbox, e.getMessage());
      return Optional.empty();
    }
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(value, max));
  }
}
