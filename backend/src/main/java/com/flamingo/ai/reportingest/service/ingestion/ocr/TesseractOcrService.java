package com.flamingo.ai.reportingest.service.ingestion.ocr;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;

/**
 * Word-level OCR through Tess4J.
 *
 * <p>Tesseract instances are not thread-safe, so each worker thread gets its own.
 */
@Slf4j
public class TesseractOcrService implements OcrService {

  private final ThreadLocal<Tesseract> tesseract;

  public TesseractOcrService(IngestConfig.Ocr config) {
    this.tesseract = ThreadLocal.withInitial(() -> createTesseract(config));
  }

  @Override
  public List<OcrBox> recognize(byte[] png, double confidenceThreshold) {
    if (png == null || png.length == 0) {
      return List.of();
    }
    BufferedImage image = decode(png);
    if (image == null) {
      log.warn("OCR input is not a decodable image ({} bytes)", png.length);
      return List.of();
    }
    List<Word> words = tesseract.get().getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
    return words.stream()
        .filter(w -> w.getText() != null && !w.getText().isBlank())
        .map(TesseractOcrService::toBox)
        .filter(b -> b.confidence() >= confidenceThreshold)
        .sorted(OcrBox.READING_ORDER)
        .toList();
  }

  private static OcrBox toBox(Word word) {
    Rectangle r = word.getBoundingBox();
    BoundingBox bbox = new BoundingBox(r.x, r.y, r.x + r.width, r.y + r.height);
    return new OcrBox(word.getText().trim(), word.getConfidence() / 100.0, bbox);
  }

  private static BufferedImage decode(byte[] png) {
    try {
      return ImageIO.read(new ByteArrayInputStream(png));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode OCR input", e);
    }
  }

  private static Tesseract createTesseract(IngestConfig.Ocr config) {
    Tesseract tess = new Tesseract();
    tess.setPageSegMode(3);
    tess.setOcrEngineMode(3);
    if (config.getDataPath() != null && !config.getDataPath().isBlank()) {
      tess.setDatapath(config.getDataPath());
    }
    tess.setLanguage(config.getLanguage());
    log.debug("Tesseract instance created for thread: {}", Thread.currentThread().getName());
    return tess;
  }
}
