package com.flamingo.ai.reportingest.service.ingestion.figure;

import com.flamingo.ai.reportingest.config.IngestConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Persists figure crops as {@code {resources-dir}/{docId[0..16]}/page_{n}_fig_{m}.png}.
 *
 * <p>Returned paths are relative to the storage root so stored chunks stay valid when the data
 * directory moves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FigureImageStorage {

  private static final int DOC_DIR_LENGTH = 16;

  private final IngestConfig ingestConfig;

  /**
   * Writes one crop.
   *
   * @return the path relative to the storage root, empty when the write failed
   */
  public Optional<String> save(String documentId, int pageNumber, int figureIndex, byte[] png) {
    String docDir =
        documentId.length() > DOC_DIR_LENGTH ? documentId.substring(0, DOC_DIR_LENGTH) : documentId;
    Path dir = Paths.get(ingestConfig.getPaths().getResourcesDir()).resolve(docDir);
    Path target = dir.resolve("page_" + pageNumber + "_fig_" + figureIndex + ".png");
    try {
      Files.createDirectories(dir);
      Files.write(target, png);
    } catch (IOException e) {
      log.warn("Failed to store figure {} of page {}: {}", figureIndex, pageNumber, e.getMessage());
      return Optional.empty();
    }
    Path storageRoot =
        Paths.get(ingestConfig.getPaths().getStorageDir()).toAbsolutePath().normalize();
    Path relative = storageRoot.relativize(target.toAbsolutePath().normalize());
    log.debug("Stored figure crop {} ({} bytes)", relative, png.length);
    return Optional.of(relative.toString().replace('\\', '/'));
  }
}
