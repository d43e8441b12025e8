package com.flamingo.ai.reportingest.config;

import com.flamingo.ai.reportingest.service.ingestion.IngestionPipelineService;
import com.flamingo.ai.reportingest.service.ingestion.model.IngestionStats;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ingests the configured PDF folder once on startup.
 *
 * <p>Enabled with {@code ingest.run-on-startup=true}; pass {@code --force} to re-ingest documents
 * that are already stored.
 */
@Component
@ConditionalOnProperty(name = "ingest.run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements ApplicationRunner {

  private final IngestionPipelineService ingestionPipelineService;
  private final IngestConfig ingestConfig;

  @Override
  public void run(ApplicationArguments args) {
    boolean force = args.containsOption("force");
    Path pdfDir = Path.of(ingestConfig.getPaths().getPdfDir());
    log.info("Startup ingestion of {} (force={})", pdfDir.toAbsolutePath(), force);

    IngestionStats stats = ingestionPipelineService.ingestFolder(pdfDir, force);
    log.info(
        "Startup ingestion done: {} processed, {} skipped, {} failed, {} chunks stored in {}",
        stats.getFilesProcessed(),
        stats.getFilesSkipped(),
        stats.getFilesFailed(),
        stats.getChunksStored(),
        stats.getElapsed());
  }
}
