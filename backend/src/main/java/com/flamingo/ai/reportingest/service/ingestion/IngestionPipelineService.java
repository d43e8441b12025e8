package com.flamingo.ai.reportingest.service.ingestion;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import com.flamingo.ai.reportingest.domain.enums.IngestionState;
import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;
import com.flamingo.ai.reportingest.exception.ChunkStoreException;
import com.flamingo.ai.reportingest.exception.DocumentProcessingException;
import com.flamingo.ai.reportingest.exception.IngestionCancelledException;
import com.flamingo.ai.reportingest.service.ingestion.chart.FigureAnalyzer;
import com.flamingo.ai.reportingest.service.ingestion.chunking.Chunker;
import com.flamingo.ai.reportingest.service.ingestion.chunking.ContentHasher;
import com.flamingo.ai.reportingest.service.ingestion.chunking.DocumentRef;
import com.flamingo.ai.reportingest.service.ingestion.chunking.PageContent;
import com.flamingo.ai.reportingest.service.ingestion.figure.FigureExtractor;
import com.flamingo.ai.reportingest.service.ingestion.layout.LayoutSegmenter;
import com.flamingo.ai.reportingest.service.ingestion.model.DocumentIngestionResult;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedTable;
import com.flamingo.ai.reportingest.service.ingestion.model.FigureAnalysis;
import com.flamingo.ai.reportingest.service.ingestion.model.IngestionStats;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrBox;
import com.flamingo.ai.reportingest.service.ingestion.ocr.OcrService;
import com.flamingo.ai.reportingest.service.ingestion.parsing.PageCursor;
import com.flamingo.ai.reportingest.service.ingestion.parsing.PageSource;
import com.flamingo.ai.reportingest.service.ingestion.quality.QualityGate;
import com.flamingo.ai.reportingest.service.ingestion.quality.QualityReport;
import com.flamingo.ai.reportingest.service.ingestion.table.TableExtractor;
import com.flamingo.ai.reportingest.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives documents through the ingestion stages: page parsing, layout segmentation, table and
 * figure extraction, figure analysis, chunking, quality gating and a single store upsert per
 * document.
 *
 * <p>Pages of one document are processed in order because the running section heading is carried
 * from page to page. Folder runs process different documents in parallel on the ingestion
 * executor; the {@link KnownDocumentRegistry} keeps two workers from ingesting the same file.
 */
@Service
@Slf4j
public class IngestionPipelineService {

  private static final Set<LayoutLabel> TEXT_LAYER_LABELS =
      EnumSet.of(
          LayoutLabel.HEADING,
          LayoutLabel.PARAGRAPH,
          LayoutLabel.CAPTION,
          LayoutLabel.FOOTNOTE,
          LayoutLabel.HEADER,
          LayoutLabel.FOOTER);

  private final PageSource pageSource;
  private final LayoutSegmenter layoutSegmenter;
  private final TableExtractor tableExtractor;
  private final FigureExtractor figureExtractor;
  private final FigureAnalyzer figureAnalyzer;
  private final Chunker chunker;
  private final QualityGate qualityGate;
  private final ChunkStore chunkStore;
  private final KnownDocumentRegistry knownDocumentRegistry;
  private final OcrService ocrService;
  private final CollaboratorInvoker collaboratorInvoker;
  private final Executor ingestionExecutor;
  private final MeterRegistry meterRegistry;
  private final IngestConfig ingestConfig;

  private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

  public IngestionPipelineService(
      PageSource pageSource,
      LayoutSegmenter layoutSegmenter,
      TableExtractor tableExtractor,
      FigureExtractor figureExtractor,
      FigureAnalyzer figureAnalyzer,
      Chunker chunker,
      QualityGate qualityGate,
      ChunkStore chunkStore,
      KnownDocumentRegistry knownDocumentRegistry,
      OcrService ocrService,
      CollaboratorInvoker collaboratorInvoker,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor,
      MeterRegistry meterRegistry,
      IngestConfig ingestConfig) {
    this.pageSource = pageSource;
    this.layoutSegmenter = layoutSegmenter;
    this.tableExtractor = tableExtractor;
    this.figureExtractor = figureExtractor;
    this.figureAnalyzer = figureAnalyzer;
    this.chunker = chunker;
    this.qualityGate = qualityGate;
    this.chunkStore = chunkStore;
    this.knownDocumentRegistry = knownDocumentRegistry;
    this.ocrService = ocrService;
    this.collaboratorInvoker = collaboratorInvoker;
    this.ingestionExecutor = ingestionExecutor;
    this.meterRegistry = meterRegistry;
    this.ingestConfig = ingestConfig;
  }

  /**
   * Ingests every PDF directly inside {@code folder}, one task per file on the ingestion executor.
   * A failing document is recorded and does not stop the others.
   *
   * @param folder directory to scan
   * @param force re-ingest documents that are already stored
   * @return counters merged over all documents, elapsed set to the wall-clock time of the run
   */
  @Timed(value = "ingest.folder", description = "Time to ingest a folder of reports")
  public IngestionStats ingestFolder(Path folder, boolean force) {
    long start = System.nanoTime();
    List<Path> pdfs = listPdfs(folder);
    log.info("Ingesting {} PDF(s) from {} (force={})", pdfs.size(), folder, force);

    List<CompletableFuture<DocumentIngestionResult>> futures =
        pdfs.stream().map(pdf -> submit(pdf, force)).toList();

    IngestionStats total = new IngestionStats();
    for (CompletableFuture<DocumentIngestionResult> future : futures) {
      DocumentIngestionResult result = future.join();
      total.merge(result.stats());
      log.info(
          "{}: {}{}",
          result.fileName(),
          result.state(),
          result.errorMessage() != null ? " (" + result.errorMessage() + ")" : "");
    }
    total.setElapsed(Duration.ofNanos(System.nanoTime() - start));
    log.info("Folder run finished: {}", total);
    return total;
  }

  private CompletableFuture<DocumentIngestionResult> submit(Path pdf, boolean force) {
    try {
      return CompletableFuture.supplyAsync(() -> ingestFileSafely(pdf, force), ingestionExecutor);
    } catch (RejectedExecutionException e) {
      log.error("Ingestion executor rejected {}: {}", pdf, e.getMessage());
      meterRegistry.counter("ingest.document.failure").increment();
      IngestionStats stats = new IngestionStats();
      stats.fileFailed();
      return CompletableFuture.completedFuture(
          DocumentIngestionResult.failed(
              pdf.getFileName().toString(),
              null,
              stats,
              "Not scheduled: " + e.getMessage()));
    }
  }

  /**
   * Ingests one PDF.
   *
   * @param file the PDF
   * @param force re-ingest even when the document is already stored
   * @return the outcome; {@code FAILED} when the file does not exist
   * @throws DocumentProcessingException when the file cannot be parsed or the store rejects the
   *     upsert
   */
  @Timed(value = "ingest.document", description = "Time to ingest one report")
  public DocumentIngestionResult ingestFile(Path file, boolean force) {
    long start = System.nanoTime();
    String fileName = file.getFileName().toString();
    IngestionStats stats = new IngestionStats();

    if (!Files.isRegularFile(file)) {
      log.error("File not found: {}", file);
      return fail(fileName, null, stats, start, "File not found: " + file);
    }

    String documentId;
    try {
      documentId = ContentHasher.hashFile(file);
    } catch (IOException e) {
      log.error("Failed to hash {}: {}", file, e.getMessage());
      return fail(fileName, null, stats, start, "Unreadable file: " + e.getMessage());
    }

    StateTracker state = new StateTracker(documentId);
    boolean reserved;
    try {
      reserved = knownDocumentRegistry.tryReserve(documentId, force);
    } catch (ChunkStoreException e) {
      meterRegistry.counter("ingest.document.failure").increment();
      throw new DocumentProcessingException(
          documentId, "Known-document lookup failed for " + fileName, e);
    }
    if (!reserved) {
      state.moveTo(IngestionState.SKIPPED);
      stats.fileSkipped();
      stats.setElapsed(Duration.ofNanos(System.nanoTime() - start));
      meterRegistry.counter("ingest.document.skipped").increment();
      log.info("Skipping {} (document {} already ingested)", fileName, documentId);
      return new DocumentIngestionResult(fileName, documentId, state.current(), stats, null);
    }

    log.info("Ingesting {} (document {})", fileName, documentId);
    try {
      process(file, new DocumentRef(documentId, fileName), state, stats);
      knownDocumentRegistry.markIngested(documentId);
      stats.fileProcessed();
      stats.setElapsed(Duration.ofNanos(System.nanoTime() - start));
      meterRegistry.counter("ingest.document.success").increment();
      log.info("Ingested {}: {}", fileName, stats);
      return new DocumentIngestionResult(fileName, documentId, state.current(), stats, null);
    } catch (IngestionCancelledException e) {
      state.moveTo(IngestionState.CANCELLED);
      stats.setElapsed(Duration.ofNanos(System.nanoTime() - start));
      log.warn("Ingestion of {} cancelled after {} page(s)", fileName, stats.getPagesProcessed());
      return new DocumentIngestionResult(
          fileName, documentId, state.current(), stats, e.getMessage());
    } catch (ChunkStoreException e) {
      meterRegistry.counter("ingest.document.failure").increment();
      log.error("Store upsert failed for {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(
          documentId, "Failed to store chunks of " + fileName, e);
    } catch (DocumentProcessingException e) {
      meterRegistry.counter("ingest.document.failure").increment();
      log.error("Failed to process {}: {}", fileName, e.getMessage());
      if (!documentId.equals(e.getDocumentId())) {
        throw new DocumentProcessingException(documentId, e.getMessage(), e);
      }
      throw e;
    } catch (IOException e) {
      meterRegistry.counter("ingest.document.failure").increment();
      log.error("Failed to open {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(documentId, "Failed to parse " + fileName, e);
    } finally {
      knownDocumentRegistry.release(documentId);
      cancelRequests.remove(documentId);
    }
  }

  /**
   * Requests cancellation of a running document; it stops before its next page. Requests for
   * documents that are not being ingested are ignored.
   *
   * @return true when the request was recorded
   */
  public boolean cancel(String documentId) {
    cancelRequests.add(documentId);
    // re-checked after the add: a run finishing in between has already cleared its requests
    if (!knownDocumentRegistry.isInFlight(documentId)) {
      cancelRequests.remove(documentId);
      log.info("Ignoring cancellation of document {}: not being ingested", documentId);
      return false;
    }
    log.info("Cancellation requested for document {}", documentId);
    return true;
  }

  private void process(Path file, DocumentRef doc, StateTracker state, IngestionStats stats)
      throws IOException {
    List<Chunk> chunks = new ArrayList<>();
    String section = "";

    try (PageCursor cursor = pageSource.open(file)) {
      while (cursor.hasNext()) {
        checkCancelled(doc.documentId());
        PageRecord page = cursor.next();
        state.moveTo(IngestionState.PARSED);

        List<LayoutBlock> blocks = layoutSegmenter.segment(page);
        if (!page.hasTextLayer() && page.hasRaster()) {
          blocks = replaceTextLayerWithOcr(page, blocks);
        }
        blocks = layoutSegmenter.groupParagraphs(blocks);
        state.moveTo(IngestionState.SEGMENTED);

        List<ExtractedTable> tables = tableExtractor.extract(page, blocks);
        List<ExtractedFigure> figures = figureExtractor.extract(page, blocks, doc.documentId());
        List<FigureAnalysis> analyses = figures.stream().map(figureAnalyzer::analyze).toList();
        state.moveTo(IngestionState.EXTRACTED);

        PageContent content =
            new PageContent(page.withoutRaster(), blocks, tables, figures, analyses);
        chunks.addAll(chunker.chunkPage(doc, content, section));
        section = LayoutSegmenter.updateSection(section, blocks);
        state.moveTo(IngestionState.CHUNKED);
        stats.pageProcessed();
      }
    }

    QualityReport report = qualityGate.filter(chunks);
    state.moveTo(IngestionState.FILTERED);
    List<Chunk> accepted =
        ingestConfig.getQuality().isDedupEnabled()
            ? distinctByContentHash(report.accepted())
            : report.accepted();
    int rejected = report.rejected().size();
    stats.addRejected(rejected);
    meterRegistry.counter("ingest.chunks.rejected").increment(rejected);
    log.debug(
        "{}: {} chunks built, {} accepted, {} rejected, {} duplicates dropped",
        doc.sourceFile(),
        chunks.size(),
        report.accepted().size(),
        rejected,
        report.accepted().size() - accepted.size());

    checkCancelled(doc.documentId());
    int stored = chunkStore.upsert(accepted);
    state.moveTo(IngestionState.STORED);

    for (Chunk chunk : accepted) {
      switch (chunk.blockType()) {
        case TABLE -> stats.addTableChunks(1);
        case FIGURE -> stats.addFigureChunks(1);
        default -> stats.addTextChunks(1);
      }
    }
    stats.addStored(stored);
  }

  /** Drops span-derived blocks and adds one paragraph holding the page's OCR text. */
  private List<LayoutBlock> replaceTextLayerWithOcr(PageRecord page, List<LayoutBlock> blocks) {
    double threshold = ingestConfig.getOcr().getConfidenceThreshold();
    List<OcrBox> boxes =
        collaboratorInvoker.invoke(
            "ocr", () -> ocrService.recognize(page.raster(), threshold), List.of());
    String text = OcrService.joinText(boxes);

    List<LayoutBlock> result = new ArrayList<>();
    for (LayoutBlock block : blocks) {
      if (!TEXT_LAYER_LABELS.contains(block.label())) {
        result.add(block);
      }
    }
    if (!text.isBlank()) {
      result.add(
          0,
          LayoutBlock.of(
              LayoutLabel.PARAGRAPH, LayoutSegmenter.pageBox(page), text, page.pageNumber()));
    }
    log.debug(
        "Page {} has no text layer; OCR recovered {} characters", page.pageNumber(), text.length());
    return result;
  }

  private void checkCancelled(String documentId) {
    if (cancelRequests.contains(documentId)) {
      throw new IngestionCancelledException(documentId);
    }
  }

  private DocumentIngestionResult ingestFileSafely(Path file, boolean force) {
    try {
      return ingestFile(file, force);
    } catch (DocumentProcessingException e) {
      IngestionStats stats = new IngestionStats();
      stats.fileFailed();
      return DocumentIngestionResult.failed(
          file.getFileName().toString(), e.getDocumentId(), stats, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error ingesting {}", file, e);
      IngestionStats stats = new IngestionStats();
      stats.fileFailed();
      return DocumentIngestionResult.failed(
          file.getFileName().toString(), null, stats, e.getMessage());
    }
  }

  private DocumentIngestionResult fail(
      String fileName, String documentId, IngestionStats stats, long start, String message) {
    stats.fileFailed();
    stats.setElapsed(Duration.ofNanos(System.nanoTime() - start));
    meterRegistry.counter("ingest.document.failure").increment();
    return DocumentIngestionResult.failed(fileName, documentId, stats, message);
  }

  static List<Chunk> distinctByContentHash(List<Chunk> chunks) {
    Map<String, Chunk> byHash = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      byHash.putIfAbsent(chunk.contentHash(), chunk);
    }
    return new ArrayList<>(byHash.values());
  }

  private static List<Path> listPdfs(Path folder) {
    if (!Files.isDirectory(folder)) {
      log.error("PDF folder not found: {}", folder);
      return List.of();
    }
    try (Stream<Path> files = Files.list(folder)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new DocumentProcessingException(folder.toString(), "Failed to list " + folder, e);
    }
  }

  /** Current state of one document run; rejects transitions the state machine does not allow. */
  static final class StateTracker {

    private final String documentId;
    private IngestionState current = IngestionState.NEW;

    StateTracker(String documentId) {
      this.documentId = documentId;
    }

    void moveTo(IngestionState next) {
      if (!current.canTransitionTo(next)) {
        throw new IllegalStateException(
            "Illegal transition " + current + " -> " + next + " for document " + documentId);
      }
      current = next;
    }

    IngestionState current() {
      return current;
    }
  }
}
