package com.flamingo.ai.reportingest.service.ingestion.chunking;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import com.flamingo.ai.reportingest.domain.chunk.ChunkMetadata;
import com.flamingo.ai.reportingest.domain.chunk.FigureChunk;
import com.flamingo.ai.reportingest.domain.chunk.TableChunk;
import com.flamingo.ai.reportingest.domain.chunk.TextChunk;
import com.flamingo.ai.reportingest.domain.enums.BlockType;
import com.flamingo.ai.reportingest.domain.enums.LayoutLabel;
import com.flamingo.ai.reportingest.service.ingestion.layout.LayoutSegmenter;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedFigure;
import com.flamingo.ai.reportingest.service.ingestion.model.ExtractedTable;
import com.flamingo.ai.reportingest.service.ingestion.model.FigureAnalysis;
import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts page content into chunks.
 *
 * <p>Prose is rebuilt into one string per page with {@code "\n## heading\n"} markers and cut into
 * fixed windows that overlap by the configured amount. Tables and figures become one chunk each;
 * an optional page overview chunk carries the page's raw text.
 */
@Component
@Slf4j
public class Chunker {

  private static final String PAGE_SUMMARY_PREFIX = "[Page %d overview] ";

  private final IngestConfig ingestConfig;
  private final Clock clock;

  @Autowired
  public Chunker(IngestConfig ingestConfig) {
    this(ingestConfig, Clock.systemUTC());
  }

  Chunker(IngestConfig ingestConfig, Clock clock) {
    this.ingestConfig = ingestConfig;
    this.clock = clock;
  }

  /**
   * Chunks one page.
   *
   * @param doc the document the page belongs to
   * @param content the page's blocks, tables and analysed figures
   * @param inheritedSection section in effect at the top of the page
   * @return text chunks, then the page overview, then tables, then figures
   */
  public List<Chunk> chunkPage(DocumentRef doc, PageContent content, String inheritedSection) {
    String createdAt = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));
    int pageNumber = content.page().pageNumber();
    String pageSection = LayoutSegmenter.updateSection(inheritedSection, content.blocks());

    List<Chunk> chunks = new ArrayList<>();
    chunks.addAll(chunkText(doc, pageNumber, content.blocks(), inheritedSection, createdAt));
    if (ingestConfig.getChunking().isIncludePageSummary()) {
      pageSummary(doc, pageNumber, content.page().rawText(), pageSection, createdAt)
          .ifPresent(chunks::add);
    }
    chunks.addAll(chunkTables(doc, content.tables(), pageSection, createdAt));
    for (int i = 0; i < content.figures().size(); i++) {
      chunks.add(
          chunkFigure(
              doc, content.figures().get(i), content.analyses().get(i), pageSection, createdAt));
    }
    log.debug("Page {} of {}: {} chunks", pageNumber, doc.sourceFile(), chunks.size());
    return chunks;
  }

  List<TextChunk> chunkText(
      DocumentRef doc,
      int pageNumber,
      List<LayoutBlock> blocks,
      String inheritedSection,
      String createdAt) {
    StringBuilder sb = new StringBuilder();
    List<Integer> markerOffsets = new ArrayList<>();
    List<String> markerHeadings = new ArrayList<>();
    for (LayoutBlock block : blocks) {
      if (block.label() == LayoutLabel.HEADING) {
        markerOffsets.add(sb.length());
        markerHeadings.add(block.text());
        sb.append("\n## ").append(block.text()).append('\n');
      } else if (block.label() == LayoutLabel.PARAGRAPH
          || block.label() == LayoutLabel.FOOTNOTE) {
        sb.append(block.text()).append(' ');
      }
    }

    String raw = sb.toString();
    String fullText = raw.trim();
    if (fullText.isEmpty()) {
      return List.of();
    }
    int leading = raw.indexOf(fullText);

    IngestConfig.Chunking config = ingestConfig.getChunking();
    int size = config.getTextChunkSize();
    int overlap = config.getTextChunkOverlap();
    if (size <= overlap) {
      throw new IllegalArgumentException(
          "text-chunk-size (" + size + ") must exceed text-chunk-overlap (" + overlap + ")");
    }
    int minLength = ingestConfig.getQuality().getMinChunkLength();

    List<TextChunk> chunks = new ArrayList<>();
    for (int start = 0; start < fullText.length(); start += size - overlap) {
      String window = fullText.substring(start, Math.min(start + size, fullText.length())).trim();
      if (window.length() < minLength) {
        continue;
      }
      String section = inheritedSection;
      for (int m = 0; m < markerOffsets.size(); m++) {
        if (Math.max(0, markerOffsets.get(m) - leading) <= start) {
          section = markerHeadings.get(m);
        }
      }
      chunks.add(
          new TextChunk(
              metadata(doc, pageNumber, BlockType.TEXT, section, "", window, createdAt),
              window));
    }
    return chunks;
  }

  Optional<TextChunk> pageSummary(
      DocumentRef doc, int pageNumber, String rawText, String section, String createdAt) {
    String body = rawText == null ? "" : rawText.trim();
    if (body.length() < ingestConfig.getQuality().getMinChunkLength()) {
      return Optional.empty();
    }
    String text = String.format(PAGE_SUMMARY_PREFIX, pageNumber) + body;
    int max = ingestConfig.getChunking().getPageSummaryMaxChars();
    if (text.length() > max) {
      text = text.substring(0, max);
    }
    return Optional.of(
        new TextChunk(
            metadata(doc, pageNumber, BlockType.PAGE_SUMMARY, section, "", text, createdAt),
            text));
  }

  List<TableChunk> chunkTables(
      DocumentRef doc, List<ExtractedTable> tables, String section, String createdAt) {
    List<TableChunk> chunks = new ArrayList<>();
    int n = 0;
    for (ExtractedTable table : tables) {
      n++;
      if (table.markdown() == null || table.markdown().isBlank()) {
        continue;
      }
      String exhibit = "Table " + n + " (p." + table.pageNumber() + ")";
      String canonical = TableChunk.canonicalText(table.markdown(), null);
      chunks.add(
          new TableChunk(
              metadata(
                  doc,
                  table.pageNumber(),
                  BlockType.TABLE,
                  section,
                  exhibit,
                  canonical,
                  createdAt),
              table.markdown(),
              table.csv(),
              null));
    }
    return chunks;
  }

  FigureChunk chunkFigure(
      DocumentRef doc,
      ExtractedFigure figure,
      FigureAnalysis analysis,
      String section,
      String createdAt) {
    String exhibit = "Figure " + figure.index() + " (p." + figure.pageNumber() + ")";
    String representation =
        Stream.of(figure.caption(), analysis.description(), analysis.ocrText())
            .filter(s -> s != null && !s.isBlank())
            .map(String::trim)
            .collect(Collectors.joining(" "));
    if (representation.length() < ingestConfig.getQuality().getMinChunkLength()) {
      representation = "Figure from " + doc.sourceFile() + " page " + figure.pageNumber();
    }
    return new FigureChunk(
        metadata(
            doc,
            figure.pageNumber(),
            BlockType.FIGURE,
            section,
            exhibit,
            representation,
            createdAt),
        figure.caption(),
        analysis.ocrText(),
        analysis.description(),
        analysis.figureType(),
        analysis.seriesData(),
        figure.imagePath(),
        representation);
  }

  private static ChunkMetadata metadata(
      DocumentRef doc,
      int pageNumber,
      BlockType blockType,
      String section,
      String exhibit,
      String canonicalText,
      String createdAt) {
    return ChunkMetadata.builder()
        .documentId(doc.documentId())
        .sourceFile(doc.sourceFile())
        .pageNumber(pageNumber)
        .blockType(blockType)
        .sectionHeading(section)
        .exhibitLabel(exhibit)
        .contentHash(ContentHasher.hashText(canonicalText))
        .createdAt(createdAt)
        .build();
  }
}
