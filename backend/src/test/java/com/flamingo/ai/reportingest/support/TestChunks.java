package com.flamingo.ai.reportingest.support;

import com.flamingo.ai.reportingest.domain.chunk.ChunkMetadata;
import com.flamingo.ai.reportingest.domain.chunk.FigureChunk;
import com.flamingo.ai.reportingest.domain.chunk.TableChunk;
import com.flamingo.ai.reportingest.domain.chunk.TextChunk;
import com.flamingo.ai.reportingest.domain.enums.BlockType;
import com.flamingo.ai.reportingest.domain.enums.FigureType;
import com.flamingo.ai.reportingest.service.ingestion.chunking.ContentHasher;

/** Chunk factories for gate and store tests. */
public final class TestChunks {

  private TestChunks() {}

  public static TextChunk text(String text) {
    return new TextChunk(metadata(BlockType.TEXT, "", text), text);
  }

  public static TableChunk table(String markdown) {
    return new TableChunk(
        metadata(BlockType.TABLE, "Table 1 (p.1)", markdown), markdown, "", null);
  }

  public static FigureChunk figure(String caption, String description, String ocrText) {
    String representation = (caption + " " + description + " " + ocrText).trim();
    return new FigureChunk(
        metadata(BlockType.FIGURE, "Figure 1 (p.1)", representation),
        caption,
        ocrText,
        description,
        FigureType.UNKNOWN,
        null,
        "",
        representation);
  }

  public static ChunkMetadata metadata(BlockType type, String exhibit, String canonicalText) {
    return ChunkMetadata.builder()
        .documentId("doc-1")
        .sourceFile("report.pdf")
        .pageNumber(1)
        .blockType(type)
        .exhibitLabel(exhibit)
        .contentHash(ContentHasher.hashText(canonicalText))
        .createdAt("2024-01-01T00:00:00Z")
        .build();
  }
}
