package com.flamingo.ai.reportingest.domain.chunk;

/** Prose window or page overview ({@code TEXT} or {@code PAGE_SUMMARY}). */
public record TextChunk(ChunkMetadata metadata, String text) implements Chunk {

  @Override
  public String canonicalText() {
    return text;
  }
}
