package com.flamingo.ai.reportingest.domain.chunk;

/** Table rendered as markdown and CSV; summary may be null. */
public record TableChunk(ChunkMetadata metadata, String markdown, String csv, String summary)
    implements Chunk {

  @Override
  public String canonicalText() {
    return canonicalText(markdown, summary);
  }

  public static String canonicalText(String markdown, String summary) {
    if (summary == null || summary.isBlank()) {
      return markdown;
    }
    return markdown + "\nSummary: " + summary;
  }
}
