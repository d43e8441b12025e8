package com.flamingo.ai.reportingest.service.ingestion.quality;

import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import java.util.List;

/** Partition of a chunk list by the quality gate; both lists keep input order. */
public record QualityReport(List<Chunk> accepted, List<Rejection> rejected) {

  public QualityReport {
    accepted = List.copyOf(accepted);
    rejected = List.copyOf(rejected);
  }

  /** A rejected chunk and the reason it failed. */
  public record Rejection(Chunk chunk, String reason) {}

  public List<Chunk> rejectedChunks() {
    return rejected.stream().map(Rejection::chunk).toList();
  }
}
