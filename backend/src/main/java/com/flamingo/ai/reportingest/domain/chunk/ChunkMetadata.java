package com.flamingo.ai.reportingest.domain.chunk;

import com.flamingo.ai.reportingest.domain.enums.BlockType;
import lombok.Builder;

/**
 * Provenance shared by every chunk variant.
 *
 * @param documentId SHA-256 of the source file
 * @param sectionHeading heading in effect when the chunk was created, may be empty
 * @param exhibitLabel e.g. "Table 2 (p.4)", empty for text
 * @param contentHash SHA-256 of the chunk's canonical text; the storage identity
 * @param createdAt UTC ISO-8601 timestamp
 */
@Builder(toBuilder = true)
public record ChunkMetadata(
    String documentId,
    String sourceFile,
    int pageNumber,
    BlockType blockType,
    String sectionHeading,
    String exhibitLabel,
    String contentHash,
    String createdAt) {

  public ChunkMetadata {
    sectionHeading = sectionHeading == null ? "" : sectionHeading;
    exhibitLabel = exhibitLabel == null ? "" : exhibitLabel;
  }
}
