package com.flamingo.ai.reportingest.domain.chunk;

import com.flamingo.ai.reportingest.domain.enums.BlockType;

/** A retrievable unit of a document. */
public interface Chunk {

  ChunkMetadata metadata();

  /** Text the content hash is computed from; also the text embedded and stored. */
  String canonicalText();

  default String contentHash() {
    return metadata().contentHash();
  }

  default BlockType blockType() {
    return metadata().blockType();
  }

  default Citation citation() {
    ChunkMetadata m = metadata();
    return new Citation(m.sourceFile(), m.pageNumber(), m.exhibitLabel());
  }
}
