package com.flamingo.ai.reportingest.store;

import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import com.flamingo.ai.reportingest.domain.enums.BlockType;
import java.util.List;
import java.util.Set;

/**
 * Persistent, searchable chunk storage keyed by content hash.
 *
 * <p>Failures surface as {@link com.flamingo.ai.reportingest.exception.ChunkStoreException}.
 */
public interface ChunkStore {

  /**
   * Inserts or replaces chunks. Chunks sharing a content hash within the batch are stored once;
   * re-upserting an existing hash replaces the stored entry.
   *
   * @param chunks the chunks to store
   * @return the number of distinct chunks written
   */
  int upsert(List<Chunk> chunks);

  /** Whether any chunk of the document is stored. */
  boolean existsByDocumentId(String documentId);

  /**
   * Similarity search.
   *
   * @param query free text
   * @param k maximum number of hits
   * @param blockTypes restrict hits to these types; empty means all
   * @return hits ordered by descending score
   */
  List<ChunkSearchHit> search(String query, int k, Set<BlockType> blockTypes);

  void deleteByDocumentId(String documentId);
}
