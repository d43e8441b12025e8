package com.flamingo.ai.reportingest.support;

import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import com.flamingo.ai.reportingest.domain.enums.BlockType;
import com.flamingo.ai.reportingest.exception.ChunkStoreException;
import com.flamingo.ai.reportingest.store.ChunkSearchHit;
import com.flamingo.ai.reportingest.store.ChunkStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link ChunkStore} keeping chunks in memory, keyed by content hash. */
public class InMemoryChunkStore implements ChunkStore {

  private final Map<String, Chunk> chunks = new LinkedHashMap<>();
  private final AtomicInteger upsertCalls = new AtomicInteger();
  private volatile boolean failUpserts;

  @Override
  public synchronized int upsert(List<Chunk> batch) {
    upsertCalls.incrementAndGet();
    if (failUpserts) {
      throw new ChunkStoreException("Store unavailable");
    }
    Map<String, Chunk> distinct = new LinkedHashMap<>();
    batch.forEach(c -> distinct.putIfAbsent(c.contentHash(), c));
    chunks.putAll(distinct);
    return distinct.size();
  }

  @Override
  public synchronized boolean existsByDocumentId(String documentId) {
    return chunks.values().stream().anyMatch(c -> c.metadata().documentId().equals(documentId));
  }

  @Override
  public synchronized List<ChunkSearchHit> search(String query, int k, Set<BlockType> blockTypes) {
    String needle = query.toLowerCase(Locale.ROOT);
    List<ChunkSearchHit> hits = new ArrayList<>();
    for (Chunk chunk : chunks.values()) {
      if ((blockTypes.isEmpty() || blockTypes.contains(chunk.blockType()))
          && chunk.canonicalText().toLowerCase(Locale.ROOT).contains(needle)) {
        hits.add(new ChunkSearchHit(chunk.canonicalText(), chunk.metadata(), 1.0));
      }
    }
    return hits.subList(0, Math.min(k, hits.size()));
  }

  @Override
  public synchronized void deleteByDocumentId(String documentId) {
    chunks.values().removeIf(c -> c.metadata().documentId().equals(documentId));
  }

  public synchronized List<Chunk> all() {
    return new ArrayList<>(chunks.values());
  }

  public int upsertCalls() {
    return upsertCalls.get();
  }

  public void setFailUpserts(boolean failUpserts) {
    this.failUpserts = failUpserts;
  }
}
