package com.flamingo.ai.reportingest.service.ingestion;

import com.flamingo.ai.reportingest.store.ChunkStore;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tracks documents already ingested and documents currently being ingested, keyed by document
 * hash. The store is authoritative; this map only short-circuits repeat lookups.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KnownDocumentRegistry {

  enum Status {
    IN_FLIGHT,
    INGESTED
  }

  private final ChunkStore chunkStore;
  private final Map<String, Status> documents = new ConcurrentHashMap<>();

  /**
   * Checks whether a document should be ingested and, if so, reserves it. The reservation is
   * taken before the store lookup so concurrent callers for the same document are refused without
   * waiting on the store.
   *
   * @param documentId document hash
   * @param force ingest even when the document is already known
   * @return true when the caller now owns the reservation
   * @throws com.flamingo.ai.reportingest.exception.ChunkStoreException when the store lookup
   *     fails; the reservation is dropped first
   */
  public boolean tryReserve(String documentId, boolean force) {
    if (!reserve(documentId, force)) {
      log.debug("Document {} not reserved (known or in flight)", documentId);
      return false;
    }
    if (force) {
      return true;
    }
    boolean stored;
    try {
      stored = chunkStore.existsByDocumentId(documentId);
    } catch (RuntimeException e) {
      release(documentId);
      throw e;
    }
    if (stored) {
      documents.replace(documentId, Status.IN_FLIGHT, Status.INGESTED);
      log.debug("Document {} already in the store", documentId);
      return false;
    }
    return true;
  }

  private boolean reserve(String documentId, boolean force) {
    Status current = documents.putIfAbsent(documentId, Status.IN_FLIGHT);
    if (current == null) {
      return true;
    }
    return force
        && current == Status.INGESTED
        && documents.replace(documentId, Status.INGESTED, Status.IN_FLIGHT);
  }

  public void markIngested(String documentId) {
    documents.put(documentId, Status.INGESTED);
  }

  /** Drops an in-flight reservation so the document can be retried. */
  public void release(String documentId) {
    documents.remove(documentId, Status.IN_FLIGHT);
  }

  public boolean isInFlight(String documentId) {
    return documents.get(documentId) == Status.IN_FLIGHT;
  }

  public boolean isKnown(String documentId) {
    return documents.get(documentId) == Status.INGESTED;
  }
}
