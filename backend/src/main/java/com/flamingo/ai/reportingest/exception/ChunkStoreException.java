package com.flamingo.ai.reportingest.exception;

/** Exception thrown when the chunk store cannot complete an upsert, lookup or delete. */
public class ChunkStoreException extends RuntimeException {

  public ChunkStoreException(String message) {
    super(message);
  }

  public ChunkStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
