package com.flamingo.ai.reportingest.exception;

/** Thrown between pages when cancellation was requested for the running document. */
public class IngestionCancelledException extends RuntimeException {

  private final String documentId;

  public IngestionCancelledException(String documentId) {
    super("Ingestion cancelled for document " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
