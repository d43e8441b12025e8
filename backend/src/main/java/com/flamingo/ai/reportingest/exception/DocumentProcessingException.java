package com.flamingo.ai.reportingest.exception;

/** Exception thrown when ingesting a single document fails. */
public class DocumentProcessingException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentProcessingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  /** SHA-256 of the source file, or the file name when the file could not be hashed. */
  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
