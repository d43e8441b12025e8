package com.flamingo.ai.reportingest.service.ingestion.model;

import com.flamingo.ai.reportingest.domain.enums.IngestionState;

/**
 * Outcome of ingesting one file.
 *
 * @param documentId SHA-256 of the file, null when it could not be read
 * @param errorMessage failure reason for {@code FAILED} and {@code CANCELLED} runs
 */
public record DocumentIngestionResult(
    String fileName,
    String documentId,
    IngestionState state,
    IngestionStats stats,
    String errorMessage) {

  public static DocumentIngestionResult failed(
      String fileName, String documentId, IngestionStats stats, String errorMessage) {
    return new DocumentIngestionResult(
        fileName, documentId, IngestionState.FAILED, stats, errorMessage);
  }
}
