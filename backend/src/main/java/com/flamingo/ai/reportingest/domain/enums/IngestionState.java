package com.flamingo.ai.reportingest.domain.enums;

/**
 * Processing state of one document run.
 *
 * <p>Pages cycle {@code PARSED -> SEGMENTED -> EXTRACTED -> CHUNKED}; after the last page the run
 * moves to {@code FILTERED} and then {@code STORED}. {@code STORED}, {@code SKIPPED}, {@code
 * FAILED} and {@code CANCELLED} are terminal.
 */
public enum IngestionState {
  /** Run created, nothing read yet. */
  NEW,

  /** A page record has been produced by the page source. */
  PARSED,

  /** The current page has been classified into layout blocks. */
  SEGMENTED,

  /** Tables and figures have been extracted from the current page. */
  EXTRACTED,

  /** Chunks have been built for the current page. */
  CHUNKED,

  /** The quality gate has run over all chunks of the document. */
  FILTERED,

  /** Accepted chunks have been upserted. */
  STORED,

  /** Document was already ingested and not forced. */
  SKIPPED,

  /** Missing file, parse error or store error. */
  FAILED,

  /** Cancellation was requested before the upsert. */
  CANCELLED;

  public boolean isTerminal() {
    return this == STORED || this == SKIPPED || this == FAILED || this == CANCELLED;
  }

  /**
   * Checks whether a run in this state may move to {@code next}.
   *
   * @param next the requested state
   * @return true when the transition is legal
   */
  public boolean canTransitionTo(IngestionState next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED || next == CANCELLED) {
      return true;
    }
    return switch (this) {
      case NEW -> next == PARSED || next == SKIPPED || next == FILTERED;
      case PARSED -> next == SEGMENTED;
      case SEGMENTED -> next == EXTRACTED;
      case EXTRACTED -> next == CHUNKED;
      case CHUNKED -> next == PARSED || next == FILTERED;
      case FILTERED -> next == STORED;
      default -> false;
    };
  }
}
