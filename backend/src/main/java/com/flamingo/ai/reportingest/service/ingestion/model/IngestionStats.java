package com.flamingo.ai.reportingest.service.ingestion.model;

import java.time.Duration;
import lombok.Getter;
import lombok.ToString;

/** Counters for one ingestion invocation. Not thread-safe; merge per-document stats instead. */
@Getter
@ToString
public class IngestionStats {

  private int filesProcessed;
  private int filesSkipped;
  private int filesFailed;
  private int pagesProcessed;
  private int textChunks;
  private int tableChunks;
  private int figureChunks;
  private int chunksRejected;
  private int chunksStored;
  private Duration elapsed = Duration.ZERO;

  public void fileProcessed() {
    filesProcessed++;
  }

  public void fileSkipped() {
    filesSkipped++;
  }

  public void fileFailed() {
    filesFailed++;
  }

  public void pageProcessed() {
    pagesProcessed++;
  }

  public void addTextChunks(int n) {
    textChunks += n;
  }

  public void addTableChunks(int n) {
    tableChunks += n;
  }

  public void addFigureChunks(int n) {
    figureChunks += n;
  }

  public void addRejected(int n) {
    chunksRejected += n;
  }

  public void addStored(int n) {
    chunksStored += n;
  }

  public void setElapsed(Duration elapsed) {
    this.elapsed = elapsed;
  }

  public int totalChunks() {
    return textChunks + tableChunks + figureChunks;
  }

  /** Adds every counter of {@code other} into this instance; elapsed time is summed. */
  public IngestionStats merge(IngestionStats other) {
    filesProcessed += other.filesProcessed;
    filesSkipped += other.filesSkipped;
    filesFailed += other.filesFailed;
    pagesProcessed += other.pagesProcessed;
    textChunks += other.textChunks;
    tableChunks += other.tableChunks;
    figureChunks += other.figureChunks;
    chunksRejected += other.chunksRejected;
    chunksStored += other.chunksStored;
    elapsed = elapsed.plus(other.elapsed);
    return this;
  }
}
