package com.flamingo.ai.reportingest.domain.chunk;

/** Human-readable pointer back to the source of a chunk. */
public record Citation(String sourceFile, int pageNumber, String exhibitLabel) {

  /** Renders {@code "{file}, p.{page} – {exhibit}"}, omitting the exhibit when blank. */
  public String render() {
    if (exhibitLabel == null || exhibitLabel.isBlank()) {
      return sourceFile + ", p." + pageNumber;
    }
    return sourceFile + ", p." + pageNumber + " – " + exhibitLabel;
  }

  @Override
  public String toString() {
    return render();
  }
}
