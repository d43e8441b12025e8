package com.flamingo.ai.reportingest.service.ingestion.parsing;

import java.io.IOException;
import java.nio.file.Path;

/** Produces per-page records for a document. */
public interface PageSource {

  /**
   * Opens a document once for sequential page reads.
   *
   * @param file the PDF to read
   * @return a cursor over the document's pages; the caller closes it
   * @throws IOException if the file cannot be opened or is not a readable PDF
   */
  PageCursor open(Path file) throws IOException;
}
