package com.flamingo.ai.reportingest.service.ingestion.parsing;

import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import java.io.Closeable;
import java.util.Iterator;

/** Pages of an open document in reading order. */
public interface PageCursor extends Iterator<PageRecord>, Closeable {

  /** Number of pages this cursor will yield, after any page limit. */
  int pageCount();
}
