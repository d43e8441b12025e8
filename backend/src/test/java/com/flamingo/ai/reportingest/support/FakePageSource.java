package com.flamingo.ai.reportingest.support;

import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import com.flamingo.ai.reportingest.service.ingestion.parsing.PageCursor;
import com.flamingo.ai.reportingest.service.ingestion.parsing.PageSource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/** {@link PageSource} serving prepared pages by file name. Unknown files fail to open. */
public class FakePageSource implements PageSource {

  private final Map<String, List<PageRecord>> pages = new HashMap<>();
  private final AtomicInteger openCursors = new AtomicInteger();
  private IntConsumer onPage = page -> {};

  public FakePageSource register(String fileName, PageRecord... filePages) {
    pages.put(fileName, List.of(filePages));
    return this;
  }

  /** Called with the 1-based page number each time a page is handed out. */
  public void onPage(IntConsumer onPage) {
    this.onPage = onPage;
  }

  public int openCursors() {
    return openCursors.get();
  }

  @Override
  public PageCursor open(Path file) throws IOException {
    List<PageRecord> filePages = pages.get(file.getFileName().toString());
    if (filePages == null) {
      throw new IOException("Not a PDF: " + file);
    }
    openCursors.incrementAndGet();
    return new PageCursor() {
      private int next;

      @Override
      public int pageCount() {
        return filePages.size();
      }

      @Override
      public boolean hasNext() {
        return next < filePages.size();
      }

      @Override
      public PageRecord next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        PageRecord page = filePages.get(next++);
        onPage.accept(page.pageNumber());
        return page;
      }

      @Override
      public void close() {
        openCursors.decrementAndGet();
      }
    };
  }
}
