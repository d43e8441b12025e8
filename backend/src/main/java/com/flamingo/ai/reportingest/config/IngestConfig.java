package com.flamingo.ai.reportingest.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Getter
@Setter
public class IngestConfig {

  private Paths paths = new Paths();
  private Render render = new Render();
  private Ocr ocr = new Ocr();
  private Layout layout = new Layout();
  private Table table = new Table();
  private Figure figure = new Figure();
  private Chunking chunking = new Chunking();
  private Quality quality = new Quality();
  private Charts charts = new Charts();
  private Collaborators collaborators = new Collaborators();
  private Elasticsearch elasticsearch = new Elasticsearch();

  /** Ingest {@code paths.pdf-dir} once when the application starts. */
  private boolean runOnStartup = false;

  @Getter
  @Setter
  public static class Paths {
    private String pdfDir = "./data/pdfs";
    private String storageDir = "./data/storage";

    /** Root for cropped figure images; stored paths are relative to {@code storageDir}. */
    private String resourcesDir = "./data/storage/resources";
  }

  @Getter
  @Setter
  public static class Render {
    private int dpi = 100;

    /** 0 means every page. */
    private int maxPages = 0;
  }

  @Getter
  @Setter
  public static class Ocr {
    private boolean enabled = true;
    private String language = "eng";
    private String dataPath = "/usr/share/tesseract-ocr/5/tessdata";
    private double confidenceThreshold = 0.40;
    private double figureConfidenceThreshold = 0.30;
  }

  @Getter
  @Setter
  public static class Layout {
    private double confidenceThreshold = 0.5;
  }

  @Getter
  @Setter
  public static class Table {
    private int minRows = 2;
    private int minCols = 2;
    private int ocrRowTolerancePx = 12;
  }

  @Getter
  @Setter
  public static class Figure {
    private double minAreaRatio = 0.02;
    private double iouThreshold = 0.3;
    private int minPaths = 5;
    private double mergeGap = 10.0;
    private int minCropPx = 20;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int textChunkSize = 450;
    private int textChunkOverlap = 50;
    private boolean includePageSummary = true;
    private int pageSummaryMaxChars = 8000;
  }

  @Getter
  @Setter
  public static class Quality {
    private int minChunkLength = 30;
    private int maxChunkLength = 8000;
    private int tableMinRows = 2;
    private double minAlnumRatio = 0.30;
    private boolean dedupEnabled = true;
  }

  @Getter
  @Setter
  public static class Charts {
    /** Use the vision chat model for chart description and digitization. */
    private boolean llmEnabled = false;
  }

  @Getter
  @Setter
  public static class Collaborators {
    private Duration timeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Elasticsearch {
    private String indexName = "report_chunks";
    private int vectorDimensions = 1536;
  }
}
