package com.flamingo.ai.reportingest.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Chunk as stored in the Elasticsearch index; the document id is the content hash. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexedChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String documentId;
  private String sourceFile;
  private Integer pageNumber;
  private String blockType;
  private String sectionHeading;
  private String exhibitLabel;
  private String citation;
  private String content;
  private String createdAt;

  // Table fields
  private String tableCsv;

  // Figure fields
  private String figureType;
  private String imagePath;
  private String seriesJson;

  private List<Float> embedding;

  /** Relevance score from search (not stored). */
  private Double relevanceScore;
}
