package com.flamingo.ai.reportingest.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import com.flamingo.ai.reportingest.domain.chunk.ChunkMetadata;
import com.flamingo.ai.reportingest.domain.chunk.FigureChunk;
import com.flamingo.ai.reportingest.domain.chunk.TableChunk;
import com.flamingo.ai.reportingest.domain.enums.BlockType;
import com.flamingo.ai.reportingest.exception.ChunkStoreException;
import com.flamingo.ai.reportingest.service.embedding.EmbeddingService;
import com.flamingo.ai.reportingest.store.ChunkSearchHit;
import com.flamingo.ai.reportingest.store.ChunkStore;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link ChunkStore}.
 *
 * <p>Chunks are indexed under their content hash, so re-ingesting identical content replaces the
 * stored entry instead of duplicating it. Embeddings come from {@link EmbeddingService}; a batch
 * it cannot embed in full is not indexed and the upsert fails.
 */
@Service
@Slf4j
public class ChunkIndexService extends AbstractElasticsearchIndexService<IndexedChunk>
    implements ChunkStore {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final EmbeddingService embeddingService;
  private final String indexName;
  private final int vectorDimensions;

  @Autowired
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      EmbeddingService embeddingService,
      IngestConfig ingestConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        embeddingService,
        ingestConfig.getElasticsearch().getIndexName(),
        ingestConfig.getElasticsearch().getVectorDimensions());
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      EmbeddingService embeddingService,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.embeddingService = embeddingService;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  @Timed(value = "chunk_store.upsert", description = "Time to embed and index a chunk batch")
  @Retry(name = "chunkStore")
  public int upsert(List<Chunk> chunks) {
    List<Chunk> distinct = distinctByContentHash(chunks);
    if (distinct.isEmpty()) {
      return 0;
    }

    List<List<Float>> embeddings =
        embeddingService.embedPassages(distinct.stream().map(Chunk::canonicalText).toList());
    if (embeddings.size() != distinct.size()) {
      throw new ChunkStoreException(
          String.format(
              "Embedding returned %d vectors for %d chunks", embeddings.size(), distinct.size()));
    }

    List<IndexedChunk> documents = new ArrayList<>(distinct.size());
    for (int i = 0; i < distinct.size(); i++) {
      documents.add(toIndexed(distinct.get(i), embeddings.get(i)));
    }
    indexDocuments(documents);
    log.info(
        "Upserted {} chunks ({} duplicates dropped) into {}",
        documents.size(),
        chunks.size() - distinct.size(),
        indexName);
    return documents.size();
  }

  @Override
  public boolean existsByDocumentId(String documentId) {
    return countBy(Map.of("documentId", documentId)) > 0;
  }

  @Override
  public List<ChunkSearchHit> search(String query, int k, Set<BlockType> blockTypes) {
    List<Float> queryEmbedding = embeddingService.embedQuery(query);
    if (queryEmbedding.isEmpty()) {
      log.warn("Query embedding unavailable, returning no results");
      return List.of();
    }
    Map<String, Object> filter = new HashMap<>();
    if (blockTypes != null && !blockTypes.isEmpty()) {
      filter.put("blockTypes", blockTypes.stream().map(Enum::name).sorted().toList());
    }
    return vectorSearch(filter, queryEmbedding, k).stream()
        .map(ChunkIndexService::toHit)
        .toList();
  }

  @Override
  public void deleteByDocumentId(String documentId) {
    deleteBy(Map.of("documentId", documentId));
  }

  /** First chunk per content hash, in input order. */
  static List<Chunk> distinctByContentHash(List<Chunk> chunks) {
    Map<String, Chunk> byHash = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      byHash.putIfAbsent(chunk.contentHash(), chunk);
    }
    return new ArrayList<>(byHash.values());
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_store";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ids and enums MUST be keyword type for exact matching
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("blockType", Property.of(p -> p.keyword(k -> k)));
    properties.put("figureType", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceFile", Property.of(p -> p.keyword(k -> k)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("sectionHeading", Property.of(p -> p.text(t -> t)));
    properties.put("exhibitLabel", Property.of(p -> p.keyword(k -> k)));
    properties.put("citation", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("createdAt", Property.of(p -> p.date(d -> d)));
    properties.put("tableCsv", Property.of(p -> p.text(t -> t.index(false))));
    properties.put("imagePath", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(IndexedChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId());
    document.put("sourceFile", chunk.getSourceFile());
    document.put("pageNumber", chunk.getPageNumber());
    document.put("blockType", chunk.getBlockType());
    document.put("sectionHeading", chunk.getSectionHeading());
    document.put("exhibitLabel", chunk.getExhibitLabel());
    document.put("citation", chunk.getCitation());
    document.put("content", chunk.getContent());
    document.put("createdAt", chunk.getCreatedAt());
    if (chunk.getTableCsv() != null) {
      document.put("tableCsv", chunk.getTableCsv());
    }
    if (chunk.getFigureType() != null) {
      document.put("figureType", chunk.getFigureType());
      document.put("imagePath", chunk.getImagePath());
    }
    if (chunk.getSeriesJson() != null) {
      document.put("seriesJson", chunk.getSeriesJson());
    }
    if (chunk.getEmbedding() != null) {
      document.put("embedding", chunk.getEmbedding());
    }
    return document;
  }

  @Override
  protected IndexedChunk convertFromDocument(Map<String, Object> source) {
    Object page = source.get("pageNumber");
    return IndexedChunk.builder()
        .id((String) source.get("id"))
        .documentId((String) source.get("documentId"))
        .sourceFile((String) source.get("sourceFile"))
        .pageNumber(page instanceof Number n ? n.intValue() : null)
        .blockType((String) source.get("blockType"))
        .sectionHeading((String) source.get("sectionHeading"))
        .exhibitLabel((String) source.get("exhibitLabel"))
        .citation((String) source.get("citation"))
        .content((String) source.get("content"))
        .createdAt((String) source.get("createdAt"))
        .tableCsv((String) source.get("tableCsv"))
        .figureType((String) source.get("figureType"))
        .imagePath((String) source.get("imagePath"))
        .seriesJson((String) source.get("seriesJson"))
        .build();
  }

  @Override
  protected String getDocumentId(IndexedChunk chunk) {
    return chunk.getId();
  }

  @Override
  @SuppressWarnings("unchecked")
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    List<String> blockTypes = (List<String>) filterCriteria.getOrDefault("blockTypes", List.of());
    List<FieldValue> values = blockTypes.stream().map(FieldValue::of).toList();
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field("embedding")
                          .queryVector(queryEmbedding)
                          .k(topK)
                          .numCandidates(topK * 2);
                      if (!values.isEmpty()) {
                        k.filter(
                            f -> f.terms(t -> t.field("blockType").terms(v -> v.value(values))));
                      }
                      return k;
                    })
                .size(topK));
  }

  @Override
  protected Query buildCriteriaQuery(Map<String, Object> criteria) {
    String documentId = (String) criteria.get("documentId");
    if (documentId == null) {
      throw new IllegalArgumentException("documentId criterion is required");
    }
    return Query.of(q -> q.term(t -> t.field("documentId").value(documentId)));
  }

  private static IndexedChunk toIndexed(Chunk chunk, List<Float> embedding) {
    ChunkMetadata m = chunk.metadata();
    IndexedChunk.IndexedChunkBuilder builder =
        IndexedChunk.builder()
            .id(chunk.contentHash())
            .documentId(m.documentId())
            .sourceFile(m.sourceFile())
            .pageNumber(m.pageNumber())
            .blockType(m.blockType().name())
            .sectionHeading(m.sectionHeading())
            .exhibitLabel(m.exhibitLabel())
            .citation(chunk.citation().render())
            .content(chunk.canonicalText())
            .createdAt(m.createdAt())
            .embedding(embedding);
    if (chunk instanceof TableChunk table) {
      builder.tableCsv(table.csv());
    }
    if (chunk instanceof FigureChunk figure) {
      builder.figureType(figure.figureType().name()).imagePath(figure.imagePath());
      if (figure.seriesData() != null) {
        builder.seriesJson(toJson(figure));
      }
    }
    return builder.build();
  }

  private static String toJson(FigureChunk figure) {
    try {
      return OBJECT_MAPPER.writeValueAsString(figure.seriesData());
    } catch (JsonProcessingException e) {
      throw new ChunkStoreException(
          "Failed to serialize series data of " + figure.contentHash(), e);
    }
  }

  private static ChunkSearchHit toHit(IndexedChunk chunk) {
    ChunkMetadata metadata =
        ChunkMetadata.builder()
            .documentId(chunk.getDocumentId())
            .sourceFile(chunk.getSourceFile())
            .pageNumber(chunk.getPageNumber() != null ? chunk.getPageNumber() : 0)
            .blockType(BlockType.valueOf(chunk.getBlockType()))
            .sectionHeading(chunk.getSectionHeading())
            .exhibitLabel(chunk.getExhibitLabel())
            .contentHash(chunk.getId())
            .createdAt(chunk.getCreatedAt())
            .build();
    double score = chunk.getRelevanceScore() != null ? chunk.getRelevanceScore() : 0.0;
    return new ChunkSearchHit(chunk.getContent(), metadata, score);
  }
}
