package com.flamingo.ai.reportingest.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.reportingest.exception.ChunkStoreException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides common functionality for indexing, searching, counting and deleting documents with
 * vector embeddings. Subclasses define document-specific schema and conversion logic. Write and
 * count failures raise {@link ChunkStoreException}; search degrades to no results.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Builds the vector search request with filters.
   *
   * @param filterCriteria the filter criteria
   * @param queryEmbedding the query embedding
   * @param topK the number of results
   * @return the search request
   */
  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Builds the query selecting documents for count and delete operations.
   *
   * @param criteria the selection criteria
   * @return the query
   */
  protected abstract Query buildCriteriaQuery(Map<String, Object> criteria);

  /**
   * Returns the metric prefix for this index (e.g., "chunk_store").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields (such as seriesJson) out of the mapping
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch cannot change the type of an existing field, so a mismatch fails fast and the
   * index has to be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> docMap = convertToDocument(document);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new ChunkStoreException("Failed to index documents to " + getIndexName(), e);
    }
    if (response.errors()) {
      List<String> reasons =
          response.items().stream()
              .filter(item -> item.error() != null)
              .map(AbstractElasticsearchIndexService::describe)
              .toList();
      log.warn(
          "{} of {} documents failed to index in {}: {}",
          reasons.size(),
          documents.size(),
          getIndexName(),
          reasons);
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new ChunkStoreException(
          reasons.size() + " document(s) failed to index in " + getIndexName());
    }
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  private static String describe(BulkResponseItem item) {
    return item.id() + ": " + item.error().reason();
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug("[vectorSearch] index={} returned={}", getIndexName(), results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new ChunkStoreException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  public long countBy(Map<String, Object> criteria) {
    try {
      Query query = buildCriteriaQuery(criteria);
      CountRequest request = CountRequest.of(c -> c.index(getIndexName()).query(query));
      return elasticsearchClient.count(request).count();
    } catch (IOException e) {
      log.error(
          "Failed to count documents in {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage());
      throw new ChunkStoreException("Failed to count documents in " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildCriteriaQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery));
      elasticsearchClient.deleteByQuery(request);
      log.info("Deleted documents from {} with criteria: {}", getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new ChunkStoreException("Failed to delete documents", e);
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Marker interface for documents that support relevance scoring. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
