package com.flamingo.ai.reportingest.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk. Documents whose ID already exists are replaced.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs vector similarity search with filters.
   *
   * @param filterCriteria key-value pairs for filtering (e.g., blockTypes, documentId)
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return list of matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Counts documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to count
   * @return the number of matching documents
   */
  long countBy(Map<String, Object> criteria);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   */
  void deleteBy(Map<String, Object> criteria);

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
