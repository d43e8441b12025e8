package com.flamingo.ai.reportingest.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates embeddings for chunk text and search queries. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense numeric tables
  private static final int MAX_CHARS_PER_EMBEDDING = 6000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector, empty when the model is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(query, -1));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds chunk texts, one vector per input in input order.
   *
   * @param texts the passages to embed
   * @return vectors, or an empty list when embedding failed
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedPassagesFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedPassages(List<String> texts) {
    List<List<Float>> results = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      Response<Embedding> response = embeddingModel.embed(truncate(texts.get(i), i));
      results.add(toFloatList(response.content().vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment(texts.size());
    return results;
  }

  private String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedPassagesFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    return List.of();
  }
}
