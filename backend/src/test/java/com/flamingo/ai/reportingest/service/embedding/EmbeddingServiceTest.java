package com.flamingo.ai.reportingest.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed query")
  void shouldEmbedQuery() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(new float[] {0.1f, 0.2f}));

    List<Float> result = embeddingService.embedQuery("What drove Q3 revenue?");

    assertThat(result).containsExactly(0.1f, 0.2f);
    verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should embed passages in input order")
  void shouldEmbedPassagesInOrder() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(createResponse(new float[] {0.1f, 0.2f}))
        .thenReturn(createResponse(new float[] {0.3f, 0.4f}))
        .thenReturn(createResponse(new float[] {0.5f, 0.6f}));

    List<List<Float>> results =
        embeddingService.embedPassages(List.of("Revenue", "| Year | GDP |", "Figure 1"));

    assertThat(results)
        .containsExactly(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f), List.of(0.5f, 0.6f));
    verify(embeddingModel, times(3)).embed(anyString());
    verify(counter).increment(3.0);
  }

  @Test
  @DisplayName("Should truncate very long passages before embedding")
  void shouldTruncateLongPassages() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(new float[] {0.1f}));

    embeddingService.embedPassages(List.of("c".repeat(9000), "short"));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel, times(2)).embed(captor.capture());
    assertThat(captor.getAllValues().get(0)).hasSize(6000);
    assertThat(captor.getAllValues().get(1)).isEqualTo("short");
  }

  @Test
  @DisplayName("Should handle empty batch")
  void shouldHandleEmptyBatch() {
    assertThat(embeddingService.embedPassages(List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should handle empty vector from embedding model")
  void shouldHandleEmptyVector() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(new float[] {}));

    assertThat(embeddingService.embedQuery("test")).isEmpty();
  }

  private Response<Embedding> createResponse(float[] vector) {
    return Response.from(new Embedding(vector));
  }
}
