package com.flamingo.ai.reportingest.service.ingestion.chart;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LlmChartAnalyzerTest {

  @Mock private ChatModel chatModel;

  private LlmChartAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    analyzer = new LlmChartAnalyzer(chatModel);
  }

  @Test
  void shouldReturnTrimmedModelAnswer_asDescription() {
    when(chatModel.chat(any(ChatMessage[].class))).thenReturn(answer("  Debt rises steadily.  "));

    assertThat(analyzer.describe(new byte[] {1, 2}, "Figure 1", ""))
        .isEqualTo("Debt rises steadily.");
  }

  @Test
  void shouldParseModelTable_asSeries() {
    when(chatModel.chat(any(ChatMessage[].class)))
        .thenReturn(answer("Year | Rate <0x0A> 2023 | 5.25 <0x0A> 2024 | 4.50"));

    Optional<SeriesData> series = analyzer.digitize(new byte[] {1});

    assertThat(series).isPresent();
    assertThat(series.get().columns()).containsExactly("Year", "Rate");
    assertThat(series.get().rows()).hasSize(2).contains(List.of("2024", "4.50"));
  }

  @Test
  void shouldReturnNoSeries_whenModelAnswersProse() {
    when(chatModel.chat(any(ChatMessage[].class))).thenReturn(answer("I cannot read this chart."));

    assertThat(analyzer.digitize(new byte[] {1})).isEmpty();
  }

  private static ChatResponse answer(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }
}
