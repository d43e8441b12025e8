package com.flamingo.ai.reportingest.service.ingestion.chart;

import com.flamingo.ai.reportingest.domain.chunk.SeriesData;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Base64;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Chart description and digitization with a vision chat model.
 *
 * <p>Active when {@code ingest.charts.llm-enabled=true}. Errors propagate; the figure analyzer
 * applies the time limit and soft failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ingest.charts.llm-enabled", havingValue = "true")
public class LlmChartAnalyzer implements ChartDescriber, ChartDigitizer {

  static final String DESCRIBE_PROMPT =
      "Describe the chart in this image in 2-3 sentences, highlighting trends, comparisons and "
          + "key values. Caption: %s. Text read from the chart: %s";

  static final String DIGITIZE_PROMPT =
      "Generate the underlying data table of the chart in this image. Output only the table, one "
          + "row per line, cells separated by ' | ', the header row first.";

  private final ChatModel chatModel;

  @Override
  public String describe(byte[] png, String caption, String ocrText) {
    String prompt = String.format(DESCRIBE_PROMPT, blankToNone(caption), blankToNone(ocrText));
    String answer = ask(png, prompt);
    log.debug("Chart description: {} chars", answer.length());
    return answer;
  }

  @Override
  public Optional<SeriesData> digitize(byte[] png) {
    return LinearisedTableParser.parse(ask(png, DIGITIZE_PROMPT));
  }

  private String ask(byte[] png, String prompt) {
    UserMessage message =
        UserMessage.from(
            TextContent.from(prompt),
            ImageContent.from(Base64.getEncoder().encodeToString(png), "image/png"));
    String text = chatModel.chat(message).aiMessage().text();
    return text == null ? "" : text.trim();
  }

  private static String blankToNone(String s) {
    return s == null || s.isBlank() ? "none" : s.trim();
  }
}
