package com.flamingo.ai.reportingest.service.ingestion.quality;

import com.flamingo.ai.reportingest.config.IngestConfig;
import com.flamingo.ai.reportingest.domain.chunk.Chunk;
import com.flamingo.ai.reportingest.domain.chunk.FigureChunk;
import com.flamingo.ai.reportingest.domain.chunk.TableChunk;
import com.flamingo.ai.reportingest.domain.chunk.TextChunk;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates chunks before persistence. Every check looks at one chunk only, so the outcome for a
 * chunk never depends on the rest of the batch.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QualityGate {

  static final int MIN_FIGURE_TEXT = 10;
  static final int MIN_REPETITION_WORDS = 5;
  static final double MIN_UNIQUE_WORD_RATIO = 0.5;

  private final IngestConfig ingestConfig;

  public QualityVerdict validate(Chunk chunk) {
    if (chunk instanceof TextChunk text) {
      return validateText(text);
    }
    if (chunk instanceof TableChunk table) {
      return validateTable(table);
    }
    if (chunk instanceof FigureChunk figure) {
      return validateFigure(figure);
    }
    return QualityVerdict.ok();
  }

  /**
   * Applies {@link #validate(Chunk)} to every chunk.
   *
   * @return accepted and rejected chunks; together they are exactly the input
   */
  public QualityReport filter(List<Chunk> chunks) {
    List<Chunk> accepted = new ArrayList<>();
    List<QualityReport.Rejection> rejected = new ArrayList<>();
    for (Chunk chunk : chunks) {
      QualityVerdict verdict = validate(chunk);
      if (verdict.accepted()) {
        accepted.add(chunk);
      } else {
        rejected.add(new QualityReport.Rejection(chunk, verdict.reason()));
        log.debug("Chunk rejected ({}): {}", verdict.reason(), preview(chunk.canonicalText()));
      }
    }
    if (!rejected.isEmpty()) {
      log.info("Quality gate: {} chunks passed, {} rejected", accepted.size(), rejected.size());
    }
    return new QualityReport(accepted, rejected);
  }

  QualityVerdict validateText(TextChunk chunk) {
    IngestConfig.Quality config = ingestConfig.getQuality();
    String text = chunk.text() == null ? "" : chunk.text().trim();
    if (text.length() < config.getMinChunkLength()) {
      return QualityVerdict.reject("Too short (" + text.length() + " chars)");
    }
    if (text.length() > config.getMaxChunkLength()) {
      return QualityVerdict.reject("Too long (" + text.length() + " chars)");
    }
    long alnum = text.chars().filter(Character::isLetterOrDigit).count();
    double ratio = (double) alnum / text.length();
    if (ratio < config.getMinAlnumRatio()) {
      return QualityVerdict.reject(String.format("Low alphanumeric ratio (%.2f)", ratio));
    }
    if (isRepetitive(text)) {
      return QualityVerdict.reject("Repetitive content detected");
    }
    return QualityVerdict.ok();
  }

  QualityVerdict validateTable(TableChunk chunk) {
    String markdown = chunk.markdown() == null ? "" : chunk.markdown().trim();
    if (markdown.isEmpty()) {
      return QualityVerdict.reject("Empty table");
    }
    long dataLines =
        markdown
            .lines()
            .filter(l -> l.trim().startsWith("|"))
            .filter(l -> !l.contains("---"))
            .count();
    if (dataLines < ingestConfig.getQuality().getTableMinRows()) {
      return QualityVerdict.reject("Too few rows (" + dataLines + ")");
    }
    return QualityVerdict.ok();
  }

  QualityVerdict validateFigure(FigureChunk chunk) {
    if (chunk.flattenedText().length() < MIN_FIGURE_TEXT) {
      return QualityVerdict.reject("Insufficient textual representation");
    }
    return QualityVerdict.ok();
  }

  /** Mostly the same few words repeated. Texts under five words are never judged repetitive. */
  static boolean isRepetitive(String text) {
    String[] words = text.trim().split("\\s+");
    if (words.length < MIN_REPETITION_WORDS) {
      return false;
    }
    return (double) new HashSet<>(Arrays.asList(words)).size() / words.length
        < MIN_UNIQUE_WORD_RATIO;
  }

  private static String preview(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > 80 ? text.substring(0, 80) : text;
  }
}
