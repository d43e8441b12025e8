package com.flamingo.ai.reportingest.service.ingestion.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** Renders cell matrices as markdown pipe tables and CSV. */
public final class TableFormatter {

  private TableFormatter() {}

  /**
   * Renders a markdown pipe table. The first row is the header; ragged rows are padded with empty
   * cells to the widest row.
   */
  public static String toMarkdown(List<List<String>> rows) {
    if (rows.isEmpty()) {
      return "";
    }
    int width = rows.stream().mapToInt(List::size).max().orElse(0);
    if (width == 0) {
      return "";
    }
    List<String> lines = new ArrayList<>();
    lines.add(markdownRow(pad(rows.get(0), width)));
    lines.add(markdownRow(Collections.nCopies(width, "---")));
    for (List<String> row : rows.subList(1, rows.size())) {
      lines.add(markdownRow(pad(row, width)));
    }
    return String.join("\n", lines);
  }

  /** Renders RFC 4180 CSV with CRLF row terminators. */
  public static String toCsv(List<List<String>> rows) {
    StringBuilder sb = new StringBuilder();
    for (List<String> row : rows) {
      sb.append(row.stream().map(TableFormatter::csvField).collect(Collectors.joining(",")));
      sb.append("\r\n");
    }
    return sb.toString();
  }

  private static String markdownRow(List<String> cells) {
    return "| "
        + cells.stream().map(TableFormatter::markdownCell).collect(Collectors.joining(" | "))
        + " |";
  }

  private static String markdownCell(String cell) {
    return cell == null ? "" : cell.replace('\n', ' ').replace('\r', ' ').trim();
  }

  private static String csvField(String cell) {
    String value = cell == null ? "" : cell;
    if (value.contains(",") || value.contains("\"") || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  private static List<String> pad(List<String> row, int width) {
    List<String> padded = new ArrayList<>(row);
    while (padded.size() < width) {
      padded.add("");
    }
    return padded;
  }
}
