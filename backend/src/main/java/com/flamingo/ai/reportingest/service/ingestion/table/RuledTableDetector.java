package com.flamingo.ai.reportingest.service.ingestion.table;

import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.RulingLine;
import com.flamingo.ai.reportingest.service.ingestion.model.TextSpan;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds tables drawn with ruling lines.
 *
 * <p>Rulings that touch are grouped with single-linkage clustering (union-find). A group with at
 * least two distinct horizontal and two distinct vertical positions defines a grid; each span
 * whose centre lies in a grid cell contributes its text to that cell.
 */
@Slf4j
@Component
public class RuledTableDetector {

  static final double TOLERANCE = 2.0;

  /** Grid found on a page, before row and column minimums are applied. */
  public record Candidate(BoundingBox bbox, List<List<String>> rows) {

    public int columnCount() {
      return rows.stream().mapToInt(List::size).max().orElse(0);
    }
  }

  /**
   * Detects ruled tables.
   *
   * @param rulings ruling lines of the page
   * @param spans text spans of the page
   * @return candidates in order of their first ruling, fully empty rows removed
   */
  public List<Candidate> detect(List<RulingLine> rulings, List<TextSpan> spans) {
    if (rulings.size() < 4) {
      return List.of();
    }
    List<Candidate> candidates = new ArrayList<>();
    for (List<RulingLine> component : connectedComponents(rulings)) {
      List<Double> ys = distinctPositions(component, true);
      List<Double> xs = distinctPositions(component, false);
      if (ys.size() < 2 || xs.size() < 2) {
        continue;
      }
      List<List<String>> rows = fillCells(xs, ys, spans);
      BoundingBox bbox = new BoundingBox(xs.get(0), ys.get(0), last(xs), last(ys));
      log.debug(
          "Ruled grid {}x{} at {} with {} non-empty rows",
          ys.size() - 1,
          xs.size() - 1,
          bbox,
          rows.size());
      candidates.add(new Candidate(bbox, rows));
    }
    return candidates;
  }

  private List<List<RulingLine>> connectedComponents(List<RulingLine> rulings) {
    int n = rulings.size();
    UnionFind uf = new UnionFind(n);
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        if (rulings.get(i).intersects(rulings.get(j), TOLERANCE)) {
          uf.union(i, j);
        }
      }
    }
    // LinkedHashMap keeps components in order of their first ruling
    Map<Integer, List<RulingLine>> components = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      components.computeIfAbsent(uf.find(i), k -> new ArrayList<>()).add(rulings.get(i));
    }
    return new ArrayList<>(components.values());
  }

  /** Sorted positions of one orientation, merging positions closer than the tolerance. */
  private List<Double> distinctPositions(List<RulingLine> component, boolean horizontal) {
    List<Double> sorted =
        component.stream()
            .filter(r -> r.horizontal() == horizontal)
            .map(RulingLine::position)
            .sorted()
            .toList();
    List<Double> distinct = new ArrayList<>();
    for (double p : sorted) {
      if (distinct.isEmpty() || p - last(distinct) > TOLERANCE) {
        distinct.add(p);
      }
    }
    return distinct;
  }

  private List<List<String>> fillCells(List<Double> xs, List<Double> ys, List<TextSpan> spans) {
    int rowCount = ys.size() - 1;
    int colCount = xs.size() - 1;
    StringBuilder[][] cells = new StringBuilder[rowCount][colCount];

    List<TextSpan> ordered =
        spans.stream()
            .sorted(
                Comparator.comparingDouble((TextSpan s) -> s.bbox().y0())
                    .thenComparingDouble(s -> s.bbox().x0()))
            .toList();
    for (TextSpan span : ordered) {
      int row = slot(ys, span.bbox().centerY());
      int col = slot(xs, span.bbox().centerX());
      if (row < 0 || col < 0) {
        continue;
      }
      if (cells[row][col] == null) {
        cells[row][col] = new StringBuilder(span.text().trim());
      } else {
        cells[row][col].append(' ').append(span.text().trim());
      }
    }

    List<List<String>> rows = new ArrayList<>();
    for (StringBuilder[] rowCells : cells) {
      List<String> row = new ArrayList<>(colCount);
      boolean empty = true;
      for (StringBuilder cell : rowCells) {
        String text = cell == null ? "" : cell.toString();
        empty &= text.isBlank();
        row.add(text);
      }
      if (!empty) {
        rows.add(row);
      }
    }
    return rows;
  }

  /** Index of the interval of {@code bounds} containing {@code value}, or -1. */
  private static int slot(List<Double> bounds, double value) {
    for (int i = 0; i < bounds.size() - 1; i++) {
      if (value >= bounds.get(i) && value < bounds.get(i + 1)) {
        return i;
      }
    }
    return -1;
  }

  private static double last(List<Double> values) {
    return values.get(values.size() - 1);
  }

  /** Union-Find (Disjoint Set Union) over ruling indices. */
  private static class UnionFind {
    private final int[] parent;
    private final int[] rank;

    UnionFind(int size) {
      parent = new int[size];
      rank = new int[size];
      for (int i = 0; i < size; i++) {
        parent[i] = i;
      }
    }

    int find(int x) {
      if (parent[x] != x) {
        parent[x] = find(parent[x]); // Path compression
      }
      return parent[x];
    }

    void union(int x, int y) {
      int rootX = find(x);
      int rootY = find(y);
      if (rootX == rootY) {
        return;
      }
      if (rank[rootX] < rank[rootY]) {
        parent[rootX] = rootY;
      } else if (rank[rootX] > rank[rootY]) {
        parent[rootY] = rootX;
      } else {
        parent[rootY] = rootX;
        rank[rootX]++;
      }
    }
  }
}
