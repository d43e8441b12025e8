package com.flamingo.ai.reportingest.service.ingestion.table;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.RulingLine;
import com.flamingo.ai.reportingest.service.ingestion.model.TextSpan;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RuledTableDetector}. */
class RuledTableDetectorTest {

  private final RuledTableDetector detector = new RuledTableDetector();

  @Test
  void shouldBuildGrid_fromIntersectingRulings() {
    List<RulingLine> rulings = grid(new double[] {0, 100, 200}, new double[] {0, 20, 40});
    List<TextSpan> spans =
        List.of(
            span("Revenue", 50, 10),
            span("2023", 150, 10),
            span("Sales", 50, 30),
            span("120", 150, 30));

    List<RuledTableDetector.Candidate> candidates = detector.detect(rulings, spans);

    assertThat(candidates).hasSize(1);
    RuledTableDetector.Candidate table = candidates.get(0);
    assertThat(table.rows())
        .containsExactly(List.of("Revenue", "2023"), List.of("Sales", "120"));
    assertThat(table.columnCount()).isEqualTo(2);
    assertThat(table.bbox()).isEqualTo(new BoundingBox(0, 0, 200, 40));
  }

  @Test
  void shouldJoinSpans_inSameCellInReadingOrder() {
    List<RulingLine> rulings = grid(new double[] {0, 100, 200}, new double[] {0, 40});
    List<TextSpan> spans =
        List.of(span("income", 60, 10), span("Net", 20, 10), span("5.0", 150, 20));

    List<RuledTableDetector.Candidate> candidates = detector.detect(rulings, spans);

    assertThat(candidates.get(0).rows()).containsExactly(List.of("Net income", "5.0"));
  }

  @Test
  void shouldDropEmptyRows() {
    List<RulingLine> rulings = grid(new double[] {0, 100, 200}, new double[] {0, 20, 40, 60});
    List<TextSpan> spans = List.of(span("A", 50, 10), span("B", 150, 50));

    List<RuledTableDetector.Candidate> candidates = detector.detect(rulings, spans);

    assertThat(candidates.get(0).rows()).containsExactly(List.of("A", ""), List.of("", "B"));
  }

  @Test
  void shouldSeparateDisjointGrids() {
    List<RulingLine> rulings = new ArrayList<>(grid(new double[] {0, 100}, new double[] {0, 20}));
    rulings.addAll(grid(new double[] {0, 100}, new double[] {300, 320}));
    List<TextSpan> spans = List.of(span("top", 50, 10), span("bottom", 50, 310));

    List<RuledTableDetector.Candidate> candidates = detector.detect(rulings, spans);

    assertThat(candidates).hasSize(2);
    assertThat(candidates.get(0).rows()).containsExactly(List.of("top"));
    assertThat(candidates.get(1).rows()).containsExactly(List.of("bottom"));
  }

  @Test
  void shouldReturnNothing_withFewerThanFourRulings() {
    List<RulingLine> rulings =
        List.of(
            RulingLine.horizontal(0, 0, 100),
            RulingLine.horizontal(20, 0, 100),
            RulingLine.vertical(0, 0, 20));

    assertThat(detector.detect(rulings, List.of(span("x", 50, 10)))).isEmpty();
  }

  static List<RulingLine> grid(double[] xs, double[] ys) {
    List<RulingLine> rulings = new ArrayList<>();
    for (double y : ys) {
      rulings.add(RulingLine.horizontal(y, xs[0], xs[xs.length - 1]));
    }
    for (double x : xs) {
      rulings.add(RulingLine.vertical(x, ys[0], ys[ys.length - 1]));
    }
    return rulings;
  }

  static TextSpan span(String text, double cx, double cy) {
    return new TextSpan(
        text, new BoundingBox(cx - 5, cy - 4, cx + 5, cy + 4), 9.0, "Helvetica", false);
  }
}
