package com.flamingo.ai.reportingest.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.DrawingCluster;
import com.flamingo.ai.reportingest.service.ingestion.parsing.DrawingClusterer.PathBox;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DrawingClusterer}. */
class DrawingClustererTest {

  private final DrawingClusterer clusterer = new DrawingClusterer();

  @Test
  void shouldMergeNearbyBars_intoOneCluster() {
    List<PathBox> bars = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      double x = 100 + i * 15;
      bars.add(new PathBox(new BoundingBox(x, 200, x + 10, 300), true, false));
    }

    List<DrawingCluster> clusters = clusterer.cluster(bars, 5, 10.0);

    assertThat(clusters).hasSize(1);
    DrawingCluster chart = clusters.get(0);
    assertThat(chart.pathCount()).isEqualTo(6);
    assertThat(chart.bbox()).isEqualTo(new BoundingBox(100, 200, 185, 300));
    assertThat(chart.filled()).isTrue();
    assertThat(chart.stroked()).isFalse();
  }

  @Test
  void shouldKeepDistantGroupsApart() {
    List<PathBox> paths = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      paths.add(new PathBox(new BoundingBox(i * 12, 0, i * 12 + 10, 10), false, true));
      paths.add(new PathBox(new BoundingBox(400 + i * 12, 400, 410 + i * 12, 410), true, false));
    }

    List<DrawingCluster> clusters = clusterer.cluster(paths, 5, 10.0);

    assertThat(clusters).extracting(DrawingCluster::pathCount).containsExactly(3, 3);
  }

  @Test
  void shouldMergeClusters_thatGrowIntoReach() {
    List<PathBox> paths =
        List.of(
            new PathBox(new BoundingBox(0, 0, 10, 10), false, true),
            new PathBox(new BoundingBox(40, 0, 50, 10), false, true),
            new PathBox(new BoundingBox(20, 0, 30, 10), false, true),
            new PathBox(new BoundingBox(60, 0, 70, 10), false, true),
            new PathBox(new BoundingBox(80, 0, 90, 10), false, true));

    List<DrawingCluster> clusters = clusterer.cluster(paths, 5, 10.0);

    assertThat(clusters).hasSize(1);
    assertThat(clusters.get(0).pathCount()).isEqualTo(5);
  }

  @Test
  void shouldIgnoreHairlines_andSparsePages() {
    List<PathBox> paths = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      paths.add(new PathBox(new BoundingBox(0, i * 5, 10, i * 5 + 5), true, false));
    }
    paths.add(new PathBox(new BoundingBox(0, 100, 300, 100.5), false, true));

    assertThat(clusterer.cluster(paths, 5, 10.0)).isEmpty();
  }
}
