package com.flamingo.ai.reportingest.service.ingestion.parsing;

import com.flamingo.ai.reportingest.service.ingestion.model.BoundingBox;
import com.flamingo.ai.reportingest.service.ingestion.model.DrawingCluster;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Greedily merges painted vector paths that overlap or sit close together. */
@Component
public class DrawingClusterer {

  static final double MIN_PATH_EXTENT = 2.0;

  /** Bounding box of one painted path with its paint operators. */
  public record PathBox(BoundingBox bbox, boolean filled, boolean stroked) {}

  /**
   * Clusters path boxes.
   *
   * @param paths painted paths of one page
   * @param minPaths pages with fewer drawable paths yield no clusters
   * @param mergeGap distance in points under which two boxes join the same cluster
   * @return clusters in order of first appearance
   */
  public List<DrawingCluster> cluster(List<PathBox> paths, int minPaths, double mergeGap) {
    List<PathBox> drawable =
        paths.stream()
            .filter(
                p -> p.bbox().width() >= MIN_PATH_EXTENT && p.bbox().height() >= MIN_PATH_EXTENT)
            .toList();
    if (drawable.size() < minPaths) {
      return List.of();
    }

    List<Accumulator> clusters = new ArrayList<>();
    for (PathBox path : drawable) {
      Accumulator target = null;
      for (Accumulator c : clusters) {
        if (c.bbox.isNear(path.bbox(), mergeGap)) {
          target = c;
          break;
        }
      }
      if (target == null) {
        clusters.add(new Accumulator(path));
      } else {
        target.add(path);
      }
    }

    // growing boxes can bring earlier clusters within reach of each other
    boolean merged = true;
    while (merged) {
      merged = false;
      outer:
      for (int i = 0; i < clusters.size(); i++) {
        for (int j = i + 1; j < clusters.size(); j++) {
          if (clusters.get(i).bbox.isNear(clusters.get(j).bbox, mergeGap)) {
            clusters.get(i).absorb(clusters.remove(j));
            merged = true;
            break outer;
          }
        }
      }
    }

    return clusters.stream()
        .map(c -> new DrawingCluster(c.bbox, c.count, c.filled, c.stroked))
        .toList();
  }

  private static final class Accumulator {
    private BoundingBox bbox;
    private int count;
    private boolean filled;
    private boolean stroked;

    Accumulator(PathBox first) {
      this.bbox = first.bbox();
      this.count = 1;
      this.filled = first.filled();
      this.stroked = first.stroked();
    }

    void add(PathBox path) {
      bbox = bbox.union(path.bbox());
      count++;
      filled |= path.filled();
      stroked |= path.stroked();
    }

    void absorb(Accumulator other) {
      bbox = bbox.union(other.bbox);
      count += other.count;
      filled |= other.filled;
      stroked |= other.stroked;
    }
  }
}
