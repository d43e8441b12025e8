package com.flamingo.ai.reportingest.service.ingestion.model;

/**
 * Straight horizontal or vertical segment drawn on a page.
 *
 * @param horizontal true for horizontal rulings
 * @param position y for horizontal rulings, x for vertical ones
 * @param start lower bound along the ruling
 * @param end upper bound along the ruling
 */
public record RulingLine(boolean horizontal, double position, double start, double end) {

  public RulingLine {
    if (end < start) {
      double t = start;
      start = end;
      end = t;
    }
  }

  public static RulingLine horizontal(double y, double xStart, double xEnd) {
    return new RulingLine(true, y, xStart, xEnd);
  }

  public static RulingLine vertical(double x, double yStart, double yEnd) {
    return new RulingLine(false, x, yStart, yEnd);
  }

  public double length() {
    return end - start;
  }

  /**
   * Whether two rulings touch. Parallel rulings touch when collinear and overlapping, crossing
   * rulings when each passes within {@code tolerance} of the other.
   */
  public boolean intersects(RulingLine other, double tolerance) {
    if (horizontal == other.horizontal) {
      return Math.abs(position - other.position) <= tolerance
          && start - tolerance <= other.end
          && other.start - tolerance <= end;
    }
    return other.position >= start - tolerance
        && other.position <= end + tolerance
        && position >= other.start - tolerance
        && position <= other.end + tolerance;
  }
}
