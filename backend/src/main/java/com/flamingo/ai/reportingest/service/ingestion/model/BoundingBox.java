package com.flamingo.ai.reportingest.service.ingestion.model;

/**
 * Axis-aligned rectangle in PDF points, origin at the top-left of the page.
 *
 * @param x0 left edge
 * @param y0 top edge
 * @param x1 right edge
 * @param y1 bottom edge
 */
public record BoundingBox(double x0, double y0, double x1, double y1) {

  public BoundingBox {
    if (x1 < x0) {
      double t = x0;
      x0 = x1;
      x1 = t;
    }
    if (y1 < y0) {
      double t = y0;
      y0 = y1;
      y1 = t;
    }
  }

  public double width() {
    return x1 - x0;
  }

  public double height() {
    return y1 - y0;
  }

  public double area() {
    return width() * height();
  }

  public double centerX() {
    return (x0 + x1) / 2.0;
  }

  public double centerY() {
    return (y0 + y1) / 2.0;
  }

  public BoundingBox union(BoundingBox other) {
    return new BoundingBox(
        Math.min(x0, other.x0),
        Math.min(y0, other.y0),
        Math.max(x1, other.x1),
        Math.max(y1, other.y1));
  }

  /** Area shared with {@code other}; 0 when the boxes are disjoint. */
  public double intersectionArea(BoundingBox other) {
    double w = Math.min(x1, other.x1) - Math.max(x0, other.x0);
    double h = Math.min(y1, other.y1) - Math.max(y0, other.y0);
    if (w <= 0 || h <= 0) {
      return 0.0;
    }
    return w * h;
  }

  /** Intersection over union; 0 when either box is empty. */
  public double iou(BoundingBox other) {
    double inter = intersectionArea(other);
    double union = area() + other.area() - inter;
    return union > 0 ? inter / union : 0.0;
  }

  /** True when the boxes overlap or lie within {@code gap} of each other on both axes. */
  public boolean isNear(BoundingBox other, double gap) {
    return x0 - gap <= other.x1
        && other.x0 - gap <= x1
        && y0 - gap <= other.y1
        && other.y0 - gap <= y1;
  }

  public boolean contains(double x, double y) {
    return x >= x0 && x <= x1 && y >= y0 && y <= y1;
  }

  public double centroidDistance(BoundingBox other) {
    return Math.hypot(centerX() - other.centerX(), centerY() - other.centerY());
  }

  public BoundingBox scale(double factor) {
    return new BoundingBox(x0 * factor, y0 * factor, x1 * factor, y1 * factor);
  }
}
