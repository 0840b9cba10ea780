package pinto.canvas;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class BoundingBox {
  public abstract double x();

  public abstract double y();

  public abstract double width();

  public abstract double height();

  public static BoundingBox of(double x, double y, double width, double height) {
    return new AutoValue_BoundingBox(x, y, width, height);
  }

  public Point center() {
    return Point.of(x() + width() / 2, y() + height() / 2);
  }

  /** Zero for points inside the box, otherwise the distance to its nearest edge. */
  public double distanceTo(Point point) {
    double dx = Math.max(Math.max(x() - point.x(), 0), point.x() - (x() + width()));
    double dy = Math.max(Math.max(y() - point.y(), 0), point.y() - (y() + height()));
    return Math.hypot(dx, dy);
  }
}
