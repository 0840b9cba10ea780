package pinto.canvas;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Point {
  public abstract double x();

  public abstract double y();

  public static Point of(double x, double y) {
    return new AutoValue_Point(x, y);
  }

  public Point translate(double dx, double dy) {
    return of(x() + dx, y() + dy);
  }
}
