package pinto.canvas;

import com.google.auto.value.AutoValue;

/** Paint attributes shared by every shape. */
@AutoValue
public abstract class ShapeStyle {
  public static final String BLACK = "#000000";
  public static final String WHITE = "#ffffff";
  public static final String TRANSPARENT = "transparent";

  public abstract String stroke();

  public abstract double strokeWidth();

  public abstract String fill();

  public abstract double opacity();

  public static ShapeStyle create(String stroke, double strokeWidth, String fill, double opacity) {
    return new AutoValue_ShapeStyle(stroke, strokeWidth, fill, opacity);
  }

  public static ShapeStyle of(String stroke, double strokeWidth, String fill) {
    return create(stroke, strokeWidth, fill, 1);
  }
}
