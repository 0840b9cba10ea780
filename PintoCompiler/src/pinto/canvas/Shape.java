package pinto.canvas;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A shape on the drawing surface. Positions are absolute; the point lists of connectors and
 * freehand strokes are relative to {@link #x()}, {@link #y()}.
 *
 * <p>The variants are closed: switch over {@link #kind()} and {@link #cast()}.
 */
public abstract class Shape {
  public enum Kind {
    RECTANGLE("rectangle"),
    ELLIPSE("ellipse"),
    LINE("line"),
    ARROW("arrow"),
    FREEHAND("freehand"),
    TEXT("text");

    private final String wireName;

    Kind(String wireName) {
      this.wireName = wireName;
    }

    public String wireName() {
      return wireName;
    }

    public static Optional<Kind> fromWireName(String name) {
      for (Kind kind : values()) {
        if (kind.wireName.equals(name)) return Optional.of(kind);
      }
      return Optional.empty();
    }
  }

  Shape() {}

  public abstract String id();

  public abstract double x();

  public abstract double y();

  public abstract double rotation();

  public abstract ShapeStyle style();

  public abstract Kind kind();

  @SuppressWarnings("unchecked")
  public <T extends Shape> T cast() {
    return (T) this;
  }

  public BoundingBox bounds() {
    switch (kind()) {
      case RECTANGLE:
      case ELLIPSE:
      case TEXT:
        {
          Boxed boxed = (Boxed) this;
          return BoundingBox.of(x(), y(), boxed.width(), boxed.height());
        }
      case LINE:
      case ARROW:
      case FREEHAND:
        return pointBounds(this.<Stroked>cast().points());
    }
    throw new AssertionError(kind());
  }

  private BoundingBox pointBounds(List<Point> points) {
    if (points.isEmpty()) {
      return BoundingBox.of(x(), y(), 0, 0);
    }
    double minX = Double.POSITIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    for (Point p : points) {
      minX = Math.min(minX, p.x());
      minY = Math.min(minY, p.y());
      maxX = Math.max(maxX, p.x());
      maxY = Math.max(maxY, p.y());
    }
    return BoundingBox.of(x() + minX, y() + minY, maxX - minX, maxY - minY);
  }

  /** Shapes with an explicit width and height. */
  interface Boxed {
    double width();

    double height();
  }

  /** Shapes described by a point list. */
  public abstract static class Stroked extends Shape {
    Stroked() {}

    public abstract ImmutableList<Point> points();

    /** The given point translated into absolute coordinates. */
    public Point absolute(Point point) {
      return point.translate(x(), y());
    }
  }

  /** Lines and arrows, which may be attached to other shapes at either end. */
  public abstract static class Connector extends Stroked {
    Connector() {}

    public abstract Optional<String> startConnection();

    public abstract Optional<String> endConnection();
  }

  @AutoValue
  public abstract static class Rectangle extends Shape implements Boxed {
    @Override
    public abstract double width();

    @Override
    public abstract double height();

    public abstract double cornerRadius();

    @Override
    public Kind kind() {
      return Kind.RECTANGLE;
    }

    public static Builder builder() {
      return new AutoValue_Shape_Rectangle.Builder().setRotation(0).setCornerRadius(0);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setId(String id);

      public abstract Builder setX(double x);

      public abstract Builder setY(double y);

      public abstract Builder setRotation(double rotation);

      public abstract Builder setStyle(ShapeStyle style);

      public abstract Builder setWidth(double width);

      public abstract Builder setHeight(double height);

      public abstract Builder setCornerRadius(double cornerRadius);

      public abstract Rectangle build();
    }
  }

  @AutoValue
  public abstract static class Ellipse extends Shape implements Boxed {
    @Override
    public abstract double width();

    @Override
    public abstract double height();

    @Override
    public Kind kind() {
      return Kind.ELLIPSE;
    }

    public static Builder builder() {
      return new AutoValue_Shape_Ellipse.Builder().setRotation(0);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setId(String id);

      public abstract Builder setX(double x);

      public abstract Builder setY(double y);

      public abstract Builder setRotation(double rotation);

      public abstract Builder setStyle(ShapeStyle style);

      public abstract Builder setWidth(double width);

      public abstract Builder setHeight(double height);

      public abstract Ellipse build();
    }
  }

  @AutoValue
  public abstract static class Line extends Connector {
    @Override
    public Kind kind() {
      return Kind.LINE;
    }

    public static Builder builder() {
      return new AutoValue_Shape_Line.Builder().setX(0).setY(0).setRotation(0);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setId(String id);

      public abstract Builder setX(double x);

      public abstract Builder setY(double y);

      public abstract Builder setRotation(double rotation);

      public abstract Builder setStyle(ShapeStyle style);

      public abstract Builder setPoints(List<Point> points);

      public abstract Builder setStartConnection(String shapeId);

      public abstract Builder setEndConnection(String shapeId);

      public abstract Line build();
    }
  }

  @AutoValue
  public abstract static class Arrow extends Connector {
    public abstract boolean startArrow();

    public abstract boolean endArrow();

    @Override
    public Kind kind() {
      return Kind.ARROW;
    }

    public static Builder builder() {
      return new AutoValue_Shape_Arrow.Builder()
          .setX(0)
          .setY(0)
          .setRotation(0)
          .setStartArrow(false)
          .setEndArrow(true);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setId(String id);

      public abstract Builder setX(double x);

      public abstract Builder setY(double y);

      public abstract Builder setRotation(double rotation);

      public abstract Builder setStyle(ShapeStyle style);

      public abstract Builder setPoints(List<Point> points);

      public abstract Builder setStartConnection(String shapeId);

      public abstract Builder setEndConnection(String shapeId);

      public abstract Builder setStartArrow(boolean startArrow);

      public abstract Builder setEndArrow(boolean endArrow);

      public abstract Arrow build();
    }
  }

  @AutoValue
  public abstract static class Freehand extends Stroked {
    @Override
    public Kind kind() {
      return Kind.FREEHAND;
    }

    public static Builder builder() {
      return new AutoValue_Shape_Freehand.Builder().setRotation(0);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setId(String id);

      public abstract Builder setX(double x);

      public abstract Builder setY(double y);

      public abstract Builder setRotation(double rotation);

      public abstract Builder setStyle(ShapeStyle style);

      public abstract Builder setPoints(List<Point> points);

      public abstract Freehand build();
    }
  }

  @AutoValue
  public abstract static class Text extends Shape implements Boxed {
    public abstract String text();

    public abstract double fontSize();

    public abstract String fontFamily();

    @Override
    public abstract double width();

    @Override
    public abstract double height();

    @Override
    public Kind kind() {
      return Kind.TEXT;
    }

    public static Builder builder() {
      return new AutoValue_Shape_Text.Builder().setRotation(0);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setId(String id);

      public abstract Builder setX(double x);

      public abstract Builder setY(double y);

      public abstract Builder setRotation(double rotation);

      public abstract Builder setStyle(ShapeStyle style);

      public abstract Builder setText(String text);

      public abstract Builder setFontSize(double fontSize);

      public abstract Builder setFontFamily(String fontFamily);

      public abstract Builder setWidth(double width);

      public abstract Builder setHeight(double height);

      public abstract Text build();
    }
  }
}
