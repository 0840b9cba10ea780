package pinto;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * One statement of a parsed document. The set of variants is closed; consumers switch over
 * {@link #type()} and {@link #cast()} to the matching subclass.
 */
public abstract class Statement {
  public enum Type {
    NODE,
    EDGE,
    GROUP,
    LAYOUT,
    FREE_ARROW;
  }

  Statement() {}

  public abstract Type type();

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  @AutoValue
  public abstract static class Node extends Statement {
    public abstract String id();

    public abstract Optional<String> label();

    public abstract Optional<ShapeType> shape();

    public abstract StyleProps style();

    @Override
    public Type type() {
      return Type.NODE;
    }

    public static Node create(String id) {
      return builder(id).build();
    }

    public static Builder builder(String id) {
      return new AutoValue_Statement_Node.Builder().setId(id).setStyle(StyleProps.empty());
    }

    public abstract Builder toBuilder();

    public ShapeType shapeOrDefault() {
      return shape().orElse(ShapeType.DEFAULT);
    }

    public int widthOrDefault() {
      return style().width().orElse(shapeOrDefault().defaultWidth());
    }

    public int heightOrDefault() {
      return style().height().orElse(shapeOrDefault().defaultHeight());
    }

    /**
     * Merges a later reference to the same node: label and shape are replaced only if {@code
     * other} supplies them, and style is merged key by key.
     */
    public Node mergedWith(Node other) {
      Builder builder = toBuilder();
      other.label().ifPresent(builder::setLabel);
      other.shape().ifPresent(builder::setShape);
      builder.setStyle(style().merge(other.style()));
      return builder.build();
    }

    @AutoValue.Builder
    public abstract static class Builder {
      abstract Builder setId(String id);

      public abstract Builder setLabel(String label);

      public abstract Builder setShape(ShapeType shape);

      public abstract Builder setStyle(StyleProps style);

      public abstract Node build();
    }
  }

  @AutoValue
  public abstract static class Edge extends Statement {
    public abstract String from();

    public abstract String to();

    public abstract ArrowType arrowType();

    public abstract Optional<String> label();

    public abstract Optional<Integer> x1();

    public abstract Optional<Integer> y1();

    public abstract Optional<Integer> x2();

    public abstract Optional<Integer> y2();

    @Override
    public Type type() {
      return Type.EDGE;
    }

    public static Edge create(String from, String to, ArrowType arrowType) {
      return builder(from, to, arrowType).build();
    }

    public static Builder builder(String from, String to, ArrowType arrowType) {
      return new AutoValue_Statement_Edge.Builder()
          .setFrom(from)
          .setTo(to)
          .setArrowType(arrowType);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      abstract Builder setFrom(String from);

      abstract Builder setTo(String to);

      abstract Builder setArrowType(ArrowType arrowType);

      public abstract Builder setLabel(String label);

      public abstract Builder setX1(Integer x1);

      public abstract Builder setY1(Integer y1);

      public abstract Builder setX2(Integer x2);

      public abstract Builder setY2(Integer y2);

      public Builder setAnchors(StyleProps anchors) {
        anchors.x1().ifPresent(this::setX1);
        anchors.y1().ifPresent(this::setY1);
        anchors.x2().ifPresent(this::setX2);
        anchors.y2().ifPresent(this::setY2);
        return this;
      }

      public abstract Edge build();
    }
  }

  @AutoValue
  public abstract static class Group extends Statement {
    public abstract String id();

    public abstract StyleProps style();

    public abstract ImmutableList<Statement> children();

    @Override
    public Type type() {
      return Type.GROUP;
    }

    public static Group create(String id, StyleProps style, List<? extends Statement> children) {
      return new AutoValue_Statement_Group(id, style, ImmutableList.copyOf(children));
    }
  }

  @AutoValue
  public abstract static class Layout extends Statement {
    /** The algorithm name exactly as written after {@code @layout:}. */
    public abstract String algorithm();

    @Override
    public Type type() {
      return Type.LAYOUT;
    }

    public static Layout create(String algorithm) {
      return new AutoValue_Statement_Layout(algorithm);
    }
  }

  // arrow(x1: .., y1: .., x2: .., y2: ..)
  @AutoValue
  public abstract static class FreeArrow extends Statement {
    public abstract int x1();

    public abstract int y1();

    public abstract int x2();

    public abstract int y2();

    public abstract ArrowType arrowType();

    @Override
    public Type type() {
      return Type.FREE_ARROW;
    }

    public static FreeArrow create(StyleProps props) {
      return new AutoValue_Statement_FreeArrow(
          props.x1().orElse(0),
          props.y1().orElse(0),
          props.x2().orElse(0),
          props.y2().orElse(0),
          ArrowType.RIGHT);
    }
  }
}
