package pinto;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A sparse bag of style and geometry properties. Unset fields are absent, never defaulted. */
@AutoValue
public abstract class StyleProps {
  private static final StyleProps EMPTY = builder().build();

  public abstract Optional<String> fill();

  public abstract Optional<String> stroke();

  public abstract Optional<Integer> strokeWidth();

  public abstract Optional<Integer> x();

  public abstract Optional<Integer> y();

  public abstract Optional<Integer> width();

  public abstract Optional<Integer> height();

  public abstract Optional<Integer> x1();

  public abstract Optional<Integer> y1();

  public abstract Optional<Integer> x2();

  public abstract Optional<Integer> y2();

  public static StyleProps empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new AutoValue_StyleProps.Builder();
  }

  public abstract Builder toBuilder();

  public boolean hasPosition() {
    return x().isPresent() && y().isPresent();
  }

  /** Returns a copy where every field set in {@code other} replaces the field here. */
  public StyleProps merge(StyleProps other) {
    Builder builder = toBuilder();
    other.fill().ifPresent(builder::setFill);
    other.stroke().ifPresent(builder::setStroke);
    other.strokeWidth().ifPresent(builder::setStrokeWidth);
    other.x().ifPresent(builder::setX);
    other.y().ifPresent(builder::setY);
    other.width().ifPresent(builder::setWidth);
    other.height().ifPresent(builder::setHeight);
    other.x1().ifPresent(builder::setX1);
    other.y1().ifPresent(builder::setY1);
    other.x2().ifPresent(builder::setX2);
    other.y2().ifPresent(builder::setY2);
    return builder.build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFill(String fill);

    public abstract Builder setStroke(String stroke);

    public abstract Builder setStrokeWidth(Integer strokeWidth);

    public abstract Builder setX(Integer x);

    public abstract Builder setY(Integer y);

    public abstract Builder setWidth(Integer width);

    public abstract Builder setHeight(Integer height);

    public abstract Builder setX1(Integer x1);

    public abstract Builder setY1(Integer y1);

    public abstract Builder setX2(Integer x2);

    public abstract Builder setY2(Integer y2);

    public abstract StyleProps build();
  }
}
