package pinto;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** Settings for automatic layout. Ignored when every node carries explicit coordinates. */
@AutoValue
public abstract class CompileOptions {
  public enum Algorithm {
    LAYERED("org.eclipse.elk.layered"),
    FORCE("org.eclipse.elk.force"),
    STRESS("org.eclipse.elk.stress"),
    RADIAL("org.eclipse.elk.radial"),
    BOX("org.eclipse.elk.box");

    private final String elkId;

    Algorithm(String elkId) {
      this.elkId = elkId;
    }

    public String elkId() {
      return elkId;
    }

    public static Optional<Algorithm> parse(String name) {
      for (Algorithm algorithm : values()) {
        if (algorithm.name().equalsIgnoreCase(name.trim())) return Optional.of(algorithm);
      }
      return Optional.empty();
    }
  }

  public enum Direction {
    DOWN,
    RIGHT,
    UP,
    LEFT;

    public static Optional<Direction> parse(String name) {
      for (Direction direction : values()) {
        if (direction.name().equalsIgnoreCase(name.trim())) return Optional.of(direction);
      }
      return Optional.empty();
    }
  }

  public abstract Algorithm algorithm();

  public abstract Direction direction();

  public abstract double nodeSpacing();

  public abstract double edgeSpacing();

  public static CompileOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompileOptions.Builder()
        .setAlgorithm(Algorithm.LAYERED)
        .setDirection(Direction.DOWN)
        .setNodeSpacing(50)
        .setEdgeSpacing(20);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAlgorithm(Algorithm algorithm);

    public abstract Builder setDirection(Direction direction);

    public abstract Builder setNodeSpacing(double nodeSpacing);

    public abstract Builder setEdgeSpacing(double edgeSpacing);

    abstract CompileOptions autoBuild();

    public CompileOptions build() {
      CompileOptions options = autoBuild();
      Preconditions.checkArgument(options.nodeSpacing() >= 0, "negative node spacing");
      Preconditions.checkArgument(options.edgeSpacing() >= 0, "negative edge spacing");
      return options;
    }
  }
}
