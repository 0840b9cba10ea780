package pinto;

import com.google.auto.value.AutoValue;

/** A 1-based source span; the end column is inclusive. */
@AutoValue
public abstract class Location {
  public abstract int startLine();

  public abstract int startColumn();

  public abstract int endLine();

  public abstract int endColumn();

  public static Location create(int startLine, int startColumn, int endLine, int endColumn) {
    return new AutoValue_Location(startLine, startColumn, endLine, endColumn);
  }

  public static Location at(int line, int column) {
    return create(line, column, line, column);
  }

  @Override
  public String toString() {
    return startLine() + ":" + startColumn();
  }
}
