package pinto;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import pinto.canvas.Shape;

/** Shapes produced from DSL source, or the parse errors that prevented compiling it. */
@AutoValue
public abstract class CompileResult {
  public abstract ImmutableList<Shape> shapes();

  public abstract ImmutableList<ParseError> errors();

  public static CompileResult success(List<Shape> shapes) {
    return new AutoValue_CompileResult(ImmutableList.copyOf(shapes), ImmutableList.of());
  }

  public static CompileResult failed(List<ParseError> errors) {
    return new AutoValue_CompileResult(ImmutableList.of(), ImmutableList.copyOf(errors));
  }

  public boolean hasErrors() {
    return !errors().isEmpty();
  }
}
