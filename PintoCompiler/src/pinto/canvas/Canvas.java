package pinto.canvas;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** An in-memory, ordered shape store: the headless counterpart of a drawing surface. */
public class Canvas implements ShapeSink {
  private final List<Shape> shapes = new ArrayList<>();

  public Canvas() {}

  public Canvas(Iterable<? extends Shape> shapes) {
    addAll(shapes);
  }

  @Override
  public synchronized void addShape(Shape shape) {
    shapes.add(shape);
  }

  public synchronized Optional<Shape> shape(String id) {
    return shapes.stream().filter(s -> s.id().equals(id)).findFirst();
  }

  public synchronized boolean deleteShape(String id) {
    return shapes.removeIf(s -> s.id().equals(id));
  }

  public synchronized void clear() {
    shapes.clear();
  }

  /** A snapshot of the shapes in insertion order. */
  public synchronized ImmutableList<Shape> shapes() {
    return ImmutableList.copyOf(shapes);
  }
}
