package pinto.canvas;

/** Receives compiled shapes, one at a time. */
public interface ShapeSink {
  void addShape(Shape shape);

  default void addAll(Iterable<? extends Shape> shapes) {
    for (Shape shape : shapes) {
      addShape(shape);
    }
  }
}
