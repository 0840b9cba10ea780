package pinto;

/** Assigns positions to nodes and routes edges for automatic layout. */
public interface LayoutEngine {
  /**
   * Lays out {@code graph}. Implementations must either return a position for every node or
   * throw; partial results are not allowed.
   */
  LayoutResult layout(LayoutGraph graph, CompileOptions options) throws LayoutException;
}
