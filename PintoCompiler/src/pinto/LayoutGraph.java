package pinto;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The graph handed to a {@link LayoutEngine}: sized nodes and the edges between them. */
@AutoValue
public abstract class LayoutGraph {
  @AutoValue
  public abstract static class Node {
    public abstract String id();

    public abstract double width();

    public abstract double height();

    public abstract Optional<String> label();

    public static Node create(String id, double width, double height, Optional<String> label) {
      return new AutoValue_LayoutGraph_Node(id, width, height, label);
    }
  }

  @AutoValue
  public abstract static class Edge {
    public abstract String id();

    public abstract String source();

    public abstract String target();

    public abstract Optional<String> label();

    public static Edge create(String id, String source, String target, Optional<String> label) {
      return new AutoValue_LayoutGraph_Edge(id, source, target, label);
    }
  }

  public abstract ImmutableList<Node> nodes();

  public abstract ImmutableList<Edge> edges();

  public static LayoutGraph create(List<Node> nodes, List<Edge> edges) {
    return new AutoValue_LayoutGraph(ImmutableList.copyOf(nodes), ImmutableList.copyOf(edges));
  }
}
