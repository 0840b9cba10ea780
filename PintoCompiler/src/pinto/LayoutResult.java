package pinto;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import pinto.canvas.BoundingBox;
import pinto.canvas.Point;

/** Absolute node boxes and routed edge polylines, keyed by the ids of the {@link LayoutGraph}. */
@AutoValue
public abstract class LayoutResult {
  /** One routed stretch of an edge. */
  @AutoValue
  public abstract static class Section {
    public abstract Point startPoint();

    public abstract ImmutableList<Point> bendPoints();

    public abstract Point endPoint();

    public static Section create(Point startPoint, List<Point> bendPoints, Point endPoint) {
      return new AutoValue_LayoutResult_Section(
          startPoint, ImmutableList.copyOf(bendPoints), endPoint);
    }
  }

  public abstract ImmutableMap<String, BoundingBox> nodes();

  public abstract ImmutableMap<String, ImmutableList<Section>> edges();

  public static LayoutResult create(
      Map<String, BoundingBox> nodes, Map<String, ImmutableList<Section>> edges) {
    return new AutoValue_LayoutResult(ImmutableMap.copyOf(nodes), ImmutableMap.copyOf(edges));
  }

  public Optional<BoundingBox> node(String id) {
    return Optional.ofNullable(nodes().get(id));
  }

  /** Sections for the edge, empty if the engine did not route it. */
  public ImmutableList<Section> sections(String edgeId) {
    return edges().getOrDefault(edgeId, ImmutableList.of());
  }

  /** The sections flattened into one polyline. */
  public ImmutableList<Point> polyline(String edgeId) {
    ImmutableList.Builder<Point> points = ImmutableList.builder();
    for (Section section : sections(edgeId)) {
      points.add(section.startPoint());
      points.addAll(section.bendPoints());
      points.add(section.endPoint());
    }
    return points.build();
  }
}
