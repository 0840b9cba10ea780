package pinto;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import pinto.canvas.BoundingBox;
import pinto.canvas.Point;
import pinto.canvas.Shape;
import pinto.canvas.ShapeStyle;

/**
 * Renders canvas shapes back into DSL source. Rectangles and ellipses become nodes; lines and
 * arrows become edges between the nodes nearest their endpoints. Other shapes are skipped.
 */
public final class Decompiler {
  private static final Logger log = LoggerFactory.getLogger(Decompiler.class);

  /** An endpoint farther than this from every node's box is unattached. */
  static final double ATTACH_DISTANCE = 50;

  private final boolean positions;

  private Decompiler(boolean positions) {
    this.positions = positions;
  }

  /** Decompiles without node coordinates, leaving placement to automatic layout. */
  public static String decompile(List<? extends Shape> shapes) {
    return new Decompiler(false).render(shapes);
  }

  /** A decompiler that also emits each node's {@code x} and {@code y}. */
  public static Decompiler withPositions() {
    return new Decompiler(true);
  }

  public String render(List<? extends Shape> shapes) {
    Map<String, DecompiledNode> nodes = new LinkedHashMap<>();
    for (Shape shape : shapes) {
      if (shape.kind() == Shape.Kind.RECTANGLE || shape.kind() == Shape.Kind.ELLIPSE) {
        String id = nodeId(nodes.size());
        nodes.put(shape.id(), new DecompiledNode(id, shape));
      }
    }

    List<String> edges = new ArrayList<>();
    for (Shape shape : shapes) {
      if (shape.kind() == Shape.Kind.LINE || shape.kind() == Shape.Kind.ARROW) {
        edge(shape.cast(), nodes).ifPresent(edges::add);
      }
    }

    List<String> lines = new ArrayList<>();
    for (DecompiledNode node : nodes.values()) {
      lines.add(nodeLine(node));
    }
    if (!nodes.isEmpty() && !edges.isEmpty()) {
      lines.add("");
    }
    lines.addAll(edges);
    return Joiner.on('\n').join(lines);
  }

  static String nodeId(int index) {
    if (index < 26) {
      return String.valueOf((char) ('a' + index));
    }
    return "node" + (index + 1);
  }

  private String nodeLine(DecompiledNode node) {
    Shape shape = node.shape;
    ShapeType type = shape.kind() == Shape.Kind.ELLIPSE ? ShapeType.CIRCLE : ShapeType.RECT;
    BoundingBox box = shape.bounds();

    List<String> props = new ArrayList<>();
    props.add(type.keyword());
    if (positions) {
      props.add("x: " + Math.round(box.x()));
      props.add("y: " + Math.round(box.y()));
    }
    long width = Math.round(box.width());
    long height = Math.round(box.height());
    if (width != type.defaultWidth() || height != type.defaultHeight()) {
      props.add("width: " + width);
      props.add("height: " + height);
    }
    ShapeStyle style = shape.style();
    if (!style.fill().equals(ShapeStyle.WHITE) && !style.fill().equals(ShapeStyle.TRANSPARENT)) {
      props.add("fill: " + style.fill());
    }
    if (!style.stroke().equals(ShapeStyle.BLACK)) {
      props.add("stroke: " + style.stroke());
    }
    return node.id + "(" + Joiner.on(", ").join(props) + ")";
  }

  private static Optional<String> edge(
      Shape.Connector connector, Map<String, DecompiledNode> nodes) {
    ImmutableList<Point> points = connector.points();
    if (points.size() < 2) {
      log.debug("dropping connector {} with fewer than two points", connector.id());
      return Optional.empty();
    }

    List<DecompiledNode> from =
        candidates(connector.startConnection(), connector.absolute(points.get(0)), nodes);
    List<DecompiledNode> to =
        candidates(
            connector.endConnection(), connector.absolute(points.get(points.size() - 1)), nodes);
    if (from.isEmpty() || to.isEmpty()) {
      log.debug("dropping connector {}: an endpoint is not near any node", connector.id());
      return Optional.empty();
    }

    DecompiledNode start = from.get(0);
    DecompiledNode end = to.get(0);
    if (start == end) {
      if (to.size() > 1) {
        end = to.get(1);
      } else if (from.size() > 1) {
        start = from.get(1);
      } else {
        log.debug("dropping connector {}: both ends attach to {}", connector.id(), start.id);
        return Optional.empty();
      }
    }
    return Optional.of(start.id + " " + symbol(connector) + " " + end.id);
  }

  // In-range nodes nearest first; ties keep encounter order.
  private static List<DecompiledNode> candidates(
      Optional<String> connection, Point point, Map<String, DecompiledNode> nodes) {
    if (connection.isPresent() && nodes.containsKey(connection.get())) {
      return ImmutableList.of(nodes.get(connection.get()));
    }
    List<DecompiledNode> inRange = new ArrayList<>();
    for (DecompiledNode node : nodes.values()) {
      if (node.shape.bounds().distanceTo(point) <= ATTACH_DISTANCE) {
        inRange.add(node);
      }
    }
    inRange.sort(Comparator.comparingDouble(n -> n.shape.bounds().distanceTo(point)));
    return inRange;
  }

  private static String symbol(Shape.Connector connector) {
    if (connector.kind() == Shape.Kind.LINE) {
      return ArrowType.LINE.symbol();
    }
    Shape.Arrow arrow = connector.cast();
    if (arrow.startArrow() && arrow.endArrow()) {
      return ArrowType.BOTH.symbol();
    }
    if (arrow.startArrow()) {
      return ArrowType.LEFT.symbol();
    }
    return ArrowType.RIGHT.symbol();
  }

  private static class DecompiledNode {
    final String id;
    final Shape shape;

    DecompiledNode(String id, Shape shape) {
      this.id = id;
      this.shape = shape;
    }
  }
}
