package pinto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import pinto.canvas.BoundingBox;
import pinto.canvas.Point;
import pinto.canvas.Shape;
import pinto.canvas.ShapeStyle;

/**
 * Turns a {@link DocumentAst} into canvas shapes.
 *
 * <p>If every node of the document carries both {@code x} and {@code y}, nodes are placed at
 * their literal coordinates and edges are straight centre-to-centre connectors. Otherwise the
 * {@link LayoutEngine} positions the nodes and routes the edges.
 */
public class LayoutCompiler {
  private static final Logger log = LoggerFactory.getLogger(LayoutCompiler.class);

  private static final int DEFAULT_STROKE_WIDTH = 2;

  private final LayoutEngine engine;
  private final Supplier<String> idGenerator;

  public LayoutCompiler(LayoutEngine engine) {
    this(engine, () -> UUID.randomUUID().toString());
  }

  public LayoutCompiler(LayoutEngine engine, Supplier<String> idGenerator) {
    this.engine = engine;
    this.idGenerator = idGenerator;
  }

  /** Parses and compiles {@code text}. Parse errors are returned rather than thrown. */
  public CompileResult parseAndCompile(String text, CompileOptions options)
      throws LayoutException {
    DocumentAst ast = PintoParser.parse(text);
    if (ast.hasErrors()) {
      return CompileResult.failed(ast.errors());
    }
    return CompileResult.success(compile(ast, options));
  }

  public ImmutableList<Shape> compile(DocumentAst ast, CompileOptions options)
      throws LayoutException {
    Map<String, Statement.Node> nodes = new LinkedHashMap<>();
    List<Statement.Edge> edges = new ArrayList<>();
    List<Statement.FreeArrow> freeArrows = new ArrayList<>();
    Optional<Statement.Layout> layout = gather(ast.statements(), nodes, edges, freeArrows);

    for (Statement.Edge edge : edges) {
      nodes.computeIfAbsent(edge.from(), Statement.Node::create);
      nodes.computeIfAbsent(edge.to(), Statement.Node::create);
    }

    ImmutableList.Builder<Shape> shapes = ImmutableList.builder();
    if (!nodes.isEmpty()) {
      boolean explicit = nodes.values().stream().allMatch(n -> n.style().hasPosition());
      if (explicit) {
        compileExplicit(nodes, edges, shapes);
      } else {
        compileAutomatic(nodes, edges, withLayoutDirective(options, layout), shapes);
      }
    }

    for (Statement.FreeArrow arrow : freeArrows) {
      shapes.add(
          Shape.Arrow.builder()
              .setId(idGenerator.get())
              .setStyle(connectorStyle())
              .setPoints(
                  ImmutableList.of(
                      Point.of(arrow.x1(), arrow.y1()), Point.of(arrow.x2(), arrow.y2())))
              .setStartArrow(arrow.arrowType().hasStartArrow())
              .setEndArrow(arrow.arrowType().hasEndArrow())
              .build());
    }
    return shapes.build();
  }

  // Returns the last layout directive seen, if any.
  private static Optional<Statement.Layout> gather(
      List<Statement> statements,
      Map<String, Statement.Node> nodes,
      List<Statement.Edge> edges,
      List<Statement.FreeArrow> freeArrows) {
    Optional<Statement.Layout> layout = Optional.empty();
    for (Statement statement : statements) {
      switch (statement.type()) {
        case NODE:
          {
            Statement.Node node = statement.cast();
            nodes.merge(node.id(), node, Statement.Node::mergedWith);
            break;
          }
        case EDGE:
          edges.add(statement.cast());
          break;
        case GROUP:
          {
            Statement.Group group = statement.cast();
            Optional<Statement.Layout> inner =
                gather(group.children(), nodes, edges, freeArrows);
            if (inner.isPresent()) layout = inner;
            break;
          }
        case LAYOUT:
          layout = Optional.of(statement.cast());
          break;
        case FREE_ARROW:
          freeArrows.add(statement.cast());
          break;
      }
    }
    return layout;
  }

  private static CompileOptions withLayoutDirective(
      CompileOptions options, Optional<Statement.Layout> layout) {
    if (!layout.isPresent()) {
      return options;
    }
    String name = layout.get().algorithm();
    Optional<CompileOptions.Algorithm> algorithm = CompileOptions.Algorithm.parse(name);
    if (!algorithm.isPresent()) {
      log.warn("ignoring unknown layout algorithm '{}'", name);
      return options;
    }
    return options.toBuilder().setAlgorithm(algorithm.get()).build();
  }

  private void compileExplicit(
      Map<String, Statement.Node> nodes,
      List<Statement.Edge> edges,
      ImmutableList.Builder<Shape> shapes) {
    Map<String, Shape> nodeShapes = new LinkedHashMap<>();
    for (Statement.Node node : nodes.values()) {
      BoundingBox box =
          BoundingBox.of(
              node.style().x().get(),
              node.style().y().get(),
              node.widthOrDefault(),
              node.heightOrDefault());
      Shape shape = nodeShape(node, box);
      nodeShapes.put(node.id(), shape);
      shapes.add(shape);
    }

    for (Statement.Edge edge : edges) {
      Shape from = nodeShapes.get(edge.from());
      Shape to = nodeShapes.get(edge.to());
      shapes.add(
          connector(
              edge,
              ImmutableList.of(from.bounds().center(), to.bounds().center()),
              from.id(),
              to.id()));
    }
  }

  private void compileAutomatic(
      Map<String, Statement.Node> nodes,
      List<Statement.Edge> edges,
      CompileOptions options,
      ImmutableList.Builder<Shape> shapes)
      throws LayoutException {
    List<LayoutGraph.Node> graphNodes = new ArrayList<>();
    for (Statement.Node node : nodes.values()) {
      graphNodes.add(
          LayoutGraph.Node.create(
              node.id(), node.widthOrDefault(), node.heightOrDefault(), node.label()));
    }
    List<LayoutGraph.Edge> graphEdges = new ArrayList<>();
    for (int i = 0; i < edges.size(); i++) {
      Statement.Edge edge = edges.get(i);
      graphEdges.add(LayoutGraph.Edge.create(edgeId(i), edge.from(), edge.to(), edge.label()));
    }

    LayoutResult result;
    try {
      result = engine.layout(LayoutGraph.create(graphNodes, graphEdges), options);
    } catch (RuntimeException ex) {
      throw new LayoutException("layout engine failed: " + ex.getMessage(), ex);
    }

    Map<String, Shape> nodeShapes = new LinkedHashMap<>();
    for (Statement.Node node : nodes.values()) {
      Optional<BoundingBox> placed = result.node(node.id());
      if (!placed.isPresent()) {
        throw new LayoutException(
            String.format("layout result has no position for node '%s'", node.id()));
      }
      BoundingBox box = placed.get();
      if (!isFinite(box.x()) || !isFinite(box.y())) {
        throw new LayoutException(
            String.format("layout produced a non-finite position for node '%s'", node.id()));
      }
      Shape shape = nodeShape(node, box);
      nodeShapes.put(node.id(), shape);
      shapes.add(shape);
    }

    for (int i = 0; i < edges.size(); i++) {
      Statement.Edge edge = edges.get(i);
      Shape from = nodeShapes.get(edge.from());
      Shape to = nodeShapes.get(edge.to());
      List<Point> points = result.polyline(edgeId(i));
      if (points.isEmpty()) {
        points = ImmutableList.of(from.bounds().center(), to.bounds().center());
      }
      for (Point p : points) {
        if (!isFinite(p.x()) || !isFinite(p.y())) {
          throw new LayoutException(
              String.format(
                  "layout produced a non-finite route for edge %s -> %s", edge.from(), edge.to()));
        }
      }
      shapes.add(connector(edge, points, from.id(), to.id()));
    }
  }

  private static String edgeId(int index) {
    return "e" + index;
  }

  private static boolean isFinite(double d) {
    return !Double.isNaN(d) && !Double.isInfinite(d);
  }

  private Shape nodeShape(Statement.Node node, BoundingBox box) {
    StyleProps style = node.style();
    ShapeStyle shapeStyle =
        ShapeStyle.of(
            style.stroke().orElse(ShapeStyle.BLACK),
            style.strokeWidth().orElse(DEFAULT_STROKE_WIDTH),
            style.fill().orElse(ShapeStyle.WHITE));

    ShapeType type = node.shapeOrDefault();
    if (type == ShapeType.CIRCLE) {
      return Shape.Ellipse.builder()
          .setId(idGenerator.get())
          .setX(box.x())
          .setY(box.y())
          .setWidth(box.width())
          .setHeight(box.height())
          .setStyle(shapeStyle)
          .build();
    }
    return Shape.Rectangle.builder()
        .setId(idGenerator.get())
        .setX(box.x())
        .setY(box.y())
        .setWidth(box.width())
        .setHeight(box.height())
        .setCornerRadius(cornerRadius(type))
        .setStyle(shapeStyle)
        .build();
  }

  private static double cornerRadius(ShapeType type) {
    switch (type) {
      case RECT:
        return 4;
      case CYLINDER:
        return 8;
      case DIAMOND:
      case CIRCLE:
        return 0;
    }
    throw new AssertionError(type);
  }

  private Shape connector(Statement.Edge edge, List<Point> route, String fromId, String toId) {
    List<Point> points = new ArrayList<>(route);
    int last = points.size() - 1;
    Point first = points.get(0);
    points.set(0, Point.of(anchor(edge.x1(), first.x()), anchor(edge.y1(), first.y())));
    Point end = points.get(last);
    points.set(last, Point.of(anchor(edge.x2(), end.x()), anchor(edge.y2(), end.y())));

    if (edge.arrowType() == ArrowType.LINE) {
      return Shape.Line.builder()
          .setId(idGenerator.get())
          .setStyle(connectorStyle())
          .setPoints(points)
          .setStartConnection(fromId)
          .setEndConnection(toId)
          .build();
    }
    return Shape.Arrow.builder()
        .setId(idGenerator.get())
        .setStyle(connectorStyle())
        .setPoints(points)
        .setStartConnection(fromId)
        .setEndConnection(toId)
        .setStartArrow(edge.arrowType().hasStartArrow())
        .setEndArrow(edge.arrowType().hasEndArrow())
        .build();
  }

  private static double anchor(Optional<Integer> override, double routed) {
    return override.map(Integer::doubleValue).orElse(routed);
  }

  private static ShapeStyle connectorStyle() {
    return ShapeStyle.of(ShapeStyle.BLACK, DEFAULT_STROKE_WIDTH, ShapeStyle.TRANSPARENT);
  }
}
