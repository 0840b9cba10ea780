package pinto;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import pinto.canvas.BoundingBox;
import pinto.canvas.Point;
import pinto.canvas.Shape;
import pinto.canvas.ShapeStyle;

public class LayoutCompilerTest {

  /** Places node i at (200 * i, 0) and routes nothing unless told to. */
  private static class FakeEngine implements LayoutEngine {
    LayoutGraph graph;
    CompileOptions options;
    final Map<String, ImmutableList<LayoutResult.Section>> routes = new LinkedHashMap<>();

    @Override
    public LayoutResult layout(LayoutGraph graph, CompileOptions options) {
      this.graph = graph;
      this.options = options;
      Map<String, BoundingBox> boxes = new LinkedHashMap<>();
      for (int i = 0; i < graph.nodes().size(); i++) {
        LayoutGraph.Node node = graph.nodes().get(i);
        boxes.put(node.id(), BoundingBox.of(200 * i, 0, node.width(), node.height()));
      }
      return LayoutResult.create(boxes, routes);
    }
  }

  private static final LayoutEngine UNUSED_ENGINE =
      (graph, options) -> {
        throw new AssertionError("layout engine should not be called");
      };

  private static Supplier<String> sequentialIds() {
    int[] next = {0};
    return () -> "s" + (++next[0]);
  }

  private static ImmutableList<Shape> compile(LayoutEngine engine, String... lines)
      throws LayoutException {
    CompileResult result =
        new LayoutCompiler(engine, sequentialIds())
            .parseAndCompile(String.join("\n", lines), CompileOptions.defaults());
    assertThat(result.errors()).isEmpty();
    return result.shapes();
  }

  private static ImmutableList<Shape> ofKind(ImmutableList<Shape> shapes, Shape.Kind kind) {
    return shapes.stream().filter(s -> s.kind() == kind).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyDocument() throws LayoutException {
    assertThat(compile(UNUSED_ENGINE)).isEmpty();
  }

  @Test
  public void explicitPositionsSkipTheEngine() throws LayoutException {
    ImmutableList<Shape> shapes =
        compile(UNUSED_ENGINE, "a(rect, x: 0, y: 0)", "b(circle, x: 200, y: 0)", "a -> b");

    assertThat(shapes).hasSize(3);
    Shape.Rectangle a = ofKind(shapes, Shape.Kind.RECTANGLE).get(0).cast();
    Shape.Ellipse b = ofKind(shapes, Shape.Kind.ELLIPSE).get(0).cast();
    assertThat(a.bounds()).isEqualTo(BoundingBox.of(0, 0, 120, 60));
    assertThat(a.cornerRadius()).isEqualTo(4.0);
    assertThat(b.bounds()).isEqualTo(BoundingBox.of(200, 0, 80, 80));

    Shape.Arrow arrow = ofKind(shapes, Shape.Kind.ARROW).get(0).cast();
    assertThat(arrow.x()).isEqualTo(0.0);
    assertThat(arrow.y()).isEqualTo(0.0);
    assertThat(arrow.points()).containsExactly(Point.of(60, 30), Point.of(240, 40)).inOrder();
    assertThat(arrow.startConnection()).hasValue(a.id());
    assertThat(arrow.endConnection()).hasValue(b.id());
    assertThat(arrow.startArrow()).isFalse();
    assertThat(arrow.endArrow()).isTrue();
    assertThat(arrow.style())
        .isEqualTo(ShapeStyle.of(ShapeStyle.BLACK, 2, ShapeStyle.TRANSPARENT));
  }

  @Test
  public void anchorsOverrideEndpoints() throws LayoutException {
    ImmutableList<Shape> shapes =
        compile(
            UNUSED_ENGINE,
            "a(rect, x: 0, y: 0)",
            "b(rect, x: 300, y: 0)",
            "a -- b (x1: 5, y2: 7)");

    Shape.Line line = ofKind(shapes, Shape.Kind.LINE).get(0).cast();
    assertThat(line.points()).containsExactly(Point.of(5, 30), Point.of(360, 7)).inOrder();
  }

  @Test
  public void shapeMapping() throws LayoutException {
    ImmutableList<Shape> shapes =
        compile(
            UNUSED_ENGINE,
            "d(diamond, x: 0, y: 0)",
            "c(cylinder, x: 0, y: 200, fill: #ff0000, stroke: #00ff00, strokeWidth: 3)",
            "r(rect, x: 0, y: 400, width: 10, height: 20)");

    assertThat(shapes).hasSize(3);
    // Implicit nodes are listed last-referenced first.
    Shape.Rectangle r = shapes.get(0).cast();
    Shape.Rectangle c = shapes.get(1).cast();
    Shape.Rectangle d = shapes.get(2).cast();

    assertThat(d.cornerRadius()).isEqualTo(0.0);
    assertThat(d.bounds()).isEqualTo(BoundingBox.of(0, 0, 100, 100));
    assertThat(d.style()).isEqualTo(ShapeStyle.of(ShapeStyle.BLACK, 2, ShapeStyle.WHITE));

    assertThat(c.cornerRadius()).isEqualTo(8.0);
    assertThat(c.bounds()).isEqualTo(BoundingBox.of(0, 200, 80, 100));
    assertThat(c.style()).isEqualTo(ShapeStyle.of("#00ff00", 3, "#ff0000"));

    assertThat(r.bounds()).isEqualTo(BoundingBox.of(0, 400, 10, 20));
  }

  @Test
  public void arrowheads() throws LayoutException {
    ImmutableList<Shape> shapes =
        compile(
            UNUSED_ENGINE,
            "a(rect, x: 0, y: 0)",
            "b(rect, x: 300, y: 0)",
            "a <- b",
            "a <-> b",
            "a ==> b");

    ImmutableList<Shape> arrows = ofKind(shapes, Shape.Kind.ARROW);
    assertThat(arrows).hasSize(3);
    Shape.Arrow left = arrows.get(0).cast();
    Shape.Arrow both = arrows.get(1).cast();
    Shape.Arrow thick = arrows.get(2).cast();
    assertThat(left.startArrow()).isTrue();
    assertThat(left.endArrow()).isFalse();
    assertThat(both.startArrow()).isTrue();
    assertThat(both.endArrow()).isTrue();
    assertThat(thick.startArrow()).isFalse();
    assertThat(thick.endArrow()).isTrue();
  }

  @Test
  public void automaticLayoutSendsSizedGraph() throws LayoutException {
    FakeEngine engine = new FakeEngine();

    compile(engine, "a(circle, width: 30): \"A\" -> b: \"to b\"", "c(rect, x: 5, y: 5)");

    assertThat(engine.graph.nodes())
        .containsExactly(
            LayoutGraph.Node.create("c", 120, 60, Optional.empty()),
            LayoutGraph.Node.create("b", 120, 60, Optional.of("to b")),
            LayoutGraph.Node.create("a", 30, 80, Optional.of("A")))
        .inOrder();
    assertThat(engine.graph.edges())
        .containsExactly(LayoutGraph.Edge.create("e0", "a", "b", Optional.empty()));
    assertThat(engine.options).isEqualTo(CompileOptions.defaults());
  }

  @Test
  public void automaticLayoutUsesRoutes() throws LayoutException {
    FakeEngine engine = new FakeEngine();
    engine.routes.put(
        "e0",
        ImmutableList.of(
            LayoutResult.Section.create(
                Point.of(120, 30), ImmutableList.of(Point.of(160, 30)), Point.of(200, 30))));

    ImmutableList<Shape> shapes = compile(engine, "a -> b (y2: 99)");

    Shape.Arrow arrow = ofKind(shapes, Shape.Kind.ARROW).get(0).cast();
    assertThat(arrow.points())
        .containsExactly(Point.of(120, 30), Point.of(160, 30), Point.of(200, 99))
        .inOrder();
  }

  @Test
  public void unroutedEdgeFallsBackToCentres() throws LayoutException {
    ImmutableList<Shape> shapes = compile(new FakeEngine(), "a -> b");

    // b is placed first, at x = 0; a second, at x = 200.
    Shape.Arrow arrow = ofKind(shapes, Shape.Kind.ARROW).get(0).cast();
    assertThat(arrow.points()).containsExactly(Point.of(260, 30), Point.of(60, 30)).inOrder();
  }

  @Test
  public void groupsAreCompiled() throws LayoutException {
    ImmutableList<Shape> shapes =
        compile(new FakeEngine(), "group g {", "  a -> b", "  group h { c }", "}");

    assertThat(ofKind(shapes, Shape.Kind.RECTANGLE)).hasSize(3);
    assertThat(ofKind(shapes, Shape.Kind.ARROW)).hasSize(1);
  }

  @Test
  public void layoutDirectiveOverridesAlgorithm() throws LayoutException {
    FakeEngine engine = new FakeEngine();

    compile(engine, "@layout: Force", "a -> b");

    assertThat(engine.options.algorithm()).isEqualTo(CompileOptions.Algorithm.FORCE);
  }

  @Test
  public void unknownLayoutDirectiveIsIgnored() throws LayoutException {
    FakeEngine engine = new FakeEngine();

    compile(engine, "@layout: spiral", "a -> b");

    assertThat(engine.options.algorithm()).isEqualTo(CompileOptions.Algorithm.LAYERED);
  }

  @Test
  public void freeArrowsNeedNoLayout() throws LayoutException {
    ImmutableList<Shape> shapes = compile(UNUSED_ENGINE, "arrow(x1: 1, y1: 2, x2: 30, y2: 40)");

    Shape.Arrow arrow = shapes.get(0).cast();
    assertThat(arrow.points()).containsExactly(Point.of(1, 2), Point.of(30, 40)).inOrder();
    assertThat(arrow.endArrow()).isTrue();
    assertThat(arrow.startConnection()).isEmpty();
  }

  @Test
  public void shapeIdsComeFromTheGenerator() throws LayoutException {
    ImmutableList<Shape> shapes = compile(new FakeEngine(), "a -> b");

    assertThat(shapes.stream().map(Shape::id).collect(ImmutableList.toImmutableList()))
        .containsExactly("s1", "s2", "s3")
        .inOrder();
  }

  @Test
  public void parseErrorsAreReturned() throws LayoutException {
    CompileResult result =
        new LayoutCompiler(UNUSED_ENGINE).parseAndCompile("a -> (", CompileOptions.defaults());

    assertThat(result.hasErrors()).isTrue();
    assertThat(result.shapes()).isEmpty();
  }

  @Test
  public void engineFailureIsALayoutException() {
    LayoutEngine broken =
        (graph, options) -> {
          throw new IllegalStateException("boom");
        };

    LayoutException ex = assertThrows(LayoutException.class, () -> compile(broken, "a -> b"));
    assertThat(ex).hasCauseThat().isInstanceOf(IllegalStateException.class);
    assertThat(ex).hasMessageThat().contains("boom");
  }

  @Test
  public void missingNodeIsALayoutException() {
    LayoutEngine partial =
        (graph, options) ->
            LayoutResult.create(
                ImmutableMap.of("a", BoundingBox.of(0, 0, 120, 60)), ImmutableMap.of());

    LayoutException ex = assertThrows(LayoutException.class, () -> compile(partial, "a -> b"));
    assertThat(ex).hasMessageThat().contains("'b'");
  }

  @Test
  public void nonFinitePositionIsALayoutException() {
    LayoutEngine diverging =
        (graph, options) ->
            LayoutResult.create(
                ImmutableMap.of(
                    "a", BoundingBox.of(Double.NaN, 0, 120, 60),
                    "b", BoundingBox.of(0, 0, 120, 60)),
                ImmutableMap.of());

    assertThrows(LayoutException.class, () -> compile(diverging, "a -> b"));
  }
}
