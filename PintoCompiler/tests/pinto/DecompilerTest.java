package pinto;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import pinto.canvas.BoundingBox;
import pinto.canvas.Point;
import pinto.canvas.Shape;
import pinto.canvas.ShapeStyle;

public class DecompilerTest {

  private static final ShapeStyle NODE_STYLE =
      ShapeStyle.of(ShapeStyle.BLACK, 2, ShapeStyle.WHITE);
  private static final ShapeStyle CONNECTOR_STYLE =
      ShapeStyle.of(ShapeStyle.BLACK, 2, ShapeStyle.TRANSPARENT);

  private static Shape.Rectangle rect(String id, double x, double y) {
    return rect(id, x, y, NODE_STYLE);
  }

  private static Shape.Rectangle rect(String id, double x, double y, ShapeStyle style) {
    return Shape.Rectangle.builder()
        .setId(id)
        .setX(x)
        .setY(y)
        .setWidth(120)
        .setHeight(60)
        .setStyle(style)
        .build();
  }

  private static Shape.Arrow.Builder arrow(String id, Point from, Point to) {
    return Shape.Arrow.builder()
        .setId(id)
        .setStyle(CONNECTOR_STYLE)
        .setPoints(ImmutableList.of(from, to));
  }

  @Test
  public void emptyInput() {
    assertThat(Decompiler.decompile(ImmutableList.of())).isEmpty();
  }

  @Test
  public void twoNodesAndAnArrow() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 300, 0),
                arrow("s3", Point.of(60, 30), Point.of(360, 30)).build()));

    assertThat(source).isEqualTo("a(rect)\nb(rect)\n\na -> b");
  }

  @Test
  public void nodesOnly() {
    assertThat(Decompiler.decompile(ImmutableList.of(rect("s1", 0, 0))))
        .isEqualTo("a(rect)");
  }

  @Test
  public void connectorPointsAreRelativeToItsOrigin() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 300, 0),
                arrow("s3", Point.of(0, 0), Point.of(300, 0)).setX(60).setY(30).build()));

    assertThat(source).endsWith("a -> b");
  }

  @Test
  public void attachDistanceIsInclusive() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 400, 0),
                arrow("s3", Point.of(170, 30), Point.of(460, 30)).build(),
                arrow("s4", Point.of(171, 30), Point.of(460, 30)).build()));

    assertThat(source).isEqualTo("a(rect)\nb(rect)\n\na -> b");
  }

  @Test
  public void tiesKeepTheEarlierNode() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 100, 0),
                rect("s3", 400, 0),
                arrow("s4", Point.of(110, 30), Point.of(460, 30)).build()));

    assertThat(source).endsWith("\n\na -> c");
  }

  @Test
  public void sameNodeFallsBackToNextCandidate() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 140, 0),
                arrow("s3", Point.of(60, 30), Point.of(125, 30)).build()));

    assertThat(source).endsWith("\n\na -> b");
  }

  @Test
  public void selfLoopsAreDropped() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 500, 0),
                arrow("s3", Point.of(10, 30), Point.of(50, 30)).build()));

    assertThat(source).isEqualTo("a(rect)\nb(rect)");
  }

  @Test
  public void unattachedAndDegenerateConnectorsAreDropped() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 300, 0),
                arrow("s3", Point.of(60, 30), Point.of(1000, 1000)).build(),
                Shape.Arrow.builder()
                    .setId("s4")
                    .setStyle(CONNECTOR_STYLE)
                    .setPoints(ImmutableList.of(Point.of(60, 30)))
                    .build()));

    assertThat(source).isEqualTo("a(rect)\nb(rect)");
  }

  @Test
  public void connectionsWinOverGeometry() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 300, 0),
                arrow("s3", Point.of(5000, 5000), Point.of(60, 30))
                    .setStartConnection("s2")
                    .setEndConnection("missing")
                    .build()));

    assertThat(source).endsWith("\n\nb -> a");
  }

  @Test
  public void arrowSymbols() {
    Point a = Point.of(60, 30);
    Point b = Point.of(360, 30);
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 300, 0),
                arrow("s3", a, b).setStartArrow(true).setEndArrow(false).build(),
                arrow("s4", a, b).setStartArrow(true).build(),
                Shape.Line.builder()
                    .setId("s5")
                    .setStyle(CONNECTOR_STYLE)
                    .setPoints(ImmutableList.of(a, b))
                    .build()));

    assertThat(source).endsWith("\n\na <- b\na <-> b\na -- b");
  }

  @Test
  public void nodeProperties() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0, ShapeStyle.of("#0000ff", 2, "#ff0000")),
                rect("s2", 0, 100, ShapeStyle.of(ShapeStyle.BLACK, 2, ShapeStyle.TRANSPARENT)),
                Shape.Ellipse.builder()
                    .setId("s3")
                    .setX(0)
                    .setY(200)
                    .setWidth(80.4)
                    .setHeight(120.6)
                    .setStyle(NODE_STYLE)
                    .build()));

    assertThat(source)
        .isEqualTo(
            "a(rect, fill: #ff0000, stroke: #0000ff)\n"
                + "b(rect)\n"
                + "c(circle, width: 80, height: 121)");
  }

  @Test
  public void positions() {
    String source =
        Decompiler.withPositions().render(ImmutableList.of(rect("s1", 10.4, -20.6)));

    assertThat(source).isEqualTo("a(rect, x: 10, y: -21)");
  }

  @Test
  public void otherShapesAreIgnored() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                Shape.Text.builder()
                    .setId("t")
                    .setX(0)
                    .setY(0)
                    .setStyle(NODE_STYLE)
                    .setText("hello")
                    .setFontSize(16)
                    .setFontFamily("sans-serif")
                    .setWidth(50)
                    .setHeight(20)
                    .build(),
                rect("s1", 0, 0)));

    assertThat(source).isEqualTo("a(rect)");
  }

  @Test
  public void nodeIds() {
    assertThat(Decompiler.nodeId(0)).isEqualTo("a");
    assertThat(Decompiler.nodeId(25)).isEqualTo("z");
    assertThat(Decompiler.nodeId(26)).isEqualTo("node27");
    assertThat(Decompiler.nodeId(27)).isEqualTo("node28");
  }

  @Test
  public void decompiledSourceParses() {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0, ShapeStyle.of("#0000ff", 2, "#ff0000")),
                rect("s2", 300, 0),
                arrow("s3", Point.of(60, 30), Point.of(360, 30)).build()));

    DocumentAst ast = PintoParser.parse(source);
    assertThat(ast.errors()).isEmpty();
    assertThat(ast.statements()).contains(Statement.Edge.create("a", "b", ArrowType.RIGHT));
  }

  @Test
  public void decompiledSourceRecompiles() throws LayoutException {
    String source =
        Decompiler.decompile(
            ImmutableList.of(
                rect("s1", 0, 0),
                rect("s2", 300, 0),
                arrow("s3", Point.of(60, 30), Point.of(360, 30)).build()));

    LayoutEngine byId =
        (graph, options) -> {
          ImmutableMap.Builder<String, BoundingBox> boxes = ImmutableMap.builder();
          for (LayoutGraph.Node node : graph.nodes()) {
            double x = node.id().equals("a") ? 0 : 300;
            boxes.put(node.id(), BoundingBox.of(x, 0, node.width(), node.height()));
          }
          return LayoutResult.create(boxes.build(), ImmutableMap.of());
        };
    CompileResult result =
        new LayoutCompiler(byId).parseAndCompile(source, CompileOptions.defaults());

    assertThat(result.errors()).isEmpty();
    ImmutableList<Shape> rects =
        result.shapes().stream()
            .filter(s -> s.kind() == Shape.Kind.RECTANGLE)
            .collect(ImmutableList.toImmutableList());
    ImmutableList<Shape> arrows =
        result.shapes().stream()
            .filter(s -> s.kind() == Shape.Kind.ARROW)
            .collect(ImmutableList.toImmutableList());
    assertThat(rects).hasSize(2);
    assertThat(arrows).hasSize(1);

    Shape from = rects.stream().filter(s -> s.x() == 0).findFirst().get();
    Shape to = rects.stream().filter(s -> s.x() == 300).findFirst().get();
    Shape.Arrow arrow = arrows.get(0).cast();
    assertThat(arrow.startConnection()).hasValue(from.id());
    assertThat(arrow.endConnection()).hasValue(to.id());
    assertThat(arrow.endArrow()).isTrue();
    assertThat(arrow.startArrow()).isFalse();
  }
}
