package pinto.canvas;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

/**
 * Reads and writes board snapshots:
 *
 * <pre>
 * { "version": 1,
 *   "state": { "shapes": [...], "selectedIds": [], "camera": { "x": 0, "y": 0, "zoom": 1 } } }
 * </pre>
 *
 * A bare shape array is also accepted on input.
 */
public final class SnapshotCodec {
  public static final int VERSION = 1;

  private static final ObjectMapper om = new ObjectMapper();

  public static ImmutableList<Shape> read(String json) throws IOException {
    JsonNode root = om.readTree(json);
    JsonNode shapes = root;
    if (root != null && root.isObject()) {
      shapes = root.path("state").path("shapes");
    }
    if (shapes == null || !shapes.isArray()) {
      throw new IOException("snapshot has no shape array");
    }

    ImmutableList.Builder<Shape> builder = ImmutableList.builder();
    for (JsonNode shape : shapes) {
      builder.add(readShape(shape));
    }
    return builder.build();
  }

  public static String write(List<? extends Shape> shapes) throws IOException {
    ObjectNode snapshot = om.createObjectNode();
    snapshot.put("version", VERSION);

    ObjectNode state = snapshot.putObject("state");
    ArrayNode array = state.putArray("shapes");
    for (Shape shape : shapes) {
      array.add(writeShape(shape));
    }
    state.putArray("selectedIds");
    ObjectNode camera = state.putObject("camera");
    camera.put("x", 0);
    camera.put("y", 0);
    camera.put("zoom", 1);

    return om.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
  }

  static Shape readShape(JsonNode node) throws IOException {
    String type = node.path("type").asText();
    Optional<Shape.Kind> kind = Shape.Kind.fromWireName(type);
    if (!kind.isPresent()) {
      throw new IOException("unknown shape type '" + type + "'");
    }
    if (!node.hasNonNull("id")) {
      throw new IOException("shape without id");
    }

    String id = node.get("id").asText();
    double x = node.path("x").asDouble(0);
    double y = node.path("y").asDouble(0);
    double rotation = node.path("rotation").asDouble(0);
    ShapeStyle style =
        ShapeStyle.create(
            node.path("stroke").asText(ShapeStyle.BLACK),
            node.path("strokeWidth").asDouble(2),
            node.path("fill").asText(ShapeStyle.TRANSPARENT),
            node.path("opacity").asDouble(1));

    switch (kind.get()) {
      case RECTANGLE:
        return Shape.Rectangle.builder()
            .setId(id)
            .setX(x)
            .setY(y)
            .setRotation(rotation)
            .setStyle(style)
            .setWidth(node.path("width").asDouble(0))
            .setHeight(node.path("height").asDouble(0))
            .setCornerRadius(node.path("cornerRadius").asDouble(0))
            .build();
      case ELLIPSE:
        return Shape.Ellipse.builder()
            .setId(id)
            .setX(x)
            .setY(y)
            .setRotation(rotation)
            .setStyle(style)
            .setWidth(node.path("width").asDouble(0))
            .setHeight(node.path("height").asDouble(0))
            .build();
      case LINE:
        {
          Shape.Line.Builder line =
              Shape.Line.builder()
                  .setId(id)
                  .setX(x)
                  .setY(y)
                  .setRotation(rotation)
                  .setStyle(style)
                  .setPoints(readPoints(node.path("points")));
          connection(node, "startConnection").ifPresent(line::setStartConnection);
          connection(node, "endConnection").ifPresent(line::setEndConnection);
          return line.build();
        }
      case ARROW:
        {
          Shape.Arrow.Builder arrow =
              Shape.Arrow.builder()
                  .setId(id)
                  .setX(x)
                  .setY(y)
                  .setRotation(rotation)
                  .setStyle(style)
                  .setPoints(readPoints(node.path("points")))
                  .setStartArrow(node.path("startArrow").asBoolean(false))
                  .setEndArrow(node.path("endArrow").asBoolean(true));
          connection(node, "startConnection").ifPresent(arrow::setStartConnection);
          connection(node, "endConnection").ifPresent(arrow::setEndConnection);
          return arrow.build();
        }
      case FREEHAND:
        return Shape.Freehand.builder()
            .setId(id)
            .setX(x)
            .setY(y)
            .setRotation(rotation)
            .setStyle(style)
            .setPoints(readPoints(node.path("points")))
            .build();
      case TEXT:
        return Shape.Text.builder()
            .setId(id)
            .setX(x)
            .setY(y)
            .setRotation(rotation)
            .setStyle(style)
            .setText(node.path("text").asText(""))
            .setFontSize(node.path("fontSize").asDouble(16))
            .setFontFamily(node.path("fontFamily").asText("sans-serif"))
            .setWidth(node.path("width").asDouble(0))
            .setHeight(node.path("height").asDouble(0))
            .build();
    }
    throw new AssertionError(kind.get());
  }

  static ObjectNode writeShape(Shape shape) {
    ObjectNode node = om.createObjectNode();
    node.put("id", shape.id());
    node.put("type", shape.kind().wireName());
    node.put("x", shape.x());
    node.put("y", shape.y());
    node.put("rotation", shape.rotation());
    node.put("stroke", shape.style().stroke());
    node.put("strokeWidth", shape.style().strokeWidth());
    node.put("fill", shape.style().fill());
    node.put("opacity", shape.style().opacity());

    switch (shape.kind()) {
      case RECTANGLE:
        {
          Shape.Rectangle rect = shape.cast();
          node.put("width", rect.width());
          node.put("height", rect.height());
          node.put("cornerRadius", rect.cornerRadius());
          break;
        }
      case ELLIPSE:
        {
          Shape.Ellipse ellipse = shape.cast();
          node.put("width", ellipse.width());
          node.put("height", ellipse.height());
          break;
        }
      case LINE:
        writeConnector(node, shape.cast());
        break;
      case ARROW:
        {
          Shape.Arrow arrow = shape.cast();
          writeConnector(node, arrow);
          node.put("startArrow", arrow.startArrow());
          node.put("endArrow", arrow.endArrow());
          break;
        }
      case FREEHAND:
        writePoints(node, shape.<Shape.Freehand>cast().points());
        break;
      case TEXT:
        {
          Shape.Text text = shape.cast();
          node.put("text", text.text());
          node.put("fontSize", text.fontSize());
          node.put("fontFamily", text.fontFamily());
          node.put("width", text.width());
          node.put("height", text.height());
          break;
        }
    }
    return node;
  }

  private static void writeConnector(ObjectNode node, Shape.Connector connector) {
    writePoints(node, connector.points());
    connector
        .startConnection()
        .ifPresent(id -> node.putObject("startConnection").put("shapeId", id));
    connector.endConnection().ifPresent(id -> node.putObject("endConnection").put("shapeId", id));
  }

  private static void writePoints(ObjectNode node, List<Point> points) {
    ArrayNode array = node.putArray("points");
    for (Point p : points) {
      array.addObject().put("x", p.x()).put("y", p.y());
    }
  }

  private static ImmutableList<Point> readPoints(JsonNode array) {
    ImmutableList.Builder<Point> points = ImmutableList.builder();
    for (JsonNode p : array) {
      points.add(Point.of(p.path("x").asDouble(0), p.path("y").asDouble(0)));
    }
    return points.build();
  }

  private static Optional<String> connection(JsonNode node, String field) {
    JsonNode shapeId = node.path(field).path("shapeId");
    return shapeId.isTextual() ? Optional.of(shapeId.asText()) : Optional.empty();
  }

  private SnapshotCodec() {}
}
