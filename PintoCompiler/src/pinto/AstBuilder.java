package pinto;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import pinto.Cst.Element;
import pinto.Cst.Rule;

/**
 * Semantic pass over the CST. Every node reference is merged into a per-document registry; nodes
 * that never appear as explicit statements are prepended to the statement list afterwards.
 *
 * <p>Each builder owns its registry, so one instance must be used for a single document.
 */
public class AstBuilder {
  private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

  private final Map<String, Statement.Node> nodes = new LinkedHashMap<>();
  private boolean built = false;

  public ImmutableList<Statement> build(Cst.Node document) {
    Verify.verify(document.rule() == Rule.DOCUMENT, "expected a document, got %s", document.rule());
    Verify.verify(!built, "AstBuilder instances are single-use");
    built = true;

    List<Statement> statements = collectStatements(document.children());

    Set<String> defined = new HashSet<>();
    for (Statement statement : statements) {
      if (statement.type() == Statement.Type.NODE) {
        defined.add(statement.<Statement.Node>cast().id());
      }
    }

    // Each insertion goes to the front, so later-registered nodes end up first.
    for (Statement.Node node : nodes.values()) {
      if (!defined.contains(node.id())) {
        statements.add(0, node);
      }
    }
    return ImmutableList.copyOf(statements);
  }

  private List<Statement> collectStatements(List<Element> elements) {
    List<Statement> statements = new ArrayList<>();
    for (Element element : elements) {
      if (!element.isNode()) continue;

      Cst.Node node = element.node();
      switch (node.rule()) {
        case GROUP_DEF:
          statements.add(groupDef(node));
          break;
        case LAYOUT_DEF:
          statements.add(Statement.Layout.create(node.token(2).text()));
          break;
        case FREE_ARROW_DEF:
          statements.add(
              Statement.FreeArrow.create(styleProps(node.requiredNode(Rule.STYLE_PROPS))));
          break;
        case EDGE_OR_NODE:
          statements.addAll(edgeOrNode(node));
          break;
        default:
          throw new IllegalStateException("not a statement: " + node.rule());
      }
    }
    return statements;
  }

  private Statement.Group groupDef(Cst.Node node) {
    String id = node.token(1).text();
    StyleProps style =
        node.firstNode(Rule.STYLE_SPEC)
            .map(spec -> styleProps(spec.requiredNode(Rule.STYLE_PROPS)))
            .orElse(StyleProps.empty());
    List<Element> body = new ArrayList<>();
    for (Element element : node.children()) {
      if (element.isNode() && !element.isNode(Rule.STYLE_SPEC)) {
        body.add(element);
      }
    }
    return Statement.Group.create(id, style, collectStatements(body));
  }

  // NodeRef (Arrow NodeRef AnchorSpec? LabelSpec?)*
  private List<Statement> edgeOrNode(Cst.Node node) {
    List<Statement> edges = new ArrayList<>();
    Optional<Statement.Node> previous = Optional.empty();
    Optional<ArrowType> pendingArrow = Optional.empty();
    Statement.Edge.Builder current = null;

    for (Element element : node.children()) {
      Cst.Node child = element.node();
      switch (child.rule()) {
        case NODE_REF:
          {
            Statement.Node ref = register(nodeRef(child));
            if (pendingArrow.isPresent()) {
              flush(current, edges);
              current = Statement.Edge.builder(previous.get().id(), ref.id(), pendingArrow.get());
              pendingArrow = Optional.empty();
            }
            previous = Optional.of(ref);
            break;
          }
        case ARROW:
          pendingArrow = Optional.of(ArrowType.fromToken(child.token(0).type()));
          break;
        case ANCHOR_SPEC:
          current.setAnchors(styleProps(child.requiredNode(Rule.STYLE_PROPS)));
          break;
        case LABEL_SPEC:
          current.setLabel(labelSpec(child));
          break;
        default:
          throw new IllegalStateException("unexpected " + child.rule() + " in edge chain");
      }
    }
    flush(current, edges);
    return edges;
  }

  private static void flush(Statement.Edge.Builder edge, List<Statement> edges) {
    if (edge != null) {
      edges.add(edge.build());
    }
  }

  private Statement.Node register(Statement.Node ref) {
    Statement.Node existing = nodes.get(ref.id());
    if (existing == null) {
      nodes.put(ref.id(), ref);
      return ref;
    }

    if (existing.shape().isPresent()
        && ref.shape().isPresent()
        && existing.shape().get() != ref.shape().get()) {
      log.debug(
          "node '{}' redeclared as {} (was {}); keeping the later shape",
          ref.id(),
          ref.shape().get(),
          existing.shape().get());
    }
    Statement.Node merged = existing.mergedWith(ref);
    nodes.put(ref.id(), merged);
    return merged;
  }

  // Identifier ('.' Identifier)? ShapeSpec? LabelSpec?
  private Statement.Node nodeRef(Cst.Node node) {
    String id = node.token(0).text();
    if (node.firstToken(TokenType.DOT).isPresent()) {
      id = id + "." + node.token(2).text();
    }

    Statement.Node.Builder builder = Statement.Node.builder(id);
    node.firstNode(Rule.SHAPE_SPEC)
        .ifPresent(
            spec -> {
              builder.setShape(
                  ShapeType.fromToken(spec.requiredNode(Rule.SHAPE_TYPE).token(0).type()));
              spec.firstNode(Rule.STYLE_PROPS).ifPresent(p -> builder.setStyle(styleProps(p)));
            });
    node.firstNode(Rule.LABEL_SPEC).ifPresent(label -> builder.setLabel(labelSpec(label)));
    return builder.build();
  }

  private static String labelSpec(Cst.Node node) {
    String raw = node.token(1).text();
    return raw.substring(1, raw.length() - 1);
  }

  private static StyleProps styleProps(Cst.Node node) {
    StyleProps.Builder builder = StyleProps.builder();
    node.nodes(Rule.STYLE_PROP).forEach(prop -> applyStyleProp(prop, builder));
    return builder.build();
  }

  private static void applyStyleProp(Cst.Node prop, StyleProps.Builder builder) {
    String key = prop.token(0).text();
    String value = prop.token(2).text();
    switch (key) {
      case "fill":
        builder.setFill(value);
        return;
      case "stroke":
        builder.setStroke(value);
        return;
      default:
        break;
    }

    Optional<Integer> number = Optional.ofNullable(Ints.tryParse(value));
    if (!number.isPresent()) {
      log.debug("ignoring non-numeric value '{}' for style property '{}'", value, key);
      return;
    }

    switch (key) {
      case "strokeWidth":
        builder.setStrokeWidth(number.get());
        break;
      case "x":
        builder.setX(number.get());
        break;
      case "y":
        builder.setY(number.get());
        break;
      case "width":
        builder.setWidth(number.get());
        break;
      case "height":
        builder.setHeight(number.get());
        break;
      case "x1":
        builder.setX1(number.get());
        break;
      case "y1":
        builder.setY1(number.get());
        break;
      case "x2":
        builder.setX2(number.get());
        break;
      case "y2":
        builder.setY2(number.get());
        break;
      default:
        log.debug("ignoring unknown style property '{}'", key);
    }
  }
}
