package pinto;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.elk.alg.force.options.ForceMetaDataProvider;
import org.eclipse.elk.alg.force.options.StressMetaDataProvider;
import org.eclipse.elk.alg.layered.options.LayeredMetaDataProvider;
import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.alg.radial.options.RadialMetaDataProvider;
import org.eclipse.elk.core.RecursiveGraphLayoutEngine;
import org.eclipse.elk.core.data.LayoutMetaDataService;
import org.eclipse.elk.core.options.CoreOptions;
import org.eclipse.elk.core.options.Direction;
import org.eclipse.elk.core.util.BasicProgressMonitor;
import org.eclipse.elk.graph.ElkBendPoint;
import org.eclipse.elk.graph.ElkEdge;
import org.eclipse.elk.graph.ElkEdgeSection;
import org.eclipse.elk.graph.ElkNode;
import org.eclipse.elk.graph.util.ElkGraphUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import pinto.canvas.BoundingBox;
import pinto.canvas.Point;

/**
 * {@link LayoutEngine} backed by the Eclipse Layout Kernel. Every call builds and lays out its own
 * ELK graph, so instances are safe to share.
 */
public class ElkLayoutEngine implements LayoutEngine {
  private static final Logger log = LoggerFactory.getLogger(ElkLayoutEngine.class);

  static {
    LayoutMetaDataService.getInstance()
        .registerLayoutMetaDataProviders(
            new LayeredMetaDataProvider(),
            new ForceMetaDataProvider(),
            new StressMetaDataProvider(),
            new RadialMetaDataProvider());
  }

  @Override
  public LayoutResult layout(LayoutGraph graph, CompileOptions options) throws LayoutException {
    ElkNode root = ElkGraphUtil.createGraph();
    root.setProperty(CoreOptions.ALGORITHM, options.algorithm().elkId());
    root.setProperty(CoreOptions.DIRECTION, direction(options.direction()));
    root.setProperty(CoreOptions.SPACING_NODE_NODE, options.nodeSpacing());
    root.setProperty(CoreOptions.SPACING_EDGE_EDGE, options.edgeSpacing());
    root.setProperty(LayeredOptions.SPACING_NODE_NODE_BETWEEN_LAYERS, options.nodeSpacing());

    Map<String, ElkNode> nodes = new LinkedHashMap<>();
    for (LayoutGraph.Node node : graph.nodes()) {
      ElkNode elkNode = ElkGraphUtil.createNode(root);
      elkNode.setIdentifier(node.id());
      elkNode.setDimensions(node.width(), node.height());
      node.label().ifPresent(label -> ElkGraphUtil.createLabel(label, elkNode));
      nodes.put(node.id(), elkNode);
    }

    Map<String, ElkEdge> edges = new LinkedHashMap<>();
    for (LayoutGraph.Edge edge : graph.edges()) {
      ElkNode source = nodes.get(edge.source());
      ElkNode target = nodes.get(edge.target());
      if (source == null || target == null) {
        throw new LayoutException(
            String.format("edge %s references an unknown node", edge.id()));
      }
      ElkEdge elkEdge = ElkGraphUtil.createSimpleEdge(source, target);
      elkEdge.setIdentifier(edge.id());
      edge.label().ifPresent(label -> ElkGraphUtil.createLabel(label, elkEdge));
      edges.put(edge.id(), elkEdge);
    }

    log.info(
        "running {} layout on {} nodes and {} edges",
        options.algorithm(),
        nodes.size(),
        edges.size());
    try {
      new RecursiveGraphLayoutEngine().layout(root, new BasicProgressMonitor());
    } catch (RuntimeException ex) {
      throw new LayoutException(
          String.format("%s layout failed: %s", options.algorithm(), ex.getMessage()), ex);
    }

    Map<String, BoundingBox> boxes = new LinkedHashMap<>();
    for (Map.Entry<String, ElkNode> entry : nodes.entrySet()) {
      ElkNode n = entry.getValue();
      boxes.put(entry.getKey(), BoundingBox.of(n.getX(), n.getY(), n.getWidth(), n.getHeight()));
    }

    Map<String, ImmutableList<LayoutResult.Section>> routes = new LinkedHashMap<>();
    for (Map.Entry<String, ElkEdge> entry : edges.entrySet()) {
      ImmutableList.Builder<LayoutResult.Section> sections = ImmutableList.builder();
      for (ElkEdgeSection section : entry.getValue().getSections()) {
        ImmutableList.Builder<Point> bends = ImmutableList.builder();
        for (ElkBendPoint bend : section.getBendPoints()) {
          bends.add(Point.of(bend.getX(), bend.getY()));
        }
        sections.add(
            LayoutResult.Section.create(
                Point.of(section.getStartX(), section.getStartY()),
                bends.build(),
                Point.of(section.getEndX(), section.getEndY())));
      }
      routes.put(entry.getKey(), sections.build());
    }

    return LayoutResult.create(boxes, routes);
  }

  private static Direction direction(CompileOptions.Direction direction) {
    switch (direction) {
      case DOWN:
        return Direction.DOWN;
      case RIGHT:
        return Direction.RIGHT;
      case UP:
        return Direction.UP;
      case LEFT:
        return Direction.LEFT;
    }
    throw new AssertionError(direction);
  }
}
