package com.gentoro.linktree.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link KeywordGraph} into a vis.js payload: white boxes with black borders and text,
 * black curved arrows. Labels show the bare keyword while ids carry the full path.
 */
public final class VisJsGraphRenderer {
  static final String NODE_BACKGROUND = "#ffffff";
  static final String NODE_HIGHLIGHT_BACKGROUND = "#f3f4f6";
  static final String INK = "#000000";
  static final int FONT_SIZE = 14;
  static final int BORDER_WIDTH = 2;
  static final double EDGE_ROUNDNESS = 0.2;

  private VisJsGraphRenderer() {}

  public static VisGraph render(KeywordGraph graph) {
    List<Map<String, Object>> nodes = new ArrayList<>(graph.nodeCount());
    for (GraphNode node : graph.getNodes()) {
      nodes.add(renderNode(node));
    }
    List<Map<String, Object>> edges = new ArrayList<>(graph.edgeCount());
    for (GraphEdge edge : graph.getEdges()) {
      edges.add(renderEdge(edge));
    }
    return new VisGraph(nodes, edges);
  }

  private static Map<String, Object> renderNode(GraphNode node) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("id", node.getKey());
    data.put("label", node.getKeyword());
    data.put("level", node.getLevel());
    data.put(
        "color",
        Map.of(
            "background", NODE_BACKGROUND,
            "border", INK,
            "highlight", Map.of("background", NODE_HIGHLIGHT_BACKGROUND, "border", INK)));
    data.put("font", Map.of("color", INK, "size", FONT_SIZE));
    data.put("shape", "box");
    data.put("borderWidth", BORDER_WIDTH);
    return data;
  }

  private static Map<String, Object> renderEdge(GraphEdge edge) {
    Map<String, Object> data = edge.toMap();
    data.put("arrows", "to");
    data.put("color", Map.of("color", INK, "highlight", INK));
    data.put("smooth", Map.of("type", "curvedCW", "roundness", EDGE_ROUNDNESS));
    return data;
  }
}
