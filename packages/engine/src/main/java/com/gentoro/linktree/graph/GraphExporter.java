package com.gentoro.linktree.graph;

import com.gentoro.linktree.tree.KeywordNode;
import java.util.List;

/**
 * Flattens a keyword forest into a {@link KeywordGraph}.
 *
 * <p>Node keys are the ancestor keywords joined with {@value #PATH_SEPARATOR}; a top-level node is
 * keyed by its bare keyword. Identical sibling paths collapse into one node and one edge.
 *
 * <p>Keywords are not escaped, so a keyword containing {@value #PATH_SEPARATOR} can produce the
 * same key as a nested path: the outline {@code "A/B"} at the top level and {@code B} under {@code
 * A} both map to {@code A/B}. The node added last wins and keeps the first one's position; {@link
 * KeywordGraph#addNode} logs a warning when this happens.
 */
public final class GraphExporter {
  public static final String PATH_SEPARATOR = "/";

  private GraphExporter() {}

  public static KeywordGraph flatten(List<KeywordNode> forest) {
    KeywordGraph graph = new KeywordGraph();
    for (KeywordNode root : forest) {
      addRecursive(graph, root, null);
    }
    return graph;
  }

  private static void addRecursive(KeywordGraph graph, KeywordNode node, String parentKey) {
    String key =
        parentKey == null ? node.getKeyword() : parentKey + PATH_SEPARATOR + node.getKeyword();
    graph.addNode(key, node.getLevel(), node.getKeyword());
    if (parentKey != null) {
      graph.connect(parentKey, key, node.getLevel());
    }
    for (KeywordNode child : node.getChildren()) {
      addRecursive(graph, child, key);
    }
  }
}
