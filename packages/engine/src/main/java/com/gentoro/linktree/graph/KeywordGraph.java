package com.gentoro.linktree.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Directed graph produced by {@link GraphExporter}. Nodes and edges keep insertion order. */
public final class KeywordGraph {
  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(KeywordGraph.class);

  private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
  private final Set<GraphEdge> edges = new LinkedHashSet<>();

  /**
   * Add or refresh a node. Re-adding a key keeps its position and replaces its attributes; when
   * the replaced node had a different keyword or level the keys collided and a warning is logged.
   */
  public void addNode(String key, int level, String keyword) {
    GraphNode previous = nodes.put(key, new GraphNode(key, level, keyword, false));
    if (previous != null
        && !previous.isStandIn()
        && (previous.getLevel() != level || !previous.getKeyword().equals(keyword))) {
      log.warn(
          "Graph key '{}' reused: '{}' (level {}) replaced by '{}' (level {})",
          key,
          previous.getKeyword(),
          previous.getLevel(),
          keyword,
          level);
    }
  }

  /**
   * Add a parent-to-child edge. If the parent key is unknown a stand-in parent is created one
   * level above the child, labelled with the last path segment of its key.
   */
  public void connect(String parentKey, String childKey, int childLevel) {
    if (!nodes.containsKey(parentKey)) {
      String keyword = parentKey.substring(parentKey.lastIndexOf(GraphExporter.PATH_SEPARATOR) + 1);
      log.debug("Synthesizing stand-in parent '{}' for '{}'", parentKey, childKey);
      nodes.put(parentKey, new GraphNode(parentKey, childLevel - 1, keyword, true));
    }
    edges.add(new GraphEdge(parentKey, childKey));
  }

  public boolean containsNode(String key) {
    return nodes.containsKey(key);
  }

  public Optional<GraphNode> node(String key) {
    return Optional.ofNullable(nodes.get(key));
  }

  public List<GraphNode> getNodes() {
    return new ArrayList<>(nodes.values());
  }

  public List<GraphEdge> getEdges() {
    return new ArrayList<>(edges);
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }
}
