package com.gentoro.linktree.graph;

import java.util.Objects;

/**
 * A vertex of a flattened keyword graph.
 *
 * <p>The key is the node's root-to-node path so that equal keywords under different parents stay
 * distinct; the keyword is kept separately for display.
 */
public final class GraphNode {
  private final String key;
  private final int level;
  private final String keyword;
  private final boolean standIn;

  GraphNode(String key, int level, String keyword, boolean standIn) {
    this.key = Objects.requireNonNull(key, "key");
    this.level = level;
    this.keyword = keyword;
    this.standIn = standIn;
  }

  public String getKey() {
    return key;
  }

  public int getLevel() {
    return level;
  }

  public String getKeyword() {
    return keyword;
  }

  /** True when the node was synthesized to anchor an edge whose parent was never added. */
  public boolean isStandIn() {
    return standIn;
  }

  @Override
  public String toString() {
    return "GraphNode{" + key + ", level=" + level + '}';
  }
}
