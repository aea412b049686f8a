package com.gentoro.linktree.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Directed parent-to-child edge between two {@link GraphNode} keys. */
public final class GraphEdge {
  private final String fromKey;
  private final String toKey;

  public GraphEdge(String fromKey, String toKey) {
    this.fromKey = Objects.requireNonNull(fromKey, "fromKey");
    this.toKey = Objects.requireNonNull(toKey, "toKey");
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("from", fromKey);
    map.put("to", toKey);
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GraphEdge other)) return false;
    return fromKey.equals(other.fromKey) && toKey.equals(other.toKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromKey, toKey);
  }

  @Override
  public String toString() {
    return fromKey + " -> " + toKey;
  }
}
