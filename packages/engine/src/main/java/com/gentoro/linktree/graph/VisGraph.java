package com.gentoro.linktree.graph;

import java.util.List;
import java.util.Map;

/** Node/edge payload in the shape consumed by the vis.js network widget. */
public record VisGraph(List<Map<String, Object>> nodes, List<Map<String, Object>> edges) {}
