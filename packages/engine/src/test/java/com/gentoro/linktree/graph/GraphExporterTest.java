package com.gentoro.linktree.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.linktree.tree.KeywordTreeParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphExporterTest {

  private final KeywordTreeParser parser = new KeywordTreeParser();

  @Test
  @DisplayName("Path identities and parent-to-child edges for a simple outline")
  void flattenSimpleOutline() {
    KeywordGraph graph = GraphExporter.flatten(parser.buildForest("A\n    B\n    C\nD\n"));

    assertEquals(List.of("A", "A/B", "A/C", "D"), keys(graph));
    assertEquals(List.of("A -> A/B", "A -> A/C"), edges(graph));
    assertEquals(1, graph.node("A/C").orElseThrow().getLevel());
    assertEquals("C", graph.node("A/C").orElseThrow().getKeyword());
  }

  @Test
  @DisplayName("Equal keywords under different parents stay distinct")
  void repeatedKeywordsDoNotCollapse() {
    KeywordGraph graph = GraphExporter.flatten(parser.buildForest("HW\n    CPU\nSW\n    CPU\n"));

    assertTrue(graph.containsNode("HW/CPU"));
    assertTrue(graph.containsNode("SW/CPU"));
    assertEquals(4, graph.nodeCount());
    assertEquals(List.of("HW -> HW/CPU", "SW -> SW/CPU"), edges(graph));
  }

  @Test
  @DisplayName("Identical sibling paths collapse into one node and one edge")
  void duplicateSiblingsCollapse() {
    KeywordGraph graph = GraphExporter.flatten(parser.buildForest("A\n    B\n    B\n"));

    assertEquals(List.of("A", "A/B"), keys(graph));
    assertEquals(1, graph.edgeCount());
  }

  @Test
  @DisplayName("Deep paths use every ancestor keyword")
  void deepPaths() {
    KeywordGraph graph =
        GraphExporter.flatten(parser.buildForest("A\n    B\n        C\n            D\n"));

    assertEquals(List.of("A", "A/B", "A/B/C", "A/B/C/D"), keys(graph));
    assertEquals(3, graph.edgeCount());
    assertEquals(3, graph.node("A/B/C/D").orElseThrow().getLevel());
  }

  @Test
  @DisplayName("An edge to an unknown parent synthesizes a stand-in node")
  void standInParent() {
    KeywordGraph graph = new KeywordGraph();
    graph.addNode("X/Y/Z", 2, "Z");
    graph.connect("X/Y", "X/Y/Z", 2);

    GraphNode standIn = graph.node("X/Y").orElseThrow();
    assertTrue(standIn.isStandIn());
    assertEquals(1, standIn.getLevel());
    assertEquals("Y", standIn.getKeyword());
    assertEquals(List.of("X/Y -> X/Y/Z"), edges(graph));
  }

  @Test
  @DisplayName("A keyword containing the separator shares its key with the nested path")
  void separatorInKeywordCollides() {
    KeywordGraph graph = GraphExporter.flatten(parser.buildForest("A/B\nA\n    B\n"));

    assertEquals(List.of("A/B", "A"), keys(graph));
    GraphNode shared = graph.node("A/B").orElseThrow();
    assertEquals("B", shared.getKeyword());
    assertEquals(1, shared.getLevel());
    assertFalse(shared.isStandIn());
    assertEquals(1, graph.edgeCount());
  }

  @Test
  @DisplayName("Flattening never needs stand-ins and an empty forest gives an empty graph")
  void noStandInsForWellFormedForests() {
    KeywordGraph graph =
        GraphExporter.flatten(parser.buildForest("A\n            B\n    C\n        D\n"));
    assertTrue(graph.getNodes().stream().noneMatch(GraphNode::isStandIn));
    assertEquals(graph.nodeCount() - 1, graph.edgeCount());

    KeywordGraph empty = GraphExporter.flatten(List.of());
    assertEquals(0, empty.nodeCount());
    assertEquals(0, empty.edgeCount());
  }

  private static List<String> keys(KeywordGraph graph) {
    List<String> keys = new ArrayList<>();
    graph.getNodes().forEach(n -> keys.add(n.getKey()));
    return keys;
  }

  private static List<String> edges(KeywordGraph graph) {
    List<String> edges = new ArrayList<>();
    graph.getEdges().forEach(e -> edges.add(e.toString()));
    return edges;
  }
}
