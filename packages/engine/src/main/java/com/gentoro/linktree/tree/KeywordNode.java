package com.gentoro.linktree.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One line of a keyword outline.
 *
 * <p>A node owns its children; the parent link is a navigation aid for ancestor-path queries and
 * is never serialized or used to transfer ownership. Nodes are only mutated by {@link
 * KeywordTreeParser} while the forest is being built.
 */
public final class KeywordNode {
  static final int ROOT_LEVEL = -1;

  private final String keyword;
  private final int indentLevel;
  private final List<KeywordNode> children = new ArrayList<>();
  private int level;
  private KeywordNode parent;

  KeywordNode(String keyword, int indentLevel) {
    this.keyword = keyword;
    this.indentLevel = indentLevel;
    this.level = indentLevel;
  }

  static KeywordNode syntheticRoot() {
    return new KeywordNode("ROOT", ROOT_LEVEL);
  }

  /** Attach {@code child}; its level becomes one below this node whatever its indentation. */
  void addChild(KeywordNode child) {
    child.parent = this;
    child.level = level + 1;
    children.add(child);
  }

  /** Depth as written in the source, used only to pick a parent while parsing. */
  int getIndentLevel() {
    return indentLevel;
  }

  public String getKeyword() {
    return keyword;
  }

  public int getLevel() {
    return level;
  }

  public List<KeywordNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  boolean isSyntheticRoot() {
    return level == ROOT_LEVEL;
  }

  /**
   * Keywords from the outermost exposed ancestor down to this node, inclusive. The synthetic root
   * is never part of the path.
   */
  public List<String> path() {
    Deque<String> segments = new ArrayDeque<>();
    for (KeywordNode n = this; n != null && !n.isSyntheticRoot(); n = n.parent) {
      segments.addFirst(n.keyword);
    }
    return new ArrayList<>(segments);
  }

  /** This node's keyword together with every descendant keyword. */
  public Set<String> allKeywords() {
    Set<String> keywords = new LinkedHashSet<>();
    collectKeywords(this, keywords);
    return keywords;
  }

  private static void collectKeywords(KeywordNode node, Set<String> into) {
    into.add(node.keyword);
    for (KeywordNode child : node.children) {
      collectKeywords(child, into);
    }
  }

  @Override
  public String toString() {
    return "KeywordNode{keyword='" + keyword + "', level=" + level + ", children=" + children.size()
        + '}';
  }
}
