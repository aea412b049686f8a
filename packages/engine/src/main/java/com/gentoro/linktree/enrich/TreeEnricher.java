package com.gentoro.linktree.enrich;

import com.gentoro.linktree.procedure.ProcedureRecord;
import com.gentoro.linktree.procedure.TagMatcher;
import com.gentoro.linktree.tree.KeywordNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Attaches matching procedures to every node of a keyword forest.
 *
 * <p>Each node is matched against its own keyword only. Procedures tagged with a child keyword
 * never surface at the parent, and parent matches are not inherited by children.
 */
public final class TreeEnricher {
  private TreeEnricher() {}

  public static EnrichedNode enrich(KeywordNode node, List<ProcedureRecord> records) {
    List<ProcedureRecord> matches =
        TagMatcher.matchByKeywords(records, Set.of(node.getKeyword()));
    List<EnrichedNode> children = new ArrayList<>(node.getChildren().size());
    for (KeywordNode child : node.getChildren()) {
      children.add(enrich(child, records));
    }
    return new EnrichedNode(node.getKeyword(), node.getLevel(), matches, children);
  }

  public static List<EnrichedNode> enrichForest(
      List<KeywordNode> forest, List<ProcedureRecord> records) {
    List<EnrichedNode> result = new ArrayList<>(forest.size());
    for (KeywordNode root : forest) {
      result.add(enrich(root, records));
    }
    return result;
  }
}
