package com.gentoro.linktree.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/** Flat, sorted keyword lists used to populate tag pickers. */
public final class KeywordVocabulary {
  private KeywordVocabulary() {}

  @SafeVarargs
  public static List<String> of(Collection<KeywordNode>... forests) {
    TreeSet<String> keywords = new TreeSet<>();
    for (Collection<KeywordNode> forest : forests) {
      if (forest == null) continue;
      for (KeywordNode root : forest) {
        keywords.addAll(root.allKeywords());
      }
    }
    return new ArrayList<>(keywords);
  }
}
