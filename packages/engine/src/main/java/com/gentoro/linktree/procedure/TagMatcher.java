package com.gentoro.linktree.procedure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Selects procedure records by tag or title. Results keep the input order. */
public final class TagMatcher {
  private TagMatcher() {}

  /**
   * Records whose tag set shares at least one value with {@code keywords}. Matching is
   * case-sensitive; untagged records never match.
   */
  public static List<ProcedureRecord> matchByKeywords(
      List<ProcedureRecord> records, Set<String> keywords) {
    if (records == null || keywords == null || keywords.isEmpty()) return List.of();
    List<ProcedureRecord> results = new ArrayList<>();
    for (ProcedureRecord record : records) {
      Set<String> tags = record.tags();
      if (tags.isEmpty()) continue;
      if (!Collections.disjoint(tags, keywords)) {
        results.add(record);
      }
    }
    return results;
  }

  /**
   * Records whose title contains {@code query}, ignoring case. An empty query matches nothing
   * rather than everything.
   */
  public static List<ProcedureRecord> searchByTitle(List<ProcedureRecord> records, String query) {
    if (records == null || query == null || query.isEmpty()) return List.of();
    String needle = query.toLowerCase(Locale.ROOT);
    List<ProcedureRecord> results = new ArrayList<>();
    for (ProcedureRecord record : records) {
      if (record.title().toLowerCase(Locale.ROOT).contains(needle)) {
        results.add(record);
      }
    }
    return results;
  }
}
