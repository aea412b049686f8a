package com.gentoro.linktree.procedure;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/** Parsing and normalization of {@code ;}-separated tag values. */
public final class Tags {
  public static final String SEPARATOR = ";";

  /** Tag assigned to procedures added without any tag. */
  public static final String UNCATEGORIZED = "REST";

  private Tags() {}

  /** Split a raw tag value into its trimmed, non-empty pieces, keeping first-seen order. */
  public static Set<String> split(String raw) {
    if (raw == null || raw.isBlank()) return Set.of();
    return Arrays.stream(raw.split(SEPARATOR))
        .map(String::trim)
        .filter(t -> !t.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Re-split, trim, drop empty pieces and rejoin with {@code ;}. A value with no pieces left
   * normalizes to the empty string. Repeated pieces are kept as written.
   */
  public static String normalize(String raw) {
    if (raw == null) return "";
    return Arrays.stream(raw.split(SEPARATOR))
        .map(String::trim)
        .filter(t -> !t.isEmpty())
        .collect(Collectors.joining(SEPARATOR));
  }
}
