package com.gentoro.linktree.storage;

import java.util.List;
import java.util.Locale;

/** Logical columns of the tagged database and the header names accepted for each. */
enum ProcedureColumn {
  /** Preferred over {@link #CODE} when both are present. */
  NAME(List.of("name")),
  CODE(List.of("코드", "code")),
  TITLE(List.of("제목", "title")),
  LINK(List.of("link", "url", "링크")),
  TAG(List.of("tag", "태그"));

  private final List<String> aliases;

  ProcedureColumn(List<String> aliases) {
    this.aliases = aliases;
  }

  boolean matches(String header) {
    return header != null && aliases.contains(header.trim().toLowerCase(Locale.ROOT));
  }

  /** Index of the first header accepted for this column, or -1. */
  int indexIn(List<String> headers) {
    for (int i = 0; i < headers.size(); i++) {
      if (matches(headers.get(i))) return i;
    }
    return -1;
  }
}
