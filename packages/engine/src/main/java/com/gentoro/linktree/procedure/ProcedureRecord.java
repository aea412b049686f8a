package com.gentoro.linktree.procedure;

import java.util.Set;

/**
 * A tagged knowledge-base entry. Absent fields are stored as empty strings.
 *
 * @param code unique identifier, empty when the source has no code column
 * @param title display title
 * @param link URL of the procedure
 * @param tag one or more tags separated by {@code ;}
 */
public record ProcedureRecord(String code, String title, String link, String tag) {
  public ProcedureRecord {
    code = code == null ? "" : code;
    title = title == null ? "" : title;
    link = link == null ? "" : link;
    tag = tag == null ? "" : tag;
  }

  public Set<String> tags() {
    return Tags.split(tag);
  }

  public ProcedureRecord withTag(String newTag) {
    return new ProcedureRecord(code, title, link, newTag);
  }
}
