package com.gentoro.linktree.procedure;

import java.util.List;
import java.util.ListIterator;

/**
 * Mutations applied to a caller-owned, mutable list of procedure records.
 *
 * <p>Operations are not synchronized. Callers that share a list between threads must serialize
 * access themselves.
 */
public final class ProcedureCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(ProcedureCatalog.class);

  private ProcedureCatalog() {}

  /**
   * Replace the tag of the first record with the given code by the normalized {@code newTag}.
   *
   * @return true when a record with that code exists
   */
  public static boolean updateTag(List<ProcedureRecord> records, String code, String newTag) {
    String wanted = code == null ? "" : code.trim();
    ListIterator<ProcedureRecord> it = records.listIterator();
    while (it.hasNext()) {
      ProcedureRecord record = it.next();
      if (record.code().equals(wanted)) {
        String normalized = Tags.normalize(newTag);
        it.set(record.withTag(normalized));
        log.debug("Updated tag of procedure '{}' to '{}'", wanted, normalized);
        return true;
      }
    }
    log.debug("No procedure with code '{}', tag update skipped", wanted);
    return false;
  }

  /**
   * Append a new record. Code, title and link are required; a code that is already present is
   * skipped without error. A missing tag defaults to {@link Tags#UNCATEGORIZED}.
   *
   * @return true when the record was appended
   */
  public static boolean addProcedure(List<ProcedureRecord> records, NewProcedure request) {
    String code = trim(request.code());
    String title = trim(request.title());
    String link = trim(request.link());
    if (code.isEmpty() || title.isEmpty() || link.isEmpty()) {
      log.debug("Incomplete procedure request, add skipped: {}", request);
      return false;
    }
    for (ProcedureRecord existing : records) {
      if (existing.code().equals(code)) {
        log.debug("Procedure '{}' already exists, add skipped", code);
        return false;
      }
    }
    String tag = Tags.normalize(request.tag());
    if (tag.isEmpty()) {
      tag = Tags.UNCATEGORIZED;
    }
    records.add(new ProcedureRecord(code, title, link, tag));
    return true;
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
