package com.gentoro.linktree.enrich;

import com.gentoro.linktree.procedure.ProcedureRecord;
import java.util.List;

/** Serializable view of a keyword node with the procedures tagged with its own keyword. */
public record EnrichedNode(
    String keyword, int level, List<ProcedureRecord> matchedProcedures, List<EnrichedNode> children) {
  public EnrichedNode {
    matchedProcedures = List.copyOf(matchedProcedures);
    children = List.copyOf(children);
  }
}
