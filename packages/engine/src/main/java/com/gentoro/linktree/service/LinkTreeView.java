package com.gentoro.linktree.service;

import com.gentoro.linktree.enrich.EnrichedNode;
import com.gentoro.linktree.graph.VisGraph;
import com.gentoro.linktree.procedure.ProcedureRecord;
import java.util.List;

/**
 * Everything needed to render one version: both enriched outlines, the raw procedure list and,
 * when graph export is enabled, the vis.js payload of the main outline.
 */
public record LinkTreeView(
    String versionId,
    String versionLabel,
    List<EnrichedNode> linkTree,
    List<EnrichedNode> otherKeywords,
    List<ProcedureRecord> procedures,
    VisGraph graph) {}
