package com.gentoro.linktree.service;

import com.gentoro.linktree.config.VersionDefinition;
import com.gentoro.linktree.config.VersionRegistry;
import com.gentoro.linktree.enrich.EnrichedNode;
import com.gentoro.linktree.enrich.TreeEnricher;
import com.gentoro.linktree.exception.NotFoundException;
import com.gentoro.linktree.graph.GraphExporter;
import com.gentoro.linktree.graph.VisGraph;
import com.gentoro.linktree.graph.VisJsGraphRenderer;
import com.gentoro.linktree.procedure.NewProcedure;
import com.gentoro.linktree.procedure.ProcedureCatalog;
import com.gentoro.linktree.procedure.ProcedureRecord;
import com.gentoro.linktree.procedure.TagMatcher;
import com.gentoro.linktree.storage.TaggedDatabaseStore;
import com.gentoro.linktree.tree.KeywordNode;
import com.gentoro.linktree.tree.KeywordTreeParser;
import com.gentoro.linktree.tree.KeywordVocabulary;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.apache.commons.configuration2.Configuration;

/**
 * Connects the keyword tree engine to configured versions and their files.
 *
 * <p>Every call re-reads the version's files, so edits made outside the process are picked up
 * immediately. Tag updates and additions run a load-modify-save cycle that is serialized per
 * database file.
 */
public class LinkTreeService {
  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(LinkTreeService.class);

  private final VersionRegistry versions;
  private final KeywordTreeParser parser;
  private final TaggedDatabaseStore store;
  private final boolean graphEnabled;
  private final Map<Path, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

  public LinkTreeService(Configuration configuration) {
    this(
        VersionRegistry.from(configuration),
        new KeywordTreeParser(),
        new TaggedDatabaseStore(),
        configuration.getBoolean("linktree.graph.enabled", true));
  }

  public LinkTreeService(
      VersionRegistry versions,
      KeywordTreeParser parser,
      TaggedDatabaseStore store,
      boolean graphEnabled) {
    this.versions = Objects.requireNonNull(versions, "versions");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.store = Objects.requireNonNull(store, "store");
    this.graphEnabled = graphEnabled;
  }

  public List<VersionDefinition> versions() {
    return versions.all();
  }

  /** Build the enriched outlines and, if enabled, the graph payload for a version. */
  public LinkTreeView view(String versionId) {
    VersionDefinition version = requireVersion(versionId);
    List<ProcedureRecord> procedures = loadProcedures(version);

    List<KeywordNode> tree = version.tree().map(parser::buildForest).orElse(List.of());
    List<KeywordNode> others = version.otherKeywords().map(parser::buildForest).orElse(List.of());

    List<EnrichedNode> linkTree = TreeEnricher.enrichForest(tree, procedures);
    List<EnrichedNode> otherKeywords = TreeEnricher.enrichForest(others, procedures);

    VisGraph graph = null;
    if (graphEnabled && version.tree().isPresent()) {
      graph = VisJsGraphRenderer.render(GraphExporter.flatten(tree));
    }
    log.debug(
        "Built view for version '{}': {} roots, {} other roots, {} procedures",
        version.id(),
        tree.size(),
        others.size(),
        procedures.size());
    return new LinkTreeView(
        version.id(), version.label(), linkTree, otherKeywords, procedures, graph);
  }

  /** Sorted keywords of the main and secondary outlines, for tag pickers. */
  public List<String> keywordVocabulary(String versionId) {
    VersionDefinition version = requireVersion(versionId);
    List<KeywordNode> tree = version.tree().map(parser::buildForest).orElse(List.of());
    List<KeywordNode> others = version.otherKeywords().map(parser::buildForest).orElse(List.of());
    return KeywordVocabulary.of(tree, others);
  }

  public List<ProcedureRecord> search(String versionId, String query) {
    return TagMatcher.searchByTitle(loadProcedures(requireVersion(versionId)), query);
  }

  /**
   * Replace the tag of the procedure with {@code code}.
   *
   * @return true when the procedure exists and the database was rewritten
   */
  public boolean updateProcedureTag(String versionId, String code, String tag) {
    return modify(versionId, records -> ProcedureCatalog.updateTag(records, code, tag));
  }

  /**
   * Add a procedure. Incomplete requests and duplicate codes are ignored.
   *
   * @return true when the procedure was added and the database was rewritten
   */
  public boolean addProcedure(String versionId, NewProcedure request) {
    return modify(versionId, records -> ProcedureCatalog.addProcedure(records, request));
  }

  private boolean modify(String versionId, Predicate<List<ProcedureRecord>> change) {
    VersionDefinition version = requireVersion(versionId);
    if (version.taggedDatabase().isEmpty()) {
      log.info("Version '{}' has no tagged database, change ignored", version.id());
      return false;
    }
    Path file = version.taggedDatabase().get().toAbsolutePath();
    ReentrantLock lock = writeLocks.computeIfAbsent(file, f -> new ReentrantLock());
    lock.lock();
    try {
      List<ProcedureRecord> records = store.load(file);
      if (!change.test(records)) {
        return false;
      }
      store.save(file, records);
      return true;
    } finally {
      lock.unlock();
    }
  }

  private List<ProcedureRecord> loadProcedures(VersionDefinition version) {
    return version.taggedDatabase().map(store::load).orElseGet(ArrayList::new);
  }

  private VersionDefinition requireVersion(String versionId) {
    return versions
        .resolve(versionId)
        .orElseThrow(
            () ->
                new NotFoundException(
                    "Version not found: " + versionId,
                    versionId == null ? Map.of() : Map.of("version", versionId)));
  }
}
