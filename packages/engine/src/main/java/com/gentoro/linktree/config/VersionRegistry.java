package com.gentoro.linktree.config;

import com.gentoro.linktree.exception.ConfigException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.tree.ImmutableNode;

/**
 * Versions declared under {@code linktree.versions}. Relative file names resolve against {@code
 * linktree.baseDir}.
 */
public final class VersionRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(VersionRegistry.class);

  private final List<VersionDefinition> versions;

  public VersionRegistry(List<VersionDefinition> versions) {
    this.versions = List.copyOf(versions);
  }

  @SuppressWarnings("unchecked")
  public static VersionRegistry from(Configuration cfg) {
    Path baseDir = Paths.get(cfg.getString("linktree.baseDir", "."));
    if (!(cfg instanceof HierarchicalConfiguration<?>)) {
      log.warn("Configuration is not hierarchical, no versions can be read");
      return new VersionRegistry(List.of());
    }

    List<VersionDefinition> result = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (HierarchicalConfiguration<ImmutableNode> v :
        ((HierarchicalConfiguration<ImmutableNode>) cfg).configurationsAt("linktree.versions")) {
      String id = v.getString("id", "").trim();
      if (id.isEmpty()) {
        throw new ConfigException("Version entry without id in linktree.versions");
      }
      if (!seen.add(id)) {
        throw new ConfigException("Duplicate version id: " + id);
      }
      result.add(
          new VersionDefinition(
              id,
              v.getString("label", id),
              resolve(baseDir, v.getString("tree", null)),
              resolve(baseDir, v.getString("otherKeywords", null)),
              resolve(baseDir, v.getString("taggedDatabase", null))));
    }
    log.debug("Loaded {} version definition(s)", result.size());
    return new VersionRegistry(result);
  }

  private static Path resolve(Path baseDir, String file) {
    if (file == null || file.isBlank()) return null;
    return baseDir.resolve(file.trim()).normalize();
  }

  public List<VersionDefinition> all() {
    return versions;
  }

  /** Look up a version; a null or blank id selects the first declared version. */
  public Optional<VersionDefinition> resolve(String versionId) {
    if (versionId == null || versionId.isBlank()) {
      return versions.stream().findFirst();
    }
    return versions.stream().filter(v -> v.id().equals(versionId.trim())).findFirst();
  }
}
