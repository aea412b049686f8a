package com.gentoro.linktree.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Files that make up one version of the link tree. Any of the files may be absent.
 *
 * @param id identifier used to select the version
 * @param label display name
 * @param treeFile main keyword outline
 * @param otherKeywordsFile secondary outline of keywords outside the main tree
 * @param taggedDatabaseFile procedure CSV
 */
public record VersionDefinition(
    String id, String label, Path treeFile, Path otherKeywordsFile, Path taggedDatabaseFile) {

  public Optional<Path> tree() {
    return Optional.ofNullable(treeFile);
  }

  public Optional<Path> otherKeywords() {
    return Optional.ofNullable(otherKeywordsFile);
  }

  public Optional<Path> taggedDatabase() {
    return Optional.ofNullable(taggedDatabaseFile);
  }
}
