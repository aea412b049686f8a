package com.gentoro.linktree.tree;

import com.gentoro.linktree.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Parses indentation-formatted outlines into a forest of {@link KeywordNode}s.
 *
 * <p>Each group of four leading spaces is one level. Indentation that is not a multiple of four
 * rounds down, tabs do not count as indentation, and blank lines are ignored. A line indented
 * deeper than its predecessor by several levels attaches to the nearest shallower node and is
 * still exactly one level below it, so siblings always share a level.
 */
public class KeywordTreeParser {
  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(KeywordTreeParser.class);

  public static final int SPACES_PER_LEVEL = 4;

  /** Parse outline text and return the top-level nodes in source order. */
  public List<KeywordNode> buildForest(String text) {
    KeywordNode root = KeywordNode.syntheticRoot();
    if (text == null || text.isEmpty()) {
      return root.getChildren();
    }

    Deque<KeywordNode> open = new ArrayDeque<>();
    open.push(root);

    for (String line : text.split("\\r\\n|\\r|\\n")) {
      if (line.isBlank()) {
        continue;
      }
      int level = countLeadingSpaces(line) / SPACES_PER_LEVEL;
      KeywordNode node = new KeywordNode(line.strip(), level);

      // find the nearest strictly shallower ancestor
      while (open.size() > 1 && open.peek().getIndentLevel() >= level) {
        open.pop();
      }
      open.peek().addChild(node);
      open.push(node);
    }
    return root.getChildren();
  }

  /**
   * Parse the outline stored at {@code file}. A missing file is treated as an empty outline.
   *
   * @throws IoException when the file exists but cannot be read
   */
  public List<KeywordNode> buildForest(Path file) {
    if (file == null || !Files.exists(file)) {
      log.debug("Outline file not found, using empty forest: {}", file);
      return List.of();
    }
    try {
      return buildForest(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new IoException("Failed to read outline file: " + file, e);
    }
  }

  static int countLeadingSpaces(String line) {
    int count = 0;
    while (count < line.length() && line.charAt(count) == ' ') {
      count++;
    }
    return count;
  }
}
