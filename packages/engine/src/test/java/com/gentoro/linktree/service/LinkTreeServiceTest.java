package com.gentoro.linktree.service;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.linktree.enrich.EnrichedNode;
import com.gentoro.linktree.exception.NotFoundException;
import com.gentoro.linktree.procedure.NewProcedure;
import com.gentoro.linktree.procedure.ProcedureRecord;
import com.gentoro.linktree.storage.TaggedDatabaseStore;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LinkTreeServiceTest {

  @TempDir Path dataDir;

  @BeforeEach
  void copyFixtures() throws Exception {
    for (String name : List.of("tree.txt", "other_keywords.txt", "tagged_database.csv")) {
      try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
        assertNotNull(in, "fixture " + name);
        Files.copy(in, dataDir.resolve(name));
      }
    }
  }

  private LinkTreeService service(boolean graphEnabled) throws Exception {
    String yaml =
        String.join(
            "\n",
            "linktree:",
            "  baseDir: '" + dataDir.toString().replace("'", "''") + "'",
            "  graph:",
            "    enabled: " + graphEnabled,
            "  versions:",
            "    - id: v1",
            "      label: Version 1",
            "      tree: tree.txt",
            "      otherKeywords: other_keywords.txt",
            "      taggedDatabase: tagged_database.csv",
            "    - id: bare",
            "");
    YAMLConfiguration cfg = new YAMLConfiguration();
    cfg.read(new StringReader(yaml));
    return new LinkTreeService(cfg);
  }

  private static EnrichedNode child(EnrichedNode parent, String keyword) {
    return parent.children().stream()
        .filter(c -> c.keyword().equals(keyword))
        .findFirst()
        .orElseThrow();
  }

  private static List<String> codes(List<ProcedureRecord> records) {
    return records.stream().map(ProcedureRecord::code).collect(Collectors.toList());
  }

  @Test
  @DisplayName("View enriches every node with the procedures tagged by its keyword")
  void viewEnrichesTree() throws Exception {
    LinkTreeView view = service(true).view(null);

    assertEquals("v1", view.versionId());
    assertEquals("Version 1", view.versionLabel());
    assertEquals(4, view.procedures().size());
    assertEquals(2, view.linkTree().size());

    EnrichedNode hardware = view.linkTree().get(0);
    assertEquals("Hardware", hardware.keyword());
    assertEquals(0, hardware.level());
    assertEquals(List.of("P-2"), codes(hardware.matchedProcedures()));

    EnrichedNode cpu = child(hardware, "CPU");
    assertEquals(1, cpu.level());
    assertEquals(List.of("P-1", "P-4"), codes(cpu.matchedProcedures()));
    assertTrue(child(cpu, "Cache").matchedProcedures().isEmpty());

    EnrichedNode kernelCpu = child(child(view.linkTree().get(1), "Kernel"), "CPU");
    assertEquals(2, kernelCpu.level());
    assertEquals(List.of("P-1", "P-4"), codes(kernelCpu.matchedProcedures()));

    assertEquals("Network", view.otherKeywords().get(0).keyword());
    assertTrue(child(view.otherKeywords().get(0), "REST").matchedProcedures().isEmpty());
  }

  @Test
  @DisplayName("Graph payload is built when enabled and omitted when disabled")
  void graphToggle() throws Exception {
    LinkTreeView enabled = service(true).view("v1");
    assertNotNull(enabled.graph());
    assertEquals(7, enabled.graph().nodes().size());
    assertEquals(5, enabled.graph().edges().size());
    assertTrue(
        enabled.graph().nodes().stream()
            .map(n -> n.get("id"))
            .collect(Collectors.toList())
            .containsAll(List.of("Hardware/CPU", "Software/Kernel/CPU")));

    assertNull(service(false).view("v1").graph());
    assertNull(service(true).view("bare").graph());
  }

  @Test
  @DisplayName("Vocabulary is the sorted union of both outlines")
  void vocabulary() throws Exception {
    assertEquals(
        List.of("CPU", "Cache", "Hardware", "Kernel", "Memory", "Network", "REST", "Software"),
        service(true).keywordVocabulary("v1"));
    assertTrue(service(true).keywordVocabulary("bare").isEmpty());
  }

  @Test
  @DisplayName("Search matches titles case-insensitively")
  void search() throws Exception {
    LinkTreeService service = service(true);
    assertEquals(List.of("P-1"), codes(service.search("v1", "cpu FAN")));
    assertTrue(service.search("v1", "").isEmpty());
  }

  @Test
  @DisplayName("Tag updates are normalized and written back to the database")
  void updateTagPersists() throws Exception {
    LinkTreeService service = service(true);

    assertTrue(service.updateProcedureTag("v1", "P-3", "  cpu ; ;mem  "));
    assertFalse(service.updateProcedureTag("v1", "P-404", "x"));

    List<ProcedureRecord> stored =
        new TaggedDatabaseStore().load(dataDir.resolve("tagged_database.csv"));
    assertEquals("cpu;mem", stored.get(2).tag());
    assertTrue(
        Files.readAllLines(dataDir.resolve("tagged_database.csv")).get(0).endsWith(",Owner"));
  }

  @Test
  @DisplayName("Added procedures default to REST and duplicates are ignored")
  void addProcedure() throws Exception {
    LinkTreeService service = service(true);

    assertTrue(
        service.addProcedure("v1", new NewProcedure(" P-5 ", "New guide", "http://kb/p5", "")));
    assertFalse(service.addProcedure("v1", new NewProcedure("P-5", "Again", "http://kb/x", "CPU")));
    assertFalse(service.addProcedure("v1", new NewProcedure("P-6", "", "http://kb/p6", "CPU")));

    List<ProcedureRecord> stored = service.view("v1").procedures();
    assertEquals(5, stored.size());
    assertEquals(new ProcedureRecord("P-5", "New guide", "http://kb/p5", "REST"), stored.get(4));

    EnrichedNode rest = child(service.view("v1").otherKeywords().get(0), "REST");
    assertEquals(List.of("P-5"), codes(rest.matchedProcedures()));
  }

  @Test
  @DisplayName("Changes to a version without a database are ignored")
  void bareVersionChanges() throws Exception {
    LinkTreeService service = service(true);
    assertFalse(service.addProcedure("bare", new NewProcedure("X", "T", "L", "")));
    assertFalse(Files.exists(dataDir.resolve("bare")));
  }

  @Test
  @DisplayName("Unknown versions raise NotFoundException")
  void unknownVersion() throws Exception {
    NotFoundException e =
        assertThrows(NotFoundException.class, () -> service(true).view("v9"));
    assertEquals(Map.of("version", "v9"), e.getContext());
  }
}
