package com.gentoro.linktree.storage;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gentoro.linktree.exception.IoException;
import com.gentoro.linktree.procedure.ProcedureRecord;
import com.gentoro.linktree.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes the tagged procedure database CSV.
 *
 * <p>Headers are matched case-insensitively in English or Korean (see {@link ProcedureColumn}).
 * When saving over an existing file its header row is preserved, so files keep the column names
 * and order they were authored with. Files are UTF-8 and written with a byte order mark.
 */
public class TaggedDatabaseStore {
  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(TaggedDatabaseStore.class);

  static final List<String> DEFAULT_HEADER = List.of("코드", "제목", "link", "tag");
  private static final char BOM = '\uFEFF';

  private final CsvMapper mapper;

  public TaggedDatabaseStore() {
    this(JacksonUtility.getCsvMapper());
  }

  public TaggedDatabaseStore(CsvMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Load every row of {@code file}. A missing file yields an empty list.
   *
   * @return a mutable list in file order
   */
  public List<ProcedureRecord> load(Path file) {
    Objects.requireNonNull(file, "file");
    List<ProcedureRecord> records = new ArrayList<>();
    if (!Files.isRegularFile(file)) {
      log.debug("Tagged database not found: {}", file);
      return records;
    }

    List<String[]> rows = readRows(file);
    if (rows.isEmpty()) return records;

    List<String> header = Arrays.asList(rows.get(0));
    int name = ProcedureColumn.NAME.indexIn(header);
    int code = ProcedureColumn.CODE.indexIn(header);
    int title = ProcedureColumn.TITLE.indexIn(header);
    int link = ProcedureColumn.LINK.indexIn(header);
    int tag = ProcedureColumn.TAG.indexIn(header);

    for (String[] row : rows.subList(1, rows.size())) {
      if (row.length == 0 || (row.length == 1 && row[0].isEmpty())) continue;
      // "name" wins over "code" unless it is blank on this row
      String id = cell(row, name);
      if (id.isEmpty()) id = cell(row, code);
      records.add(new ProcedureRecord(id, cell(row, title), cell(row, link), cell(row, tag)));
    }
    log.debug("Loaded {} procedures from {}", records.size(), file);
    return records;
  }

  /**
   * Write {@code records} to {@code file}, replacing its content. The rows go to a temporary file
   * in the same directory which then replaces {@code file}, so a failed write leaves the previous
   * content untouched. The existing header is reused when the file already has one; a {@code code}
   * column is only filled when there is no {@code name} column. Columns with no known meaning are
   * written empty.
   */
  public void save(Path file, List<ProcedureRecord> records) {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(records, "records");
    List<String> header = existingHeader(file);
    if (header.isEmpty()) header = DEFAULT_HEADER;
    boolean hasName = ProcedureColumn.NAME.indexIn(header) >= 0;

    Path target = file.toAbsolutePath();
    try {
      Files.createDirectories(target.getParent());
      Path staging =
          Files.createTempFile(target.getParent(), target.getFileName().toString() + ".", ".tmp");
      try {
        writeRows(staging, header, hasName, records);
        replace(staging, target);
      } finally {
        Files.deleteIfExists(staging);
      }
    } catch (IOException e) {
      throw new IoException("Failed to write tagged database: " + file, e);
    }
    log.debug("Saved {} procedures to {}", records.size(), file);
  }

  private void writeRows(
      Path staging, List<String> header, boolean hasName, List<ProcedureRecord> records)
      throws IOException {
    try (BufferedWriter out = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
      out.write(BOM);
      try (SequenceWriter rows =
          mapper
              .writerFor(String[].class)
              .with(CsvSchema.emptySchema().withLineSeparator("\r\n"))
              .writeValues(out)) {
        rows.write(header.toArray(new String[0]));
        for (ProcedureRecord record : records) {
          rows.write(toRow(header, hasName, record));
        }
      }
    }
  }

  private static void replace(Path staging, Path target) throws IOException {
    try {
      Files.move(
          staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, replacing in place", target);
      Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static String[] toRow(List<String> header, boolean hasName, ProcedureRecord record) {
    String[] row = new String[header.size()];
    for (int i = 0; i < header.size(); i++) {
      String column = header.get(i);
      if (ProcedureColumn.NAME.matches(column)) {
        row[i] = record.code();
      } else if (ProcedureColumn.CODE.matches(column)) {
        row[i] = hasName ? "" : record.code();
      } else if (ProcedureColumn.TITLE.matches(column)) {
        row[i] = record.title();
      } else if (ProcedureColumn.LINK.matches(column)) {
        row[i] = record.link();
      } else if (ProcedureColumn.TAG.matches(column)) {
        row[i] = record.tag();
      } else {
        row[i] = "";
      }
    }
    return row;
  }

  private List<String> existingHeader(Path file) {
    if (!Files.isRegularFile(file)) return List.of();
    List<String[]> rows = readRows(file);
    return rows.isEmpty() ? List.of() : List.of(rows.get(0));
  }

  private List<String[]> readRows(Path file) {
    try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      in.mark(1);
      if (in.read() != BOM) {
        in.reset();
      }
      List<String[]> rows = new ArrayList<>();
      try (MappingIterator<String[]> it =
          mapper
              .readerFor(String[].class)
              .with(CsvParser.Feature.WRAP_AS_ARRAY)
              .readValues(in)) {
        while (it.hasNextValue()) {
          rows.add(it.nextValue());
        }
      }
      return rows;
    } catch (IOException e) {
      throw new IoException("Failed to read tagged database: " + file, e);
    }
  }

  private static String cell(String[] row, int index) {
    if (index < 0 || index >= row.length || row[index] == null) return "";
    return row[index].trim();
  }
}
