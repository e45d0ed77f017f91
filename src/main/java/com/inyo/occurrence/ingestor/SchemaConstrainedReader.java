/*
 * Copyright 2025 Inyo Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.inyo.occurrence.ingestor;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a delimited file into a {@link PartitionedTable} holding only the schema's columns, in
 * schema order, every value kept as text. Cells matching a missing token become nulls.
 *
 * <p>Records follow the usual CSV quoting rules, so a quoted field may contain the delimiter or a
 * line break. A record whose quoting is never closed, or whose field count differs from the header,
 * is skipped and counted against the partition it falls into; the read goes on. Empty lines are
 * ignored. A partition is cut every {@code partitionLines} records, skipped ones included.
 */
public final class SchemaConstrainedReader {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaConstrainedReader.class);

  // Individual skipped records are logged up to this many, the rest only in totals
  private static final int MAX_LOGGED_SKIPS = 10;

  // Longest record, in physical lines, a quoted field may stretch over
  static final int MAX_RECORD_LINES = 64;

  private final BufferAllocator allocator;
  private final MissingValues missingValues;
  private final int partitionLines;

  public SchemaConstrainedReader(
      BufferAllocator allocator, MissingValues missingValues, int partitionLines) {
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null");
    }
    if (partitionLines < 1) {
      throw new IllegalArgumentException("partitionLines must be positive: " + partitionLines);
    }
    this.allocator = allocator;
    this.missingValues = Objects.requireNonNull(missingValues, "missingValues");
    this.partitionLines = partitionLines;
  }

  /**
   * Parses {@code path} with the given delimiter.
   *
   * @throws IngestException if the file cannot be read, the header lacks schema columns or no row
   *     survives parsing
   */
  public PartitionedTable read(Path path, char delimiter, OccurrenceSchema schema) {
    List<TablePartition> partitions = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String headerLine = reader.readLine();
      if (headerLine == null) {
        throw new IngestException("Source " + path + " is empty, no header row");
      }
      var header = parseHeader(newParser(delimiter), headerLine, path);
      var projection = project(header, schema, delimiter, path);

      var records = new RecordReader(reader, delimiter);
      var batch = new PartitionBatch(schema.size());
      long totalSkipped = 0;
      SourceRecord sourceRecord;
      while ((sourceRecord = records.next()) != null) {
        batch.sourceLines++;
        String problem = sourceRecord.problem();
        if (problem == null && sourceRecord.fields().length != projection.width()) {
          problem =
              "expected " + projection.width() + " fields, found " + sourceRecord.fields().length;
        }
        if (problem != null) {
          logSkip(sourceRecord.lineNumber(), problem, totalSkipped);
          batch.skippedLines++;
          totalSkipped++;
        } else {
          batch.add(sourceRecord.fields(), projection, missingValues);
        }
        if (batch.sourceLines >= partitionLines) {
          partitions.add(batch.toPartition(partitions.size(), schema, allocator));
          batch = new PartitionBatch(schema.size());
        }
      }
      if (batch.sourceLines > 0) {
        partitions.add(batch.toPartition(partitions.size(), schema, allocator));
      }
    } catch (IOException e) {
      closeAll(partitions);
      throw new IngestException("Cannot read source file " + path + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      closeAll(partitions);
      throw e;
    }

    var table = new PartitionedTable(schema, partitions);
    if (table.rowCount() == 0) {
      table.close();
      throw new IngestException(
          String.format(
              "No usable rows in %s (%d malformed records skipped)", path, table.skippedLines()));
    }
    LOG.info(
        "Read {} rows into {} partitions from {} ({} malformed records skipped)",
        table.rowCount(),
        table.partitionCount(),
        path,
        table.skippedLines());
    return table;
  }

  private static CSVParser newParser(char delimiter) {
    return new CSVParserBuilder()
        .withSeparator(delimiter)
        .withEscapeChar(ICSVParser.NULL_CHARACTER)
        .build();
  }

  private static String[] parseHeader(CSVParser parser, String headerLine, Path path) {
    try {
      String[] names = parser.parseLine(DelimiterSniffer.stripBom(headerLine));
      for (int i = 0; i < names.length; i++) {
        names[i] = names[i] == null ? "" : names[i].strip();
      }
      return names;
    } catch (IOException e) {
      throw new IngestException("Cannot parse header row of " + path + ": " + e.getMessage(), e);
    }
  }

  /** Maps schema positions to header positions. */
  private static HeaderProjection project(
      String[] header, OccurrenceSchema schema, char delimiter, Path path) {
    Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < header.length; i++) {
      positions.putIfAbsent(header[i], i);
    }
    int[] positionsBySchema = new int[schema.size()];
    List<String> missing = new ArrayList<>();
    var names = schema.columnNames();
    for (int i = 0; i < names.size(); i++) {
      Integer position = positions.get(names.get(i));
      if (position == null) {
        missing.add(names.get(i));
      } else {
        positionsBySchema[i] = position;
      }
    }
    if (missing.size() == names.size()) {
      throw new IngestException(
          String.format(
              "Delimiter %s yields no usable columns in the header of %s (%d fields found)",
              DelimiterSniffer.describe(delimiter), path, header.length));
    }
    if (!missing.isEmpty()) {
      throw new IngestException("Header of " + path + " lacks required columns " + missing);
    }
    return new HeaderProjection(positionsBySchema, header.length);
  }

  private static void logSkip(long lineNumber, String reason, long skippedSoFar) {
    if (skippedSoFar < MAX_LOGGED_SKIPS) {
      LOG.warn("Skipping malformed record at line {}: {}", lineNumber, reason);
    } else if (skippedSoFar == MAX_LOGGED_SKIPS) {
      LOG.warn("Further malformed records are skipped without individual warnings");
    }
  }

  private static void closeAll(List<TablePartition> partitions) {
    for (TablePartition partition : partitions) {
      partition.close();
    }
  }

  /** A physical line of the source, numbered from 1 for the header. */
  private record SourceLine(long number, String text) {}

  /**
   * One logical record: its fields, or the reason it cannot be used.
   *
   * @param lineNumber line the record starts on
   */
  private record SourceRecord(long lineNumber, String[] fields, String problem) {}

  /**
   * Splits the data lines into records. A quoted field may span lines. When quoting is still open
   * after {@link #MAX_RECORD_LINES} lines or at the end of input, only the record's first line is
   * rejected and the lines it swallowed are read again as records of their own.
   */
  private static final class RecordReader {
    private final BufferedReader reader;
    private final char delimiter;
    private final Deque<SourceLine> replay = new ArrayDeque<>();
    private long lastLineNumber = 1;

    RecordReader(BufferedReader reader, char delimiter) {
      this.reader = reader;
      this.delimiter = delimiter;
    }

    SourceRecord next() throws IOException {
      SourceLine first;
      do {
        first = nextLine();
        if (first == null) {
          return null;
        }
      } while (isIgnorable(first.text()));

      var parser = newParser(delimiter);
      List<SourceLine> consumed = new ArrayList<>();
      consumed.add(first);
      List<String> fields = new ArrayList<>();
      try {
        Collections.addAll(fields, parser.parseLineMulti(first.text()));
        while (parser.isPending()) {
          SourceLine more = consumed.size() < MAX_RECORD_LINES ? nextLine() : null;
          if (more == null) {
            return reject(consumed, "unterminated quoted field");
          }
          consumed.add(more);
          Collections.addAll(fields, parser.parseLineMulti(more.text()));
        }
      } catch (IOException e) {
        return reject(consumed, e.getMessage());
      }
      return new SourceRecord(first.number(), fields.toArray(new String[0]), null);
    }

    private SourceRecord reject(List<SourceLine> consumed, String problem) {
      for (int i = consumed.size() - 1; i >= 1; i--) {
        replay.addFirst(consumed.get(i));
      }
      return new SourceRecord(consumed.get(0).number(), null, problem);
    }

    private SourceLine nextLine() throws IOException {
      if (!replay.isEmpty()) {
        return replay.pollFirst();
      }
      String text = reader.readLine();
      return text == null ? null : new SourceLine(++lastLineNumber, text);
    }

    // Whitespace-only lines are blank unless they hold delimiters, e.g. a TSV row of empty cells
    private boolean isIgnorable(String text) {
      return text.isEmpty() || (text.isBlank() && text.indexOf(delimiter) < 0);
    }
  }

  /** Header index of every schema column, and the number of fields a well-formed row has. */
  private record HeaderProjection(int[] positions, int width) {}

  /** Rows of the partition being filled, already projected to the schema. */
  private static final class PartitionBatch {
    final List<String[]> rows = new ArrayList<>();
    final int width;
    long sourceLines = 0;
    long skippedLines = 0;

    PartitionBatch(int width) {
      this.width = width;
    }

    void add(String[] fields, HeaderProjection projection, MissingValues missingValues) {
      String[] row = new String[width];
      for (int i = 0; i < width; i++) {
        String value = fields[projection.positions()[i]];
        row[i] = missingValues.isMissing(value) ? null : value;
      }
      rows.add(row);
    }

    TablePartition toPartition(int index, OccurrenceSchema schema, BufferAllocator allocator) {
      VectorSchemaRoot root = VectorSchemaRoot.create(schema.rawArrowSchema(), allocator);
      try {
        root.allocateNew();
        for (int col = 0; col < width; col++) {
          var vector = (VarCharVector) root.getVector(col);
          for (int row = 0; row < rows.size(); row++) {
            TextVectors.set(vector, row, rows.get(row)[col]);
          }
        }
        root.setRowCount(rows.size());
      } catch (RuntimeException e) {
        root.close();
        throw e;
      }
      LOG.debug(
          "Partition {} cut: {} rows from {} lines, {} skipped",
          index,
          rows.size(),
          sourceLines,
          skippedLines);
      return new TablePartition(index, root, sourceLines, skippedLines);
    }
  }
}
