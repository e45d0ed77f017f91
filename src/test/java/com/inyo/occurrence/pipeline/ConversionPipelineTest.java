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
package com.inyo.occurrence.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.inyo.occurrence.TestHelper;
import com.inyo.occurrence.ingestor.ConversionStatus;
import com.inyo.occurrence.ingestor.FileValidation;
import com.inyo.occurrence.ingestor.OccurrenceSchema;
import com.inyo.occurrence.ingestor.PartitionWrite;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.kafka.common.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversionPipelineTest {

  @TempDir Path tempDir;

  private Metrics metricsRegistry;
  private ConversionMetrics metrics;

  @BeforeEach
  void setUp() {
    metricsRegistry = new Metrics();
    metrics = new ConversionMetrics(metricsRegistry, "test");
  }

  @AfterEach
  void tearDown() {
    metrics.close();
    metricsRegistry.close();
  }

  private Map<String, String> props(Path source, Path output) {
    Map<String, String> props = new HashMap<>();
    props.put(ConverterConfig.SOURCE_PATH, source.toString());
    props.put(ConverterConfig.OUTPUT_DIR, output.toString());
    props.put(ConverterConfig.WORKER_THREADS, "2");
    props.put(ConverterConfig.DUCKDB_THREADS, "1");
    return props;
  }

  private ConversionReport run(Map<String, String> props) {
    return new ConversionPipeline(new ConverterConfig(props), metrics).run();
  }

  private static List<String> parquetFiles(Path dir) throws Exception {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .map(p -> p.getFileName().toString())
          .filter(n -> n.endsWith(".parquet"))
          .sorted()
          .toList();
    }
  }

  @Test
  @DisplayName("Converts clean occurrences without losing rows")
  void testCleanConversion() throws Exception {
    var source =
        TestHelper.writeLines(tempDir, "occurrence.csv", TestHelper.cleanOccurrences(',', 1000));
    var out = tempDir.resolve("parquet");
    var props = props(source, out);
    props.put(ConverterConfig.PARTITION_LINES, "300");

    var report = run(props);

    assertEquals(ConversionStatus.OK, report.status(), report.error());
    assertNull(report.failedStage());
    assertEquals(",", report.delimiter());
    assertEquals(1000, report.rowsRead());
    assertEquals(0, report.linesSkipped());
    assertEquals(1000, report.rowsWritten());
    assertTrue(report.missingCounts().isEmpty());
    assertTrue(report.invalidValues().isEmpty());
    assertEquals(4, report.files().size());
    assertEquals(1000, report.files().stream().mapToLong(FileValidation::rowCount).sum());
    for (FileValidation file : report.files()) {
      assertTrue(file.valid(), file.fileName());
      assertTrue(file.conformsTo(OccurrenceSchema.GBIF), file.fileName());
    }
    assertEquals(
        List.of("part.0.parquet", "part.1.parquet", "part.2.parquet", "part.3.parquet"),
        parquetFiles(out));
    assertEquals(1000.0, metrics.metricValue("rows-written-total"));
    assertEquals(4.0, metrics.metricValue("files-written-total"));
  }

  @Test
  @DisplayName("A non-numeric elevation is filled with the sentinel and reported")
  void testUnknownElevation() throws Exception {
    var lines = new ArrayList<>(TestHelper.cleanOccurrences(',', 20));
    lines.add(TestHelper.row(',', "77", "Vulpes vulpes", "5.1", "52.3", "NL", "unknown", "d", "e"));
    var source = TestHelper.writeLines(tempDir, "unknown.csv", lines);
    var props = props(source, tempDir.resolve("out"));
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "10");

    var report = run(props);

    assertEquals(ConversionStatus.OK, report.status(), report.error());
    assertEquals(Map.of("elevation", 1L), report.missingCounts());
    assertTrue(report.invalidValues().get("elevation").preview().contains("unknown"));
    assertEquals(21, report.rowsWritten());
    assertEquals(1.0, metrics.metricValue("invalid-values-total", Map.of("column", "elevation")));
  }

  @Test
  @DisplayName("A source shorter than the sniff sample fails before creating output")
  void testShortSample() throws Exception {
    var source =
        TestHelper.writeLines(tempDir, "short.csv", TestHelper.cleanOccurrences(',', 10));
    var out = tempDir.resolve("never");

    var report = run(props(source, out));

    assertEquals(ConversionStatus.FORMAT_DETECTION_ERROR, report.status());
    assertEquals(ConversionPipeline.STAGE_DETECT, report.failedStage());
    assertEquals(2, report.status().exitCode());
    assertFalse(Files.exists(out));
    assertTrue(report.writes().isEmpty());
  }

  @Test
  @DisplayName("An explicit delimiter bypasses detection")
  void testExplicitDelimiter() throws Exception {
    var source =
        TestHelper.writeLines(tempDir, "short.csv", TestHelper.cleanOccurrences(';', 10));
    var props = props(source, tempDir.resolve("out"));
    props.put(ConverterConfig.DELIMITER, ";");

    var report = run(props);

    assertEquals(ConversionStatus.OK, report.status(), report.error());
    assertEquals(";", report.delimiter());
    assertEquals(10, report.rowsWritten());
  }

  @Test
  @DisplayName("An output directory that cannot be created fails the write stage")
  void testUnwritableOutput() throws Exception {
    var source =
        TestHelper.writeLines(tempDir, "ok.csv", TestHelper.cleanOccurrences(',', 50));
    var blocker = Files.writeString(tempDir.resolve("blocker"), "a file, not a directory");
    var props = props(source, blocker.resolve("out"));
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "10");

    var report = run(props);

    assertEquals(ConversionStatus.WRITE_ERROR, report.status());
    assertEquals(ConversionPipeline.STAGE_WRITE, report.failedStage());
    assertEquals(50, report.rowsRead());
    assertTrue(report.writes().isEmpty());
    assertTrue(report.files().isEmpty());
    assertFalse(Files.exists(blocker.resolve("out")));
  }

  @Test
  @DisplayName("A failed partition write keeps the other files and ends with a write error")
  void testPartitionWriteFailure() throws Exception {
    var source =
        TestHelper.writeLines(tempDir, "ok.csv", TestHelper.cleanOccurrences(',', 30));
    var out = Files.createDirectories(tempDir.resolve("out"));
    var occupied = Files.createDirectories(out.resolve("part.1.parquet"));
    Files.writeString(occupied.resolve("keep.txt"), "not ours");
    var props = props(source, out);
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "10");
    props.put(ConverterConfig.PARTITION_LINES, "10");

    var report = run(props);

    assertEquals(ConversionStatus.WRITE_ERROR, report.status());
    assertEquals(ConversionPipeline.STAGE_WRITE, report.failedStage());
    assertEquals(4, report.status().exitCode());
    assertEquals(20, report.rowsWritten());
    assertEquals(
        List.of(
            PartitionWrite.Outcome.WRITTEN,
            PartitionWrite.Outcome.FAILED,
            PartitionWrite.Outcome.WRITTEN),
        report.writes().stream().map(PartitionWrite::outcome).toList());
    assertEquals(List.of("part.0.parquet", "part.2.parquet"), parquetFiles(out));
    assertEquals(2, report.files().size());
    assertTrue(report.files().stream().allMatch(FileValidation::valid));
    assertEquals(1.0, metrics.metricValue("partition-write-failures-total"));
  }

  @Test
  @DisplayName("Extra and reordered source columns do not change the output schema")
  void testSchemaInvariance() throws Exception {
    var lines = new ArrayList<String>();
    lines.add(
        "occurrenceID|eventDate|decimalLatitude|species|gbifID|elevation|datasetKey"
            + "|countryCode|decimalLongitude|basisOfRecord");
    for (int i = 0; i < 30; i++) {
      lines.add(
          String.join(
              "|", "occ-" + i, "2019-07-0" + (i % 9 + 1), "10.5", "Ursus arctos", "" + i, "",
              "ds", "SE", "15.25", "HUMAN_OBSERVATION"));
    }
    var source = TestHelper.writeLines(tempDir, "wide.txt", lines);
    var props = props(source, tempDir.resolve("out"));
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "20");

    var report = run(props);

    assertEquals(ConversionStatus.OK, report.status(), report.error());
    assertEquals("|", report.delimiter());
    assertEquals(Map.of("elevation", 30L), report.missingCounts());
    var columns = report.files().get(0).columns();
    assertEquals(
        OccurrenceSchema.GBIF.columnNames(),
        columns.stream().map(FileValidation.FileColumn::name).toList());
    assertTrue(report.files().get(0).conformsTo(OccurrenceSchema.GBIF));
  }

  @Test
  @DisplayName("Every non-blank data line is either written or counted as skipped")
  void testRowConservation() throws Exception {
    var lines = new ArrayList<String>();
    lines.add(TestHelper.header(','));
    int expectedRows = 0;
    int expectedSkipped = 0;
    for (int i = 0; i < 40; i++) {
      if (i % 7 == 3) {
        lines.add("truncated," + i);
        expectedSkipped++;
      } else if (i % 11 == 5) {
        lines.add("");
      } else {
        lines.add(TestHelper.occurrence(',', i));
        expectedRows++;
      }
    }
    var source = TestHelper.writeLines(tempDir, "mixed.csv", lines);
    var props = props(source, tempDir.resolve("out"));
    // header plus the first three rows, all well formed
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "4");
    props.put(ConverterConfig.PARTITION_LINES, "8");

    var report = run(props);

    assertEquals(ConversionStatus.OK, report.status(), report.error());
    assertEquals(expectedRows, report.rowsRead());
    assertEquals(expectedSkipped, report.linesSkipped());
    assertEquals(expectedRows, report.rowsWritten());
    long sourceLines = report.partitions().stream().mapToLong(p -> p.sourceLines()).sum();
    assertEquals(expectedRows + expectedSkipped, sourceLines);
  }

  @Test
  @DisplayName("Running twice over the same output validates the same files")
  void testRerunIsStable() throws Exception {
    var source =
        TestHelper.writeLines(tempDir, "twice.csv", TestHelper.cleanOccurrences(',', 30));
    var props = props(source, tempDir.resolve("out"));
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "10");
    props.put(ConverterConfig.PARTITION_LINES, "10");

    var first = run(props);
    var second = run(props);

    assertEquals(ConversionStatus.OK, second.status(), second.error());
    assertEquals(first.files(), second.files());
    assertTrue(
        second.writes().stream()
            .allMatch(w -> w.outcome() == PartitionWrite.Outcome.WRITTEN));
  }

  @Test
  @DisplayName("A missing source or missing columns fail the run as ingest errors")
  void testIngestErrors() throws Exception {
    var missing = run(props(tempDir.resolve("absent.csv"), tempDir.resolve("out1")));
    assertEquals(ConversionStatus.INGEST_ERROR, missing.status());

    var narrow =
        TestHelper.writeLines(
            tempDir, "narrow.csv", List.of("gbifID,species", "1,a", "2,b", "3,c"));
    var props = props(narrow, tempDir.resolve("out2"));
    props.put(ConverterConfig.SNIFF_SAMPLE_LINES, "3");
    var report = run(props);
    assertEquals(ConversionStatus.INGEST_ERROR, report.status());
    assertEquals(ConversionPipeline.STAGE_READ, report.failedStage());
    assertTrue(report.error().contains("lacks required columns"), report.error());
    assertFalse(Files.exists(tempDir.resolve("out2")));
  }
}
