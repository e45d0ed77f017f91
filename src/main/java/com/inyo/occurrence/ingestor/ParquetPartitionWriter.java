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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.apache.arrow.c.ArrowArrayStream;
import org.apache.arrow.c.Data;
import org.apache.arrow.memory.BufferAllocator;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each partition of a typed table to its own Parquet file, {@code part.<index>.parquet}.
 *
 * <p>A partition is handed to DuckDB as an Arrow stream and copied to Parquet with the columns in
 * the table's schema order; no row index is added. Partitions are written independently: a failed
 * partition is reported and the others are still written, files already on disk are left alone.
 */
public final class ParquetPartitionWriter implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ParquetPartitionWriter.class);

  public static final String FILE_EXTENSION = ".parquet";
  public static final Set<String> COMPRESSION_CODECS =
      Set.of("snappy", "zstd", "gzip", "uncompressed");

  private final DuckDBConnection connection;
  private final BufferAllocator allocator;
  private final PartitionScheduler scheduler;
  private final String compression;

  public ParquetPartitionWriter(
      DuckDBConnection connection,
      BufferAllocator allocator,
      PartitionScheduler scheduler,
      String compression) {
    if (connection == null) {
      throw new IllegalArgumentException("DuckDBConnection cannot be null");
    }
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null");
    }
    var codec = compression == null ? "" : compression.toLowerCase(Locale.ROOT);
    if (!COMPRESSION_CODECS.contains(codec)) {
      throw new IllegalArgumentException("Unsupported Parquet compression: " + compression);
    }
    this.allocator = allocator;
    this.scheduler = scheduler;
    this.compression = codec;
    try {
      // Own connection so closing the writer never closes the caller's
      this.connection = (DuckDBConnection) connection.duplicate();
    } catch (SQLException e) {
      throw new RuntimeException("Failed to duplicate DuckDB connection for writer", e);
    }
  }

  public static String fileName(int partitionIndex) {
    return "part." + partitionIndex + FILE_EXTENSION;
  }

  /**
   * Writes every partition of {@code table} into {@code outputDir}, creating the directory when
   * needed.
   *
   * @throws WriteException if the directory cannot be created or is not writable; nothing is
   *     written in that case
   */
  public WriteResult write(PartitionedTable table, Path outputDir) {
    prepareDirectory(outputDir);
    LOG.info(
        "Writing {} partitions ({} rows) to {}",
        table.partitionCount(),
        table.rowCount(),
        outputDir);
    List<PartitionWrite> outcomes =
        scheduler.map(table, "write", partition -> writePartition(partition, outputDir));
    var result = new WriteResult(outputDir, outcomes);
    if (result.hasFailures()) {
      LOG.error(
          "{} of {} partitions failed to write to {}",
          result.failures().size(),
          outcomes.size(),
          outputDir);
    } else {
      LOG.info(
          "Wrote {} files, {} rows to {}",
          result.writtenFiles().size(),
          result.rowsWritten(),
          outputDir);
    }
    return result;
  }

  private static void prepareDirectory(Path outputDir) {
    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new WriteException(
          "Cannot create output directory " + outputDir + ": " + e.getMessage(), e);
    }
    if (!Files.isDirectory(outputDir) || !Files.isWritable(outputDir)) {
      throw new WriteException("Output directory " + outputDir + " is not writable");
    }
  }

  private PartitionWrite writePartition(TablePartition partition, Path outputDir) {
    var name = fileName(partition.index());
    long start = System.nanoTime();
    if (partition.rowCount() == 0) {
      LOG.debug("No data to write for {}", partition);
      return new PartitionWrite(
          partition.index(), name, 0, PartitionWrite.Outcome.SKIPPED_EMPTY, null, 0);
    }
    var target = outputDir.resolve(name);
    try {
      copyToParquet(partition, target);
      long millis = (System.nanoTime() - start) / 1_000_000;
      LOG.debug("Wrote {} to {} in {} ms", partition, target, millis);
      return new PartitionWrite(
          partition.index(),
          name,
          partition.rowCount(),
          PartitionWrite.Outcome.WRITTEN,
          null,
          millis);
    } catch (SQLException | IOException | RuntimeException e) {
      LOG.error("Failed to write {} to {}", partition, target, e);
      discardPartialFile(target);
      return new PartitionWrite(
          partition.index(),
          name,
          partition.rowCount(),
          PartitionWrite.Outcome.FAILED,
          "Failed to write " + name + ": " + e.getMessage(),
          (System.nanoTime() - start) / 1_000_000);
    }
  }

  @SuppressFBWarnings(
      value = "SQL_NONCONSTANT_STRING_PASSED_TO_EXECUTE",
      justification =
          "View name is generated and the target path is quoted via SqlIdentifierUtil.literal; "
              + "COPY targets cannot be parameterized.")
  private void copyToParquet(TablePartition partition, Path target)
      throws SQLException, IOException {
    var view = "partition_" + UUID.randomUUID().toString().replace("-", "");
    try (var conn = (DuckDBConnection) connection.duplicate();
        var reader = new PartitionArrowReader(allocator, partition.root());
        var arrayStream = ArrowArrayStream.allocateNew(allocator)) {
      Data.exportArrayStream(allocator, reader, arrayStream);
      LOG.debug("Registering Arrow stream as view {} with {} rows", view, partition.rowCount());
      conn.registerArrowStream(view, arrayStream);

      var sql =
          "COPY (SELECT * FROM "
              + SqlIdentifierUtil.quote(view)
              + ") TO "
              + SqlIdentifierUtil.literal(target.toAbsolutePath().toString())
              + " (FORMAT PARQUET, COMPRESSION "
              + compression
              + ")";
      LOG.debug("Executing: {}", sql);
      try (var st = conn.createStatement()) {
        st.execute(sql);
      }
      try (var st = conn.createStatement()) {
        st.execute("DROP VIEW IF EXISTS " + SqlIdentifierUtil.quote(view));
      }
    }
  }

  private static void discardPartialFile(Path target) {
    if (!Files.isRegularFile(target)) {
      return;
    }
    try {
      if (Files.deleteIfExists(target)) {
        LOG.warn("Removed partial file {}", target);
      }
    } catch (IOException e) {
      LOG.warn("Could not remove partial file {}: {}", target, e.getMessage());
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.warn("Failed to close writer connection: {}", e.getMessage());
    }
  }
}
