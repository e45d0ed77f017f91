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
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reopens every Parquet file of a directory and reports its row count and schema. A file that
 * cannot be read is reported as invalid; nothing in the directory is modified or removed.
 */
public final class ParquetValidator implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ParquetValidator.class);

  private final DuckDBConnection connection;

  public ParquetValidator(DuckDBConnection connection) {
    if (connection == null) {
      throw new IllegalArgumentException("DuckDBConnection cannot be null");
    }
    try {
      this.connection = (DuckDBConnection) connection.duplicate();
    } catch (SQLException e) {
      throw new RuntimeException("Failed to duplicate DuckDB connection for validator", e);
    }
  }

  /**
   * Validates every {@code *.parquet} file directly inside {@code directory}, in file name order.
   *
   * @return one entry per file; empty when the directory does not exist
   */
  public List<FileValidation> validate(Path directory) {
    if (!Files.isDirectory(directory)) {
      LOG.warn("Nothing to validate, {} is not a directory", directory);
      return List.of();
    }
    List<Path> files;
    try (Stream<Path> listing = Files.list(directory)) {
      files =
          listing
              .filter(Files::isRegularFile)
              .filter(ParquetValidator::isParquetFile)
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException e) {
      LOG.error("Cannot list {}", directory, e);
      return List.of();
    }
    List<FileValidation> results = new ArrayList<>(files.size());
    for (Path file : files) {
      results.add(validateFile(file));
    }
    long invalid = results.stream().filter(r -> !r.valid()).count();
    LOG.info("Validated {} files in {}, {} invalid", results.size(), directory, invalid);
    return results;
  }

  private static boolean isParquetFile(Path path) {
    return path.getFileName().toString().endsWith(ParquetPartitionWriter.FILE_EXTENSION);
  }

  /** Reopens a single file. */
  public FileValidation validateFile(Path file) {
    var name = file.getFileName().toString();
    try {
      var columns = describe(file);
      long rows = countRows(file);
      LOG.debug("{}: {} rows, columns {}", name, rows, columns);
      return FileValidation.valid(name, rows, columns);
    } catch (SQLException e) {
      LOG.warn("File {} failed validation: {}", file, e.getMessage());
      return FileValidation.invalid(name, e.getMessage());
    }
  }

  @SuppressFBWarnings(
      value = "SQL_NONCONSTANT_STRING_PASSED_TO_EXECUTE",
      justification = "File path is quoted via SqlIdentifierUtil.literal.")
  private List<FileValidation.FileColumn> describe(Path file) throws SQLException {
    var sql = "DESCRIBE SELECT * FROM read_parquet(" + literalPath(file) + ")";
    List<FileValidation.FileColumn> columns = new ArrayList<>();
    try (var st = connection.createStatement();
        var rs = st.executeQuery(sql)) {
      while (rs.next()) {
        columns.add(
            new FileValidation.FileColumn(
                rs.getString("column_name"), rs.getString("column_type")));
      }
    }
    return columns;
  }

  @SuppressFBWarnings(
      value = "SQL_NONCONSTANT_STRING_PASSED_TO_EXECUTE",
      justification = "File path is quoted via SqlIdentifierUtil.literal.")
  private long countRows(Path file) throws SQLException {
    var sql = "SELECT count(*) FROM read_parquet(" + literalPath(file) + ")";
    try (var st = connection.createStatement();
        var rs = st.executeQuery(sql)) {
      rs.next();
      return rs.getLong(1);
    }
  }

  private static String literalPath(Path file) {
    return SqlIdentifierUtil.literal(file.toAbsolutePath().toString());
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.warn("Failed to close validator connection: {}", e.getMessage());
    }
  }
}
