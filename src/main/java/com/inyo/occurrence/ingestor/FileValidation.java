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

import java.util.List;

/**
 * Result of reopening one output file.
 *
 * @param fileName file name within the output directory
 * @param valid whether the file could be opened and scanned
 * @param rowCount rows in the file, -1 when invalid
 * @param columns column names and DuckDB types in file order, empty when invalid
 * @param error why the file is invalid, null when valid
 */
public record FileValidation(
    String fileName, boolean valid, long rowCount, List<FileColumn> columns, String error) {

  public FileValidation {
    columns = List.copyOf(columns);
  }

  /** A column of a Parquet file as DuckDB describes it. */
  public record FileColumn(String name, String type) {}

  public static FileValidation valid(String fileName, long rowCount, List<FileColumn> columns) {
    return new FileValidation(fileName, true, rowCount, columns, null);
  }

  public static FileValidation invalid(String fileName, String error) {
    return new FileValidation(fileName, false, -1, List.of(), error);
  }

  /** True when the file holds exactly the schema's columns, in order, with their target types. */
  public boolean conformsTo(OccurrenceSchema schema) {
    if (!valid || columns.size() != schema.size()) {
      return false;
    }
    for (int i = 0; i < columns.size(); i++) {
      var expected = schema.columns().get(i);
      var actual = columns.get(i);
      if (!expected.name().equals(actual.name())
          || !expected.duckDbType().equalsIgnoreCase(actual.type())) {
        return false;
      }
    }
    return true;
  }
}
