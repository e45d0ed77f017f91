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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Ordered set of columns the converter keeps from the source. Column order here is the order of
 * every table and every Parquet file produced.
 */
public final class OccurrenceSchema {

  public static final String UNKNOWN = "Unknown";
  public static final double NUMERIC_SENTINEL = -9999d;

  /** The occurrence record layout: identifier, taxon, coordinates, country, elevation, etc. */
  public static final OccurrenceSchema GBIF =
      new OccurrenceSchema(
          List.of(
              ColumnSpec.text("gbifID"),
              ColumnSpec.text("species", UNKNOWN),
              ColumnSpec.float64("decimalLongitude", NUMERIC_SENTINEL),
              ColumnSpec.float64("decimalLatitude", NUMERIC_SENTINEL),
              ColumnSpec.text("countryCode", UNKNOWN),
              ColumnSpec.float64("elevation", NUMERIC_SENTINEL),
              ColumnSpec.text("datasetKey"),
              ColumnSpec.text("eventDate", UNKNOWN)));

  private final List<ColumnSpec> columns;
  private final Map<String, ColumnSpec> byName;

  public OccurrenceSchema(List<ColumnSpec> columns) {
    Objects.requireNonNull(columns, "columns");
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("Schema needs at least one column");
    }
    this.columns = List.copyOf(columns);
    this.byName = new LinkedHashMap<>();
    for (ColumnSpec column : this.columns) {
      if (byName.put(column.name(), column) != null) {
        throw new IllegalArgumentException("Duplicate column " + column.name());
      }
    }
  }

  public List<ColumnSpec> columns() {
    return columns;
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnSpec::name).collect(Collectors.toList());
  }

  public List<ColumnSpec> numericColumns() {
    return columns.stream().filter(ColumnSpec::isNumeric).collect(Collectors.toList());
  }

  public ColumnSpec column(String name) {
    var column = byName.get(name);
    if (column == null) {
      throw new IllegalArgumentException("Unknown column " + name);
    }
    return column;
  }

  public int size() {
    return columns.size();
  }

  /** Arrow schema of freshly read partitions: every column nullable text. */
  public Schema rawArrowSchema() {
    return new Schema(columns.stream().map(ColumnSpec::rawField).collect(Collectors.toList()));
  }

  /** Arrow schema of partitions after coercion, missing markers not yet filled. */
  public Schema coercedArrowSchema() {
    return new Schema(columns.stream().map(ColumnSpec::coercedField).collect(Collectors.toList()));
  }

  /** Arrow schema of partitions after coercion and imputation. */
  public Schema targetArrowSchema() {
    return new Schema(columns.stream().map(ColumnSpec::targetField).collect(Collectors.toList()));
  }
}
