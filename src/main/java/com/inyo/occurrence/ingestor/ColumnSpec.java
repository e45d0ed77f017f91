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

import java.util.Objects;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Declaration of one schema column: its name, the type it is converted to and the value that
 * replaces missing markers, if any.
 *
 * @param name column name as it appears in the source header
 * @param targetType type after coercion
 * @param textFill fill for text columns, null when none is defined
 * @param numericFill fill for float columns, null when none is defined
 */
public record ColumnSpec(String name, TargetType targetType, String textFill, Double numericFill) {

  /** Type of a column once coercion has run. */
  public enum TargetType {
    TEXT,
    FLOAT64
  }

  public ColumnSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(targetType, "targetType");
    if (targetType == TargetType.TEXT && numericFill != null) {
      throw new IllegalArgumentException("Text column " + name + " cannot have a numeric fill");
    }
    if (targetType == TargetType.FLOAT64 && textFill != null) {
      throw new IllegalArgumentException("Float column " + name + " cannot have a text fill");
    }
    if (numericFill != null && !Double.isFinite(numericFill)) {
      throw new IllegalArgumentException("Fill for " + name + " must be finite");
    }
  }

  public static ColumnSpec text(String name) {
    return new ColumnSpec(name, TargetType.TEXT, null, null);
  }

  public static ColumnSpec text(String name, String fill) {
    return new ColumnSpec(name, TargetType.TEXT, Objects.requireNonNull(fill, "fill"), null);
  }

  public static ColumnSpec float64(String name, double fill) {
    return new ColumnSpec(name, TargetType.FLOAT64, null, fill);
  }

  public boolean isNumeric() {
    return targetType == TargetType.FLOAT64;
  }

  public boolean hasFill() {
    return textFill != null || numericFill != null;
  }

  /** Field as read from the source: always nullable text. */
  public Field rawField() {
    return new Field(name, FieldType.nullable(ArrowTypeConstants.TEXT), null);
  }

  /** Field after coercion, before imputation: target type, still nullable. */
  public Field coercedField() {
    var type = isNumeric() ? ArrowTypeConstants.FLOAT64 : ArrowTypeConstants.TEXT;
    return new Field(name, FieldType.nullable(type), null);
  }

  /** Field after coercion and imputation; columns with a fill can no longer hold nulls. */
  public Field targetField() {
    var type = isNumeric() ? ArrowTypeConstants.FLOAT64 : ArrowTypeConstants.TEXT;
    var fieldType = hasFill() ? FieldType.notNullable(type) : FieldType.nullable(type);
    return new Field(name, fieldType, null);
  }

  /** DuckDB type name this column carries once written to Parquet. */
  public String duckDbType() {
    return isNumeric() ? ArrowTypeConstants.DUCKDB_FLOAT64 : ArrowTypeConstants.DUCKDB_TEXT;
  }
}
