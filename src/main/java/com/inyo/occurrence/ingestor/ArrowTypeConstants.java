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

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Arrow types used for the two physical column representations of the converter. Centralizes the
 * instances so raw and target schemas compare equal field by field.
 */
public final class ArrowTypeConstants {

  private ArrowTypeConstants() {
    // Utility class - no instantiation
  }

  public static final ArrowType TEXT = ArrowType.Utf8.INSTANCE;
  public static final ArrowType FLOAT64 =
      new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);

  // DuckDB type names reported back by DESCRIBE on the written Parquet files
  public static final String DUCKDB_TEXT = "VARCHAR";
  public static final String DUCKDB_FLOAT64 = "DOUBLE";
}
