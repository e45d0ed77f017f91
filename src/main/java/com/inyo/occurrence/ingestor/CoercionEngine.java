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
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the text table into its typed form in two steps, always in this order:
 *
 * <ol>
 *   <li>coercion: numeric columns become nullable doubles, anything that is not a finite decimal
 *       number becomes null;
 *   <li>imputation: every null in a column that declares a fill is replaced by the fill.
 * </ol>
 *
 * Coercing first means the fill sees one kind of missing marker, whether the cell was empty in the
 * source or held text that does not parse. Input tables are never modified; every step allocates
 * new partitions.
 */
public final class CoercionEngine {

  private static final Logger LOG = LoggerFactory.getLogger(CoercionEngine.class);

  private final BufferAllocator allocator;
  private final PartitionScheduler scheduler;

  public CoercionEngine(BufferAllocator allocator, PartitionScheduler scheduler) {
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null");
    }
    this.allocator = allocator;
    this.scheduler = scheduler;
  }

  /** Coerces then imputes. The intermediate table is released before returning. */
  public PartitionedTable transform(PartitionedTable textTable) {
    try (PartitionedTable coerced = coerce(textTable)) {
      var result = impute(coerced);
      LOG.info(
          "Converted {} rows in {} partitions to the target schema",
          result.rowCount(),
          result.partitionCount());
      return result;
    }
  }

  /** Text table to a table whose numeric columns are nullable doubles. */
  public PartitionedTable coerce(PartitionedTable textTable) {
    var schema = textTable.schema();
    var arrowSchema = schema.coercedArrowSchema();
    List<TablePartition> partitions =
        scheduler.map(textTable, "coerce", p -> coercePartition(p, schema, arrowSchema));
    return new PartitionedTable(schema, partitions);
  }

  /** Replaces nulls with the declared fill; columns without a fill keep their nulls. */
  public PartitionedTable impute(PartitionedTable coercedTable) {
    var schema = coercedTable.schema();
    var arrowSchema = schema.targetArrowSchema();
    List<TablePartition> partitions =
        scheduler.map(coercedTable, "impute", p -> imputePartition(p, schema, arrowSchema));
    return new PartitionedTable(schema, partitions);
  }

  private TablePartition coercePartition(
      TablePartition source, OccurrenceSchema schema, Schema arrowSchema) {
    int rows = source.rowCount();
    VectorSchemaRoot target = newRoot(arrowSchema);
    try {
      for (ColumnSpec column : schema.columns()) {
        var input = (VarCharVector) source.root().getVector(column.name());
        FieldVector output = target.getVector(column.name());
        if (column.isNumeric()) {
          var doubles = (Float8Vector) output;
          for (int row = 0; row < rows; row++) {
            var parsed = NumericCoercion.coerce(TextVectors.get(input, row));
            if (parsed.isPresent()) {
              doubles.setSafe(row, parsed.getAsDouble());
            } else {
              doubles.setNull(row);
            }
          }
        } else {
          copyText(input, (VarCharVector) output, rows);
        }
      }
      target.setRowCount(rows);
    } catch (RuntimeException e) {
      target.close();
      throw e;
    }
    return new TablePartition(source.index(), target, source.sourceLines(), source.skippedLines());
  }

  private TablePartition imputePartition(
      TablePartition source, OccurrenceSchema schema, Schema arrowSchema) {
    int rows = source.rowCount();
    VectorSchemaRoot target = newRoot(arrowSchema);
    long filled = 0;
    try {
      for (ColumnSpec column : schema.columns()) {
        FieldVector input = source.root().getVector(column.name());
        FieldVector output = target.getVector(column.name());
        if (column.isNumeric()) {
          var in = (Float8Vector) input;
          var out = (Float8Vector) output;
          for (int row = 0; row < rows; row++) {
            if (!in.isNull(row)) {
              out.setSafe(row, in.get(row));
            } else if (column.numericFill() != null) {
              out.setSafe(row, column.numericFill());
              filled++;
            } else {
              out.setNull(row);
            }
          }
        } else if (column.textFill() != null) {
          var in = (VarCharVector) input;
          var out = (VarCharVector) output;
          for (int row = 0; row < rows; row++) {
            String value = TextVectors.get(in, row);
            if (value == null) {
              value = column.textFill();
              filled++;
            }
            TextVectors.set(out, row, value);
          }
        } else {
          copyText((VarCharVector) input, (VarCharVector) output, rows);
        }
      }
      target.setRowCount(rows);
    } catch (RuntimeException e) {
      target.close();
      throw e;
    }
    LOG.debug("Partition {}: filled {} missing cells", source.index(), filled);
    return new TablePartition(source.index(), target, source.sourceLines(), source.skippedLines());
  }

  private VectorSchemaRoot newRoot(Schema arrowSchema) {
    var root = VectorSchemaRoot.create(arrowSchema, allocator);
    root.allocateNew();
    return root;
  }

  private static void copyText(VarCharVector input, VarCharVector output, int rows) {
    for (int row = 0; row < rows; row++) {
      output.copyFromSafe(row, row, input);
    }
  }
}
