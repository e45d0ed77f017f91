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
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * One contiguous block of records, held as an Arrow batch. The partition owns its vectors and
 * releases them on {@link #close()}.
 */
public final class TablePartition implements AutoCloseable {

  private final int index;
  private final VectorSchemaRoot root;
  private final long sourceLines;
  private final long skippedLines;

  /**
   * @param index position of the partition in the table, also used in output file names
   * @param root the partition's data
   * @param sourceLines source records the partition was cut from, empty lines excluded
   * @param skippedLines source records dropped as malformed
   */
  public TablePartition(int index, VectorSchemaRoot root, long sourceLines, long skippedLines) {
    if (index < 0) {
      throw new IllegalArgumentException("Partition index must not be negative: " + index);
    }
    this.index = index;
    this.root = Objects.requireNonNull(root, "root");
    this.sourceLines = sourceLines;
    this.skippedLines = skippedLines;
  }

  public int index() {
    return index;
  }

  public VectorSchemaRoot root() {
    return root;
  }

  public int rowCount() {
    return root.getRowCount();
  }

  public long sourceLines() {
    return sourceLines;
  }

  public long skippedLines() {
    return skippedLines;
  }

  @Override
  public void close() {
    root.close();
  }

  @Override
  public String toString() {
    return "partition " + index + " (" + rowCount() + " rows)";
  }
}
