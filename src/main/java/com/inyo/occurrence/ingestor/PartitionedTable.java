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
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A sequence of partitions sharing one schema. Closing the table closes every partition. */
public final class PartitionedTable implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionedTable.class);

  private final OccurrenceSchema schema;
  private final List<TablePartition> partitions;

  public PartitionedTable(OccurrenceSchema schema, List<TablePartition> partitions) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.partitions = List.copyOf(partitions);
    for (int i = 0; i < this.partitions.size(); i++) {
      if (this.partitions.get(i).index() != i) {
        throw new IllegalArgumentException(
            "Partition at position " + i + " has index " + this.partitions.get(i).index());
      }
    }
  }

  public OccurrenceSchema schema() {
    return schema;
  }

  public List<TablePartition> partitions() {
    return partitions;
  }

  public int partitionCount() {
    return partitions.size();
  }

  public long rowCount() {
    return partitions.stream().mapToLong(TablePartition::rowCount).sum();
  }

  public long skippedLines() {
    return partitions.stream().mapToLong(TablePartition::skippedLines).sum();
  }

  @Override
  public void close() {
    for (TablePartition partition : partitions) {
      try {
        partition.close();
      } catch (RuntimeException e) {
        LOG.warn("Failed to close {}: {}", partition, e.getMessage());
      }
    }
  }
}
