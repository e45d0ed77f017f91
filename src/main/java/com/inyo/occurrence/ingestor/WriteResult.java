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

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of the write stage: one entry per partition, in partition order.
 *
 * @param directory the output directory
 * @param partitions per-partition outcomes
 */
public record WriteResult(Path directory, List<PartitionWrite> partitions) {

  public WriteResult {
    partitions = List.copyOf(partitions);
  }

  public boolean hasFailures() {
    return partitions.stream().anyMatch(PartitionWrite::failed);
  }

  public List<PartitionWrite> failures() {
    return partitions.stream().filter(PartitionWrite::failed).collect(Collectors.toList());
  }

  public List<String> writtenFiles() {
    return partitions.stream()
        .filter(p -> p.outcome() == PartitionWrite.Outcome.WRITTEN)
        .map(PartitionWrite::fileName)
        .collect(Collectors.toList());
  }

  public long rowsWritten() {
    return partitions.stream()
        .filter(p -> p.outcome() == PartitionWrite.Outcome.WRITTEN)
        .mapToLong(PartitionWrite::rows)
        .sum();
  }
}
