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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Diagnostic result of auditing a text table.
 *
 * @param partitions per-partition counts, in partition order
 * @param missingCounts missing markers per column as they stand before fill, non-zero only, in
 *     schema order
 * @param invalidValues offending values per numeric column that has any, in schema order
 */
public record QualityAudit(
    List<PartitionStats> partitions,
    Map<String, Long> missingCounts,
    Map<String, InvalidValueSample> invalidValues) {

  public QualityAudit {
    partitions = List.copyOf(partitions);
    missingCounts = Collections.unmodifiableMap(new LinkedHashMap<>(missingCounts));
    invalidValues = Collections.unmodifiableMap(new LinkedHashMap<>(invalidValues));
  }

  public long totalRows() {
    return partitions.stream().mapToLong(PartitionStats::rowCount).sum();
  }

  public long totalSkippedLines() {
    return partitions.stream().mapToLong(PartitionStats::skippedLines).sum();
  }

  public List<Integer> emptyPartitions() {
    return partitions.stream()
        .filter(PartitionStats::isEmpty)
        .map(PartitionStats::index)
        .collect(Collectors.toList());
  }
}
