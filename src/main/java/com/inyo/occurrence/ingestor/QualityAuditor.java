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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.arrow.vector.VarCharVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inspects a text table without modifying it: missing markers per column, values of numeric
 * columns that do not coerce, and row counts per partition.
 *
 * <p>Each partition is tallied by its own task; tallies are then merged. The merge only sums counts
 * and unions bounded sorted sets, so the outcome does not depend on which partition finishes
 * first.
 */
public final class QualityAuditor {

  private static final Logger LOG = LoggerFactory.getLogger(QualityAuditor.class);

  private final PartitionScheduler scheduler;
  private final int previewSize;

  public QualityAuditor(PartitionScheduler scheduler, int previewSize) {
    if (previewSize < 0) {
      throw new IllegalArgumentException("previewSize must not be negative: " + previewSize);
    }
    this.scheduler = scheduler;
    this.previewSize = previewSize;
  }

  public QualityAudit audit(PartitionedTable table) {
    var schema = table.schema();
    List<PartitionTally> tallies =
        scheduler.map(table, "audit", partition -> tally(partition, schema));

    var merged = new PartitionTally(schema, previewSize);
    for (PartitionTally tally : tallies) {
      merged.mergeFrom(tally);
    }

    Map<String, Long> missing = new LinkedHashMap<>();
    Map<String, InvalidValueSample> invalid = new LinkedHashMap<>();
    for (int col = 0; col < schema.size(); col++) {
      var column = schema.columns().get(col);
      if (merged.missing[col] > 0) {
        missing.put(column.name(), merged.missing[col]);
      }
      if (column.isNumeric() && merged.invalid[col] > 0) {
        invalid.put(
            column.name(),
            new InvalidValueSample(
                column.name(), merged.invalid[col], List.copyOf(merged.invalidPreview.get(col))));
      }
    }

    var audit =
        new QualityAudit(tallies.stream().map(t -> t.stats).toList(), missing, invalid);
    for (int index : audit.emptyPartitions()) {
      LOG.warn("Partition {} kept no rows, every line in it was malformed", index);
    }
    LOG.info(
        "Audit: {} rows, {} columns with missing values, {} numeric columns with invalid values",
        audit.totalRows(),
        missing.size(),
        invalid.size());
    return audit;
  }

  private PartitionTally tally(TablePartition partition, OccurrenceSchema schema) {
    var tally = new PartitionTally(schema, previewSize);
    tally.stats =
        new PartitionStats(
            partition.index(),
            partition.rowCount(),
            partition.sourceLines(),
            partition.skippedLines());
    var root = partition.root();
    for (int col = 0; col < schema.size(); col++) {
      var column = schema.columns().get(col);
      var vector = (VarCharVector) root.getVector(column.name());
      for (int row = 0; row < partition.rowCount(); row++) {
        String value = TextVectors.get(vector, row);
        if (value == null) {
          tally.missing[col]++;
        } else if (column.isNumeric() && !NumericCoercion.isNumeric(value)) {
          // coercion turns it into a missing marker before fill
          tally.missing[col]++;
          tally.invalid[col]++;
          tally.addInvalid(col, value);
        }
      }
    }
    return tally;
  }

  /** Counts for one partition, or the merge of several. */
  private static final class PartitionTally {
    final long[] missing;
    final long[] invalid;
    final List<TreeSet<String>> invalidPreview;
    final int previewSize;
    PartitionStats stats;

    PartitionTally(OccurrenceSchema schema, int previewSize) {
      this.missing = new long[schema.size()];
      this.invalid = new long[schema.size()];
      this.previewSize = previewSize;
      this.invalidPreview = new ArrayList<>(schema.size());
      for (int i = 0; i < schema.size(); i++) {
        invalidPreview.add(new TreeSet<>());
      }
    }

    void addInvalid(int col, String value) {
      if (previewSize == 0) {
        return;
      }
      var preview = invalidPreview.get(col);
      preview.add(value);
      if (preview.size() > previewSize) {
        preview.pollLast();
      }
    }

    void mergeFrom(PartitionTally other) {
      for (int col = 0; col < missing.length; col++) {
        missing[col] += other.missing[col];
        invalid[col] += other.invalid[col];
        for (String value : other.invalidPreview.get(col)) {
          addInvalid(col, value);
        }
      }
    }
  }
}
