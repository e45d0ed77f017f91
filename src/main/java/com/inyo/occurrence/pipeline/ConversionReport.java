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
package com.inyo.occurrence.pipeline;

import com.inyo.occurrence.ingestor.ConversionStatus;
import com.inyo.occurrence.ingestor.FileValidation;
import com.inyo.occurrence.ingestor.InvalidValueSample;
import com.inyo.occurrence.ingestor.PartitionStats;
import com.inyo.occurrence.ingestor.PartitionWrite;
import com.inyo.occurrence.ingestor.QualityAudit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured outcome of one conversion run. Stages that did not run leave their parts empty.
 *
 * @param source source file
 * @param outputDirectory output directory
 * @param status terminal status
 * @param failedStage stage that ended the run, null when the run completed
 * @param error failure message, null when status is OK
 * @param delimiter delimiter used, null if detection failed
 * @param rowsRead rows kept by the reader
 * @param linesSkipped malformed lines dropped by the reader
 * @param partitions per-partition counts
 * @param missingCounts missing markers per column before fill, non-zero only
 * @param invalidValues offending values per numeric column
 * @param writes per-partition write outcomes
 * @param files per-file validation results
 * @param durationMillis wall time of the run
 */
public record ConversionReport(
    String source,
    String outputDirectory,
    ConversionStatus status,
    String failedStage,
    String error,
    String delimiter,
    long rowsRead,
    long linesSkipped,
    List<PartitionStats> partitions,
    Map<String, Long> missingCounts,
    Map<String, InvalidValueSample> invalidValues,
    List<PartitionWrite> writes,
    List<FileValidation> files,
    long durationMillis) {

  public ConversionReport {
    partitions = List.copyOf(partitions);
    missingCounts = Collections.unmodifiableMap(new LinkedHashMap<>(missingCounts));
    invalidValues = Collections.unmodifiableMap(new LinkedHashMap<>(invalidValues));
    writes = List.copyOf(writes);
    files = List.copyOf(files);
  }

  public boolean succeeded() {
    return status == ConversionStatus.OK;
  }

  public long rowsWritten() {
    return writes.stream()
        .filter(w -> w.outcome() == PartitionWrite.Outcome.WRITTEN)
        .mapToLong(PartitionWrite::rows)
        .sum();
  }

  public static Builder builder(String source, String outputDirectory) {
    return new Builder(source, outputDirectory);
  }

  /** Collects stage results while the pipeline runs. */
  public static final class Builder {
    private final String source;
    private final String outputDirectory;
    private ConversionStatus status = ConversionStatus.OK;
    private String failedStage;
    private String error;
    private String delimiter;
    private long rowsRead;
    private long linesSkipped;
    private List<PartitionStats> partitions = new ArrayList<>();
    private Map<String, Long> missingCounts = new LinkedHashMap<>();
    private Map<String, InvalidValueSample> invalidValues = new LinkedHashMap<>();
    private List<PartitionWrite> writes = new ArrayList<>();
    private List<FileValidation> files = new ArrayList<>();

    private Builder(String source, String outputDirectory) {
      this.source = source;
      this.outputDirectory = outputDirectory;
    }

    public Builder delimiter(String delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder audit(QualityAudit audit) {
      this.partitions = audit.partitions();
      this.missingCounts = audit.missingCounts();
      this.invalidValues = audit.invalidValues();
      this.rowsRead = audit.totalRows();
      this.linesSkipped = audit.totalSkippedLines();
      return this;
    }

    public Builder writes(List<PartitionWrite> writes) {
      this.writes = writes;
      return this;
    }

    public Builder files(List<FileValidation> files) {
      this.files = files;
      return this;
    }

    public Builder failed(ConversionStatus status, String stage, String error) {
      this.status = status;
      this.failedStage = stage;
      this.error = error;
      return this;
    }

    public ConversionReport build(long durationMillis) {
      return new ConversionReport(
          source,
          outputDirectory,
          status,
          failedStage,
          error,
          delimiter,
          rowsRead,
          linesSkipped,
          partitions,
          missingCounts,
          invalidValues,
          writes,
          files,
          durationMillis);
    }
  }
}
