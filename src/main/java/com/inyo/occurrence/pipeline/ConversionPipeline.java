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

import com.inyo.occurrence.ingestor.CoercionEngine;
import com.inyo.occurrence.ingestor.ConversionException;
import com.inyo.occurrence.ingestor.ConversionStatus;
import com.inyo.occurrence.ingestor.DelimiterSniffer;
import com.inyo.occurrence.ingestor.FileValidation;
import com.inyo.occurrence.ingestor.OccurrenceSchema;
import com.inyo.occurrence.ingestor.ParquetPartitionWriter;
import com.inyo.occurrence.ingestor.ParquetValidator;
import com.inyo.occurrence.ingestor.PartitionScheduler;
import com.inyo.occurrence.ingestor.PartitionWrite;
import com.inyo.occurrence.ingestor.PartitionedTable;
import com.inyo.occurrence.ingestor.QualityAudit;
import com.inyo.occurrence.ingestor.QualityAuditor;
import com.inyo.occurrence.ingestor.SchemaConstrainedReader;
import com.inyo.occurrence.ingestor.WriteResult;
import java.sql.SQLException;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversion: detect the delimiter, read, audit, coerce and impute, write, validate.
 *
 * <p>Each stage consumes the full result of the previous one. Fatal failures (delimiter detection,
 * ingestion, output directory) end the run; {@link #run()} does not throw for them but returns a
 * report whose status and failed stage name the cause. Partition write failures are reported per
 * partition; the remaining partitions are still written and then validated.
 */
public class ConversionPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(ConversionPipeline.class);

  static final String STAGE_DETECT = "detect-delimiter";
  static final String STAGE_READ = "read";
  static final String STAGE_AUDIT = "audit";
  static final String STAGE_TRANSFORM = "transform";
  static final String STAGE_WRITE = "write";
  static final String STAGE_VALIDATE = "validate";

  private final ConverterConfig config;
  private final OccurrenceSchema schema;
  private final ConversionMetricsInterface metrics;

  public ConversionPipeline(ConverterConfig config, ConversionMetricsInterface metrics) {
    this(config, OccurrenceSchema.GBIF, metrics);
  }

  public ConversionPipeline(
      ConverterConfig config, OccurrenceSchema schema, ConversionMetricsInterface metrics) {
    this.config = config;
    this.schema = schema;
    this.metrics = metrics;
  }

  public ConversionReport run() {
    long start = System.nanoTime();
    var source = config.getSourcePath();
    var outputDir = config.getOutputDir();
    var report = ConversionReport.builder(source.toString(), outputDir.toString());
    LOG.info("Converting {} into {}", source, outputDir);

    var connectionFactory = new DuckDbConnectionFactory(config);
    BufferAllocator allocator = new RootAllocator();
    String stage = STAGE_DETECT;
    try (var scheduler = new PartitionScheduler(config.getWorkerThreads())) {
      char delimiter;
      try (var timer = metrics.startStageTimer(STAGE_DETECT)) {
        delimiter = detectDelimiter();
      }
      report.delimiter(String.valueOf(delimiter));

      stage = STAGE_READ;
      var reader =
          new SchemaConstrainedReader(
              allocator, config.getMissingValues(), config.getPartitionLines());
      PartitionedTable text;
      try (var timer = metrics.startStageTimer(STAGE_READ)) {
        text = reader.read(source, delimiter, schema);
      }
      metrics.recordRowsRead(text.rowCount());
      metrics.recordLinesSkipped(text.skippedLines());

      PartitionedTable typed;
      try (text) {
        stage = STAGE_AUDIT;
        QualityAudit audit;
        try (var timer = metrics.startStageTimer(STAGE_AUDIT)) {
          audit = new QualityAuditor(scheduler, config.getInvalidValuePreview()).audit(text);
        }
        report.audit(audit);
        for (var sample : audit.invalidValues().values()) {
          metrics.recordInvalidValues(sample.column(), sample.invalidCount());
        }

        stage = STAGE_TRANSFORM;
        try (var timer = metrics.startStageTimer(STAGE_TRANSFORM)) {
          typed = new CoercionEngine(allocator, scheduler).transform(text);
        }
      }

      try (typed) {
        stage = STAGE_WRITE;
        connectionFactory.create();
        WriteResult written;
        try (var timer = metrics.startStageTimer(STAGE_WRITE);
            var connection = connectionFactory.getConnection();
            var writer =
                new ParquetPartitionWriter(
                    connection, allocator, scheduler, config.getParquetCompression())) {
          written = writer.write(typed, outputDir);
        }
        report.writes(written.partitions());
        recordWrites(written.partitions());

        stage = STAGE_VALIDATE;
        List<FileValidation> files;
        try (var timer = metrics.startStageTimer(STAGE_VALIDATE);
            var connection = connectionFactory.getConnection();
            var validator = new ParquetValidator(connection)) {
          files = validator.validate(outputDir);
        }
        report.files(files);
        warnAboutForeignFiles(files);

        if (written.hasFailures()) {
          var first = written.failures().get(0);
          report.failed(
              ConversionStatus.WRITE_ERROR,
              STAGE_WRITE,
              written.failures().size() + " partition(s) failed to write, first: " + first.error());
        }
      }
    } catch (ConversionException e) {
      LOG.error("Conversion failed during {}: {}", stage, e.getMessage(), e);
      report.failed(e.status(), stage, e.getMessage());
    } catch (SQLException e) {
      LOG.error("DuckDB failed during {}", stage, e);
      report.failed(ConversionStatus.WRITE_ERROR, stage, "DuckDB failure: " + e.getMessage());
    } finally {
      closeConnections(connectionFactory);
      closeAllocator(allocator);
    }

    var result = report.build((System.nanoTime() - start) / 1_000_000);
    LOG.info(
        "Conversion of {} finished with status {} in {} ms",
        source,
        result.status(),
        result.durationMillis());
    return result;
  }

  private char detectDelimiter() {
    var explicit = config.getDelimiter();
    if (explicit.isPresent()) {
      LOG.info("Using configured delimiter {}", DelimiterSniffer.describe(explicit.get()));
      return explicit.get();
    }
    return new DelimiterSniffer().sniff(config.getSourcePath(), config.getSniffSampleLines());
  }

  private void recordWrites(List<PartitionWrite> writes) {
    for (PartitionWrite write : writes) {
      if (write.outcome() == PartitionWrite.Outcome.WRITTEN) {
        metrics.recordPartitionWrite(write.durationMillis(), write.rows());
      } else if (write.failed()) {
        metrics.recordPartitionWriteFailure();
      }
    }
  }

  private void warnAboutForeignFiles(List<FileValidation> files) {
    for (FileValidation file : files) {
      if (file.valid() && !file.conformsTo(schema)) {
        LOG.warn(
            "{} does not match the record schema, possibly left over from another run",
            file.fileName());
      }
    }
  }

  private static void closeConnections(DuckDbConnectionFactory connectionFactory) {
    try {
      connectionFactory.close();
    } catch (RuntimeException e) {
      LOG.warn("Failed to close DuckDB: {}", e.getMessage());
    }
  }

  private static void closeAllocator(BufferAllocator allocator) {
    try {
      allocator.close();
    } catch (RuntimeException e) {
      LOG.warn("Failed to close allocator: {}", e.getMessage());
    }
  }
}
