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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.inyo.occurrence.ingestor.DelimiterSniffer;
import com.inyo.occurrence.ingestor.FileValidation;
import com.inyo.occurrence.ingestor.InvalidValueSample;
import com.inyo.occurrence.ingestor.PartitionWrite;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders a {@link ConversionReport} to the log and to JSON. */
public final class ReportRenderer {

  private static final Logger LOG = LoggerFactory.getLogger(ReportRenderer.class);

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private ReportRenderer() {}

  public static void log(ConversionReport report) {
    LOG.info("Source: {}", report.source());
    if (report.delimiter() != null) {
      LOG.info("Delimiter: {}", printable(report.delimiter()));
    }
    LOG.info(
        "Rows read: {}, malformed lines skipped: {}, partitions: {}",
        report.rowsRead(),
        report.linesSkipped(),
        report.partitions().size());

    if (report.missingCounts().isEmpty()) {
      LOG.info("No missing values");
    } else {
      report.missingCounts().forEach((column, count) -> LOG.info("Missing {}: {}", column, count));
    }
    for (InvalidValueSample sample : report.invalidValues().values()) {
      LOG.info(
          "Invalid numeric values in {}: {} (e.g. {})",
          sample.column(),
          sample.invalidCount(),
          sample.preview());
    }

    for (PartitionWrite write : report.writes()) {
      if (write.failed()) {
        LOG.warn("{}: FAILED {}", write.fileName(), write.error());
      } else {
        LOG.info("{}: {} ({} rows)", write.fileName(), write.outcome(), write.rows());
      }
    }
    for (FileValidation file : report.files()) {
      if (file.valid()) {
        LOG.info("Valid {}: {} rows, columns {}", file.fileName(), file.rowCount(), file.columns());
      } else {
        LOG.warn("Invalid {}: {}", file.fileName(), file.error());
      }
    }

    if (report.succeeded()) {
      LOG.info(
          "Wrote {} rows to {} in {} ms",
          report.rowsWritten(),
          report.outputDirectory(),
          report.durationMillis());
    } else {
      LOG.error(
          "Conversion failed with {} during {}: {}",
          report.status(),
          report.failedStage(),
          report.error());
    }
  }

  public static String toJson(ConversionReport report) {
    try {
      return JSON_MAPPER.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize conversion report", e);
    }
  }

  /** Writes the JSON form of {@code report} to {@code path}, creating parent directories. */
  public static void writeJson(ConversionReport report, Path path) throws IOException {
    var parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
    LOG.info("Report written to {}", path);
  }

  private static String printable(String delimiter) {
    return delimiter.length() == 1
        ? DelimiterSniffer.describe(delimiter.charAt(0))
        : delimiter;
  }
}
