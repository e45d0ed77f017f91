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

import com.inyo.occurrence.ingestor.MissingValues;
import com.inyo.occurrence.ingestor.ParquetPartitionWriter;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;

public class ConverterConfig extends AbstractConfig {

  public static final String VERSION = "1.0.0";

  public static final String SOURCE_PATH = "source.path";
  public static final String OUTPUT_DIR = "output.dir";
  public static final String SNIFF_SAMPLE_LINES = "sniff.sample.lines";
  public static final String DELIMITER = "delimiter";
  public static final String PARTITION_LINES = "partition.lines";
  public static final String NULL_VALUES = "null.values";
  public static final String INVALID_VALUE_PREVIEW = "invalid.value.preview";
  public static final String REPORT_JSON_PATH = "report.json.path";

  // Performance tuning
  public static final String WORKER_THREADS = "worker.threads";
  public static final String DUCKDB_THREADS = "duckdb.threads";
  public static final String PARQUET_COMPRESSION = "parquet.compression";

  public static final ConfigDef CONFIG_DEF = newConfigDef();

  private static ConfigDef newConfigDef() {
    return new ConfigDef()
        .define(
            SOURCE_PATH,
            ConfigDef.Type.STRING,
            ConfigDef.NO_DEFAULT_VALUE,
            new ConfigDef.NonEmptyString(),
            ConfigDef.Importance.HIGH,
            "Delimited source file, UTF-8, with a header row naming the record columns")
        .define(
            OUTPUT_DIR,
            ConfigDef.Type.STRING,
            ConfigDef.NO_DEFAULT_VALUE,
            new ConfigDef.NonEmptyString(),
            ConfigDef.Importance.HIGH,
            "Directory receiving one Parquet file per partition. Created if missing, "
                + "existing files are not removed")
        .define(
            SNIFF_SAMPLE_LINES,
            ConfigDef.Type.INT,
            1000,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.MEDIUM,
            "Number of leading lines (header included) sampled to detect the delimiter. "
                + "Sources shorter than this fail detection. Default: 1000")
        .define(
            DELIMITER,
            ConfigDef.Type.STRING,
            "",
            new DelimiterValidator(),
            ConfigDef.Importance.MEDIUM,
            "Explicit field delimiter, bypassing detection. Empty to detect. Default: empty")
        .define(
            PARTITION_LINES,
            ConfigDef.Type.INT,
            100000,
            ConfigDef.Range.atLeast(1),
            ConfigDef.Importance.MEDIUM,
            "Source records per partition; each partition becomes one Parquet file. "
                + "Default: 100000")
        .define(
            NULL_VALUES,
            ConfigDef.Type.LIST,
            String.join(",", MissingValues.DEFAULT_TOKENS),
            ConfigDef.Importance.LOW,
            "Cell values read as missing in addition to blank cells")
        .define(
            INVALID_VALUE_PREVIEW,
            ConfigDef.Type.INT,
            5,
            ConfigDef.Range.atLeast(0),
            ConfigDef.Importance.LOW,
            "Distinct invalid values listed per numeric column in the report. Default: 5")
        .define(
            REPORT_JSON_PATH,
            ConfigDef.Type.STRING,
            "",
            ConfigDef.Importance.LOW,
            "File receiving the conversion report as JSON. Empty to only log it")
        .define(
            WORKER_THREADS,
            ConfigDef.Type.INT,
            0,
            ConfigDef.Range.atLeast(0),
            ConfigDef.Importance.MEDIUM,
            "Threads processing partitions in parallel. 0 means use all available processors. "
                + "Default: 0")
        .define(
            DUCKDB_THREADS,
            ConfigDef.Type.INT,
            0,
            ConfigDef.Range.atLeast(0),
            ConfigDef.Importance.MEDIUM,
            "Number of threads for DuckDB to use. 0 means use all available processors. "
                + "Default: 0 (all cores)")
        .define(
            PARQUET_COMPRESSION,
            ConfigDef.Type.STRING,
            "snappy",
            ConfigDef.ValidString.in(
                ParquetPartitionWriter.COMPRESSION_CODECS.toArray(new String[0])),
            ConfigDef.Importance.LOW,
            "Parquet compression codec. Default: snappy");
  }

  public ConverterConfig(Map<?, ?> originals) {
    super(CONFIG_DEF, originals);
  }

  public ConverterConfig(ConfigDef definition, Map<?, ?> originals) {
    super(definition, originals);
  }

  public Path getSourcePath() {
    return Path.of(getString(SOURCE_PATH));
  }

  public Path getOutputDir() {
    return Path.of(getString(OUTPUT_DIR));
  }

  public int getSniffSampleLines() {
    return getInt(SNIFF_SAMPLE_LINES);
  }

  /** Explicit delimiter when configured; empty means the file is sniffed. */
  public Optional<Character> getDelimiter() {
    var raw = getString(DELIMITER);
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(DelimiterValidator.parseDelimiter(raw));
  }

  public int getPartitionLines() {
    return getInt(PARTITION_LINES);
  }

  public MissingValues getMissingValues() {
    return new MissingValues(new LinkedHashSet<>(getList(NULL_VALUES)));
  }

  public int getInvalidValuePreview() {
    return getInt(INVALID_VALUE_PREVIEW);
  }

  public Optional<Path> getReportJsonPath() {
    var raw = getString(REPORT_JSON_PATH);
    return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(Path.of(raw));
  }

  /**
   * Returns the number of worker threads processing partitions.
   *
   * @return number of threads, all available processors when configured as 0
   */
  public int getWorkerThreads() {
    int threads = getInt(WORKER_THREADS);
    if (threads <= 0) {
      return Runtime.getRuntime().availableProcessors();
    }
    return threads;
  }

  /**
   * Returns the number of threads DuckDB should use for parallel processing.
   *
   * @return number of threads, 0 means use all available processors
   */
  public int getDuckDbThreads() {
    int threads = getInt(DUCKDB_THREADS);
    if (threads <= 0) {
      return Runtime.getRuntime().availableProcessors();
    }
    return threads;
  }

  public String getParquetCompression() {
    return getString(PARQUET_COMPRESSION);
  }
}
