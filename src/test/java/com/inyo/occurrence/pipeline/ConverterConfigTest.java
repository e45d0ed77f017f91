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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.common.config.ConfigException;
import org.junit.jupiter.api.Test;

class ConverterConfigTest {

  private static Map<String, String> required() {
    Map<String, String> props = new HashMap<>();
    props.put(ConverterConfig.SOURCE_PATH, "/data/occurrence.txt");
    props.put(ConverterConfig.OUTPUT_DIR, "/data/parquet");
    return props;
  }

  @Test
  void testDefaults() {
    var config = new ConverterConfig(required());
    assertEquals(Path.of("/data/occurrence.txt"), config.getSourcePath());
    assertEquals(Path.of("/data/parquet"), config.getOutputDir());
    assertEquals(1000, config.getSniffSampleLines());
    assertEquals(Optional.empty(), config.getDelimiter());
    assertEquals(100000, config.getPartitionLines());
    assertEquals(5, config.getInvalidValuePreview());
    assertEquals(Optional.empty(), config.getReportJsonPath());
    assertEquals("snappy", config.getParquetCompression());
    assertTrue(config.getWorkerThreads() >= 1);
    assertTrue(config.getDuckDbThreads() >= 1);
    assertTrue(config.getMissingValues().isMissing("NA"));
    assertTrue(config.getMissingValues().isMissing("#N/A N/A"));
  }

  @Test
  void testOverrides() {
    var props = required();
    props.put(ConverterConfig.DELIMITER, "\\t");
    props.put(ConverterConfig.PARTITION_LINES, "500");
    props.put(ConverterConfig.NULL_VALUES, "?, -");
    props.put(ConverterConfig.WORKER_THREADS, "3");
    props.put(ConverterConfig.PARQUET_COMPRESSION, "zstd");
    props.put(ConverterConfig.REPORT_JSON_PATH, "/tmp/report.json");

    var config = new ConverterConfig(props);
    assertEquals(Optional.of('\t'), config.getDelimiter());
    assertEquals(500, config.getPartitionLines());
    assertTrue(config.getMissingValues().isMissing("?"));
    assertTrue(config.getMissingValues().isMissing("-"));
    assertFalse(config.getMissingValues().isMissing("NA"));
    assertEquals(3, config.getWorkerThreads());
    assertEquals("zstd", config.getParquetCompression());
    assertEquals(Optional.of(Path.of("/tmp/report.json")), config.getReportJsonPath());
  }

  @Test
  void testMissingRequired() {
    var props = required();
    props.remove(ConverterConfig.OUTPUT_DIR);
    assertThrows(ConfigException.class, () -> new ConverterConfig(props));
  }

  @Test
  void testInvalidValues() {
    var sample = required();
    sample.put(ConverterConfig.SNIFF_SAMPLE_LINES, "0");
    assertThrows(ConfigException.class, () -> new ConverterConfig(sample));

    var codec = required();
    codec.put(ConverterConfig.PARQUET_COMPRESSION, "lz4-ish");
    assertThrows(ConfigException.class, () -> new ConverterConfig(codec));

    var delimiter = required();
    delimiter.put(ConverterConfig.DELIMITER, ",;");
    assertThrows(ConfigException.class, () -> new ConverterConfig(delimiter));
  }
}
