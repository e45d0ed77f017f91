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
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inyo.occurrence.ingestor.ConversionStatus;
import com.inyo.occurrence.ingestor.FileValidation;
import com.inyo.occurrence.ingestor.InvalidValueSample;
import com.inyo.occurrence.ingestor.PartitionStats;
import com.inyo.occurrence.ingestor.PartitionWrite;
import com.inyo.occurrence.ingestor.QualityAudit;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportRendererTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir Path tempDir;

  private static ConversionReport sampleReport() {
    var audit =
        new QualityAudit(
            List.of(new PartitionStats(0, 2, 3, 1)),
            Map.of("elevation", 1L),
            Map.of("elevation", new InvalidValueSample("elevation", 1, List.of("unknown"))));
    return ConversionReport.builder("in.csv", "out")
        .delimiter("\t")
        .audit(audit)
        .writes(
            List.of(
                new PartitionWrite(
                    0, "part.0.parquet", 2, PartitionWrite.Outcome.WRITTEN, null, 15)))
        .files(
            List.of(
                FileValidation.valid(
                    "part.0.parquet",
                    2,
                    List.of(new FileValidation.FileColumn("gbifID", "VARCHAR")))))
        .build(42);
  }

  @Test
  void testJson() throws Exception {
    var json = MAPPER.readTree(ReportRenderer.toJson(sampleReport()));

    assertEquals("OK", json.get("status").asText());
    assertEquals("\t", json.get("delimiter").asText());
    assertEquals(2, json.get("rowsRead").asLong());
    assertEquals(1, json.get("linesSkipped").asLong());
    assertEquals(1, json.get("missingCounts").get("elevation").asLong());
    assertEquals(
        "unknown", json.get("invalidValues").get("elevation").get("preview").get(0).asText());
    assertEquals("WRITTEN", json.get("writes").get(0).get("outcome").asText());
    assertEquals("VARCHAR", json.get("files").get(0).get("columns").get(0).get("type").asText());
  }

  @Test
  void testFailedReportJson() throws Exception {
    var report =
        ConversionReport.builder("in.csv", "out")
            .failed(ConversionStatus.FORMAT_DETECTION_ERROR, "detect-delimiter", "too short")
            .build(1);
    var json = MAPPER.readTree(ReportRenderer.toJson(report));

    assertEquals("FORMAT_DETECTION_ERROR", json.get("status").asText());
    assertEquals("detect-delimiter", json.get("failedStage").asText());
    assertTrue(json.get("files").isEmpty());
  }

  @Test
  void testWriteJson() throws Exception {
    var path = tempDir.resolve("reports/run.json");
    var report = sampleReport();
    ReportRenderer.writeJson(report, path);

    var json = MAPPER.readTree(Files.readString(path));
    assertEquals("in.csv", json.get("source").asText());
    assertEquals(42, json.get("durationMillis").asLong());
  }

  @Test
  void testLogDoesNotThrow() {
    ReportRenderer.log(sampleReport());
    ReportRenderer.log(
        ConversionReport.builder("in.csv", "out")
            .failed(ConversionStatus.WRITE_ERROR, "write", "disk full")
            .build(3));
  }
}
