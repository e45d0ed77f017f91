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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inyo.occurrence.TestHelper;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConverterMainTest {

  @TempDir Path tempDir;

  @Test
  void testParseArgs() {
    var props =
        ConverterMain.parseArgs(new String[] {"in.csv", "out", "250", "--partition.lines=10"});
    assertEquals("in.csv", props.get(ConverterConfig.SOURCE_PATH));
    assertEquals("out", props.get(ConverterConfig.OUTPUT_DIR));
    assertEquals("250", props.get(ConverterConfig.SNIFF_SAMPLE_LINES));
    assertEquals("10", props.get(ConverterConfig.PARTITION_LINES));
    assertFalse(
        ConverterMain.parseArgs(new String[] {"in.csv", "out"})
            .containsKey(ConverterConfig.SNIFF_SAMPLE_LINES));
  }

  @Test
  void testParseArgsRejectsBadInput() {
    assertThrows(
        IllegalArgumentException.class, () -> ConverterMain.parseArgs(new String[] {"in.csv"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> ConverterMain.parseArgs(new String[] {"a", "b", "c", "d"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> ConverterMain.parseArgs(new String[] {"a", "b", "--novalue"}));
  }

  @Test
  void testUsageErrors() {
    assertEquals(ConverterMain.USAGE_EXIT_CODE, ConverterMain.run(new String[0]));
    assertEquals(
        ConverterMain.USAGE_EXIT_CODE, ConverterMain.run(new String[] {"in.csv", "out", "zero"}));
  }

  @Test
  void testSuccessfulRunWritesReport() throws Exception {
    var source = TestHelper.writeLines(tempDir, "in.csv", TestHelper.cleanOccurrences(',', 12));
    var out = tempDir.resolve("out");
    var reportPath = tempDir.resolve("report.json");

    int code =
        ConverterMain.run(
            new String[] {
              source.toString(),
              out.toString(),
              "5",
              "--worker.threads=2",
              "--report.json.path=" + reportPath
            });

    assertEquals(0, code);
    assertTrue(Files.exists(out.resolve("part.0.parquet")));
    var json = new ObjectMapper().readTree(Files.readString(reportPath));
    assertEquals(12, json.get("rowsRead").asLong());
  }

  @Test
  void testExitCodeFollowsStatus() throws Exception {
    var source = TestHelper.writeLines(tempDir, "in.csv", TestHelper.cleanOccurrences(',', 3));
    int code = ConverterMain.run(new String[] {source.toString(), tempDir.resolve("o").toString()});
    assertEquals(2, code);
  }
}
