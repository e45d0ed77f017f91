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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.inyo.occurrence.TestHelper;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoercionEngineTest {

  @TempDir Path tempDir;

  private BufferAllocator allocator;
  private PartitionScheduler scheduler;

  @BeforeEach
  void setup() {
    allocator = new RootAllocator();
    scheduler = new PartitionScheduler(2);
  }

  @AfterEach
  void tearDown() {
    scheduler.close();
    assertEquals(0, allocator.getAllocatedMemory(), "all partition buffers released");
    allocator.close();
  }

  private PartitionedTable readText() throws Exception {
    var lines =
        List.of(
            TestHelper.header(','),
            TestHelper.row(',', "1", "Puma concolor", "-70.5", "-33.25", "AR", "1200", "d", "e"),
            TestHelper.row(',', "", "NA", "", "abc", "", "unknown", "", ""));
    var file = TestHelper.writeLines(tempDir, "coerce.csv", lines);
    return new SchemaConstrainedReader(allocator, MissingValues.defaults(), 100)
        .read(file, ',', OccurrenceSchema.GBIF);
  }

  @Test
  @DisplayName("Coerces numeric columns to nullable doubles")
  void testCoerce() throws Exception {
    var engine = new CoercionEngine(allocator, scheduler);
    try (var text = readText();
        var coerced = engine.coerce(text)) {
      var root = coerced.partitions().get(0).root();
      var lon = (Float8Vector) root.getVector("decimalLongitude");
      var lat = (Float8Vector) root.getVector("decimalLatitude");
      assertEquals(-70.5, lon.get(0));
      assertTrue(lon.isNull(1));
      assertTrue(lat.isNull(1));
      assertTrue(root.getVector("elevation").getField().isNullable());
      assertNull(TextVectors.get((VarCharVector) root.getVector("species"), 1));
    }
  }

  @Test
  @DisplayName("Fills missing cells and leaves no nulls in filled columns")
  void testTransform() throws Exception {
    var engine = new CoercionEngine(allocator, scheduler);
    try (var text = readText();
        var typed = engine.transform(text)) {
      var root = typed.partitions().get(0).root();
      assertEquals(2, root.getRowCount());

      for (ColumnSpec column : OccurrenceSchema.GBIF.columns()) {
        var vector = root.getVector(column.name());
        assertEquals(column.hasFill(), !vector.getField().isNullable(), column.name());
        if (column.hasFill()) {
          assertEquals(0, vector.getNullCount(), column.name());
        }
      }

      var elevation = (Float8Vector) root.getVector("elevation");
      assertEquals(1200.0, elevation.get(0));
      assertEquals(OccurrenceSchema.NUMERIC_SENTINEL, elevation.get(1));
      assertEquals(
          OccurrenceSchema.NUMERIC_SENTINEL,
          ((Float8Vector) root.getVector("decimalLatitude")).get(1));
      assertEquals(
          OccurrenceSchema.UNKNOWN,
          TextVectors.get((VarCharVector) root.getVector("species"), 1));
      assertEquals(
          OccurrenceSchema.UNKNOWN,
          TextVectors.get((VarCharVector) root.getVector("eventDate"), 1));
      assertEquals(
          "Puma concolor", TextVectors.get((VarCharVector) root.getVector("species"), 0));

      var gbifId = (VarCharVector) root.getVector("gbifID");
      assertTrue(gbifId.isNull(1));
      assertFalse(gbifId.isNull(0));
      assertEquals(
          ArrowType.Utf8.INSTANCE, root.getVector("datasetKey").getField().getType());
    }
  }
}
