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

import java.nio.charset.StandardCharsets;
import org.apache.arrow.vector.VarCharVector;

/** Reading and writing UTF-8 cells of {@link VarCharVector}s, with null as the missing marker. */
final class TextVectors {

  private TextVectors() {}

  static String get(VarCharVector vector, int index) {
    if (vector.isNull(index)) {
      return null;
    }
    return new String(vector.get(index), StandardCharsets.UTF_8);
  }

  static void set(VarCharVector vector, int index, String value) {
    if (value == null) {
      vector.setNull(index);
      return;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    vector.setSafe(index, bytes, 0, bytes.length);
  }
}
