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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class MissingValuesTest {

  @Test
  void testDefaults() {
    var missing = MissingValues.defaults();
    assertTrue(missing.isMissing(null));
    assertTrue(missing.isMissing(""));
    assertTrue(missing.isMissing("   "));
    assertTrue(missing.isMissing("NA"));
    assertTrue(missing.isMissing(" null "));
    assertTrue(missing.isMissing("#N/A"));
    assertFalse(missing.isMissing("unknown"));
    assertFalse(missing.isMissing("Na"));
    assertFalse(missing.isMissing("0"));
  }

  @Test
  void testCustomTokens() {
    var missing = new MissingValues(List.of("-", "?"));
    assertTrue(missing.isMissing("?"));
    assertTrue(missing.isMissing(""));
    assertFalse(missing.isMissing("NA"));
  }
}
