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

import java.util.List;

/**
 * Values of a numeric column that failed coercion.
 *
 * @param column column name
 * @param invalidCount number of cells holding a non-numeric, non-missing value
 * @param preview the lexicographically smallest distinct offending values, bounded in size
 */
public record InvalidValueSample(String column, long invalidCount, List<String> preview) {

  public InvalidValueSample {
    preview = List.copyOf(preview);
  }
}
