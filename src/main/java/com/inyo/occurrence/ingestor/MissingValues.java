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

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a raw cell stands for a missing value. A cell is missing when it is blank or
 * matches one of the configured tokens exactly (case-sensitive).
 */
public final class MissingValues {

  /** Tokens recognised as missing out of the box; the usual NA spellings of tabular exports. */
  public static final List<String> DEFAULT_TOKENS =
      List.of(
          "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
          "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

  private static final MissingValues DEFAULTS = new MissingValues(DEFAULT_TOKENS);

  private final Set<String> tokens;

  public MissingValues(Collection<String> tokens) {
    this.tokens = Set.copyOf(new HashSet<>(tokens));
  }

  public static MissingValues defaults() {
    return DEFAULTS;
  }

  public boolean isMissing(String value) {
    if (value == null) {
      return true;
    }
    return value.isBlank() || tokens.contains(value) || tokens.contains(value.strip());
  }

  public Set<String> tokens() {
    return tokens;
  }
}
