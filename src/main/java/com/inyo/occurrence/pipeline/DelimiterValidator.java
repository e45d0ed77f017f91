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

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

/**
 * Validates the explicit delimiter override: empty (sniff the file) or a single character. The
 * two-character spelling {@code \t} is accepted for tab.
 */
public class DelimiterValidator implements ConfigDef.Validator {

  @Override
  public void ensureValid(String name, Object value) {
    String s = (String) value;
    if (s == null || s.isEmpty()) {
      return;
    }
    try {
      parseDelimiter(s);
    } catch (IllegalArgumentException e) {
      throw new ConfigException(name, value, e.getMessage());
    }
  }

  @Override
  public String toString() {
    return "Empty to detect the delimiter, or a single character such as , ; | or \\t";
  }

  /**
   * Parses a configured delimiter.
   *
   * @param raw configured value, non-empty
   * @return the delimiter character
   * @throws IllegalArgumentException if the value is not a single usable character
   */
  public static char parseDelimiter(String raw) {
    if ("\\t".equals(raw)) {
      return '\t';
    }
    if (raw.length() != 1) {
      throw new IllegalArgumentException("Delimiter must be a single character, got '" + raw + "'");
    }
    char ch = raw.charAt(0);
    if (ch == '"' || ch == '\n' || ch == '\r') {
      throw new IllegalArgumentException("Delimiter cannot be a quote or line break");
    }
    return ch;
  }
}
