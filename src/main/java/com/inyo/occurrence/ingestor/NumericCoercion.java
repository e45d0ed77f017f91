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

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Text to float coercion shared by the quality audit and the conversion itself, so both agree on
 * what counts as a number. Coercion never throws: anything that is not plain decimal syntax, or
 * that overflows to a non-finite double, comes back empty.
 */
public final class NumericCoercion {

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

  private NumericCoercion() {}

  public static OptionalDouble coerce(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    var trimmed = raw.strip();
    if (!DECIMAL.matcher(trimmed).matches()) {
      return OptionalDouble.empty();
    }
    double value = Double.parseDouble(trimmed);
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  public static boolean isNumeric(String raw) {
    return coerce(raw).isPresent();
  }
}
