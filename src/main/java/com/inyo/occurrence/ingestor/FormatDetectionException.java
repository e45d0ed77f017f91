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

/** The delimiter could not be inferred: sample too short or no consistent candidate. */
public class FormatDetectionException extends ConversionException {

  private static final long serialVersionUID = 1L;

  public FormatDetectionException(String message) {
    super(message);
  }

  public FormatDetectionException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ConversionStatus status() {
    return ConversionStatus.FORMAT_DETECTION_ERROR;
  }
}
