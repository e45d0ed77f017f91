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

/** Base class of the fatal conversion failures. Each subclass maps to one terminal status. */
public abstract class ConversionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected ConversionException(String message) {
    super(message);
  }

  protected ConversionException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ConversionStatus status();
}
