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

/**
 * What happened to one partition during the write stage.
 *
 * @param index partition index
 * @param fileName output file name, set even when the write failed
 * @param rows rows in the partition
 * @param outcome written, skipped because empty, or failed
 * @param error failure message, null unless failed
 * @param durationMillis time spent on the partition
 */
public record PartitionWrite(
    int index, String fileName, long rows, Outcome outcome, String error, long durationMillis) {

  /** Result of writing one partition. */
  public enum Outcome {
    WRITTEN,
    SKIPPED_EMPTY,
    FAILED
  }

  public boolean failed() {
    return outcome == Outcome.FAILED;
  }
}
