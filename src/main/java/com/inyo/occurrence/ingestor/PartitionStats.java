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
 * Structural counts of one partition.
 *
 * @param index partition index
 * @param rowCount rows kept
 * @param sourceLines source records the partition was cut from, empty lines excluded
 * @param skippedLines malformed lines dropped
 */
public record PartitionStats(int index, int rowCount, long sourceLines, long skippedLines) {

  /** A partition that kept no rows although source records fell into it. */
  public boolean isEmpty() {
    return rowCount == 0;
  }
}
