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

/** Interface to abstract conversion metrics so tests can mock metrics behavior. */
public interface ConversionMetricsInterface extends AutoCloseable {

  void recordRowsRead(long rows);

  void recordLinesSkipped(long lines);

  void recordInvalidValues(String column, long count);

  void recordPartitionWrite(long durationMillis, long rows);

  void recordPartitionWriteFailure();

  MetricTimer startStageTimer(String stage);

  @Override
  void close();

  /** Simple marker interface for timers returned by the metrics implementation. */
  interface MetricTimer extends AutoCloseable {
    @Override
    void close();
  }
}
