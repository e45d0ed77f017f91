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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;
import org.apache.kafka.common.MetricName;
import org.apache.kafka.common.metrics.Metrics;
import org.apache.kafka.common.metrics.Sensor;
import org.apache.kafka.common.metrics.stats.Avg;
import org.apache.kafka.common.metrics.stats.CumulativeSum;
import org.apache.kafka.common.metrics.stats.Max;
import org.apache.kafka.common.metrics.stats.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion metrics on top of Kafka's metrics registry, so a run can be exposed through JMX like
 * any other Kafka client component.
 *
 * <p>All metrics live in the {@value #METRIC_GROUP} group and carry a {@code source} tag with the
 * source file name.
 */
public final class ConversionMetrics implements ConversionMetricsInterface {

  private static final Logger LOG = LoggerFactory.getLogger(ConversionMetrics.class);
  public static final String METRIC_GROUP = "occurrence-conversion-metrics";

  private final Metrics metrics;
  private final Map<String, String> metricTags;
  private final Sensor rowsReadSensor;
  private final Sensor linesSkippedSensor;
  private final Sensor partitionWriteSensor; // timing of successful partition writes
  private final Sensor rowsWrittenSensor;
  private final Sensor writeFailureSensor;

  // Created on first use
  private final Map<String, Sensor> invalidValueSensors = new ConcurrentHashMap<>();
  private final Map<String, Sensor> stageSensors = new ConcurrentHashMap<>();

  /**
   * Creates a new metrics instance.
   *
   * @param metrics the Kafka metrics registry
   * @param sourceName name of the converted source, used as tag
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification =
          "Storing externally managed Metrics registry is intentional; "
              + "this class only registers and removes its own sensors.")
  public ConversionMetrics(Metrics metrics, String sourceName) {
    this.metrics = metrics;
    this.metricTags = new HashMap<>();
    metricTags.put("source", sourceName);

    this.rowsReadSensor = cumulativeSensor("rows-read", "rows-read-total", "Total rows parsed");
    this.linesSkippedSensor =
        cumulativeSensor(
            "lines-skipped", "lines-skipped-total", "Total malformed source lines skipped");
    this.rowsWrittenSensor =
        cumulativeSensor("rows-written", "rows-written-total", "Total rows written to Parquet");
    this.writeFailureSensor =
        cumulativeSensor(
            "partition-write-failures",
            "partition-write-failures-total",
            "Total partitions that failed to write");
    this.partitionWriteSensor = createPartitionWriteSensor();

    LOG.debug("Initialized conversion metrics for source={}", sourceName);
  }

  private Sensor cumulativeSensor(String sensorName, String metricName, String description) {
    var sensor = metrics.sensor(sensorName);
    sensor.add(
        new MetricName(metricName, METRIC_GROUP, description, metricTags), new CumulativeSum());
    return sensor;
  }

  private Sensor createPartitionWriteSensor() {
    var sensor = metrics.sensor("partition-write");

    var avgMetricName =
        new MetricName(
            "partition-write-time-avg",
            METRIC_GROUP,
            "Average partition write time in ms",
            metricTags);
    sensor.add(avgMetricName, new Avg());

    var maxMetricName =
        new MetricName(
            "partition-write-time-max",
            METRIC_GROUP,
            "Maximum partition write time in ms",
            metricTags);
    sensor.add(maxMetricName, new Max());

    // Files written is the number of recordings on this sensor
    var countSensor = metrics.sensor("files-written");
    countSensor.add(
        new MetricName(
            "files-written-total", METRIC_GROUP, "Total Parquet files written", metricTags),
        new CumulativeSum());
    return sensor;
  }

  private Sensor invalidValueSensor(String column) {
    return invalidValueSensors.computeIfAbsent(
        column,
        c -> {
          var tags = new HashMap<>(metricTags);
          tags.put("column", c);
          var sensor = metrics.sensor("invalid-values-" + c);
          sensor.add(
              new MetricName(
                  "invalid-values-total",
                  METRIC_GROUP,
                  "Total values of " + c + " that failed numeric coercion",
                  tags),
              new CumulativeSum());
          return sensor;
        });
  }

  private Sensor stageSensor(String stage) {
    return stageSensors.computeIfAbsent(
        stage,
        s -> {
          var tags = new HashMap<>(metricTags);
          tags.put("stage", s);
          var sensor = metrics.sensor("stage-" + s + "-timing");
          sensor.add(
              new MetricName("stage-time", METRIC_GROUP, "Duration of stage " + s + " in ms", tags),
              new Value());
          return sensor;
        });
  }

  @Override
  public void recordRowsRead(long rows) {
    rowsReadSensor.record(rows);
  }

  @Override
  public void recordLinesSkipped(long lines) {
    linesSkippedSensor.record(lines);
  }

  @Override
  public void recordInvalidValues(String column, long count) {
    invalidValueSensor(column).record(count);
  }

  /**
   * Records one successfully written partition.
   *
   * @param durationMillis time spent writing it
   * @param rows rows in the file
   */
  @Override
  public void recordPartitionWrite(long durationMillis, long rows) {
    partitionWriteSensor.record(durationMillis);
    rowsWrittenSensor.record(rows);
    metrics.getSensor("files-written").record(1);
  }

  @Override
  public void recordPartitionWriteFailure() {
    writeFailureSensor.record(1);
  }

  /**
   * Creates a timer measuring a pipeline stage. Use with try-with-resources:
   *
   * <pre>
   * try (var timer = metrics.startStageTimer("read")) {
   *   // run the stage
   * }
   * </pre>
   */
  @Override
  public MetricTimer startStageTimer(String stage) {
    var sensor = stageSensor(stage);
    return new MetricTimer(nanos -> sensor.record(TimeUnit.NANOSECONDS.toMillis(nanos)));
  }

  /**
   * Current value of a metric of this instance, or null when it does not exist.
   *
   * @param name metric name, e.g. {@code rows-read-total}
   */
  public Object metricValue(String name) {
    return metricValue(name, Map.of());
  }

  /**
   * Current value of a tagged metric, e.g. {@code invalid-values-total} with a {@code column} tag.
   */
  public Object metricValue(String name, Map<String, String> extraTags) {
    var tags = new HashMap<>(metricTags);
    tags.putAll(extraTags);
    var metric = metrics.metric(new MetricName(name, METRIC_GROUP, "", tags));
    return metric == null ? null : metric.metricValue();
  }

  @Override
  public void close() {
    metrics.removeSensor("rows-read");
    metrics.removeSensor("lines-skipped");
    metrics.removeSensor("rows-written");
    metrics.removeSensor("partition-write-failures");
    metrics.removeSensor("partition-write");
    metrics.removeSensor("files-written");
    for (var column : invalidValueSensors.keySet()) {
      metrics.removeSensor("invalid-values-" + column);
    }
    for (var stage : stageSensors.keySet()) {
      metrics.removeSensor("stage-" + stage + "-timing");
    }
    LOG.debug("Closed conversion metrics");
  }

  /**
   * Timer utility for measuring operation duration. Automatically records the duration when closed.
   */
  public static final class MetricTimer implements ConversionMetricsInterface.MetricTimer {
    private final long startTimeNanos;
    private final LongConsumer recorder;

    private MetricTimer(LongConsumer recorder) {
      this.startTimeNanos = System.nanoTime();
      this.recorder = recorder;
    }

    @Override
    public void close() {
      var durationNanos = System.nanoTime() - startTimeNanos;
      recorder.accept(durationNanos);
    }
  }
}
