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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * converter &lt;input_csv&gt; &lt;output_dir&gt; [sample_lines] [--key=value ...]
 * </pre>
 *
 * <p>{@code --key=value} options set any {@link ConverterConfig} key, e.g. {@code
 * --partition.lines=50000}. The process exits with the status code of the run, or 1 on a usage
 * error.
 */
public final class ConverterMain {

  private static final Logger LOG = LoggerFactory.getLogger(ConverterMain.class);

  static final int USAGE_EXIT_CODE = 1;

  private static final String USAGE =
      "Usage: converter <input_csv> <output_dir> [sample_lines] [--key=value ...]";

  private ConverterMain() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /** Runs a conversion and returns the process exit code. */
  static int run(String[] args) {
    ConverterConfig config;
    try {
      config = new ConverterConfig(parseArgs(args));
    } catch (IllegalArgumentException | ConfigException e) {
      LOG.error("{}. {}", e.getMessage(), USAGE);
      return USAGE_EXIT_CODE;
    }

    ConversionReport report;
    try (var kafkaMetrics = new Metrics();
        var metrics = new ConversionMetrics(kafkaMetrics, config.getSourcePath().toString())) {
      report = new ConversionPipeline(config, metrics).run();
    }
    ReportRenderer.log(report);

    var reportPath = config.getReportJsonPath();
    if (reportPath.isPresent()) {
      try {
        ReportRenderer.writeJson(report, reportPath.get());
      } catch (IOException e) {
        LOG.warn("Cannot write report to {}: {}", reportPath.get(), e.getMessage());
      }
    }
    return report.status().exitCode();
  }

  static Map<String, String> parseArgs(String[] args) {
    Map<String, String> props = new HashMap<>();
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      if (arg.startsWith("--")) {
        int eq = arg.indexOf('=');
        if (eq <= 2) {
          throw new IllegalArgumentException("Option must be --key=value: " + arg);
        }
        props.put(arg.substring(2, eq), arg.substring(eq + 1));
      } else {
        positional.add(arg);
      }
    }
    if (positional.size() < 2 || positional.size() > 3) {
      throw new IllegalArgumentException("Expected 2 or 3 arguments, got " + positional.size());
    }
    props.put(ConverterConfig.SOURCE_PATH, positional.get(0));
    props.put(ConverterConfig.OUTPUT_DIR, positional.get(1));
    if (positional.size() == 3) {
      props.put(ConverterConfig.SNIFF_SAMPLE_LINES, positional.get(2));
    }
    return props;
  }
}
