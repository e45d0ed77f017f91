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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the field separator of a delimited file from its first lines.
 *
 * <p>For every candidate character the sniffer counts occurrences per line (outside double
 * quotes), takes the modal count and the share of lines that match it. A character qualifies when
 * its modal count is positive and its share reaches the consistency threshold; the threshold starts
 * at 1.0 and is relaxed down to 0.9. Among qualifying characters the preferred separators win,
 * in the order {@code , \t ; | :}.
 */
public final class DelimiterSniffer {

  private static final Logger LOG = LoggerFactory.getLogger(DelimiterSniffer.class);

  static final String PREFERRED = ",\t;|:";
  private static final double MIN_CONSISTENCY = 0.9;
  private static final double CONSISTENCY_STEP = 0.01;

  /**
   * Reads {@code sampleLines} leading lines of {@code path} (header included) and infers the
   * delimiter.
   *
   * @throws FormatDetectionException if the file holds fewer lines than requested or no consistent
   *     delimiter exists in the sample
   * @throws IngestException if the file cannot be read
   */
  public char sniff(Path path, int sampleLines) {
    if (sampleLines < 1) {
      throw new IllegalArgumentException("sampleLines must be positive: " + sampleLines);
    }
    var sample = new ArrayList<String>(Math.min(sampleLines, 4096));
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while (sample.size() < sampleLines && (line = reader.readLine()) != null) {
        sample.add(line);
      }
    } catch (IOException e) {
      throw new IngestException("Cannot read source file " + path + ": " + e.getMessage(), e);
    }
    if (sample.size() < sampleLines) {
      throw new FormatDetectionException(
          String.format(
              "Source %s is too short for delimiter detection: %d lines available, %d requested",
              path, sample.size(), sampleLines));
    }
    char delimiter = sniff(sample);
    LOG.info(
        "Detected delimiter {} from {} sample lines of {}", describe(delimiter), sampleLines, path);
    return delimiter;
  }

  /** Infers the delimiter of an in-memory sample. */
  public char sniff(List<String> sample) {
    if (sample.isEmpty()) {
      throw new FormatDetectionException("Cannot detect a delimiter from an empty sample");
    }
    var lines = new ArrayList<>(sample);
    lines.set(0, stripBom(lines.get(0)));

    Map<Character, int[]> countsPerChar = new HashMap<>();
    for (int i = 0; i < lines.size(); i++) {
      for (Map.Entry<Character, Integer> e : countOutsideQuotes(lines.get(i)).entrySet()) {
        countsPerChar.computeIfAbsent(e.getKey(), k -> new int[lines.size()])[i] = e.getValue();
      }
    }

    List<Candidate> candidates = new ArrayList<>();
    for (Map.Entry<Character, int[]> e : countsPerChar.entrySet()) {
      candidateOf(e.getKey(), e.getValue()).ifPresent(candidates::add);
    }

    for (double threshold = 1.0;
        threshold >= MIN_CONSISTENCY - 1e-9;
        threshold -= CONSISTENCY_STEP) {
      final double t = threshold;
      var best =
          candidates.stream()
              .filter(c -> c.consistency() >= t - 1e-9)
              .min(DelimiterSniffer::compareCandidates);
      if (best.isPresent()) {
        LOG.debug("Delimiter candidate {} accepted at consistency {}", best.get(), t);
        return best.get().delimiter();
      }
    }
    throw new FormatDetectionException(
        "No consistent delimiter found in " + lines.size() + " sample lines");
  }

  private static Optional<Candidate> candidateOf(char ch, int[] perLine) {
    Map<Integer, Integer> frequencyOfCount = new HashMap<>();
    for (int count : perLine) {
      frequencyOfCount.merge(count, 1, Integer::sum);
    }
    int modalCount = 0;
    int modalLines = 0;
    for (Map.Entry<Integer, Integer> e : frequencyOfCount.entrySet()) {
      if (e.getValue() > modalLines || (e.getValue() == modalLines && e.getKey() > modalCount)) {
        modalCount = e.getKey();
        modalLines = e.getValue();
      }
    }
    if (modalCount == 0) {
      return Optional.empty();
    }
    return Optional.of(new Candidate(ch, modalCount, (double) modalLines / perLine.length));
  }

  private static int compareCandidates(Candidate a, Candidate b) {
    int pa = preference(a.delimiter());
    int pb = preference(b.delimiter());
    if (pa != pb) {
      return Integer.compare(pa, pb);
    }
    if (a.consistency() != b.consistency()) {
      return Double.compare(b.consistency(), a.consistency());
    }
    if (a.modalCount() != b.modalCount()) {
      return Integer.compare(b.modalCount(), a.modalCount());
    }
    return Character.compare(a.delimiter(), b.delimiter());
  }

  private static int preference(char ch) {
    int idx = PREFERRED.indexOf(ch);
    return idx < 0 ? PREFERRED.length() : idx;
  }

  private static Map<Character, Integer> countOutsideQuotes(String line) {
    Map<Character, Integer> counts = new HashMap<>();
    boolean inQuotes = false;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      if (ch == '"') {
        inQuotes = !inQuotes;
      } else if (!inQuotes && isCandidate(ch)) {
        counts.merge(ch, 1, Integer::sum);
      }
    }
    return counts;
  }

  private static boolean isCandidate(char ch) {
    if (ch == '\t') {
      return true;
    }
    return !Character.isLetterOrDigit(ch)
        && !Character.isWhitespace(ch)
        && !Character.isISOControl(ch)
        && ch != '\''
        && ch != '"';
  }

  static String stripBom(String line) {
    return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
  }

  /** Printable form of a delimiter for logs and reports. */
  public static String describe(char delimiter) {
    return delimiter == '\t' ? "'\\t'" : "'" + delimiter + "'";
  }

  private record Candidate(char delimiter, int modalCount, double consistency) {}
}
