/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.aperio.inference.mapping;

import org.aperio.inference.geo.CoordinateParser;
import org.aperio.inference.geo.GeoPatterns;
import org.aperio.inference.stats.FieldStatistics;
import org.aperio.inference.stats.NumericStats;
import org.aperio.inference.stats.TypeTag;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks latitude and longitude fields from accumulated statistics.
 *
 * <p>A field is eligible when its name matches a coordinate pattern and its
 * values lie within the coordinate's bound. Eligible fields are ranked by a
 * confidence built from pattern specificity (up to 0.4), in-bound values
 * (0.3), type consistency (0.2) and completeness (0.1).
 */
public final class CoordinateFieldScorer {

  private static final int STRING_SAMPLE_LIMIT = 10;
  private static final double STRING_VALID_RATIO = 0.7;

  private CoordinateFieldScorer() {
  }

  /** A field path with its confidence. */
  public static class FieldMatch {
    private final String path;
    private final double score;

    FieldMatch(String path, double score) {
      this.path = path;
      this.score = score;
    }

    public String getPath() {
      return path;
    }

    public double getScore() {
      return score;
    }

    @Override public String toString() {
      return path + "=" + score;
    }
  }

  public static @Nullable FieldMatch findLatitudeField(Map<String, FieldStatistics> fields) {
    return findCoordinateField(fields, GeoPatterns.LATITUDE, CoordinateParser.MAX_LATITUDE);
  }

  public static @Nullable FieldMatch findLongitudeField(Map<String, FieldStatistics> fields) {
    return findCoordinateField(fields, GeoPatterns.LONGITUDE, CoordinateParser.MAX_LONGITUDE);
  }

  /**
   * Returns the eligible field with the highest confidence; the first one
   * wins a tie. Returns null when no field is eligible.
   *
   * @param bound Largest absolute value the coordinate may take
   */
  public static @Nullable FieldMatch findCoordinateField(Map<String, FieldStatistics> fields,
      List<Pattern> patterns, double bound) {
    FieldMatch best = null;
    for (Map.Entry<String, FieldStatistics> entry : fields.entrySet()) {
      String name = leafName(entry.getKey());
      if (GeoPatterns.indexOf(name, patterns) < 0 || !isValidField(entry.getValue(), bound)) {
        continue;
      }
      double score = calculateConfidence(entry.getValue(), patterns, bound);
      if (best == null || score > best.getScore()) {
        best = new FieldMatch(entry.getKey(), score);
      }
    }
    return best;
  }

  /**
   * Returns the confidence, between 0 and 1, that the field holds the
   * coordinate the patterns describe.
   */
  public static double calculateConfidence(FieldStatistics stats, List<Pattern> patterns,
      double bound) {
    if (stats.getOccurrences() == 0) {
      return 0;
    }
    double score = patternConfidence(leafName(stats.getPath()), patterns);
    score += typeConfidence(stats, bound);

    long total = 0;
    long dominant = 0;
    for (Long count : stats.getTypeDistribution().values()) {
      total += count;
      dominant = Math.max(dominant, count);
    }
    if (total > 0) {
      score += 0.2 * dominant / total;
    }
    score += 0.1 * (stats.getOccurrences() - stats.getNullCount()) / stats.getOccurrences();
    return score;
  }

  private static double patternConfidence(String name, List<Pattern> patterns) {
    int index = GeoPatterns.indexOf(name, patterns);
    if (index < 0) {
      return 0;
    }
    return 0.4 * (1 - (double) index / patterns.size());
  }

  private static double typeConfidence(FieldStatistics stats, double bound) {
    if (isNumeric(stats)) {
      return numericInBounds(stats, bound) ? 0.3 : 0;
    }
    if (stats.getTypeCount(TypeTag.STRING) > 0) {
      int total = 0;
      int valid = 0;
      for (String sample : stringSamples(stats)) {
        total++;
        Double parsed = CoordinateParser.parseCoordinate(sample);
        if (parsed != null && Math.abs(parsed) <= bound) {
          valid++;
        }
      }
      return total == 0 ? 0 : 0.3 * valid / total;
    }
    return 0;
  }

  static boolean isValidField(FieldStatistics stats, double bound) {
    if (isNumeric(stats) && numericInBounds(stats, bound)) {
      return true;
    }
    if (stats.getTypeCount(TypeTag.STRING) == 0) {
      return false;
    }
    int parsedCount = 0;
    int valid = 0;
    for (String sample : stringSamples(stats)) {
      Double parsed = CoordinateParser.parseCoordinate(sample);
      if (parsed != null) {
        parsedCount++;
        if (Math.abs(parsed) <= bound) {
          valid++;
        }
      }
    }
    return parsedCount > 0 && (double) valid / parsedCount >= STRING_VALID_RATIO;
  }

  private static boolean isNumeric(FieldStatistics stats) {
    return stats.getNumericStats() != null
        && (stats.getTypeCount(TypeTag.INTEGER) > 0 || stats.getTypeCount(TypeTag.NUMBER) > 0);
  }

  private static boolean numericInBounds(FieldStatistics stats, double bound) {
    NumericStats numeric = stats.getNumericStats();
    return numeric != null && numeric.getMin() >= -bound && numeric.getMax() <= bound;
  }

  /** Non-blank string samples among the first few sampled values. */
  private static List<String> stringSamples(FieldStatistics stats) {
    List<@Nullable Object> samples = stats.getUniqueSamples();
    List<String> strings = new ArrayList<>();
    for (int i = 0; i < Math.min(samples.size(), STRING_SAMPLE_LIMIT); i++) {
      Object sample = samples.get(i);
      if (sample instanceof String && !((String) sample).trim().isEmpty()) {
        strings.add((String) sample);
      }
    }
    return strings;
  }

  static String leafName(String path) {
    int dot = path.lastIndexOf('.');
    return dot >= 0 ? path.substring(dot + 1) : path;
  }
}
