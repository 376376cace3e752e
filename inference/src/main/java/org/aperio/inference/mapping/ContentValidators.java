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

import org.aperio.inference.stats.FieldStatistics;
import org.aperio.inference.stats.StringFormat;
import org.aperio.inference.stats.TypeTag;
import org.aperio.inference.value.DateStrings;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how well a column's values fit a semantic role, from 0 (reject)
 * to 1.
 *
 * <p>Text roles look at the share of string occurrences and the average
 * length of the sampled strings. A column with statistics but no samples
 * scores a neutral 0.5.
 */
public final class ContentValidators {

  /** Unix seconds after September 2001. */
  private static final double MIN_EPOCH_SECONDS = 1_000_000_000d;
  private static final double MAX_EPOCH_SECONDS = 9_999_999_999d;
  private static final double MIN_EPOCH_MILLIS = 1_000_000_000_000d;
  private static final double MAX_EPOCH_MILLIS = 9_999_999_999_999d;

  private static final int PARSE_SAMPLE_LIMIT = 10;

  private ContentValidators() {
  }

  /**
   * Returns the content score of a column for a role.
   */
  public static double validate(FieldRole role, FieldStatistics stats) {
    if (stats.getOccurrences() == 0) {
      return 0;
    }
    double stringShare = (double) stats.getTypeCount(TypeTag.STRING) / stats.getOccurrences();
    switch (role) {
    case TITLE:
      return validateTitle(stats, stringShare);
    case DESCRIPTION:
      return validateDescription(stats, stringShare);
    case LOCATION_NAME:
      return validateLocationName(stats, stringShare);
    case TIMESTAMP:
      return validateTimestamp(stats, stringShare);
    case LOCATION:
      return validateLocation(stats, stringShare);
    default:
      throw new AssertionError("Unknown role " + role);
    }
  }

  static double validateTitle(FieldStatistics stats, double stringShare) {
    if (stringShare < 0.8) {
      return 0;
    }
    Double length = averageLength(stats);
    if (length == null) {
      return noStringSamples(stats);
    }
    if (length >= 10 && length <= 100) {
      return 1.0;
    }
    if (length >= 5 && length <= 200) {
      return 0.8;
    }
    if (length < 3 || length > 500) {
      return 0.3;
    }
    return 0.6;
  }

  static double validateDescription(FieldStatistics stats, double stringShare) {
    if (stringShare < 0.7) {
      return 0;
    }
    Double length = averageLength(stats);
    if (length == null) {
      return noStringSamples(stats);
    }
    if (length >= 20 && length <= 500) {
      return 1.0;
    }
    if (length >= 10 && length <= 1000) {
      return 0.8;
    }
    if (length < 5) {
      return 0.2;
    }
    if (length > 1000) {
      return 0.7;
    }
    return 0.6;
  }

  static double validateLocationName(FieldStatistics stats, double stringShare) {
    if (stringShare < 0.7) {
      return 0;
    }
    Double length = averageLength(stats);
    if (length == null) {
      return noStringSamples(stats);
    }
    if (length >= 3 && length <= 50) {
      return 1.0;
    }
    if (length >= 2 && length <= 100) {
      return 0.8;
    }
    if (length < 2) {
      return 0.2;
    }
    if (length > 100) {
      return 0.6;
    }
    return 0.5;
  }

  static double validateLocation(FieldStatistics stats, double stringShare) {
    if (stringShare < 0.7) {
      return 0;
    }
    Double length = averageLength(stats);
    if (length == null) {
      return noStringSamples(stats);
    }
    if (length >= 3 && length <= 100) {
      return 1.0;
    }
    if (length >= 2 && length <= 500) {
      return 0.8;
    }
    if (length < 2) {
      return 0.2;
    }
    return 0.6;
  }

  /**
   * Scores a timestamp column by the first of four checks that succeeds:
   * date values, date format counters, strings that parse as dates, and
   * numbers in the Unix epoch range.
   */
  static double validateTimestamp(FieldStatistics stats, double stringShare) {
    double score = checkDateValues(stats);
    if (score > 0) {
      return score;
    }
    score = checkDateFormats(stats);
    if (score > 0) {
      return score;
    }
    score = checkParseableStrings(stats, stringShare);
    if (score > 0) {
      return score;
    }
    return checkUnixTimestamps(stats);
  }

  /**
   * Native dates and date-shaped strings are tagged {@code date}; both are
   * sampled as ISO-8601 text.
   */
  static double checkDateValues(FieldStatistics stats) {
    double dateShare = (double) stats.getTypeCount(TypeTag.DATE) / stats.getOccurrences();
    List<@Nullable Object> samples = stats.getUniqueSamples();
    if (dateShare < 0.7 || samples.isEmpty()) {
      return 0;
    }
    int dates = 0;
    for (Object sample : samples) {
      if (sample instanceof String && DateStrings.hasIsoDateTimePrefix((String) sample)) {
        dates++;
      }
    }
    double ratio = (double) dates / samples.size();
    if (ratio >= 0.7) {
      return 1.0;
    }
    if (ratio >= 0.5) {
      return 0.8;
    }
    return 0;
  }

  static double checkDateFormats(FieldStatistics stats) {
    long dated = stats.getFormatCount(StringFormat.DATE)
        + stats.getFormatCount(StringFormat.DATE_TIME);
    if (dated == 0) {
      return 0;
    }
    return Math.min(1.0, 0.7 + (double) dated / stats.getOccurrences() * 0.3);
  }

  static double checkParseableStrings(FieldStatistics stats, double stringShare) {
    List<String> strings = stringSamples(stats);
    if (stringShare <= 0.5 || strings.isEmpty()) {
      return 0;
    }
    int checked = Math.min(strings.size(), PARSE_SAMPLE_LIMIT);
    int parsed = 0;
    for (int i = 0; i < checked; i++) {
      if (DateStrings.parsesAsDate(strings.get(i))) {
        parsed++;
      }
    }
    double ratio = (double) parsed / checked;
    if (ratio >= 0.7) {
      return 0.9;
    }
    if (ratio >= 0.5) {
      return 0.7;
    }
    return 0;
  }

  static double checkUnixTimestamps(FieldStatistics stats) {
    boolean numeric = stats.getTypeCount(TypeTag.INTEGER) > 0
        || stats.getTypeCount(TypeTag.NUMBER) > 0;
    if (!numeric || stats.getNumericStats() == null) {
      return 0;
    }
    double min = stats.getNumericStats().getMin();
    double max = stats.getNumericStats().getMax();
    if (min > MIN_EPOCH_SECONDS && max < MAX_EPOCH_SECONDS) {
      return 0.8;
    }
    if (min > MIN_EPOCH_MILLIS && max < MAX_EPOCH_MILLIS) {
      return 0.8;
    }
    return 0;
  }

  private static double noStringSamples(FieldStatistics stats) {
    return stats.getUniqueSamples().isEmpty() ? 0.5 : 0;
  }

  /** Average sampled string length, or null when no string was sampled. */
  private static @Nullable Double averageLength(FieldStatistics stats) {
    List<String> strings = stringSamples(stats);
    if (strings.isEmpty()) {
      return null;
    }
    long total = 0;
    for (String s : strings) {
      total += s.codePointCount(0, s.length());
    }
    return (double) total / strings.size();
  }

  private static List<String> stringSamples(FieldStatistics stats) {
    List<String> strings = new ArrayList<>();
    for (Object sample : stats.getUniqueSamples()) {
      if (sample instanceof String) {
        strings.add((String) sample);
      }
    }
    return strings;
  }
}
