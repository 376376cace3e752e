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
package org.aperio.inference.stats;

import org.aperio.inference.DetectionConfig;
import org.aperio.inference.value.CellValue;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Creates, updates and merges {@link FieldStatistics}.
 *
 * <p>Updating is streaming: each value is folded in once and memory per
 * field is bounded by the sample cap. Merging is associative and commutative
 * for the counts, the numeric range and mean, and the enum counts, so
 * statistics from independent chunks can be combined in any order.
 */
public final class FieldStatisticsTracker {

  private static final Pattern ID_FIELD_NAME =
      Pattern.compile("^(id|uuid|guid|_id|identifier|key)$", Pattern.CASE_INSENSITIVE);

  private FieldStatisticsTracker() {
  }

  /**
   * Creates empty statistics for a path.
   */
  public static FieldStatistics create(String path) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Field path is required");
    }
    return new FieldStatistics(path, Instant.now());
  }

  /**
   * Returns the type tag of a value.
   */
  public static TypeTag typeOf(@Nullable Object value) {
    return TypeTag.of(CellValue.of(value));
  }

  /**
   * Folds one value into the statistics.
   *
   * @param stats Statistics to update in place
   * @param value Observed value
   * @param maxUniqueValues Cap on distinct samples kept
   */
  public static void update(FieldStatistics stats, CellValue value, int maxUniqueValues) {
    stats.setOccurrences(stats.getOccurrences() + 1);
    if (value.isNull()) {
      stats.setNullCount(stats.getNullCount() + 1);
    }

    TypeTag tag = TypeTag.of(value);
    stats.typeDistribution().merge(tag.getTag(), 1L, Long::sum);

    // NaN and infinities are counted and typed but kept out of min/max/avg.
    if (value.isNumeric() && Double.isFinite(value.asDouble())) {
      double d = value.asDouble();
      boolean integer = value.getKind() == CellValue.Kind.INTEGER;
      NumericStats numeric = stats.getNumericStats();
      stats.setNumericStats(numeric == null
          ? NumericStats.first(d, integer)
          : numeric.add(d, integer));
    }

    if (value.getKind() == CellValue.Kind.STRING) {
      for (StringFormat format : StringFormat.detect(value.asText())) {
        stats.formats().merge(format.getTag(), 1L, Long::sum);
      }
    }

    if (value.isScalar()) {
      trackSample(stats, value.toJavaObject(), maxUniqueValues);
    }

    stats.setLastSeen(Instant.now());
  }

  /**
   * Folds one raw value into the statistics.
   */
  public static void update(FieldStatistics stats, @Nullable Object value,
      int maxUniqueValues) {
    update(stats, CellValue.of(value), maxUniqueValues);
  }

  private static void trackSample(FieldStatistics stats, @Nullable Object sample,
      int maxUniqueValues) {
    List<@Nullable Object> samples = stats.uniqueSamples();
    int index = samples.indexOf(sample);
    if (index >= 0) {
      stats.sampleCounts().set(index, stats.sampleCounts().get(index) + 1);
      return;
    }
    if (samples.size() < maxUniqueValues) {
      samples.add(sample);
      stats.sampleCounts().add(1L);
      stats.setUniqueValues(samples.size());
    } else {
      stats.setCapped(true);
    }
  }

  /**
   * Combines statistics of the same path from two independent chunks.
   * Neither argument is modified.
   *
   * @throws IllegalArgumentException if the paths differ
   */
  public static FieldStatistics merge(FieldStatistics a, FieldStatistics b) {
    return merge(a, b, DetectionConfig.defaults().getMaxUniqueValues());
  }

  /**
   * Combines statistics of the same path, keeping at most
   * {@code maxUniqueValues} samples.
   *
   * @throws IllegalArgumentException if the paths differ
   */
  public static FieldStatistics merge(FieldStatistics a, FieldStatistics b,
      int maxUniqueValues) {
    if (!a.getPath().equals(b.getPath())) {
      throw new IllegalArgumentException("Cannot merge statistics of different fields: "
          + a.getPath() + " and " + b.getPath());
    }

    FieldStatistics merged = new FieldStatistics(a.getPath(), a.getFirstSeen());
    merged.setDepth(a.getDepth());
    merged.setOccurrences(a.getOccurrences() + b.getOccurrences());
    merged.setNullCount(a.getNullCount() + b.getNullCount());
    merged.setOccurrencePercent(Math.max(a.getOccurrencePercent(), b.getOccurrencePercent()));
    addCounts(merged.typeDistribution(), a.typeDistribution(), b.typeDistribution());
    addCounts(merged.formats(), a.formats(), b.formats());

    NumericStats na = a.getNumericStats();
    NumericStats nb = b.getNumericStats();
    if (na != null && nb != null) {
      merged.setNumericStats(NumericStats.merge(na, nb));
    } else {
      merged.setNumericStats(na != null ? na : nb);
    }

    Map<@Nullable Object, Long> union = sampleUnion(a, b);
    int kept = 0;
    for (Map.Entry<@Nullable Object, Long> entry : union.entrySet()) {
      if (kept++ >= maxUniqueValues) {
        break;
      }
      merged.uniqueSamples().add(entry.getKey());
      merged.sampleCounts().add(entry.getValue());
    }
    merged.setUniqueValues(Math.max(union.size(),
        Math.max(a.getUniqueValues(), b.getUniqueValues())));
    merged.setCapped(a.isCapped() || b.isCapped() || union.size() > maxUniqueValues);

    merged.setEnumCandidate(a.isEnumCandidate() || b.isEnumCandidate());
    if (a.getEnumValues() != null || b.getEnumValues() != null) {
      merged.setEnumValues(mergeEnumValues(a.getEnumValues(), b.getEnumValues(),
          merged.getOccurrences()));
    }

    merged.setFirstSeen(min(a.getFirstSeen(), b.getFirstSeen()));
    merged.setLastSeen(max(a.getLastSeen(), b.getLastSeen()));
    return merged;
  }

  /**
   * Merges two path-to-statistics maps. Paths present on one side only are
   * copied.
   */
  public static Map<String, FieldStatistics> mergeAll(Map<String, FieldStatistics> a,
      Map<String, FieldStatistics> b, int maxUniqueValues) {
    Map<String, FieldStatistics> merged = new LinkedHashMap<>();
    for (Map.Entry<String, FieldStatistics> entry : a.entrySet()) {
      FieldStatistics other = b.get(entry.getKey());
      merged.put(entry.getKey(), other == null
          ? entry.getValue().copy()
          : merge(entry.getValue(), other, maxUniqueValues));
    }
    for (Map.Entry<String, FieldStatistics> entry : b.entrySet()) {
      if (!merged.containsKey(entry.getKey())) {
        merged.put(entry.getKey(), entry.getValue().copy());
      }
    }
    return merged;
  }

  /**
   * Decides whether the field looks like an enum and, if so, records its
   * values with counts.
   *
   * <p>In count mode a field is a candidate when it has at most
   * {@code threshold} distinct values; in percentage mode when distinct
   * values per occurrence are at most {@code threshold} percent. Fields whose
   * samples were capped, or with no non-null values, are never candidates.
   */
  public static void detectEnum(FieldStatistics stats, int threshold,
      DetectionConfig.EnumMode mode) {
    long nonNull = stats.getOccurrences() - stats.getNullCount();
    boolean candidate;
    if (stats.isCapped() || nonNull <= 0 || stats.getUniqueValues() == 0) {
      candidate = false;
    } else if (mode == DetectionConfig.EnumMode.PERCENTAGE) {
      candidate = (double) stats.getUniqueValues() / stats.getOccurrences()
          <= threshold / 100d;
    } else {
      candidate = stats.getUniqueValues() <= threshold;
    }

    stats.setEnumCandidate(candidate);
    if (!candidate) {
      stats.setEnumValues(null);
      return;
    }
    List<EnumValue> values = new ArrayList<>();
    List<@Nullable Object> samples = stats.uniqueSamples();
    for (int i = 0; i < samples.size(); i++) {
      Object sample = samples.get(i);
      if (sample == null) {
        continue;
      }
      long count = stats.sampleCounts().get(i);
      values.add(new EnumValue(sample, count, percent(count, stats.getOccurrences())));
    }
    values.sort((x, y) -> Long.compare(y.getCount(), x.getCount()));
    stats.setEnumValues(values);
  }

  /**
   * Whether a field looks like a record identifier: an identifier-like name,
   * present in more than 90% of records, with a distinct value each time.
   */
  public static boolean isIdField(FieldStatistics stats, long recordCount) {
    String name = stats.getPath();
    int dot = name.lastIndexOf('.');
    String leaf = dot >= 0 ? name.substring(dot + 1) : name;
    return ID_FIELD_NAME.matcher(leaf).matches()
        && stats.getOccurrences() > recordCount * 0.9
        && !stats.isCapped()
        && stats.getUniqueValues() == stats.getOccurrences();
  }

  private static void addCounts(Map<String, Long> target, Map<String, Long> a,
      Map<String, Long> b) {
    for (Map.Entry<String, Long> entry : a.entrySet()) {
      target.merge(entry.getKey(), entry.getValue(), Long::sum);
    }
    for (Map.Entry<String, Long> entry : b.entrySet()) {
      target.merge(entry.getKey(), entry.getValue(), Long::sum);
    }
  }

  private static Map<@Nullable Object, Long> sampleUnion(FieldStatistics a, FieldStatistics b) {
    Map<@Nullable Object, Long> union = new LinkedHashMap<>();
    for (FieldStatistics stats : new FieldStatistics[] {a, b}) {
      List<@Nullable Object> samples = stats.uniqueSamples();
      for (int i = 0; i < samples.size(); i++) {
        long count = i < stats.sampleCounts().size() ? stats.sampleCounts().get(i) : 1L;
        union.merge(samples.get(i), count, Long::sum);
      }
    }
    return union;
  }

  private static List<EnumValue> mergeEnumValues(@Nullable List<EnumValue> a,
      @Nullable List<EnumValue> b, long occurrences) {
    Map<@Nullable Object, Long> counts = new LinkedHashMap<>();
    for (List<EnumValue> side : Arrays.asList(a, b)) {
      if (side == null) {
        continue;
      }
      for (EnumValue value : side) {
        counts.merge(value.getValue(), value.getCount(), Long::sum);
      }
    }
    List<EnumValue> merged = new ArrayList<>();
    for (Map.Entry<@Nullable Object, Long> entry : counts.entrySet()) {
      merged.add(
          new EnumValue(entry.getKey(), entry.getValue(),
              percent(entry.getValue(), occurrences)));
    }
    merged.sort((x, y) -> Long.compare(y.getCount(), x.getCount()));
    return merged;
  }

  private static double percent(long count, long total) {
    return total == 0 ? 0 : count * 100d / total;
  }

  private static Instant min(Instant a, Instant b) {
    return a.isBefore(b) ? a : b;
  }

  private static Instant max(Instant a, Instant b) {
    return a.isAfter(b) ? a : b;
  }
}
