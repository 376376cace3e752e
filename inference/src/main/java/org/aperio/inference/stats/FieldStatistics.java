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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running statistics for one field path.
 *
 * <p>Instances are mutable and updated in place by
 * {@link FieldStatisticsTracker}. They are not thread-safe: each worker keeps
 * its own instances and combines them with
 * {@link FieldStatisticsTracker#merge(FieldStatistics, FieldStatistics)}.
 *
 * <p>Invariants: {@code nullCount <= occurrences}, and {@code occurrences}
 * equals the sum of the type distribution.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldStatistics {

  private String path;
  private long occurrences;
  private double occurrencePercent;
  private long nullCount;
  private Map<String, Long> typeDistribution = new LinkedHashMap<>();
  private @Nullable NumericStats numericStats;
  private List<@Nullable Object> uniqueSamples = new ArrayList<>();
  private List<Long> sampleCounts = new ArrayList<>();
  private int uniqueValues;
  private boolean capped;
  private Map<String, Long> formats = new LinkedHashMap<>();
  @JsonProperty("isEnumCandidate")
  private boolean enumCandidate;
  private @Nullable List<EnumValue> enumValues;
  private Instant firstSeen;
  private Instant lastSeen;
  private int depth;

  /** For deserialization. */
  private FieldStatistics() {
    this.path = "";
    this.firstSeen = Instant.EPOCH;
    this.lastSeen = Instant.EPOCH;
  }

  FieldStatistics(String path, Instant now) {
    this.path = path;
    this.firstSeen = now;
    this.lastSeen = now;
    this.depth = depthOf(path);
  }

  /** Number of dots in the path; top-level fields have depth 0. */
  static int depthOf(String path) {
    int depth = 0;
    for (int i = 0; i < path.length(); i++) {
      if (path.charAt(i) == '.') {
        depth++;
      }
    }
    return depth;
  }

  public String getPath() {
    return path;
  }

  public long getOccurrences() {
    return occurrences;
  }

  void setOccurrences(long occurrences) {
    this.occurrences = occurrences;
  }

  /**
   * Returns occurrences as a percentage of the records seen; set by the
   * schema builder after each batch.
   */
  public double getOccurrencePercent() {
    return occurrencePercent;
  }

  public void setOccurrencePercent(double occurrencePercent) {
    this.occurrencePercent = occurrencePercent;
  }

  public long getNullCount() {
    return nullCount;
  }

  void setNullCount(long nullCount) {
    this.nullCount = nullCount;
  }

  /**
   * Returns counts keyed by {@link TypeTag#getTag()}.
   */
  public Map<String, Long> getTypeDistribution() {
    return Collections.unmodifiableMap(typeDistribution);
  }

  public long getTypeCount(TypeTag tag) {
    Long count = typeDistribution.get(tag.getTag());
    return count == null ? 0 : count;
  }

  Map<String, Long> typeDistribution() {
    return typeDistribution;
  }

  public @Nullable NumericStats getNumericStats() {
    return numericStats;
  }

  void setNumericStats(@Nullable NumericStats numericStats) {
    this.numericStats = numericStats;
  }

  /**
   * Returns distinct scalar values in first-seen order.
   */
  public List<@Nullable Object> getUniqueSamples() {
    return Collections.unmodifiableList(uniqueSamples);
  }

  List<@Nullable Object> uniqueSamples() {
    return uniqueSamples;
  }

  /** Occurrence counts parallel to the unique samples. */
  List<Long> sampleCounts() {
    return sampleCounts;
  }

  /**
   * Returns the number of distinct values; exact unless {@link #isCapped()}.
   */
  public int getUniqueValues() {
    return uniqueValues;
  }

  void setUniqueValues(int uniqueValues) {
    this.uniqueValues = uniqueValues;
  }

  /**
   * Returns whether distinct values were dropped because the sample list
   * was full, so the unique count is a lower bound.
   */
  public boolean isCapped() {
    return capped;
  }

  void setCapped(boolean capped) {
    this.capped = capped;
  }

  /**
   * Returns counts keyed by {@link StringFormat#getTag()}.
   */
  public Map<String, Long> getFormats() {
    return Collections.unmodifiableMap(formats);
  }

  public long getFormatCount(StringFormat format) {
    Long count = formats.get(format.getTag());
    return count == null ? 0 : count;
  }

  Map<String, Long> formats() {
    return formats;
  }

  public boolean isEnumCandidate() {
    return enumCandidate;
  }

  void setEnumCandidate(boolean enumCandidate) {
    this.enumCandidate = enumCandidate;
  }

  public @Nullable List<EnumValue> getEnumValues() {
    return enumValues == null ? null : Collections.unmodifiableList(enumValues);
  }

  void setEnumValues(@Nullable List<EnumValue> enumValues) {
    this.enumValues = enumValues;
  }

  public Instant getFirstSeen() {
    return firstSeen;
  }

  void setFirstSeen(Instant firstSeen) {
    this.firstSeen = firstSeen;
  }

  public Instant getLastSeen() {
    return lastSeen;
  }

  void setLastSeen(Instant lastSeen) {
    this.lastSeen = lastSeen;
  }

  public int getDepth() {
    return depth;
  }

  void setDepth(int depth) {
    this.depth = depth;
  }

  /**
   * Returns the tag with the highest count, ignoring null and undefined;
   * {@code null} when only nulls were seen.
   */
  public @Nullable String getDominantType() {
    String best = null;
    long bestCount = 0;
    for (Map.Entry<String, Long> entry : typeDistribution.entrySet()) {
      if (entry.getKey().equals(TypeTag.NULL.getTag())
          || entry.getKey().equals(TypeTag.UNDEFINED.getTag())) {
        continue;
      }
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best;
  }

  /**
   * Returns a deep copy.
   */
  public FieldStatistics copy() {
    FieldStatistics copy = new FieldStatistics(path, firstSeen);
    copy.occurrences = occurrences;
    copy.occurrencePercent = occurrencePercent;
    copy.nullCount = nullCount;
    copy.typeDistribution = new LinkedHashMap<>(typeDistribution);
    copy.numericStats = numericStats;
    copy.uniqueSamples = new ArrayList<>(uniqueSamples);
    copy.sampleCounts = new ArrayList<>(sampleCounts);
    copy.uniqueValues = uniqueValues;
    copy.capped = capped;
    copy.formats = new LinkedHashMap<>(formats);
    copy.enumCandidate = enumCandidate;
    copy.enumValues = enumValues == null ? null : new ArrayList<>(enumValues);
    copy.lastSeen = lastSeen;
    copy.depth = depth;
    return copy;
  }

  /**
   * Checks the invariants of restored statistics.
   *
   * @throws IllegalStateException if the counts are inconsistent
   */
  void checkInvariants() {
    if (nullCount > occurrences) {
      throw new IllegalStateException("Field " + path + " has nullCount " + nullCount
          + " greater than occurrences " + occurrences);
    }
    long sum = 0;
    for (Long count : typeDistribution.values()) {
      sum += count;
    }
    if (sum != occurrences) {
      throw new IllegalStateException("Field " + path + " has occurrences " + occurrences
          + " but its type distribution sums to " + sum);
    }
    if (sampleCounts.size() != uniqueSamples.size()) {
      // Statistics written without per-value counts.
      sampleCounts = new ArrayList<>(Collections.nCopies(uniqueSamples.size(), 1L));
    }
  }

  @Override public String toString() {
    return "FieldStatistics{path=" + path
        + ", occurrences=" + occurrences
        + ", nullCount=" + nullCount
        + ", types=" + typeDistribution
        + ", uniqueValues=" + uniqueValues
        + (capped ? "+" : "")
        + (enumCandidate ? ", enum" : "") + "}";
  }
}
