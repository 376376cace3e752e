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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Running range and mean of the numeric values of a field.
 */
public class NumericStats {

  private final double min;
  private final double max;
  private final double avg;
  private final boolean integer;
  private final long count;

  @JsonCreator
  public NumericStats(@JsonProperty("min") double min,
      @JsonProperty("max") double max,
      @JsonProperty("avg") double avg,
      @JsonProperty("isInteger") boolean integer,
      @JsonProperty("count") long count) {
    this.min = min;
    this.max = max;
    this.avg = avg;
    this.integer = integer;
    this.count = count;
  }

  static NumericStats first(double value, boolean integer) {
    return new NumericStats(value, value, value, integer, 1);
  }

  /**
   * Returns these statistics with one more value folded in.
   */
  NumericStats add(double value, boolean valueIsInteger) {
    long n = count + 1;
    return new NumericStats(Math.min(min, value), Math.max(max, value),
        (avg * count + value) / n, integer && valueIsInteger, n);
  }

  /**
   * Returns the combination of two sets of statistics; the mean is weighted
   * by the number of numeric values on each side.
   */
  static NumericStats merge(NumericStats a, NumericStats b) {
    long n = a.count + b.count;
    double avg = n == 0 ? 0 : (a.avg * a.count + b.avg * b.count) / n;
    return new NumericStats(Math.min(a.min, b.min), Math.max(a.max, b.max), avg,
        a.integer && b.integer, n);
  }

  @JsonProperty("min")
  public double getMin() {
    return min;
  }

  @JsonProperty("max")
  public double getMax() {
    return max;
  }

  @JsonProperty("avg")
  public double getAvg() {
    return avg;
  }

  /**
   * Returns whether every numeric value seen was a whole number.
   */
  @JsonProperty("isInteger")
  public boolean isInteger() {
    return integer;
  }

  /** Returns how many numeric values were seen. */
  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NumericStats)) {
      return false;
    }
    NumericStats that = (NumericStats) o;
    return Double.compare(min, that.min) == 0
        && Double.compare(max, that.max) == 0
        && Double.compare(avg, that.avg) == 0
        && integer == that.integer
        && count == that.count;
  }

  @Override public int hashCode() {
    return Objects.hash(min, max, avg, integer, count);
  }

  @Override public String toString() {
    return "NumericStats{min=" + min + ", max=" + max + ", avg=" + avg
        + ", isInteger=" + integer + ", count=" + count + "}";
  }
}
