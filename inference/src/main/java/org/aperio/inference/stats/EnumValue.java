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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One value of an enum-like field with its frequency.
 */
public class EnumValue {

  private final @Nullable Object value;
  private final long count;
  private final double percent;

  @JsonCreator
  public EnumValue(@JsonProperty("value") @Nullable Object value,
      @JsonProperty("count") long count,
      @JsonProperty("percent") double percent) {
    this.value = value;
    this.count = count;
    this.percent = percent;
  }

  @JsonProperty("value")
  public @Nullable Object getValue() {
    return value;
  }

  @JsonProperty("count")
  public long getCount() {
    return count;
  }

  /** Returns the count as a percentage of the field's occurrences. */
  @JsonProperty("percent")
  public double getPercent() {
    return percent;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EnumValue)) {
      return false;
    }
    EnumValue that = (EnumValue) o;
    return count == that.count
        && Double.compare(percent, that.percent) == 0
        && Objects.equals(value, that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(value, count, percent);
  }

  @Override public String toString() {
    return value + "=" + count + " (" + percent + "%)";
  }
}
