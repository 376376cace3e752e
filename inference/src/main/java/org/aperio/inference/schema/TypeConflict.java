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
package org.aperio.inference.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A field that received values of a type it had not seen before.
 */
public class TypeConflict {
  static final int MAX_SAMPLES = 5;

  private final String path;
  private final Map<String, Long> types;
  private final List<Sample> samples;

  @JsonCreator
  TypeConflict(@JsonProperty("path") String path,
      @JsonProperty("types") @Nullable Map<String, Long> types,
      @JsonProperty("samples") @Nullable List<Sample> samples) {
    this.path = path;
    this.types = types == null ? new LinkedHashMap<>() : new LinkedHashMap<>(types);
    this.samples = samples == null ? new ArrayList<>() : new ArrayList<>(samples);
  }

  @JsonProperty("path")
  public String getPath() {
    return path;
  }

  /** Returns the type distribution at the time of the latest conflict. */
  @JsonProperty("types")
  public Map<String, Long> getTypes() {
    return Collections.unmodifiableMap(types);
  }

  /** Returns up to five conflicting values with their types. */
  @JsonProperty("samples")
  public List<Sample> getSamples() {
    return Collections.unmodifiableList(samples);
  }

  void record(Map<String, Long> distribution, String type, @Nullable Object value) {
    types.clear();
    types.putAll(distribution);
    if (samples.size() < MAX_SAMPLES) {
      samples.add(new Sample(type, value));
    }
  }

  @Override public String toString() {
    return "TypeConflict{" + path + ", types=" + types + "}";
  }

  /** A conflicting value. */
  public static class Sample {
    private final String type;
    private final @Nullable Object value;

    @JsonCreator
    public Sample(@JsonProperty("type") String type,
        @JsonProperty("value") @Nullable Object value) {
      this.type = type;
      this.value = value;
    }

    @JsonProperty("type")
    public String getType() {
      return type;
    }

    @JsonProperty("value")
    public @Nullable Object getValue() {
      return value;
    }
  }
}
