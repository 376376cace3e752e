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
package org.aperio.inference.geo;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Layouts of a column that holds both coordinates in one value.
 */
public enum CoordinateFormat {
  /** {@code "40.7128, -74.0060"}. */
  COMBINED_COMMA("combined_comma"),
  /** {@code "40.7128 -74.0060"}. */
  COMBINED_SPACE("combined_space"),
  /** GeoJSON Point with {@code [longitude, latitude]} coordinates. */
  GEOJSON("geojson"),
  /** {@code "[40.7128, -74.0060]"}. */
  BRACKETS("brackets"),
  UNKNOWN("unknown");

  private static final ImmutableMap<String, CoordinateFormat> BY_TAG;

  static {
    ImmutableMap.Builder<String, CoordinateFormat> builder = ImmutableMap.builder();
    for (CoordinateFormat format : values()) {
      builder.put(format.tag, format);
    }
    BY_TAG = builder.build();
  }

  private final String tag;

  CoordinateFormat(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Looks up a format by its tag; returns {@code null} for an unknown tag.
   */
  public static @Nullable CoordinateFormat fromTag(String tag) {
    return BY_TAG.get(tag);
  }
}
