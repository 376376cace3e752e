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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Which field path plays each semantic role, with the confidence of each
 * detected mapping. Any path may be {@code null}.
 *
 * <p>Instances are immutable; callers adjust detected mappings with
 * {@link #withOverrides(FieldMappings)}.
 */
public class FieldMappings {

  public static final String TITLE = "titlePath";
  public static final String DESCRIPTION = "descriptionPath";
  public static final String LOCATION_NAME = "locationNamePath";
  public static final String TIMESTAMP = "timestampPath";
  public static final String LATITUDE = "latitudePath";
  public static final String LONGITUDE = "longitudePath";
  public static final String LOCATION = "locationPath";

  private static final FieldMappings EMPTY = builder().build();

  private final @Nullable String titlePath;
  private final @Nullable String descriptionPath;
  private final @Nullable String locationNamePath;
  private final @Nullable String timestampPath;
  private final @Nullable String latitudePath;
  private final @Nullable String longitudePath;
  private final @Nullable String locationPath;
  private final ImmutableMap<String, Double> confidences;

  private FieldMappings(Builder builder) {
    this.titlePath = builder.titlePath;
    this.descriptionPath = builder.descriptionPath;
    this.locationNamePath = builder.locationNamePath;
    this.timestampPath = builder.timestampPath;
    this.latitudePath = builder.latitudePath;
    this.longitudePath = builder.longitudePath;
    this.locationPath = builder.locationPath;
    this.confidences = ImmutableMap.copyOf(builder.confidences);
  }

  /** Returns mappings with no roles assigned. */
  public static FieldMappings empty() {
    return EMPTY;
  }

  public @Nullable String getTitlePath() {
    return titlePath;
  }

  public @Nullable String getDescriptionPath() {
    return descriptionPath;
  }

  public @Nullable String getLocationNamePath() {
    return locationNamePath;
  }

  public @Nullable String getTimestampPath() {
    return timestampPath;
  }

  public @Nullable String getLatitudePath() {
    return latitudePath;
  }

  public @Nullable String getLongitudePath() {
    return longitudePath;
  }

  /** Returns the free-text location field, such as an address. */
  public @Nullable String getLocationPath() {
    return locationPath;
  }

  /**
   * Returns the confidence of a detected mapping, keyed by property name
   * such as {@link #TITLE}; 0 when the role was not detected or was set by
   * an override.
   */
  public double getConfidence(String property) {
    Double confidence = confidences.get(property);
    return confidence == null ? 0 : confidence;
  }

  public Map<String, Double> getConfidences() {
    return confidences;
  }

  /**
   * Returns the mappings as property name to path, including unassigned
   * roles.
   */
  public Map<String, @Nullable String> toMap() {
    Map<String, @Nullable String> map = new LinkedHashMap<>();
    map.put(TITLE, titlePath);
    map.put(DESCRIPTION, descriptionPath);
    map.put(LOCATION_NAME, locationNamePath);
    map.put(TIMESTAMP, timestampPath);
    map.put(LATITUDE, latitudePath);
    map.put(LONGITUDE, longitudePath);
    map.put(LOCATION, locationPath);
    return map;
  }

  /**
   * Returns a copy in which every role the override assigns replaces the
   * detected one. Overridden roles keep no detection confidence.
   */
  public FieldMappings withOverrides(FieldMappings overrides) {
    Builder builder = toBuilder();
    if (overrides.titlePath != null) {
      builder.titlePath(overrides.titlePath, null);
    }
    if (overrides.descriptionPath != null) {
      builder.descriptionPath(overrides.descriptionPath, null);
    }
    if (overrides.locationNamePath != null) {
      builder.locationNamePath(overrides.locationNamePath, null);
    }
    if (overrides.timestampPath != null) {
      builder.timestampPath(overrides.timestampPath, null);
    }
    if (overrides.latitudePath != null) {
      builder.latitudePath(overrides.latitudePath, null);
    }
    if (overrides.longitudePath != null) {
      builder.longitudePath(overrides.longitudePath, null);
    }
    if (overrides.locationPath != null) {
      builder.locationPath(overrides.locationPath, null);
    }
    return builder.build();
  }

  /**
   * Creates mappings from a map of property name to path, as stored with a
   * dataset. Unknown keys are ignored.
   */
  public static FieldMappings fromMap(Map<String, ?> map) {
    if (map == null) {
      return EMPTY;
    }
    Builder builder = builder();
    builder.titlePath(asPath(map.get(TITLE)), null);
    builder.descriptionPath(asPath(map.get(DESCRIPTION)), null);
    builder.locationNamePath(asPath(map.get(LOCATION_NAME)), null);
    builder.timestampPath(asPath(map.get(TIMESTAMP)), null);
    builder.latitudePath(asPath(map.get(LATITUDE)), null);
    builder.longitudePath(asPath(map.get(LONGITUDE)), null);
    builder.locationPath(asPath(map.get(LOCATION)), null);
    return builder.build();
  }

  private static @Nullable String asPath(@Nullable Object value) {
    return value == null ? null : value.toString();
  }

  public Builder toBuilder() {
    Builder builder = builder();
    builder.titlePath = titlePath;
    builder.descriptionPath = descriptionPath;
    builder.locationNamePath = locationNamePath;
    builder.timestampPath = timestampPath;
    builder.latitudePath = latitudePath;
    builder.longitudePath = longitudePath;
    builder.locationPath = locationPath;
    builder.confidences.putAll(confidences);
    return builder;
  }

  /**
   * Creates a new builder for FieldMappings.
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldMappings)) {
      return false;
    }
    return toMap().equals(((FieldMappings) o).toMap());
  }

  @Override public int hashCode() {
    return Objects.hash(titlePath, descriptionPath, locationNamePath, timestampPath,
        latitudePath, longitudePath, locationPath);
  }

  @Override public String toString() {
    return "FieldMappings" + toMap();
  }

  /**
   * Builder for FieldMappings. Passing a null confidence records none.
   */
  public static class Builder {
    private @Nullable String titlePath;
    private @Nullable String descriptionPath;
    private @Nullable String locationNamePath;
    private @Nullable String timestampPath;
    private @Nullable String latitudePath;
    private @Nullable String longitudePath;
    private @Nullable String locationPath;
    private final Map<String, Double> confidences = new LinkedHashMap<>();

    private void confidence(String property, @Nullable String path,
        @Nullable Double confidence) {
      if (path != null && confidence != null) {
        confidences.put(property, confidence);
      } else {
        confidences.remove(property);
      }
    }

    public Builder titlePath(@Nullable String path, @Nullable Double confidence) {
      this.titlePath = path;
      confidence(TITLE, path, confidence);
      return this;
    }

    public Builder descriptionPath(@Nullable String path, @Nullable Double confidence) {
      this.descriptionPath = path;
      confidence(DESCRIPTION, path, confidence);
      return this;
    }

    public Builder locationNamePath(@Nullable String path, @Nullable Double confidence) {
      this.locationNamePath = path;
      confidence(LOCATION_NAME, path, confidence);
      return this;
    }

    public Builder timestampPath(@Nullable String path, @Nullable Double confidence) {
      this.timestampPath = path;
      confidence(TIMESTAMP, path, confidence);
      return this;
    }

    public Builder latitudePath(@Nullable String path, @Nullable Double confidence) {
      this.latitudePath = path;
      confidence(LATITUDE, path, confidence);
      return this;
    }

    public Builder longitudePath(@Nullable String path, @Nullable Double confidence) {
      this.longitudePath = path;
      confidence(LONGITUDE, path, confidence);
      return this;
    }

    public Builder locationPath(@Nullable String path, @Nullable Double confidence) {
      this.locationPath = path;
      confidence(LOCATION, path, confidence);
      return this;
    }

    public FieldMappings build() {
      return new FieldMappings(this);
    }
  }
}
