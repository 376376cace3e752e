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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Coordinate columns found in a table.
 *
 * <p>When {@link #isSwappedCoordinates()} is true the column reported as the
 * latitude column holds longitudes and the other way round.
 */
public class GeoColumnResult {

  private static final GeoColumnResult NOT_FOUND =
      new GeoColumnResult(false, GeoColumnType.NONE, null, null, null, null, 0, null, false);

  private final boolean found;
  private final GeoColumnType type;
  private final @Nullable String latColumn;
  private final @Nullable String lonColumn;
  private final @Nullable String combinedColumn;
  private final @Nullable CoordinateFormat format;
  private final double confidence;
  private final @Nullable DetectionMethod detectionMethod;
  private final boolean swappedCoordinates;

  private GeoColumnResult(boolean found, GeoColumnType type, @Nullable String latColumn,
      @Nullable String lonColumn, @Nullable String combinedColumn,
      @Nullable CoordinateFormat format, double confidence,
      @Nullable DetectionMethod detectionMethod, boolean swappedCoordinates) {
    this.found = found;
    this.type = type;
    this.latColumn = latColumn;
    this.lonColumn = lonColumn;
    this.combinedColumn = combinedColumn;
    this.format = format;
    this.confidence = confidence;
    this.detectionMethod = detectionMethod;
    this.swappedCoordinates = swappedCoordinates;
  }

  /**
   * Returns the result for a table without usable coordinate columns.
   */
  public static GeoColumnResult notFound() {
    return NOT_FOUND;
  }

  static GeoColumnResult separate(String latColumn, String lonColumn, double confidence,
      DetectionMethod method, boolean swapped) {
    return new GeoColumnResult(true, GeoColumnType.SEPARATE, latColumn, lonColumn, null,
        null, confidence, method, swapped);
  }

  static GeoColumnResult combined(String column, CoordinateFormat format,
      double confidence) {
    return new GeoColumnResult(true, GeoColumnType.COMBINED, null, null, column, format,
        confidence, DetectionMethod.PATTERN, false);
  }

  public boolean isFound() {
    return found;
  }

  public GeoColumnType getType() {
    return type;
  }

  public @Nullable String getLatColumn() {
    return latColumn;
  }

  public @Nullable String getLonColumn() {
    return lonColumn;
  }

  public @Nullable String getCombinedColumn() {
    return combinedColumn;
  }

  public @Nullable CoordinateFormat getFormat() {
    return format;
  }

  public double getConfidence() {
    return confidence;
  }

  public @Nullable DetectionMethod getDetectionMethod() {
    return detectionMethod;
  }

  public boolean isSwappedCoordinates() {
    return swappedCoordinates;
  }

  /**
   * Returns the column that actually holds latitudes, taking a detected swap
   * into account.
   */
  public @Nullable String getEffectiveLatColumn() {
    return swappedCoordinates ? lonColumn : latColumn;
  }

  /**
   * Returns the column that actually holds longitudes, taking a detected swap
   * into account.
   */
  public @Nullable String getEffectiveLonColumn() {
    return swappedCoordinates ? latColumn : lonColumn;
  }

  @Override public String toString() {
    if (!found) {
      return "GeoColumnResult{none}";
    }
    StringBuilder sb = new StringBuilder("GeoColumnResult{").append(type.getLabel());
    if (type == GeoColumnType.SEPARATE) {
      sb.append(", lat=").append(latColumn).append(", lon=").append(lonColumn);
    } else {
      sb.append(", column=").append(combinedColumn)
          .append(", format=").append(format == null ? null : format.getTag());
    }
    sb.append(", confidence=").append(confidence);
    if (detectionMethod != null) {
      sb.append(", method=").append(detectionMethod.getLabel());
    }
    if (swappedCoordinates) {
      sb.append(", swapped");
    }
    return sb.append('}').toString();
  }
}
