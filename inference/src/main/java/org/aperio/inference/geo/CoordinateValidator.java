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

import org.aperio.inference.DetectionConfig;
import org.aperio.inference.value.CellValue;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Validates coordinate pairs and extracts pairs from combined values.
 *
 * <p>Validation checks run in a fixed order: missing values, the (0, 0)
 * placeholder, exchanged latitude and longitude, then range. A swapped pair is
 * corrected when auto-fix is on.
 *
 * <p>Instances are immutable and may be shared.
 */
public class CoordinateValidator {

  private static final double[][] TEST_COORDINATES = {
      {0, 0}, {1, 1}, {-1, -1}, {12.345678, 12.345678}
  };
  private static final double TEST_COORDINATE_TOLERANCE = 0.0001;

  private final DetectionConfig config;

  public CoordinateValidator() {
    this(DetectionConfig.defaults());
  }

  public CoordinateValidator(DetectionConfig config) {
    this.config = config;
  }

  /**
   * Validates a pair, exchanging the values when they are swapped.
   */
  public ValidatedCoordinates validateCoordinates(@Nullable Double lat, @Nullable Double lon) {
    return validateCoordinates(lat, lon, true);
  }

  /**
   * Validates a pair.
   *
   * @param lat Latitude; may be null
   * @param lon Longitude; may be null
   * @param autoFix Whether a swapped pair is returned exchanged and valid
   * @return Validation outcome; never null
   */
  public ValidatedCoordinates validateCoordinates(@Nullable Double lat, @Nullable Double lon,
      boolean autoFix) {
    if (lat == null || lon == null || lat.isNaN() || lon.isNaN()) {
      return ValidatedCoordinates.of(lat, lon, false, ValidationStatus.INVALID, 0);
    }

    if (lat == 0 && lon == 0) {
      return ValidatedCoordinates.of(lat, lon, !config.isRejectZeroCoordinates(),
          ValidationStatus.SUSPICIOUS_ZERO, 0.1);
    }

    if (CoordinateParser.looksSwapped(lat, lon)) {
      if (autoFix) {
        return new ValidatedCoordinates(lon, lat, true, ValidationStatus.SWAPPED, 0.8,
            true, lat, lon);
      }
      return ValidatedCoordinates.of(lat, lon, false, ValidationStatus.SWAPPED, 0.3);
    }

    if (!CoordinateParser.isValidLatitude(lat) || !CoordinateParser.isValidLongitude(lon)) {
      return ValidatedCoordinates.of(lat, lon, false, ValidationStatus.OUT_OF_RANGE, 0);
    }

    return ValidatedCoordinates.of(lat, lon, true, ValidationStatus.VALID, 1.0);
  }

  /**
   * Extracts a pair from a combined value, detecting the layout.
   * Layouts are tried in the order comma, space, brackets, GeoJSON.
   */
  public CoordinateExtraction extractFromCombined(@Nullable Object value) {
    return extractFromCombined(value, CoordinateFormat.UNKNOWN);
  }

  /**
   * Extracts a pair from a combined value.
   *
   * @param value Raw cell value
   * @param format Layout to read; {@link CoordinateFormat#UNKNOWN} auto-detects
   * @return Extraction; {@code isValid()} is false when nothing could be read
   *     or the pair is out of range
   */
  public CoordinateExtraction extractFromCombined(@Nullable Object value,
      CoordinateFormat format) {
    CellValue cell = CellValue.of(value);
    if (cell.isBlank()) {
      return CoordinateExtraction.failed(format);
    }

    switch (format) {
    case COMBINED_COMMA:
      return toExtraction(CombinedCoordinates.readComma(cell), format);
    case COMBINED_SPACE:
      return toExtraction(CombinedCoordinates.readSpace(cell), format);
    case GEOJSON:
      return toExtraction(CombinedCoordinates.readGeoJson(cell), format);
    case BRACKETS:
      return toExtraction(CombinedCoordinates.readBrackets(cell), format);
    default:
      break;
    }

    double[] pair = CombinedCoordinates.readComma(cell);
    if (pair != null) {
      return toExtraction(pair, CoordinateFormat.COMBINED_COMMA);
    }
    pair = CombinedCoordinates.readSpace(cell);
    if (pair != null) {
      return toExtraction(pair, CoordinateFormat.COMBINED_SPACE);
    }
    pair = CombinedCoordinates.readBrackets(cell);
    if (pair != null) {
      return toExtraction(pair, CoordinateFormat.BRACKETS);
    }
    pair = CombinedCoordinates.readGeoJson(cell);
    if (pair != null) {
      return toExtraction(pair, CoordinateFormat.GEOJSON);
    }
    return CoordinateExtraction.failed(CoordinateFormat.UNKNOWN);
  }

  private CoordinateExtraction toExtraction(double @Nullable [] pair,
      CoordinateFormat format) {
    if (pair == null) {
      return CoordinateExtraction.failed(format);
    }
    boolean valid = CoordinateParser.isValidCoordinate(pair[0], pair[1],
        config.isRejectZeroCoordinates());
    return new CoordinateExtraction(pair[0], pair[1], format, valid);
  }

  /**
   * Reports whether a sample of pairs is systematically swapped, that is
   * whether more than the configured share (70% by default) of the complete
   * pairs looks swapped.
   *
   * @param samples Pairs as {@code {latitude, longitude}}; incomplete pairs
   *     are skipped
   */
  public boolean detectSwappedCoordinates(List<Double[]> samples) {
    int total = 0;
    int swapped = 0;
    for (Double[] sample : samples) {
      if (sample == null || sample.length < 2 || sample[0] == null || sample[1] == null) {
        continue;
      }
      total++;
      if (CoordinateParser.looksSwapped(sample[0], sample[1])) {
        swapped++;
      }
    }
    return total > 0 && (double) swapped / total > config.getBatchSwapRatio();
  }

  /**
   * Scores how plausible a valid pair is as a real measured location.
   * Whole-number pairs, pairs near the poles or the antimeridian, and
   * well-known placeholder values score lower.
   */
  public double calculateConfidence(double lat, double lon) {
    double confidence = 1.0;
    if (lat == Math.rint(lat) && lon == Math.rint(lon)) {
      confidence *= 0.9;
    }
    if (Math.abs(lat) > 85 || Math.abs(lon) > 175) {
      confidence *= 0.95;
    }
    for (double[] test : TEST_COORDINATES) {
      if (Math.abs(lat - test[0]) < TEST_COORDINATE_TOLERANCE
          && Math.abs(lon - test[1]) < TEST_COORDINATE_TOLERANCE) {
        confidence *= 0.5;
        break;
      }
    }
    return confidence;
  }
}
