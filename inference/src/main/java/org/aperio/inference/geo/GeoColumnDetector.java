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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the columns of a table that hold geographic coordinates.
 *
 * <p>Detection runs in three stages and stops at the first success:
 * <ol>
 *   <li>Pattern: a header matches a latitude name and another a longitude
 *   name, and sample rows validate as coordinate pairs.</li>
 *   <li>Combined: a header matches a combined-coordinate name and its values
 *   have a recognized combined format.</li>
 *   <li>Heuristic: two numeric columns whose values look like latitudes and
 *   longitudes and validate as pairs.</li>
 * </ol>
 *
 * <p>Pair validation notices columns whose latitudes and longitudes are
 * exchanged; such a result has {@code swappedCoordinates} set.
 */
public class GeoColumnDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(GeoColumnDetector.class);

  private final DetectionConfig config;
  private final FormatDetector formatDetector;

  public GeoColumnDetector() {
    this(DetectionConfig.defaults());
  }

  public GeoColumnDetector(DetectionConfig config) {
    this.config = config;
    this.formatDetector = new FormatDetector(config);
  }

  /**
   * Detects coordinate columns.
   *
   * @param headers Column names in table order
   * @param rows Sample rows keyed by column name
   * @return Detected columns, or {@link GeoColumnResult#notFound()}
   */
  public GeoColumnResult detectGeoColumns(List<String> headers,
      List<? extends Map<String, ?>> rows) {
    if (headers == null || rows == null) {
      throw new IllegalArgumentException("headers and rows are required");
    }

    GeoColumnResult result = detectByPattern(headers, rows);
    if (!result.isFound()) {
      result = detectCombined(headers, rows);
    }
    if (!result.isFound()) {
      result = detectByHeuristic(headers, rows);
    }

    if (result.isFound()) {
      LOGGER.info("Detected geo columns: {}", result);
    } else {
      LOGGER.debug("No geo columns among {} headers", headers.size());
    }
    return result;
  }

  /**
   * Validates a caller-chosen pair of columns.
   *
   * @return A manual result when the pair validates, swapped or not;
   *     otherwise {@link GeoColumnResult#notFound()}
   */
  public GeoColumnResult validateManualSelection(List<? extends Map<String, ?>> rows,
      String latColumn, String lonColumn) {
    if (latColumn == null || lonColumn == null) {
      throw new IllegalArgumentException("Both latitude and longitude columns are required");
    }
    PairValidation validation = validatePair(rows, latColumn, lonColumn);
    if (!validation.valid) {
      LOGGER.info("Manual selection {}/{} did not validate (confidence {})",
          latColumn, lonColumn, validation.confidence);
      return GeoColumnResult.notFound();
    }
    return GeoColumnResult.separate(latColumn, lonColumn, validation.confidence,
        DetectionMethod.MANUAL, validation.swapped);
  }

  private GeoColumnResult detectByPattern(List<String> headers,
      List<? extends Map<String, ?>> rows) {
    String latColumn = GeoPatterns.firstMatch(headers, GeoPatterns.LATITUDE);
    String lonColumn = GeoPatterns.firstMatch(headers, GeoPatterns.LONGITUDE);
    if (latColumn == null || lonColumn == null) {
      return GeoColumnResult.notFound();
    }
    PairValidation validation = validatePair(rows, latColumn, lonColumn);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Pattern candidates {}/{}: valid={}, swapped={}, confidence={}",
          latColumn, lonColumn, validation.valid, validation.swapped, validation.confidence);
    }
    if (!validation.valid) {
      return GeoColumnResult.notFound();
    }
    return GeoColumnResult.separate(latColumn, lonColumn, validation.confidence,
        DetectionMethod.PATTERN, validation.swapped);
  }

  private GeoColumnResult detectCombined(List<String> headers,
      List<? extends Map<String, ?>> rows) {
    String column = GeoPatterns.firstMatch(headers, GeoPatterns.COMBINED);
    if (column == null) {
      return GeoColumnResult.notFound();
    }
    List<Object> samples = new ArrayList<>();
    for (Map<String, ?> row : rows) {
      if (samples.size() >= config.getGeoSampleRows()) {
        break;
      }
      Object value = row.get(column);
      if (!CellValue.of(value).isBlank()) {
        samples.add(value);
      }
    }
    FormatDetectionResult format = formatDetector.detect(samples);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Combined candidate {} over {} samples: {}", column, samples.size(), format);
    }
    if (!format.isAccepted()) {
      return GeoColumnResult.notFound();
    }
    return GeoColumnResult.combined(column, format.getFormat(), format.getConfidence());
  }

  private GeoColumnResult detectByHeuristic(List<String> headers,
      List<? extends Map<String, ?>> rows) {
    List<? extends Map<String, ?>> sample =
        rows.subList(0, Math.min(rows.size(), config.getHeuristicSampleRows()));
    if (sample.isEmpty()) {
      return GeoColumnResult.notFound();
    }
    double minValues = Math.min(5, sample.size() * 0.5);

    Map<String, ColumnShape> shapes = new LinkedHashMap<>();
    for (String header : headers) {
      ColumnShape shape = new ColumnShape();
      for (Map<String, ?> row : sample) {
        shape.add(CoordinateParser.parseCoordinate(row.get(header)));
      }
      if (shape.total > 0 && shape.total >= minValues) {
        shapes.put(header, shape);
      }
    }

    String latColumn = null;
    double bestLat = 0;
    for (Map.Entry<String, ColumnShape> entry : shapes.entrySet()) {
      ColumnShape shape = entry.getValue();
      if (shape.latitudeShaped == shape.total && shape.ratio() > bestLat
          && shape.distinct.size() > 1) {
        latColumn = entry.getKey();
        bestLat = shape.ratio();
      }
    }

    String lonColumn = null;
    double bestLon = 0;
    for (Map.Entry<String, ColumnShape> entry : shapes.entrySet()) {
      ColumnShape shape = entry.getValue();
      if (!entry.getKey().equals(latColumn) && shape.ratio() > bestLon
          && shape.distinct.size() > 1) {
        lonColumn = entry.getKey();
        bestLon = shape.ratio();
      }
    }

    if (latColumn == null || lonColumn == null
        || bestLat < config.getHeuristicMinRatio() || bestLon < config.getHeuristicMinRatio()) {
      return GeoColumnResult.notFound();
    }

    PairValidation validation = validatePair(rows, latColumn, lonColumn);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Heuristic candidates {}/{}: valid={}, swapped={}, confidence={}",
          latColumn, lonColumn, validation.valid, validation.swapped, validation.confidence);
    }
    if (!validation.valid && !validation.swapped) {
      return GeoColumnResult.notFound();
    }
    return GeoColumnResult.separate(latColumn, lonColumn, validation.confidence,
        DetectionMethod.HEURISTIC, validation.swapped);
  }

  /**
   * Validates up to the configured number of rows in which both columns
   * hold a coordinate.
   */
  PairValidation validatePair(List<? extends Map<String, ?>> rows, String latColumn,
      String lonColumn) {
    int total = 0;
    int direct = 0;
    int swapped = 0;
    int exchanged = 0;
    for (Map<String, ?> row : rows) {
      if (total >= config.getGeoSampleRows()) {
        break;
      }
      Double lat = CoordinateParser.parseCoordinate(row.get(latColumn));
      Double lon = CoordinateParser.parseCoordinate(row.get(lonColumn));
      if (lat == null || lon == null) {
        continue;
      }
      total++;
      boolean rejectZero = config.isRejectZeroCoordinates();
      if (CoordinateParser.isValidCoordinate(lat, lon, rejectZero)) {
        direct++;
      }
      if (CoordinateParser.looksSwapped(lat, lon)) {
        swapped++;
      }
      if (CoordinateParser.isValidCoordinate(lon, lat, rejectZero)) {
        exchanged++;
      }
    }
    if (total == 0) {
      return new PairValidation(false, false, 0);
    }

    double swappedRatio = (double) swapped / total;
    if (swappedRatio > config.getSwapDominanceRatio()) {
      double confidence = (double) exchanged / total;
      return new PairValidation(confidence >= config.getPairValidityRatio(), true, confidence);
    }
    double confidence = (double) direct / total;
    return new PairValidation(confidence >= config.getPairValidityRatio(), false, confidence);
  }

  /** Outcome of validating a candidate column pair. */
  static class PairValidation {
    final boolean valid;
    final boolean swapped;
    final double confidence;

    PairValidation(boolean valid, boolean swapped, double confidence) {
      this.valid = valid;
      this.swapped = swapped;
      this.confidence = confidence;
    }
  }

  /** Value shape of one column in the heuristic sample. */
  private static class ColumnShape {
    int total;
    int coordinateShaped;
    int latitudeShaped;
    final Set<Double> distinct = new HashSet<>();

    void add(Double value) {
      if (value == null) {
        return;
      }
      total++;
      distinct.add(value);
      double abs = Math.abs(value);
      if (abs <= CoordinateParser.MAX_LATITUDE) {
        coordinateShaped++;
        latitudeShaped++;
      } else if (abs <= CoordinateParser.MAX_LONGITUDE) {
        coordinateShaped++;
      }
    }

    double ratio() {
      return total == 0 ? 0 : (double) coordinateShaped / total;
    }
  }
}
