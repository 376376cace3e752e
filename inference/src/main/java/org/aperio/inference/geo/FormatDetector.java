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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Classifies a column that holds both coordinates in each value.
 *
 * <p>Each checker reports the share of non-empty samples that have its
 * layout and a valid coordinate pair. A format is accepted when that share
 * reaches the configured acceptance ratio (0.7 by default). Auto-detection
 * tries comma, space, GeoJSON and bracketed layouts in that order and returns
 * the first accepted one.
 */
public class FormatDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(FormatDetector.class);

  private final DetectionConfig config;

  public FormatDetector() {
    this(DetectionConfig.defaults());
  }

  public FormatDetector(DetectionConfig config) {
    this.config = config;
  }

  /**
   * Detects the combined format of a column from value samples.
   *
   * @param samples Raw values; blanks are ignored
   * @return The first accepted format, or {@link CoordinateFormat#UNKNOWN}
   *     with zero confidence
   */
  public FormatDetectionResult detect(List<?> samples) {
    return detect(samples, CoordinateFormat.UNKNOWN);
  }

  /**
   * Detects the combined format of a column, restricted to one format family.
   *
   * @param samples Raw values; blanks are ignored
   * @param target Format to check; {@link CoordinateFormat#UNKNOWN} tries all
   */
  public FormatDetectionResult detect(List<?> samples, CoordinateFormat target) {
    if (target != CoordinateFormat.UNKNOWN) {
      FormatDetectionResult result = check(samples, target);
      return result.isAccepted() ? result : FormatDetectionResult.none();
    }
    CoordinateFormat[] order = {
        CoordinateFormat.COMBINED_COMMA,
        CoordinateFormat.COMBINED_SPACE,
        CoordinateFormat.GEOJSON,
        CoordinateFormat.BRACKETS
    };
    for (CoordinateFormat format : order) {
      FormatDetectionResult result = check(samples, format);
      if (result.isAccepted()) {
        LOGGER.debug("Detected combined coordinate format {} with confidence {}",
            format.getTag(), result.getConfidence());
        return result;
      }
    }
    return FormatDetectionResult.none();
  }

  /** Checks {@code "lat, lon"} values. */
  public FormatDetectionResult checkCommaFormat(List<?> samples) {
    return check(samples, CoordinateFormat.COMBINED_COMMA);
  }

  /** Checks {@code "lat lon"} values. */
  public FormatDetectionResult checkSpaceFormat(List<?> samples) {
    return check(samples, CoordinateFormat.COMBINED_SPACE);
  }

  /** Checks GeoJSON Point values, as JSON text or structured objects. */
  public FormatDetectionResult checkGeoJsonFormat(List<?> samples) {
    return check(samples, CoordinateFormat.GEOJSON);
  }

  /** Checks {@code "[lat, lon]"} values. */
  public FormatDetectionResult checkBracketsFormat(List<?> samples) {
    return check(samples, CoordinateFormat.BRACKETS);
  }

  private FormatDetectionResult check(List<?> samples, CoordinateFormat format) {
    Function<CellValue, double @Nullable []> reader = readerFor(format);
    int nonEmpty = 0;
    int matched = 0;
    for (Object sample : samples) {
      CellValue cell = CellValue.of(sample);
      if (cell.isBlank()) {
        continue;
      }
      nonEmpty++;
      double[] pair = reader.apply(cell);
      if (pair != null
          && CoordinateParser.isValidCoordinate(pair[0], pair[1],
              config.isRejectZeroCoordinates())) {
        matched++;
      }
    }
    if (nonEmpty == 0) {
      return new FormatDetectionResult(format, 0, false);
    }
    double confidence = (double) matched / nonEmpty;
    return new FormatDetectionResult(format, confidence,
        confidence >= config.getFormatAcceptanceRatio());
  }

  private static Function<CellValue, double @Nullable []> readerFor(CoordinateFormat format) {
    switch (format) {
    case COMBINED_COMMA:
      return CombinedCoordinates::readComma;
    case COMBINED_SPACE:
      return CombinedCoordinates::readSpace;
    case GEOJSON:
      return CombinedCoordinates::readGeoJson;
    case BRACKETS:
      return CombinedCoordinates::readBrackets;
    default:
      throw new IllegalArgumentException("No reader for format " + format.getTag());
    }
  }
}
