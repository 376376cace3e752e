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

import org.aperio.inference.DetectionConfig;
import org.aperio.inference.geo.GeoColumnResult;
import org.aperio.inference.geo.GeoColumnType;
import org.aperio.inference.stats.FieldStatistics;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Assigns semantic roles to fields from their names and accumulated
 * statistics.
 *
 * <p>For each text role the detector matches the last segment of every
 * field path against the role's patterns in the dataset language, falling
 * back to English when the language has no patterns or none match. A field
 * matching pattern {@code i} of {@code n} scores
 * {@code 0.6 * (1 - i/n) + 0.4 * content}, where the content score comes
 * from {@link ContentValidators}; a content score of 0 rejects the field.
 * The highest score wins and the earlier field wins a tie.
 *
 * <p>Latitude and longitude come from a geo detection result when one with
 * separate columns is supplied, otherwise from
 * {@link CoordinateFieldScorer}.
 */
public class FieldMappingDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(FieldMappingDetector.class);

  private static final double PATTERN_WEIGHT = 0.6;
  private static final double CONTENT_WEIGHT = 0.4;

  private final DetectionConfig config;

  public FieldMappingDetector() {
    this(DetectionConfig.defaults());
  }

  public FieldMappingDetector(DetectionConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config is required");
    }
    this.config = config;
  }

  public DetectionConfig getConfig() {
    return config;
  }

  /**
   * Detects field mappings from statistics alone.
   *
   * @param fieldStats Statistics keyed by field path, in declaration order
   * @param language ISO 639-3 code of the dataset; null means English
   */
  public FieldMappings detectFieldMappings(Map<String, FieldStatistics> fieldStats,
      @Nullable String language) {
    return detectFieldMappings(fieldStats, language, null);
  }

  /**
   * Detects field mappings, taking latitude and longitude from a geo
   * detection result when it found separate columns.
   */
  public FieldMappings detectFieldMappings(Map<String, FieldStatistics> fieldStats,
      @Nullable String language, @Nullable GeoColumnResult geo) {
    String lang = language == null ? FieldPatterns.DEFAULT_LANGUAGE : language;
    FieldMappings.Builder builder = FieldMappings.builder();

    Match title = detectRole(fieldStats, FieldRole.TITLE, lang);
    if (title != null) {
      builder.titlePath(title.path, title.score);
    }
    Match description = detectRole(fieldStats, FieldRole.DESCRIPTION, lang);
    if (description != null) {
      builder.descriptionPath(description.path, description.score);
    }
    Match locationName = detectRole(fieldStats, FieldRole.LOCATION_NAME, lang);
    if (locationName != null) {
      builder.locationNamePath(locationName.path, locationName.score);
    }
    Match timestamp = detectRole(fieldStats, FieldRole.TIMESTAMP, lang);
    if (timestamp != null) {
      builder.timestampPath(timestamp.path, timestamp.score);
    }
    Match location = detectRole(fieldStats, FieldRole.LOCATION, lang);
    if (location != null) {
      builder.locationPath(location.path, location.score);
    }

    if (geo != null && geo.isFound() && geo.getType() == GeoColumnType.SEPARATE) {
      builder.latitudePath(geo.getEffectiveLatColumn(), geo.getConfidence());
      builder.longitudePath(geo.getEffectiveLonColumn(), geo.getConfidence());
    } else {
      CoordinateFieldScorer.FieldMatch lat = CoordinateFieldScorer.findLatitudeField(fieldStats);
      if (lat != null) {
        builder.latitudePath(lat.getPath(), lat.getScore());
      }
      CoordinateFieldScorer.FieldMatch lon = CoordinateFieldScorer.findLongitudeField(fieldStats);
      if (lon != null) {
        builder.longitudePath(lon.getPath(), lon.getScore());
      }
    }

    FieldMappings mappings = builder.build();
    LOGGER.info("Detected field mappings for language {}: {}", lang, mappings);
    return mappings;
  }

  /**
   * Returns the best field for a role, or null when no field matches.
   */
  public @Nullable String detectField(Map<String, FieldStatistics> fieldStats, FieldRole role,
      @Nullable String language) {
    Match match = detectRole(fieldStats, role,
        language == null ? FieldPatterns.DEFAULT_LANGUAGE : language);
    return match == null ? null : match.path;
  }

  private @Nullable Match detectRole(Map<String, FieldStatistics> fieldStats, FieldRole role,
      String language) {
    List<Pattern> patterns = FieldPatterns.patterns(role, language);
    if (patterns == null) {
      patterns = FieldPatterns.english(role);
    }
    Match best = findBestMatch(fieldStats, role, patterns);
    if (best == null && !FieldPatterns.DEFAULT_LANGUAGE.equals(language)) {
      best = findBestMatch(fieldStats, role, FieldPatterns.english(role));
    }
    if (best != null && LOGGER.isDebugEnabled()) {
      LOGGER.debug("Role {} -> {} (score {})", role, best.path, best.score);
    }
    return best;
  }

  static @Nullable Match findBestMatch(Map<String, FieldStatistics> fieldStats, FieldRole role,
      List<Pattern> patterns) {
    Match best = null;
    for (Map.Entry<String, FieldStatistics> entry : fieldStats.entrySet()) {
      int index = FieldPatterns.indexOf(CoordinateFieldScorer.leafName(entry.getKey()),
          patterns);
      if (index < 0) {
        continue;
      }
      double content = ContentValidators.validate(role, entry.getValue());
      if (content == 0) {
        continue;
      }
      double score = PATTERN_WEIGHT * (1 - (double) index / patterns.size())
          + CONTENT_WEIGHT * content;
      if (best == null || score > best.score) {
        best = new Match(entry.getKey(), score);
      }
    }
    return best;
  }

  /** Field chosen for a role. */
  static class Match {
    final String path;
    final double score;

    Match(String path, double score) {
      this.path = path;
      this.score = score;
    }
  }
}
