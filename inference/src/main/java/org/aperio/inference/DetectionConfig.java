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
package org.aperio.inference;

import java.util.Locale;
import java.util.Map;

/**
 * Tunable limits and thresholds for schema inference and column detection.
 *
 * <p>All values have defaults, so {@code DetectionConfig.defaults()} is a
 * complete configuration. A configuration can also be read from a YAML/JSON
 * map:
 *
 * <pre>{@code
 * inference:
 *   maxSamples: 200
 *   enumThreshold: 20
 *   enumMode: percentage
 *   rejectZeroCoordinates: false
 * }</pre>
 */
public class DetectionConfig {

  /**
   * How the enum threshold is interpreted.
   */
  public enum EnumMode {
    /** Candidate when the number of distinct values is at most the threshold. */
    COUNT,
    /** Candidate when distinct values per occurrence is at most threshold percent. */
    PERCENTAGE;

    public static EnumMode fromString(String value) {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
  }

  private static final DetectionConfig DEFAULTS = builder().build();

  private final int maxSamples;
  private final int maxUniqueValues;
  private final int enumThreshold;
  private final EnumMode enumMode;
  private final int maxDepth;
  private final double requiredFieldRatio;
  private final int geoSampleRows;
  private final int heuristicSampleRows;
  private final double formatAcceptanceRatio;
  private final double heuristicMinRatio;
  private final double pairValidityRatio;
  private final double swapDominanceRatio;
  private final double batchSwapRatio;
  private final boolean rejectZeroCoordinates;
  private final int renameAcceptanceScore;

  private DetectionConfig(Builder builder) {
    this.maxSamples = builder.maxSamples;
    this.maxUniqueValues = builder.maxUniqueValues;
    this.enumThreshold = builder.enumThreshold;
    this.enumMode = builder.enumMode;
    this.maxDepth = builder.maxDepth;
    this.requiredFieldRatio = builder.requiredFieldRatio;
    this.geoSampleRows = builder.geoSampleRows;
    this.heuristicSampleRows = builder.heuristicSampleRows;
    this.formatAcceptanceRatio = builder.formatAcceptanceRatio;
    this.heuristicMinRatio = builder.heuristicMinRatio;
    this.pairValidityRatio = builder.pairValidityRatio;
    this.swapDominanceRatio = builder.swapDominanceRatio;
    this.batchSwapRatio = builder.batchSwapRatio;
    this.rejectZeroCoordinates = builder.rejectZeroCoordinates;
    this.renameAcceptanceScore = builder.renameAcceptanceScore;
  }

  /**
   * Returns the configuration with every value at its default.
   */
  public static DetectionConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the number of raw rows the schema builder keeps as samples.
   */
  public int getMaxSamples() {
    return maxSamples;
  }

  /**
   * Returns the cap on distinct sample values tracked per field.
   */
  public int getMaxUniqueValues() {
    return maxUniqueValues;
  }

  public int getEnumThreshold() {
    return enumThreshold;
  }

  public EnumMode getEnumMode() {
    return enumMode;
  }

  /**
   * Returns how many levels of nested objects are walked.
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  /**
   * Returns the share of records a field must appear in to be required.
   */
  public double getRequiredFieldRatio() {
    return requiredFieldRatio;
  }

  /**
   * Returns how many rows pairwise coordinate validation and combined format
   * detection look at.
   */
  public int getGeoSampleRows() {
    return geoSampleRows;
  }

  /**
   * Returns how many rows the value-shape heuristic looks at.
   */
  public int getHeuristicSampleRows() {
    return heuristicSampleRows;
  }

  public double getFormatAcceptanceRatio() {
    return formatAcceptanceRatio;
  }

  public double getHeuristicMinRatio() {
    return heuristicMinRatio;
  }

  public double getPairValidityRatio() {
    return pairValidityRatio;
  }

  public double getSwapDominanceRatio() {
    return swapDominanceRatio;
  }

  /**
   * Returns the share of swapped-looking pairs above which a whole sample
   * is reported as swapped.
   */
  public double getBatchSwapRatio() {
    return batchSwapRatio;
  }

  /**
   * Returns whether the exact pair (0, 0) counts as an invalid coordinate.
   */
  public boolean isRejectZeroCoordinates() {
    return rejectZeroCoordinates;
  }

  public int getRenameAcceptanceScore() {
    return renameAcceptanceScore;
  }

  /**
   * Creates a new builder for DetectionConfig.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a DetectionConfig from a YAML/JSON map. Missing keys keep their
   * defaults; numbers may be given as numbers or strings.
   *
   * @param map Configuration map
   * @return DetectionConfig instance
   */
  public static DetectionConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return DEFAULTS;
    }

    Builder builder = builder();
    Object value;
    if ((value = map.get("maxSamples")) != null) {
      builder.maxSamples(toInt("maxSamples", value));
    }
    if ((value = map.get("maxUniqueValues")) != null) {
      builder.maxUniqueValues(toInt("maxUniqueValues", value));
    }
    if ((value = map.get("enumThreshold")) != null) {
      builder.enumThreshold(toInt("enumThreshold", value));
    }
    if ((value = map.get("enumMode")) != null) {
      builder.enumMode(EnumMode.fromString(value.toString()));
    }
    if ((value = map.get("maxDepth")) != null) {
      builder.maxDepth(toInt("maxDepth", value));
    }
    if ((value = map.get("requiredFieldRatio")) != null) {
      builder.requiredFieldRatio(toDouble("requiredFieldRatio", value));
    }
    if ((value = map.get("geoSampleRows")) != null) {
      builder.geoSampleRows(toInt("geoSampleRows", value));
    }
    if ((value = map.get("heuristicSampleRows")) != null) {
      builder.heuristicSampleRows(toInt("heuristicSampleRows", value));
    }
    if ((value = map.get("formatAcceptanceRatio")) != null) {
      builder.formatAcceptanceRatio(toDouble("formatAcceptanceRatio", value));
    }
    if ((value = map.get("heuristicMinRatio")) != null) {
      builder.heuristicMinRatio(toDouble("heuristicMinRatio", value));
    }
    if ((value = map.get("pairValidityRatio")) != null) {
      builder.pairValidityRatio(toDouble("pairValidityRatio", value));
    }
    if ((value = map.get("swapDominanceRatio")) != null) {
      builder.swapDominanceRatio(toDouble("swapDominanceRatio", value));
    }
    if ((value = map.get("batchSwapRatio")) != null) {
      builder.batchSwapRatio(toDouble("batchSwapRatio", value));
    }
    if ((value = map.get("rejectZeroCoordinates")) != null) {
      builder.rejectZeroCoordinates(
          value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(value.toString()));
    }
    if ((value = map.get("renameAcceptanceScore")) != null) {
      builder.renameAcceptanceScore(toInt("renameAcceptanceScore", value));
    }
    return builder.build();
  }

  private static int toInt(String key, Object value) {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
    }
  }

  private static double toDouble(String key, Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
    }
  }

  @Override public String toString() {
    return "DetectionConfig{maxSamples=" + maxSamples
        + ", maxUniqueValues=" + maxUniqueValues
        + ", enumThreshold=" + enumThreshold
        + ", enumMode=" + enumMode
        + ", maxDepth=" + maxDepth
        + ", rejectZeroCoordinates=" + rejectZeroCoordinates + "}";
  }

  /**
   * Builder for DetectionConfig.
   */
  public static class Builder {
    private int maxSamples = 100;
    private int maxUniqueValues = 100;
    private int enumThreshold = 50;
    private EnumMode enumMode = EnumMode.COUNT;
    private int maxDepth = 3;
    private double requiredFieldRatio = 0.9;
    private int geoSampleRows = 10;
    private int heuristicSampleRows = 20;
    private double formatAcceptanceRatio = 0.7;
    private double heuristicMinRatio = 0.7;
    private double pairValidityRatio = 0.5;
    private double swapDominanceRatio = 0.5;
    private double batchSwapRatio = 0.7;
    private boolean rejectZeroCoordinates = true;
    private int renameAcceptanceScore = 60;

    public Builder maxSamples(int maxSamples) {
      this.maxSamples = maxSamples;
      return this;
    }

    public Builder maxUniqueValues(int maxUniqueValues) {
      this.maxUniqueValues = maxUniqueValues;
      return this;
    }

    public Builder enumThreshold(int enumThreshold) {
      this.enumThreshold = enumThreshold;
      return this;
    }

    public Builder enumMode(EnumMode enumMode) {
      this.enumMode = enumMode;
      return this;
    }

    public Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public Builder requiredFieldRatio(double requiredFieldRatio) {
      this.requiredFieldRatio = requiredFieldRatio;
      return this;
    }

    public Builder geoSampleRows(int geoSampleRows) {
      this.geoSampleRows = geoSampleRows;
      return this;
    }

    public Builder heuristicSampleRows(int heuristicSampleRows) {
      this.heuristicSampleRows = heuristicSampleRows;
      return this;
    }

    public Builder formatAcceptanceRatio(double formatAcceptanceRatio) {
      this.formatAcceptanceRatio = formatAcceptanceRatio;
      return this;
    }

    public Builder heuristicMinRatio(double heuristicMinRatio) {
      this.heuristicMinRatio = heuristicMinRatio;
      return this;
    }

    public Builder pairValidityRatio(double pairValidityRatio) {
      this.pairValidityRatio = pairValidityRatio;
      return this;
    }

    public Builder swapDominanceRatio(double swapDominanceRatio) {
      this.swapDominanceRatio = swapDominanceRatio;
      return this;
    }

    public Builder batchSwapRatio(double batchSwapRatio) {
      this.batchSwapRatio = batchSwapRatio;
      return this;
    }

    public Builder rejectZeroCoordinates(boolean rejectZeroCoordinates) {
      this.rejectZeroCoordinates = rejectZeroCoordinates;
      return this;
    }

    public Builder renameAcceptanceScore(int renameAcceptanceScore) {
      this.renameAcceptanceScore = renameAcceptanceScore;
      return this;
    }

    public DetectionConfig build() {
      requirePositive("maxSamples", maxSamples);
      requirePositive("maxUniqueValues", maxUniqueValues);
      requirePositive("geoSampleRows", geoSampleRows);
      requirePositive("heuristicSampleRows", heuristicSampleRows);
      if (enumThreshold < 0) {
        throw new IllegalArgumentException("enumThreshold must not be negative");
      }
      if (maxDepth < 1) {
        throw new IllegalArgumentException("maxDepth must be at least 1");
      }
      if (enumMode == null) {
        throw new IllegalArgumentException("enumMode is required");
      }
      if (enumMode == EnumMode.PERCENTAGE && enumThreshold > 100) {
        throw new IllegalArgumentException(
            "enumThreshold is a percentage in percentage mode: " + enumThreshold);
      }
      requireRatio("requiredFieldRatio", requiredFieldRatio);
      requireRatio("formatAcceptanceRatio", formatAcceptanceRatio);
      requireRatio("heuristicMinRatio", heuristicMinRatio);
      requireRatio("pairValidityRatio", pairValidityRatio);
      requireRatio("swapDominanceRatio", swapDominanceRatio);
      requireRatio("batchSwapRatio", batchSwapRatio);
      if (renameAcceptanceScore < 0 || renameAcceptanceScore > 100) {
        throw new IllegalArgumentException(
            "renameAcceptanceScore must be between 0 and 100: " + renameAcceptanceScore);
      }
      return new DetectionConfig(this);
    }

    private static void requirePositive(String name, int value) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive: " + value);
      }
    }

    private static void requireRatio(String name, double value) {
      if (Double.isNaN(value) || value < 0 || value > 1) {
        throw new IllegalArgumentException(name + " must be between 0 and 1: " + value);
      }
    }
  }
}
