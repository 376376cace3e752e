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
package org.aperio.inference.similarity;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Filters for ranking target datasets.
 */
public class SimilarityOptions {
  public static final int DEFAULT_MIN_SCORE = 30;
  public static final int DEFAULT_MAX_RESULTS = 5;

  private static final SimilarityOptions DEFAULTS = builder().build();

  private final int minScore;
  private final int maxResults;
  private final @Nullable String detectedLanguage;

  private SimilarityOptions(Builder builder) {
    this.minScore = builder.minScore;
    this.maxResults = builder.maxResults;
    this.detectedLanguage = builder.detectedLanguage;
  }

  public static SimilarityOptions defaults() {
    return DEFAULTS;
  }

  public int getMinScore() {
    return minScore;
  }

  public int getMaxResults() {
    return maxResults;
  }

  /** Language detected in the upload; null when unknown. */
  public @Nullable String getDetectedLanguage() {
    return detectedLanguage;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for SimilarityOptions.
   */
  public static class Builder {
    private int minScore = DEFAULT_MIN_SCORE;
    private int maxResults = DEFAULT_MAX_RESULTS;
    private @Nullable String detectedLanguage;

    public Builder minScore(int minScore) {
      this.minScore = minScore;
      return this;
    }

    public Builder maxResults(int maxResults) {
      this.maxResults = maxResults;
      return this;
    }

    public Builder detectedLanguage(@Nullable String detectedLanguage) {
      this.detectedLanguage = detectedLanguage;
      return this;
    }

    public SimilarityOptions build() {
      if (minScore < 0 || minScore > 100) {
        throw new IllegalArgumentException("minScore must be between 0 and 100: " + minScore);
      }
      if (maxResults < 0) {
        throw new IllegalArgumentException("maxResults must not be negative: " + maxResults);
      }
      return new SimilarityOptions(this);
    }
  }
}
