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

import java.util.Map;
import java.util.Objects;

/**
 * Language of a dataset as reported by a {@link LanguageDetector}.
 */
public class LanguageDetectionResult {

  /** Confidence from which a detection is reliable. */
  public static final double RELIABILITY_THRESHOLD = 0.5;

  /** Code a detector reports when it cannot decide. */
  public static final String UNDETERMINED_CODE = "und";

  private static final Map<String, String> LANGUAGE_NAMES =
      ImmutableMap.<String, String>builder()
          .put("eng", "English")
          .put("deu", "German")
          .put("fra", "French")
          .put("spa", "Spanish")
          .put("ita", "Italian")
          .put("nld", "Dutch")
          .put("por", "Portuguese")
          .put(UNDETERMINED_CODE, "Unknown")
          .build();

  private static final LanguageDetectionResult UNDETERMINED =
      new LanguageDetectionResult(FieldPatterns.DEFAULT_LANGUAGE, 0);

  private final String code;
  private final String name;
  private final double confidence;
  private final boolean reliable;

  public LanguageDetectionResult(String code, double confidence) {
    if (code == null || code.isEmpty()) {
      throw new IllegalArgumentException("Language code is required");
    }
    if (confidence < 0 || confidence > 1) {
      throw new IllegalArgumentException("Confidence must be between 0 and 1: " + confidence);
    }
    this.code = code;
    this.name = LANGUAGE_NAMES.getOrDefault(code, code);
    this.confidence = confidence;
    this.reliable = confidence >= RELIABILITY_THRESHOLD;
  }

  /**
   * Returns the fallback result: English with no confidence.
   */
  public static LanguageDetectionResult undetermined() {
    return UNDETERMINED;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public double getConfidence() {
    return confidence;
  }

  public boolean isReliable() {
    return reliable;
  }

  /**
   * Whether field patterns exist for the detected language.
   */
  public boolean isSupported() {
    return FieldPatterns.isSupported(code);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LanguageDetectionResult)) {
      return false;
    }
    LanguageDetectionResult that = (LanguageDetectionResult) o;
    return code.equals(that.code) && Double.compare(confidence, that.confidence) == 0;
  }

  @Override public int hashCode() {
    return Objects.hash(code, confidence);
  }

  @Override public String toString() {
    return name + " (" + code + ", " + confidence + ")";
  }
}
