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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Selects the text of a dataset that is worth handing to a
 * {@link LanguageDetector}, and applies the fallback rules around it.
 *
 * <p>Headers and cell strings are kept; emails, URLs, dates, numbers,
 * coordinate pairs, UUIDs and other digit-only values are skipped because
 * they carry no language.
 */
public final class LanguageSamples {
  private static final Logger LOGGER = LoggerFactory.getLogger(LanguageSamples.class);

  /** Shorter text is not sent to the detector. */
  public static final int MIN_TEXT_LENGTH = 20;

  private static final List<Pattern> NON_TEXT = ImmutableList.of(
      Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[a-z]{2,}$", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE),
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}:\\d{2})?"),
      Pattern.compile("^-?\\d+(\\.\\d+)?$"),
      Pattern.compile("^-?\\d+\\.\\d+,\\s?-?\\d+\\.\\d+$"),
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("^[\\d\\s./-]+$"));

  private LanguageSamples() {
  }

  /**
   * Joins headers longer than two characters and string cells of at least
   * three characters with spaces, skipping values that are not prose.
   */
  public static String extractText(List<? extends Map<String, ?>> rows, List<String> headers) {
    List<String> parts = new ArrayList<>();
    for (String header : headers) {
      if (header != null && header.length() > 2 && !isNonText(header)) {
        parts.add(header);
      }
    }
    for (Map<String, ?> row : rows) {
      for (Object value : row.values()) {
        if (value instanceof String) {
          String trimmed = ((String) value).trim();
          if (trimmed.length() >= 3 && !isNonText(trimmed)) {
            parts.add((String) value);
          }
        }
      }
    }
    return String.join(" ", parts);
  }

  /**
   * Detects the language of sample rows. Falls back to
   * {@link LanguageDetectionResult#undetermined()} when there is too little
   * text or the detector cannot decide.
   */
  public static LanguageDetectionResult detect(LanguageDetector detector,
      List<? extends Map<String, ?>> rows, List<String> headers) {
    String text = extractText(rows, headers);
    if (text.length() < MIN_TEXT_LENGTH) {
      LOGGER.debug("Only {} characters of text; assuming {}", text.length(),
          FieldPatterns.DEFAULT_LANGUAGE);
      return LanguageDetectionResult.undetermined();
    }
    LanguageDetectionResult result = detector.detect(text);
    if (result == null || LanguageDetectionResult.UNDETERMINED_CODE.equals(result.getCode())) {
      return LanguageDetectionResult.undetermined();
    }
    LOGGER.debug("Detected language {}", result);
    return result;
  }

  static boolean isNonText(String value) {
    for (Pattern pattern : NON_TEXT) {
      if (pattern.matcher(value).find()) {
        return true;
      }
    }
    return false;
  }
}
