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
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for LanguageSamples and LanguageDetectionResult.
 */
@Tag("unit")
public class LanguageSamplesTest {

  private static final List<Map<String, Object>> ROWS = ImmutableList.<Map<String, Object>>of(
      ImmutableMap.<String, Object>of("id", "17", "titel", "Sommerfest im Stadtpark",
          "kontakt", "info@example.de", "link", "https://example.de/fest"),
      ImmutableMap.<String, Object>of("id", "18", "titel", "Weihnachtsmarkt",
          "kontakt", "2024-12-01", "link", "ab"));

  @Test void testExtractTextSkipsNonProse() {
    String text = LanguageSamples.extractText(ROWS, ImmutableList.of("id", "titel", "kontakt"));
    assertEquals("titel kontakt Sommerfest im Stadtpark Weihnachtsmarkt", text);
  }

  @Test void testNonTextValues() {
    assertTrue(LanguageSamples.isNonText("40.7128, -74.0060"));
    assertTrue(LanguageSamples.isNonText("123e4567-e89b-12d3-a456-426614174000"));
    assertTrue(LanguageSamples.isNonText("12/05/2024"));
    assertFalse(LanguageSamples.isNonText("Open air concert"));
  }

  @Test void testDetectDelegatesToDetector() {
    LanguageDetectionResult result = LanguageSamples.detect(
        text -> new LanguageDetectionResult("deu", 0.92), ROWS,
        ImmutableList.of("titel", "kontakt"));
    assertEquals("deu", result.getCode());
    assertEquals("German", result.getName());
    assertTrue(result.isReliable());
    assertTrue(result.isSupported());
  }

  @Test void testShortTextIsNotDetected() {
    AtomicInteger calls = new AtomicInteger();
    LanguageDetectionResult result = LanguageSamples.detect(text -> {
      calls.incrementAndGet();
      return new LanguageDetectionResult("fra", 1.0);
    }, ImmutableList.<Map<String, Object>>of(ImmutableMap.<String, Object>of("a", "Hi")),
        ImmutableList.of("a"));
    assertEquals(0, calls.get());
    assertEquals(LanguageDetectionResult.undetermined(), result);
    assertEquals("eng", result.getCode());
    assertFalse(result.isReliable());
  }

  @Test void testUndeterminedFallsBackToEnglish() {
    LanguageDetectionResult result = LanguageSamples.detect(
        text -> new LanguageDetectionResult(LanguageDetectionResult.UNDETERMINED_CODE, 0.1),
        ROWS, ImmutableList.of("titel"));
    assertEquals("eng", result.getCode());
    assertEquals(0.0, result.getConfidence());
  }

  @Test void testResultValidation() {
    assertThrows(IllegalArgumentException.class, () -> new LanguageDetectionResult("", 0.5));
    assertThrows(IllegalArgumentException.class, () -> new LanguageDetectionResult("eng", 1.5));
    LanguageDetectionResult other = new LanguageDetectionResult("kor", 0.4);
    assertEquals("kor", other.getName());
    assertFalse(other.isSupported());
    assertFalse(other.isReliable());
  }
}
