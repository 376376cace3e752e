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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FieldNameMatcher and TypeCompatibility.
 */
@Tag("unit")
public class FieldNameMatcherTest {

  @Test void testSimilarityIgnoresSeparatorsAndCase() {
    assertEquals(1.0, FieldNameMatcher.similarity("start_date", "Start-Date"), 1e-9);
    assertEquals(1 - 1.0 / 6, FieldNameMatcher.similarity("color", "colour"), 1e-9);
    assertEquals(0.0, FieldNameMatcher.similarity("", "abc"), 1e-9);
  }

  @Test void testSynonyms() {
    assertTrue(FieldNameMatcher.areSynonyms("LAT", "latitude"));
    assertTrue(FieldNameMatcher.areSynonyms("latitude", "lat"));
    assertTrue(FieldNameMatcher.areSynonyms("venue", "city"));
    assertFalse(FieldNameMatcher.areSynonyms("title", "date"));
  }

  @Test void testFindBestMatch() {
    FieldNameMatcher.Match exact =
        FieldNameMatcher.findBestMatch("Title", Arrays.asList("name", "title"));
    assertNotNull(exact);
    assertEquals("title", exact.getField());
    assertEquals(1.0, exact.getScore(), 1e-9);

    FieldNameMatcher.Match synonym =
        FieldNameMatcher.findBestMatch("lng", Arrays.asList("x", "longitude"));
    assertNotNull(synonym);
    assertEquals("x", synonym.getField());
    assertEquals(0.9, synonym.getScore(), 1e-9);

    FieldNameMatcher.Match fuzzy =
        FieldNameMatcher.findBestMatch("colour", Collections.singletonList("color"));
    assertNotNull(fuzzy);
    assertEquals("color", fuzzy.getField());

    assertNull(FieldNameMatcher.findBestMatch("sku", Arrays.asList("title", "date")));
  }

  @Test void testTypeNormalization() {
    assertEquals("string", TypeCompatibility.normalize("String | null"));
    assertEquals("boolean_string", TypeCompatibility.normalize("boolean-string"));
    assertNull(TypeCompatibility.normalize("null"));
    assertNull(TypeCompatibility.normalize(null));
  }

  @Test void testTypeCompatibility() {
    assertTrue(TypeCompatibility.areCompatible("integer", "number"));
    assertTrue(TypeCompatibility.areCompatible("date", "string"));
    assertTrue(TypeCompatibility.areCompatible("numeric_string", "integer"));
    assertTrue(TypeCompatibility.areCompatible("boolean", "string"));
    assertFalse(TypeCompatibility.areCompatible("boolean", "number"));
    assertFalse(TypeCompatibility.areCompatible("object", null));
    assertTrue(TypeCompatibility.anyCompatible(Arrays.asList("object", "integer"),
        Collections.singletonList("number")));
  }

  @Test void testClassifyAndInfer() {
    assertEquals("date", TypeCompatibility.classify("2024-05-01"));
    assertEquals("date", TypeCompatibility.classify("01.05.2024"));
    assertEquals(TypeCompatibility.NUMERIC_STRING, TypeCompatibility.classify("12.5"));
    assertEquals("string", TypeCompatibility.classify("abc"));
    assertEquals("integer", TypeCompatibility.classify(3));
    assertEquals("number", TypeCompatibility.classify(2.5));
    assertEquals("boolean", TypeCompatibility.classify(true));
    assertEquals("null", TypeCompatibility.classify(null));

    assertEquals(TypeCompatibility.NUMERIC_STRING,
        TypeCompatibility.inferType(Arrays.asList("1", "2", "x", null)));
    assertEquals("string", TypeCompatibility.inferType(Arrays.asList(null, null)));
  }

  @Test void testNumericStringsAreStrict() {
    assertEquals(TypeCompatibility.NUMERIC_STRING, TypeCompatibility.classify("1e3"));
    assertEquals(TypeCompatibility.NUMERIC_STRING, TypeCompatibility.classify(" -.5 "));
    assertEquals("string", TypeCompatibility.classify("NaN"));
    assertEquals("string", TypeCompatibility.classify("Infinity"));
    assertEquals("string", TypeCompatibility.classify("1d"));
    assertEquals("string", TypeCompatibility.classify("1f"));
    assertEquals("string",
        TypeCompatibility.inferType(Arrays.asList("NaN", "Infinity", "12")));
  }
}
