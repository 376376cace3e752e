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

import org.aperio.inference.DetectionConfig;
import org.aperio.inference.schema.SchemaComparator;
import org.aperio.inference.schema.StructuralSchema;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TransformDetector.
 */
@Tag("unit")
public class TransformDetectorTest {

  private final TransformDetector detector = new TransformDetector();

  private List<TransformSuggestion> detect(TransformDetector transformDetector,
      StructuralSchema oldSchema, StructuralSchema newSchema) {
    return transformDetector.detectTransforms(oldSchema, newSchema,
        SchemaComparator.compare(oldSchema, newSchema));
  }

  @Test void testPrefixedRename() {
    StructuralSchema stored = StructuralSchema.builder().field("date", "string").build();
    StructuralSchema incoming = StructuralSchema.builder().field("start_date", "string").build();

    List<TransformSuggestion> suggestions = detect(detector, stored, incoming);
    assertEquals(1, suggestions.size());
    TransformSuggestion suggestion = suggestions.get(0);
    assertEquals(TransformType.RENAME, suggestion.getType());
    assertEquals("start_date", suggestion.getFrom());
    assertEquals("date", suggestion.getTo());
    assertEquals(90, suggestion.getConfidence());
    assertEquals("'start_' prefix, compatible type string, same position",
        suggestion.getReason());
  }

  @Test void testCaseOnlyRename() {
    StructuralSchema stored = StructuralSchema.builder().field("title", "string").build();
    StructuralSchema incoming = StructuralSchema.builder().field("Title", "string").build();

    List<TransformSuggestion> suggestions = detect(detector, stored, incoming);
    assertEquals(1, suggestions.size());
    assertEquals(100, suggestions.get(0).getConfidence());
  }

  @Test void testUnrelatedNamesAreNotPaired() {
    StructuralSchema stored = StructuralSchema.builder().field("date", "string").build();
    StructuralSchema incoming = StructuralSchema.builder().field("location", "string").build();
    assertTrue(detect(detector, stored, incoming).isEmpty());
  }

  @Test void testIncompatibleTypeDropsScore() {
    StructuralSchema stored = StructuralSchema.builder().field("count", "integer").build();
    StructuralSchema incoming =
        StructuralSchema.builder().field("count_items", "object").build();
    assertTrue(detect(detector, stored, incoming).isEmpty());

    List<String> reasons = new ArrayList<>();
    assertEquals(35, TransformDetector.nameScore("count", "count_items", reasons), 1e-9);
    assertEquals("'count' is part of 'count_items'", reasons.get(0));
  }

  @Test void testEachFieldRenamedOnce() {
    StructuralSchema stored = StructuralSchema.builder().field("venue_name", "string").build();
    StructuralSchema incoming = StructuralSchema.builder()
        .field("venue", "string")
        .field("venue_name_full", "string")
        .build();

    List<TransformSuggestion> suggestions = detect(detector, stored, incoming);
    assertEquals(1, suggestions.size());
    assertEquals("venue", suggestions.get(0).getFrom());
    assertEquals("venue_name", suggestions.get(0).getTo());
    assertEquals(90, suggestions.get(0).getConfidence());
  }

  @Test void testAcceptanceScoreIsConfigurable() {
    StructuralSchema stored = StructuralSchema.builder().field("date", "string").build();
    StructuralSchema incoming = StructuralSchema.builder().field("start_date", "string").build();
    TransformDetector strict = new TransformDetector(
        DetectionConfig.builder().renameAcceptanceScore(95).build());
    assertTrue(detect(strict, stored, incoming).isEmpty());
  }

  @Test void testNoRemovedFields() {
    StructuralSchema stored = StructuralSchema.builder().field("title", "string").build();
    StructuralSchema incoming = StructuralSchema.builder()
        .field("title", "string")
        .field("venue", "string")
        .build();
    assertTrue(detect(detector, stored, incoming).isEmpty());
  }

  @Test void testConfigIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> new TransformDetector(null));
  }
}
