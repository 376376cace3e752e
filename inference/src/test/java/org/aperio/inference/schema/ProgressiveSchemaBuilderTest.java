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
package org.aperio.inference.schema;

import org.aperio.inference.DetectionConfig;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ProgressiveSchemaBuilder.
 */
@Tag("unit")
public class ProgressiveSchemaBuilderTest {

  private static Map<String, Object> event(int id, String name, Object score) {
    return ImmutableMap.<String, Object>of("id", id, "name", name,
        "meta", ImmutableMap.of("score", score));
  }

  @Test void testFirstBatchAddsFields() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    BatchResult result = builder.processBatch(
        ImmutableList.of(event(1, "Opening", 5), event(2, "Closing", 6)));

    assertTrue(result.isSchemaChanged());
    assertEquals(2, result.getRecordsProcessed());
    assertEquals(2, result.getVersion());
    assertEquals(4, result.getChanges().size());
    for (SchemaChange change : result.getChanges()) {
      assertEquals(ChangeType.NEW_FIELD, change.getType());
      assertTrue(change.isAutoApprovable());
    }
    assertEquals(Arrays.asList("id", "name", "meta", "meta.score"),
        builder.getSchema().getFieldNames());
    assertEquals(Arrays.asList("id", "name", "meta"), builder.getSampleHeaders());
    assertEquals(Collections.singletonList("id"), builder.getDetectedIdFields());
  }

  @Test void testUnchangedBatchKeepsVersion() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    builder.processBatch(ImmutableList.of(event(1, "Opening", 5)));
    BatchResult result = builder.processBatch(ImmutableList.of(event(2, "Closing", 7)));
    assertFalse(result.isSchemaChanged());
    assertEquals(2, result.getVersion());
    assertEquals(2, builder.getState().getRecordCount());
    assertEquals(2, builder.getState().getBatchCount());
  }

  @Test void testTypeConflict() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    builder.processBatch(ImmutableList.of(event(1, "Opening", 5), event(2, "Closing", 6)));
    BatchResult result = builder.processBatch(ImmutableList.of(event(3, "Late", "high")));

    assertTrue(result.isSchemaChanged());
    assertEquals(3, result.getVersion());
    assertEquals(1, result.getChanges().size());
    SchemaChange change = result.getChanges().get(0);
    assertEquals(ChangeType.TYPE_CHANGE, change.getType());
    assertEquals("meta.score", change.getPath());
    assertEquals(Severity.WARNING, change.getSeverity());
    assertFalse(change.isAutoApprovable());

    TypeConflict conflict = builder.getTypeConflicts().get("meta.score");
    assertNotNull(conflict);
    assertEquals(1, conflict.getSamples().size());
    assertEquals(Long.valueOf(2), conflict.getTypes().get("integer"));
    assertEquals(Long.valueOf(1), conflict.getTypes().get("string"));

    FieldDefinition score = builder.getSchema().getField("meta.score");
    assertNotNull(score);
    assertEquals(Arrays.asList("integer", "string"), score.getTypes());
    assertEquals("integer | string", score.getTypeLabel());
  }

  @Test void testRequiredFields() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    builder.processBatch(ImmutableList.of(
        ImmutableMap.<String, Object>of("title", "a", "note", "x"),
        ImmutableMap.<String, Object>of("title", "b"),
        ImmutableMap.<String, Object>of("title", "c")));
    StructuralSchema schema = builder.getSchema();
    assertTrue(schema.isRequired("title"));
    assertFalse(schema.isRequired("note"));
  }

  @Test void testNullableAndNumericBounds() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    builder.processBatch(Arrays.<Map<String, Object>>asList(
        Collections.<String, Object>singletonMap("size", 3),
        Collections.<String, Object>singletonMap("size", null),
        Collections.<String, Object>singletonMap("size", 9)));
    FieldDefinition size = builder.getSchema().getField("size");
    assertNotNull(size);
    assertTrue(size.isNullable());
    assertEquals(Collections.singletonList("integer"), size.getTypes());
    assertEquals(Double.valueOf(3), size.getMinimum());
    assertEquals(Double.valueOf(9), size.getMaximum());
    assertEquals(Arrays.asList(3L, 9L), size.getEnumValues());
  }

  @Test void testSamplesAreBounded() {
    ProgressiveSchemaBuilder builder =
        new ProgressiveSchemaBuilder(DetectionConfig.builder().maxSamples(2).build());
    builder.processBatch(ImmutableList.of(event(1, "a", 1), event(2, "b", 2), event(3, "c", 3)));
    List<Map<String, Object>> samples = builder.getState().getDataSamples();
    assertEquals(2, samples.size());
    assertEquals(2L, samples.get(0).get("id"));
  }

  @Test void testNestingStopsAtMaxDepth() {
    ProgressiveSchemaBuilder builder =
        new ProgressiveSchemaBuilder(DetectionConfig.builder().maxDepth(1).build());
    builder.processBatch(ImmutableList.of(event(1, "a", 1)));
    assertEquals(Arrays.asList("id", "name", "meta"), builder.getSchema().getFieldNames());
  }

  @Test void testRejectsNullInput() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    assertThrows(IllegalArgumentException.class, () -> builder.processBatch(null));
    assertThrows(IllegalArgumentException.class,
        () -> builder.processBatch(Arrays.<Map<String, Object>>asList(event(1, "a", 1), null)));
  }

  @Test void testCompareWithStoredSchema() {
    ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder();
    builder.processBatch(ImmutableList.of(event(1, "a", 1)));
    StructuralSchema stored = StructuralSchema.builder()
        .field("id", "integer")
        .field("name", "string")
        .field("category", "string")
        .build();
    SchemaComparison comparison = builder.compareWith(stored);
    assertEquals(1, comparison.getChanges(ChangeType.REMOVED_FIELD).size());
    assertEquals(2, comparison.getChanges(ChangeType.NEW_FIELD).size());
    assertTrue(comparison.isBreaking());
  }
}
