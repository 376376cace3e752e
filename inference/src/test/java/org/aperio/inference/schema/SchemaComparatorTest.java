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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SchemaComparator.
 */
@Tag("unit")
public class SchemaComparatorTest {

  private static FieldDefinition enumOf(Object... values) {
    return new FieldDefinition(Collections.singletonList("string"), false,
        Arrays.asList(values), null, null);
  }

  private static StructuralSchema base() {
    return StructuralSchema.builder()
        .field("id", "integer")
        .field("title", "string")
        .field("status", enumOf("open", "closed"))
        .required("id")
        .build();
  }

  @Test void testIdenticalSchemas() {
    SchemaComparison comparison = SchemaComparator.compare(base(), base());
    assertFalse(comparison.hasChanges());
    assertFalse(comparison.isBreaking());
    assertTrue(comparison.canAutoApprove());
    assertEquals("No schema changes detected", SchemaComparator.summarize(comparison));
  }

  @Test void testRemovedFieldIsBreaking() {
    StructuralSchema newer = StructuralSchema.builder()
        .field("id", "integer")
        .field("status", enumOf("open", "closed"))
        .required("id")
        .build();
    SchemaComparison comparison = SchemaComparator.compare(base(), newer);
    List<SchemaChange> removed = comparison.getChanges(ChangeType.REMOVED_FIELD);
    assertEquals(1, removed.size());
    assertEquals("title", removed.get(0).getPath());
    assertEquals(Severity.ERROR, removed.get(0).getSeverity());
    assertTrue(comparison.isBreaking());
    assertTrue(comparison.requiresApproval());
    assertFalse(comparison.canAutoApprove());
  }

  @Test void testOptionalAndRequiredNewFields() {
    StructuralSchema newer = StructuralSchema.builder()
        .field("id", "integer")
        .field("title", "string")
        .field("status", enumOf("open", "closed"))
        .field("notes", "string")
        .required("id")
        .build();
    SchemaComparison optional = SchemaComparator.compare(base(), newer);
    assertEquals(1, optional.getChanges().size());
    assertEquals(Severity.INFO, optional.getChanges().get(0).getSeverity());
    assertTrue(optional.canAutoApprove());
    assertFalse(optional.isBreaking());

    StructuralSchema required = StructuralSchema.builder()
        .field("id", "integer")
        .field("title", "string")
        .field("status", enumOf("open", "closed"))
        .field("owner", "string")
        .required("id", "owner")
        .build();
    SchemaChange change = SchemaComparator.compare(base(), required).getChanges().get(0);
    assertEquals(ChangeType.NEW_FIELD, change.getType());
    assertEquals(Severity.ERROR, change.getSeverity());
    assertFalse(change.isAutoApprovable());
  }

  @Test void testTypeChange() {
    StructuralSchema newer = StructuralSchema.builder()
        .field("id", "string")
        .field("title", "string")
        .field("status", enumOf("open", "closed"))
        .required("id")
        .build();
    List<SchemaChange> changes =
        SchemaComparator.compare(base(), newer).getChanges(ChangeType.TYPE_CHANGE);
    assertEquals(1, changes.size());
    assertEquals("integer", changes.get(0).getDetails().get("oldType"));
    assertEquals("string", changes.get(0).getDetails().get("newType"));
    assertTrue(changes.get(0).isBreaking());
  }

  @Test void testNullabilityIsNotATypeChange() {
    StructuralSchema newer = StructuralSchema.builder()
        .field("id", "integer")
        .field("title", Arrays.asList("string", "null"))
        .field("status", enumOf("open", "closed"))
        .required("id")
        .build();
    assertTrue(SchemaComparator.compare(base(), newer)
        .getChanges(ChangeType.TYPE_CHANGE).isEmpty());
  }

  @Test void testEnumChanges() {
    StructuralSchema added = StructuralSchema.builder()
        .field("id", "integer")
        .field("title", "string")
        .field("status", enumOf("open", "closed", "archived"))
        .required("id")
        .build();
    SchemaChange addition = SchemaComparator.compare(base(), added).getChanges().get(0);
    assertEquals(ChangeType.ENUM_CHANGE, addition.getType());
    assertEquals(Severity.INFO, addition.getSeverity());
    assertFalse(addition.isBreaking());

    StructuralSchema removed = StructuralSchema.builder()
        .field("id", "integer")
        .field("title", "string")
        .field("status", enumOf("open"))
        .required("id")
        .build();
    SchemaChange removal = SchemaComparator.compare(base(), removed).getChanges().get(0);
    assertEquals(Severity.WARNING, removal.getSeverity());
    assertTrue(removal.isBreaking());
  }

  @Test void testRequirednessChanges() {
    StructuralSchema newer = StructuralSchema.builder()
        .field("id", "integer")
        .field("title", "string")
        .field("status", enumOf("open", "closed"))
        .required("title")
        .build();
    List<SchemaChange> changes =
        SchemaComparator.compare(base(), newer).getChanges(ChangeType.FORMAT_CHANGE);
    assertEquals(2, changes.size());
    assertEquals("title", changes.get(0).getPath());
    assertEquals(Severity.ERROR, changes.get(0).getSeverity());
    assertEquals("id", changes.get(1).getPath());
    assertEquals(Severity.INFO, changes.get(1).getSeverity());
  }

  @Test void testSummary() {
    StructuralSchema newer = StructuralSchema.builder()
        .field("id", "integer")
        .field("status", enumOf("open", "closed"))
        .field("notes", "string")
        .required("id")
        .build();
    String summary = SchemaComparator.summarize(SchemaComparator.compare(base(), newer));
    assertTrue(summary.startsWith("Schema Changes Summary:"));
    assertTrue(summary.contains("- Total changes: 2"));
    assertTrue(summary.contains("- Breaking changes: Yes"));
    assertTrue(summary.contains("Breaking Changes:\n  - Field 'title' was removed"));
    assertTrue(summary.contains("Non-Breaking Changes:\n  - Field 'notes' was added"));
  }

  @Test void testRejectsNullSchema() {
    assertThrows(IllegalArgumentException.class, () -> SchemaComparator.compare(null, base()));
  }
}
