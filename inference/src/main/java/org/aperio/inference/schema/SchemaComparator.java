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

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Diffs two versions of a structural schema.
 *
 * <p>Changes are reported in this order: removed fields, new fields, type
 * and enum changes, then fields that became required or optional.
 */
public final class SchemaComparator {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaComparator.class);

  private SchemaComparator() {
  }

  /**
   * Compares a stored schema with a newer one.
   *
   * @param oldSchema Stored schema
   * @param newSchema Incoming schema
   * @return The changes with approval flags
   */
  public static SchemaComparison compare(StructuralSchema oldSchema,
      StructuralSchema newSchema) {
    if (oldSchema == null || newSchema == null) {
      throw new IllegalArgumentException("Both schemas are required");
    }
    List<SchemaChange> changes = new ArrayList<>();
    Map<String, FieldDefinition> oldFields = oldSchema.getFields();
    Map<String, FieldDefinition> newFields = newSchema.getFields();

    for (String field : oldFields.keySet()) {
      if (!newFields.containsKey(field)) {
        changes.add(
            new SchemaChange(ChangeType.REMOVED_FIELD, field,
                "Field '" + field + "' was removed",
                Collections.<String, Object>emptyMap(), Severity.ERROR, false));
      }
    }

    for (String field : newFields.keySet()) {
      if (!oldFields.containsKey(field)) {
        boolean required = newSchema.isRequired(field);
        changes.add(
            new SchemaChange(ChangeType.NEW_FIELD, field,
                "Field '" + field + "' was added" + (required ? " (required)" : ""),
                ImmutableMap.of("required", required),
                required ? Severity.ERROR : Severity.INFO, !required));
      }
    }

    for (Map.Entry<String, FieldDefinition> entry : oldFields.entrySet()) {
      String field = entry.getKey();
      FieldDefinition newField = newFields.get(field);
      if (newField == null) {
        continue;
      }
      String oldType = entry.getValue().getTypeLabel();
      String newType = newField.getTypeLabel();
      if (!oldType.equals(newType)) {
        changes.add(
            new SchemaChange(ChangeType.TYPE_CHANGE, field,
                "Field '" + field + "' type changed from " + oldType + " to " + newType,
                ImmutableMap.of("oldType", oldType, "newType", newType),
                Severity.ERROR, false));
      } else if (entry.getValue().getEnumValues() != null && newField.getEnumValues() != null) {
        List<Object> oldEnum = entry.getValue().getEnumValues();
        List<Object> newEnum = newField.getEnumValues();
        List<Object> added = new ArrayList<>(newEnum);
        added.removeAll(oldEnum);
        List<Object> removed = new ArrayList<>(oldEnum);
        removed.removeAll(newEnum);
        if (!added.isEmpty() || !removed.isEmpty()) {
          changes.add(
              new SchemaChange(ChangeType.ENUM_CHANGE, field,
                  "Enum values changed for '" + field + "'",
                  ImmutableMap.of("added", added, "removed", removed),
                  removed.isEmpty() ? Severity.INFO : Severity.WARNING, removed.isEmpty()));
        }
      }
    }

    for (String field : newSchema.getRequired()) {
      if (!oldSchema.isRequired(field) && oldFields.containsKey(field)) {
        changes.add(
            new SchemaChange(ChangeType.FORMAT_CHANGE, field,
                "Field '" + field + "' became required",
                ImmutableMap.of("required", true), Severity.ERROR, false));
      }
    }
    for (String field : oldSchema.getRequired()) {
      if (!newSchema.isRequired(field) && newFields.containsKey(field)) {
        changes.add(
            new SchemaChange(ChangeType.FORMAT_CHANGE, field,
                "Field '" + field + "' became optional",
                ImmutableMap.of("required", false), Severity.INFO, true));
      }
    }

    SchemaComparison comparison = new SchemaComparison(changes);
    LOGGER.debug("Compared schemas: {} changes, breaking={}", changes.size(),
        comparison.isBreaking());
    return comparison;
  }

  /**
   * Renders a comparison as readable text.
   */
  public static String summarize(SchemaComparison comparison) {
    if (!comparison.hasChanges()) {
      return "No schema changes detected";
    }
    List<String> lines = new ArrayList<>();
    lines.add("Schema Changes Summary:");
    lines.add("- Total changes: " + comparison.getChanges().size());
    lines.add("- Breaking changes: " + yesNo(comparison.isBreaking()));
    lines.add("- Requires approval: " + yesNo(comparison.requiresApproval()));
    lines.add("- Can auto-approve: " + yesNo(comparison.canAutoApprove()));

    List<String> breaking = new ArrayList<>();
    List<String> nonBreaking = new ArrayList<>();
    for (SchemaChange change : comparison.getChanges()) {
      String line = "  - " + change.getDescription();
      if (change.getSeverity() == Severity.ERROR) {
        breaking.add(line);
      } else {
        nonBreaking.add(line);
      }
    }
    if (!breaking.isEmpty()) {
      lines.add("");
      lines.add("Breaking Changes:");
      lines.addAll(breaking);
    }
    if (!nonBreaking.isEmpty()) {
      lines.add("");
      lines.add("Non-Breaking Changes:");
      lines.addAll(nonBreaking);
    }
    return String.join("\n", lines);
  }

  private static String yesNo(boolean value) {
    return value ? "Yes" : "No";
  }
}
