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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered set of field paths with their declared types and the fields
 * that are required.
 *
 * <pre>{@code
 * StructuralSchema schema = StructuralSchema.builder()
 *     .field("id", "integer")
 *     .field("title", "string")
 *     .required("id")
 *     .build();
 * }</pre>
 */
public class StructuralSchema {

  private final Map<String, FieldDefinition> fields;
  private final Set<String> required;

  private StructuralSchema(Builder builder) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    this.required = Collections.unmodifiableSet(new LinkedHashSet<>(builder.required));
  }

  public Map<String, FieldDefinition> getFields() {
    return fields;
  }

  /** Returns the field paths in declaration order. */
  public List<String> getFieldNames() {
    return new ArrayList<>(fields.keySet());
  }

  public @Nullable FieldDefinition getField(String path) {
    return fields.get(path);
  }

  public boolean hasField(String path) {
    return fields.containsKey(path);
  }

  public Set<String> getRequired() {
    return required;
  }

  public boolean isRequired(String path) {
    return required.contains(path);
  }

  /**
   * Returns the position of a field in declaration order, or -1.
   */
  public int indexOf(String path) {
    int i = 0;
    for (String name : fields.keySet()) {
      if (name.equals(path)) {
        return i;
      }
      i++;
    }
    return -1;
  }

  /**
   * Returns a JSON Schema object for the fields; nested paths are listed
   * under their full dotted name.
   */
  public Map<String, Object> toJsonSchema() {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
      FieldDefinition field = entry.getValue();
      Map<String, Object> property = new LinkedHashMap<>();
      List<String> types = new ArrayList<>(field.getTypes());
      if (field.isNullable() && !types.contains("null")) {
        types.add("null");
      }
      property.put("type", types.size() == 1 ? types.get(0) : types);
      if (field.getEnumValues() != null) {
        property.put("enum", field.getEnumValues());
      }
      if (field.getMinimum() != null) {
        property.put("minimum", field.getMinimum());
      }
      if (field.getMaximum() != null) {
        property.put("maximum", field.getMaximum());
      }
      properties.put(entry.getKey(), property);
    }
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("properties", properties);
    schema.put("required", new ArrayList<>(required));
    return schema;
  }

  /**
   * Creates a new builder for StructuralSchema.
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StructuralSchema)) {
      return false;
    }
    StructuralSchema that = (StructuralSchema) o;
    return getFieldNames().equals(that.getFieldNames())
        && fields.equals(that.fields)
        && required.equals(that.required);
  }

  @Override public int hashCode() {
    return fields.hashCode() * 31 + required.hashCode();
  }

  @Override public String toString() {
    return "StructuralSchema" + fields + ", required=" + required;
  }

  /**
   * Builder for StructuralSchema.
   */
  public static class Builder {
    private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
    private final Set<String> required = new LinkedHashSet<>();

    public Builder field(String path, String type) {
      return field(path, FieldDefinition.of(type));
    }

    /**
     * Adds a field that may hold any of the given types.
     */
    public Builder field(String path, List<String> types) {
      boolean nullable = types.contains("null");
      List<String> declared = new ArrayList<>();
      for (String type : types) {
        if (!type.equals("null")) {
          declared.add(type);
        }
      }
      if (declared.isEmpty()) {
        declared.add("null");
      }
      return field(path, new FieldDefinition(declared, nullable, null, null, null));
    }

    public Builder field(String path, FieldDefinition definition) {
      if (path == null || path.isEmpty()) {
        throw new IllegalArgumentException("Field path is required");
      }
      fields.put(path, definition);
      return this;
    }

    public Builder required(String... paths) {
      Collections.addAll(required, paths);
      return this;
    }

    public StructuralSchema build() {
      for (String path : required) {
        if (!fields.containsKey(path)) {
          throw new IllegalArgumentException("Required field " + path + " is not declared");
        }
      }
      return new StructuralSchema(this);
    }
  }
}
