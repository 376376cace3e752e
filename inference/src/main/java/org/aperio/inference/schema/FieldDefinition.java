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
import java.util.List;
import java.util.Objects;

/**
 * Declared type information for one field of a {@link StructuralSchema}.
 *
 * <p>Types use JSON Schema names ({@code string}, {@code integer},
 * {@code number}, {@code boolean}, {@code array}, {@code object},
 * {@code null}) and are ordered from most to least frequent.
 */
public class FieldDefinition {

  private final List<String> types;
  private final boolean nullable;
  private final @Nullable List<Object> enumValues;
  private final @Nullable Double minimum;
  private final @Nullable Double maximum;

  public FieldDefinition(List<String> types, boolean nullable,
      @Nullable List<?> enumValues, @Nullable Double minimum, @Nullable Double maximum) {
    if (types == null || types.isEmpty()) {
      throw new IllegalArgumentException("A field needs at least one type");
    }
    this.types = Collections.unmodifiableList(new ArrayList<>(types));
    this.nullable = nullable;
    this.enumValues = enumValues == null
        ? null : Collections.unmodifiableList(new ArrayList<Object>(enumValues));
    this.minimum = minimum;
    this.maximum = maximum;
  }

  /**
   * Creates a definition with a single type.
   */
  public static FieldDefinition of(String type) {
    return new FieldDefinition(Collections.singletonList(type), false, null, null, null);
  }

  public List<String> getTypes() {
    return types;
  }

  /** Returns the most frequent type. */
  public String getPrimaryType() {
    return types.get(0);
  }

  /**
   * Returns the types other than {@code null}, joined with {@code " | "}.
   */
  public String getTypeLabel() {
    List<String> nonNull = new ArrayList<>();
    for (String type : types) {
      if (!type.equals("null")) {
        nonNull.add(type);
      }
    }
    return nonNull.isEmpty() ? "null" : String.join(" | ", nonNull);
  }

  public boolean isNullable() {
    return nullable;
  }

  public @Nullable List<Object> getEnumValues() {
    return enumValues;
  }

  public @Nullable Double getMinimum() {
    return minimum;
  }

  public @Nullable Double getMaximum() {
    return maximum;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FieldDefinition)) {
      return false;
    }
    FieldDefinition that = (FieldDefinition) o;
    return nullable == that.nullable
        && types.equals(that.types)
        && Objects.equals(enumValues, that.enumValues)
        && Objects.equals(minimum, that.minimum)
        && Objects.equals(maximum, that.maximum);
  }

  @Override public int hashCode() {
    return Objects.hash(types, nullable, enumValues, minimum, maximum);
  }

  @Override public String toString() {
    return getTypeLabel() + (nullable ? "?" : "");
  }
}
