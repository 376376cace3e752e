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

import org.aperio.inference.value.CellValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Type names and the groups of types that can hold each other's values.
 *
 * <p>Types are compared after normalization: lower case, {@code -} read as
 * {@code _}, and a {@code null} alternative dropped, so
 * {@code "String | null"} and {@code "string"} are the same type.
 */
public final class TypeCompatibility {

  public static final String NUMERIC_STRING = "numeric_string";

  private static final List<Set<String>> GROUPS = ImmutableList.of(
      ImmutableSet.of("string", "date", NUMERIC_STRING),
      ImmutableSet.of("number", "integer", NUMERIC_STRING),
      ImmutableSet.of("boolean", "string"));

  private static final Pattern NUMBER =
      Pattern.compile("^-?(?:\\d+(?:\\.\\d+)?|\\.\\d+)(?:[eE][+-]?\\d+)?$");
  private static final Pattern DATE_PREFIX =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}|^\\d{2}[/.]\\d{2}[/.]\\d{4}");

  private TypeCompatibility() {
  }

  /**
   * Normalizes a type name; returns null for a missing or null-only type.
   */
  public static @Nullable String normalize(@Nullable String type) {
    if (type == null) {
      return null;
    }
    for (String part : type.split("\\|")) {
      String name = part.trim().toLowerCase(Locale.ROOT).replace('-', '_');
      if (!name.isEmpty() && !name.equals("null")) {
        return name;
      }
    }
    return null;
  }

  /**
   * Whether values of one type fit a field of the other. Equal types are
   * compatible; so are types sharing a group.
   */
  public static boolean areCompatible(@Nullable String type1, @Nullable String type2) {
    String a = normalize(type1);
    String b = normalize(type2);
    if (a == null || b == null) {
      return false;
    }
    if (a.equals(b)) {
      return true;
    }
    for (Set<String> group : GROUPS) {
      if (group.contains(a) && group.contains(b)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether any type of one list is compatible with any type of the other.
   */
  public static boolean anyCompatible(List<String> types1, List<String> types2) {
    for (String a : types1) {
      for (String b : types2) {
        if (areCompatible(a, b)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Classifies a sample value: {@code null}, {@code integer}, {@code number},
   * {@code boolean}, {@code array}, {@code object}, {@code date},
   * {@code numeric_string} or {@code string}.
   */
  public static String classify(@Nullable Object value) {
    CellValue cell = CellValue.of(value);
    switch (cell.getKind()) {
    case NULL:
    case UNDEFINED:
      return "null";
    case INTEGER:
      return "integer";
    case FLOAT:
      return "number";
    case BOOLEAN:
      return "boolean";
    case ARRAY:
      return "array";
    case OBJECT:
      return "object";
    case DATE:
      return "date";
    default:
      break;
    }
    String text = cell.asText();
    if (DATE_PREFIX.matcher(text).find()) {
      return "date";
    }
    if (isNumeric(text)) {
      return NUMERIC_STRING;
    }
    return "string";
  }

  /**
   * Returns the most frequent non-null type among the values, or
   * {@code string} when all are null.
   */
  public static String inferType(Iterable<?> values) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (Object value : values) {
      String type = classify(value);
      if (!type.equals("null")) {
        counts.merge(type, 1, Integer::sum);
      }
    }
    String dominant = "string";
    int max = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > max) {
        max = entry.getValue();
        dominant = entry.getKey();
      }
    }
    return dominant;
  }

  private static boolean isNumeric(String text) {
    return NUMBER.matcher(text.trim()).matches();
  }
}
