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
package org.aperio.inference.stats;

import org.aperio.inference.value.CellValue;
import org.aperio.inference.value.DateStrings;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Type of a single observed value, as counted in a field's type
 * distribution.
 *
 * <p>Strings are refined: a date-like string counts as {@link #DATE} and the
 * strings {@code "true"} and {@code "false"} count as
 * {@link #BOOLEAN_STRING}.
 */
public enum TypeTag {
  NULL("null"),
  UNDEFINED("undefined"),
  ARRAY("array"),
  OBJECT("object"),
  STRING("string"),
  INTEGER("integer"),
  NUMBER("number"),
  BOOLEAN("boolean"),
  BOOLEAN_STRING("boolean-string"),
  DATE("date");

  private static final Map<String, TypeTag> MAP;

  static {
    ImmutableMap.Builder<String, TypeTag> builder = ImmutableMap.builder();
    for (TypeTag value : values()) {
      builder.put(value.tag, value);
    }
    MAP = builder.build();
  }

  private final String tag;

  TypeTag(String tag) {
    this.tag = tag;
  }

  /** Returns the name used in serialized statistics. */
  public String getTag() {
    return tag;
  }

  public static @Nullable TypeTag fromTag(String tag) {
    return MAP.get(tag);
  }

  /**
   * Classifies a value.
   */
  public static TypeTag of(CellValue value) {
    switch (value.getKind()) {
    case NULL:
      return NULL;
    case UNDEFINED:
      return UNDEFINED;
    case ARRAY:
      return ARRAY;
    case OBJECT:
      return OBJECT;
    case INTEGER:
      return INTEGER;
    case FLOAT:
      return NUMBER;
    case BOOLEAN:
      return BOOLEAN;
    case DATE:
      return DATE;
    case STRING:
    default:
      String text = value.asText();
      if (DateStrings.isDateString(text)) {
        return DATE;
      }
      if (text.equals("true") || text.equals("false")) {
        return BOOLEAN_STRING;
      }
      return STRING;
    }
  }
}
