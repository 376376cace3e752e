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
package org.aperio.inference.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single cell of a parsed row, as a closed set of value kinds.
 *
 * <p>Row values arrive from file decoders as plain Java objects of unknown
 * shape. {@link #of(Object)} converts them once at the ingestion boundary so
 * that statistics and detectors switch over {@link Kind} instead of probing
 * runtime types.
 *
 * <p>Numbers with no fractional part are normalized to {@link Kind#INTEGER},
 * so {@code 3.0} and {@code 3} are the same value.
 */
public abstract class CellValue {

  /** Kinds of cell value. */
  public enum Kind {
    NULL,
    UNDEFINED,
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    DATE,
    ARRAY,
    OBJECT
  }

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final CellValue NULL_VALUE = new NullValue(Kind.NULL);
  private static final CellValue UNDEFINED_VALUE = new NullValue(Kind.UNDEFINED);

  CellValue() {
  }

  public abstract Kind getKind();

  /**
   * Returns the plain Java form of this value: {@code null}, Boolean, Long,
   * Double, String, an ISO-8601 string for dates, a List or a Map.
   */
  public abstract @Nullable Object toJavaObject();

  /**
   * Returns the text form used by parsers. Objects and arrays render as JSON;
   * null and undefined render as the empty string.
   */
  public abstract String asText();

  public boolean isNull() {
    return getKind() == Kind.NULL || getKind() == Kind.UNDEFINED;
  }

  public boolean isNumeric() {
    return getKind() == Kind.INTEGER || getKind() == Kind.FLOAT;
  }

  /** Whether this value is a string, number, boolean or null. */
  public boolean isScalar() {
    switch (getKind()) {
    case NULL:
    case BOOLEAN:
    case INTEGER:
    case FLOAT:
    case STRING:
    case DATE:
      return true;
    default:
      return false;
    }
  }

  /** Whether this value is null, undefined or a blank string. */
  public boolean isBlank() {
    return isNull() || (getKind() == Kind.STRING && asText().trim().isEmpty());
  }

  public double asDouble() {
    throw new UnsupportedOperationException(getKind() + " is not numeric");
  }

  public boolean asBoolean() {
    throw new UnsupportedOperationException(getKind() + " is not a boolean");
  }

  public Instant asInstant() {
    throw new UnsupportedOperationException(getKind() + " is not a date");
  }

  public List<CellValue> elements() {
    throw new UnsupportedOperationException(getKind() + " is not an array");
  }

  public Map<String, CellValue> fields() {
    throw new UnsupportedOperationException(getKind() + " is not an object");
  }

  public static CellValue nullValue() {
    return NULL_VALUE;
  }

  public static CellValue undefined() {
    return UNDEFINED_VALUE;
  }

  public static CellValue of(boolean value) {
    return new BooleanValue(value);
  }

  public static CellValue of(long value) {
    return new IntegerValue(value);
  }

  public static CellValue of(double value) {
    if (isIntegral(value)) {
      return new IntegerValue((long) value);
    }
    return new FloatValue(value);
  }

  public static CellValue of(String value) {
    return new StringValue(value);
  }

  public static CellValue of(Instant value) {
    return new DateValue(value);
  }

  /**
   * Converts an arbitrary decoded value.
   *
   * @param value Value from a row mapping; may be null
   * @return The cell value; unknown types become their string form
   */
  public static CellValue of(@Nullable Object value) {
    if (value == null) {
      return NULL_VALUE;
    }
    if (value instanceof CellValue) {
      return (CellValue) value;
    }
    if (value instanceof Boolean) {
      return new BooleanValue((Boolean) value);
    }
    if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      return new IntegerValue(((Number) value).longValue());
    }
    if (value instanceof BigInteger) {
      BigInteger big = (BigInteger) value;
      return big.bitLength() < 64 ? new IntegerValue(big.longValue()) : of(big.doubleValue());
    }
    if (value instanceof BigDecimal || value instanceof Number) {
      return of(((Number) value).doubleValue());
    }
    if (value instanceof CharSequence || value instanceof Character) {
      return new StringValue(value.toString());
    }
    if (value instanceof JsonNode) {
      return fromJson((JsonNode) value);
    }
    Instant instant = toInstant(value);
    if (instant != null) {
      return new DateValue(instant);
    }
    if (value instanceof Map) {
      Map<String, CellValue> fields = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        fields.put(String.valueOf(entry.getKey()), of(entry.getValue()));
      }
      return new ObjectValue(fields);
    }
    if (value instanceof Iterable) {
      List<CellValue> elements = new ArrayList<>();
      for (Object element : (Iterable<?>) value) {
        elements.add(of(element));
      }
      return new ArrayValue(elements);
    }
    if (value instanceof Object[]) {
      List<CellValue> elements = new ArrayList<>();
      for (Object element : (Object[]) value) {
        elements.add(of(element));
      }
      return new ArrayValue(elements);
    }
    return new StringValue(value.toString());
  }

  /**
   * Converts a Jackson tree node.
   */
  public static CellValue fromJson(@Nullable JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return UNDEFINED_VALUE;
    }
    if (node.isNull()) {
      return NULL_VALUE;
    }
    if (node.isBoolean()) {
      return new BooleanValue(node.booleanValue());
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return new IntegerValue(node.longValue());
    }
    if (node.isNumber()) {
      return of(node.doubleValue());
    }
    if (node.isTextual()) {
      return new StringValue(node.textValue());
    }
    if (node.isArray()) {
      List<CellValue> elements = new ArrayList<>();
      for (JsonNode element : node) {
        elements.add(fromJson(element));
      }
      return new ArrayValue(elements);
    }
    if (node.isObject()) {
      Map<String, CellValue> fields = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> entry = it.next();
        fields.put(entry.getKey(), fromJson(entry.getValue()));
      }
      return new ObjectValue(fields);
    }
    return new StringValue(node.asText());
  }

  private static @Nullable Instant toInstant(Object value) {
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    return null;
  }

  private static boolean isIntegral(double value) {
    return !Double.isNaN(value) && !Double.isInfinite(value)
        && value == Math.rint(value)
        && Math.abs(value) < 9.007199254740992E15;
  }

  static String toJson(@Nullable Object javaObject) {
    try {
      return MAPPER.writeValueAsString(javaObject);
    } catch (JsonProcessingException e) {
      return String.valueOf(javaObject);
    }
  }

  @Override public String toString() {
    return getKind() + "(" + asText() + ")";
  }

  /** Null or undefined. */
  private static final class NullValue extends CellValue {
    private final Kind kind;

    NullValue(Kind kind) {
      this.kind = kind;
    }

    @Override public Kind getKind() {
      return kind;
    }

    @Override public @Nullable Object toJavaObject() {
      return null;
    }

    @Override public String asText() {
      return "";
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof NullValue && ((NullValue) o).kind == kind;
    }

    @Override public int hashCode() {
      return kind.hashCode();
    }
  }

  /** Boolean. */
  private static final class BooleanValue extends CellValue {
    private final boolean value;

    BooleanValue(boolean value) {
      this.value = value;
    }

    @Override public Kind getKind() {
      return Kind.BOOLEAN;
    }

    @Override public boolean asBoolean() {
      return value;
    }

    @Override public Object toJavaObject() {
      return value;
    }

    @Override public String asText() {
      return Boolean.toString(value);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof BooleanValue && ((BooleanValue) o).value == value;
    }

    @Override public int hashCode() {
      return Boolean.hashCode(value);
    }
  }

  /** Whole number. */
  private static final class IntegerValue extends CellValue {
    private final long value;

    IntegerValue(long value) {
      this.value = value;
    }

    @Override public Kind getKind() {
      return Kind.INTEGER;
    }

    @Override public double asDouble() {
      return value;
    }

    @Override public Object toJavaObject() {
      return value;
    }

    @Override public String asText() {
      return Long.toString(value);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof IntegerValue && ((IntegerValue) o).value == value;
    }

    @Override public int hashCode() {
      return Long.hashCode(value);
    }
  }

  /** Number with a fractional part, NaN or infinity. */
  private static final class FloatValue extends CellValue {
    private final double value;

    FloatValue(double value) {
      this.value = value;
    }

    @Override public Kind getKind() {
      return Kind.FLOAT;
    }

    @Override public double asDouble() {
      return value;
    }

    @Override public Object toJavaObject() {
      return value;
    }

    @Override public String asText() {
      return Double.toString(value);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof FloatValue
          && Double.compare(((FloatValue) o).value, value) == 0;
    }

    @Override public int hashCode() {
      return Double.hashCode(value);
    }
  }

  /** Text. */
  private static final class StringValue extends CellValue {
    private final String value;

    StringValue(String value) {
      this.value = Objects.requireNonNull(value, "value");
    }

    @Override public Kind getKind() {
      return Kind.STRING;
    }

    @Override public Object toJavaObject() {
      return value;
    }

    @Override public String asText() {
      return value;
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof StringValue && ((StringValue) o).value.equals(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }
  }

  /** Native date or timestamp, held as an instant. */
  private static final class DateValue extends CellValue {
    private final Instant value;

    DateValue(Instant value) {
      this.value = Objects.requireNonNull(value, "value");
    }

    @Override public Kind getKind() {
      return Kind.DATE;
    }

    @Override public Instant asInstant() {
      return value;
    }

    @Override public Object toJavaObject() {
      return value.toString();
    }

    @Override public String asText() {
      return value.toString();
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof DateValue && ((DateValue) o).value.equals(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }
  }

  /** Ordered list of values. */
  private static final class ArrayValue extends CellValue {
    private final List<CellValue> elements;

    ArrayValue(List<CellValue> elements) {
      this.elements = Collections.unmodifiableList(elements);
    }

    @Override public Kind getKind() {
      return Kind.ARRAY;
    }

    @Override public List<CellValue> elements() {
      return elements;
    }

    @Override public Object toJavaObject() {
      List<Object> list = new ArrayList<>(elements.size());
      for (CellValue element : elements) {
        list.add(element.toJavaObject());
      }
      return list;
    }

    @Override public String asText() {
      return toJson(toJavaObject());
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof ArrayValue && ((ArrayValue) o).elements.equals(elements);
    }

    @Override public int hashCode() {
      return elements.hashCode();
    }
  }

  /** Nested record with ordered keys. */
  private static final class ObjectValue extends CellValue {
    private final Map<String, CellValue> fields;

    ObjectValue(Map<String, CellValue> fields) {
      this.fields = Collections.unmodifiableMap(fields);
    }

    @Override public Kind getKind() {
      return Kind.OBJECT;
    }

    @Override public Map<String, CellValue> fields() {
      return fields;
    }

    @Override public Object toJavaObject() {
      Map<String, Object> map = new LinkedHashMap<>();
      for (Map.Entry<String, CellValue> entry : fields.entrySet()) {
        map.put(entry.getKey(), entry.getValue().toJavaObject());
      }
      return map;
    }

    @Override public String asText() {
      return toJson(toJavaObject());
    }

    @Override public boolean equals(@Nullable Object o) {
      return o instanceof ObjectValue && ((ObjectValue) o).fields.equals(fields);
    }

    @Override public int hashCode() {
      return fields.hashCode();
    }
  }
}
