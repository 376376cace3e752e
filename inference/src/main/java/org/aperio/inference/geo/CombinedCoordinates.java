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
package org.aperio.inference.geo;

import org.aperio.inference.value.CellValue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits combined coordinate values into a {@code {latitude, longitude}}
 * pair. Each reader returns {@code null} when the value does not have its
 * layout; range checks are left to the caller.
 */
final class CombinedCoordinates {
  private static final Logger LOGGER = LoggerFactory.getLogger(CombinedCoordinates.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final Pattern COMMA =
      Pattern.compile("^(-?\\d{1,3}\\.?\\d{0,10}),\\s{0,5}(-?\\d{1,3}\\.?\\d{0,10})$");
  private static final Pattern SPACE =
      Pattern.compile("^(-?\\d{1,3}\\.?\\d{0,10})\\s{1,5}(-?\\d{1,3}\\.?\\d{0,10})$");
  private static final Pattern BRACKETS =
      Pattern.compile("^\\[\\s*(-?\\d{1,3}(?:\\.\\d+)?)\\s*,\\s*(-?\\d{1,3}(?:\\.\\d+)?)\\s*]$");

  private CombinedCoordinates() {
  }

  static double @Nullable [] readComma(CellValue value) {
    return readPattern(COMMA, value);
  }

  static double @Nullable [] readSpace(CellValue value) {
    return readPattern(SPACE, value);
  }

  static double @Nullable [] readBrackets(CellValue value) {
    if (value.getKind() == CellValue.Kind.ARRAY) {
      return readPair(value.elements(), false);
    }
    return readPattern(BRACKETS, value);
  }

  /**
   * Reads a GeoJSON Point given as JSON text or as an already-structured
   * object. GeoJSON stores {@code [longitude, latitude]}.
   */
  static double @Nullable [] readGeoJson(CellValue value) {
    CellValue point = value;
    if (value.getKind() == CellValue.Kind.STRING) {
      String text = value.asText().trim();
      if (!text.startsWith("{")) {
        return null;
      }
      try {
        JsonNode node = MAPPER.readTree(text);
        point = CellValue.fromJson(node);
      } catch (JsonProcessingException e) {
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("Value is not GeoJSON: {}", e.getOriginalMessage());
        }
        return null;
      }
    }
    if (point.getKind() != CellValue.Kind.OBJECT) {
      return null;
    }
    Map<String, CellValue> fields = point.fields();
    CellValue type = fields.get("type");
    CellValue coordinates = fields.get("coordinates");
    if (type == null || !"Point".equals(type.asText())
        || coordinates == null || coordinates.getKind() != CellValue.Kind.ARRAY) {
      return null;
    }
    return readPair(coordinates.elements(), true);
  }

  private static double @Nullable [] readPair(List<CellValue> elements,
      boolean lonFirst) {
    if (elements.size() < 2) {
      return null;
    }
    CellValue first = elements.get(0);
    CellValue second = elements.get(1);
    if (!first.isNumeric() || !second.isNumeric()) {
      return null;
    }
    return lonFirst
        ? new double[] {second.asDouble(), first.asDouble()}
        : new double[] {first.asDouble(), second.asDouble()};
  }

  private static double @Nullable [] readPattern(Pattern pattern, CellValue value) {
    if (value.getKind() != CellValue.Kind.STRING) {
      return null;
    }
    Matcher m = pattern.matcher(value.asText().trim());
    if (!m.matches()) {
      return null;
    }
    return new double[] {parse(m.group(1)), parse(m.group(2))};
  }

  private static double parse(String digits) {
    String s = digits.endsWith(".") ? digits.substring(0, digits.length() - 1) : digits;
    return Double.parseDouble(s);
  }
}
