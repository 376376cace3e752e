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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CoordinateParser.
 */
@Tag("unit")
public class CoordinateParserTest {

  @Test void testNumbersPassThrough() {
    assertEquals(40.7128, CoordinateParser.parseCoordinate(40.7128), 1e-9);
    assertEquals(-74.0, CoordinateParser.parseCoordinate(-74), 1e-9);
    assertNull(CoordinateParser.parseCoordinate(Double.NaN));
    assertNull(CoordinateParser.parseCoordinate(Double.POSITIVE_INFINITY));
  }

  @Test void testDecimalStrings() {
    assertEquals(51.5074, CoordinateParser.parseCoordinate(" 51.5074 "), 1e-9);
    assertEquals(-0.1278, CoordinateParser.parseCoordinate("-0.1278"), 1e-9);
    assertEquals(0.5, CoordinateParser.parseCoordinate(".5"), 1e-9);
  }

  @Test void testDegreesMinutesSeconds() {
    Double lat = CoordinateParser.parseCoordinate("40°42'46\"N");
    assertNotNull(lat);
    assertEquals(40.7128, lat, 1e-3);

    Double lon = CoordinateParser.parseCoordinate("74°0'21\"W");
    assertNotNull(lon);
    assertEquals(-74.0058, lon, 1e-3);
  }

  @Test void testDegreesDecimalMinutes() {
    Double lat = CoordinateParser.parseCoordinate("33°51.5'S");
    assertNotNull(lat);
    assertEquals(-33.8583, lat, 1e-3);
  }

  @Test void testDirectionalSuffix() {
    assertEquals(-33.87, CoordinateParser.parseCoordinate("33.87 S"), 1e-9);
    assertEquals(151.21, CoordinateParser.parseCoordinate("151.21E"), 1e-9);
    assertEquals(-151.21, CoordinateParser.parseCoordinate("151.21 w"), 1e-9);
  }

  @Test void testUnparseableReturnsNull() {
    assertNull(CoordinateParser.parseCoordinate(null));
    assertNull(CoordinateParser.parseCoordinate(""));
    assertNull(CoordinateParser.parseCoordinate("   "));
    assertNull(CoordinateParser.parseCoordinate("north"));
    assertNull(CoordinateParser.parseCoordinate("12.5.3"));
    assertNull(CoordinateParser.parseCoordinate(true));
  }

  @Test void testParsingIsIdempotent() {
    Object[] inputs = {"40.7128", "40°42'46\"N", "33.87 S", 151.21, "-0.1278"};
    for (Object input : inputs) {
      Double once = CoordinateParser.parseCoordinate(input);
      assertNotNull(once, String.valueOf(input));
      assertEquals(once, CoordinateParser.parseCoordinate(once));
    }
  }

  @Test void testValidCoordinates() {
    double[][] valid = {
        {40.7128, -74.0060}, {-90, 180}, {90, -180}, {0, 45}, {45, 0}, {-33.87, 151.21}
    };
    for (double[] pair : valid) {
      assertTrue(CoordinateParser.isValidCoordinate(pair[0], pair[1]),
          pair[0] + "," + pair[1]);
    }
  }

  @Test void testInvalidCoordinates() {
    assertFalse(CoordinateParser.isValidCoordinate(0d, 0d));
    assertFalse(CoordinateParser.isValidCoordinate(90.0001, 0d));
    assertFalse(CoordinateParser.isValidCoordinate(10d, 180.5));
    assertFalse(CoordinateParser.isValidCoordinate(null, 10d));
    assertFalse(CoordinateParser.isValidCoordinate(10d, null));
    assertFalse(CoordinateParser.isValidCoordinate(Double.NaN, 10d));
  }

  @Test void testZeroPairAllowedWhenNotRejected() {
    assertTrue(CoordinateParser.isValidCoordinate(0d, 0d, false));
  }

  @Test void testLooksSwapped() {
    assertTrue(CoordinateParser.looksSwapped(139.65, 35.67));
    assertFalse(CoordinateParser.looksSwapped(35.67, 139.65));
    assertFalse(CoordinateParser.looksSwapped(185, 10));
    assertFalse(CoordinateParser.looksSwapped(120, 95));
  }
}
