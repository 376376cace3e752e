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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for GeoColumnDetector.
 */
@Tag("unit")
public class GeoColumnDetectorTest {

  private static final double[][] CITIES = {
      {40.7128, -74.0060},
      {51.5074, -0.1278},
      {48.8566, 2.3522},
      {35.6762, 139.6503},
      {-33.8688, 151.2093},
      {52.5200, 13.4050}
  };

  private final GeoColumnDetector detector = new GeoColumnDetector();

  private static List<Map<String, Object>> rows(String latKey, String lonKey,
      boolean swapped) {
    List<Map<String, Object>> rows = new ArrayList<>();
    int i = 0;
    for (double[] city : CITIES) {
      rows.add(ImmutableMap.<String, Object>of(
          latKey, swapped ? city[1] : city[0],
          lonKey, swapped ? city[0] : city[1],
          "title", "City " + i++));
    }
    return rows;
  }

  @Test void testSeparateColumnsByName() {
    GeoColumnResult result = detector.detectGeoColumns(ImmutableList.of("lat", "lon", "title"),
        rows("lat", "lon", false));
    assertTrue(result.isFound());
    assertEquals(GeoColumnType.SEPARATE, result.getType());
    assertEquals(DetectionMethod.PATTERN, result.getDetectionMethod());
    assertEquals("lat", result.getLatColumn());
    assertEquals("lon", result.getLonColumn());
    assertFalse(result.isSwappedCoordinates());
    assertEquals(1.0, result.getConfidence(), 1e-9);
  }

  @Test void testSwappedColumns() {
    List<Map<String, Object>> rows = new ArrayList<>();
    rows.add(ImmutableMap.<String, Object>of("latitude", 139.6917, "longitude", 35.6895));
    rows.add(ImmutableMap.<String, Object>of("latitude", 135.5023, "longitude", 34.6937));
    rows.add(ImmutableMap.<String, Object>of("latitude", 130.4017, "longitude", 33.5902));
    GeoColumnResult result = detector.detectGeoColumns(
        ImmutableList.of("latitude", "longitude"), rows);
    assertTrue(result.isFound());
    assertTrue(result.isSwappedCoordinates());
    assertEquals("longitude", result.getEffectiveLatColumn());
    assertEquals("latitude", result.getEffectiveLonColumn());
    assertEquals(1.0, result.getConfidence(), 1e-9);
  }

  @Test void testCombinedColumn() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (double[] city : CITIES) {
      rows.add(ImmutableMap.<String, Object>of("name", "x",
          "coordinates", city[0] + "," + city[1]));
    }
    GeoColumnResult result = detector.detectGeoColumns(
        ImmutableList.of("name", "coordinates"), rows);
    assertTrue(result.isFound());
    assertEquals(GeoColumnType.COMBINED, result.getType());
    assertEquals("coordinates", result.getCombinedColumn());
    assertEquals(CoordinateFormat.COMBINED_COMMA, result.getFormat());
    assertNull(result.getLatColumn());
  }

  @Test void testHeuristicDetection() {
    GeoColumnResult result = detector.detectGeoColumns(ImmutableList.of("title", "a", "b"),
        rows("a", "b", false));
    assertTrue(result.isFound());
    assertEquals(DetectionMethod.HEURISTIC, result.getDetectionMethod());
    assertEquals("a", result.getLatColumn());
    assertEquals("b", result.getLonColumn());
  }

  @Test void testHeuristicSkipsConstantColumns() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (double[] city : CITIES) {
      rows.add(ImmutableMap.<String, Object>of(
          "a", 10, "b", 20, "c", city[0], "d", city[1]));
    }
    GeoColumnResult result =
        detector.detectGeoColumns(ImmutableList.of("a", "b", "c", "d"), rows);
    assertTrue(result.isFound());
    assertEquals(DetectionMethod.HEURISTIC, result.getDetectionMethod());
    assertEquals("c", result.getLatColumn());
    assertEquals("d", result.getLonColumn());
  }

  @Test void testNoCoordinates() {
    List<Map<String, Object>> rows = Arrays.<Map<String, Object>>asList(
        ImmutableMap.<String, Object>of("title", "One", "notes", "first"),
        ImmutableMap.<String, Object>of("title", "Two", "notes", "second"));
    GeoColumnResult result = detector.detectGeoColumns(ImmutableList.of("title", "notes"), rows);
    assertFalse(result.isFound());
    assertEquals(GeoColumnType.NONE, result.getType());
  }

  @Test void testNamedColumnsWithBadValues() {
    List<Map<String, Object>> rows = Arrays.<Map<String, Object>>asList(
        ImmutableMap.<String, Object>of("lat", 300, "lon", 400),
        ImmutableMap.<String, Object>of("lat", 500, "lon", 600));
    assertFalse(detector.detectGeoColumns(ImmutableList.of("lat", "lon"), rows).isFound());
  }

  @Test void testManualSelection() {
    GeoColumnResult result = detector.validateManualSelection(rows("y_pos", "x_pos", false),
        "y_pos", "x_pos");
    assertTrue(result.isFound());
    assertEquals(DetectionMethod.MANUAL, result.getDetectionMethod());
    assertEquals("y_pos", result.getEffectiveLatColumn());

    assertFalse(detector.validateManualSelection(rows("y_pos", "x_pos", false),
        "title", "x_pos").isFound());
    assertThrows(IllegalArgumentException.class,
        () -> detector.validateManualSelection(rows("y_pos", "x_pos", false), null, "x_pos"));
  }
}
