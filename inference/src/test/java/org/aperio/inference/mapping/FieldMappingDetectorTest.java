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
package org.aperio.inference.mapping;

import org.aperio.inference.geo.GeoColumnDetector;
import org.aperio.inference.geo.GeoColumnResult;
import org.aperio.inference.stats.FieldStatistics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.aperio.inference.mapping.ContentValidatorsTest.stats;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FieldMappingDetector.
 */
@Tag("unit")
public class FieldMappingDetectorTest {

  private final FieldMappingDetector detector = new FieldMappingDetector();

  private static void put(Map<String, FieldStatistics> map, FieldStatistics stats) {
    map.put(stats.getPath(), stats);
  }

  private static Map<String, FieldStatistics> englishEvents() {
    Map<String, FieldStatistics> map = new LinkedHashMap<>();
    put(map, stats("title", "Summer Music Festival", "Open Air Cinema Night"));
    put(map, stats("description", "An evening of jazz standards by the river.",
        "Classic films under the stars with food trucks."));
    put(map, stats("venue", "Town Hall", "City Park"));
    put(map, stats("date", "2024-06-01", "2024-06-08"));
    put(map, stats("address", "1 Market Square, Springfield", "20 Park Lane, Springfield"));
    put(map, stats("lat", 40.7128, 51.5074));
    put(map, stats("lon", -74.006, -0.1278));
    return map;
  }

  @Test void testEnglishDataset() {
    FieldMappings mappings = detector.detectFieldMappings(englishEvents(), "eng");
    assertEquals("title", mappings.getTitlePath());
    assertEquals("description", mappings.getDescriptionPath());
    assertEquals("venue", mappings.getLocationNamePath());
    assertEquals("date", mappings.getTimestampPath());
    assertEquals("address", mappings.getLocationPath());
    assertEquals("lat", mappings.getLatitudePath());
    assertEquals("lon", mappings.getLongitudePath());
    assertEquals(1.0, mappings.getConfidence(FieldMappings.TITLE), 1e-9);
    assertTrue(mappings.getConfidence(FieldMappings.LATITUDE) > 0.9);
  }

  @Test void testNullLanguageMeansEnglish() {
    assertEquals(detector.detectFieldMappings(englishEvents(), "eng"),
        detector.detectFieldMappings(englishEvents(), null));
  }

  @Test void testGermanDataset() {
    Map<String, FieldStatistics> map = new LinkedHashMap<>();
    put(map, stats("titel", "Sommerfest im Stadtpark", "Weihnachtsmarkt Altstadt"));
    put(map, stats("beschreibung", "Musik, Essen und Spiele für die ganze Familie.",
        "Glühwein und Kunsthandwerk auf dem Marktplatz."));
    put(map, stats("ort", "Stadthalle", "Marktplatz"));
    put(map, stats("datum", "2024-07-13", "2024-12-01"));

    FieldMappings mappings = detector.detectFieldMappings(map, "deu");
    assertEquals("titel", mappings.getTitlePath());
    assertEquals("beschreibung", mappings.getDescriptionPath());
    assertEquals("ort", mappings.getLocationNamePath());
    assertEquals("ort", mappings.getLocationPath());
    assertEquals("datum", mappings.getTimestampPath());
    assertNull(mappings.getLatitudePath());
  }

  @Test void testFallsBackToEnglishPatterns() {
    FieldMappings german = detector.detectFieldMappings(englishEvents(), "deu");
    assertEquals("title", german.getTitlePath());
    assertEquals("date", german.getTimestampPath());

    FieldMappings unknown = detector.detectFieldMappings(englishEvents(), "kor");
    assertEquals("title", unknown.getTitlePath());
  }

  @Test void testContentCanRejectAName() {
    Map<String, FieldStatistics> map = new LinkedHashMap<>();
    put(map, stats("title", 1, 2, 3));
    put(map, stats("name", "Harbour Lights Parade", "Night Market"));
    FieldMappings mappings = detector.detectFieldMappings(map, "eng");
    assertEquals("name", mappings.getTitlePath());
  }

  @Test void testEarlierPatternWins() {
    Map<String, FieldStatistics> map = new LinkedHashMap<>();
    put(map, stats("name", "Harbour Lights Parade", "Night Market"));
    put(map, stats("title", "Summer Music Festival", "Open Air Cinema Night"));
    assertEquals("title", detector.detectField(map, FieldRole.TITLE, "eng"));
    assertNull(detector.detectField(map, FieldRole.TIMESTAMP, "eng"));
  }

  @Test void testNestedPathsMatchOnLastSegment() {
    Map<String, FieldStatistics> map = new LinkedHashMap<>();
    put(map, stats("event.title", "Summer Music Festival"));
    assertEquals("event.title", detector.detectField(map, FieldRole.TITLE, null));
  }

  @Test void testSwappedGeoColumnsOverrideScoring() {
    List<Map<String, Object>> rows = ImmutableList.<Map<String, Object>>of(
        ImmutableMap.<String, Object>of("latitude", 139.6917, "longitude", 35.6895),
        ImmutableMap.<String, Object>of("latitude", 135.5023, "longitude", 34.6937));
    Map<String, FieldStatistics> map = new LinkedHashMap<>();
    put(map, stats("latitude", 139.6917, 135.5023));
    put(map, stats("longitude", 35.6895, 34.6937));

    FieldMappings scored = detector.detectFieldMappings(map, "eng");
    assertNull(scored.getLatitudePath());
    assertEquals("longitude", scored.getLongitudePath());

    GeoColumnResult geo = new GeoColumnDetector()
        .detectGeoColumns(ImmutableList.of("latitude", "longitude"), rows);
    FieldMappings mappings = detector.detectFieldMappings(map, "eng", geo);
    assertEquals("longitude", mappings.getLatitudePath());
    assertEquals("latitude", mappings.getLongitudePath());
    assertEquals(geo.getConfidence(), mappings.getConfidence(FieldMappings.LATITUDE), 1e-9);
  }

  @Test void testEmptyStatistics() {
    FieldMappings mappings = detector.detectFieldMappings(new LinkedHashMap<>(), "eng");
    assertEquals(FieldMappings.empty(), mappings);
    assertTrue(mappings.getConfidences().isEmpty());
  }
}
