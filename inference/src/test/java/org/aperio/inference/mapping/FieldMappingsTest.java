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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FieldMappings.
 */
@Tag("unit")
public class FieldMappingsTest {

  @Test void testToMapListsEveryRole() {
    Map<String, String> map = FieldMappings.builder().titlePath("name", 0.9).build().toMap();
    assertEquals(7, map.size());
    assertEquals("name", map.get(FieldMappings.TITLE));
    assertTrue(map.containsKey(FieldMappings.LOCATION));
    assertNull(map.get(FieldMappings.LOCATION));
  }

  @Test void testOverridesReplaceDetectedRoles() {
    FieldMappings detected = FieldMappings.builder()
        .titlePath("name", 0.9)
        .timestampPath("created", 0.7)
        .build();
    FieldMappings overrides = FieldMappings.builder().titlePath("headline", null).build();
    FieldMappings merged = detected.withOverrides(overrides);

    assertEquals("headline", merged.getTitlePath());
    assertEquals("created", merged.getTimestampPath());
    assertEquals(0.0, merged.getConfidence(FieldMappings.TITLE));
    assertEquals(0.7, merged.getConfidence(FieldMappings.TIMESTAMP));
  }

  @Test void testFromMap() {
    FieldMappings mappings = FieldMappings.fromMap(ImmutableMap.of(
        FieldMappings.LATITUDE, "geo.lat",
        FieldMappings.LONGITUDE, "geo.lng",
        "unknownPath", "x"));
    assertEquals("geo.lat", mappings.getLatitudePath());
    assertEquals("geo.lng", mappings.getLongitudePath());
    assertNull(mappings.getTitlePath());
    assertEquals(mappings, FieldMappings.fromMap(mappings.toMap()));
  }

  @Test void testClearingARoleDropsItsConfidence() {
    FieldMappings mappings = FieldMappings.builder()
        .locationPath("address", 0.8)
        .build()
        .toBuilder()
        .locationPath(null, 0.5)
        .build();
    assertNull(mappings.getLocationPath());
    assertTrue(mappings.getConfidences().isEmpty());
  }
}
