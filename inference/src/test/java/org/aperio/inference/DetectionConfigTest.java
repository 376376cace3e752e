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
package org.aperio.inference;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for DetectionConfig.
 */
@Tag("unit")
public class DetectionConfigTest {

  @Test void testDefaults() {
    DetectionConfig config = DetectionConfig.defaults();
    assertEquals(100, config.getMaxSamples());
    assertEquals(100, config.getMaxUniqueValues());
    assertEquals(50, config.getEnumThreshold());
    assertEquals(DetectionConfig.EnumMode.COUNT, config.getEnumMode());
    assertEquals(3, config.getMaxDepth());
    assertEquals(0.9, config.getRequiredFieldRatio(), 1e-9);
    assertEquals(10, config.getGeoSampleRows());
    assertEquals(20, config.getHeuristicSampleRows());
    assertTrue(config.isRejectZeroCoordinates());
    assertEquals(60, config.getRenameAcceptanceScore());
  }

  @Test void testFromMap() {
    Map<String, Object> map = ImmutableMap.<String, Object>builder()
        .put("maxSamples", 20)
        .put("enumThreshold", "10")
        .put("enumMode", "percentage")
        .put("requiredFieldRatio", "0.75")
        .put("rejectZeroCoordinates", "false")
        .put("renameAcceptanceScore", 70L)
        .build();
    DetectionConfig config = DetectionConfig.fromMap(map);
    assertEquals(20, config.getMaxSamples());
    assertEquals(10, config.getEnumThreshold());
    assertEquals(DetectionConfig.EnumMode.PERCENTAGE, config.getEnumMode());
    assertEquals(0.75, config.getRequiredFieldRatio(), 1e-9);
    assertFalse(config.isRejectZeroCoordinates());
    assertEquals(70, config.getRenameAcceptanceScore());
    assertEquals(100, config.getMaxUniqueValues());
  }

  @Test void testFromNullMap() {
    assertSame(DetectionConfig.defaults(), DetectionConfig.fromMap(null));
  }

  @Test void testInvalidValues() {
    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.fromMap(ImmutableMap.<String, Object>of("maxSamples", "many")));
    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.builder().maxSamples(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.builder().maxDepth(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.builder().requiredFieldRatio(1.5).build());
    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.builder()
            .enumMode(DetectionConfig.EnumMode.PERCENTAGE)
            .enumThreshold(150)
            .build());
    assertThrows(IllegalArgumentException.class,
        () -> DetectionConfig.builder().renameAcceptanceScore(120).build());
  }
}
