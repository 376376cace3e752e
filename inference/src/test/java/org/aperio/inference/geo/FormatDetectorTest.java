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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FormatDetector.
 */
@Tag("unit")
public class FormatDetectorTest {

  private final FormatDetector detector = new FormatDetector();

  @Test void testDetectsCommaFormat() {
    List<String> samples = Arrays.asList("40.7128,-74.0060", "51.5074, -0.1278",
        "48.8566,2.3522", "");
    FormatDetectionResult result = detector.detect(samples);
    assertTrue(result.isAccepted());
    assertEquals(CoordinateFormat.COMBINED_COMMA, result.getFormat());
    assertEquals(1.0, result.getConfidence(), 1e-9);
  }

  @Test void testDetectsSpaceFormat() {
    List<String> samples = Arrays.asList("40.7128 -74.0060", "51.5074 -0.1278",
        "48.8566 2.3522");
    FormatDetectionResult result = detector.detect(samples);
    assertTrue(result.isAccepted());
    assertEquals(CoordinateFormat.COMBINED_SPACE, result.getFormat());
  }

  @Test void testDetectsGeoJson() {
    List<Object> samples = Arrays.asList(
        "{\"type\":\"Point\",\"coordinates\":[-74.006,40.7128]}",
        ImmutableMap.of("type", "Point", "coordinates", Arrays.asList(-0.1278, 51.5074)));
    FormatDetectionResult result = detector.detect(samples);
    assertTrue(result.isAccepted());
    assertEquals(CoordinateFormat.GEOJSON, result.getFormat());
  }

  @Test void testDetectsBrackets() {
    List<String> samples = Arrays.asList("[40.7128, -74.0060]", "[51.5074,-0.1278]");
    FormatDetectionResult result = detector.detect(samples);
    assertTrue(result.isAccepted());
    assertEquals(CoordinateFormat.BRACKETS, result.getFormat());
  }

  @Test void testBelowAcceptanceRatio() {
    List<String> samples = Arrays.asList("40.7128,-74.0060", "51.5074,-0.1278",
        "near the station", "unknown");
    FormatDetectionResult comma = detector.checkCommaFormat(samples);
    assertEquals(0.5, comma.getConfidence(), 1e-9);
    assertFalse(comma.isAccepted());

    FormatDetectionResult result = detector.detect(samples);
    assertFalse(result.isAccepted());
    assertEquals(CoordinateFormat.UNKNOWN, result.getFormat());
    assertEquals(0.0, result.getConfidence());
  }

  @Test void testOutOfRangeValuesDoNotCount() {
    List<String> samples = Arrays.asList("95.0,10.0", "0,0", "40.7128,-74.0060");
    assertEquals(1.0 / 3, detector.checkCommaFormat(samples).getConfidence(), 1e-9);
  }

  @Test void testNoSamples() {
    FormatDetectionResult result = detector.checkSpaceFormat(Collections.emptyList());
    assertFalse(result.isAccepted());
    assertEquals(0.0, result.getConfidence());
  }

  @Test void testRestrictedToOneFormat() {
    List<String> samples = Arrays.asList("40.7128,-74.0060", "51.5074,-0.1278");
    assertFalse(detector.detect(samples, CoordinateFormat.BRACKETS).isAccepted());
    assertEquals(CoordinateFormat.COMBINED_COMMA,
        detector.detect(samples, CoordinateFormat.COMBINED_COMMA).getFormat());
  }
}
