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

import org.aperio.inference.geo.GeoColumnResult;
import org.aperio.inference.mapping.FieldMappings;
import org.aperio.inference.mapping.LanguageDetectionResult;
import org.aperio.inference.schema.BatchResult;
import org.aperio.inference.schema.ChangeType;
import org.aperio.inference.schema.SchemaChange;
import org.aperio.inference.schema.StructuralSchema;
import org.aperio.inference.similarity.TransformSuggestion;
import org.aperio.inference.similarity.UploadedSchema;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SchemaInferenceEngine.
 */
@Tag("unit")
public class SchemaInferenceEngineTest {

  private static final double[][] CITIES = {
      {40.7128, -74.0060},
      {51.5074, -0.1278},
      {48.8566, 2.3522},
      {35.6762, 139.6503},
      {-33.8688, 151.2093},
      {52.5200, 13.4050}
  };

  private static final String[] TITLES = {
      "Summer Music Festival", "Open Air Cinema Night", "Harbour Lights Parade",
      "Spring Flower Show", "Autumn Food Market", "Winter Jazz Evening"
  };

  private static List<Map<String, Object>> events() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < CITIES.length; i++) {
      rows.add(ImmutableMap.<String, Object>of(
          "title", TITLES[i],
          "date", "2024-06-0" + (i + 1),
          "lat", CITIES[i][0],
          "lon", CITIES[i][1]));
    }
    return rows;
  }

  private static SchemaInferenceEngine loaded() {
    SchemaInferenceEngine engine = new SchemaInferenceEngine(DetectionConfig.defaults());
    engine.processBatch(events());
    return engine;
  }

  @Test void testProcessBatch() {
    SchemaInferenceEngine engine = new SchemaInferenceEngine(DetectionConfig.defaults());
    BatchResult result = engine.processBatch(events());
    assertTrue(result.isSchemaChanged());
    assertEquals(6, result.getRecordsProcessed());
    assertEquals(2, result.getVersion());
    List<String> added = new ArrayList<>();
    for (SchemaChange change : result.getChanges()) {
      assertEquals(ChangeType.NEW_FIELD, change.getType());
      added.add(change.getPath());
    }
    assertEquals(Arrays.asList("title", "date", "lat", "lon"), added);

    StructuralSchema schema = engine.getSchema();
    assertEquals(Arrays.asList("title", "date", "lat", "lon"), schema.getFieldNames());
    assertTrue(schema.isRequired("title"));
    assertEquals(6, engine.getState().getRecordCount());
  }

  @Test void testRejectsNullBatch() {
    SchemaInferenceEngine engine = new SchemaInferenceEngine(DetectionConfig.defaults());
    assertThrows(IllegalArgumentException.class, () -> engine.processBatch(null));
    assertThrows(IllegalArgumentException.class,
        () -> new SchemaInferenceEngine(null));
  }

  @Test void testDetectGeoColumns() {
    SchemaInferenceEngine engine = loaded();
    GeoColumnResult geo = engine.detectGeoColumns();
    assertTrue(geo.isFound());
    assertEquals("lat", geo.getLatColumn());
    assertEquals("lon", geo.getLonColumn());
    assertFalse(geo.isSwappedCoordinates());

    assertTrue(engine.validateManualSelection("lat", "lon").isFound());
    assertFalse(engine.validateManualSelection("title", "date").isFound());
  }

  @Test void testDetectFieldMappings() {
    FieldMappings mappings = loaded().detectFieldMappings("eng");
    assertEquals("title", mappings.getTitlePath());
    assertEquals("date", mappings.getTimestampPath());
    assertEquals("lat", mappings.getLatitudePath());
    assertEquals("lon", mappings.getLongitudePath());
  }

  @Test void testDetectLanguage() {
    SchemaInferenceEngine engine = loaded();
    LanguageDetectionResult detected =
        engine.detectLanguage(text -> new LanguageDetectionResult("eng", 0.95));
    assertEquals("eng", detected.getCode());

    LanguageDetectionResult unsure =
        engine.detectLanguage(text -> LanguageDetectionResult.undetermined());
    assertEquals(LanguageDetectionResult.UNDETERMINED_CODE, unsure.getCode());
  }

  @Test void testResumeFromStatistics() {
    String json = loaded().serializeStatistics();
    SchemaInferenceEngine resumed =
        SchemaInferenceEngine.fromSerializedStatistics(json, DetectionConfig.defaults());
    assertEquals(4, resumed.getFieldStatistics().size());
    assertEquals(6, resumed.getFieldStatistics().get("title").getOccurrences());

    resumed.processBatch(events());
    assertEquals(12, resumed.getFieldStatistics().get("title").getOccurrences());
  }

  @Test void testResumeFromState() {
    String json = loaded().serializeState();
    SchemaInferenceEngine resumed = SchemaInferenceEngine.resume(json, DetectionConfig.defaults());
    assertEquals(2, resumed.getState().getVersion());
    assertEquals(6, resumed.getState().getRecordCount());

    BatchResult result = resumed.processBatch(ImmutableList.of(
        ImmutableMap.<String, Object>of("title", "Late Show", "venue", "Town Hall")));
    assertEquals(3, result.getVersion());
    assertEquals(7, resumed.getState().getRecordCount());
  }

  @Test void testResumeFromMalformedJson() {
    assertThrows(SchemaInferenceException.class,
        () -> SchemaInferenceEngine.fromSerializedStatistics("{not json",
            DetectionConfig.defaults()));
    assertThrows(SchemaInferenceException.class,
        () -> SchemaInferenceEngine.resume("[]", DetectionConfig.defaults()));
  }

  @Test void testSuggestTransforms() {
    StructuralSchema stored = StructuralSchema.builder()
        .field("title", "string")
        .field("start_date", "string")
        .field("lat", "number")
        .field("lon", "number")
        .build();
    List<TransformSuggestion> suggestions = loaded().suggestTransforms(stored);
    assertEquals(1, suggestions.size());
    assertEquals("date", suggestions.get(0).getFrom());
    assertEquals("start_date", suggestions.get(0).getTo());
    assertTrue(suggestions.get(0).getConfidence() >= 80);
  }

  @Test void testToUploadedSchema() {
    UploadedSchema uploaded = loaded().toUploadedSchema();
    assertEquals(Arrays.asList("title", "date", "lat", "lon"), uploaded.getHeaders());
    assertEquals(6, uploaded.getRowCount());
    assertEquals(6, uploaded.getSampleData().size());
    assertEquals("Summer Music Festival", uploaded.valuesOf("title").get(0));
  }
}
