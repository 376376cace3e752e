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

import org.aperio.inference.geo.GeoColumnDetector;
import org.aperio.inference.geo.GeoColumnResult;
import org.aperio.inference.mapping.FieldMappingDetector;
import org.aperio.inference.mapping.FieldMappings;
import org.aperio.inference.mapping.LanguageDetectionResult;
import org.aperio.inference.mapping.LanguageDetector;
import org.aperio.inference.mapping.LanguageSamples;
import org.aperio.inference.schema.BatchResult;
import org.aperio.inference.schema.ProgressiveSchemaBuilder;
import org.aperio.inference.schema.SchemaBuilderState;
import org.aperio.inference.schema.SchemaComparator;
import org.aperio.inference.schema.SchemaComparison;
import org.aperio.inference.schema.SchemaStateCodec;
import org.aperio.inference.schema.StructuralSchema;
import org.aperio.inference.similarity.TransformDetector;
import org.aperio.inference.similarity.TransformSuggestion;
import org.aperio.inference.similarity.UploadedSchema;
import org.aperio.inference.stats.FieldStatistics;
import org.aperio.inference.stats.FieldStatisticsCodec;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point for inferring the schema and field roles of a dataset that
 * arrives in batches.
 *
 * <p>The engine owns a {@link ProgressiveSchemaBuilder}. Callers feed it
 * batches, then ask for the geo columns, field mappings, schema or rename
 * suggestions against a stored schema. Between runs they persist either the
 * statistics map ({@link #serializeStatistics()}) or the full builder state
 * ({@link #serializeState()}) and hand it to a new engine.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * SchemaInferenceEngine engine = new SchemaInferenceEngine(DetectionConfig.defaults());
 * engine.processBatch(rows);
 * FieldMappings mappings = engine.detectFieldMappings("eng");
 * String saved = engine.serializeStatistics();
 * }</pre>
 *
 * <p>Not thread-safe; use one engine per dataset and merge statistics with
 * {@link org.aperio.inference.stats.FieldStatisticsTracker#mergeAll}.
 */
public class SchemaInferenceEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaInferenceEngine.class);

  private final DetectionConfig config;
  private final ProgressiveSchemaBuilder builder;
  private final GeoColumnDetector geoDetector;
  private final FieldMappingDetector mappingDetector;
  private final TransformDetector transformDetector;

  public SchemaInferenceEngine(DetectionConfig config) {
    this(config, new SchemaBuilderState());
  }

  /**
   * Creates an engine that continues from previously accumulated
   * statistics.
   */
  public SchemaInferenceEngine(DetectionConfig config, Map<String, FieldStatistics> prior) {
    this(config, SchemaBuilderState.fromStatistics(prior));
  }

  private SchemaInferenceEngine(DetectionConfig config, SchemaBuilderState state) {
    if (config == null) {
      throw new IllegalArgumentException("config is required");
    }
    this.config = config;
    this.builder = new ProgressiveSchemaBuilder(state, config);
    this.geoDetector = new GeoColumnDetector(config);
    this.mappingDetector = new FieldMappingDetector(config);
    this.transformDetector = new TransformDetector(config);
  }

  /**
   * Creates an engine from a statistics map written by
   * {@link #serializeStatistics()}.
   *
   * @throws SchemaInferenceException if the JSON cannot be read
   */
  public static SchemaInferenceEngine fromSerializedStatistics(String json,
      DetectionConfig config) {
    Map<String, FieldStatistics> statistics = FieldStatisticsCodec.read(json);
    LOGGER.info("Resuming from statistics for {} fields", statistics.size());
    return new SchemaInferenceEngine(config, statistics);
  }

  /**
   * Creates an engine from builder state written by
   * {@link #serializeState()}.
   *
   * @throws SchemaInferenceException if the JSON cannot be read
   */
  public static SchemaInferenceEngine resume(String stateJson, DetectionConfig config) {
    SchemaBuilderState state = SchemaStateCodec.read(stateJson);
    LOGGER.info("Resuming schema version {} after {} records", state.getVersion(),
        state.getRecordCount());
    return new SchemaInferenceEngine(config, state);
  }

  public DetectionConfig getConfig() {
    return config;
  }

  /**
   * Folds a batch of rows into the statistics.
   *
   * @throws IllegalArgumentException if the batch or a row is null
   */
  public BatchResult processBatch(List<? extends Map<String, ?>> rows) {
    return builder.processBatch(rows);
  }

  /**
   * Detects coordinate columns from the buffered sample rows.
   */
  public GeoColumnResult detectGeoColumns() {
    return geoDetector.detectGeoColumns(builder.getSampleHeaders(),
        builder.getState().getDataSamples());
  }

  /**
   * Validates columns the user picked as latitude and longitude against the
   * buffered sample rows.
   */
  public GeoColumnResult validateManualSelection(String latColumn, String lonColumn) {
    return geoDetector.validateManualSelection(builder.getState().getDataSamples(), latColumn,
        lonColumn);
  }

  /**
   * Detects field roles for a dataset language, using coordinate columns
   * found in the sample rows when there are any.
   *
   * @param language ISO 639-3 code; null means English
   */
  public FieldMappings detectFieldMappings(@Nullable String language) {
    GeoColumnResult geo = detectGeoColumns();
    return mappingDetector.detectFieldMappings(builder.getFieldStatistics(), language, geo);
  }

  /**
   * Detects the language of the buffered sample rows.
   */
  public LanguageDetectionResult detectLanguage(LanguageDetector detector) {
    return LanguageSamples.detect(detector, builder.getState().getDataSamples(),
        builder.getSampleHeaders());
  }

  public StructuralSchema getSchema() {
    return builder.getSchema();
  }

  public SchemaComparison compareWith(StructuralSchema previous) {
    return builder.compareWith(previous);
  }

  /**
   * Suggests renames that would map the current columns onto a stored
   * schema.
   */
  public List<TransformSuggestion> suggestTransforms(StructuralSchema previous) {
    StructuralSchema current = getSchema();
    SchemaComparison comparison = SchemaComparator.compare(previous, current);
    return transformDetector.detectTransforms(previous, current, comparison);
  }

  /**
   * Describes the data seen so far for similarity ranking.
   */
  public UploadedSchema toUploadedSchema() {
    return new UploadedSchema(builder.getSampleHeaders(), builder.getState().getDataSamples(),
        builder.getState().getRecordCount());
  }

  public Map<String, FieldStatistics> getFieldStatistics() {
    return builder.getFieldStatistics();
  }

  public SchemaBuilderState getState() {
    return builder.getState();
  }

  public String serializeStatistics() {
    return FieldStatisticsCodec.write(builder.getState().getFieldStats());
  }

  public String serializeState() {
    return SchemaStateCodec.write(builder.getState());
  }
}
