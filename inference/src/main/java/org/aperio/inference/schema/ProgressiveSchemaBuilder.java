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
package org.aperio.inference.schema;

import org.aperio.inference.DetectionConfig;
import org.aperio.inference.stats.EnumValue;
import org.aperio.inference.stats.FieldStatistics;
import org.aperio.inference.stats.FieldStatisticsTracker;
import org.aperio.inference.stats.NumericStats;
import org.aperio.inference.stats.TypeTag;
import org.aperio.inference.value.CellValue;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers a structural schema from batches of records without holding the
 * whole dataset.
 *
 * <p>Each batch is counted into fresh statistics that are then merged into
 * the accumulated ones, so a builder resumed from serialized state ends up
 * exactly where an uninterrupted builder would. After every batch the builder
 * refreshes enum candidates and identifier fields, and bumps the schema
 * version when fields appeared or a field received a new type.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * ProgressiveSchemaBuilder builder = new ProgressiveSchemaBuilder(config);
 * for (List<Map<String, Object>> batch : batches) {
 *   BatchResult result = builder.processBatch(batch);
 * }
 * StructuralSchema schema = builder.getSchema();
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public class ProgressiveSchemaBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressiveSchemaBuilder.class);

  private static final Map<String, String> JSON_SCHEMA_TYPES =
      ImmutableMap.<String, String>builder()
          .put(TypeTag.STRING.getTag(), "string")
          .put(TypeTag.DATE.getTag(), "string")
          .put(TypeTag.BOOLEAN_STRING.getTag(), "string")
          .put(TypeTag.INTEGER.getTag(), "integer")
          .put(TypeTag.NUMBER.getTag(), "number")
          .put(TypeTag.BOOLEAN.getTag(), "boolean")
          .put(TypeTag.ARRAY.getTag(), "array")
          .put(TypeTag.OBJECT.getTag(), "object")
          .build();

  private final DetectionConfig config;
  private final RecordFlattener flattener;
  private final SchemaBuilderState state;

  public ProgressiveSchemaBuilder() {
    this(DetectionConfig.defaults());
  }

  public ProgressiveSchemaBuilder(DetectionConfig config) {
    this(new SchemaBuilderState(), config);
  }

  /**
   * Creates a builder that continues from saved state.
   */
  public ProgressiveSchemaBuilder(SchemaBuilderState state, DetectionConfig config) {
    if (state == null || config == null) {
      throw new IllegalArgumentException("state and config are required");
    }
    this.config = config;
    this.flattener = new RecordFlattener(config.getMaxDepth());
    this.state = state;
  }

  /**
   * Folds a batch of records into the schema.
   *
   * @param records Records keyed by column name
   * @return Changes the batch caused
   * @throws IllegalArgumentException if the batch or a record is null
   */
  public BatchResult processBatch(List<? extends Map<String, ?>> records) {
    if (records == null) {
      throw new IllegalArgumentException("Batch must not be null");
    }

    List<SchemaChange> changes = new ArrayList<>();
    Map<String, FieldStatistics> batchStats = new LinkedHashMap<>();
    for (Map<String, ?> record : records) {
      if (record == null) {
        throw new IllegalArgumentException("Batch contains a null record");
      }
      processRecord(record, batchStats, changes);
      addSample(record);
    }

    Map<String, FieldStatistics> merged = FieldStatisticsTracker.mergeAll(
        state.getFieldStats(), batchStats, config.getMaxUniqueValues());
    state.getFieldStats().clear();
    state.getFieldStats().putAll(merged);

    state.addRecords(records.size());
    state.incrementBatchCount();
    state.setLastUpdated(Instant.now());

    for (FieldStatistics stats : state.getFieldStats().values()) {
      stats.setOccurrencePercent(state.getRecordCount() == 0
          ? 0 : stats.getOccurrences() * 100d / state.getRecordCount());
    }
    detectIdFields();
    detectEnums();

    for (SchemaChange change : changes) {
      if (change.getType() == ChangeType.NEW_FIELD
          || change.getType() == ChangeType.TYPE_CHANGE) {
        state.incrementVersion();
        break;
      }
    }

    LOGGER.info("Processed batch {} with {} records: {} fields, {} changes, version {}",
        state.getBatchCount(), records.size(), state.getFieldStats().size(),
        changes.size(), state.getVersion());
    return new BatchResult(changes, records.size(), state.getVersion());
  }

  private void processRecord(Map<String, ?> record, Map<String, FieldStatistics> batchStats,
      List<SchemaChange> changes) {
    for (Map.Entry<String, CellValue> entry : flattener.flatten(record).entrySet()) {
      String path = entry.getKey();
      CellValue value = entry.getValue();
      FieldStatistics known = state.getFieldStats().get(path);
      FieldStatistics local = batchStats.get(path);

      if (local == null) {
        local = FieldStatisticsTracker.create(path);
        batchStats.put(path, local);
        if (known == null) {
          changes.add(
              new SchemaChange(ChangeType.NEW_FIELD, path,
                  "New field '" + path + "' detected",
                  ImmutableMap.of("type", TypeTag.of(value).getTag()),
                  Severity.INFO, true));
          if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("New field {} ({})", path, TypeTag.of(value).getTag());
          }
        }
      }
      checkTypeConflict(path, value, known, local, changes);
      FieldStatisticsTracker.update(local, value, config.getMaxUniqueValues());
    }
  }

  private void checkTypeConflict(String path, CellValue value, @Nullable FieldStatistics known,
      FieldStatistics local, List<SchemaChange> changes) {
    TypeTag tag = TypeTag.of(value);
    if (tag == TypeTag.NULL || tag == TypeTag.UNDEFINED) {
      return;
    }
    Map<String, Long> distribution = new LinkedHashMap<>();
    if (known != null) {
      addAll(distribution, known.getTypeDistribution());
    }
    addAll(distribution, local.getTypeDistribution());
    if (distribution.containsKey(tag.getTag())) {
      return;
    }

    List<String> existing = new ArrayList<>();
    for (Map.Entry<String, Long> entry : distribution.entrySet()) {
      if (entry.getValue() > 0
          && !entry.getKey().equals(TypeTag.NULL.getTag())
          && !entry.getKey().equals(TypeTag.UNDEFINED.getTag())) {
        existing.add(entry.getKey());
      }
    }
    if (existing.isEmpty()) {
      return;
    }

    changes.add(
        new SchemaChange(ChangeType.TYPE_CHANGE, path,
            "Field '" + path + "' received " + tag.getTag() + " values, previously "
                + String.join(", ", existing),
            ImmutableMap.<String, Object>of("existingTypes", existing, "newType", tag.getTag()),
            Severity.WARNING, false));
    TypeConflict conflict = state.getTypeConflicts().get(path);
    if (conflict == null) {
      conflict = new TypeConflict(path, null, null);
      state.getTypeConflicts().put(path, conflict);
    }
    distribution.merge(tag.getTag(), 1L, Long::sum);
    conflict.record(distribution, tag.getTag(), value.toJavaObject());
    LOGGER.warn("Type conflict on {}: {} after {}", path, tag.getTag(), existing);
  }

  private static void addAll(Map<String, Long> target, Map<String, Long> counts) {
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      target.merge(entry.getKey(), entry.getValue(), Long::sum);
    }
  }

  @SuppressWarnings("unchecked")
  private void addSample(Map<String, ?> record) {
    Object sample = CellValue.of(record).toJavaObject();
    state.getDataSamples().add((Map<String, Object>) sample);
    while (state.getDataSamples().size() > config.getMaxSamples()) {
      state.getDataSamples().remove(0);
    }
  }

  private void detectIdFields() {
    List<String> ids = new ArrayList<>();
    for (FieldStatistics stats : state.getFieldStats().values()) {
      if (FieldStatisticsTracker.isIdField(stats, state.getRecordCount())) {
        ids.add(stats.getPath());
      }
    }
    state.setDetectedIdFields(ids);
  }

  private void detectEnums() {
    for (FieldStatistics stats : state.getFieldStats().values()) {
      FieldStatisticsTracker.detectEnum(stats, config.getEnumThreshold(), config.getEnumMode());
    }
  }

  /**
   * Builds the schema implied by the statistics so far.
   */
  public StructuralSchema getSchema() {
    StructuralSchema.Builder builder = StructuralSchema.builder();
    long records = state.getRecordCount();
    for (FieldStatistics stats : state.getFieldStats().values()) {
      builder.field(stats.getPath(), toDefinition(stats));
      if (records > 0
          && stats.getOccurrences() >= records * config.getRequiredFieldRatio()) {
        builder.required(stats.getPath());
      }
    }
    return builder.build();
  }

  private static FieldDefinition toDefinition(FieldStatistics stats) {
    List<Map.Entry<String, Long>> entries =
        new ArrayList<>(stats.getTypeDistribution().entrySet());
    entries.sort((a, b) -> Long.compare(b.getValue(), a.getValue()));
    Set<String> types = new LinkedHashSet<>();
    for (Map.Entry<String, Long> entry : entries) {
      String type = JSON_SCHEMA_TYPES.get(entry.getKey());
      if (type != null && entry.getValue() > 0) {
        types.add(type);
      }
    }
    if (types.isEmpty()) {
      types.add("null");
    }

    List<Object> enumValues = null;
    if (stats.isEnumCandidate() && stats.getEnumValues() != null) {
      enumValues = new ArrayList<>();
      for (EnumValue value : stats.getEnumValues()) {
        enumValues.add(value.getValue());
      }
    }
    NumericStats numeric = stats.getNumericStats();
    return new FieldDefinition(new ArrayList<>(types), stats.getNullCount() > 0, enumValues,
        numeric == null ? null : numeric.getMin(),
        numeric == null ? null : numeric.getMax());
  }

  /**
   * Compares a stored schema with the current one.
   */
  public SchemaComparison compareWith(StructuralSchema previous) {
    return SchemaComparator.compare(previous, getSchema());
  }

  /**
   * Returns the live state; serialize it with {@link SchemaStateCodec} to
   * resume later.
   */
  public SchemaBuilderState getState() {
    return state;
  }

  public Map<String, FieldStatistics> getFieldStatistics() {
    return Collections.unmodifiableMap(state.getFieldStats());
  }

  public List<String> getDetectedIdFields() {
    return Collections.unmodifiableList(state.getDetectedIdFields());
  }

  public Map<String, TypeConflict> getTypeConflicts() {
    return Collections.unmodifiableMap(state.getTypeConflicts());
  }

  /**
   * Returns the paths of fields that currently look like enums.
   */
  public List<String> getEnumFields() {
    List<String> paths = new ArrayList<>();
    for (FieldStatistics stats : state.getFieldStats().values()) {
      if (stats.isEnumCandidate()) {
        paths.add(stats.getPath());
      }
    }
    return paths;
  }

  /**
   * Returns the column names of the buffered sample records, in first-seen
   * order.
   */
  public List<String> getSampleHeaders() {
    Set<String> headers = new LinkedHashSet<>();
    for (Map<String, Object> sample : state.getDataSamples()) {
      headers.addAll(sample.keySet());
    }
    return new ArrayList<>(headers);
  }
}
