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

import org.aperio.inference.stats.FieldStatistics;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link ProgressiveSchemaBuilder} accumulates, in a form that
 * can be written as JSON and handed to a new builder to resume.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE)
public class SchemaBuilderState {

  private int version = 1;
  private long recordCount;
  private int batchCount;
  private @Nullable Instant lastUpdated;
  private Map<String, FieldStatistics> fieldStats = new LinkedHashMap<>();
  private List<Map<String, Object>> dataSamples = new ArrayList<>();
  private List<String> detectedIdFields = new ArrayList<>();
  private Map<String, TypeConflict> typeConflicts = new LinkedHashMap<>();

  public SchemaBuilderState() {
  }

  /**
   * Creates a state from previously accumulated statistics alone. The
   * record count is taken as the largest occurrence count of a top-level
   * field.
   */
  public static SchemaBuilderState fromStatistics(Map<String, FieldStatistics> statistics) {
    SchemaBuilderState state = new SchemaBuilderState();
    long records = 0;
    for (FieldStatistics stats : statistics.values()) {
      state.fieldStats.put(stats.getPath(), stats.copy());
      if (stats.getDepth() == 0) {
        records = Math.max(records, stats.getOccurrences());
      }
    }
    state.recordCount = records;
    return state;
  }

  public int getVersion() {
    return version;
  }

  void incrementVersion() {
    version++;
  }

  public long getRecordCount() {
    return recordCount;
  }

  void addRecords(long count) {
    recordCount += count;
  }

  public int getBatchCount() {
    return batchCount;
  }

  void incrementBatchCount() {
    batchCount++;
  }

  public @Nullable Instant getLastUpdated() {
    return lastUpdated;
  }

  void setLastUpdated(Instant lastUpdated) {
    this.lastUpdated = lastUpdated;
  }

  /** Returns the live statistics map, keyed by field path. */
  public Map<String, FieldStatistics> getFieldStats() {
    return fieldStats;
  }

  /** Returns the most recent raw records, oldest first. */
  public List<Map<String, Object>> getDataSamples() {
    return dataSamples;
  }

  public List<String> getDetectedIdFields() {
    return detectedIdFields;
  }

  void setDetectedIdFields(List<String> detectedIdFields) {
    this.detectedIdFields = new ArrayList<>(detectedIdFields);
  }

  public Map<String, TypeConflict> getTypeConflicts() {
    return typeConflicts;
  }

  @Override public String toString() {
    return "SchemaBuilderState{version=" + version
        + ", records=" + recordCount
        + ", batches=" + batchCount
        + ", fields=" + fieldStats.size() + "}";
  }
}
