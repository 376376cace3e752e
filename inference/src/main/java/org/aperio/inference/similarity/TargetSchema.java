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
package org.aperio.inference.similarity;

import org.aperio.inference.mapping.FieldMappings;
import org.aperio.inference.schema.FieldDefinition;
import org.aperio.inference.schema.StructuralSchema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An existing dataset that an upload could be imported into.
 */
public class TargetSchema {
  private final String datasetId;
  private final String datasetName;
  private final String language;
  private final List<String> fields;
  private final Map<String, String> fieldTypes;
  private final boolean hasGeoFields;
  private final boolean hasDateFields;

  private TargetSchema(Builder builder, String datasetId) {
    this.datasetId = datasetId;
    this.datasetName = builder.datasetName;
    this.language = builder.language;
    this.fields = ImmutableList.copyOf(builder.fields);
    this.fieldTypes = ImmutableMap.copyOf(builder.fieldTypes);
    this.hasGeoFields = builder.hasGeoFields;
    this.hasDateFields = builder.hasDateFields;
  }

  /**
   * Describes a stored dataset from its schema and mappings. Mapped paths
   * missing from the schema are added as fields; mapped coordinates or
   * location mark geo fields, a mapped timestamp marks date fields.
   */
  public static TargetSchema fromSchema(String datasetId, String datasetName, String language,
      StructuralSchema schema, FieldMappings mappings) {
    Builder builder = builder()
        .datasetId(datasetId)
        .datasetName(datasetName)
        .language(language);
    for (Map.Entry<String, FieldDefinition> entry : schema.getFields().entrySet()) {
      builder.field(entry.getKey(),
          TypeCompatibility.normalize(entry.getValue().getTypeLabel()));
    }
    for (String path : mappings.toMap().values()) {
      if (path != null && !schema.hasField(path)) {
        builder.field(path, null);
      }
    }
    return builder
        .hasGeoFields(mappings.getLatitudePath() != null || mappings.getLongitudePath() != null
            || mappings.getLocationPath() != null)
        .hasDateFields(mappings.getTimestampPath() != null)
        .build();
  }

  public String getDatasetId() {
    return datasetId;
  }

  public String getDatasetName() {
    return datasetName;
  }

  public String getLanguage() {
    return language;
  }

  public List<String> getFields() {
    return fields;
  }

  /** Declared types by field; fields without a known type are absent. */
  public Map<String, String> getFieldTypes() {
    return fieldTypes;
  }

  public boolean hasGeoFields() {
    return hasGeoFields;
  }

  public boolean hasDateFields() {
    return hasDateFields;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for TargetSchema.
   */
  public static class Builder {
    private @Nullable String datasetId;
    private String datasetName = "";
    private String language = "eng";
    private final List<String> fields = new ArrayList<>();
    private final Map<String, String> fieldTypes = new LinkedHashMap<>();
    private boolean hasGeoFields;
    private boolean hasDateFields;

    public Builder datasetId(String datasetId) {
      this.datasetId = datasetId;
      return this;
    }

    public Builder datasetName(String datasetName) {
      this.datasetName = datasetName;
      return this;
    }

    public Builder language(String language) {
      this.language = language;
      return this;
    }

    /**
     * Adds a field; a null type leaves it untyped.
     */
    public Builder field(String name, @Nullable String type) {
      if (!fields.contains(name)) {
        fields.add(name);
      }
      if (type != null) {
        fieldTypes.put(name, type);
      }
      return this;
    }

    public Builder fields(List<String> names) {
      for (String name : names) {
        field(name, null);
      }
      return this;
    }

    public Builder hasGeoFields(boolean hasGeoFields) {
      this.hasGeoFields = hasGeoFields;
      return this;
    }

    public Builder hasDateFields(boolean hasDateFields) {
      this.hasDateFields = hasDateFields;
      return this;
    }

    public TargetSchema build() {
      String id = datasetId;
      if (id == null || id.isEmpty()) {
        throw new IllegalArgumentException("datasetId is required");
      }
      if (language == null || language.isEmpty()) {
        throw new IllegalArgumentException("language is required");
      }
      return new TargetSchema(this, id);
    }
  }
}
