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
package org.aperio.inference.stats;

import org.aperio.inference.SchemaInferenceException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the path-to-statistics map as JSON.
 *
 * <p>The caller persists this JSON between runs and hands it back to a new
 * engine, so field order and every counter round-trip exactly.
 */
public final class FieldStatisticsCodec {
  private static final Logger LOGGER = LoggerFactory.getLogger(FieldStatisticsCodec.class);

  private static final ObjectMapper MAPPER = newObjectMapper();

  private static final TypeReference<LinkedHashMap<String, FieldStatistics>> MAP_TYPE =
      new TypeReference<LinkedHashMap<String, FieldStatistics>>() {
      };

  private FieldStatisticsCodec() {
  }

  /**
   * Creates an object mapper configured for inference state: ISO-8601
   * instants, and whole numbers read as {@code Long} so restored samples
   * compare equal to freshly observed ones.
   */
  public static ObjectMapper newObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.enable(DeserializationFeature.USE_LONG_FOR_INTS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return mapper;
  }

  public static String write(Map<String, FieldStatistics> statistics) {
    try {
      return MAPPER.writeValueAsString(statistics);
    } catch (JsonProcessingException e) {
      throw new SchemaInferenceException("Cannot serialize field statistics", e);
    }
  }

  /**
   * Parses a statistics map.
   *
   * @throws SchemaInferenceException if the JSON is malformed or the
   *     statistics are inconsistent
   */
  public static Map<String, FieldStatistics> read(String json) {
    if (json == null || json.trim().isEmpty()) {
      throw new SchemaInferenceException("Serialized field statistics are empty");
    }
    Map<String, FieldStatistics> statistics;
    try {
      statistics = MAPPER.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new SchemaInferenceException("Cannot parse field statistics: "
          + e.getOriginalMessage(), e);
    }
    if (statistics == null) {
      throw new SchemaInferenceException("Serialized field statistics are null");
    }
    check(statistics);
    LOGGER.debug("Restored statistics for {} fields", statistics.size());
    return statistics;
  }

  public static void write(Path file, Map<String, FieldStatistics> statistics) {
    try {
      Files.write(file, write(statistics).getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SchemaInferenceException("Cannot write field statistics to " + file, e);
    }
  }

  public static Map<String, FieldStatistics> read(Path file) {
    try {
      return read(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SchemaInferenceException("Cannot read field statistics from " + file, e);
    }
  }

  /**
   * Checks restored statistics against their invariants.
   *
   * @throws SchemaInferenceException if a field is inconsistent
   */
  public static void check(Map<String, FieldStatistics> statistics) {
    for (Map.Entry<String, FieldStatistics> entry : statistics.entrySet()) {
      FieldStatistics stats = entry.getValue();
      if (stats == null || !entry.getKey().equals(stats.getPath())) {
        throw new SchemaInferenceException("Statistics entry " + entry.getKey()
            + " does not describe that path");
      }
      try {
        stats.checkInvariants();
      } catch (IllegalStateException e) {
        throw new SchemaInferenceException(e.getMessage(), e);
      }
    }
  }
}
