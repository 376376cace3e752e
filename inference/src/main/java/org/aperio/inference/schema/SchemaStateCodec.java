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

import org.aperio.inference.SchemaInferenceException;
import org.aperio.inference.stats.FieldStatisticsCodec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link SchemaBuilderState} as JSON.
 */
public final class SchemaStateCodec {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaStateCodec.class);

  private static final ObjectMapper MAPPER = FieldStatisticsCodec.newObjectMapper();

  private SchemaStateCodec() {
  }

  public static String write(SchemaBuilderState state) {
    try {
      return MAPPER.writeValueAsString(state);
    } catch (JsonProcessingException e) {
      throw new SchemaInferenceException("Cannot serialize schema builder state", e);
    }
  }

  /**
   * Parses builder state.
   *
   * @throws SchemaInferenceException if the JSON is malformed or its
   *     statistics are inconsistent
   */
  public static SchemaBuilderState read(String json) {
    if (json == null || json.trim().isEmpty()) {
      throw new SchemaInferenceException("Serialized schema builder state is empty");
    }
    SchemaBuilderState state;
    try {
      state = MAPPER.readValue(json, SchemaBuilderState.class);
    } catch (JsonProcessingException e) {
      throw new SchemaInferenceException("Cannot parse schema builder state: "
          + e.getOriginalMessage(), e);
    }
    if (state == null) {
      throw new SchemaInferenceException("Serialized schema builder state is null");
    }
    FieldStatisticsCodec.check(state.getFieldStats());
    LOGGER.debug("Restored {}", state);
    return state;
  }

  public static void write(Path file, SchemaBuilderState state) {
    try {
      Files.write(file, write(state).getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SchemaInferenceException("Cannot write schema builder state to " + file, e);
    }
  }

  public static SchemaBuilderState read(Path file) {
    try {
      return read(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SchemaInferenceException("Cannot read schema builder state from " + file, e);
    }
  }
}
