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

import org.aperio.inference.value.CellValue;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for RecordFlattener.
 */
@Tag("unit")
public class RecordFlattenerTest {

  @Test void testNestedObjectsAndArrays() {
    Map<String, Object> record = ImmutableMap.<String, Object>of(
        "name", "Fair",
        "venue", ImmutableMap.of("city", "Lyon", "address", ImmutableMap.of("zip", "69001")),
        "tags", Arrays.asList("food", "music"),
        "slots", Collections.singletonList(ImmutableMap.of("start", "10:00")));
    Map<String, CellValue> flat = new RecordFlattener(3).flatten(record);
    assertEquals(Arrays.asList("name", "venue", "venue.city", "venue.address",
        "venue.address.zip", "tags", "slots", "slots[].start"),
        Arrays.asList(flat.keySet().toArray()));
    assertEquals(CellValue.Kind.OBJECT, flat.get("venue").getKind());
    assertEquals("Lyon", flat.get("venue.city").asText());
  }

  @Test void testDepthLimit() {
    Map<String, Object> record = ImmutableMap.<String, Object>of(
        "a", ImmutableMap.of("b", ImmutableMap.of("c", 1)));
    assertEquals(Arrays.asList("a", "a.b"),
        Arrays.asList(new RecordFlattener(2).flatten(record).keySet().toArray()));
  }

  @Test void testRejectsZeroDepth() {
    assertThrows(IllegalArgumentException.class, () -> new RecordFlattener(0));
  }
}
