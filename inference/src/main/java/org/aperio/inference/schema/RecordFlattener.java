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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks a nested record into field paths.
 *
 * <p>Nested objects produce dotted paths ({@code address.city}). For an
 * array whose first element is an object, that element is walked under the
 * array's path with a {@code []} suffix ({@code items[].sku}). Objects and
 * arrays are reported under their own path as well, so their presence and
 * type are counted. Walking stops at the maximum depth.
 */
public class RecordFlattener {
  private static final String SEPARATOR = ".";
  private static final String ARRAY_SUFFIX = "[]";

  private final int maxDepth;

  public RecordFlattener(int maxDepth) {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be at least 1");
    }
    this.maxDepth = maxDepth;
  }

  /**
   * Flattens a record.
   *
   * @param record Row keyed by column name
   * @return Values keyed by field path, in walk order
   */
  public Map<String, CellValue> flatten(Map<String, ?> record) {
    Map<String, CellValue> output = new LinkedHashMap<>();
    Map<String, CellValue> fields = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : record.entrySet()) {
      fields.put(entry.getKey(), CellValue.of(entry.getValue()));
    }
    flattenObject("", fields, output, 0);
    return output;
  }

  private void flattenObject(String prefix, Map<String, CellValue> obj,
      Map<String, CellValue> output, int depth) {
    if (depth >= maxDepth) {
      return;
    }
    for (Map.Entry<String, CellValue> entry : obj.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + SEPARATOR + entry.getKey();
      CellValue value = entry.getValue();
      output.put(key, value);

      if (value.getKind() == CellValue.Kind.OBJECT) {
        flattenObject(key, value.fields(), output, depth + 1);
      } else if (value.getKind() == CellValue.Kind.ARRAY && !value.elements().isEmpty()) {
        CellValue first = value.elements().get(0);
        if (first.getKind() == CellValue.Kind.OBJECT) {
          flattenObject(key + ARRAY_SUFFIX, first.fields(), output, depth + 1);
        }
      }
    }
  }
}
