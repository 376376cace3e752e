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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of a file about to be imported: its headers, some sample rows and
 * the total row count.
 */
public class UploadedSchema {
  private final List<String> headers;
  private final List<Map<String, Object>> sampleData;
  private final long rowCount;

  public UploadedSchema(List<String> headers, List<? extends Map<String, ?>> sampleData,
      long rowCount) {
    if (headers == null) {
      throw new IllegalArgumentException("headers are required");
    }
    this.headers = ImmutableList.copyOf(headers);
    List<Map<String, Object>> rows = new ArrayList<>();
    if (sampleData != null) {
      for (Map<String, ?> row : sampleData) {
        rows.add(Collections.unmodifiableMap(new LinkedHashMap<String, Object>(row)));
      }
    }
    this.sampleData = Collections.unmodifiableList(rows);
    this.rowCount = rowCount;
  }

  public List<String> getHeaders() {
    return headers;
  }

  public List<Map<String, Object>> getSampleData() {
    return sampleData;
  }

  public long getRowCount() {
    return rowCount;
  }

  /**
   * Returns the sampled values of a column; rows without the column are
   * skipped.
   */
  public List<Object> valuesOf(String header) {
    List<Object> values = new ArrayList<>();
    for (Map<String, Object> row : sampleData) {
      if (row.containsKey(header)) {
        values.add(row.get(header));
      }
    }
    return values;
  }
}
