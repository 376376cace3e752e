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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of feeding one batch of records to a {@link ProgressiveSchemaBuilder}.
 */
public class BatchResult {

  private final boolean schemaChanged;
  private final List<SchemaChange> changes;
  private final int recordsProcessed;
  private final int version;

  BatchResult(List<SchemaChange> changes, int recordsProcessed, int version) {
    this.changes = Collections.unmodifiableList(new ArrayList<>(changes));
    this.schemaChanged = !changes.isEmpty();
    this.recordsProcessed = recordsProcessed;
    this.version = version;
  }

  /**
   * Returns whether the batch added fields or introduced new types.
   */
  public boolean isSchemaChanged() {
    return schemaChanged;
  }

  public List<SchemaChange> getChanges() {
    return changes;
  }

  public int getRecordsProcessed() {
    return recordsProcessed;
  }

  /** Returns the schema version after the batch. */
  public int getVersion() {
    return version;
  }

  @Override public String toString() {
    return "BatchResult{records=" + recordsProcessed
        + ", changes=" + changes.size()
        + ", version=" + version + "}";
  }
}
