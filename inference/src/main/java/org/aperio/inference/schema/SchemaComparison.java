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
 * The changes between two schema versions with approval flags.
 */
public class SchemaComparison {

  private final List<SchemaChange> changes;

  SchemaComparison(List<SchemaChange> changes) {
    this.changes = Collections.unmodifiableList(new ArrayList<>(changes));
  }

  public List<SchemaChange> getChanges() {
    return changes;
  }

  public List<SchemaChange> getChanges(ChangeType type) {
    List<SchemaChange> result = new ArrayList<>();
    for (SchemaChange change : changes) {
      if (change.getType() == type) {
        result.add(change);
      }
    }
    return result;
  }

  public boolean hasChanges() {
    return !changes.isEmpty();
  }

  /** Returns whether any change is breaking. */
  public boolean isBreaking() {
    for (SchemaChange change : changes) {
      if (change.isBreaking()) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether any change is a warning or an error. */
  public boolean requiresApproval() {
    for (SchemaChange change : changes) {
      if (change.getSeverity() != Severity.INFO) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether every change may be applied without review. */
  public boolean canAutoApprove() {
    for (SchemaChange change : changes) {
      if (!change.isAutoApprovable()) {
        return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return "SchemaComparison{changes=" + changes.size()
        + ", breaking=" + isBreaking() + "}";
  }
}
