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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * One difference between two schema versions.
 */
public class SchemaChange {

  private final ChangeType type;
  private final String path;
  private final String description;
  private final ImmutableMap<String, Object> details;
  private final Severity severity;
  private final boolean autoApprovable;

  public SchemaChange(ChangeType type, String path, String description,
      Map<String, ?> details, Severity severity, boolean autoApprovable) {
    this.type = Objects.requireNonNull(type, "type");
    this.path = Objects.requireNonNull(path, "path");
    this.description = description;
    this.details = ImmutableMap.copyOf(details);
    this.severity = Objects.requireNonNull(severity, "severity");
    this.autoApprovable = autoApprovable;
  }

  public ChangeType getType() {
    return type;
  }

  public String getPath() {
    return path;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Returns change-specific values, such as {@code oldType} and
   * {@code newType} for a type change.
   */
  public Map<String, Object> getDetails() {
    return details;
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isAutoApprovable() {
    return autoApprovable;
  }

  /**
   * Returns whether data written for the old schema may no longer fit:
   * every error, and enum changes that dropped values.
   */
  public boolean isBreaking() {
    return severity == Severity.ERROR
        || (type == ChangeType.ENUM_CHANGE && severity == Severity.WARNING);
  }

  @Override public String toString() {
    return type.getLabel() + " " + path + " [" + severity.getLabel() + "]: " + description;
  }
}
