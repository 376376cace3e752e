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
package org.aperio.inference.geo;

/**
 * Outcome of validating a single latitude/longitude pair.
 */
public enum ValidationStatus {
  VALID("valid"),
  OUT_OF_RANGE("out_of_range"),
  SUSPICIOUS_ZERO("suspicious_zero"),
  SWAPPED("swapped"),
  INVALID("invalid");

  private final String label;

  ValidationStatus(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
