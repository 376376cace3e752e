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

import java.util.Objects;

/**
 * A suggested transform that maps an incoming column onto a stored one.
 */
public class TransformSuggestion {
  private final TransformType type;
  private final String from;
  private final String to;
  private final int confidence;
  private final String reason;

  public TransformSuggestion(TransformType type, String from, String to, int confidence,
      String reason) {
    this.type = type;
    this.from = from;
    this.to = to;
    this.confidence = confidence;
    this.reason = reason;
  }

  public TransformType getType() {
    return type;
  }

  /** Column name in the incoming data. */
  public String getFrom() {
    return from;
  }

  /** Column name the dataset already stores. */
  public String getTo() {
    return to;
  }

  /** Returns the confidence in [0, 100]. */
  public int getConfidence() {
    return confidence;
  }

  public String getReason() {
    return reason;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransformSuggestion)) {
      return false;
    }
    TransformSuggestion that = (TransformSuggestion) o;
    return type == that.type && from.equals(that.from) && to.equals(that.to)
        && confidence == that.confidence && reason.equals(that.reason);
  }

  @Override public int hashCode() {
    return Objects.hash(type, from, to, confidence, reason);
  }

  @Override public String toString() {
    return type.getLabel() + " " + from + " -> " + to + " (" + confidence + "): " + reason;
  }
}
