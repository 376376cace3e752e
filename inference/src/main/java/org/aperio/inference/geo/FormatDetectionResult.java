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
 * Format of a combined-coordinate column with the share of samples that
 * matched it.
 */
public class FormatDetectionResult {

  private final CoordinateFormat format;
  private final double confidence;
  private final boolean accepted;

  FormatDetectionResult(CoordinateFormat format, double confidence, boolean accepted) {
    this.format = format;
    this.confidence = confidence;
    this.accepted = accepted;
  }

  static FormatDetectionResult none() {
    return new FormatDetectionResult(CoordinateFormat.UNKNOWN, 0, false);
  }

  public CoordinateFormat getFormat() {
    return format;
  }

  /**
   * Returns matching-and-valid samples divided by non-empty samples.
   */
  public double getConfidence() {
    return confidence;
  }

  /**
   * Returns whether the confidence reached the acceptance ratio.
   */
  public boolean isAccepted() {
    return accepted;
  }

  @Override public String toString() {
    return "FormatDetectionResult{" + format.getTag() + ", confidence=" + confidence
        + ", accepted=" + accepted + "}";
  }
}
