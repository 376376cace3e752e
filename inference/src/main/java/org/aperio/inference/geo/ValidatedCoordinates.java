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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A latitude/longitude pair after validation, possibly with the values
 * exchanged.
 */
public class ValidatedCoordinates {

  private final @Nullable Double latitude;
  private final @Nullable Double longitude;
  private final boolean valid;
  private final ValidationStatus validationStatus;
  private final double confidence;
  private final boolean wasSwapped;
  private final @Nullable Double originalLatitude;
  private final @Nullable Double originalLongitude;

  ValidatedCoordinates(@Nullable Double latitude, @Nullable Double longitude,
      boolean valid, ValidationStatus validationStatus, double confidence,
      boolean wasSwapped, @Nullable Double originalLatitude,
      @Nullable Double originalLongitude) {
    this.latitude = latitude;
    this.longitude = longitude;
    this.valid = valid;
    this.validationStatus = validationStatus;
    this.confidence = confidence;
    this.wasSwapped = wasSwapped;
    this.originalLatitude = originalLatitude;
    this.originalLongitude = originalLongitude;
  }

  static ValidatedCoordinates of(@Nullable Double latitude, @Nullable Double longitude,
      boolean valid, ValidationStatus status, double confidence) {
    return new ValidatedCoordinates(latitude, longitude, valid, status, confidence,
        false, null, null);
  }

  public @Nullable Double getLatitude() {
    return latitude;
  }

  public @Nullable Double getLongitude() {
    return longitude;
  }

  public boolean isValid() {
    return valid;
  }

  public ValidationStatus getValidationStatus() {
    return validationStatus;
  }

  public double getConfidence() {
    return confidence;
  }

  /**
   * Returns whether latitude and longitude were exchanged to make the pair
   * valid. The values before the exchange are kept as the original values.
   */
  public boolean wasSwapped() {
    return wasSwapped;
  }

  public @Nullable Double getOriginalLatitude() {
    return originalLatitude;
  }

  public @Nullable Double getOriginalLongitude() {
    return originalLongitude;
  }

  @Override public String toString() {
    return "ValidatedCoordinates{" + latitude + ", " + longitude
        + ", status=" + validationStatus.getLabel()
        + ", confidence=" + confidence
        + (wasSwapped ? ", swapped" : "") + "}";
  }
}
