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
 * Coordinates pulled out of a single combined value.
 */
public class CoordinateExtraction {

  private final @Nullable Double latitude;
  private final @Nullable Double longitude;
  private final CoordinateFormat format;
  private final boolean valid;

  CoordinateExtraction(@Nullable Double latitude, @Nullable Double longitude,
      CoordinateFormat format, boolean valid) {
    this.latitude = latitude;
    this.longitude = longitude;
    this.format = format;
    this.valid = valid;
  }

  static CoordinateExtraction failed(CoordinateFormat format) {
    return new CoordinateExtraction(null, null, format, false);
  }

  public @Nullable Double getLatitude() {
    return latitude;
  }

  public @Nullable Double getLongitude() {
    return longitude;
  }

  /**
   * Returns the format the value was read as; {@link CoordinateFormat#UNKNOWN}
   * when no format matched.
   */
  public CoordinateFormat getFormat() {
    return format;
  }

  public boolean isValid() {
    return valid;
  }

  @Override public String toString() {
    return "CoordinateExtraction{" + latitude + ", " + longitude
        + ", format=" + format.getTag() + ", valid=" + valid + "}";
  }
}
