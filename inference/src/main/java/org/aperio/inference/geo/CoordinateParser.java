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

import org.aperio.inference.value.CellValue;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses single coordinate values into decimal degrees.
 *
 * <p>Accepted string forms, tried in this order:
 * <ul>
 *   <li>plain decimal: {@code 40.7128}, {@code -.5}, {@code 1.2e1}</li>
 *   <li>degrees, minutes, seconds: {@code 40°42'46"N}, {@code 40 42 46 N}</li>
 *   <li>degrees and decimal minutes: {@code 40°42.767'N}</li>
 *   <li>decimal with a hemisphere suffix: {@code 74.0060 W}</li>
 * </ul>
 *
 * <p>A {@code S} or {@code W} hemisphere makes the value negative. Parsing
 * never throws; anything unrecognized yields {@code null}.
 */
public final class CoordinateParser {

  /** Largest valid absolute latitude. */
  public static final double MAX_LATITUDE = 90;
  /** Largest valid absolute longitude. */
  public static final double MAX_LONGITUDE = 180;

  private static final Pattern DECIMAL =
      Pattern.compile("^-?(?:\\d+(?:\\.\\d+)?|\\.\\d+)(?:[eE][+-]?\\d+)?$");
  private static final Pattern DMS =
      Pattern.compile("^(-?\\d{1,3})[°\\s]\\s*(\\d{1,2})['′\\s]\\s*"
          + "(\\d{1,2}\\.?\\d{0,6})[\"″\\s]?\\s*([NSEW])?$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern DEGREES_DECIMAL_MINUTES =
      Pattern.compile("^(-?\\d{1,3})[°\\s](\\d{1,3}\\.?\\d{0,6})['′\\s]?([NSEW])?$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern DIRECTIONAL =
      Pattern.compile("^(-?\\d{1,3}\\.?\\d{0,10})\\s{0,2}([NSEW])$",
          Pattern.CASE_INSENSITIVE);

  private CoordinateParser() {
  }

  /**
   * Parses a raw cell value.
   *
   * @param value Number, string or any other decoded value; may be null
   * @return Decimal degrees, or null when the value is not a coordinate
   */
  public static @Nullable Double parseCoordinate(@Nullable Object value) {
    return parseCoordinate(CellValue.of(value));
  }

  /**
   * Parses a cell value. Numbers pass through unchanged unless they are NaN
   * or infinite.
   */
  public static @Nullable Double parseCoordinate(CellValue value) {
    switch (value.getKind()) {
    case INTEGER:
    case FLOAT:
      double d = value.asDouble();
      return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
    case STRING:
      return parseString(value.asText());
    default:
      return null;
    }
  }

  private static @Nullable Double parseString(String raw) {
    String text = raw.trim();
    if (text.isEmpty()) {
      return null;
    }

    if (DECIMAL.matcher(text).matches()) {
      double d = Double.parseDouble(text);
      return Double.isInfinite(d) ? null : d;
    }

    Matcher m = DMS.matcher(text);
    if (m.matches()) {
      double degrees = Double.parseDouble(m.group(1));
      double minutes = Double.parseDouble(m.group(2));
      double seconds = parseLoose(m.group(3));
      double magnitude = Math.abs(degrees) + minutes / 60 + seconds / 3600;
      return signed(degrees < 0 || text.startsWith("-"), magnitude, m.group(4));
    }

    m = DEGREES_DECIMAL_MINUTES.matcher(text);
    if (m.matches()) {
      double degrees = Double.parseDouble(m.group(1));
      double minutes = parseLoose(m.group(2));
      double magnitude = Math.abs(degrees) + minutes / 60;
      return signed(degrees < 0 || text.startsWith("-"), magnitude, m.group(3));
    }

    m = DIRECTIONAL.matcher(text);
    if (m.matches()) {
      double value = parseLoose(m.group(1));
      return signed(value < 0, Math.abs(value), m.group(2));
    }

    return null;
  }

  /** Parses digits that may end with a bare decimal point, such as "46.". */
  private static double parseLoose(String digits) {
    String s = digits.endsWith(".") ? digits.substring(0, digits.length() - 1) : digits;
    return Double.parseDouble(s);
  }

  private static double signed(boolean negative, double magnitude,
      @Nullable String hemisphere) {
    if (hemisphere != null) {
      String h = hemisphere.toUpperCase(Locale.ROOT);
      if (h.equals("S") || h.equals("W")) {
        return -magnitude;
      }
    }
    return negative ? -magnitude : magnitude;
  }

  /**
   * Checks that a latitude/longitude pair is inside the valid ranges and is
   * not the exact pair (0, 0).
   */
  public static boolean isValidCoordinate(@Nullable Double lat, @Nullable Double lon) {
    return isValidCoordinate(lat, lon, true);
  }

  /**
   * Checks that a latitude/longitude pair is inside the valid ranges.
   *
   * @param rejectZero Whether the exact pair (0, 0) is treated as a
   *     placeholder rather than a real location
   */
  public static boolean isValidCoordinate(@Nullable Double lat, @Nullable Double lon,
      boolean rejectZero) {
    if (lat == null || lon == null || lat.isNaN() || lon.isNaN()) {
      return false;
    }
    if (!isValidLatitude(lat) || !isValidLongitude(lon)) {
      return false;
    }
    return !(rejectZero && lat == 0 && lon == 0);
  }

  public static boolean isValidLatitude(double lat) {
    return lat >= -MAX_LATITUDE && lat <= MAX_LATITUDE;
  }

  public static boolean isValidLongitude(double lon) {
    return lon >= -MAX_LONGITUDE && lon <= MAX_LONGITUDE;
  }

  /**
   * Whether a pair only makes sense with latitude and longitude exchanged:
   * the latitude is in (90, 180] and the longitude is within ±90.
   */
  public static boolean looksSwapped(double lat, double lon) {
    double absLat = Math.abs(lat);
    return absLat > MAX_LATITUDE && absLat <= MAX_LONGITUDE
        && Math.abs(lon) <= MAX_LATITUDE;
  }
}
