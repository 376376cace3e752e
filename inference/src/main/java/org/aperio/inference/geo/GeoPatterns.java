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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Column-name patterns for coordinate columns. Patterns are ordered from most
 * to least specific; a match earlier in a list is stronger evidence.
 */
public final class GeoPatterns {

  public static final ImmutableList<Pattern> LATITUDE = compile(
      "^lat(itude)?$",
      "^lat[_\\s.-]?deg(rees)?$",
      "^y[_\\s.-]?coord(inate)?$",
      "^location[_\\s.-]?lat(itude)?$",
      "^geo[_\\s.-]?lat(itude)?$",
      "^decimal[_\\s.-]?lat(itude)?$",
      "^latitude[_\\s.-]?decimal$",
      "^wgs84[_\\s.-]?lat(itude)?$",
      "^breite$",
      "^breitengrad$");

  public static final ImmutableList<Pattern> LONGITUDE = compile(
      "^lon(g|gitude)?$",
      "^lng$",
      "^lon[_\\s.-]?deg(rees)?$",
      "^long[_\\s.-]?deg(rees)?$",
      "^x[_\\s.-]?coord(inate)?$",
      "^location[_\\s.-]?lon(g|gitude)?$",
      "^geo[_\\s.-]?lon(g|gitude)?$",
      "^decimal[_\\s.-]?lon(g|gitude)?$",
      "^longitude[_\\s.-]?decimal$",
      "^wgs84[_\\s.-]?lon(g|gitude)?$",
      "^länge$",
      "^laenge$",
      "^längengrad$");

  public static final ImmutableList<Pattern> COMBINED = compile(
      "^coord(inate)?s?$",
      "^lat[_\\s.-]?lon(g)?$",
      "^location$",
      "^geo[_\\s.-]?location$",
      "^position$",
      "^point$",
      "^geometry$",
      "^geo$",
      "^geolocation$",
      "^geo[_\\s.-]?point$",
      "^latlng$",
      "^lat[_\\s.-]?lng$",
      "^lnglat$",
      "^lng[_\\s.-]?lat$",
      "^koordinaten$");

  private GeoPatterns() {
  }

  private static ImmutableList<Pattern> compile(String... regexes) {
    ImmutableList.Builder<Pattern> builder = ImmutableList.builder();
    for (String regex : regexes) {
      builder.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
    return builder.build();
  }

  /**
   * Returns the index of the first pattern matching the trimmed name, or -1.
   */
  public static int indexOf(String name, List<Pattern> patterns) {
    String trimmed = name.trim();
    for (int i = 0; i < patterns.size(); i++) {
      if (patterns.get(i).matcher(trimmed).find()) {
        return i;
      }
    }
    return -1;
  }

  public static boolean matches(String name, List<Pattern> patterns) {
    return indexOf(name, patterns) >= 0;
  }

  /**
   * Returns the first header, in header order, that matches any pattern.
   */
  public static @Nullable String firstMatch(List<String> headers, List<Pattern> patterns) {
    for (String header : headers) {
      if (header != null && matches(header, patterns)) {
        return header;
      }
    }
    return null;
  }
}
