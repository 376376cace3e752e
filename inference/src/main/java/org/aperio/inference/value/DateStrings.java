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
package org.aperio.inference.value;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizers for date-like strings.
 */
public final class DateStrings {

  private static final Pattern ISO_DATE_OR_DATE_TIME =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(T\\d{2}:\\d{2}:\\d{2})?$");
  private static final Pattern SLASH_DATE =
      Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{2,4}$");
  private static final Pattern ISO_DATE_TIME_PREFIX =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}");
  private static final Pattern ISO_DATE =
      Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  /**
   * Formats tried, in order, by {@link #parsesAsDate(String)}. Resolution is
   * strict, so impossible calendar days do not parse.
   */
  private static final ImmutableList<DateTimeFormatter> LENIENT_FORMATS =
      ImmutableList.of(
          DateTimeFormatter.ISO_OFFSET_DATE_TIME,
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ISO_INSTANT,
          DateTimeFormatter.ISO_LOCAL_DATE,
          DateTimeFormatter.RFC_1123_DATE_TIME.withResolverStyle(ResolverStyle.STRICT),
          pattern("uuuu-MM-dd HH:mm[:ss]"),
          pattern("uuuu/M/d[ H:mm[:ss]]"),
          pattern("M/d/uuuu[ H:mm[:ss]]"),
          pattern("d.M.uuuu[ H:mm[:ss]]"),
          pattern("MMM d, uuuu"),
          pattern("MMMM d, uuuu"),
          pattern("d MMM uuuu"),
          pattern("d MMMM uuuu"),
          pattern("EEE MMM d uuuu[ HH:mm:ss]"));

  private DateStrings() {
  }

  private static DateTimeFormatter pattern(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  /**
   * Whether the string is an ISO date or date-time that names a real calendar
   * day, or a numeric {@code d/m/y} style date.
   */
  public static boolean isDateString(String value) {
    if (ISO_DATE_OR_DATE_TIME.matcher(value).matches()) {
      try {
        if (value.length() == 10) {
          LocalDate.parse(value);
        } else {
          LocalDateTime.parse(value);
        }
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
    return SLASH_DATE.matcher(value).matches();
  }

  /** Whether the string starts with an ISO-8601 date-time. */
  public static boolean hasIsoDateTimePrefix(String value) {
    return ISO_DATE_TIME_PREFIX.matcher(value).find();
  }

  /** Whether the string is exactly an ISO-8601 calendar date. */
  public static boolean isIsoDate(String value) {
    return ISO_DATE.matcher(value).matches();
  }

  /**
   * Whether the string parses as a calendar date in any common format.
   */
  public static boolean parsesAsDate(@Nullable String value) {
    if (value == null) {
      return false;
    }
    String text = value.trim();
    if (text.isEmpty()) {
      return false;
    }
    for (DateTimeFormatter format : LENIENT_FORMATS) {
      try {
        format.parse(text);
        return true;
      } catch (DateTimeParseException e) {
        // try the next format
      }
    }
    return false;
  }
}
