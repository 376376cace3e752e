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
package org.aperio.inference.stats;

import org.aperio.inference.value.DateStrings;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognized string formats, counted per field.
 */
public enum StringFormat {
  EMAIL("email"),
  URL("url"),
  DATE_TIME("dateTime"),
  DATE("date"),
  NUMERIC("numeric");

  private static final Pattern URL_PATTERN = Pattern.compile("^https?://[^\\s]+");
  private static final Pattern NUMERIC_PATTERN = Pattern.compile("^-?\\d+(\\.\\d+)?$");

  private final String tag;

  StringFormat(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Returns every format the string has. A string may have none.
   */
  public static Set<StringFormat> detect(String value) {
    Set<StringFormat> formats = EnumSet.noneOf(StringFormat.class);
    if (isEmail(value)) {
      formats.add(EMAIL);
    }
    if (URL_PATTERN.matcher(value).find()) {
      formats.add(URL);
    }
    if (DateStrings.hasIsoDateTimePrefix(value)) {
      formats.add(DATE_TIME);
    }
    if (DateStrings.isIsoDate(value)) {
      formats.add(DATE);
    }
    if (NUMERIC_PATTERN.matcher(value).matches()) {
      formats.add(NUMERIC);
    }
    return formats;
  }

  /**
   * One {@code @}, not first or last, a dot somewhere after it, and no
   * whitespace.
   */
  static boolean isEmail(String value) {
    int at = value.indexOf('@');
    if (at <= 0 || at != value.lastIndexOf('@') || at == value.length() - 1) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return false;
      }
    }
    return value.indexOf('.', at + 1) > at + 1;
  }
}
