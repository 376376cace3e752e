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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Matches field names across schemas by exact name, synonym group or edit
 * distance.
 */
public final class FieldNameMatcher {

  /** Similarity from which two names are considered the same field. */
  public static final double MATCH_THRESHOLD = 0.7;

  static final double EXACT_SCORE = 1.0;
  static final double SYNONYM_SCORE = 0.9;

  /** Each group lists its canonical name first. */
  private static final List<Set<String>> SYNONYM_GROUPS = ImmutableList.of(
      ImmutableSet.of("title", "name", "event", "label", "heading", "subject"),
      ImmutableSet.of("description", "desc", "details", "summary", "notes", "content", "text"),
      ImmutableSet.of("date", "timestamp", "datetime", "time", "when", "start", "created"),
      ImmutableSet.of("location", "address", "place", "venue", "city", "area", "region"),
      ImmutableSet.of("latitude", "lat", "y", "coord_y"),
      ImmutableSet.of("longitude", "lng", "lon", "long", "x", "coord_x"));

  private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

  private FieldNameMatcher() {
  }

  /** A candidate name with its match score. */
  public static class Match {
    private final String field;
    private final double score;

    Match(String field, double score) {
      this.field = field;
      this.score = score;
    }

    public String getField() {
      return field;
    }

    public double getScore() {
      return score;
    }
  }

  /**
   * Returns the similarity of two names in [0, 1], ignoring case,
   * underscores and hyphens.
   */
  public static double similarity(String name1, String name2) {
    String s1 = strip(name1);
    String s2 = strip(name2);
    if (s1.equals(s2)) {
      return 1.0;
    }
    if (s1.isEmpty() || s2.isEmpty()) {
      return 0;
    }
    int distance = LEVENSHTEIN.apply(s1, s2);
    return 1 - (double) distance / Math.max(s1.length(), s2.length());
  }

  /**
   * Whether both names belong to the same synonym group, ignoring case.
   */
  public static boolean areSynonyms(String name1, String name2) {
    String a = name1.toLowerCase(Locale.ROOT);
    String b = name2.toLowerCase(Locale.ROOT);
    for (Set<String> group : SYNONYM_GROUPS) {
      if (group.contains(a) && group.contains(b)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds the candidate that best matches a field: a case-insensitive equal
   * name scores 1.0, a synonym 0.9, otherwise the name similarity when it
   * reaches {@link #MATCH_THRESHOLD}. The first candidate wins a tie.
   */
  public static @Nullable Match findBestMatch(String field, List<String> candidates) {
    Match best = null;
    for (String candidate : candidates) {
      if (field.equalsIgnoreCase(candidate)) {
        return new Match(candidate, EXACT_SCORE);
      }
      double score;
      if (areSynonyms(field, candidate)) {
        score = SYNONYM_SCORE;
      } else {
        score = similarity(field, candidate);
        if (score < MATCH_THRESHOLD) {
          continue;
        }
      }
      if (best == null || score > best.score) {
        best = new Match(candidate, score);
      }
    }
    return best;
  }

  private static String strip(String name) {
    return name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
  }
}
