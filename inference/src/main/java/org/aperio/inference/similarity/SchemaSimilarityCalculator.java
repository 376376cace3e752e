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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores how well an upload fits existing datasets, to suggest where it
 * should be imported.
 *
 * <p>The score is a weighted sum of five components, each in [0, 100]:
 * <ul>
 *   <li>field overlap (35%): Jaccard index of the lower-cased names (40%)
 *   blended with the share of headers matched by name, synonym or edit
 *   distance (60%);</li>
 *   <li>type compatibility (25%): share of typed target fields whose best
 *   matching header has a compatible sampled type;</li>
 *   <li>structure similarity (20%): ratio of the smaller field count to the
 *   larger;</li>
 *   <li>semantic hints (15%): agreement on having geo-like and date-like
 *   fields;</li>
 *   <li>language match (5%).</li>
 * </ul>
 */
public class SchemaSimilarityCalculator {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaSimilarityCalculator.class);

  static final double FIELD_OVERLAP_WEIGHT = 0.35;
  static final double TYPE_COMPATIBILITY_WEIGHT = 0.25;
  static final double STRUCTURE_WEIGHT = 0.20;
  static final double SEMANTIC_WEIGHT = 0.15;
  static final double LANGUAGE_WEIGHT = 0.05;

  private static final double NO_TYPE_INFO_SCORE = 70;
  private static final double NEUTRAL_SCORE = 50;
  private static final double LANGUAGE_MISMATCH_SCORE = 30;

  private static final List<Pattern> GEO_HINTS = hints("lat", "lon", "lng", "location",
      "address", "coord");
  private static final List<Pattern> DATE_HINTS = hints("date", "time", "timestamp", "when",
      "created", "start");

  /**
   * Scores an upload against one target.
   *
   * @param detectedLanguage Language detected in the upload; null if unknown
   */
  public SimilarityResult calculate(UploadedSchema uploaded, TargetSchema target,
      @Nullable String detectedLanguage) {
    FieldOverlap overlap = fieldOverlap(uploaded.getHeaders(), target.getFields());
    double types = typeCompatibility(uploaded, target);
    double structure = structureSimilarity(uploaded.getHeaders().size(),
        target.getFields().size());
    double semantic = semanticHints(uploaded.getHeaders(), target);
    double language = languageMatch(target.getLanguage(), detectedLanguage);

    double total = overlap.score * FIELD_OVERLAP_WEIGHT
        + types * TYPE_COMPATIBILITY_WEIGHT
        + structure * STRUCTURE_WEIGHT
        + semantic * SEMANTIC_WEIGHT
        + language * LANGUAGE_WEIGHT;

    SimilarityResult result = new SimilarityResult(target.getDatasetId(),
        target.getDatasetName(), round(total),
        new SimilarityBreakdown(round(overlap.score), round(types), round(structure),
            round(semantic), round(language)),
        overlap.matching, overlap.missing, overlap.added);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Similarity to {}: {}", target.getDatasetId(), result);
    }
    return result;
  }

  /**
   * Ranks targets by score, keeping those at or above the minimum score, at
   * most the maximum number of results.
   */
  public List<SimilarityResult> findSimilar(UploadedSchema uploaded, List<TargetSchema> targets,
      SimilarityOptions options) {
    List<SimilarityResult> results = new ArrayList<>();
    for (TargetSchema target : targets) {
      SimilarityResult result = calculate(uploaded, target, options.getDetectedLanguage());
      if (result.getScore() >= options.getMinScore()) {
        results.add(result);
      }
    }
    results.sort((a, b) -> Integer.compare(b.getScore(), a.getScore()));
    List<SimilarityResult> ranked = results.size() > options.getMaxResults()
        ? new ArrayList<>(results.subList(0, options.getMaxResults()))
        : results;
    LOGGER.info("{} of {} datasets scored at least {}", results.size(), targets.size(),
        options.getMinScore());
    return ranked;
  }

  public List<SimilarityResult> findSimilar(UploadedSchema uploaded, List<TargetSchema> targets) {
    return findSimilar(uploaded, targets, SimilarityOptions.defaults());
  }

  static FieldOverlap fieldOverlap(List<String> uploaded, List<String> target) {
    FieldOverlap overlap = new FieldOverlap();
    Set<String> matchedTarget = new HashSet<>();
    for (String field : uploaded) {
      FieldNameMatcher.Match match = FieldNameMatcher.findBestMatch(field, target);
      if (match != null && match.getScore() >= FieldNameMatcher.MATCH_THRESHOLD) {
        overlap.matching.add(field);
        matchedTarget.add(match.getField().toLowerCase(Locale.ROOT));
      } else {
        overlap.added.add(field);
      }
    }
    for (String field : target) {
      if (!matchedTarget.contains(field.toLowerCase(Locale.ROOT))) {
        overlap.missing.add(field);
      }
    }

    double jaccard = jaccard(lowerCase(uploaded), lowerCase(target));
    double fuzzy = (double) overlap.matching.size()
        / Math.max(Math.max(uploaded.size(), target.size()), 1);
    overlap.score = Math.min((jaccard * 0.4 + fuzzy * 0.6) * 100, 100);
    return overlap;
  }

  static double typeCompatibility(UploadedSchema uploaded, TargetSchema target) {
    if (target.getFieldTypes().isEmpty()) {
      return NO_TYPE_INFO_SCORE;
    }
    Map<String, String> uploadedTypes = new HashMap<>();
    for (String header : uploaded.getHeaders()) {
      uploadedTypes.put(header.toLowerCase(Locale.ROOT),
          TypeCompatibility.inferType(uploaded.valuesOf(header)));
    }

    int compatible = 0;
    int compared = 0;
    for (Map.Entry<String, String> entry : target.getFieldTypes().entrySet()) {
      FieldNameMatcher.Match match =
          FieldNameMatcher.findBestMatch(entry.getKey(), uploaded.getHeaders());
      if (match == null) {
        continue;
      }
      String actual = uploadedTypes.get(match.getField().toLowerCase(Locale.ROOT));
      if (actual != null && TypeCompatibility.areCompatible(actual, entry.getValue())) {
        compatible++;
      }
      compared++;
    }
    return compared == 0 ? NEUTRAL_SCORE : compatible * 100d / compared;
  }

  static double structureSimilarity(int uploadedCount, int targetCount) {
    if (uploadedCount == 0 || targetCount == 0) {
      return 0;
    }
    return Math.min(uploadedCount, targetCount) * 100d / Math.max(uploadedCount, targetCount);
  }

  static double semanticHints(List<String> headers, TargetSchema target) {
    boolean uploadedGeo = anyMatches(headers, GEO_HINTS);
    boolean uploadedDate = anyMatches(headers, DATE_HINTS);
    double score = 0;
    int comparisons = 0;
    if (target.hasGeoFields() || uploadedGeo) {
      score += target.hasGeoFields() == uploadedGeo ? 100 : 0;
      comparisons++;
    }
    if (target.hasDateFields() || uploadedDate) {
      score += target.hasDateFields() == uploadedDate ? 100 : 0;
      comparisons++;
    }
    return comparisons == 0 ? NEUTRAL_SCORE : score / comparisons;
  }

  static double languageMatch(String targetLanguage, @Nullable String detectedLanguage) {
    if (detectedLanguage == null || detectedLanguage.isEmpty()) {
      return NEUTRAL_SCORE;
    }
    return targetLanguage.equals(detectedLanguage) ? 100 : LANGUAGE_MISMATCH_SCORE;
  }

  private static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 1.0;
    }
    if (a.isEmpty() || b.isEmpty()) {
      return 0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    return (double) intersection.size() / union.size();
  }

  private static Set<String> lowerCase(List<String> names) {
    Set<String> set = new HashSet<>();
    for (String name : names) {
      set.add(name.toLowerCase(Locale.ROOT));
    }
    return set;
  }

  private static boolean anyMatches(List<String> headers, List<Pattern> patterns) {
    for (String header : headers) {
      for (Pattern pattern : patterns) {
        if (pattern.matcher(header).find()) {
          return true;
        }
      }
    }
    return false;
  }

  private static List<Pattern> hints(String... words) {
    ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
    for (String word : words) {
      patterns.add(Pattern.compile(word, Pattern.CASE_INSENSITIVE));
    }
    return patterns.build();
  }

  private static int round(double value) {
    return (int) Math.round(value);
  }

  /** Field overlap score with the names on each side. */
  static class FieldOverlap {
    double score;
    final List<String> matching = new ArrayList<>();
    final List<String> missing = new ArrayList<>();
    final List<String> added = new ArrayList<>();
  }
}
