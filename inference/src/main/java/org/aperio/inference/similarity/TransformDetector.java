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

import org.aperio.inference.DetectionConfig;
import org.aperio.inference.schema.ChangeType;
import org.aperio.inference.schema.FieldDefinition;
import org.aperio.inference.schema.SchemaChange;
import org.aperio.inference.schema.SchemaComparison;
import org.aperio.inference.schema.StructuralSchema;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Suggests renames between two versions of a schema.
 *
 * <p>Every removed field is scored against every added field, from 0 to
 * 100:
 * <ul>
 *   <li>name, up to 50: equal ignoring case 50, a known prefix or suffix
 *   added or dropped 40, one name inside the other 35, otherwise 50 times
 *   the edit-distance similarity; pairs under 25 are not considered;</li>
 *   <li>type: +30 when the declared types are compatible, -30 when not;</li>
 *   <li>position: +20 at the same index, +10 at an adjacent one.</li>
 * </ul>
 * Pairs reaching the configured acceptance score are claimed greedily,
 * highest first, so each field takes part in at most one rename.
 */
public class TransformDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(TransformDetector.class);

  private static final List<String> PREFIXES = ImmutableList.of("start_", "end_", "event_");
  private static final List<String> SUFFIXES = ImmutableList.of("_name");

  private static final int EQUAL_NAME_SCORE = 50;
  private static final int AFFIX_SCORE = 40;
  private static final int CONTAINED_SCORE = 35;
  private static final int MIN_NAME_SCORE = 25;
  private static final int MIN_CONTAINED_LENGTH = 3;
  private static final int TYPE_SCORE = 30;
  private static final int SAME_POSITION_SCORE = 20;
  private static final int ADJACENT_POSITION_SCORE = 10;

  private final DetectionConfig config;

  public TransformDetector() {
    this(DetectionConfig.defaults());
  }

  public TransformDetector(DetectionConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config is required");
    }
    this.config = config;
  }

  public List<TransformSuggestion> detectTransforms(StructuralSchema oldSchema,
      StructuralSchema newSchema, SchemaComparison comparison) {
    return detectTransforms(oldSchema, newSchema, comparison.getChanges());
  }

  /**
   * Suggests renames from the removed and added fields of a change list.
   *
   * @param oldSchema Schema the dataset stores
   * @param newSchema Schema of the incoming data
   * @param changes Changes from {@code oldSchema} to {@code newSchema}
   * @return Suggestions, highest confidence first
   */
  public List<TransformSuggestion> detectTransforms(StructuralSchema oldSchema,
      StructuralSchema newSchema, List<SchemaChange> changes) {
    List<String> removed = new ArrayList<>();
    List<String> added = new ArrayList<>();
    for (SchemaChange change : changes) {
      if (change.getType() == ChangeType.REMOVED_FIELD) {
        removed.add(change.getPath());
      } else if (change.getType() == ChangeType.NEW_FIELD) {
        added.add(change.getPath());
      }
    }
    if (removed.isEmpty() || added.isEmpty()) {
      return new ArrayList<>();
    }

    List<Candidate> candidates = new ArrayList<>();
    for (String oldName : removed) {
      for (String newName : added) {
        Candidate candidate = score(oldSchema, newSchema, oldName, newName);
        if (candidate != null && candidate.score >= config.getRenameAcceptanceScore()) {
          candidates.add(candidate);
        }
      }
    }
    // Stable sort keeps declaration order among equal scores.
    candidates.sort((a, b) -> Integer.compare(b.score, a.score));

    List<TransformSuggestion> suggestions = new ArrayList<>();
    Set<String> claimedOld = new HashSet<>();
    Set<String> claimedNew = new HashSet<>();
    for (Candidate candidate : candidates) {
      if (claimedOld.contains(candidate.oldName) || claimedNew.contains(candidate.newName)) {
        continue;
      }
      claimedOld.add(candidate.oldName);
      claimedNew.add(candidate.newName);
      suggestions.add(
          new TransformSuggestion(TransformType.RENAME, candidate.newName, candidate.oldName,
              candidate.score, String.join(", ", candidate.reasons)));
    }
    LOGGER.info("Suggested {} renames for {} removed and {} added fields", suggestions.size(),
        removed.size(), added.size());
    return suggestions;
  }

  private @Nullable Candidate score(StructuralSchema oldSchema, StructuralSchema newSchema,
      String oldName, String newName) {
    Candidate candidate = new Candidate(oldName, newName);
    double nameScore = nameScore(oldName, newName, candidate.reasons);
    if (nameScore < MIN_NAME_SCORE) {
      return null;
    }

    double total = nameScore;
    List<String> oldTypes = types(oldSchema.getField(oldName));
    List<String> newTypes = types(newSchema.getField(newName));
    if (!oldTypes.isEmpty() && !newTypes.isEmpty()) {
      if (TypeCompatibility.anyCompatible(oldTypes, newTypes)) {
        total += TYPE_SCORE;
        candidate.reasons.add("compatible type " + String.join("/", newTypes));
      } else {
        total -= TYPE_SCORE;
        candidate.reasons.add("type changed from " + String.join("/", oldTypes)
            + " to " + String.join("/", newTypes));
      }
    }

    int oldIndex = oldSchema.indexOf(oldName);
    int newIndex = newSchema.indexOf(newName);
    if (oldIndex >= 0 && newIndex >= 0) {
      int distance = Math.abs(oldIndex - newIndex);
      if (distance == 0) {
        total += SAME_POSITION_SCORE;
        candidate.reasons.add("same position");
      } else if (distance == 1) {
        total += ADJACENT_POSITION_SCORE;
        candidate.reasons.add("adjacent position");
      }
    }
    candidate.score = (int) Math.min(100, Math.max(0, Math.round(total)));
    return candidate;
  }

  static double nameScore(String oldName, String newName, List<String> reasons) {
    String a = oldName.toLowerCase(Locale.ROOT);
    String b = newName.toLowerCase(Locale.ROOT);
    if (a.equals(b)) {
      reasons.add("same name ignoring case");
      return EQUAL_NAME_SCORE;
    }
    for (String prefix : PREFIXES) {
      if (b.equals(prefix + a) || a.equals(prefix + b)) {
        reasons.add("'" + prefix + "' prefix");
        return AFFIX_SCORE;
      }
    }
    for (String suffix : SUFFIXES) {
      if (b.equals(a + suffix) || a.equals(b + suffix)) {
        reasons.add("'" + suffix + "' suffix");
        return AFFIX_SCORE;
      }
    }
    if (Math.min(a.length(), b.length()) >= MIN_CONTAINED_LENGTH
        && (b.contains(a) || a.contains(b))) {
      reasons.add("'" + (a.length() < b.length() ? oldName : newName) + "' is part of '"
          + (a.length() < b.length() ? newName : oldName) + "'");
      return CONTAINED_SCORE;
    }
    double similarity = FieldNameMatcher.similarity(oldName, newName);
    reasons.add(Math.round(similarity * 100) + "% similar name");
    return EQUAL_NAME_SCORE * similarity;
  }

  private static List<String> types(@Nullable FieldDefinition definition) {
    List<String> types = new ArrayList<>();
    if (definition == null) {
      return types;
    }
    for (String type : definition.getTypes()) {
      String normalized = TypeCompatibility.normalize(type);
      if (normalized != null) {
        types.add(normalized);
      }
    }
    return types;
  }

  /** A scored pairing of a removed field with an added one. */
  private static class Candidate {
    final String oldName;
    final String newName;
    final List<String> reasons = new ArrayList<>();
    int score;

    Candidate(String oldName, String newName) {
      this.oldName = oldName;
      this.newName = newName;
    }
  }
}
