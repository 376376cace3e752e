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

import java.util.List;

/**
 * How closely an upload matches one target dataset.
 */
public class SimilarityResult {
  private final String datasetId;
  private final String datasetName;
  private final int score;
  private final SimilarityBreakdown breakdown;
  private final List<String> matchingFields;
  private final List<String> missingFields;
  private final List<String> newFields;

  public SimilarityResult(String datasetId, String datasetName, int score,
      SimilarityBreakdown breakdown, List<String> matchingFields, List<String> missingFields,
      List<String> newFields) {
    this.datasetId = datasetId;
    this.datasetName = datasetName;
    this.score = score;
    this.breakdown = breakdown;
    this.matchingFields = ImmutableList.copyOf(matchingFields);
    this.missingFields = ImmutableList.copyOf(missingFields);
    this.newFields = ImmutableList.copyOf(newFields);
  }

  public String getDatasetId() {
    return datasetId;
  }

  public String getDatasetName() {
    return datasetName;
  }

  /** Returns the weighted score, rounded, in [0, 100]. */
  public int getScore() {
    return score;
  }

  public SimilarityBreakdown getBreakdown() {
    return breakdown;
  }

  /** Uploaded headers that match a target field. */
  public List<String> getMatchingFields() {
    return matchingFields;
  }

  /** Target fields no uploaded header matches. */
  public List<String> getMissingFields() {
    return missingFields;
  }

  /** Uploaded headers that match no target field. */
  public List<String> getNewFields() {
    return newFields;
  }

  @Override public String toString() {
    return "SimilarityResult{" + datasetId + " '" + datasetName + "' score=" + score
        + " [" + breakdown + "]}";
  }
}
