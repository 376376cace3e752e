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

/**
 * Component scores of a similarity result, each rounded to an integer in
 * [0, 100].
 */
public class SimilarityBreakdown {
  private final int fieldOverlap;
  private final int typeCompatibility;
  private final int structureSimilarity;
  private final int semanticHints;
  private final int languageMatch;

  public SimilarityBreakdown(int fieldOverlap, int typeCompatibility, int structureSimilarity,
      int semanticHints, int languageMatch) {
    this.fieldOverlap = fieldOverlap;
    this.typeCompatibility = typeCompatibility;
    this.structureSimilarity = structureSimilarity;
    this.semanticHints = semanticHints;
    this.languageMatch = languageMatch;
  }

  public int getFieldOverlap() {
    return fieldOverlap;
  }

  public int getTypeCompatibility() {
    return typeCompatibility;
  }

  public int getStructureSimilarity() {
    return structureSimilarity;
  }

  public int getSemanticHints() {
    return semanticHints;
  }

  public int getLanguageMatch() {
    return languageMatch;
  }

  @Override public String toString() {
    return "fieldOverlap=" + fieldOverlap
        + ", typeCompatibility=" + typeCompatibility
        + ", structureSimilarity=" + structureSimilarity
        + ", semanticHints=" + semanticHints
        + ", languageMatch=" + languageMatch;
  }
}
