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
package org.aperio.inference.mapping;

/**
 * Identifies the language of a text sample.
 *
 * <p>Implementations wrap an external detection library. They should
 * return {@link LanguageDetectionResult#undetermined()} rather than throw
 * when the text is too short or ambiguous.
 */
public interface LanguageDetector {

  /**
   * Detects the language of the text.
   *
   * @param text Space-joined text extracted by
   *     {@link LanguageSamples#extractText(java.util.List, java.util.List)}
   * @return Detected ISO 639-3 code with its confidence
   */
  LanguageDetectionResult detect(String text);
}
