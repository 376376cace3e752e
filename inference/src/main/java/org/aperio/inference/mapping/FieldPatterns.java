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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Column-name patterns per role and language.
 *
 * <p>Languages are ISO 639-3 codes. Within a list, patterns run from most to
 * least specific, and a column's score grows the earlier its pattern
 * appears. All patterns match case-insensitively against the last segment
 * of a field path.
 */
public final class FieldPatterns {

  /** Language used when a language has no patterns or finds no match. */
  public static final String DEFAULT_LANGUAGE = "eng";

  public static final ImmutableList<String> SUPPORTED_LANGUAGES =
      ImmutableList.of("eng", "deu", "fra", "spa", "ita", "nld", "por");

  private static final ImmutableMap<FieldRole, ImmutableMap<String, ImmutableList<Pattern>>>
      PATTERNS;

  static {
    ImmutableMap.Builder<FieldRole, ImmutableMap<String, ImmutableList<Pattern>>> builder =
        ImmutableMap.builder();

    ImmutableMap.Builder<String, ImmutableList<Pattern>> title = ImmutableMap.builder();
    title.put("eng", compile(
        "^title$", "^name$", "^event.*name$", "^event.*title$", "^label$", "^event$"));
    title.put("deu", compile(
        "^titel$", "^name$", "^bezeichnung$", "^veranstaltung.*name$", "^veranstaltung.*titel$",
        "^veranstaltung$"));
    title.put("fra", compile(
        "^titre$", "^nom$", "^événement.*nom$", "^événement.*titre$", "^intitulé$", "^événement$"));
    title.put("spa", compile(
        "^título$", "^nombre$", "^evento.*nombre$", "^evento.*título$", "^denominación$",
        "^evento$"));
    title.put("ita", compile(
        "^titolo$", "^nome$", "^evento.*nome$", "^evento.*titolo$", "^denominazione$", "^evento$"));
    title.put("nld", compile(
        "^titel$", "^naam$", "^evenement.*naam$", "^evenement.*titel$", "^benaming$",
        "^evenement$"));
    title.put("por", compile(
        "^título$", "^nome$", "^evento.*nome$", "^evento.*título$", "^denominação$", "^evento$"));
    builder.put(FieldRole.TITLE, title.build());

    ImmutableMap.Builder<String, ImmutableList<Pattern>> description = ImmutableMap.builder();
    description.put("eng", compile(
        "^description$", "^details$", "^summary$", "^notes$", "^text$", "^content$",
        "^event.*description$"));
    description.put("deu", compile(
        "^beschreibung$", "^details$", "^zusammenfassung$", "^notizen$", "^text$", "^inhalt$",
        "^veranstaltung.*beschreibung$"));
    description.put("fra", compile(
        "^description$", "^détails$", "^résumé$", "^notes$", "^texte$", "^contenu$",
        "^événement.*description$"));
    description.put("spa", compile(
        "^descripción$", "^detalles$", "^resumen$", "^notas$", "^texto$", "^contenido$",
        "^evento.*descripción$"));
    description.put("ita", compile(
        "^descrizione$", "^dettagli$", "^sommario$", "^note$", "^testo$", "^contenuto$",
        "^evento.*descrizione$"));
    description.put("nld", compile(
        "^beschrijving$", "^details$", "^samenvatting$", "^notities$", "^tekst$", "^inhoud$",
        "^evenement.*beschrijving$"));
    description.put("por", compile(
        "^descrição$", "^detalhes$", "^resumo$", "^notas$", "^texto$", "^conteúdo$",
        "^evento.*descrição$"));
    builder.put(FieldRole.DESCRIPTION, description.build());

    ImmutableMap.Builder<String, ImmutableList<Pattern>> locationName = ImmutableMap.builder();
    locationName.put("eng", compile(
        "^venue$", "^venue.*name$", "^place$", "^place.*name$", "^location$", "^location.*name$",
        "^site$", "^spot$", "^where$"));
    locationName.put("deu", compile(
        "^veranstaltungsort$", "^ort$", "^spielstätte$", "^standort$", "^platz$", "^lokalität$",
        "^wo$"));
    locationName.put("fra", compile("^lieu$", "^endroit$", "^place$", "^salle$", "^site$", "^où$"));
    locationName.put("spa", compile(
        "^lugar$", "^sitio$", "^local$", "^sede$", "^recinto$", "^donde$", "^dónde$"));
    locationName.put("ita", compile(
        "^luogo$", "^posto$", "^locale$", "^sede$", "^sito$", "^dove$"));
    locationName.put("nld", compile(
        "^locatie$", "^plaats$", "^plek$", "^zaal$", "^site$", "^waar$"));
    locationName.put("por", compile(
        "^local$", "^lugar$", "^recinto$", "^sede$", "^sítio$", "^onde$"));
    builder.put(FieldRole.LOCATION_NAME, locationName.build());

    ImmutableMap.Builder<String, ImmutableList<Pattern>> timestamp = ImmutableMap.builder();
    timestamp.put("eng", compile(
        "^date$", "^timestamp$", "^datetime$", "^date.*time$", "^created.*at$", "^event.*date$",
        "^event.*time$", "^time$", "^when$"));
    timestamp.put("deu", compile(
        "^datum$", "^zeitstempel$", "^erstellt.*am$", "^veranstaltung.*datum$",
        "^veranstaltung.*zeit$", "^zeit$", "^wann$"));
    timestamp.put("fra", compile(
        "^date$", "^horodatage$", "^créé.*le$", "^événement.*date$", "^événement.*heure$",
        "^heure$", "^quand$"));
    timestamp.put("spa", compile(
        "^fecha$", "^timestamp$", "^creado.*el$", "^evento.*fecha$", "^evento.*hora$", "^hora$",
        "^cuándo$"));
    timestamp.put("ita", compile(
        "^data$", "^timestamp$", "^creato.*il$", "^evento.*data$", "^evento.*ora$", "^ora$",
        "^quando$"));
    timestamp.put("nld", compile(
        "^datum$", "^tijdstempel$", "^gemaakt.*op$", "^evenement.*datum$", "^evenement.*tijd$",
        "^tijd$", "^wanneer$"));
    timestamp.put("por", compile(
        "^data$", "^timestamp$", "^criado.*em$", "^evento.*data$", "^evento.*hora$", "^hora$",
        "^quando$"));
    builder.put(FieldRole.TIMESTAMP, timestamp.build());

    ImmutableMap.Builder<String, ImmutableList<Pattern>> location = ImmutableMap.builder();
    location.put("eng", compile(
        "^address$", "^addr$", "^location$", "^place$", "^venue$", "^city$", "^town$", "^region$",
        "^area$", "^street$", "^full.*address$", "^event.*location$", "^event.*address$",
        "^event.*place$", "^postal.*address$"));
    location.put("deu", compile(
        "^adresse$", "^ort$", "^standort$", "^platz$", "^veranstaltungsort$", "^stadt$",
        "^region$", "^straße$", "^strasse$", "^vollständige.*adresse$", "^veranstaltung.*ort$",
        "^veranstaltung.*adresse$", "^postadresse$"));
    location.put("fra", compile(
        "^adresse$", "^lieu$", "^emplacement$", "^place$", "^salle$", "^ville$", "^région$",
        "^rue$", "^adresse.*complète$", "^événement.*lieu$", "^événement.*adresse$",
        "^adresse.*postale$"));
    location.put("spa", compile(
        "^dirección$", "^lugar$", "^ubicación$", "^sitio$", "^local$", "^ciudad$", "^región$",
        "^calle$", "^dirección.*completa$", "^evento.*lugar$", "^evento.*dirección$",
        "^dirección.*postal$"));
    location.put("ita", compile(
        "^indirizzo$", "^luogo$", "^posizione$", "^posto$", "^locale$", "^città$", "^regione$",
        "^via$", "^indirizzo.*completo$", "^evento.*luogo$", "^evento.*indirizzo$",
        "^indirizzo.*postale$"));
    location.put("nld", compile(
        "^adres$", "^locatie$", "^plaats$", "^plek$", "^zaal$", "^stad$", "^regio$", "^straat$",
        "^volledig.*adres$", "^evenement.*locatie$", "^evenement.*adres$", "^postadres$"));
    location.put("por", compile(
        "^endereço$", "^local$", "^localização$", "^lugar$", "^recinto$", "^cidade$", "^região$",
        "^rua$", "^endereço.*completo$", "^evento.*local$", "^evento.*endereço$",
        "^endereço.*postal$"));
    builder.put(FieldRole.LOCATION, location.build());
    PATTERNS = builder.build();
  }

  private FieldPatterns() {
  }

  private static ImmutableList<Pattern> compile(String... regexes) {
    ImmutableList.Builder<Pattern> list = ImmutableList.builder();
    for (String regex : regexes) {
      list.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
    return list.build();
  }

  public static boolean isSupported(@Nullable String language) {
    return language != null && SUPPORTED_LANGUAGES.contains(language);
  }

  /**
   * Returns the patterns for a role in a language, or {@code null} when the
   * language is not supported.
   */
  public static @Nullable List<Pattern> patterns(FieldRole role, String language) {
    return PATTERNS.get(role).get(language);
  }

  /** Returns the English patterns for a role. */
  public static List<Pattern> english(FieldRole role) {
    return PATTERNS.get(role).get(DEFAULT_LANGUAGE);
  }

  /**
   * Returns the index of the first pattern matching the name, or -1.
   */
  public static int indexOf(String name, List<Pattern> patterns) {
    for (int i = 0; i < patterns.size(); i++) {
      if (patterns.get(i).matcher(name).find()) {
        return i;
      }
    }
    return -1;
  }
}
