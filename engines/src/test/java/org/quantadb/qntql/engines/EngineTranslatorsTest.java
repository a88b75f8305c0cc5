/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quantadb.qntql.engines.document.DocumentTranslator;
import org.quantadb.qntql.engines.metric.MetricTranslator;
import org.quantadb.qntql.engines.relation.RelationTranslator;
import org.quantadb.qntql.engines.scalar.ScalarTranslator;
import org.quantadb.qntql.storage.StorageClassification;
import org.quantadb.qntql.translator.TranslatorRegistry;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EngineTranslatorsTest {

  @Test
  void registry_covers_every_classification() {
    TranslatorRegistry registry = EngineTranslators.registry(new ObjectMapper());

    assertInstanceOf(ScalarTranslator.class, registry.get(StorageClassification.SCALAR));
    assertInstanceOf(DocumentTranslator.class, registry.get(StorageClassification.DOCUMENT));
    assertInstanceOf(RelationTranslator.class, registry.get(StorageClassification.RELATION));
    assertInstanceOf(MetricTranslator.class, registry.get(StorageClassification.METRIC));
  }

  @Test
  void duplicate_translators_are_rejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new TranslatorRegistry(List.of(new MetricTranslator(), new MetricTranslator())));
  }

  @Test
  void missing_translator_is_reported() {
    TranslatorRegistry registry = new TranslatorRegistry(List.of(new ScalarTranslator()));

    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> registry.get(StorageClassification.METRIC));
    assertEquals(
        "No translator registered for " + StorageClassification.METRIC.getEngineName(),
        e.getMessage());
  }

  @Test
  void fragment_for_another_engine_is_rejected() {
    assertThrows(
        IllegalStateException.class,
        () ->
            new MetricTranslator()
                .translate(
                    TranslatorFixtures.scan(StorageClassification.SCALAR, List.of("status")),
                    TranslatorFixtures.BUCKET));
  }
}
