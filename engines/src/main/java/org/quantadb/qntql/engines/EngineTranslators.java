/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.quantadb.qntql.engines.document.DocumentTranslator;
import org.quantadb.qntql.engines.metric.MetricTranslator;
import org.quantadb.qntql.engines.relation.RelationTranslator;
import org.quantadb.qntql.engines.scalar.ScalarTranslator;
import org.quantadb.qntql.translator.TranslatorRegistry;

/** The four built-in translators. */
public final class EngineTranslators {

  private EngineTranslators() {}

  public static TranslatorRegistry registry(ObjectMapper objectMapper) {
    return new TranslatorRegistry(
        List.of(
            new ScalarTranslator(),
            new DocumentTranslator(objectMapper),
            new RelationTranslator(),
            new MetricTranslator()));
  }
}
