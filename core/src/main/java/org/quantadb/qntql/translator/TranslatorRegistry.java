/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.translator;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import org.quantadb.qntql.storage.StorageClassification;

/** Dispatch table from storage classification to its translator. */
public class TranslatorRegistry {

  private final Map<StorageClassification, EngineTranslator> translators =
      new EnumMap<>(StorageClassification.class);

  public TranslatorRegistry(Collection<? extends EngineTranslator> translators) {
    for (EngineTranslator translator : translators) {
      if (this.translators.put(translator.getClassification(), translator) != null) {
        throw new IllegalArgumentException(
            "Duplicate translator for " + translator.getClassification().getEngineName());
      }
    }
  }

  /**
   * Translator for a classification.
   *
   * @throws IllegalStateException if none is registered
   */
  public EngineTranslator get(StorageClassification classification) {
    EngineTranslator translator = translators.get(classification);
    if (translator == null) {
      throw new IllegalStateException(
          "No translator registered for " + classification.getEngineName());
    }
    return translator;
  }
}
