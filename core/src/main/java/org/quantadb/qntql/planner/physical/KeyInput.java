/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.physical;

import java.util.List;

/**
 * Key set a fragment receives from upstream fragments: the intersection of the keys every
 * upstream fragment returned, read from each one's {@link EngineFragment#outputKeyColumn()} and
 * bound into the native query parameter named {@code parameter}.
 *
 * @param upstream ids of the fragments producing the keys
 * @param parameter native query parameter receiving the key set
 */
public record KeyInput(List<String> upstream, String parameter) {

  public KeyInput {
    upstream = List.copyOf(upstream);
  }
}
