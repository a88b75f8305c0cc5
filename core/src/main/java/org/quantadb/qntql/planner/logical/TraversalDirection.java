/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

/** Side a navigation hop is driven from. */
public enum TraversalDirection {
  /** Source keys drive the traversal; the target is read for the reached keys. */
  FORWARD,
  /** Target keys drive the traversal; the source is read for the reached keys. */
  REVERSE
}
