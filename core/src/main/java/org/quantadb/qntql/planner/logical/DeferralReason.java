/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.logical;

/** Why a predicate is evaluated by the result assembler instead of an engine. */
public enum DeferralReason {
  /** References attributes stored by more than one engine. */
  CROSS_ENGINE,
  /** References more than one record of the query. */
  MULTI_RECORD,
  /** The owning engine cannot express it. */
  NOT_PUSHABLE
}
