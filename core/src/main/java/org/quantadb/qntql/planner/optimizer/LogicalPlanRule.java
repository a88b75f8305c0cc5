/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.planner.optimizer;

import org.quantadb.qntql.planner.logical.LogicalPlan;

/** One rewrite pass over a whole logical plan. */
public interface LogicalPlanRule {

  LogicalPlan apply(LogicalPlan plan);
}
