/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import org.quantadb.qntql.ast.expression.Expression;

/** ORDER BY item over a resolved attribute or an aggregate. */
public record SortKey(Expression expression, boolean ascending) {}
