/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import org.quantadb.qntql.ast.expression.Expression;

/**
 * One FIND output.
 *
 * @param expression attribute reference or aggregate call
 * @param allAttributes {@code ref.*}, every attribute of the referenced record
 * @param alias output name given with {@code AS}, may be null
 */
public record Projection(Expression expression, boolean allAttributes, String alias) {}
