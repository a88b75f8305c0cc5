/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import org.quantadb.qntql.ast.expression.Expression;

public record OrderItem(Expression expression, boolean ascending) {}
