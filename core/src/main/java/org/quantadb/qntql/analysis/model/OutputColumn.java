/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import org.quantadb.qntql.ast.expression.Expression;

/**
 * One value of a result row.
 *
 * @param group record alias the value is nested under, null for top-level values
 * @param name key of the value in its group
 * @param expression resolved attribute or aggregate call producing the value
 */
public record OutputColumn(String group, String name, Expression expression) {}
