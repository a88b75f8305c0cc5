/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.ast.statement;

import org.quantadb.qntql.parser.Position;

/** {@code attribute = value} in an UPDATE. */
public record Assignment(String attribute, Object value, Position position) {}
