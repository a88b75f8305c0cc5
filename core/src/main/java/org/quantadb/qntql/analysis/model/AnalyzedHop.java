/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.analysis.model;

import org.quantadb.qntql.ast.expression.ResolvedAttribute;
import org.quantadb.qntql.catalog.model.RecordSchema;

/**
 * Navigation hop resolved against the relation attribute it follows.
 *
 * @param sourceAlias alias of the record the hop leaves from
 * @param relation relation attribute of the source record
 * @param targetAlias alias the target record is bound to
 * @param target target record schema
 */
public record AnalyzedHop(
    String sourceAlias, ResolvedAttribute relation, String targetAlias, RecordSchema target) {}
