/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

/** Named value to bind into a native query. Positional dialects bind in list order. */
public record QueryParameter(String name, Object value) {}
