/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

import java.util.List;
import java.util.Map;
import org.quantadb.qntql.catalog.model.AttributeDefinition;

/**
 * Contract the engine requires from each external storage backend. These are the only operations
 * the engine issues against storage; connections, credentials and deployment belong to the
 * implementation.
 *
 * <p>Rows are exchanged as maps from column name to value. Every row carries the record key under
 * the key column named by the {@link RowShape} of the query (or by the record's key attribute for
 * writes).
 *
 * <p>{@code txnId} is the id of this backend's {@link TransactionHandle} when the call is part of a
 * transaction, or null otherwise.
 */
public interface StorageAdapter {

  /** Opens a sub-transaction on this backend. */
  TransactionHandle beginTransaction();

  /** First phase of commit. Must fail if the backend cannot guarantee the commit. */
  void prepareCommit(TransactionHandle handle);

  void commit(TransactionHandle handle);

  void rollback(TransactionHandle handle);

  /** Creates whatever backend structure stores one attribute of a record. */
  void provisionAttribute(
      String bucket, String record, String attribute, AttributeDefinition definition);

  /**
   * Runs a read.
   *
   * @param attributes attributes the query projects
   * @param query translated native query with its parameters bound
   */
  List<Map<String, Object>> select(
      String bucket, String record, List<String> attributes, NativeQuery query, String txnId);

  void insert(String bucket, String record, Map<String, Object> values, String txnId);

  /**
   * Updates matching records.
   *
   * @param condition native condition, null to update every record
   * @return number of records updated
   */
  long update(
      String bucket,
      String record,
      Map<String, Object> values,
      NativeQuery condition,
      String txnId);

  /**
   * Deletes matching records.
   *
   * @param condition native condition, null to delete every record
   * @return number of records deleted
   */
  long delete(String bucket, String record, NativeQuery condition, String txnId);
}
