/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.storage;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A query in one backend's own dialect, with the parameters to bind and the shape of the rows it
 * returns. Instances are immutable; {@link #bind} returns a copy.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class NativeQuery {

  /** Name of the parameter carrying a key set produced by an upstream fragment. */
  public static final String KEYS = "keys";

  /** Key set of the source records a forward traversal starts from. */
  public static final String SOURCE_KEYS = "sourceKeys";

  /** Key set of the target records a reverse traversal starts from. */
  public static final String TARGET_KEYS = "targetKeys";

  private final StorageClassification engine;

  /** Plan fragment this query was translated from, empty for write conditions. */
  private final String fragmentId;

  private final String text;

  private final List<QueryParameter> parameters;

  private final RowShape shape;

  public NativeQuery(
      StorageClassification engine,
      String fragmentId,
      String text,
      List<QueryParameter> parameters,
      RowShape shape) {
    this.engine = engine;
    this.fragmentId = fragmentId;
    this.text = text;
    this.parameters = ImmutableList.copyOf(parameters);
    this.shape = shape;
  }

  /** Value of the named parameter, if the query declares it. */
  public Optional<Object> parameter(String name) {
    return parameters.stream()
        .filter(parameter -> parameter.name().equals(name))
        .findFirst()
        .map(QueryParameter::value);
  }

  public boolean hasParameter(String name) {
    return parameters.stream().anyMatch(parameter -> parameter.name().equals(name));
  }

  /**
   * Returns a copy with the named parameter set to the given value.
   *
   * @throws IllegalArgumentException if the query has no such parameter
   */
  public NativeQuery bind(String name, Object value) {
    if (!hasParameter(name)) {
      throw new IllegalArgumentException("Native query has no parameter " + name + ": " + text);
    }
    ImmutableList.Builder<QueryParameter> bound = ImmutableList.builder();
    for (QueryParameter parameter : parameters) {
      bound.add(parameter.name().equals(name) ? new QueryParameter(name, value) : parameter);
    }
    return new NativeQuery(engine, fragmentId, text, bound.build(), shape);
  }
}
