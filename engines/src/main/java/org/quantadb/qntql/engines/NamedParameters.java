/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.engines;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.quantadb.qntql.storage.QueryParameter;

/** Parameters of one native query, named {@code p1}, {@code p2}, ... in order of appearance. */
public class NamedParameters {

  private final List<QueryParameter> parameters = new ArrayList<>();

  private int next = 1;

  /** Adds a value and returns its generated name. */
  public String add(Object value) {
    String name = "p" + next++;
    parameters.add(new QueryParameter(name, value));
    return name;
  }

  /** Declares a parameter bound at run time, such as an upstream key set. */
  public String declare(String name) {
    parameters.add(new QueryParameter(name, null));
    return name;
  }

  public List<QueryParameter> build() {
    return ImmutableList.copyOf(parameters);
  }
}
