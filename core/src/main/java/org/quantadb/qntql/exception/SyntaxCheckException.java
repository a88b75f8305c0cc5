/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import lombok.Getter;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.parser.Position;

/** Token stream does not match the grammar. */
@Getter
public class SyntaxCheckException extends QueryEngineException {

  private final Position position;

  private final Set<String> expected;

  private final String found;

  public SyntaxCheckException(Position position, Set<String> expected, String found) {
    super(
        StringUtils.format(
            "Syntax error at %s: expected %s but found '%s'",
            position, String.join(" or ", expected), found));
    this.position = position;
    this.expected = ImmutableSet.copyOf(expected);
    this.found = found;
  }

  public SyntaxCheckException(Position position, String message) {
    super(StringUtils.format("Syntax error at %s: %s", position, message));
    this.position = position;
    this.expected = Set.of();
    this.found = "";
  }
}
