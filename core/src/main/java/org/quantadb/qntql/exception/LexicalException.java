/*
 * Copyright QuantaDB Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quantadb.qntql.exception;

import lombok.Getter;
import org.quantadb.qntql.common.utils.StringUtils;
import org.quantadb.qntql.parser.Position;

/** Unrecognized character or unterminated literal in the query text. */
@Getter
public class LexicalException extends QueryEngineException {

  private final Position position;

  private final char unexpectedChar;

  public LexicalException(Position position, char unexpectedChar, String detail) {
    super(StringUtils.format("%s '%s' at %s", detail, unexpectedChar, position));
    this.position = position;
    this.unexpectedChar = unexpectedChar;
  }
}
