package io.texmark.lexer;

import io.texmark.TexmarkException;

/**
 * Malformed character sequence: unterminated string, list, object, call or closure, a delimiter
 * that is not valid in the current sub-state, or a closure with nothing preceding it.
 */
public final class LexException extends TexmarkException {

  public LexException(String message, int line) {
    super("Error during lexing: " + message, line);
  }
}
