package io.texmark.calltree;

import io.texmark.TexmarkException;

/**
 * Grammar violation while folding call arguments: a non-string key, a wrong token where a
 * delimiter or terminator is expected, or the end of input inside an argument list.
 */
public final class ParseException extends TexmarkException {

  private final String callName;

  public ParseException(String message, int line, String callName) {
    super("Error during parsing: " + message, line);
    this.callName = callName;
  }

  /** Name of the call being parsed when the error was found, or null at document level. */
  public String getCallName() {
    return callName;
  }
}
