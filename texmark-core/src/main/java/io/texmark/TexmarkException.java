package io.texmark;

/**
 * Base class of the errors that abort a compile. Every error carries the 1-based source line it
 * was detected on.
 */
public class TexmarkException extends Exception {

  private final int line;
  private final String rawMessage;

  public TexmarkException(String message, int line) {
    super(message + " (line " + line + ")");
    this.line = line;
    this.rawMessage = message;
  }

  public TexmarkException(String message, int line, Throwable cause) {
    super(message + " (line " + line + ")", cause);
    this.line = line;
    this.rawMessage = message;
  }

  /** 1-based source line. */
  public int getLine() {
    return line;
  }

  /** The message without the line suffix. */
  public String getRawMessage() {
    return rawMessage;
  }
}
