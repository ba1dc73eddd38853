package io.texmark.translate;

/**
 * A non-fatal style issue found during translation.
 *
 * @param line 1-based source line
 * @param message human-readable description
 */
public record Warning(int line, String message) {

  @Override
  public String toString() {
    return message + " (line " + line + ")";
  }
}
