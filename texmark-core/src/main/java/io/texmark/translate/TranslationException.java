package io.texmark.translate;

import io.texmark.TexmarkException;

/**
 * The refined token sequence cannot be translated: unbalanced closures, math mode left open, or
 * tokens that should have been resolved before translation.
 */
public final class TranslationException extends TexmarkException {

  public TranslationException(String message, int line) {
    super("Error during translation: " + message, line);
  }
}
