package io.texmark.token;

/**
 * A bare run of characters delimited by whitespace or structural characters.
 *
 * @param text the characters of the word, escapes already resolved
 * @param line source line
 */
public record Word(String text, int line) implements Token, Value {

  /** Re-tags this word as a call name; used when a closure directly follows it. */
  public FunctionNameCandidate toCallName() {
    return new FunctionNameCandidate(text, line);
  }

  @Override
  public String repr() {
    return text;
  }
}
