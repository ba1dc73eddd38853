package io.texmark.token;

/**
 * Text enclosed in double quotes. {@link #text()} excludes the quotes.
 *
 * @param text contents between the quotes
 * @param line line of the opening quote
 */
public record QuotedString(String text, int line) implements Token, Value {

  /** The string as written in the source, quotes included. */
  public String source() {
    return "\"" + text + "\"";
  }

  @Override
  public String repr() {
    return source();
  }
}
