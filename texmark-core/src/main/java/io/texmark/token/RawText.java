package io.texmark.token;

/**
 * The body of a closure whose call takes its body verbatim, exactly as written between the
 * braces.
 *
 * @param text body text, spacing and backslashes preserved
 * @param line line of the opening brace
 */
public record RawText(String text, int line) implements Token {

  @Override
  public String repr() {
    return "Raw(" + text.length() + " chars)";
  }
}
