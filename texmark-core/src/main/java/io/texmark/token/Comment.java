package io.texmark.token;

/**
 * A line comment. {@link #text()} is everything after the {@code %} up to the end of the line.
 */
public record Comment(String text, int line) implements Token {

  public String source() {
    return "%" + text;
  }

  @Override
  public boolean eatsTrailingNewline() {
    return true;
  }

  @Override
  public String repr() {
    return "%(...)";
  }
}
