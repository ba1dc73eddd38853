package io.texmark.token;

/**
 * An unescaped {@code $} or {@code $$}.
 *
 * @param isDouble true for {@code $$}
 * @param line source line
 */
public record MathDelimiter(boolean isDouble, int line) implements Token {

  public String symbol() {
    return isDouble ? "$$" : "$";
  }

  /** Two adjacent single delimiters collapse into one double delimiter. */
  public MathDelimiter doubled() {
    return new MathDelimiter(true, line);
  }

  @Override
  public String repr() {
    return symbol();
  }
}
