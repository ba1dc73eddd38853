package io.texmark.token;

/**
 * A source newline.
 *
 * @param afterLineEnd true when the preceding token already ends the line, in which case no
 *     forced line break is emitted for this newline
 * @param line line the newline terminates
 */
public record NewLine(boolean afterLineEnd, int line) implements Token {

  @Override
  public String repr() {
    return afterLineEnd ? "\\n" : "\\\\\\n";
  }
}
