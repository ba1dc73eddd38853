package io.texmark.token;

/**
 * A word directly followed by {@code (}, or a word promoted by a following closure. Replaced by a
 * {@link CallNode} during call-tree building.
 */
public record FunctionNameCandidate(String name, int line) implements Token {

  @Override
  public boolean intermediate() {
    return true;
  }

  @Override
  public String repr() {
    return "Fn" + name;
  }
}
