package io.texmark.token;

/**
 * A token produced by the lexer, or by the call-tree builder once argument runs have been folded
 * into {@link CallNode}s.
 *
 * <p>Tokens are immutable values. The only fact a {@link NewLine} needs about its predecessor is
 * captured at lex time through {@link #eatsTrailingNewline()}.
 */
public sealed interface Token
    permits Word,
        QuotedString,
        Comment,
        NewLine,
        MathDelimiter,
        Marker,
        FunctionNameCandidate,
        CallNode,
        RawText {

  /** 1-based source line the token starts on. */
  int line();

  /**
   * Whether this token already ends its line, so a newline directly after it must not emit a
   * forced line break.
   */
  default boolean eatsTrailingNewline() {
    return false;
  }

  /**
   * A token is intermediate if it only has meaning while call arguments are being folded. No
   * intermediate token may survive call-tree building.
   */
  default boolean intermediate() {
    return false;
  }

  /** Short debug rendering, used by token dumps and error messages. */
  String repr();
}
