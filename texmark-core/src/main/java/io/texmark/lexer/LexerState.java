package io.texmark.lexer;

/** Lexer sub-states. They nest, so the lexer keeps them on a stack. */
public enum LexerState {
  /** Document content, at top level or inside a closure body. */
  NORMAL("document text"),
  /** Between a call's parentheses. */
  IN_CALL_ARGS("call arguments"),
  IN_QUOTED_STRING("quoted string"),
  IN_LIST("list literal"),
  IN_OBJECT("object literal"),
  /** The character after a backslash. */
  IN_ESCAPE("escape sequence"),
  /** From % to the end of the line. */
  IN_COMMENT("comment"),
  /** Closure body of a call that takes its body verbatim, up to the matching brace. */
  IN_RAW_BODY("raw body");

  private final String description;

  LexerState(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
