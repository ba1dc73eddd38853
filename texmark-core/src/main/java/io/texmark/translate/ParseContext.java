package io.texmark.translate;

/**
 * The context literal text is emitted in. Contexts form a stack whose bottom is always {@link
 * #NORMAL}.
 */
public enum ParseContext {
  NORMAL(true),
  /** Math mode, entered by $, $$ or a math block such as {@code Math { }}. */
  MATH(true),
  /** Rendering a handler's arguments. */
  FN_ARG(true),
  /**
   * Body of a verbatim block. Its text arrives as one {@link io.texmark.token.RawText} and passes
   * through untouched; newlines never emit forced line breaks.
   */
  RAW(false),
  /** Declared body context meaning "whatever encloses the call". Never pushed itself. */
  INHERIT_PARENT(true);

  private final boolean substitutions;

  ParseContext(boolean substitutions) {
    this.substitutions = substitutions;
  }

  /** Whether text in this context is rendered, as opposed to passed through verbatim. */
  public boolean substitutions() {
    return substitutions;
  }
}
