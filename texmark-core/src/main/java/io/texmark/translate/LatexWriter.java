package io.texmark.translate;

/**
 * Accumulates output fragments. Fragments on the same line are separated by a single space except
 * after an opening brace and before a closing one; lines inside block bodies are indented.
 */
final class LatexWriter {
  private static final String INDENT = "  ";

  private final StringBuilder out = new StringBuilder();
  private int depth;

  void append(String fragment) {
    if (fragment == null || fragment.isEmpty()) {
      return;
    }
    if (atLineStart()) {
      if (fragment.charAt(0) != '\n') {
        out.append(INDENT.repeat(depth));
      }
    } else if (needsSeparator(fragment)) {
      out.append(' ');
    }
    out.append(fragment);
  }

  /** Appends {@code text} as is: no separator, no indentation. */
  void appendRaw(String text) {
    out.append(text);
  }

  void newLine() {
    out.append('\n');
  }

  void ensureLineStart() {
    if (!atLineStart()) {
      out.append('\n');
    }
  }

  void indent() {
    depth++;
  }

  void dedent() {
    if (depth > 0) {
      depth--;
    }
  }

  private boolean atLineStart() {
    return out.length() == 0 || out.charAt(out.length() - 1) == '\n';
  }

  private boolean needsSeparator(String fragment) {
    char last = out.charAt(out.length() - 1);
    char first = fragment.charAt(0);
    return !Character.isWhitespace(last)
        && last != '{'
        && !Character.isWhitespace(first)
        && first != '}';
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
