package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.TranslationState;

/**
 * Fallback for names without a dedicated handler. Emits a block environment {@code
 * \begin{name}[opts]{arg}...} / {@code \end{name}}, or for command names a single command with
 * one brace group per positional argument, such as {@code \frac{a}{b}}.
 */
public final class DefaultFn extends FnMapping {
  private final String name;
  private final boolean command;

  DefaultFn(CallNode call, String name, boolean command) {
    super(call, false);
    this.name = name;
    this.command = command;
  }

  /** The LaTeX environment or command name after aliasing and lower-casing. */
  public String latexName() {
    return name;
  }

  public boolean isCommand() {
    return command;
  }

  @Override
  public String begin(TranslationState state) {
    if (command) {
      return "\\" + name + braceGroups(state);
    }
    return "\\begin{" + name + "}" + options(state) + braceGroups(state);
  }

  @Override
  public String end() {
    return command ? "" : "\\end{" + name + "}";
  }
}
