package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.TranslationState;

/**
 * Font switches such as {@code Bold} and {@code Italic}. Picks the math variant inside math mode.
 * With positional arguments the call is inline and closes itself: {@code Bold(x)} gives {@code
 * \textbf{x}}.
 */
public final class FontFn extends FnMapping {
  private final String textCommand;
  private final String mathCommand;
  private boolean inline;

  FontFn(CallNode call, String textCommand, String mathCommand) {
    super(call, false);
    this.textCommand = textCommand;
    this.mathCommand = mathCommand;
  }

  static FontFn bold(CallNode call) {
    return new FontFn(call, "textbf", "mathbf");
  }

  static FontFn italic(CallNode call) {
    return new FontFn(call, "textit", "mathit");
  }

  @Override
  public String begin(TranslationState state) {
    String command = state.inMath() ? mathCommand : textCommand;
    inline = !args().isEmpty();
    if (inline) {
      StringBuilder sb = new StringBuilder("\\").append(command).append('{');
      for (int i = 0; i < args().size(); i++) {
        if (i > 0) {
          sb.append(' ');
        }
        sb.append(state.render(args().get(i)));
      }
      return sb.append('}').toString();
    }
    return "\\" + command + "{";
  }

  @Override
  public String end() {
    return inline ? "" : "}";
  }
}
