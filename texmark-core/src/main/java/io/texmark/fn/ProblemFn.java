package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.TranslationState;

/**
 * {@code Problem(name="...") { ... }}: a numbered, unnumbered-section heading followed by an
 * enumerate of parts. Numbers come from the run's counter and start at 1.
 */
public final class ProblemFn extends FnMapping {

  ProblemFn(CallNode call) {
    super(call, true);
  }

  @Override
  public String begin(TranslationState state) {
    int n = state.nextProblemNumber();
    String name = nameArg(state);
    if (name == null) {
      state.warn(call.line(), "Problem " + n + " has no name");
      return "\\subsection*{" + n + ".} \\begin{enumerate}";
    }
    return "\\subsection*{" + n + ". " + name + "} \\begin{enumerate}";
  }

  @Override
  public String end() {
    return "\\end{enumerate} \\clearpage";
  }
}
