package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.ParseContext;
import io.texmark.translate.TranslationState;

/** {@code Math { ... }}: an {@code align} block whose body is in math mode. */
public final class MathFn extends FnMapping {
  private final String environment;

  MathFn(CallNode call) {
    super(call, true);
    boolean numbered = !"false".equalsIgnoreCase(literal(call.kwarg("numbered")));
    this.environment = numbered ? "align" : "align*";
  }

  @Override
  public String begin(TranslationState state) {
    return "\\begin{" + environment + "}";
  }

  @Override
  public String end() {
    return "\\end{" + environment + "}";
  }

  @Override
  public ParseContext bodyContext() {
    return ParseContext.MATH;
  }
}
