package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.ParseContext;
import io.texmark.translate.TranslationState;

/** {@code Verbatim { ... }}: body passes through without forced line breaks. */
public final class VerbatimFn extends FnMapping {

  VerbatimFn(CallNode call) {
    super(call, false);
  }

  @Override
  public String begin(TranslationState state) {
    return "\\begin{verbatim}";
  }

  @Override
  public String end() {
    return "\\end{verbatim}";
  }

  @Override
  public ParseContext bodyContext() {
    return ParseContext.RAW;
  }
}
