package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.TranslationState;

/** {@code Part(name="a") { ... }}: one item of the enclosing problem. */
public final class PartFn extends FnMapping {

  PartFn(CallNode call) {
    super(call, true);
  }

  @Override
  public String begin(TranslationState state) {
    String name = nameArg(state);
    return name == null ? "\\item" : "\\item " + name + " \\\\";
  }

  @Override
  public String end() {
    return "";
  }
}
