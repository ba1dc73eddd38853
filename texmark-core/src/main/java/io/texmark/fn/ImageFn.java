package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.TranslationState;

/** {@code Image("path", width="...")}: an inline {@code \includegraphics}. */
public final class ImageFn extends FnMapping {

  ImageFn(CallNode call) {
    super(call, false);
  }

  @Override
  public String begin(TranslationState state) {
    String path = state.render(call.arg(0));
    if (path.isEmpty()) {
      state.warn(call.line(), "Image without a path");
    }
    return "\\includegraphics" + options(state) + "{" + path + "}";
  }

  @Override
  public String end() {
    return "";
  }
}
