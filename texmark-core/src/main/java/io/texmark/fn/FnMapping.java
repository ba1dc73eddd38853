package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.token.QuotedString;
import io.texmark.token.Value;
import io.texmark.token.Word;
import io.texmark.translate.ParseContext;
import io.texmark.translate.TranslationState;
import java.util.List;
import java.util.Map;

/**
 * Produces the LaTeX for one resolved call. An instance is bound to a single {@link CallNode}:
 * {@link #begin} is emitted where the call appears and {@link #end} when its closure closes. A call
 * without a closure never has {@code end()} invoked.
 */
public abstract sealed class FnMapping
    permits DefaultFn, MathFn, HeaderFn, ProblemFn, PartFn, FontFn, ImageFn, VerbatimFn {

  protected final CallNode call;
  private final boolean indentedBody;

  protected FnMapping(CallNode call, boolean indentedBody) {
    this.call = call;
    this.indentedBody = indentedBody;
  }

  /** Opening text. May use per-run state such as the problem counter. */
  public abstract String begin(TranslationState state);

  /** Closing text, emitted when the closure body ends. */
  public abstract String end();

  /** Context of the closure body; {@link ParseContext#INHERIT_PARENT} keeps the enclosing one. */
  public ParseContext bodyContext() {
    return ParseContext.INHERIT_PARENT;
  }

  /** Whether the closure body is a block whose lines are indented. */
  public boolean indentedBody() {
    return indentedBody;
  }

  /** Whether {@code begin()} already ends its output line when used without a closure. */
  public boolean endsLine() {
    return false;
  }

  public CallNode call() {
    return call;
  }

  protected List<Value> args() {
    return call.positionalArgs();
  }

  protected Map<String, Value> kwargs() {
    return call.keywordArgs();
  }

  /** The {@code name=} keyword, falling back to the first positional argument; null if neither. */
  protected String nameArg(TranslationState state) {
    Value v = call.kwarg("name");
    if (v == null) {
      v = call.arg(0);
    }
    return v == null ? null : state.render(v);
  }

  /** Text of a word or quoted string; null for anything else. */
  protected static String literal(Value v) {
    if (v instanceof Word w) {
      return w.text();
    }
    if (v instanceof QuotedString q) {
      return q.text();
    }
    return null;
  }

  /** Each positional argument rendered into its own brace group: {@code {a}{b}}. */
  protected String braceGroups(TranslationState state) {
    StringBuilder sb = new StringBuilder();
    for (Value a : args()) {
      sb.append('{').append(state.render(a)).append('}');
    }
    return sb.toString();
  }

  /** Keyword arguments as a LaTeX option list {@code [k=v,...]}, or empty when there are none. */
  protected String options(TranslationState state) {
    if (kwargs().isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("[");
    kwargs()
        .forEach(
            (k, v) -> {
              if (sb.length() > 1) {
                sb.append(',');
              }
              sb.append(k).append('=').append(state.render(v));
            });
    return sb.append(']').toString();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + call.name() + ")";
  }
}
