package io.texmark.translate;

import io.texmark.config.DocumentConfig;
import io.texmark.fn.FnMapping;
import io.texmark.fn.FnRegistry;
import io.texmark.token.CallNode;
import io.texmark.token.FunctionNameCandidate;
import io.texmark.token.Marker;
import io.texmark.token.MathDelimiter;
import io.texmark.token.NewLine;
import io.texmark.token.RawText;
import io.texmark.token.Token;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a refined token sequence once, left to right, and emits LaTeX.
 *
 * <ul>
 *   <li>A call emits its handler's {@code begin()} immediately. If a closure follows, the handler
 *       is pushed on the scope stack together with its body context and its {@code end()} is
 *       emitted when the closure closes; otherwise {@code end()} is never called.
 *   <li>{@code $}/{@code $$} toggle math mode.
 *   <li>A verbatim body is emitted exactly as written, without spacing or indentation.
 *   <li>A newline emits a forced break {@code \\} unless its predecessor already ended the line,
 *       either as a token or as a call whose handler produces a whole line (a document header).
 * </ul>
 */
public final class Translator {
  private static final Logger log = LoggerFactory.getLogger(Translator.class);

  private final FnRegistry registry;
  private final DocumentConfig config;
  private final WarningListener listener;

  public Translator() {
    this(FnRegistry.defaults(), DocumentConfig.empty(), WarningListener.NONE);
  }

  public Translator(FnRegistry registry, DocumentConfig config, WarningListener listener) {
    this.registry = registry;
    this.config = config;
    this.listener = listener;
  }

  /**
   * Translates one document. Every call starts a new run with its own counters.
   *
   * @param tokens output of the call-tree builder
   * @throws TranslationException if closures or math mode are unbalanced
   */
  public Translation translate(List<Token> tokens) throws TranslationException {
    TranslationState state = new TranslationState(registry, config, listener);
    FnMapping pending = null;
    int line = 1;
    for (Token token : tokens) {
      line = token.line();
      if (token instanceof Marker m && m.is(Marker.Kind.START_CLOSURE)) {
        if (pending == null) {
          throw new TranslationException("closure does not follow a call", m.line());
        }
        state.openScope(pending);
        pending = null;
        continue;
      }
      FnMapping previous = pending;
      pending = null;
      if (token instanceof CallNode call) {
        pending = state.invoke(call);
      } else if (token instanceof Marker m) {
        marker(state, m);
      } else if (token instanceof MathDelimiter d) {
        state.toggleMath(d);
      } else if (token instanceof NewLine nl) {
        state.newLine(nl, previous != null && previous.endsLine());
      } else if (token instanceof RawText raw) {
        state.raw(raw);
      } else if (token instanceof FunctionNameCandidate f) {
        throw new TranslationException("unresolved call name " + f.name(), f.line());
      } else {
        state.text(token);
      }
    }
    String latex = state.finish(line);
    log.debug("Translated {} tokens into {} chars", tokens.size(), latex.length());
    return new Translation(latex, state.warnings());
  }

  private static void marker(TranslationState state, Marker m) throws TranslationException {
    switch (m.kind()) {
      case END_CLOSURE -> state.closeScope(m.line());
      case LINE_JOIN -> {
        // only affects the following newline, already recorded on it
      }
      default -> throw new TranslationException("unexpected " + m.repr(), m.line());
    }
  }
}
