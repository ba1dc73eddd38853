package io.texmark.translate;

import io.texmark.config.DocumentConfig;
import io.texmark.fn.FnMapping;
import io.texmark.fn.FnRegistry;
import io.texmark.token.CallNode;
import io.texmark.token.Comment;
import io.texmark.token.ListValue;
import io.texmark.token.MathDelimiter;
import io.texmark.token.NewLine;
import io.texmark.token.ObjectValue;
import io.texmark.token.RawText;
import io.texmark.token.QuotedString;
import io.texmark.token.Token;
import io.texmark.token.Value;
import io.texmark.token.Word;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one translation run: the context stack, the scope stack of open closures, the output
 * and the per-run counters. Handlers see it while producing their text.
 *
 * <p>A fresh state is created for every run, so numbering restarts at 1 and nothing leaks between
 * independent translations.
 */
public final class TranslationState {
  private static final Logger log = LoggerFactory.getLogger(TranslationState.class);

  /** A context stack entry; {@code opener} is set for MATH entered through $ or $$. */
  private record Frame(ParseContext context, MathDelimiter opener) {}

  private final FnRegistry registry;
  private final DocumentConfig config;
  private final WarningListener listener;

  private final Deque<Frame> contexts = new ArrayDeque<>();
  private final Deque<FnMapping> scopes = new ArrayDeque<>();
  private final LatexWriter writer = new LatexWriter();
  private final List<Warning> warnings = new ArrayList<>();

  private int problemNumber;
  private boolean documentOpen;

  TranslationState(FnRegistry registry, DocumentConfig config, WarningListener listener) {
    this.registry = registry;
    this.config = config;
    this.listener = listener;
    contexts.push(new Frame(ParseContext.NORMAL, null));
  }

  // ==================== Handler view ====================

  /** Top of the context stack. */
  public ParseContext currentContext() {
    return contexts.peek().context();
  }

  /** Whether text is currently in math mode, looking through argument rendering. */
  public boolean inMath() {
    for (Frame f : contexts) {
      if (f.context() != ParseContext.FN_ARG) {
        return f.context() == ParseContext.MATH;
      }
    }
    return false;
  }

  /** Next problem number of this run, starting at 1. */
  public int nextProblemNumber() {
    return ++problemNumber;
  }

  public DocumentConfig config() {
    return config;
  }

  /**
   * Marks the document body as opened, so the run ends with {@code \end{document}}.
   *
   * @return false if the document was already open
   */
  public boolean openDocument() {
    boolean first = !documentOpen;
    documentOpen = true;
    return first;
  }

  /** Renders an argument value as LaTeX text. Nested calls render inline. */
  public String render(Value value) {
    if (value == null) {
      return "";
    }
    contexts.push(new Frame(ParseContext.FN_ARG, null));
    try {
      return renderValue(value);
    } finally {
      contexts.pop();
    }
  }

  public void warn(int line, String message) {
    Warning w = new Warning(line, message);
    log.warn("{}", w);
    warnings.add(w);
    listener.onWarning(w);
  }

  private String renderValue(Value value) {
    if (value instanceof Word w) {
      return w.text();
    }
    if (value instanceof QuotedString q) {
      return q.text();
    }
    if (value instanceof ListValue l) {
      return l.items().stream().map(this::renderValue).collect(Collectors.joining(", "));
    }
    if (value instanceof ObjectValue o) {
      return o.entries().entrySet().stream()
          .map(e -> e.getKey() + "=" + renderValue(e.getValue()))
          .collect(Collectors.joining(", "));
    }
    CallNode call = (CallNode) value;
    FnMapping fn = resolve(call);
    return fn.begin(this) + fn.end();
  }

  // ==================== Walker operations ====================

  FnMapping invoke(CallNode call) {
    FnMapping fn = resolve(call);
    writer.append(fn.begin(this));
    return fn;
  }

  void openScope(FnMapping fn) {
    scopes.push(fn);
    ParseContext body = fn.bodyContext();
    contexts.push(
        new Frame(body == ParseContext.INHERIT_PARENT ? currentContext() : body, null));
    if (fn.indentedBody()) {
      writer.indent();
    }
  }

  void closeScope(int line) throws TranslationException {
    if (scopes.isEmpty()) {
      throw new TranslationException("'}' without an open closure", line);
    }
    Frame top = contexts.peek();
    if (top.opener() != null) {
      throw new TranslationException(
          "math mode opened on line " + top.opener().line() + " is still open at '}'", line);
    }
    ParseContext body = contexts.pop().context();
    FnMapping fn = scopes.pop();
    if (fn.indentedBody()) {
      writer.dedent();
    }
    if (body == ParseContext.RAW) {
      // text before the closing command on its line belongs to the verbatim content
      writer.appendRaw(fn.end());
    } else {
      writer.append(fn.end());
    }
  }

  void toggleMath(MathDelimiter delimiter) {
    Frame top = contexts.peek();
    if (top.opener() != null) {
      if (top.opener().isDouble() != delimiter.isDouble()) {
        warn(
            delimiter.line(),
            "math opened with " + top.opener().symbol() + " but closed with " + delimiter.symbol());
      }
      contexts.pop();
    } else {
      contexts.push(new Frame(ParseContext.MATH, delimiter));
    }
    writer.append(delimiter.symbol());
  }

  void newLine(NewLine newLine, boolean afterBlockCall) {
    if (!newLine.afterLineEnd() && !afterBlockCall && currentContext().substitutions()) {
      writer.append("\\\\");
    }
    writer.newLine();
  }

  void raw(RawText raw) {
    writer.appendRaw(raw.text());
  }

  void text(Token token) {
    String literal;
    if (token instanceof Word w) {
      literal = w.text();
    } else if (token instanceof QuotedString q) {
      literal = q.source();
    } else {
      literal = ((Comment) token).source();
    }
    writer.append(literal);
  }

  String finish(int line) throws TranslationException {
    if (!scopes.isEmpty()) {
      throw new TranslationException("closure is never closed", line);
    }
    Frame top = contexts.peek();
    if (top.opener() != null) {
      throw new TranslationException(
          "unbalanced " + top.opener().symbol() + ": math mode opened on line "
              + top.opener().line() + " is never closed",
          line);
    }
    if (documentOpen) {
      writer.ensureLineStart();
      writer.append("\\end{document}");
      writer.newLine();
    }
    return writer.toString();
  }

  List<Warning> warnings() {
    return warnings;
  }

  private FnMapping resolve(CallNode call) {
    String name = call.name();
    if (!name.isEmpty() && Character.isLowerCase(name.charAt(0))) {
      warn(call.line(), "call name '" + name + "' should be capitalized");
    }
    return registry.resolve(call);
  }
}
