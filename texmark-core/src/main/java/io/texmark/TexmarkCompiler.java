package io.texmark;

import io.texmark.calltree.CallTreeBuilder;
import io.texmark.calltree.DuplicateKeyPolicy;
import io.texmark.config.DocumentConfig;
import io.texmark.fn.FnRegistry;
import io.texmark.lexer.Lexer;
import io.texmark.token.Token;
import io.texmark.translate.Translation;
import io.texmark.translate.Translator;
import io.texmark.translate.WarningListener;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles texmark markup to LaTeX: lexing, call-tree building and translation, in that order.
 * The first error aborts the compile; no partial output is returned.
 *
 * <pre>
 * Translation t = TexmarkCompiler.builder().config(DocumentConfig.load(path)).build()
 *     .compile(source);
 * </pre>
 *
 * Instances are immutable and hold no per-run state, so one compiler can be reused.
 */
public final class TexmarkCompiler {
  private static final Logger log = LoggerFactory.getLogger(TexmarkCompiler.class);

  private final FnRegistry registry;
  private final DocumentConfig config;
  private final DuplicateKeyPolicy duplicateKeys;
  private final WarningListener listener;

  private TexmarkCompiler(Builder b) {
    this.registry = b.registry;
    this.config = b.config;
    this.duplicateKeys = b.duplicateKeys;
    this.listener = b.listener;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A compiler with the built-in handlers and blank header fields. */
  public static TexmarkCompiler create() {
    return builder().build();
  }

  public Translation compile(String source) throws TexmarkException {
    try {
      return compile(new StringReader(source));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public Translation compile(Reader source) throws IOException, TexmarkException {
    List<Token> refined = tokens(source);
    Translation t = new Translator(registry, config, listener).translate(refined);
    log.debug("Compiled document with {} warning(s)", t.warnings().size());
    return t;
  }

  /** Runs the first two stages only and returns the refined token sequence. */
  public List<Token> tokens(Reader source) throws IOException, TexmarkException {
    List<Token> lexed = new Lexer(source, registry.rawBodyNames()).lex();
    return new CallTreeBuilder(duplicateKeys).build(lexed);
  }

  public static final class Builder {
    private FnRegistry registry = FnRegistry.defaults();
    private DocumentConfig config = DocumentConfig.empty();
    private DuplicateKeyPolicy duplicateKeys = DuplicateKeyPolicy.OVERWRITE;
    private WarningListener listener = WarningListener.NONE;

    private Builder() {}

    public Builder registry(FnRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder config(DocumentConfig config) {
      this.config = config;
      return this;
    }

    public Builder duplicateKeys(DuplicateKeyPolicy duplicateKeys) {
      this.duplicateKeys = duplicateKeys;
      return this;
    }

    /** Shorthand for {@code duplicateKeys(REJECT)}. */
    public Builder strictKeys(boolean strict) {
      return duplicateKeys(strict ? DuplicateKeyPolicy.REJECT : DuplicateKeyPolicy.OVERWRITE);
    }

    public Builder warnings(WarningListener listener) {
      this.listener = listener;
      return this;
    }

    public TexmarkCompiler build() {
      return new TexmarkCompiler(this);
    }
  }
}
