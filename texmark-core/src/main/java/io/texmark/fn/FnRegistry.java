package io.texmark.fn;

import io.texmark.token.CallNode;
import io.texmark.translate.ParseContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps call names (case-sensitive) to handler factories. Names without a factory resolve to {@link
 * DefaultFn}: the name is looked up in the alias table, otherwise lower-cased, and emitted as a
 * block environment, or as a command when it is one of the command names.
 *
 * <p>Built-in handlers:
 *
 * <ul>
 *   <li>{@code Math}, {@code math}: align block in math mode
 *   <li>{@code Header}: document preamble
 *   <li>{@code Problem}, {@code Part}: numbered problems and their items
 *   <li>{@code Bold}, {@code Italic}: font switches
 *   <li>{@code Image}: inline graphics
 *   <li>{@code Verbatim}: raw block
 * </ul>
 *
 * <p>Registries are immutable; {@link #builder()} starts from the built-ins.
 */
public final class FnRegistry {

  /** Creates the handler bound to one call. */
  @FunctionalInterface
  public interface FnFactory {
    FnMapping create(CallNode call);
  }

  private static final FnRegistry DEFAULTS = builder().build();

  private final Map<String, FnFactory> handlers;
  private final Map<String, String> aliases;
  private final Set<String> commandNames;
  private final Set<String> rawBodyNames;

  private FnRegistry(Builder b) {
    this.handlers = Map.copyOf(b.handlers);
    this.aliases = Map.copyOf(b.aliases);
    this.commandNames = Set.copyOf(b.commandNames);
    Set<String> raw = new TreeSet<>();
    handlers.forEach(
        (name, factory) -> {
          FnMapping sample = factory.create(new CallNode(name, List.of(), Map.of(), 0));
          if (sample.bodyContext() == ParseContext.RAW) {
            raw.add(name);
          }
        });
    this.rawBodyNames = Collections.unmodifiableSet(raw);
  }

  /** The built-in registry. */
  public static FnRegistry defaults() {
    return DEFAULTS;
  }

  /** A builder pre-populated with the built-in handlers, aliases and command names. */
  public static Builder builder() {
    return new Builder()
        .handler("Math", MathFn::new)
        .handler("math", MathFn::new)
        .handler("Header", HeaderFn::new)
        .handler("Problem", ProblemFn::new)
        .handler("Part", PartFn::new)
        .handler("Bold", FontFn::bold)
        .handler("Italic", FontFn::italic)
        .handler("Image", ImageFn::new)
        .handler("Verbatim", VerbatimFn::new)
        .alias("Box", "mdframed")
        .command("frac")
        .command("mathbb");
  }

  /** Binds a handler to {@code call}. Never returns null. */
  public FnMapping resolve(CallNode call) {
    FnFactory factory = handlers.get(call.name());
    if (factory != null) {
      return factory.create(call);
    }
    String name = latexName(call.name());
    return new DefaultFn(call, name, commandNames.contains(name));
  }

  /** Whether {@code name} has a dedicated handler. */
  public boolean isRegistered(String name) {
    return handlers.containsKey(name);
  }

  /** The LaTeX name the default handler uses for {@code callName}. */
  public String latexName(String callName) {
    String alias = aliases.get(callName);
    return alias != null ? alias : callName.toLowerCase(Locale.ROOT);
  }

  /** Names whose handler takes its closure body verbatim, sorted. The lexer needs these. */
  public Set<String> rawBodyNames() {
    return rawBodyNames;
  }

  /** Registered names, sorted. */
  public Set<String> names() {
    return new TreeSet<>(handlers.keySet());
  }

  public static final class Builder {
    private final Map<String, FnFactory> handlers = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final Set<String> commandNames = new TreeSet<>();

    private Builder() {}

    /** Maps {@code name} to a factory, replacing any earlier mapping. */
    public Builder handler(String name, FnFactory factory) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Handler name cannot be null or empty");
      }
      handlers.put(name, factory);
      return this;
    }

    /** Maps {@code name} to the handler already registered as {@code existing}. */
    public Builder sameAs(String name, String existing) {
      FnFactory factory = handlers.get(existing);
      if (factory == null) {
        throw new IllegalArgumentException("No handler registered as " + existing);
      }
      return handler(name, factory);
    }

    /** Makes the default handler emit {@code latexName} for calls named {@code name}. */
    public Builder alias(String name, String latexName) {
      aliases.put(name, latexName);
      return this;
    }

    /** Makes the default handler emit {@code \latexName{..}{..}} instead of an environment. */
    public Builder command(String latexName) {
      commandNames.add(latexName);
      return this;
    }

    public FnRegistry build() {
      return new FnRegistry(this);
    }
  }
}
