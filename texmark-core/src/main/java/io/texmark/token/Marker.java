package io.texmark.token;

/**
 * A structural marker with no text of its own.
 *
 * @param kind which structure the marker opens, closes or separates
 * @param line source line
 */
public record Marker(Kind kind, int line) implements Token {

  /** Structural marker kinds. */
  public enum Kind {
    /** ( after a call name */
    START_CALL('(', false, true),
    /** ) */
    END_CALL(')', false, true),
    /** { after a call */
    START_CLOSURE('{', true, false),
    /** } closing a closure */
    END_CLOSURE('}', true, false),
    /** { opening an object literal */
    START_OBJECT('{', true, true),
    /** } closing an object literal */
    END_OBJECT('}', true, true),
    /** [ */
    START_LIST('[', false, true),
    /** ] */
    END_LIST(']', false, true),
    /** , */
    ARG_DELIMITER(',', false, true),
    /** = between a keyword and its value */
    KEYWORD_ASSIGN('=', false, true),
    /** : between an object key and its value */
    KEY_VALUE_DELIMITER(':', false, true),
    /** \\ joining the current line with the next */
    LINE_JOIN('\\', true, false);

    private final char symbol;
    private final boolean endsLine;
    private final boolean intermediate;

    Kind(char symbol, boolean endsLine, boolean intermediate) {
      this.symbol = symbol;
      this.endsLine = endsLine;
      this.intermediate = intermediate;
    }

    public char symbol() {
      return symbol;
    }
  }

  public boolean is(Kind k) {
    return kind == k;
  }

  @Override
  public boolean eatsTrailingNewline() {
    return kind.endsLine;
  }

  @Override
  public boolean intermediate() {
    return kind.intermediate;
  }

  @Override
  public String repr() {
    return switch (kind) {
      case START_CLOSURE -> "StartClo:";
      case END_CLOSURE -> ":EndClo";
      case START_OBJECT -> "StartObj:";
      case END_OBJECT -> ":EndObj";
      default -> String.valueOf(kind.symbol);
    };
  }
}
