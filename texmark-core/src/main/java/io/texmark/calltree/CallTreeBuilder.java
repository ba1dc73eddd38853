package io.texmark.calltree;

import io.texmark.token.CallNode;
import io.texmark.token.Comment;
import io.texmark.token.FunctionNameCandidate;
import io.texmark.token.ListValue;
import io.texmark.token.Marker;
import io.texmark.token.Marker.Kind;
import io.texmark.token.NewLine;
import io.texmark.token.ObjectValue;
import io.texmark.token.QuotedString;
import io.texmark.token.Token;
import io.texmark.token.Value;
import io.texmark.token.Word;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds each {@link FunctionNameCandidate} and its bracketed argument run into a single {@link
 * CallNode}, recursively. The result is the lexer's sequence with every call collapsed.
 *
 * <p>Grammar:
 *
 * <pre>
 * call    := NAME '(' ( arg ( ',' arg )* )? ')'
 * arg     := value | key '=' value
 * value   := WORD | STRING | call | list | object
 * list    := '[' ( value ( ',' value )* )? ']'
 * object  := '{' ( key ':' value ( ',' key ':' value )* )? '}'
 * key     := WORD | STRING
 * </pre>
 *
 * Comments, newlines and line joins between argument tokens are ignored.
 */
public final class CallTreeBuilder {

  private static final Logger log = LoggerFactory.getLogger(CallTreeBuilder.class);

  private final DuplicateKeyPolicy duplicateKeys;

  private List<Token> input;
  private int pos;

  public CallTreeBuilder() {
    this(DuplicateKeyPolicy.OVERWRITE);
  }

  public CallTreeBuilder(DuplicateKeyPolicy duplicateKeys) {
    this.duplicateKeys = duplicateKeys;
  }

  /** Builds the refined token sequence for the lexer output {@code tokens}. */
  public List<Token> build(List<Token> tokens) throws ParseException {
    this.input = tokens;
    this.pos = 0;
    List<Token> out = new ArrayList<>(tokens.size());
    int calls = 0;
    while (pos < input.size()) {
      Token t = input.get(pos++);
      if (t instanceof FunctionNameCandidate name) {
        out.add(parseCall(name));
        calls++;
      } else if (t.intermediate()) {
        throw new ParseException(
            "unexpected " + t.repr() + " outside of a call's arguments", t.line(), null);
      } else {
        out.add(t);
      }
    }
    log.debug("Folded {} top-level calls, {} -> {} tokens", calls, tokens.size(), out.size());
    return List.copyOf(out);
  }

  private CallNode parseCall(FunctionNameCandidate nameToken) throws ParseException {
    String name = nameToken.name();
    Token open = next(name, nameToken.line());
    if (!isMarker(open, Kind.START_CALL)) {
      throw new ParseException(
          "call name must be followed by '(', got " + open.repr(), open.line(), name);
    }
    List<Value> args = new ArrayList<>();
    Map<String, Value> kwargs = new LinkedHashMap<>();
    skipTrivia();
    if (peekIs(Kind.END_CALL)) {
      pos++;
      return new CallNode(name, args, kwargs, nameToken.line());
    }
    while (true) {
      Value value = parseValue(name, open.line());
      Token delim = nextSignificant(name, value.line());
      if (isMarker(delim, Kind.ARG_DELIMITER)) {
        args.add(value);
        continue;
      }
      if (isMarker(delim, Kind.END_CALL)) {
        args.add(value);
        break;
      }
      if (!isMarker(delim, Kind.KEYWORD_ASSIGN)) {
        throw new ParseException(
            "expected ',', '=' or ')' after argument, got " + delim.repr(), delim.line(), name);
      }
      String key = keyOf(value, delim.line(), name);
      skipTrivia();
      if (pos >= input.size() || !startsValue(input.get(pos))) {
        throw new ParseException(
            "missing value after '=' for key '" + key + "'", delim.line(), name);
      }
      put(kwargs, key, parseValue(name, delim.line()), delim.line(), name);
      Token after = nextSignificant(name, delim.line());
      if (isMarker(after, Kind.END_CALL)) {
        break;
      }
      if (!isMarker(after, Kind.ARG_DELIMITER)) {
        throw new ParseException("expected delimiter, got " + after.repr(), after.line(), name);
      }
    }
    return new CallNode(name, args, kwargs, nameToken.line());
  }

  private Value parseValue(String callName, int line) throws ParseException {
    Token t = nextSignificant(callName, line);
    if (t instanceof Word w) {
      return w;
    }
    if (t instanceof QuotedString q) {
      return q;
    }
    if (t instanceof FunctionNameCandidate nested) {
      return parseCall(nested);
    }
    if (isMarker(t, Kind.START_LIST)) {
      return parseList(callName, t.line());
    }
    if (isMarker(t, Kind.START_OBJECT)) {
      return parseObject(callName, t.line());
    }
    throw new ParseException("invalid argument value " + t.repr(), t.line(), callName);
  }

  private ListValue parseList(String callName, int line) throws ParseException {
    List<Value> items = new ArrayList<>();
    skipTrivia();
    if (peekIs(Kind.END_LIST)) {
      pos++;
      return new ListValue(items, line);
    }
    while (true) {
      items.add(parseValue(callName, line));
      Token sep = nextSignificant(callName, line);
      if (isMarker(sep, Kind.END_LIST)) {
        return new ListValue(items, line);
      }
      if (!isMarker(sep, Kind.ARG_DELIMITER)) {
        throw new ParseException(
            "members of list must be separated by ',', got " + sep.repr() + " instead",
            sep.line(),
            callName);
      }
    }
  }

  private ObjectValue parseObject(String callName, int line) throws ParseException {
    Map<String, Value> entries = new LinkedHashMap<>();
    skipTrivia();
    if (peekIs(Kind.END_OBJECT)) {
      pos++;
      return new ObjectValue(entries, line);
    }
    while (true) {
      Token keyToken = nextSignificant(callName, line);
      String key = keyOf(keyToken, keyToken.line(), callName);
      Token kv = nextSignificant(callName, keyToken.line());
      if (!isMarker(kv, Kind.KEY_VALUE_DELIMITER)) {
        throw new ParseException(
            "key/value pairs must be separated by ':', got " + kv.repr() + " instead",
            kv.line(),
            callName);
      }
      put(entries, key, parseValue(callName, kv.line()), kv.line(), callName);
      Token sep = nextSignificant(callName, kv.line());
      if (isMarker(sep, Kind.END_OBJECT)) {
        return new ObjectValue(entries, line);
      }
      if (!isMarker(sep, Kind.ARG_DELIMITER)) {
        throw new ParseException(
            "members of object must be separated by ',', got " + sep.repr() + " instead",
            sep.line(),
            callName);
      }
    }
  }

  private void put(Map<String, Value> target, String key, Value value, int line, String callName)
      throws ParseException {
    if (target.containsKey(key) && duplicateKeys == DuplicateKeyPolicy.REJECT) {
      throw new ParseException("duplicate key '" + key + "'", line, callName);
    }
    target.put(key, value);
  }

  private static String keyOf(Object key, int line, String callName) throws ParseException {
    if (key instanceof Word w) {
      return w.text();
    }
    if (key instanceof QuotedString q) {
      return q.text();
    }
    String repr = key instanceof Token t ? t.repr() : ((Value) key).repr();
    throw new ParseException("keys must be strings, got " + repr + " instead", line, callName);
  }

  // ==================== Cursor ====================

  private Token next(String callName, int line) throws ParseException {
    if (pos >= input.size()) {
      throw new ParseException(
          "no tokens following call " + callName + " (unexpected end of input)", line, callName);
    }
    return input.get(pos++);
  }

  private Token nextSignificant(String callName, int line) throws ParseException {
    skipTrivia();
    return next(callName, line);
  }

  private void skipTrivia() {
    while (pos < input.size() && isTrivia(input.get(pos))) {
      pos++;
    }
  }

  private boolean peekIs(Kind kind) {
    return pos < input.size() && isMarker(input.get(pos), kind);
  }

  private static boolean isTrivia(Token t) {
    return t instanceof Comment || t instanceof NewLine || isMarker(t, Kind.LINE_JOIN);
  }

  private static boolean startsValue(Token t) {
    return t instanceof Word
        || t instanceof QuotedString
        || t instanceof FunctionNameCandidate
        || isMarker(t, Kind.START_LIST)
        || isMarker(t, Kind.START_OBJECT);
  }

  private static boolean isMarker(Token t, Kind kind) {
    return t instanceof Marker m && m.is(kind);
  }
}
