package io.texmark.lexer;

import io.texmark.token.Comment;
import io.texmark.token.FunctionNameCandidate;
import io.texmark.token.MathDelimiter;
import io.texmark.token.Marker;
import io.texmark.token.Marker.Kind;
import io.texmark.token.NewLine;
import io.texmark.token.QuotedString;
import io.texmark.token.RawText;
import io.texmark.token.Token;
import io.texmark.token.Word;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context-sensitive lexer for texmark documents.
 *
 * <p>Characters are read one at a time and dispatched on the innermost {@link LexerState}. States
 * are kept on a stack because quoted strings, lists and objects nest inside each other and inside
 * call arguments; popping a state restores exactly the state that opened it.
 *
 * <p>Characters of the current bare word accumulate in a buffer. Whitespace and structural
 * characters flush the buffer into a {@link Word} before they are processed.
 *
 * <p>Document text ({@code NORMAL}):
 *
 * <ul>
 *   <li>{@code Name(} starts a call; {@code Name (} is the word {@code Name} followed by a literal
 *       {@code (}
 *   <li>{@code {} after a word or a call's {@code )} opens a closure, otherwise an object literal
 *   <li>{@code $} and {@code $$} are math delimiters, {@code %} starts a comment
 *   <li>{@code \\} joins lines; {@code \%}, {@code \$}, {@code \{}, {@code \}} are literal
 * </ul>
 *
 * <p>Arguments ({@code IN_CALL_ARGS}, {@code IN_LIST}, {@code IN_OBJECT}) additionally recognise
 * {@code , = : [ ] ( ) { }}. {@code =} is only valid in call arguments and {@code :} only in
 * objects.
 *
 * <p>The body of a closure whose call name is one of the raw body names (by default {@code
 * Verbatim}) is not tokenized: everything up to the matching closing brace becomes one {@link
 * RawText}. Nested braces are kept and counted, an escaped brace is kept without its backslash and
 * is not counted, and every other character, backslashes included, is kept as written.
 */
public final class Lexer {

  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  /** Call names whose closure bodies are taken verbatim when no other set is given. */
  public static final Set<String> DEFAULT_RAW_BODIES = Set.of("Verbatim");

  /** {@code name} is the call name for {@code IN_CALL_ARGS} frames, otherwise null. */
  private record Frame(LexerState state, int line, String name) {}

  private final Reader reader;
  private final Set<String> rawBodies;
  private final Deque<Frame> states = new ArrayDeque<>();
  private final List<Token> tokens = new ArrayList<>();
  private final StringBuilder buffer = new StringBuilder();
  private int line = 1;
  private boolean previousWasDollar;
  private String lastCallName;
  private int rawDepth;

  public Lexer(Reader reader) {
    this(reader, DEFAULT_RAW_BODIES);
  }

  /**
   * @param rawBodies call names whose closure bodies are kept verbatim
   */
  public Lexer(Reader reader, Set<String> rawBodies) {
    this.reader = reader;
    this.rawBodies = Set.copyOf(rawBodies);
  }

  /** Lexes an in-memory document. */
  public static List<Token> lex(String source) throws LexException {
    try {
      return new Lexer(new StringReader(source)).lex();
    } catch (IOException e) {
      // StringReader does not fail
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Reads the whole stream and returns its tokens in source order.
   *
   * @throws IOException if the reader fails
   * @throws LexException on malformed input
   */
  public List<Token> lex() throws IOException, LexException {
    states.clear();
    tokens.clear();
    buffer.setLength(0);
    line = 1;
    previousWasDollar = false;
    lastCallName = null;
    rawDepth = 0;
    states.push(new Frame(LexerState.NORMAL, 1, null));

    int i;
    while ((i = reader.read()) != -1) {
      accept((char) i);
    }
    finish();
    log.debug("Lexed {} tokens over {} lines", tokens.size(), line);
    return List.copyOf(tokens);
  }

  private void accept(char c) throws LexException {
    if (c == '\r') {
      return;
    }
    boolean dollar = false;
    switch (state()) {
      case IN_ESCAPE -> escaped(c);
      case IN_COMMENT -> inComment(c);
      case IN_QUOTED_STRING -> inQuotedString(c);
      case NORMAL -> dollar = inDocument(c);
      case IN_CALL_ARGS, IN_LIST, IN_OBJECT -> inArguments(c);
      case IN_RAW_BODY -> inRawBody(c);
    }
    previousWasDollar = dollar;
  }

  // ==================== States ====================

  private boolean inDocument(char c) throws LexException {
    switch (c) {
      case '\\' -> push(LexerState.IN_ESCAPE);
      case '%' -> {
        flushWord();
        push(LexerState.IN_COMMENT);
      }
      case '"' -> {
        flushWord();
        push(LexerState.IN_QUOTED_STRING);
      }
      case '(' -> openParen();
      case '{' -> openBrace();
      case '}' -> closeClosure();
      case '$' -> {
        mathDelimiter();
        return true;
      }
      case '\n' -> {
        flushWord();
        newLine();
      }
      default -> wordChar(c);
    }
    return false;
  }

  private void inArguments(char c) throws LexException {
    switch (c) {
      case '\\' -> push(LexerState.IN_ESCAPE);
      case '%' -> {
        flushWord();
        push(LexerState.IN_COMMENT);
      }
      case '"' -> {
        flushWord();
        push(LexerState.IN_QUOTED_STRING);
      }
      case '(' -> openParen();
      case ')' -> close(LexerState.IN_CALL_ARGS, Kind.END_CALL);
      case '[' -> open(LexerState.IN_LIST, Kind.START_LIST);
      case ']' -> close(LexerState.IN_LIST, Kind.END_LIST);
      case '{' -> open(LexerState.IN_OBJECT, Kind.START_OBJECT);
      case '}' -> close(LexerState.IN_OBJECT, Kind.END_OBJECT);
      case ',' -> delimiter(Kind.ARG_DELIMITER);
      case '=' -> {
        if (state() != LexerState.IN_CALL_ARGS) {
          throw new LexException(
              "'=' is not valid inside a " + state().description() + " (use ':' in objects)",
              line);
        }
        delimiter(Kind.KEYWORD_ASSIGN);
      }
      case ':' -> {
        if (state() != LexerState.IN_OBJECT) {
          throw new LexException(
              "':' is not valid inside " + state().description() + " (use '=' for keywords)",
              line);
        }
        delimiter(Kind.KEY_VALUE_DELIMITER);
      }
      case '\n' -> {
        flushWord();
        newLine();
      }
      default -> wordChar(c);
    }
  }

  private void escaped(char c) {
    states.pop();
    if (state() == LexerState.IN_RAW_BODY) {
      if (c == '{' || c == '}') {
        buffer.append(c);
      } else {
        if (c == '\n') {
          line++;
        }
        buffer.append('\\').append(c);
      }
      return;
    }
    if (state() == LexerState.IN_QUOTED_STRING) {
      if (c == '"' || isEscapableLiteral(c)) {
        buffer.append(c);
      } else {
        if (c == '\n') {
          line++;
        }
        buffer.append('\\').append(c);
      }
      return;
    }
    if (c == '\\') {
      flushWord();
      emit(new Marker(Kind.LINE_JOIN, line));
    } else if (c == '\n') {
      flushWord();
      emit(new Marker(Kind.LINE_JOIN, line));
      newLine();
    } else if (isEscapableLiteral(c)) {
      buffer.append(c);
    } else {
      buffer.append('\\').append(c);
    }
  }

  private void inComment(char c) {
    if (c == '\n') {
      states.pop();
      emitComment();
      newLine();
    } else {
      buffer.append(c);
    }
  }

  private void inQuotedString(char c) {
    if (c == '\\') {
      push(LexerState.IN_ESCAPE);
    } else if (c == '"') {
      Frame frame = states.pop();
      emit(new QuotedString(buffer.toString(), frame.line()));
      buffer.setLength(0);
    } else {
      if (c == '\n') {
        line++;
      }
      buffer.append(c);
    }
  }

  private void inRawBody(char c) {
    switch (c) {
      case '\\' -> push(LexerState.IN_ESCAPE);
      case '{' -> {
        rawDepth++;
        buffer.append(c);
      }
      case '}' -> {
        if (rawDepth > 0) {
          rawDepth--;
          buffer.append(c);
        } else {
          Frame frame = states.pop();
          if (buffer.length() > 0) {
            emit(new RawText(takeBuffer(), frame.line()));
          }
          emit(new Marker(Kind.END_CLOSURE, line));
        }
      }
      case '\n' -> {
        buffer.append(c);
        line++;
      }
      default -> buffer.append(c);
    }
  }

  // ==================== Structure ====================

  private void openParen() {
    if (buffer.length() == 0) {
      buffer.append('(');
      return;
    }
    String name = takeBuffer();
    emit(new FunctionNameCandidate(name, line));
    emit(new Marker(Kind.START_CALL, line));
    states.push(new Frame(LexerState.IN_CALL_ARGS, line, name));
  }

  private void openBrace() throws LexException {
    flushWord();
    if (tokens.isEmpty()) {
      throw new LexException("cannot start document with closure", line);
    }
    int last = tokens.size() - 1;
    Token previous = tokens.get(last);
    if (previous instanceof Word word) {
      // implicit zero-argument call
      tokens.set(last, word.toCallName());
      emit(new Marker(Kind.START_CALL, word.line()));
      emit(new Marker(Kind.END_CALL, word.line()));
      openClosure(word.text());
    } else if (previous instanceof Marker m && m.is(Kind.END_CALL)) {
      openClosure(lastCallName);
    } else {
      emit(new Marker(Kind.START_OBJECT, line));
      push(LexerState.IN_OBJECT);
    }
  }

  private void openClosure(String callName) {
    emit(new Marker(Kind.START_CLOSURE, line));
    if (callName != null && rawBodies.contains(callName)) {
      rawDepth = 0;
      push(LexerState.IN_RAW_BODY);
    } else {
      push(LexerState.NORMAL);
    }
  }

  private void closeClosure() throws LexException {
    flushWord();
    if (states.size() == 1) {
      throw new LexException("unmatched '}' with no open closure", line);
    }
    states.pop();
    emit(new Marker(Kind.END_CLOSURE, line));
  }

  private void open(LexerState state, Kind kind) {
    flushWord();
    emit(new Marker(kind, line));
    push(state);
  }

  private void close(LexerState expected, Kind kind) throws LexException {
    flushWord();
    if (state() != expected) {
      throw new LexException(
          "unexpected '" + kind.symbol() + "' inside " + state().description(), line);
    }
    Frame frame = states.pop();
    if (kind == Kind.END_CALL) {
      lastCallName = frame.name();
    }
    emit(new Marker(kind, line));
  }

  private void delimiter(Kind kind) {
    flushWord();
    emit(new Marker(kind, line));
  }

  private void mathDelimiter() {
    flushWord();
    int last = tokens.size() - 1;
    if (previousWasDollar
        && last >= 0
        && tokens.get(last) instanceof MathDelimiter d
        && !d.isDouble()) {
      tokens.set(last, d.doubled());
    } else {
      emit(new MathDelimiter(false, line));
    }
  }

  private void newLine() {
    boolean afterLineEnd =
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).eatsTrailingNewline();
    emit(new NewLine(afterLineEnd, line));
    line++;
  }

  private void finish() throws LexException {
    switch (state()) {
      case IN_ESCAPE -> throw new LexException("dangling '\\' at end of input", line);
      case IN_COMMENT -> {
        states.pop();
        emitComment();
      }
      case IN_QUOTED_STRING ->
          throw new LexException("unterminated quoted string", states.peek().line());
      default -> flushWord();
    }
    if (states.size() > 1) {
      Frame open = states.peek();
      String what =
          open.state() == LexerState.NORMAL || open.state() == LexerState.IN_RAW_BODY
              ? "closure"
              : open.state().description();
      throw new LexException("unterminated " + what + " at end of input", open.line());
    }
  }

  // ==================== Buffer ====================

  private void wordChar(char c) {
    if (Character.isWhitespace(c)) {
      flushWord();
    } else {
      buffer.append(c);
    }
  }

  private void flushWord() {
    if (buffer.length() > 0) {
      emit(new Word(takeBuffer(), line));
    }
  }

  private void emitComment() {
    emit(new Comment(takeBuffer(), line));
  }

  private String takeBuffer() {
    String s = buffer.toString();
    buffer.setLength(0);
    return s;
  }

  private static boolean isEscapableLiteral(char c) {
    return c == '%' || c == '$' || c == '{' || c == '}';
  }

  private void emit(Token token) {
    tokens.add(token);
  }

  private void push(LexerState state) {
    states.push(new Frame(state, line, null));
  }

  private LexerState state() {
    return states.peek().state();
  }
}
