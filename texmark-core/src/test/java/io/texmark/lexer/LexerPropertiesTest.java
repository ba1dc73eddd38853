package io.texmark.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.texmark.token.MathDelimiter;
import io.texmark.token.Marker;
import io.texmark.token.Token;
import io.texmark.token.Word;
import java.util.List;
import java.util.stream.Collectors;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

class LexerPropertiesTest {

  @Property
  void plainTextLexesToItsWords(
      @ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 8) String> words)
      throws LexException {
    List<Token> tokens = Lexer.lex(String.join(" ", words));
    List<String> texts =
        tokens.stream().map(t -> ((Word) t).text()).collect(Collectors.toList());
    assertEquals(words, texts);
  }

  @Property
  void everyWordKeepsItsLine(
      @ForAll @Size(min = 1, max = 20) List<@AlphaChars @StringLength(min = 1, max = 8) String> words)
      throws LexException {
    List<Token> tokens = Lexer.lex(String.join("\n", words));
    int line = 1;
    for (Token t : tokens) {
      assertEquals(line, t.line());
      if (!(t instanceof Word)) {
        line++;
      }
    }
  }

  @Property
  void adjacentDollarsAlwaysFormDoubleDelimiter(
      @ForAll @AlphaChars @StringLength(min = 1, max = 10) String body) throws LexException {
    List<Token> tokens = Lexer.lex("$$" + body + "$$");
    assertEquals(new MathDelimiter(true, 1), tokens.get(0));
    assertEquals(new MathDelimiter(true, 1), tokens.get(tokens.size() - 1));
  }

  @Property
  void escapedBracesNeverProduceMarkers(
      @ForAll @AlphaChars @StringLength(min = 1, max = 10) String body) throws LexException {
    List<Token> tokens = Lexer.lex("\\{" + body + "\\}");
    assertEquals(List.of(new Word("{" + body + "}", 1)), tokens);
  }

  @Property
  void nestedClosuresBalance(@ForAll @IntRange(min = 1, max = 12) int depth) throws LexException {
    String source = "A { ".repeat(depth) + "x" + " }".repeat(depth);
    List<Token> tokens = Lexer.lex(source);
    assertEquals(depth, count(tokens, Marker.Kind.START_CLOSURE));
    assertEquals(depth, count(tokens, Marker.Kind.END_CLOSURE));
  }

  @Property
  void missingClosingBraceFails(@ForAll @IntRange(min = 1, max = 12) int depth) {
    String source = "A { ".repeat(depth) + "x" + " }".repeat(depth - 1);
    LexException e = assertThrows(LexException.class, () -> Lexer.lex(source));
    assertEquals(1, e.getLine());
  }

  private static long count(List<Token> tokens, Marker.Kind kind) {
    return tokens.stream().filter(t -> t instanceof Marker m && m.is(kind)).count();
  }
}
