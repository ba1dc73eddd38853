package io.texmark.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.texmark.token.Comment;
import io.texmark.token.FunctionNameCandidate;
import io.texmark.token.MathDelimiter;
import io.texmark.token.Marker;
import io.texmark.token.NewLine;
import io.texmark.token.QuotedString;
import io.texmark.token.RawText;
import io.texmark.token.Token;
import io.texmark.token.Word;
import java.io.StringReader;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LexerTest {

  private static List<Token> lex(String source) throws LexException {
    return Lexer.lex(source);
  }

  private static List<String> reprs(String source) throws LexException {
    return lex(source).stream().map(Token::repr).collect(Collectors.toList());
  }

  // ==================== Words and lines ====================

  @Test
  void splitsWordsOnWhitespaceAndTracksLines() throws Exception {
    List<Token> tokens = lex("hello world\nfoo");
    assertEquals(
        List.of(
            new Word("hello", 1),
            new Word("world", 1),
            new NewLine(false, 1),
            new Word("foo", 2)),
        tokens);
  }

  @Test
  void newLineAfterNewLineStillBreaks() throws Exception {
    List<Token> tokens = lex("a\n\nb");
    assertEquals(new NewLine(false, 1), tokens.get(1));
    assertEquals(new NewLine(false, 2), tokens.get(2));
    assertEquals(new Word("b", 3), tokens.get(3));
  }

  @Test
  void leadingNewLineHasNoPredecessorEndingTheLine() throws Exception {
    assertEquals(List.of(new NewLine(false, 1), new Word("x", 2)), lex("\nx"));
  }

  @Test
  void carriageReturnsAreIgnored() throws Exception {
    assertEquals(lex("a b\nc"), lex("a b\r\nc"));
  }

  @Test
  void quotedStringInTextKeepsSpaces() throws Exception {
    List<Token> tokens = lex("said \"hi there\" ok");
    assertEquals(new QuotedString("hi there", 1), tokens.get(1));
    assertEquals(new Word("ok", 1), tokens.get(2));
  }

  @Test
  void quotedStringAcrossLinesReportsOpeningLine() throws Exception {
    List<Token> tokens = lex("\"a\nb\" c");
    assertEquals(new QuotedString("a\nb", 1), tokens.get(0));
    assertEquals(new Word("c", 2), tokens.get(1));
  }

  // ==================== Escapes ====================

  @Test
  void escapedBracesAreLiteral() throws Exception {
    List<Token> tokens = lex("\\{a\\}");
    assertEquals(List.of(new Word("{a}", 1)), tokens);
  }

  @Test
  void escapedPercentAndDollarAreLiteral() throws Exception {
    assertEquals(List.of(new Word("5%", 1), new Word("$3", 1)), lex("5\\% \\$3"));
  }

  @Test
  void unknownEscapesPassThroughVerbatim() throws Exception {
    assertEquals(List.of(new Word("\\alpha", 1)), lex("\\alpha"));
  }

  @Test
  void doubleBackslashJoinsLines() throws Exception {
    List<Token> tokens = lex("a \\\\\nb");
    assertEquals(new Word("a", 1), tokens.get(0));
    assertEquals(new Marker(Marker.Kind.LINE_JOIN, 1), tokens.get(1));
    assertEquals(new NewLine(true, 1), tokens.get(2));
    assertEquals(new Word("b", 2), tokens.get(3));
  }

  @Test
  void backslashNewLineContinuesLine() throws Exception {
    List<Token> tokens = lex("a\\\nb");
    assertEquals(new Marker(Marker.Kind.LINE_JOIN, 1), tokens.get(1));
    assertTrue(((NewLine) tokens.get(2)).afterLineEnd());
  }

  @Test
  void escapesInsideQuotedString() throws Exception {
    List<Token> tokens = lex("\"say \\\"x\\\" \\\\ \\{\"");
    assertEquals(new QuotedString("say \"x\" \\\\ {", 1), tokens.get(0));
  }

  @Test
  void danglingBackslashFails() {
    LexException e = assertThrows(LexException.class, () -> lex("abc\\"));
    assertEquals(1, e.getLine());
  }

  // ==================== Comments ====================

  @Test
  void commentRunsToEndOfLineAndIsFollowedByNewLine() throws Exception {
    List<Token> tokens = lex("text % note\nmore");
    assertEquals(new Word("text", 1), tokens.get(0));
    assertEquals(new Comment(" note", 1), tokens.get(1));
    assertEquals(new NewLine(true, 1), tokens.get(2));
    assertEquals(new Word("more", 2), tokens.get(3));
  }

  @Test
  void commentAtEndOfInput() throws Exception {
    assertEquals(List.of(new Comment("last", 1)), lex("%last"));
  }

  // ==================== Math ====================

  @Test
  void doubleDollarIsOneDelimiter() throws Exception {
    List<Token> tokens = lex("$$x$$");
    assertEquals(
        List.of(new MathDelimiter(true, 1), new Word("x", 1), new MathDelimiter(true, 1)), tokens);
  }

  @Test
  void separatedDollarsStaySingle() throws Exception {
    List<Token> tokens = lex("$ $");
    assertEquals(List.of(new MathDelimiter(false, 1), new MathDelimiter(false, 1)), tokens);
  }

  @Test
  void fourDollarsAreTwoDoubles() throws Exception {
    assertEquals(List.of("$$", "$$"), reprs("$$$$"));
  }

  @Test
  void dollarInsideArgumentsIsLiteral() throws Exception {
    assertEquals(List.of("FnF", "(", "$x$", ")"), reprs("F($x$)"));
  }

  // ==================== Calls and closures ====================

  @Test
  void nameDirectlyBeforeParenStartsCall() throws Exception {
    assertEquals(List.of("FnFoo", "(", "x", ")"), reprs("Foo(x)"));
  }

  @Test
  void spaceBeforeParenKeepsLiteralParen() throws Exception {
    assertEquals(List.of("Foo", "(x)"), reprs("Foo (x)"));
  }

  @Test
  void wordBeforeBraceBecomesZeroArgumentCall() throws Exception {
    List<Token> tokens = lex("Box {\nhi\n}");
    assertEquals(new FunctionNameCandidate("Box", 1), tokens.get(0));
    assertEquals(
        List.of("FnBox", "(", ")", "StartClo:", "\\n", "hi", "\\\\\\n", ":EndClo"),
        tokens.stream().map(Token::repr).collect(Collectors.toList()));
    assertEquals(new Marker(Marker.Kind.END_CLOSURE, 3), tokens.get(tokens.size() - 1));
  }

  @Test
  void braceAfterCallOpensClosure() throws Exception {
    assertEquals(
        List.of("FnProblem", "(", "name", "=", "\"a\"", ")", "StartClo:", ":EndClo"),
        reprs("Problem(name=\"a\") {}"));
  }

  @Test
  void nestedClosures() throws Exception {
    assertEquals(
        List.of("FnA", "(", ")", "StartClo:", "FnB", "(", ")", "StartClo:", "x", ":EndClo", ":EndClo"),
        reprs("A { B { x } }"));
  }

  @Test
  void braceAfterNewLineOpensObject() throws Exception {
    assertEquals(List.of("a", "\\\\\\n", "StartObj:", "b", ":", "c", ":EndObj"), reprs("a\n{b: c}"));
  }

  @Test
  void closureAtStartOfDocumentFails() {
    LexException e = assertThrows(LexException.class, () -> lex("{x}"));
    assertTrue(e.getMessage().contains("cannot start document with closure"));
  }

  @Test
  void unmatchedClosingBraceFails() {
    LexException e = assertThrows(LexException.class, () -> lex("a\nb }"));
    assertEquals(2, e.getLine());
  }

  // ==================== Verbatim bodies ====================

  @Test
  void verbatimBodyIsOneRawToken() throws Exception {
    List<Token> tokens = lex("Verbatim {\nif x:\n    y  =  1 \\\\ z\n}");
    assertEquals(
        List.of("FnVerbatim", "(", ")", "StartClo:", "Raw(24 chars)", ":EndClo"),
        tokens.stream().map(Token::repr).collect(Collectors.toList()));
    assertEquals(new RawText("\nif x:\n    y  =  1 \\\\ z\n", 1), tokens.get(4));
    assertEquals(new Marker(Marker.Kind.END_CLOSURE, 4), tokens.get(5));
  }

  @Test
  void verbatimBodyKeepsMarkupCharacters() throws Exception {
    List<Token> tokens = lex("Verbatim(x) {50% of $a$, Bold(b) \\alpha}");
    assertEquals(new RawText("50% of $a$, Bold(b) \\alpha", 1), tokens.get(tokens.size() - 2));
  }

  @Test
  void verbatimBodyCountsNestedBraces() throws Exception {
    List<Token> tokens = lex("Verbatim {f{x} \\} }\nafter");
    assertEquals(new RawText("f{x} } ", 1), tokens.get(4));
    assertEquals(new Marker(Marker.Kind.END_CLOSURE, 1), tokens.get(5));
    assertEquals(new Word("after", 2), tokens.get(tokens.size() - 1));
  }

  @Test
  void emptyVerbatimBodyHasNoRawToken() throws Exception {
    assertEquals(List.of("FnVerbatim", "(", ")", "StartClo:", ":EndClo"), reprs("Verbatim {}"));
  }

  @Test
  void unterminatedVerbatimBodyFails() {
    LexException e = assertThrows(LexException.class, () -> lex("x\nVerbatim {\nabc {"));
    assertEquals(2, e.getLine());
    assertTrue(e.getMessage().contains("unterminated closure"));
  }

  @Test
  void rawBodyNamesAreConfigurable() throws Exception {
    List<Token> tokens = new Lexer(new StringReader("Code {a  b}"), Set.of("Code")).lex();
    assertEquals(new RawText("a  b", 1), tokens.get(4));

    List<Token> plain = new Lexer(new StringReader("Verbatim {a  b}"), Set.of()).lex();
    assertEquals(List.of(new Word("a", 1), new Word("b", 1)), plain.subList(4, 6));
  }

  // ==================== Arguments ====================

  @Test
  void argumentStructureTokens() throws Exception {
    assertEquals(
        List.of(
            "FnHeader", "(", "a", "=", "\"1\"", ",", "b", "=", "[", "\"c\"", ",", "\"d\"", "]",
            ",", "obj", "=", "StartObj:", "a", ":", "\"a\"", ",", "b", ":", "\"b\"", ":EndObj",
            ")"),
        reprs("Header(a=\"1\", b=[\"c\", \"d\"], obj={ a: \"a\", b: \"b\"})"));
  }

  @Test
  void nestedCallInArguments() throws Exception {
    assertEquals(List.of("FnFrac", "(", "FnBold", "(", "x", ")", ",", "2", ")"), reprs("Frac(Bold(x), 2)"));
  }

  @Test
  void punctuationIsLiteralInDocumentText() throws Exception {
    assertEquals(List.of("a,b=c:d", "[1]"), reprs("a,b=c:d [1]"));
  }

  @Test
  void equalsInsideObjectFails() {
    LexException e = assertThrows(LexException.class, () -> lex("F(o={a = b})"));
    assertTrue(e.getMessage().contains("'='"));
  }

  @Test
  void colonInCallArgumentsFails() {
    assertThrows(LexException.class, () -> lex("F(a: b)"));
  }

  @Test
  void equalsInsideListFails() {
    assertThrows(LexException.class, () -> lex("F([a=b])"));
  }

  @Test
  void mismatchedCloserFails() {
    LexException e = assertThrows(LexException.class, () -> lex("F([a)"));
    assertTrue(e.getMessage().contains("list literal"));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "F(\"abc | 1 | quoted string",
        "x\\nF(a,\\nb | 2 | call arguments",
        "F([a | 1 | list literal",
        "F({a: b | 1 | object literal",
        "Box {\\n a | 1 | closure"
      })
  void unterminatedStructuresReportOpeningLine(String source, int line, String what) {
    LexException e = assertThrows(LexException.class, () -> lex(source.replace("\\n", "\n")));
    assertEquals(line, e.getLine());
    assertTrue(e.getMessage().contains(what), e.getMessage());
  }
}
