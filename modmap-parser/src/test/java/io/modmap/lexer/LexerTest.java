package io.modmap.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.modmap.api.Located;
import io.modmap.api.ParseError;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LexerTest {

  private Lexer lexer;

  @BeforeEach
  void setUp() {
    lexer = new Lexer();
  }

  private static List<TokenType> types(LexResult result) {
    return result.tokens().stream().map(Token::type).collect(Collectors.toList());
  }

  private static List<ParseError> errorValues(LexResult result) {
    return result.errors().stream().map(Located::value).collect(Collectors.toList());
  }

  @Test
  void emptyTextYieldsOnlyEndOfFile() {
    LexResult result = lexer.scanAllTokens("");
    assertEquals(List.of(TokenType.END_OF_FILE), types(result));
    assertFalse(result.hasErrors());

    Token eof = result.tokens().get(0);
    assertEquals("", eof.lexeme());
    assertEquals(1, eof.line());
    assertEquals(1, eof.column());
  }

  @Test
  void punctuationIsScanned() {
    LexResult result = lexer.scanAllTokens(".,!*{}[]");
    assertEquals(
        List.of(
            TokenType.DOT,
            TokenType.COMMA,
            TokenType.BANG,
            TokenType.STAR,
            TokenType.LEADING_BRACE,
            TokenType.TRAILING_BRACE,
            TokenType.LEADING_BRACKET,
            TokenType.TRAILING_BRACKET,
            TokenType.END_OF_FILE),
        types(result));
    assertFalse(result.hasErrors());
  }

  @Test
  void stringLiteralKeepsQuotesInLexeme() {
    String text = "\"this is a string literal\"";
    LexResult result = lexer.scanAllTokens(text);
    assertEquals(2, result.tokens().size());
    Token token = result.tokens().get(0);
    assertEquals(TokenType.STRING_LITERAL, token.type());
    assertEquals(text, token.lexeme());
    assertEquals("this is a string literal", token.stringLiteralValue());
    assertFalse(result.hasErrors());
  }

  @Test
  void integerLiteralIsScanned() {
    LexResult result = lexer.scanAllTokens("123");
    assertEquals(List.of(TokenType.INTEGER_LITERAL, TokenType.END_OF_FILE), types(result));
    assertEquals("123", result.tokens().get(0).lexeme());
  }

  @Test
  void oversizedIntegerIsStillOneToken() {
    LexResult result = lexer.scanAllTokens("19223372036854775807");
    assertEquals(List.of(TokenType.INTEGER_LITERAL, TokenType.END_OF_FILE), types(result));
    assertFalse(result.hasErrors());
  }

  @Test
  void identifierIsScanned() {
    LexResult result = lexer.scanAllTokens("MyLib");
    assertEquals(List.of(TokenType.IDENTIFIER, TokenType.END_OF_FILE), types(result));
    assertEquals("MyLib", result.tokens().get(0).lexeme());
  }

  @Test
  void identifierMayContainUnderscoresAndDigits() {
    LexResult result = lexer.scanAllTokens("_Lib2_x 9lives");
    assertEquals(
        List.of(
            TokenType.IDENTIFIER,
            TokenType.INTEGER_LITERAL,
            TokenType.IDENTIFIER,
            TokenType.END_OF_FILE),
        types(result));
    assertEquals("_Lib2_x", result.tokens().get(0).lexeme());
    assertEquals("9", result.tokens().get(1).lexeme());
    assertEquals("lives", result.tokens().get(2).lexeme());
  }

  @Test
  void everyKeywordIsScannedAsItsType() {
    List<String> keywords = new ArrayList<>(TokenType.keywords());
    keywords.sort(null);

    LexResult result = lexer.scanAllTokens(String.join(" ", keywords));

    List<TokenType> expected = new ArrayList<>();
    for (String keyword : keywords) {
      expected.add(TokenType.forKeyword(keyword));
    }
    expected.add(TokenType.END_OF_FILE);
    assertEquals(expected, types(result));
    assertFalse(result.hasErrors());
  }

  @Test
  void keywordMatchIsExact() {
    LexResult result = lexer.scanAllTokens("modules Module export_asx");
    assertEquals(
        List.of(
            TokenType.IDENTIFIER,
            TokenType.IDENTIFIER,
            TokenType.IDENTIFIER,
            TokenType.END_OF_FILE),
        types(result));
  }

  @Test
  void commentsAreIgnored() {
    String text =
        """
        module MyLib {
        // This is a comment line
        requires c99
        /*
        This is a block comment
        */
        }""";
    LexResult result = lexer.scanAllTokens(text);
    assertEquals(
        List.of(
            TokenType.KEYWORD_MODULE,
            TokenType.IDENTIFIER,
            TokenType.LEADING_BRACE,
            TokenType.KEYWORD_REQUIRES,
            TokenType.IDENTIFIER,
            TokenType.TRAILING_BRACE,
            TokenType.END_OF_FILE),
        types(result));
    assertFalse(result.hasErrors());
  }

  @Test
  void blockCommentsDoNotNest() {
    LexResult result = lexer.scanAllTokens("/* a /* b */ module");
    assertEquals(List.of(TokenType.KEYWORD_MODULE, TokenType.END_OF_FILE), types(result));
  }

  @Test
  void unterminatedBlockCommentRunsToEnd() {
    LexResult result = lexer.scanAllTokens("module /* never closed");
    assertEquals(List.of(TokenType.KEYWORD_MODULE, TokenType.END_OF_FILE), types(result));
    assertFalse(result.hasErrors());
  }

  @Test
  void lineCommentEndsAtCarriageReturn() {
    LexResult result = lexer.scanAllTokens("// note\rmodule");
    assertEquals(List.of(TokenType.KEYWORD_MODULE, TokenType.END_OF_FILE), types(result));
    assertEquals(2, result.tokens().get(0).line());
  }

  @Test
  void unterminatedStringReportsError() {
    String text = "\"this is an unterminated string";
    LexResult result = lexer.scanAllTokens(text);
    assertEquals(List.of(TokenType.END_OF_FILE), types(result));
    assertEquals(List.of(new ParseError.UnterminatedString(text)), errorValues(result));
  }

  @Test
  void unescapedNewlineInStringReportsError() {
    LexResult result = lexer.scanAllTokens("\"Unescaped\n\"");
    assertEquals(List.of(TokenType.END_OF_FILE), types(result));
    assertEquals(
        List.of(
            new ParseError.UnterminatedString("\"Unescaped"),
            new ParseError.UnterminatedString("\"")),
        errorValues(result));

    Located<ParseError> second = result.errors().get(1);
    assertEquals(2, second.line());
    assertEquals(1, second.column());
  }

  @Test
  void escapedNewlineContinuesString() {
    LexResult result = lexer.scanAllTokens("\"Escaped\\\n\"");
    assertEquals(List.of(TokenType.STRING_LITERAL, TokenType.END_OF_FILE), types(result));
    assertFalse(result.hasErrors());
  }

  @Test
  void escapedCarriageReturnLineFeedContinuesString() {
    LexResult result = lexer.scanAllTokens("\"Escaped\\\r\n\" module");
    assertEquals(
        List.of(TokenType.STRING_LITERAL, TokenType.KEYWORD_MODULE, TokenType.END_OF_FILE),
        types(result));
    assertEquals(2, result.tokens().get(1).line());
  }

  @Test
  void escapedQuoteDoesNotCloseString() {
    LexResult result = lexer.scanAllTokens("\"say \\\"hi\\\"\"");
    assertEquals(List.of(TokenType.STRING_LITERAL, TokenType.END_OF_FILE), types(result));
    assertEquals("\"say \\\"hi\\\"\"", result.tokens().get(0).lexeme());
  }

  @Test
  void tokenLineAndColumnNumbersAreCorrect() {
    String text = "module MyLib {\n    header \"MyLib.h\"\n}\n";
    LexResult result = lexer.scanAllTokens(text);

    List<Integer> lines = result.tokens().stream().map(Token::line).collect(Collectors.toList());
    List<Integer> columns =
        result.tokens().stream().map(Token::column).collect(Collectors.toList());
    assertEquals(List.of(1, 1, 1, 2, 2, 3, 4), lines);
    assertEquals(List.of(1, 8, 14, 5, 12, 1, 1), columns);
  }

  @Test
  void carriageReturnLineFeedAdvancesOneLine() {
    LexResult result = lexer.scanAllTokens("module\r\nA\r\n\r\n}");
    List<Integer> lines = result.tokens().stream().map(Token::line).collect(Collectors.toList());
    assertEquals(List.of(1, 2, 4, 4), lines);
    assertEquals(1, result.tokens().get(1).column());
  }

  @Test
  void unrecognizedCharactersAreReportedAndSkipped() {
    LexResult result = lexer.scanAllTokens("a / b @");
    assertEquals(
        List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE),
        types(result));
    assertEquals(
        List.of(
            new ParseError.UnrecognizedCharacter('/'), new ParseError.UnrecognizedCharacter('@')),
        errorValues(result));
    assertEquals(3, result.errors().get(0).column());
    assertEquals(7, result.errors().get(1).column());
  }

  @Test
  void lexerErrorTokensAreNeverEmitted() {
    LexResult result = lexer.scanAllTokens("#$%\"open");
    assertEquals(List.of(TokenType.END_OF_FILE), types(result));
    assertEquals(4, result.errors().size());
  }
}
