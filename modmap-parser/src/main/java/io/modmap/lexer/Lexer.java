package io.modmap.lexer;

import io.modmap.api.Located;
import io.modmap.api.ParseError;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates module map source text into tokens.
 *
 * <p>Scanning never fails: characters that cannot form a token and broken string literals are
 * reported as located {@link ParseError}s and scanning resumes with the next character. Comments
 * and whitespace produce no tokens. Block comments do not nest, the first {@code *}{@code /} closes
 * them.
 *
 * <p>A lexer instance is stateless and may be shared between threads.
 */
public final class Lexer {

  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  /** Scans the whole text. */
  public LexResult scanAllTokens(String text) {
    Scan scan = new Scan(new Cursor(text));
    scan.run();
    log.debug("Scanned {} tokens with {} lexical errors", scan.tokens.size(), scan.errors.size());
    return new LexResult(scan.tokens, scan.errors);
  }

  /** State of one scan. */
  private static final class Scan {
    private final Cursor cursor;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Located<ParseError>> errors = new ArrayList<>();

    // origin of the token being scanned
    private int line;
    private int column;

    Scan(Cursor cursor) {
      this.cursor = cursor;
    }

    void run() {
      while (!cursor.isPastEnd()) {
        line = cursor.line();
        column = cursor.column();
        char next = cursor.advance();
        switch (next) {
          case '.' -> addToken(TokenType.DOT, next);
          case ',' -> addToken(TokenType.COMMA, next);
          case '!' -> addToken(TokenType.BANG, next);
          case '*' -> addToken(TokenType.STAR, next);
          case '{' -> addToken(TokenType.LEADING_BRACE, next);
          case '}' -> addToken(TokenType.TRAILING_BRACE, next);
          case '[' -> addToken(TokenType.LEADING_BRACKET, next);
          case ']' -> addToken(TokenType.TRAILING_BRACKET, next);
          case '"' -> scanStringLiteral();
          case '/' -> {
            if (cursor.match('/')) {
              skipLineComment();
            } else if (cursor.match('*')) {
              skipBlockComment();
            } else {
              addError(new ParseError.UnrecognizedCharacter(next));
            }
          }
          default -> {
            if (Character.isWhitespace(next)) {
              // skipped
            } else if (isDigit(next)) {
              scanIntegerLiteral(next);
            } else if (isIdentifierStart(next)) {
              scanIdentifierOrKeyword(next);
            } else {
              addError(new ParseError.UnrecognizedCharacter(next));
            }
          }
        }
      }
      tokens.add(new Token(TokenType.END_OF_FILE, "", cursor.line(), cursor.column()));
    }

    private void scanStringLiteral() {
      StringBuilder lexeme = new StringBuilder().append('"');
      while (!cursor.isPastEnd()) {
        char next = cursor.advance();
        if (next == '\\') {
          lexeme.append(next);
          if (cursor.isPastEnd()) {
            break;
          }
          char escaped = cursor.advance();
          lexeme.append(escaped);
          // an escaped CRLF continues the literal on the next line
          if (escaped == '\r' && cursor.match('\n')) {
            lexeme.append('\n');
          }
        } else if (next == '"') {
          lexeme.append(next);
          addToken(TokenType.STRING_LITERAL, lexeme);
          return;
        } else if (Cursor.isNewline(next)) {
          break;
        } else {
          lexeme.append(next);
        }
      }
      addError(new ParseError.UnterminatedString(lexeme.toString()));
    }

    private void skipLineComment() {
      while (!cursor.isPastEnd()) {
        if (Cursor.isNewline(cursor.advance())) {
          return;
        }
      }
    }

    private void skipBlockComment() {
      while (!cursor.isPastEnd()) {
        if (cursor.advance() == '*' && cursor.match('/')) {
          return;
        }
      }
    }

    private void scanIntegerLiteral(char first) {
      StringBuilder lexeme = new StringBuilder().append(first);
      while (isDigit(cursor.peek())) {
        lexeme.append(cursor.advance());
      }
      addToken(TokenType.INTEGER_LITERAL, lexeme);
    }

    private void scanIdentifierOrKeyword(char first) {
      StringBuilder sb = new StringBuilder().append(first);
      while (!cursor.isPastEnd() && isIdentifierPart(cursor.peek())) {
        sb.append(cursor.advance());
      }
      String lexeme = sb.toString();
      TokenType keyword = TokenType.forKeyword(lexeme);
      addToken(keyword != null ? keyword : TokenType.IDENTIFIER, lexeme);
    }

    private void addToken(TokenType type, Object lexeme) {
      tokens.add(new Token(type, String.valueOf(lexeme), line, column));
    }

    private void addError(ParseError error) {
      errors.add(new Located<>(error, line, column));
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
