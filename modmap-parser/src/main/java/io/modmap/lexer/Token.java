package io.modmap.lexer;

import java.util.Objects;

/**
 * A unit of the module map language.
 *
 * @param type lexical category
 * @param lexeme source characters making up the token; string literals keep their quotes
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(TokenType type, String lexeme, int line, int column) {

  public Token {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(lexeme, "lexeme must not be null");
  }

  /**
   * Returns the contents of a string literal without the surrounding quotes.
   *
   * @throws IllegalStateException if this is not a string literal
   */
  public String stringLiteralValue() {
    if (type != TokenType.STRING_LITERAL || lexeme.length() < 2) {
      throw new IllegalStateException("Not a string literal: " + this);
    }
    return lexeme.substring(1, lexeme.length() - 1);
  }
}
