package io.modmap.api;

import io.modmap.lexer.TokenType;
import java.util.Objects;

/** Problems found while scanning or parsing a module map. */
public sealed interface ParseError
    permits ParseError.UnterminatedString,
        ParseError.UnrecognizedCharacter,
        ParseError.FailedToMakeIntegerFromLexeme,
        ParseError.UnexpectedToken {

  /** Human readable description of the problem. */
  String describe();

  /** A string literal hit an unescaped line break or the end of input before its closing quote. */
  record UnterminatedString(String lexeme) implements ParseError {
    public UnterminatedString {
      Objects.requireNonNull(lexeme, "lexeme must not be null");
    }

    @Override
    public String describe() {
      return "Unterminated string literal: " + lexeme;
    }
  }

  /** A character that cannot start any token. */
  record UnrecognizedCharacter(char character) implements ParseError {
    @Override
    public String describe() {
      return "Unrecognized character '" + character + "'";
    }
  }

  /** An integer literal that does not fit a {@code long}. */
  record FailedToMakeIntegerFromLexeme(String lexeme) implements ParseError {
    public FailedToMakeIntegerFromLexeme {
      Objects.requireNonNull(lexeme, "lexeme must not be null");
    }

    @Override
    public String describe() {
      return "Integer literal out of range: " + lexeme;
    }
  }

  /** A token that does not fit the grammar at its position. */
  record UnexpectedToken(TokenType type, String lexeme, String message) implements ParseError {
    public UnexpectedToken {
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(lexeme, "lexeme must not be null");
      Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String describe() {
      if (type == TokenType.END_OF_FILE) {
        return message + ", found end of file";
      }
      return message + ", found '" + lexeme + "'";
    }
  }
}
