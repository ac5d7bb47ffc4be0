package io.modmap.impl;

import io.modmap.api.ParseError;
import io.modmap.lexer.Token;

/**
 * Aborts the top-level declaration being parsed. Caught by {@link RecursiveDescentParser}, which
 * records the error at the offending token and resynchronizes.
 */
final class SyntaxException extends RuntimeException {

  private final transient ParseError error;
  private final transient Token token;

  SyntaxException(ParseError error, Token token) {
    super(error.describe(), null, false, false);
    this.error = error;
    this.token = token;
  }

  ParseError error() {
    return error;
  }

  Token token() {
    return token;
  }
}
