package io.modmap.lexer;

import io.modmap.api.Located;
import io.modmap.api.ParseError;
import java.util.List;

/**
 * Output of a complete scan.
 *
 * @param tokens scanned tokens, always terminated by a single {@link TokenType#END_OF_FILE}
 * @param errors lexical errors in source order
 */
public record LexResult(List<Token> tokens, List<Located<ParseError>> errors) {

  public LexResult {
    tokens = List.copyOf(tokens);
    errors = List.copyOf(errors);
    if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
      throw new IllegalArgumentException("Token list must be terminated by END_OF_FILE");
    }
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
