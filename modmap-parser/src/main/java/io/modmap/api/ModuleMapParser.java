package io.modmap.api;

import io.modmap.impl.RecursiveDescentParser;
import io.modmap.lexer.LexResult;
import io.modmap.lexer.Lexer;
import java.util.Objects;

/**
 * Main entry point for parsing module map text.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ParseResult result = ModuleMapParser.parse(text);
 * if (result instanceof ParseResult.Success success) {
 *     for (ModuleMap.ModuleDeclaration decl : success.file().moduleDeclarations()) {
 *         ...
 *     }
 * } else if (result instanceof ParseResult.Failure failure) {
 *     failure.errors().forEach(e ->
 *         System.err.println(e.line() + ":" + e.column() + ": " + e.value().describe()));
 * }
 * }</pre>
 *
 * <p>The whole text is scanned before parsing starts. Parsing does not stop at the first problem:
 * every lexical error and one syntax error per malformed top-level declaration are reported. Any
 * error makes the whole result a {@link ParseResult.Failure}.
 *
 * <p>Thread safety: each call works on its own state, so concurrent calls are safe.
 */
public final class ModuleMapParser {

  private static final Lexer LEXER = new Lexer();

  private ModuleMapParser() {}

  /**
   * Parses module map text.
   *
   * @param text full contents of a module map file
   * @return the parsed file or every error found
   * @throws NullPointerException if text is null
   */
  public static ParseResult parse(String text) {
    Objects.requireNonNull(text, "text must not be null");
    return new RecursiveDescentParser(scan(text)).parse();
  }

  /**
   * Scans module map text into tokens without parsing it.
   *
   * @param text full contents of a module map file
   * @return tokens terminated by end-of-file, plus lexical errors
   * @throws NullPointerException if text is null
   */
  public static LexResult scan(String text) {
    Objects.requireNonNull(text, "text must not be null");
    return LEXER.scanAllTokens(text);
  }
}
