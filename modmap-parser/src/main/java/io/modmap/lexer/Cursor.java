package io.modmap.lexer;

import java.util.Objects;

/**
 * Character scanner over module map source text that keeps track of the 1-based line and column
 * of the next character to be read.
 *
 * <p>{@code \n} and a lone {@code \r} both count as line breaks; a {@code \r\n} pair counts once.
 */
public final class Cursor {

  private final String text;
  private int pos;
  private int line = 1;
  private int column = 1;

  public Cursor(String text) {
    this.text = Objects.requireNonNull(text, "text must not be null");
  }

  /**
   * Consumes and returns the next character.
   *
   * @throws IllegalStateException if the whole text has already been consumed
   */
  public char advance() {
    if (isPastEnd()) {
      throw new IllegalStateException("Attempted to advance past the end of the text");
    }
    char current = text.charAt(pos++);
    updateLocation(current);
    return current;
  }

  /** Consumes the next character only if it equals {@code expected}. */
  public boolean match(char expected) {
    if (isPastEnd() || text.charAt(pos) != expected) {
      return false;
    }
    pos++;
    updateLocation(expected);
    return true;
  }

  /** Returns the next character without consuming it, or {@code '\0'} when exhausted. */
  public char peek() {
    return isPastEnd() ? '\0' : text.charAt(pos);
  }

  /** True when at most one character remains to be read. */
  public boolean isAtEnd() {
    return pos >= text.length() - 1;
  }

  /** True when every character has been consumed. */
  public boolean isPastEnd() {
    return pos >= text.length();
  }

  /** Line of the next character. */
  public int line() {
    return line;
  }

  /** Column of the next character. */
  public int column() {
    return column;
  }

  private void updateLocation(char consumed) {
    if (consumed == '\n' || (consumed == '\r' && peek() != '\n')) {
      line++;
      column = 1;
    } else {
      column++;
    }
  }

  static boolean isNewline(char c) {
    return c == '\n' || c == '\r';
  }
}
