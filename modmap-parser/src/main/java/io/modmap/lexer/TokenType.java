package io.modmap.lexer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Lexical categories of the module map language. */
public enum TokenType {
  DOT("."),
  COMMA(","),
  BANG("!"),
  STAR("*"),
  LEADING_BRACE("{"),
  TRAILING_BRACE("}"),
  LEADING_BRACKET("["),
  TRAILING_BRACKET("]"),
  STRING_LITERAL(null),
  INTEGER_LITERAL(null),
  IDENTIFIER(null),
  END_OF_FILE(null),
  LEXER_ERROR(null),

  // Keywords
  KEYWORD_CONFIG_MACROS("config_macros"),
  KEYWORD_EXPORT_AS("export_as"),
  KEYWORD_PRIVATE("private"),
  KEYWORD_CONFLICT("conflict"),
  KEYWORD_FRAMEWORK("framework"),
  KEYWORD_REQUIRES("requires"),
  KEYWORD_EXCLUDE("exclude"),
  KEYWORD_HEADER("header"),
  KEYWORD_TEXTUAL("textual"),
  KEYWORD_EXPLICIT("explicit"),
  KEYWORD_LINK("link"),
  KEYWORD_UMBRELLA("umbrella"),
  KEYWORD_EXTERN("extern"),
  KEYWORD_MODULE("module"),
  KEYWORD_USE("use"),
  KEYWORD_EXPORT("export");

  private static final Map<String, TokenType> KEYWORDS;

  static {
    Map<String, TokenType> keywords = new LinkedHashMap<>();
    for (TokenType type : values()) {
      if (type.isKeyword()) {
        keywords.put(type.text, type);
      }
    }
    KEYWORDS = Collections.unmodifiableMap(keywords);
  }

  private final String text;

  TokenType(String text) {
    this.text = text;
  }

  /** Fixed source text of punctuation and keyword tokens, {@code null} for the others. */
  public String text() {
    return text;
  }

  public boolean isKeyword() {
    return name().startsWith("KEYWORD_");
  }

  /** Returns the keyword type for an exact lexeme, or {@code null} if it is not reserved. */
  public static TokenType forKeyword(String lexeme) {
    return KEYWORDS.get(lexeme);
  }

  /** All reserved words of the language. */
  public static Set<String> keywords() {
    return KEYWORDS.keySet();
  }
}
