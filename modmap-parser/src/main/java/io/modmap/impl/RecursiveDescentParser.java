package io.modmap.impl;

import io.modmap.api.Located;
import io.modmap.api.ParseError;
import io.modmap.api.ParseResult;
import io.modmap.ast.ModuleMap.ConfigMacrosDeclaration;
import io.modmap.ast.ModuleMap.ConflictDeclaration;
import io.modmap.ast.ModuleMap.ExcludedHeader;
import io.modmap.ast.ModuleMap.ExportAsDeclaration;
import io.modmap.ast.ModuleMap.ExportDeclaration;
import io.modmap.ast.ModuleMap.ExternModuleDeclaration;
import io.modmap.ast.ModuleMap.Feature;
import io.modmap.ast.ModuleMap.HeaderAttribute;
import io.modmap.ast.ModuleMap.HeaderDeclaration;
import io.modmap.ast.ModuleMap.HeaderKind;
import io.modmap.ast.ModuleMap.InferredSubmoduleDeclaration;
import io.modmap.ast.ModuleMap.InferredSubmoduleMember;
import io.modmap.ast.ModuleMap.LinkDeclaration;
import io.modmap.ast.ModuleMap.LocalModuleDeclaration;
import io.modmap.ast.ModuleMap.ModuleDeclaration;
import io.modmap.ast.ModuleMap.ModuleId;
import io.modmap.ast.ModuleMap.ModuleMember;
import io.modmap.ast.ModuleMap.ModuleSubmodule;
import io.modmap.ast.ModuleMap.RequiresDeclaration;
import io.modmap.ast.ModuleMap.StandardHeader;
import io.modmap.ast.ModuleMap.SubmoduleDeclaration;
import io.modmap.ast.ModuleMap.TextualHeader;
import io.modmap.ast.ModuleMap.UmbrellaDirectoryDeclaration;
import io.modmap.ast.ModuleMap.UmbrellaHeader;
import io.modmap.ast.ModuleMap.UseDeclaration;
import io.modmap.ast.ModuleMap.WildcardModuleId;
import io.modmap.ast.ModuleMapFile;
import io.modmap.lexer.LexResult;
import io.modmap.lexer.Token;
import io.modmap.lexer.TokenType;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for the module map language.
 *
 * <p>Grammar (simplified):
 *
 * <pre>
 * file          := module_decl*
 * module_decl   := 'explicit'? 'framework'? 'module' module_id attribute* '{' member* '}'
 *                | 'extern' 'module' module_id string
 * member        := requires | header | umbrella_dir | submodule | export | export_as
 *                | use | link | config_macros | conflict
 * header        := ('umbrella' | 'exclude' | 'private'? 'textual'?) 'header' string
 *                  ('{' (identifier integer)* '}')?
 * submodule     := module_decl
 *                | 'explicit'? 'framework'? 'module' '*' attribute* '{' ('export' '*')* '}'
 * export        := 'export' (identifier '.')* (identifier | '*')
 * </pre>
 *
 * <p>Ambiguous members are resolved with read-only lookahead of at most three tokens. A syntax
 * error abandons the current top-level declaration; the error is recorded and parsing resumes at
 * the next token that can start a module declaration. An instance parses one token stream once.
 */
public final class RecursiveDescentParser {

  private static final Logger log = LoggerFactory.getLogger(RecursiveDescentParser.class);

  // 'explicit framework module' is the longest prefix before the module keyword
  private static final int MODULE_KEYWORD_LOOKAHEAD = 3;

  private final List<Token> tokens;
  private final List<Located<ParseError>> errors;
  private int current;

  public RecursiveDescentParser(LexResult lexResult) {
    this.tokens = lexResult.tokens();
    this.errors = new ArrayList<>(lexResult.errors());
  }

  /** Parses every declaration, collecting lexical and syntax errors. */
  public ParseResult parse() {
    List<ModuleDeclaration> declarations = new ArrayList<>();
    while (!isAtEnd()) {
      int start = current;
      try {
        declarations.add(parseModuleDeclaration());
      } catch (SyntaxException e) {
        Token at = e.token();
        log.debug("Syntax error at {}:{}: {}", at.line(), at.column(), e.error().describe());
        errors.add(new Located<>(e.error(), at.line(), at.column()));
        synchronize();
        if (current == start && !isAtEnd()) {
          current++;
        }
      }
    }

    if (errors.isEmpty()) {
      log.debug("Parsed {} module declarations", declarations.size());
      return new ParseResult.Success(new ModuleMapFile(declarations));
    }
    log.debug("Parse failed with {} errors", errors.size());
    return new ParseResult.Failure(errors);
  }

  // === Module declarations ===

  private ModuleDeclaration parseModuleDeclaration() {
    if (check(TokenType.KEYWORD_EXTERN)) {
      return parseExternModule();
    }
    return parseLocalModule();
  }

  private LocalModuleDeclaration parseLocalModule() {
    boolean explicit = match(TokenType.KEYWORD_EXPLICIT);
    boolean framework = match(TokenType.KEYWORD_FRAMEWORK);
    consume(TokenType.KEYWORD_MODULE, "Expected 'module' declaration");
    ModuleId moduleId = parseModuleId();
    List<String> attributes = parseAttributes();
    List<ModuleMember> members = parseModuleMembersBlock();
    return new LocalModuleDeclaration(explicit, framework, moduleId, attributes, members);
  }

  private ExternModuleDeclaration parseExternModule() {
    consume(TokenType.KEYWORD_EXTERN, "Expected 'extern' keyword");
    consume(TokenType.KEYWORD_MODULE, "Expected 'module' keyword");
    ModuleId moduleId = parseModuleId();
    String filePath = consumeString("Expected file path string literal");
    return new ExternModuleDeclaration(moduleId, filePath);
  }

  private ModuleId parseModuleId() {
    List<String> components = new ArrayList<>();
    components.add(consume(TokenType.IDENTIFIER, "Expected module identifier").lexeme());
    while (match(TokenType.DOT)) {
      components.add(
          consume(TokenType.IDENTIFIER, "Expected module identifier component").lexeme());
    }
    return new ModuleId(components);
  }

  private List<String> parseAttributes() {
    List<String> attributes = new ArrayList<>();
    while (match(TokenType.LEADING_BRACKET)) {
      attributes.add(consume(TokenType.IDENTIFIER, "Expected attribute identifier").lexeme());
      consume(TokenType.TRAILING_BRACKET, "Expected ']' after attribute");
    }
    return attributes;
  }

  private List<ModuleMember> parseModuleMembersBlock() {
    consume(TokenType.LEADING_BRACE, "Expected '{' after module declaration");
    List<ModuleMember> members = new ArrayList<>();
    while (!isAtEnd() && !check(TokenType.TRAILING_BRACE)) {
      members.add(parseModuleMember());
    }
    consume(TokenType.TRAILING_BRACE, "Expected '}' after module members block");
    return members;
  }

  // === Module members ===

  private ModuleMember parseModuleMember() {
    if (canParseHeaderDeclaration()) {
      return parseHeaderDeclaration();
    } else if (canParseSubmoduleDeclaration()) {
      return parseSubmoduleDeclaration();
    }

    return switch (currentToken().type()) {
      case KEYWORD_REQUIRES -> parseRequiresDeclaration();
      case KEYWORD_UMBRELLA -> parseUmbrellaDirectoryDeclaration();
      case KEYWORD_EXPORT -> parseExportDeclaration();
      case KEYWORD_EXPORT_AS -> parseExportAsDeclaration();
      case KEYWORD_USE -> parseUseDeclaration();
      case KEYWORD_LINK -> parseLinkDeclaration();
      case KEYWORD_CONFIG_MACROS -> parseConfigMacrosDeclaration();
      case KEYWORD_CONFLICT -> parseConflictDeclaration();
      default -> throw unexpected(currentToken(), "Expected a module member declaration");
    };
  }

  private RequiresDeclaration parseRequiresDeclaration() {
    consume(TokenType.KEYWORD_REQUIRES, "Expected 'requires' keyword");
    List<Feature> features = new ArrayList<>();
    features.add(parseFeature());
    while (match(TokenType.COMMA)) {
      features.add(parseFeature());
    }
    return new RequiresDeclaration(features);
  }

  private Feature parseFeature() {
    boolean incompatible = match(TokenType.BANG);
    String identifier = consume(TokenType.IDENTIFIER, "Expected feature identifier").lexeme();
    return new Feature(incompatible, identifier);
  }

  private boolean canParseHeaderDeclaration() {
    return switch (currentToken().type()) {
      case KEYWORD_PRIVATE, KEYWORD_TEXTUAL, KEYWORD_HEADER, KEYWORD_EXCLUDE -> true;
      // 'umbrella' starts either an umbrella header or an umbrella directory
      case KEYWORD_UMBRELLA -> peekType(1) == TokenType.KEYWORD_HEADER;
      default -> false;
    };
  }

  private HeaderDeclaration parseHeaderDeclaration() {
    HeaderKind kind = parseHeaderKind();
    consume(TokenType.KEYWORD_HEADER, "Expected 'header' declaration");
    String filePath = consumeString("Expected file path string literal");
    List<HeaderAttribute> attributes = parseHeaderAttributes();
    return new HeaderDeclaration(kind, filePath, attributes);
  }

  private HeaderKind parseHeaderKind() {
    if (match(TokenType.KEYWORD_UMBRELLA)) {
      return new UmbrellaHeader();
    } else if (match(TokenType.KEYWORD_EXCLUDE)) {
      return new ExcludedHeader();
    }
    boolean isPrivate = match(TokenType.KEYWORD_PRIVATE);
    boolean textual = match(TokenType.KEYWORD_TEXTUAL);
    return textual ? new TextualHeader(isPrivate) : new StandardHeader(isPrivate);
  }

  private List<HeaderAttribute> parseHeaderAttributes() {
    List<HeaderAttribute> attributes = new ArrayList<>();
    if (!match(TokenType.LEADING_BRACE)) {
      return attributes;
    }
    while (!match(TokenType.TRAILING_BRACE)) {
      attributes.add(parseHeaderAttribute());
    }
    return attributes;
  }

  private HeaderAttribute parseHeaderAttribute() {
    String key = consume(TokenType.IDENTIFIER, "Expected header attribute key identifier").lexeme();
    Token value = consume(TokenType.INTEGER_LITERAL, "Expected header attribute value integer");
    try {
      return new HeaderAttribute(key, Long.parseLong(value.lexeme()));
    } catch (NumberFormatException e) {
      throw new SyntaxException(
          new ParseError.FailedToMakeIntegerFromLexeme(value.lexeme()), value);
    }
  }

  private UmbrellaDirectoryDeclaration parseUmbrellaDirectoryDeclaration() {
    consume(TokenType.KEYWORD_UMBRELLA, "Expected 'umbrella' keyword");
    return new UmbrellaDirectoryDeclaration(consumeString("Expected file path string literal"));
  }

  private boolean canParseSubmoduleDeclaration() {
    return willMatch(
            TokenType.KEYWORD_EXPLICIT, TokenType.KEYWORD_FRAMEWORK, TokenType.KEYWORD_MODULE)
        || willMatch(TokenType.KEYWORD_EXPLICIT, TokenType.KEYWORD_MODULE)
        || willMatch(TokenType.KEYWORD_FRAMEWORK, TokenType.KEYWORD_MODULE)
        || willMatch(TokenType.KEYWORD_EXTERN, TokenType.KEYWORD_MODULE)
        || willMatch(TokenType.KEYWORD_MODULE);
  }

  private SubmoduleDeclaration parseSubmoduleDeclaration() {
    // canParseSubmoduleDeclaration() guarantees a module keyword within the lookahead window
    int moduleOffset = 0;
    while (moduleOffset < MODULE_KEYWORD_LOOKAHEAD
        && peekType(moduleOffset) != TokenType.KEYWORD_MODULE) {
      moduleOffset++;
    }

    if (peekType(moduleOffset + 1) == TokenType.STAR) {
      return parseInferredSubmoduleDeclaration();
    }
    return new ModuleSubmodule(parseModuleDeclaration());
  }

  private InferredSubmoduleDeclaration parseInferredSubmoduleDeclaration() {
    boolean explicit = match(TokenType.KEYWORD_EXPLICIT);
    boolean framework = match(TokenType.KEYWORD_FRAMEWORK);
    consume(TokenType.KEYWORD_MODULE, "Expected 'module' declaration");
    consume(TokenType.STAR, "Expected '*' symbol");
    List<String> attributes = parseAttributes();

    consume(TokenType.LEADING_BRACE, "Expected '{' after module declaration");
    List<InferredSubmoduleMember> members = new ArrayList<>();
    while (!isAtEnd() && !check(TokenType.TRAILING_BRACE)) {
      consume(TokenType.KEYWORD_EXPORT, "Expected 'export' keyword");
      consume(TokenType.STAR, "Expected '*' symbol");
      members.add(new InferredSubmoduleMember());
    }
    consume(TokenType.TRAILING_BRACE, "Expected '}' after module members block");

    return new InferredSubmoduleDeclaration(explicit, framework, attributes, members);
  }

  private ExportDeclaration parseExportDeclaration() {
    consume(TokenType.KEYWORD_EXPORT, "Expected 'export' keyword");
    return new ExportDeclaration(parseWildcardModuleId());
  }

  private WildcardModuleId parseWildcardModuleId() {
    List<String> components = new ArrayList<>();
    while (true) {
      if (willMatch(TokenType.IDENTIFIER, TokenType.DOT)) {
        components.add(advance().lexeme());
        advance(); // '.'
      } else if (check(TokenType.IDENTIFIER)) {
        components.add(advance().lexeme());
        break;
      } else if (check(TokenType.STAR)) {
        break;
      } else {
        throw unexpected(currentToken(), "Expected a wildcard module identifier component");
      }
    }
    boolean trailingStar = match(TokenType.STAR);
    return new WildcardModuleId(components, trailingStar);
  }

  private ExportAsDeclaration parseExportAsDeclaration() {
    consume(TokenType.KEYWORD_EXPORT_AS, "Expected 'export_as' keyword");
    return new ExportAsDeclaration(
        consume(TokenType.IDENTIFIER, "Expected module name identifier").lexeme());
  }

  private UseDeclaration parseUseDeclaration() {
    consume(TokenType.KEYWORD_USE, "Expected 'use' keyword");
    return new UseDeclaration(parseModuleId());
  }

  private LinkDeclaration parseLinkDeclaration() {
    consume(TokenType.KEYWORD_LINK, "Expected 'link' keyword");
    boolean framework = match(TokenType.KEYWORD_FRAMEWORK);
    String name = consumeString("Expected library or framework name string literal");
    return new LinkDeclaration(framework, name);
  }

  private ConfigMacrosDeclaration parseConfigMacrosDeclaration() {
    consume(TokenType.KEYWORD_CONFIG_MACROS, "Expected 'config_macros' keyword");
    List<String> attributes = parseAttributes();
    List<String> macroNames = new ArrayList<>();
    if (check(TokenType.IDENTIFIER)) {
      macroNames.add(advance().lexeme());
      while (match(TokenType.COMMA)) {
        macroNames.add(consume(TokenType.IDENTIFIER, "Expected macro identifier").lexeme());
      }
    }
    return new ConfigMacrosDeclaration(attributes, macroNames);
  }

  private ConflictDeclaration parseConflictDeclaration() {
    consume(TokenType.KEYWORD_CONFLICT, "Expected 'conflict' keyword");
    ModuleId moduleId = parseModuleId();
    consume(TokenType.COMMA, "Expected ',' symbol");
    String message = consumeString("Expected diagnostic message string literal");
    return new ConflictDeclaration(moduleId, message);
  }

  // === Token helpers ===

  private Token currentToken() {
    return tokens.get(current);
  }

  private boolean isAtEnd() {
    return currentToken().type() == TokenType.END_OF_FILE;
  }

  /** Type of the token {@code offset} positions ahead, or {@code null} past the end. */
  private TokenType peekType(int offset) {
    int index = current + offset;
    return index < tokens.size() ? tokens.get(index).type() : null;
  }

  private boolean check(TokenType type) {
    return currentToken().type() == type;
  }

  /** True if the upcoming tokens have exactly these types. Consumes nothing. */
  private boolean willMatch(TokenType... types) {
    for (int offset = 0; offset < types.length; offset++) {
      if (peekType(offset) != types[offset]) {
        return false;
      }
    }
    return true;
  }

  private Token advance() {
    Token token = currentToken();
    if (!isAtEnd()) {
      current++;
    }
    return token;
  }

  private boolean match(TokenType type) {
    if (isAtEnd() || !check(type)) {
      return false;
    }
    current++;
    return true;
  }

  private Token consume(TokenType type, String message) {
    if (!check(type) || isAtEnd()) {
      throw unexpected(currentToken(), message);
    }
    return advance();
  }

  private String consumeString(String message) {
    return consume(TokenType.STRING_LITERAL, message).stringLiteralValue();
  }

  private static SyntaxException unexpected(Token token, String message) {
    return new SyntaxException(
        new ParseError.UnexpectedToken(token.type(), token.lexeme(), message), token);
  }

  /** Skips tokens up to the next one that can start a top-level module declaration. */
  private void synchronize() {
    while (!isAtEnd()) {
      TokenType type = currentToken().type();
      if (type == TokenType.KEYWORD_EXPLICIT
          || type == TokenType.KEYWORD_MODULE
          || type == TokenType.KEYWORD_EXTERN
          || (type == TokenType.KEYWORD_FRAMEWORK && peekType(1) == TokenType.KEYWORD_MODULE)) {
        return;
      }
      current++;
    }
  }
}
