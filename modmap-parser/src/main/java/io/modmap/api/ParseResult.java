package io.modmap.api;

import io.modmap.ast.ModuleMapFile;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing a module map: either the complete file or every error found. A result with
 * errors never carries a partial tree.
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

  boolean isSuccess();

  /**
   * Returns the parsed file.
   *
   * @throws ModuleMapParseException carrying all errors if parsing failed
   */
  ModuleMapFile getOrThrow();

  /** The file was parsed without any error. */
  record Success(ModuleMapFile file) implements ParseResult {
    public Success {
      Objects.requireNonNull(file, "file must not be null");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public ModuleMapFile getOrThrow() {
      return file;
    }
  }

  /** Lexical and syntax errors in the order they were found. Never empty. */
  record Failure(List<Located<ParseError>> errors) implements ParseResult {
    public Failure {
      errors = List.copyOf(errors);
      if (errors.isEmpty()) {
        throw new IllegalArgumentException("A failed parse must report at least one error");
      }
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public ModuleMapFile getOrThrow() {
      throw new ModuleMapParseException(errors);
    }
  }
}
