package io.modmap.api;

import java.util.List;
import java.util.stream.Collectors;

/** Exception thrown when a failed parse result is unwrapped. */
public final class ModuleMapParseException extends RuntimeException {

  private final List<Located<ParseError>> errors;

  public ModuleMapParseException(List<Located<ParseError>> errors) {
    super(formatMessage(errors));
    this.errors = List.copyOf(errors);
  }

  /** Every located error of the failed parse, in the order they were reported. */
  public List<Located<ParseError>> errors() {
    return errors;
  }

  private static String formatMessage(List<Located<ParseError>> errors) {
    return errors.size()
        + (errors.size() == 1 ? " error" : " errors")
        + " in module map:\n"
        + errors.stream()
            .map(e -> "  " + e.line() + ":" + e.column() + ": " + e.value().describe())
            .collect(Collectors.joining("\n"));
  }
}
