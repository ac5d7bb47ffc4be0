package io.modmap.api;

import java.util.Objects;

/**
 * Generator configuration options.
 *
 * @param indentation whitespace emitted per nesting level
 */
public record GeneratorOptions(Indentation indentation) {

  /** System property selecting the indentation: {@code tabs} or a number of spaces. */
  public static final String INDENT_PROPERTY = "modmap.generator.indent";

  /** Four spaces per level. */
  public static final GeneratorOptions DEFAULT = new GeneratorOptions(Indentation.spaces(4));

  /** One tab per level. */
  public static final GeneratorOptions TABS = new GeneratorOptions(Indentation.tabs());

  public GeneratorOptions {
    Objects.requireNonNull(indentation, "indentation must not be null");
  }

  /**
   * Options taken from the {@value #INDENT_PROPERTY} system property, or {@link #DEFAULT} when it
   * is not set.
   *
   * @throws IllegalArgumentException if the property is neither {@code tabs} nor a non-negative
   *     number
   */
  public static GeneratorOptions fromSystemProperties() {
    String indent = System.getProperty(INDENT_PROPERTY);
    if (indent == null || indent.isBlank()) {
      return DEFAULT;
    }
    return builder().indentation(parseIndentation(indent.trim())).build();
  }

  private static Indentation parseIndentation(String value) {
    if (value.equalsIgnoreCase("tabs") || value.equalsIgnoreCase("tab")) {
      return Indentation.tabs();
    }
    try {
      return Indentation.spaces(Integer.parseInt(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid " + INDENT_PROPERTY + " value '" + value + "': expected 'tabs' or a number", e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Indentation indentation = DEFAULT.indentation();

    public Builder indentation(Indentation indentation) {
      this.indentation = indentation;
      return this;
    }

    public Builder tabs() {
      return indentation(Indentation.tabs());
    }

    public Builder spaces(int count) {
      return indentation(Indentation.spaces(count));
    }

    public GeneratorOptions build() {
      return new GeneratorOptions(indentation);
    }
  }
}
