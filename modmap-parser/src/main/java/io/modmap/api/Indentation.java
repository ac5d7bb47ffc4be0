package io.modmap.api;

/** Indentation applied once per nesting level of generated module map text. */
public sealed interface Indentation permits Indentation.Tabs, Indentation.Spaces {

  /** Leading whitespace for a line at {@code depth}; depth 0 is the top level. */
  String at(int depth);

  static Indentation tabs() {
    return new Tabs();
  }

  static Indentation spaces(int count) {
    return new Spaces(count);
  }

  /** One tab character per level. */
  record Tabs() implements Indentation {
    @Override
    public String at(int depth) {
      return "\t".repeat(depth);
    }
  }

  /** {@code count} spaces per level. */
  record Spaces(int count) implements Indentation {
    public Spaces {
      if (count < 0) {
        throw new IllegalArgumentException("Space count must not be negative: " + count);
      }
    }

    @Override
    public String at(int depth) {
      return " ".repeat(count * depth);
    }
  }
}
