package io.modmap.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value paired with the 1-based line and column in the source text where it originated.
 *
 * @param <T> the located value type
 */
public record Located<T>(T value, int line, int column) {

  public Located {
    Objects.requireNonNull(value, "value must not be null");
  }

  /** Transforms the value while keeping the location. */
  public <U> Located<U> map(Function<? super T, ? extends U> transform) {
    return new Located<>(transform.apply(value), line, column);
  }

  @Override
  public String toString() {
    return line + ":" + column + ": " + value;
  }
}
