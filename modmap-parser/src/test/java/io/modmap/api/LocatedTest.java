package io.modmap.api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LocatedTest {

  @Test
  void mapKeepsLocation() {
    Located<String> located = new Located<>("module", 3, 7);
    Located<Integer> mapped = located.map(String::length);

    assertEquals(6, mapped.value());
    assertEquals(3, mapped.line());
    assertEquals(7, mapped.column());
  }

  @Test
  void equalityIncludesLocation() {
    assertEquals(new Located<>("a", 1, 1), new Located<>("a", 1, 1));
    assertNotEquals(new Located<>("a", 1, 1), new Located<>("a", 1, 2));
    assertNotEquals(new Located<>("a", 1, 1), new Located<>("b", 1, 1));
  }

  @Test
  void toStringPrefixesLocation() {
    Located<ParseError> located = new Located<>(new ParseError.UnrecognizedCharacter('@'), 2, 5);
    assertTrue(located.toString().startsWith("2:5: "), located.toString());
  }

  @Test
  void valueIsRequired() {
    assertThrows(NullPointerException.class, () -> new Located<>(null, 1, 1));
  }
}
