package io.modmap.lexer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CursorTest {

  @Test
  void advanceReturnsCharactersInOrder() {
    Cursor cursor = new Cursor("ab");
    assertEquals('a', cursor.advance());
    assertEquals('b', cursor.advance());
    assertTrue(cursor.isPastEnd());
  }

  @Test
  void advancePastEndThrows() {
    Cursor cursor = new Cursor("a");
    cursor.advance();
    assertThrows(IllegalStateException.class, cursor::advance);
  }

  @Test
  void emptyTextIsPastEndImmediately() {
    Cursor cursor = new Cursor("");
    assertTrue(cursor.isAtEnd());
    assertTrue(cursor.isPastEnd());
    assertEquals('\0', cursor.peek());
    assertEquals(1, cursor.line());
    assertEquals(1, cursor.column());
  }

  @Test
  void isAtEndBeforeLastCharacterIsConsumed() {
    Cursor cursor = new Cursor("xy");
    assertFalse(cursor.isAtEnd());
    cursor.advance();
    assertTrue(cursor.isAtEnd());
    assertFalse(cursor.isPastEnd());
    cursor.advance();
    assertTrue(cursor.isPastEnd());
  }

  @Test
  void peekDoesNotConsume() {
    Cursor cursor = new Cursor("q");
    assertEquals('q', cursor.peek());
    assertEquals('q', cursor.peek());
    assertEquals(1, cursor.column());
  }

  @Test
  void matchConsumesOnlyExpectedCharacter() {
    Cursor cursor = new Cursor("/*");
    assertFalse(cursor.match('*'));
    assertTrue(cursor.match('/'));
    assertTrue(cursor.match('*'));
    assertFalse(cursor.match('*'));
    assertEquals(3, cursor.column());
  }

  @Test
  void tracksLinesAndColumns() {
    Cursor cursor = new Cursor("ab\ncd");
    cursor.advance();
    cursor.advance();
    assertEquals(1, cursor.line());
    assertEquals(3, cursor.column());
    cursor.advance();
    assertEquals(2, cursor.line());
    assertEquals(1, cursor.column());
    cursor.advance();
    assertEquals(2, cursor.column());
  }

  @Test
  void carriageReturnLineFeedCountsAsOneLineBreak() {
    Cursor cursor = new Cursor("a\r\nb");
    cursor.advance();
    cursor.advance();
    cursor.advance();
    assertEquals(2, cursor.line());
    assertEquals(1, cursor.column());
  }

  @Test
  void loneCarriageReturnIsLineBreak() {
    Cursor cursor = new Cursor("a\rb");
    cursor.advance();
    cursor.advance();
    assertEquals(2, cursor.line());
    assertEquals(1, cursor.column());
  }
}
