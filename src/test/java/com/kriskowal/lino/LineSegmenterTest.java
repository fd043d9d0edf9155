package com.kriskowal.lino;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class LineSegmenterTest {

  private static List<String> split(String text) {
    return LineSegmenter.split(new ParseCursor(text, null, 1000)).stream()
        .map(line -> line.text)
        .collect(Collectors.toList());
  }

  private static LinoException failure(String text, int maxDepth) {
    return assertThrows(
        LinoException.class, () -> LineSegmenter.split(new ParseCursor(text, null, maxDepth)));
  }

  @Test
  void testPhysicalLines() {
    assertEquals(List.of("a", "  b", "", "c"), split("a\n  b\n\nc\n"));
    assertEquals(List.of("a", "b"), split("a\nb"));
  }

  @Test
  void testLineOffsets() {
    List<SourceLine> lines = LineSegmenter.split(new ParseCursor("ab\n  cd", null, 10));
    assertEquals(0, lines.get(0).offset);
    assertEquals(3, lines.get(1).offset);
    assertEquals(2, lines.get(1).rawIndent);
  }

  @Test
  void testNewlineInsideQuotes() {
    assertEquals(List.of("'a\nb' c", "d"), split("'a\nb' c\nd"));
    assertEquals(List.of("x \"\"\"a\n\"b\"\n\"\"\"", "y"), split("x \"\"\"a\n\"b\"\n\"\"\"\ny"));
  }

  @Test
  void testNewlineInsideParentheses() {
    assertEquals(List.of("(a\n  (b\n  c))", "d"), split("(a\n  (b\n  c))\nd"));
  }

  @Test
  void testRecordsMatchingParentheses() {
    ParseCursor cursor = new ParseCursor("(a (b) ')') c\n(d)", null, 10);
    LineSegmenter.split(cursor);
    assertEquals(10, cursor.closingParen(0));
    assertEquals(5, cursor.closingParen(3));
    assertEquals(16, cursor.closingParen(14));
    assertEquals(-1, cursor.closingParen(1));
  }

  @Test
  void testParenthesesInsideQuotes() {
    assertEquals(List.of("'(' x", "y"), split("'(' x\ny"));
  }

  @Test
  void testApostrophesInWords() {
    assertEquals(List.of("it's", "fine"), split("it's\nfine"));
  }

  @Test
  void testStrayClosingParenthesis() {
    LinoException e = failure("a\nb)", 10);
    assertEquals(ErrorKind.MALFORMED_SYNTAX, e.getKind());
    assertEquals(2, e.getLine());
    assertEquals(2, e.getColumn());
  }

  @Test
  void testUnterminatedQuote() {
    LinoException e = failure("a ''b' c", 10);
    assertEquals(ErrorKind.UNTERMINATED_QUOTE, e.getKind());
    assertEquals(2, e.getOffset());
  }

  @Test
  void testEarliestUnclosedParenthesis() {
    LinoException e = failure("(a (b) (c", 10);
    assertEquals(ErrorKind.UNTERMINATED_PARENTHESIS, e.getKind());
    assertEquals(0, e.getOffset());
  }

  @Test
  void testDepthCheckedWhileScanning() {
    LinoException e = failure("((()))", 2);
    assertEquals(ErrorKind.MAX_DEPTH_EXCEEDED, e.getKind());
    assertEquals(2, e.getOffset());
  }
}
