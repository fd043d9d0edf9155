package com.kriskowal.lino;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import org.junit.jupiter.api.Test;

public class FormatterTest {

  private static final Parser PARSER = new Parser();

  private static Link ref(String id) {
    return new Link(id);
  }

  private static String format(String source, FormatOptions options) {
    return new Formatter(options).format(PARSER.parse(source));
  }

  @Test
  void testDefaults() {
    FormatOptions options = FormatOptions.DEFAULT;
    assertFalse(options.isLessParentheses());
    assertEquals(80, options.getMaxLineLength());
    assertFalse(options.isIndentLongLines());
    assertNull(options.getMaxInlineRefs());
    assertFalse(options.isGroupConsecutive());
    assertEquals("  ", options.getIndentString());
    assertTrue(options.isPreferInline());
  }

  @Test
  void testIndentedByRefCount() {
    FormatOptions options = FormatOptions.builder().maxInlineRefs(1).preferInline(false).build();
    assertEquals("id:\n  value1\n  value2", format("id:\n  value1\n  value2", options));
  }

  @Test
  void testPreferInlineWins() {
    FormatOptions options = FormatOptions.builder().maxInlineRefs(1).build();
    assertEquals("(id: value1 value2)", format("id:\n  value1\n  value2", options));
  }

  @Test
  void testIndentedByLength() {
    FormatOptions options =
        FormatOptions.builder()
            .indentLongLines(true)
            .maxLineLength(10)
            .preferInline(false)
            .indentString("\t")
            .build();
    assertEquals("id:\n\taaaa\n\tbbbb\n\tcccc", format("id: aaaa bbbb cccc", options));
    assertEquals("(id: a)", format("id: a", options));
  }

  @Test
  void testIndentedNestedValuesStayInline() {
    FormatOptions options = FormatOptions.builder().maxInlineRefs(0).preferInline(false).build();
    assertEquals("id:\n  (a: b)\n  'c d'", format("id: (a: b) 'c d'", options));
  }

  @Test
  void testIndentedSingleValueWrappers() {
    FormatOptions options = FormatOptions.builder().maxInlineRefs(1).preferInline(false).build();
    String text = format("id: (a) ((x: y)) b", options);
    assertEquals("id:\n  ((a))\n  (((x: y)))\n  b", text);
    assertEquals(PARSER.parse("(id: (a) ((x: y)) b)"), PARSER.parse(text));
  }

  @Test
  void testEmptyLinkKeepsItsLine() {
    FormatOptions options = FormatOptions.builder().lessParentheses(true).build();
    assertEquals("a\n()\nb", format("a\n()\nb", options));
  }

  @Test
  void testAnonymousLinksStayInline() {
    FormatOptions options = FormatOptions.builder().maxInlineRefs(0).preferInline(false).build();
    assertEquals("(a b c)", format("a b c", options));
  }

  @Test
  void testLessParentheses() {
    FormatOptions options = FormatOptions.builder().lessParentheses(true).build();
    assertEquals("papa: loves mama", format("(papa: loves mama)", options));
    assertEquals("papa has car", format("papa has car", options));
    assertEquals("('some example': value)", format("some example: value", options));
    assertEquals("a", new Formatter(options).format(ref("a")));
    assertEquals("('a b')", new Formatter(options).format(ref("a b")));
    assertEquals("()", new Formatter(options).format(new Link()));
  }

  @Test
  void testLessParenthesesKeepsNestedWrapper() {
    FormatOptions options = FormatOptions.builder().lessParentheses(true).build();
    Link wrapped = Link.of(Link.ofReferences("a", "b"));
    String text = new Formatter(options).format(wrapped);
    assertEquals("((a b))", text);
    assertEquals(List.of(wrapped), PARSER.parse(text));
  }

  @Test
  void testReferences() {
    Formatter formatter = new Formatter();
    assertEquals("(a)", formatter.format(ref("a")));
    assertEquals("('a b')", formatter.format(ref("a b")));
    assertEquals("()", formatter.format(new Link()));
  }

  @Test
  void testGroupConsecutive() {
    FormatOptions options = FormatOptions.builder().groupConsecutive(true).build();
    assertEquals("(a: b c d)\n(x: y)\n(a: z)", format("a: b\na: c d\nx: y\na: z", options));
  }

  @Test
  void testGroupConsecutiveSkipsReferences() {
    List<Link> links = List.of(ref("a"), ref("a"), new Link("a", List.of(ref("b"))));
    assertEquals(links, Formatter.groupConsecutive(links));
  }

  @Test
  void testEscapeReference() {
    assertEquals("plain", Formatter.escapeReference("plain"));
    assertEquals("'has space'", Formatter.escapeReference("has space"));
    assertEquals("'a:b'", Formatter.escapeReference("a:b"));
    assertEquals("'(x)'", Formatter.escapeReference("(x)"));
    assertEquals("\"it's\"", Formatter.escapeReference("it's"));
    assertEquals("`it's \"so\"`", Formatter.escapeReference("it's \"so\""));
    assertEquals("'a''b\"c`d'", Formatter.escapeReference("a'b\"c`d"));
    assertEquals("\"'a\"\"b`\"", Formatter.escapeReference("'a\"b`"));
  }

  @Test
  void testEscapedReferencesReadBack() {
    for (String id : List.of("has space", "it's", "it's \"so\"", "a'b\"c`d", "'a\"b`", "x'")) {
      Link link = Link.ofReferences(id);
      assertEquals(List.of(link), PARSER.parse(link.toString()), id);
    }
  }

  @Test
  void testQuotesDroppedWhenNotNeeded() {
    assertEquals("(a: b c)", format("(a: 'b' \"c\")", FormatOptions.DEFAULT));
  }

  @Test
  void testIdempotence() {
    List<String> sources =
        List.of(
            "papa has car",
            "(papa: loves mama)",
            "papa (lovesMama: loves mama)",
            "some example: value",
            "'some example': value",
            "id:\n  value1\n  (a: b)\n  'c d'",
            "parent\n  child\n    leaf",
            "a: b\n  c",
            "()",
            "(())",
            "'''it's \"\"quoted\"\"'''",
            "`tick` 'it''s'",
            "id: (a) b",
            "id: ((x: y)) (()) z",
            "a\n()\nb");
    for (FormatOptions options :
        List.of(
            FormatOptions.DEFAULT,
            FormatOptions.builder().lessParentheses(true).build(),
            FormatOptions.builder().maxInlineRefs(1).preferInline(false).build())) {
      Formatter formatter = new Formatter(options);
      for (String source : sources) {
        String once = formatter.format(PARSER.parse(source));
        String twice = formatter.format(PARSER.parse(once));
        assertEquals(once, twice, source);
      }
    }
  }

  @Test
  void testInvalidOptions() {
    assertThrows(IllegalArgumentException.class, () -> FormatOptions.builder().maxLineLength(0));
    assertThrows(IllegalArgumentException.class, () -> FormatOptions.builder().maxInlineRefs(-1));
    assertThrows(IllegalArgumentException.class, () -> FormatOptions.builder().indentString(""));
    assertThrows(IllegalArgumentException.class, () -> FormatOptions.builder().indentString("--"));
  }

  @Test
  void testToBuilder() {
    FormatOptions options = FormatOptions.builder().lessParentheses(true).maxInlineRefs(3).build();
    FormatOptions copy = options.toBuilder().preferInline(false).build();
    assertTrue(copy.isLessParentheses());
    assertEquals(3, copy.getMaxInlineRefs());
    assertFalse(copy.isPreferInline());
    assertTrue(copy.shouldIndentByRefCount(4));
    assertFalse(copy.shouldIndentByRefCount(3));
  }
}
