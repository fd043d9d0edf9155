package com.kriskowal.lino;

import java.util.*;

/**
 * Recursive descent over logical lines. Each line becomes a {@link RawNode}; lines indented deeper
 * than it become its children.
 */
final class ElementParser {

  private final ParseCursor cursor;

  ElementParser(ParseCursor cursor) {
    this.cursor = cursor;
  }

  List<RawNode> parseDocument() {
    List<RawNode> nodes = new ArrayList<>();
    while (cursor.skipBlankLines()) {
      nodes.add(parseElement());
    }
    return nodes;
  }

  private RawNode parseElement() {
    SourceLine line = cursor.line();
    int indent = cursor.indentOf(line);
    int contentOffset = line.offset + leadingWhitespace(line.text);
    cursor.descend(contentOffset);
    cursor.next();

    RawNode node = parseLine(line.text.trim(), contentOffset);
    while (cursor.skipBlankLines() && cursor.indentOf(cursor.line()) > indent) {
      node.children.add(parseElement());
    }
    cursor.ascend();
    return node;
  }

  // ====================================================================
  // Line content
  // ====================================================================

  private RawNode parseLine(String content, int offset) {
    if (content.startsWith("(")
        && ValueTokenizer.findClosingParen(content, 0, offset, cursor) == content.length() - 1) {
      return parseLinkBody(content.substring(1, content.length() - 1), offset + 1);
    }

    int colon = ValueTokenizer.findColon(content, offset, cursor);
    if (colon >= 0 && colon == content.length() - 1) {
      return RawNode.header(parseIds(content.substring(0, colon), offset, offset + colon));
    }
    if (colon >= 0) {
      List<String> ids = parseIds(content.substring(0, colon), offset, offset + colon);
      return RawNode.link(ids, parseValues(content.substring(colon + 1), offset + colon + 1));
    }
    return RawNode.link(null, parseValues(content, offset));
  }

  /** The inside of a parenthesized link: {@code id: values} or just {@code values}. */
  private RawNode parseLinkBody(String body, int offset) {
    int colon = ValueTokenizer.findColon(body, offset, cursor);
    if (colon < 0) {
      return RawNode.link(null, parseValues(body, offset));
    }
    List<String> ids = parseIds(body.substring(0, colon), offset, offset + colon);
    return RawNode.link(ids, parseValues(body.substring(colon + 1), offset + colon + 1));
  }

  private List<String> parseIds(String text, int offset, int colonOffset) {
    List<Token> tokens = ValueTokenizer.tokenize(text, offset, cursor);
    if (tokens.isEmpty()) {
      throw cursor.error(ErrorKind.MALFORMED_SYNTAX, "Missing id before \":\"", colonOffset);
    }
    List<String> ids = new ArrayList<>(tokens.size());
    for (Token token : tokens) {
      if (token.kind == Token.Kind.PARENTHESIZED) {
        throw cursor.error(
            ErrorKind.MALFORMED_SYNTAX, "Parenthesized link cannot be an id", token.offset);
      }
      ids.add(checkedId(token));
    }
    return ids;
  }

  private List<RawNode> parseValues(String text, int offset) {
    List<Token> tokens = ValueTokenizer.tokenize(text, offset, cursor);
    List<RawNode> values = new ArrayList<>(tokens.size());
    for (Token token : tokens) {
      values.add(parseValue(token));
    }
    return values;
  }

  private RawNode parseValue(Token token) {
    if (token.kind != Token.Kind.PARENTHESIZED) {
      return RawNode.reference(checkedId(token));
    }
    cursor.descend(token.offset);
    RawNode nested = parseLinkBody(token.value, token.offset + 1);
    cursor.ascend();
    return nested;
  }

  private String checkedId(Token token) {
    if (token.value.isEmpty()) {
      throw cursor.error(ErrorKind.MALFORMED_SYNTAX, "Empty reference", token.offset);
    }
    return token.value;
  }

  private static int leadingWhitespace(String text) {
    int i = 0;
    // Matches String.trim(), which the line content is cut with.
    while (i < text.length() && text.charAt(i) <= ' ') {
      i++;
    }
    return i;
  }
}
