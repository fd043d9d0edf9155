package com.kriskowal.lino;

import java.util.*;

/**
 * Splits text into logical lines. A newline ends a line only outside quotes and parentheses, so
 * quoted strings and parenthesized links may span several physical lines.
 */
final class LineSegmenter {

  private LineSegmenter() {}

  static List<SourceLine> split(ParseCursor cursor) {
    String text = cursor.source();
    List<SourceLine> lines = new ArrayList<>();
    QuoteState state = new QuoteState();
    Deque<Integer> openParens = new ArrayDeque<>();
    int lineStart = 0;

    for (int i = 0; i < text.length(); ) {
      char c = text.charAt(i);
      if (c == '\n' && state.isSettled()) {
        lines.add(new SourceLine(text.substring(lineStart, i), lineStart));
        lineStart = ++i;
        continue;
      }
      if (!state.inQuote()) {
        if (c == '(') {
          openParens.push(i);
          cursor.checkDepth(openParens.size(), i);
        } else if (c == ')') {
          if (openParens.isEmpty()) {
            throw cursor.error(ErrorKind.MALFORMED_SYNTAX, "Unmatched closing parenthesis", i);
          }
          cursor.matchParens(openParens.pop(), i);
        }
      }
      i += state.advance(text, i);
    }

    if (state.inQuote()) {
      throw cursor.error(ErrorKind.UNTERMINATED_QUOTE, "Unterminated quote", state.quoteStart());
    }
    if (!openParens.isEmpty()) {
      throw cursor.error(
          ErrorKind.UNTERMINATED_PARENTHESIS, "Unterminated parenthesis", openParens.peekLast());
    }
    if (lineStart < text.length()) {
      lines.add(new SourceLine(text.substring(lineStart), lineStart));
    }
    return lines;
  }
}
