package com.kriskowal.lino;

import java.util.*;

/**
 * Splits a value list into top-level tokens: quoted strings, balanced parenthesized spans and
 * bare words.
 */
final class ValueTokenizer {

  private ValueTokenizer() {}

  /**
   * Tokenizes {@code text}, which must begin at a token boundary of the source. {@code offset} is
   * the position of {@code text} in the source and is used for token offsets and errors.
   */
  static List<Token> tokenize(String text, int offset, ParseCursor cursor) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;

    while (true) {
      while (i < text.length() && QuoteState.isWhitespace(text.charAt(i))) {
        i++;
      }
      if (i >= text.length()) {
        break;
      }

      char c = text.charAt(i);
      if (QuoteState.isQuote(c) && QuoteState.atBoundary(text, i)) {
        MultiQuote.Decoded decoded = MultiQuote.tryDecode(text, i);
        if (decoded == null) {
          throw cursor.error(ErrorKind.UNTERMINATED_QUOTE, "Unterminated quote", offset + i);
        }
        tokens.add(
            new Token(
                Token.Kind.QUOTED,
                text.substring(i, i + decoded.length),
                decoded.content,
                offset + i));
        i += decoded.length;
      } else if (c == '(') {
        int close = findClosingParen(text, i, offset, cursor);
        if (close < 0) {
          throw cursor.error(
              ErrorKind.UNTERMINATED_PARENTHESIS, "Unterminated parenthesis", offset + i);
        }
        tokens.add(
            new Token(
                Token.Kind.PARENTHESIZED,
                text.substring(i, close + 1),
                text.substring(i + 1, close),
                offset + i));
        i = close + 1;
      } else if (c == ')') {
        throw cursor.error(
            ErrorKind.MALFORMED_SYNTAX, "Unmatched closing parenthesis", offset + i);
      } else {
        int start = i;
        while (i < text.length() && !endsBareWord(text, i, start)) {
          i++;
        }
        String word = text.substring(start, i);
        tokens.add(new Token(Token.Kind.BARE, word, word, offset + start));
      }
    }
    return tokens;
  }

  private static boolean endsBareWord(String text, int i, int start) {
    char c = text.charAt(i);
    if (QuoteState.isWhitespace(c) || c == '(' || c == ')') {
      return true;
    }
    return i > start && QuoteState.isQuote(c) && QuoteState.atBoundary(text, i);
  }

  /**
   * Like {@link #findClosingParen(String, int)}, but takes the match recorded while the source was
   * segmented when there is one.
   */
  static int findClosingParen(String text, int open, int offset, ParseCursor cursor) {
    int close = cursor.closingParen(offset + open);
    return close >= 0 ? close - offset : findClosingParen(text, open);
  }

  /** Index of the parenthesis closing the one at {@code open}, or -1. */
  static int findClosingParen(String text, int open) {
    QuoteState state = new QuoteState();
    for (int i = open; i < text.length(); ) {
      if (!state.inQuote() && text.charAt(i) == ')' && state.depth() == 1) {
        return i;
      }
      i += state.advance(text, i);
    }
    return -1;
  }

  /** Index of the first colon outside quotes and parentheses, or -1. */
  static int findColon(String text) {
    return findColon(text, 0, null);
  }

  /** Same as {@link #findColon(String)}, skipping spans whose closing parenthesis is recorded. */
  static int findColon(String text, int offset, ParseCursor cursor) {
    QuoteState state = new QuoteState();
    for (int i = 0; i < text.length(); ) {
      if (!state.inQuote() && state.depth() == 0) {
        char c = text.charAt(i);
        if (c == ':') {
          return i;
        }
        int close = c == '(' && cursor != null ? cursor.closingParen(offset + i) : -1;
        if (close >= 0) {
          i = close - offset + 1;
          continue;
        }
      }
      i += state.advance(text, i);
    }
    return -1;
  }
}
