package com.kriskowal.lino;

/**
 * Scanner state shared by line segmentation and value tokenization: which quote style the scanner
 * is inside (if any), how many quote characters opened it, and the parenthesis depth outside
 * quotes.
 *
 * <p>A run of quote characters opens a quoted string only at a token boundary (start of text,
 * after whitespace, a parenthesis or a colon), so apostrophes inside bare words stay literal. The
 * length of the opening run is the quote count N. Inside, a run of K quote characters of the same
 * style closes the string when {@code K % 2N >= N}, which is exactly where {@link MultiQuote}
 * finds the closing sequence once doubled escapes are consumed.
 */
final class QuoteState {

  enum Mode {
    NONE((char) 0),
    SINGLE('\''),
    DOUBLE('"'),
    BACKTICK('`');

    final char quote;

    Mode(char quote) {
      this.quote = quote;
    }

    static Mode of(char c) {
      switch (c) {
        case '\'':
          return SINGLE;
        case '"':
          return DOUBLE;
        case '`':
          return BACKTICK;
        default:
          return NONE;
      }
    }
  }

  private Mode mode = Mode.NONE;
  private int quoteCount;
  private int quoteStart = -1;
  private int depth;

  static boolean isQuote(char c) {
    return c == '\'' || c == '"' || c == '`';
  }

  static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
  }

  static boolean atBoundary(CharSequence text, int i) {
    if (i == 0) {
      return true;
    }
    char prev = text.charAt(i - 1);
    return isWhitespace(prev) || prev == '(' || prev == ')' || prev == ':';
  }

  static int runLength(CharSequence text, int i, char c) {
    int end = i;
    while (end < text.length() && text.charAt(end) == c) {
      end++;
    }
    return end - i;
  }

  /**
   * Feeds the scanner the character at {@code i}, or the whole quote run starting there, and
   * returns how many characters were consumed (at least one).
   */
  int advance(CharSequence text, int i) {
    char c = text.charAt(i);
    if (mode == Mode.NONE) {
      if (isQuote(c) && atBoundary(text, i)) {
        int run = runLength(text, i, c);
        mode = Mode.of(c);
        quoteCount = run;
        quoteStart = i;
        return run;
      }
      if (c == '(') {
        depth++;
      } else if (c == ')' && depth > 0) {
        depth--;
      }
      return 1;
    }
    if (c == mode.quote) {
      int run = runLength(text, i, c);
      if (run % (2 * quoteCount) >= quoteCount) {
        mode = Mode.NONE;
        quoteCount = 0;
        quoteStart = -1;
      }
      return run;
    }
    return 1;
  }

  boolean inQuote() {
    return mode != Mode.NONE;
  }

  /** Offset of the opening run of the current quoted string, or -1. */
  int quoteStart() {
    return quoteStart;
  }

  int depth() {
    return depth;
  }

  /** Outside any quote with every parenthesis closed. */
  boolean isSettled() {
    return mode == Mode.NONE && depth == 0;
  }
}
