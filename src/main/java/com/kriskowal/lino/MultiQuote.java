package com.kriskowal.lino;

/**
 * Quoted strings delimited by N identical quote characters on each side, for any N.
 *
 * <p>The opening run fixes N. The string ends at the first run of exactly N quotes not followed
 * by another quote; inside, each run of 2N quotes stands for N literal quotes.
 */
final class MultiQuote {

  private MultiQuote() {}

  static final class Decoded {
    final String content;
    final int length;

    Decoded(String content, int length) {
      this.content = content;
      this.length = length;
    }
  }

  /**
   * Decodes the quoted string starting at {@code start}, which must hold a quote character.
   * Returns {@code null} if the text ends before a closing run.
   */
  static Decoded tryDecode(CharSequence text, int start) {
    char quote = text.charAt(start);
    int n = QuoteState.runLength(text, start, quote);
    StringBuilder content = new StringBuilder();
    int i = start + n;

    while (i < text.length()) {
      char c = text.charAt(i);
      if (c != quote) {
        content.append(c);
        i++;
        continue;
      }
      int run = QuoteState.runLength(text, i, quote);
      while (run >= 2 * n) {
        repeat(content, quote, n);
        i += 2 * n;
        run -= 2 * n;
      }
      if (run >= n) {
        repeat(content, quote, run - n);
        i += run;
        return new Decoded(content.toString(), i - start);
      }
      repeat(content, quote, run);
      i += run;
    }
    return null;
  }

  /**
   * Wraps {@code content} in single {@code quote} characters, doubling every quote character it
   * contains. The content must not start with {@code quote}.
   */
  static String encode(String content, char quote) {
    StringBuilder out = new StringBuilder(content.length() + 2);
    out.append(quote);
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      out.append(c);
      if (c == quote) {
        out.append(quote);
      }
    }
    return out.append(quote).toString();
  }

  private static void repeat(StringBuilder out, char c, int count) {
    for (int i = 0; i < count; i++) {
      out.append(c);
    }
  }
}
