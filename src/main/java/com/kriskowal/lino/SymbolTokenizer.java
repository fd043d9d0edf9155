package com.kriskowal.lino;

import java.util.*;

/**
 * Optional pre-pass that splits punctuation and arithmetic symbols off adjacent words so they
 * parse as references of their own: {@code hello, world} reads as {@code hello , world} and {@code
 * 1+1} as {@code 1 + 1}. Math symbols split only between digits, which keeps {@code Jean-Luc}
 * whole. Quoted strings are left untouched.
 */
public final class SymbolTokenizer {

  public static final List<String> DEFAULT_PUNCTUATION_SYMBOLS = List.of(",", ".", ";", "!", "?");
  public static final List<String> DEFAULT_MATH_SYMBOLS =
      List.of("+", "-", "*", "/", "=", "<", ">", "%", "^");

  private final Set<Character> punctuation;
  private final Set<Character> math;

  public SymbolTokenizer() {
    this(DEFAULT_PUNCTUATION_SYMBOLS, DEFAULT_MATH_SYMBOLS);
  }

  public SymbolTokenizer(List<String> punctuationSymbols, List<String> mathSymbols) {
    this.punctuation = toChars(punctuationSymbols);
    this.math = toChars(mathSymbols);
  }

  private static Set<Character> toChars(List<String> symbols) {
    Set<Character> chars = new HashSet<>();
    for (String symbol : symbols) {
      if (symbol.length() != 1) {
        throw new IllegalArgumentException("Symbols must be single characters: " + symbol);
      }
      chars.add(symbol.charAt(0));
    }
    return chars;
  }

  public String tokenize(String input) {
    StringBuilder out = new StringBuilder(input.length() + 16);
    QuoteState quotes = new QuoteState();

    for (int i = 0; i < input.length(); ) {
      char c = input.charAt(i);
      if (quotes.inQuote() || (QuoteState.isQuote(c) && QuoteState.atBoundary(input, i))) {
        int n = quotes.advance(input, i);
        out.append(input, i, i + n);
        i += n;
        continue;
      }

      char prev = i > 0 ? input.charAt(i - 1) : 0;
      char next = i + 1 < input.length() ? input.charAt(i + 1) : 0;
      if (punctuation.contains(c) && Character.isLetterOrDigit(prev)) {
        separate(out);
        out.append(c);
        if (Character.isLetterOrDigit(next)) {
          out.append(' ');
        }
      } else if (math.contains(c) && Character.isDigit(prev) && Character.isDigit(next)) {
        separate(out);
        out.append(c).append(' ');
      } else {
        out.append(c);
      }
      i++;
    }
    return out.toString();
  }

  /** Removes the spaces {@link #tokenize} would have inserted around symbols. */
  public String compact(String output) {
    StringBuilder out = new StringBuilder(output.length());
    QuoteState quotes = new QuoteState();

    for (int i = 0; i < output.length(); ) {
      char c = output.charAt(i);
      if (quotes.inQuote() || (QuoteState.isQuote(c) && QuoteState.atBoundary(output, i))) {
        int n = quotes.advance(output, i);
        out.append(output, i, i + n);
        i += n;
        continue;
      }
      if (c == ' ' && out.length() > 0) {
        char prev = out.charAt(out.length() - 1);
        char next = i + 1 < output.length() ? output.charAt(i + 1) : 0;
        if (!QuoteState.isWhitespace(prev) && (isSymbol(prev) || isSymbol(next))) {
          i++;
          continue;
        }
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private boolean isSymbol(char c) {
    return punctuation.contains(c) || math.contains(c);
  }

  private static void separate(StringBuilder out) {
    if (out.length() > 0 && !QuoteState.isWhitespace(out.charAt(out.length() - 1))) {
      out.append(' ');
    }
  }
}
