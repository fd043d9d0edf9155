package com.kriskowal.lino;

import java.util.List;
import java.util.Objects;

/** Limits and pre-processing switches for {@link Parser}. */
public final class ParserOptions {

  public static final int DEFAULT_MAX_INPUT_SIZE = 10 * 1024 * 1024;
  public static final int DEFAULT_MAX_DEPTH = 1000;

  public static final ParserOptions DEFAULT = builder().build();

  private final int maxInputSize;
  private final int maxDepth;
  private final boolean tokenizeSymbols;
  private final List<String> punctuationSymbols;
  private final List<String> mathSymbols;

  private ParserOptions(Builder b) {
    this.maxInputSize = b.maxInputSize;
    this.maxDepth = b.maxDepth;
    this.tokenizeSymbols = b.tokenizeSymbols;
    this.punctuationSymbols = b.punctuationSymbols;
    this.mathSymbols = b.mathSymbols;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Maximum input length in characters. */
  public int getMaxInputSize() {
    return maxInputSize;
  }

  /** Maximum combined indentation and parenthesis nesting depth. */
  public int getMaxDepth() {
    return maxDepth;
  }

  public boolean isTokenizeSymbols() {
    return tokenizeSymbols;
  }

  public List<String> getPunctuationSymbols() {
    return punctuationSymbols;
  }

  public List<String> getMathSymbols() {
    return mathSymbols;
  }

  public static final class Builder {
    private int maxInputSize = DEFAULT_MAX_INPUT_SIZE;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private boolean tokenizeSymbols = false;
    private List<String> punctuationSymbols = SymbolTokenizer.DEFAULT_PUNCTUATION_SYMBOLS;
    private List<String> mathSymbols = SymbolTokenizer.DEFAULT_MATH_SYMBOLS;

    private Builder() {}

    public Builder maxInputSize(int value) {
      if (value < 1) {
        throw new IllegalArgumentException("maxInputSize must be positive: " + value);
      }
      this.maxInputSize = value;
      return this;
    }

    public Builder maxDepth(int value) {
      if (value < 1) {
        throw new IllegalArgumentException("maxDepth must be positive: " + value);
      }
      this.maxDepth = value;
      return this;
    }

    public Builder tokenizeSymbols(boolean value) {
      this.tokenizeSymbols = value;
      return this;
    }

    public Builder punctuationSymbols(List<String> value) {
      this.punctuationSymbols = List.copyOf(Objects.requireNonNull(value));
      return this;
    }

    public Builder mathSymbols(List<String> value) {
      this.mathSymbols = List.copyOf(Objects.requireNonNull(value));
      return this;
    }

    public ParserOptions build() {
      return new ParserOptions(this);
    }
  }
}
