package com.kriskowal.lino;

/** A top-level piece of a value list. */
final class Token {

  enum Kind {
    BARE,
    QUOTED,
    PARENTHESIZED
  }

  final Kind kind;
  /** Exactly as written. */
  final String raw;
  /** Decoded content for quoted tokens, the text between the parentheses for parenthesized ones. */
  final String value;
  final int offset;

  Token(Kind kind, String raw, String value, int offset) {
    this.kind = kind;
    this.raw = raw;
    this.value = value;
    this.offset = offset;
  }

  @Override
  public String toString() {
    return kind + "(" + raw + ")";
  }
}
