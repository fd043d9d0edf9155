package com.kriskowal.lino;

/** Reasons a parse can be rejected. */
public enum ErrorKind {
  INPUT_TOO_LARGE,
  MAX_DEPTH_EXCEEDED,
  UNTERMINATED_QUOTE,
  UNTERMINATED_PARENTHESIS,
  MALFORMED_SYNTAX
}
