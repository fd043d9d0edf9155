package com.kriskowal.lino;

/**
 * Indentation relative to the first non-blank line of a document, so that the indentation unit
 * (two spaces, four spaces, a tab) never affects structure.
 */
final class IndentationNormalizer {
  private int baseline = -1;

  int normalize(SourceLine line) {
    if (baseline < 0) {
      if (line.blank) {
        return 0;
      }
      baseline = line.rawIndent;
    }
    return Math.max(0, line.rawIndent - baseline);
  }
}
