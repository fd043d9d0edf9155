package com.kriskowal.lino;

/** One logical line: its raw text (which may span physical lines) and where it starts. */
final class SourceLine {
  final String text;
  final int offset;
  final int rawIndent;
  final boolean blank;

  SourceLine(String text, int offset) {
    this.text = text;
    this.offset = offset;
    int indent = 0;
    while (indent < text.length() && (text.charAt(indent) == ' ' || text.charAt(indent) == '\t')) {
      indent++;
    }
    this.rawIndent = indent;
    this.blank = text.isBlank();
  }
}
