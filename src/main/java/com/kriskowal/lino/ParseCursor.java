package com.kriskowal.lino;

import java.util.*;

/**
 * Scratch state for one parse call: the logical lines, the current line index, the indentation
 * baseline and the nesting depth. Every parse owns its own cursor, so a {@link Parser} can be
 * shared between threads.
 */
final class ParseCursor {

  private final String source;
  private final String filename;
  private final int maxDepth;
  private final IndentationNormalizer indentation = new IndentationNormalizer();

  private final Map<Integer, Integer> closingParens = new HashMap<>();

  private List<SourceLine> lines = List.of();
  private int index;
  private int depth;

  ParseCursor(String source, String filename, int maxDepth) {
    this.source = source;
    this.filename = filename;
    this.maxDepth = maxDepth;
  }

  String source() {
    return source;
  }

  void setLines(List<SourceLine> lines) {
    this.lines = lines;
    this.index = 0;
  }

  int lineCount() {
    return lines.size();
  }

  /** Moves past blank lines; returns whether a content line remains. */
  boolean skipBlankLines() {
    while (index < lines.size() && lines.get(index).blank) {
      index++;
    }
    return index < lines.size();
  }

  SourceLine line() {
    return lines.get(index);
  }

  void next() {
    index++;
  }

  void matchParens(int open, int close) {
    closingParens.put(open, close);
  }

  /** Source offset of the parenthesis closing the one at {@code open}, or -1 if none was seen. */
  int closingParen(int open) {
    Integer close = closingParens.get(open);
    return close == null ? -1 : close;
  }

  int indentOf(SourceLine line) {
    return indentation.normalize(line);
  }

  /** Enters one nesting level, failing before any further recursion once the limit is passed. */
  void descend(int offset) {
    checkDepth(++depth, offset);
  }

  void checkDepth(int nesting, int offset) {
    if (nesting > maxDepth) {
      throw error(
          ErrorKind.MAX_DEPTH_EXCEEDED,
          "Maximum nesting depth of " + maxDepth + " exceeded",
          offset);
    }
  }

  void ascend() {
    depth--;
  }

  LinoException error(ErrorKind kind, String reason, int offset) {
    int line = 1;
    int lineStart = 0;
    int end = Math.min(offset, source.length());
    for (int i = 0; i < end; i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return new LinoException(kind, reason, filename, line, offset - lineStart + 1, offset);
  }
}
