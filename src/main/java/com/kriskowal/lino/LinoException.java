package com.kriskowal.lino;

/**
 * Thrown when notation text cannot be parsed. A failed parse never yields a partial result.
 *
 * <p>Line and column are 1-based, the offset is 0-based into the parsed text. All three are -1
 * when no position applies (for example when the whole input is too large).
 */
public class LinoException extends RuntimeException {

  private final ErrorKind kind;
  private final String filename;
  private final int line;
  private final int column;
  private final int offset;

  public LinoException(
      ErrorKind kind, String reason, String filename, int line, int column, int offset) {
    super(
        reason
            + (line > 0 ? " at " + line + ":" + column : "")
            + (filename != null ? (line > 0 ? " of " : " ") + "<" + filename + ">" : ""));
    this.kind = kind;
    this.filename = filename;
    this.line = line;
    this.column = column;
    this.offset = offset;
  }

  public LinoException(ErrorKind kind, String reason, String filename) {
    this(kind, reason, filename, -1, -1, -1);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getFilename() {
    return filename;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public int getOffset() {
    return offset;
  }
}
