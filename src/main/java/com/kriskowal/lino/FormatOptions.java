package com.kriskowal.lino;

import java.util.Objects;

/**
 * Layout options for {@link Formatter}.
 *
 * <p>Defaults: parentheses kept, 80 column limit (only consulted when {@code indentLongLines} is
 * set), no reference-count limit, no grouping, two-space indent, inline rendering preferred.
 */
public final class FormatOptions {

  public static final FormatOptions DEFAULT = builder().build();

  private final boolean lessParentheses;
  private final int maxLineLength;
  private final boolean indentLongLines;
  private final Integer maxInlineRefs;
  private final boolean groupConsecutive;
  private final String indentString;
  private final boolean preferInline;

  private FormatOptions(Builder b) {
    this.lessParentheses = b.lessParentheses;
    this.maxLineLength = b.maxLineLength;
    this.indentLongLines = b.indentLongLines;
    this.maxInlineRefs = b.maxInlineRefs;
    this.groupConsecutive = b.groupConsecutive;
    this.indentString = b.indentString;
    this.preferInline = b.preferInline;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .lessParentheses(lessParentheses)
        .maxLineLength(maxLineLength)
        .indentLongLines(indentLongLines)
        .maxInlineRefs(maxInlineRefs)
        .groupConsecutive(groupConsecutive)
        .indentString(indentString)
        .preferInline(preferInline);
  }

  public boolean isLessParentheses() {
    return lessParentheses;
  }

  public int getMaxLineLength() {
    return maxLineLength;
  }

  public boolean isIndentLongLines() {
    return indentLongLines;
  }

  /** {@code null} means unlimited. */
  public Integer getMaxInlineRefs() {
    return maxInlineRefs;
  }

  public boolean isGroupConsecutive() {
    return groupConsecutive;
  }

  public String getIndentString() {
    return indentString;
  }

  public boolean isPreferInline() {
    return preferInline;
  }

  public boolean shouldIndentByLength(String line) {
    return indentLongLines && line.codePointCount(0, line.length()) > maxLineLength;
  }

  public boolean shouldIndentByRefCount(int refCount) {
    return maxInlineRefs != null && refCount > maxInlineRefs;
  }

  public static final class Builder {
    private boolean lessParentheses = false;
    private int maxLineLength = 80;
    private boolean indentLongLines = false;
    private Integer maxInlineRefs = null;
    private boolean groupConsecutive = false;
    private String indentString = "  ";
    private boolean preferInline = true;

    private Builder() {}

    public Builder lessParentheses(boolean value) {
      this.lessParentheses = value;
      return this;
    }

    public Builder maxLineLength(int value) {
      if (value < 1) {
        throw new IllegalArgumentException("maxLineLength must be positive: " + value);
      }
      this.maxLineLength = value;
      return this;
    }

    public Builder indentLongLines(boolean value) {
      this.indentLongLines = value;
      return this;
    }

    public Builder maxInlineRefs(Integer value) {
      if (value != null && value < 0) {
        throw new IllegalArgumentException("maxInlineRefs must not be negative: " + value);
      }
      this.maxInlineRefs = value;
      return this;
    }

    public Builder groupConsecutive(boolean value) {
      this.groupConsecutive = value;
      return this;
    }

    public Builder indentString(String value) {
      Objects.requireNonNull(value, "indentString");
      if (value.isEmpty() || !value.isBlank()) {
        throw new IllegalArgumentException("indentString must be non-empty whitespace");
      }
      this.indentString = value;
      return this;
    }

    public Builder preferInline(boolean value) {
      this.preferInline = value;
      return this;
    }

    public FormatOptions build() {
      return new FormatOptions(this);
    }
  }
}
