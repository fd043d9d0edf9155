package com.kriskowal.lino;

/**
 * Thrown by {@link Link#getId()} when the link carries more than one id, as in {@code (some
 * example: value)}. Use {@link Link#getIds()} for such links.
 */
public class MultiReferenceException extends RuntimeException {

  private final int referenceCount;

  public MultiReferenceException(int referenceCount) {
    super(
        "Link has a multi-reference id with "
            + referenceCount
            + " parts; use getIds() instead of getId()");
    this.referenceCount = referenceCount;
  }

  public int getReferenceCount() {
    return referenceCount;
  }
}
