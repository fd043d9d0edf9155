package com.kriskowal.lino;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A link: an optional ordered sequence of ids and an ordered list of child links.
 *
 * <p>Links are immutable values compared structurally. A link with no ids and no values is the
 * empty link, one id and no values is a reference, and more than one id is a multi-reference,
 * which has no single-id form (see {@link #getId()}).
 *
 * <p>An absent id sequence is represented as {@code null}; an empty list passed to a constructor
 * is normalized to absent.
 */
public final class Link {

  private final List<String> ids;
  private final List<Link> values;

  /** The empty link {@code ()}. */
  public Link() {
    this((List<String>) null, null);
  }

  /** A reference to {@code id}. */
  public Link(String id) {
    this(id != null ? List.of(id) : null, null);
  }

  /** A reference with one or more ids. */
  public Link(List<String> ids) {
    this(ids, null);
  }

  /** A link with a single id (or none, if {@code id} is null) and the given values. */
  public Link(String id, List<Link> values) {
    this(id != null ? List.of(id) : null, values);
  }

  public Link(List<String> ids, List<Link> values) {
    if (ids != null) {
      for (String id : ids) {
        if (id == null || id.isEmpty()) {
          throw new IllegalArgumentException("Link ids must not contain null or empty entries");
        }
      }
    }
    this.ids = ids == null || ids.isEmpty() ? null : List.copyOf(ids);
    this.values = values == null ? List.of() : List.copyOf(values);
  }

  /** An anonymous link over {@code values}. */
  public static Link of(Link... values) {
    return new Link((List<String>) null, Arrays.asList(values));
  }

  /** An anonymous link whose values are references to each of {@code ids}. */
  public static Link ofReferences(String... ids) {
    List<Link> values = new ArrayList<>(ids.length);
    for (String id : ids) {
      values.add(new Link(id));
    }
    return new Link((List<String>) null, values);
  }

  /**
   * Returns the single id, or {@code null} for an anonymous link.
   *
   * @throws MultiReferenceException if the link has more than one id
   */
  public String getId() {
    if (ids == null) {
      return null;
    }
    if (ids.size() > 1) {
      throw new MultiReferenceException(ids.size());
    }
    return ids.get(0);
  }

  /** Returns all ids, or {@code null} for an anonymous link. Never throws. */
  public List<String> getIds() {
    return ids;
  }

  /** Ids joined with a single space, or {@code null} for an anonymous link. */
  public String getIdString() {
    return ids == null ? null : String.join(" ", ids);
  }

  public List<Link> getValues() {
    return values;
  }

  public boolean hasIds() {
    return ids != null;
  }

  public boolean isMultiReference() {
    return ids != null && ids.size() > 1;
  }

  /** True when the link has ids and no values. */
  public boolean isReference() {
    return ids != null && values.isEmpty();
  }

  public boolean isEmpty() {
    return ids == null && values.isEmpty();
  }

  /** A new anonymous link pairing this link with {@code other}. */
  public Link combine(Link other) {
    return new Link((List<String>) null, List.of(this, Objects.requireNonNull(other)));
  }

  /** Unwraps single-value containers, recursively for links with several values. */
  public Link simplify() {
    if (values.isEmpty()) {
      return this;
    }
    if (values.size() == 1) {
      return values.get(0);
    }
    return new Link(ids, values.stream().map(Link::simplify).collect(Collectors.toList()));
  }

  /** Values rendered as they would appear after the colon, separated by spaces. */
  public String getValuesString() {
    return values.stream().map(Link::toLinkOrIdString).collect(Collectors.joining(" "));
  }

  /** The escaped id for a reference, otherwise the full inline form. */
  public String toLinkOrIdString() {
    if (values.isEmpty()) {
      return ids == null ? "" : Formatter.escapeReference(getIdString());
    }
    return toString();
  }

  public String format(boolean lessParentheses) {
    return format(FormatOptions.builder().lessParentheses(lessParentheses).build());
  }

  public String format(FormatOptions options) {
    return new Formatter(options).format(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Link)) return false;
    Link other = (Link) o;
    return Objects.equals(ids, other.ids) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ids, values);
  }

  @Override
  public String toString() {
    return new Formatter(FormatOptions.DEFAULT).format(this);
  }
}
