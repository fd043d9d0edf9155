package com.kriskowal.lino;

import java.util.*;

/**
 * A link together with the groups nested under it by indentation. {@link #toLinks()} flattens
 * the tree: the group's own link first, then each descendant paired with the chain of its
 * ancestors, folded left into anonymous links. So {@code root} with child {@code child} and
 * grandchild {@code leaf} yields {@code root}, {@code (root child)} and {@code ((root child)
 * leaf)}.
 */
public final class LinksGroup {

  private final Link link;
  private final List<LinksGroup> groups;

  public LinksGroup(Link link) {
    this(link, null);
  }

  public LinksGroup(Link link, List<LinksGroup> groups) {
    this.link = Objects.requireNonNull(link, "link");
    this.groups = groups == null ? List.of() : List.copyOf(groups);
  }

  public Link getLink() {
    return link;
  }

  public List<LinksGroup> getGroups() {
    return groups;
  }

  public List<Link> toLinks() {
    List<Link> links = new ArrayList<>();
    appendTo(links);
    return links;
  }

  public void appendTo(List<Link> links) {
    appendTo(links, List.of());
  }

  private void appendTo(List<Link> links, List<Link> ancestors) {
    links.add(combine(ancestors, link));
    if (groups.isEmpty()) {
      return;
    }
    List<Link> path = new ArrayList<>(ancestors.size() + 1);
    path.addAll(ancestors);
    path.add(link);
    for (LinksGroup group : groups) {
      group.appendTo(links, path);
    }
  }

  static Link combine(List<Link> ancestors, Link current) {
    if (ancestors.isEmpty()) {
      return current;
    }
    Link path = ancestors.get(0);
    for (int i = 1; i < ancestors.size(); i++) {
      path = path.combine(ancestors.get(i));
    }
    return path.combine(current);
  }

  public String format() {
    return format(FormatOptions.DEFAULT);
  }

  public String format(FormatOptions options) {
    return new Formatter(options).format(toLinks());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LinksGroup)) return false;
    LinksGroup other = (LinksGroup) o;
    return link.equals(other.link) && groups.equals(other.groups);
  }

  @Override
  public int hashCode() {
    return Objects.hash(link, groups);
  }

  @Override
  public String toString() {
    return format();
  }
}
