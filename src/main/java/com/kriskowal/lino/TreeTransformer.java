package com.kriskowal.lino;

import java.util.*;

/**
 * Turns raw nodes into links.
 *
 * <p>An {@code id:} header absorbs its indented block as its values. Any other node with an
 * indented block becomes a {@link LinksGroup}: the node itself, then every descendant paired with
 * its ancestor chain.
 */
final class TreeTransformer {

  private TreeTransformer() {}

  static List<Link> transform(List<RawNode> nodes) {
    List<Link> links = new ArrayList<>();
    for (RawNode node : nodes) {
      toGroup(node).appendTo(links);
    }
    return links;
  }

  private static LinksGroup toGroup(RawNode node) {
    if (node.children.isEmpty()) {
      return new LinksGroup(toLink(node));
    }
    if (node.indentedHeader) {
      return new LinksGroup(absorbChildren(node));
    }
    List<LinksGroup> groups = new ArrayList<>(node.children.size());
    for (RawNode child : node.children) {
      groups.add(toGroup(child));
    }
    return new LinksGroup(toLink(node), groups);
  }

  private static Link toLink(RawNode node) {
    List<Link> values = new ArrayList<>(node.values.size());
    for (RawNode value : node.values) {
      values.add(toLink(value));
    }
    return new Link(node.ids, values);
  }

  /** The node's own values followed by one value per indented child. */
  private static Link absorbChildren(RawNode node) {
    List<Link> values = new ArrayList<>(node.values.size() + node.children.size());
    for (RawNode value : node.values) {
      values.add(toLink(value));
    }
    for (RawNode child : node.children) {
      values.add(childValue(child));
    }
    return new Link(node.ids, values);
  }

  /**
   * An anonymous child line holding a single value stands for that value, as if it had been
   * written after the header's colon. A child with its own block absorbs that block in turn.
   */
  private static Link childValue(RawNode child) {
    if (!child.children.isEmpty()) {
      return absorbChildren(child);
    }
    if (child.ids == null && child.values.size() == 1 && !child.indentedHeader) {
      return toLink(child.values.get(0));
    }
    return toLink(child);
  }
}
