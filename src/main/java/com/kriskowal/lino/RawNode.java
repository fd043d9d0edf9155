package com.kriskowal.lino;

import java.util.*;

/** Intermediate parse result for one line or value, discarded once transformed into links. */
final class RawNode {
  final List<String> ids;
  final List<RawNode> values;
  final boolean indentedHeader;
  final List<RawNode> children = new ArrayList<>();

  private RawNode(List<String> ids, List<RawNode> values, boolean indentedHeader) {
    this.ids = ids;
    this.values = values;
    this.indentedHeader = indentedHeader;
  }

  static RawNode reference(String id) {
    return new RawNode(List.of(id), List.of(), false);
  }

  static RawNode link(List<String> ids, List<RawNode> values) {
    return new RawNode(ids, values, false);
  }

  /** An {@code id:} line whose values come from the indented block below it. */
  static RawNode header(List<String> ids) {
    return new RawNode(ids, List.of(), true);
  }
}
