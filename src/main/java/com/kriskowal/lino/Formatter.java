package com.kriskowal.lino;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Renders links back to notation text.
 *
 * <p>A link with ids is written inline as {@code (id: v1 v2)}, or as an {@code id:} header with one
 * value per indented line when {@link FormatOptions} asks for indentation and does not prefer
 * inline output. Anonymous links are always inline since they have no header to hang a block on.
 * Nested values are always written inline with their parentheses.
 */
public final class Formatter {

  private final FormatOptions options;

  public Formatter() {
    this(FormatOptions.DEFAULT);
  }

  public Formatter(FormatOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Formats each link on its own line, merging runs of same-id links first if configured. */
  public String format(List<Link> links) {
    List<Link> toFormat = options.isGroupConsecutive() ? groupConsecutive(links) : links;
    return toFormat.stream().map(this::format).collect(Collectors.joining("\n"));
  }

  public String format(Link link) {
    if (link.isEmpty()) {
      return "()";
    }
    if (link.getValues().isEmpty()) {
      String id = link.getIdString();
      String escaped = escapeReference(id);
      return options.isLessParentheses() && !needsEscaping(id) ? escaped : "(" + escaped + ")";
    }

    String inline = inline(link);
    boolean indent =
        options.shouldIndentByRefCount(link.getValues().size())
            || options.shouldIndentByLength(inline);
    if (indent && !options.isPreferInline() && link.hasIds()) {
      return indented(link);
    }
    return inline;
  }

  private String inline(Link link) {
    String values = formatValues(link);
    if (!link.hasIds()) {
      // A lone nested link keeps the outer pair, or it would read back as the nested link.
      boolean wrapped = link.getValues().size() == 1 && !link.getValues().get(0).isReference();
      return options.isLessParentheses() && !wrapped ? values : "(" + values + ")";
    }
    String id = link.getIdString();
    String withColon = escapeReference(id) + ": " + values;
    return options.isLessParentheses() && !needsEscaping(id) ? withColon : "(" + withColon + ")";
  }

  private String indented(Link link) {
    StringBuilder out = new StringBuilder(escapeReference(link.getIdString())).append(':');
    for (Link value : link.getValues()) {
      String line = formatValue(value);
      // A child line holding a single value reads back as that value, so it needs an extra pair.
      if (!value.hasIds() && value.getValues().size() == 1) {
        line = "(" + line + ")";
      }
      out.append('\n').append(options.getIndentString()).append(line);
    }
    return out.toString();
  }

  private static String formatValues(Link link) {
    return link.getValues().stream().map(Formatter::formatValue).collect(Collectors.joining(" "));
  }

  private static String formatValue(Link value) {
    if (value.getValues().isEmpty()) {
      return value.hasIds() ? escapeReference(value.getIdString()) : "()";
    }
    String values = formatValues(value);
    return value.hasIds()
        ? "(" + escapeReference(value.getIdString()) + ": " + values + ")"
        : "(" + values + ")";
  }

  /**
   * Merges adjacent links that have the same ids and at least one value into one link holding all
   * of their values.
   */
  static List<Link> groupConsecutive(List<Link> links) {
    List<Link> grouped = new ArrayList<>(links.size());
    int i = 0;
    while (i < links.size()) {
      Link current = links.get(i);
      int j = i + 1;
      if (current.hasIds() && !current.getValues().isEmpty()) {
        while (j < links.size()
            && current.getIds().equals(links.get(j).getIds())
            && !links.get(j).getValues().isEmpty()) {
          j++;
        }
      }
      if (j == i + 1) {
        grouped.add(current);
      } else {
        List<Link> values = new ArrayList<>();
        for (int k = i; k < j; k++) {
          values.addAll(links.get(k).getValues());
        }
        grouped.add(new Link(current.getIds(), values));
      }
      i = j;
    }
    return grouped;
  }

  // ====================================================================
  // Escaping
  // ====================================================================

  /** True when the string cannot be written as a bare reference. */
  public static boolean needsEscaping(String reference) {
    for (int i = 0; i < reference.length(); i++) {
      char c = reference.charAt(i);
      if (Character.isWhitespace(c) || c == ':' || c == '(' || c == ')' || QuoteState.isQuote(c)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Quotes a reference if it needs it, using the first of {@code '}, {@code "} and {@code `} that
   * does not occur in it. A string containing all three is single-quoted with its quotes doubled
   * (double quotes are used instead when it starts with a single quote).
   */
  public static String escapeReference(String reference) {
    if (reference == null || reference.isEmpty()) {
      return "";
    }
    if (!needsEscaping(reference)) {
      return reference;
    }
    for (char quote : new char[] {'\'', '"', '`'}) {
      if (reference.indexOf(quote) < 0) {
        return quote + reference + quote;
      }
    }
    return MultiQuote.encode(reference, reference.charAt(0) == '\'' ? '"' : '\'');
  }
}
