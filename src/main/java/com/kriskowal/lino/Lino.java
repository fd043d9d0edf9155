package com.kriskowal.lino;

import java.util.List;

/**
 * Links Notation: N-ary relations written as nested, optionally named links.
 *
 * <pre>
 * papa (lovesMama: loves mama)
 * son lovesMama
 * 3:
 *   papa
 *   loves
 *   mama
 * </pre>
 *
 * <p>Entry points using default limits and layout. For custom limits build a {@link Parser} with
 * {@link ParserOptions}; for custom layout pass {@link FormatOptions}.
 */
public final class Lino {

  private static final Parser DEFAULT_PARSER = new Parser();

  private Lino() {}

  /** Parse Links Notation text. */
  public static List<Link> parse(String source) {
    return DEFAULT_PARSER.parse(source);
  }

  /** Parse Links Notation text with filename for error messages. */
  public static List<Link> parse(String source, String filename) {
    return DEFAULT_PARSER.parse(source, filename);
  }

  public static String format(List<Link> links) {
    return format(links, FormatOptions.DEFAULT);
  }

  public static String format(List<Link> links, FormatOptions options) {
    return new Formatter(options).format(links);
  }
}
