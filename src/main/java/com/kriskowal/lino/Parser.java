package com.kriskowal.lino;

import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for Links Notation.
 *
 * <p>Parsing runs in three phases: the text is split into logical lines (newlines inside quotes
 * or parentheses do not end a line), each line and its indented block is parsed into raw nodes,
 * and the raw nodes are transformed into {@link Link} trees. A parser holds only its options and
 * can be used from several threads at once.
 */
public class Parser {

  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  private final ParserOptions options;
  private final SymbolTokenizer symbols;

  public Parser() {
    this(ParserOptions.DEFAULT);
  }

  public Parser(int maxInputSize, int maxDepth) {
    this(ParserOptions.builder().maxInputSize(maxInputSize).maxDepth(maxDepth).build());
  }

  public Parser(ParserOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.symbols =
        options.isTokenizeSymbols()
            ? new SymbolTokenizer(options.getPunctuationSymbols(), options.getMathSymbols())
            : null;
  }

  public ParserOptions getOptions() {
    return options;
  }

  /** Parses notation text into links. Blank input yields an empty list. */
  public List<Link> parse(String source) {
    return parse(source, null);
  }

  /** Parses notation text, naming {@code filename} in error messages. */
  public List<Link> parse(String source, String filename) {
    Objects.requireNonNull(source, "source");
    if (source.length() > options.getMaxInputSize()) {
      throw new LinoException(
          ErrorKind.INPUT_TOO_LARGE,
          "Input of "
              + source.length()
              + " characters exceeds maximum of "
              + options.getMaxInputSize(),
          filename);
    }
    if (source.isBlank()) {
      return new ArrayList<>();
    }

    String text = symbols != null ? symbols.tokenize(source) : source;
    ParseCursor cursor = new ParseCursor(text, filename, options.getMaxDepth());
    cursor.setLines(LineSegmenter.split(cursor));

    List<RawNode> nodes = new ElementParser(cursor).parseDocument();
    List<Link> links = TreeTransformer.transform(nodes);
    if (log.isDebugEnabled()) {
      log.debug(
          "Parsed {} links from {} logical lines{}",
          links.size(),
          cursor.lineCount(),
          filename != null ? " of <" + filename + ">" : "");
    }
    return links;
  }
}
