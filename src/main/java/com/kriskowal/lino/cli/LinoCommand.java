package com.kriskowal.lino.cli;

import com.kriskowal.lino.FormatOptions;
import com.kriskowal.lino.Formatter;
import com.kriskowal.lino.Link;
import com.kriskowal.lino.LinoException;
import com.kriskowal.lino.Parser;
import com.kriskowal.lino.ParserOptions;
import com.kriskowal.lino.SymbolTokenizer;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Command line front end: reformat or validate Links Notation files. */
@Command(
    name = "lino",
    mixinStandardHelpOptions = true,
    version = "lino 0.1",
    description = {"Links Notation formatter and checker.%n"},
    subcommands = {HelpCommand.class, FormatCmd.class, CheckCmd.class})
public class LinoCommand {

  static final int ERR_PARSE = 1;
  static final int ERR_USER = 2;
  static final int ERR_IO = 3;

  static final String STDIN = "-";

  public static void main(String[] args) {
    int exitCode = new CommandLine(new LinoCommand()).execute(args);
    System.exit(exitCode);
  }
}

/** Input files and parser limits shared by the subcommands. */
class InputOptions {

  @Parameters(
      paramLabel = "FILE",
      arity = "0..*",
      description = "Files to read; \"-\" or none reads standard input")
  List<String> files = List.of();

  @Option(
      names = "--max-depth",
      paramLabel = "N",
      description = "Maximum nesting depth (default: ${DEFAULT-VALUE})")
  int maxDepth = ParserOptions.DEFAULT_MAX_DEPTH;

  @Option(
      names = "--max-input-size",
      paramLabel = "CHARS",
      description = "Maximum input size in characters (default: ${DEFAULT-VALUE})")
  int maxInputSize = ParserOptions.DEFAULT_MAX_INPUT_SIZE;

  @Option(
      names = "--symbols",
      description = "Split punctuation and math symbols into separate references")
  boolean symbols;

  Parser parser() {
    return new Parser(
        ParserOptions.builder()
            .maxDepth(maxDepth)
            .maxInputSize(maxInputSize)
            .tokenizeSymbols(symbols)
            .build());
  }

  List<String> sources() {
    return files.isEmpty() ? List.of(LinoCommand.STDIN) : files;
  }

  static String read(String name) throws IOException {
    if (LinoCommand.STDIN.equals(name)) {
      return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }
    return Files.readString(Path.of(name), StandardCharsets.UTF_8);
  }
}

/** Shared run loop: parse every input, hand the links to {@link #emit}, map failures to codes. */
abstract class InputCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(InputCommand.class);

  @Spec CommandSpec spec;

  @Mixin InputOptions input;

  @Override
  public Integer call() {
    Parser parser;
    try {
      parser = input.parser();
    } catch (IllegalArgumentException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return LinoCommand.ERR_USER;
    }

    PrintWriter out = spec.commandLine().getOut();
    int status = 0;
    for (String name : input.sources()) {
      String label = LinoCommand.STDIN.equals(name) ? "<stdin>" : name;
      try {
        List<Link> links = parser.parse(InputOptions.read(name), label);
        emit(label, links, out);
      } catch (LinoException e) {
        log.warn("Rejected {}: {}", label, e.getMessage());
        spec.commandLine().getErr().println(e.getMessage());
        status = Math.max(status, LinoCommand.ERR_PARSE);
      } catch (IOException e) {
        log.error("Cannot read {}", label, e);
        spec.commandLine().getErr().println("Cannot read " + label + ": " + e.getMessage());
        status = LinoCommand.ERR_IO;
      }
    }
    out.flush();
    return status;
  }

  abstract void emit(String label, List<Link> links, PrintWriter out);
}

@Command(name = "format", description = "Print inputs in canonical notation")
class FormatCmd extends InputCommand {

  @Option(names = "--less-parentheses", description = "Omit parentheses where unambiguous")
  boolean lessParentheses;

  @Option(
      names = "--max-line-length",
      paramLabel = "N",
      description = "Line length used with --indent-long-lines (default: ${DEFAULT-VALUE})")
  int maxLineLength = 80;

  @Option(names = "--indent-long-lines", description = "Indent links longer than the line limit")
  boolean indentLongLines;

  @Option(
      names = "--max-inline-refs",
      paramLabel = "N",
      description = "Indent links with more values than this")
  Integer maxInlineRefs;

  @Option(names = "--group", description = "Merge consecutive links with the same id")
  boolean groupConsecutive;

  @Option(
      names = "--indent",
      paramLabel = "N",
      description = "Spaces per indentation level (default: ${DEFAULT-VALUE})")
  int indent = 2;

  @Option(
      names = "--prefer-inline",
      negatable = true,
      defaultValue = "true",
      fallbackValue = "true",
      description = "Keep links inline even past the thresholds (default: ${DEFAULT-VALUE})")
  boolean preferInline;

  private FormatOptions formatOptions;

  @Override
  public Integer call() {
    try {
      formatOptions =
          FormatOptions.builder()
              .lessParentheses(lessParentheses)
              .maxLineLength(maxLineLength)
              .indentLongLines(indentLongLines)
              .maxInlineRefs(maxInlineRefs)
              .groupConsecutive(groupConsecutive)
              .indentString(" ".repeat(Math.max(indent, 0)))
              .preferInline(preferInline)
              .build();
    } catch (IllegalArgumentException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return LinoCommand.ERR_USER;
    }
    return super.call();
  }

  @Override
  void emit(String label, List<Link> links, PrintWriter out) {
    String text = new Formatter(formatOptions).format(links);
    if (input.symbols) {
      text = new SymbolTokenizer().compact(text);
    }
    if (!text.isEmpty()) {
      out.println(text);
    }
  }
}

@Command(name = "check", description = "Validate inputs and report link counts")
class CheckCmd extends InputCommand {

  @Override
  void emit(String label, List<Link> links, PrintWriter out) {
    out.println(label + ": " + links.size() + (links.size() == 1 ? " link" : " links"));
  }
}
