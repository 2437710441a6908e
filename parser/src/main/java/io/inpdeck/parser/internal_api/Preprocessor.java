package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.BareIfPolicy;
import io.inpdeck.parser.api.DeckIOException;
import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.ErrorKind;
import io.inpdeck.parser.api.IncludeResolver;
import io.inpdeck.parser.api.ParserOptions;
import io.inpdeck.parser.api.SourceLine;
import io.inpdeck.utils.Names;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text-to-text stage resolving preprocessor directives.
 *
 * <p>Lines are normalized first, then:
 *
 * <ul>
 *   <li>{@code @SET name value} stores {@code value} (expanded) in the variable table
 *   <li>{@code @IF expr} / {@code @ENDIF} open and close possibly nested conditional blocks
 *   <li>{@code @INCLUDE file} splices another document in place
 *   <li>every other line inside active blocks is emitted with its variable references expanded
 * </ul>
 *
 * <p>Directive lines are never emitted. {@code @SET} and {@code @INCLUDE} inside inactive blocks
 * are consumed without effect, {@code @IF}/{@code @ENDIF} are always tracked so nesting stays
 * balanced. Instances are single use.
 */
public final class Preprocessor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

  private final ParserOptions options;
  private final LineNormalizer normalizer;
  private final VariableTable variables;
  private final VariableExpander expander;
  private final ConditionalState conditions = new ConditionalState();
  private final ConditionEvaluator evaluator = new ConditionEvaluator();
  private final Deque<LineCursor> cursors = new ArrayDeque<>();

  /**
   * Creates a preprocessor over the given document.
   *
   * @param reader the top-level document; not closed by the preprocessor
   * @param source display name of the document
   * @param options parser options
   * @param variables the variable table, typically seeded from {@link ParserOptions#variables()}
   */
  public Preprocessor(
      Reader reader, String source, ParserOptions options, VariableTable variables) {
    this.options = options;
    this.normalizer = new LineNormalizer(options.commentChars());
    this.variables = variables;
    this.expander = new VariableExpander(variables);
    this.cursors.push(new LineCursor(reader, source, false, null));
  }

  /**
   * Returns the next emitted line.
   *
   * @return the expanded, directive-free, non-blank line, or null at end of input
   * @throws DeckParseException on any preprocessing error
   */
  public SourceLine next() throws DeckParseException {
    while (!cursors.isEmpty()) {
      SourceLine line = cursors.peek().next();
      if (line == null) {
        closeCursor(cursors.pop());
        continue;
      }
      String text = normalizer.normalize(line.raw());
      if (text.isEmpty()) {
        continue;
      }
      line = line.withText(text);
      if (text.charAt(0) == '@') {
        directive(line);
        continue;
      }
      if (!conditions.isActive()) {
        continue;
      }
      String expanded = expander.expand(text, line).strip();
      if (!expanded.isEmpty()) {
        return line.withText(expanded);
      }
    }
    if (conditions.inConditional()) {
      SourceLine open = conditions.innermost().opening();
      throw open.error(ErrorKind.UNBALANCED_DIRECTIVE, "@IF without matching @ENDIF");
    }
    return null;
  }

  /** Drains the remaining lines. */
  public List<SourceLine> readAll() throws DeckParseException {
    List<SourceLine> lines = new ArrayList<>();
    SourceLine line;
    while ((line = next()) != null) {
      lines.add(line);
    }
    return lines;
  }

  public VariableTable variables() {
    return variables;
  }

  /** Closes included documents still open after a failure. */
  @Override
  public void close() {
    while (!cursors.isEmpty()) {
      closeCursor(cursors.pop());
    }
  }

  private void directive(SourceLine line) throws DeckParseException {
    String text = line.text();
    int ws = indexOfWhitespace(text);
    String name = ws < 0 ? text.substring(1) : text.substring(1, ws);
    String args = ws < 0 ? "" : text.substring(ws).strip();

    switch (Names.key(name)) {
      case "SET" -> set(line, args);
      case "IF" -> enterIf(line, args);
      case "ENDIF" -> exitIf(line, args);
      case "INCLUDE" -> include(line, args);
      default -> throw line.error(
          ErrorKind.MALFORMED_DIRECTIVE, "Unknown preprocessor directive: @" + name);
    }
  }

  private void set(SourceLine line, String args) throws DeckParseException {
    if (!conditions.isActive()) {
      return;
    }
    int ws = indexOfWhitespace(args);
    if (args.isEmpty() || ws < 0) {
      throw line.error(
          ErrorKind.MALFORMED_DIRECTIVE, "@SET requires a variable name and a value");
    }
    String name = args.substring(0, ws);
    if (!Names.isIdentifier(name)) {
      throw line.error(ErrorKind.MALFORMED_DIRECTIVE, "Invalid variable name '" + name + "'");
    }
    String value = expander.expand(args.substring(ws).strip(), line);
    variables.set(name, value);
    log.debug("{}:{}: set {} = '{}'", line.source(), line.lineNumber(), name, value);
  }

  private void enterIf(SourceLine line, String expr) throws DeckParseException {
    if (!conditions.isActive()) {
      // nested in a suppressed block: tracked for balance only, never evaluated
      conditions.enterIf(false, line);
      return;
    }
    if (expr.isEmpty()) {
      if (options.bareIfPolicy() == BareIfPolicy.FAIL) {
        throw line.error(ErrorKind.MALFORMED_DIRECTIVE, "@IF requires an expression");
      }
      log.debug("{}:{}: bare @IF treated as false", line.source(), line.lineNumber());
      conditions.enterIf(false, line);
      return;
    }
    conditions.enterIf(evaluator.evaluate(expander.expand(expr, line)), line);
  }

  private void exitIf(SourceLine line, String args) throws DeckParseException {
    if (!args.isEmpty()) {
      throw line.error(ErrorKind.MALFORMED_DIRECTIVE, "Unexpected text after @ENDIF: " + args);
    }
    if (!conditions.inConditional()) {
      throw line.error(ErrorKind.UNBALANCED_DIRECTIVE, "@ENDIF without matching @IF");
    }
    conditions.exitIf();
  }

  private void include(SourceLine line, String args) throws DeckParseException {
    if (!conditions.isActive()) {
      return;
    }
    List<String> tokens = Tokenizer.split(expander.expand(args, line), line);
    if (tokens.size() != 1 || tokens.get(0).isEmpty()) {
      throw line.error(ErrorKind.MALFORMED_DIRECTIVE, "@INCLUDE requires exactly one file name");
    }
    String target = tokens.get(0);
    if (cursors.size() > options.maxIncludeDepth()) {
      throw DeckIOException.includeError(
          target,
          line.source(),
          line.lineNumber(),
          line.raw(),
          new IOException("include depth exceeds " + options.maxIncludeDepth()));
    }
    IncludeResolver resolver = options.includeResolver();
    Reader reader;
    try {
      reader = resolver.open(target, line.source());
    } catch (IOException e) {
      throw DeckIOException.includeError(
          target, line.source(), line.lineNumber(), line.raw(), e);
    }
    String source = resolver.describe(target);
    log.debug("{}:{}: including {}", line.source(), line.lineNumber(), source);
    cursors.push(new LineCursor(reader, source, true, line));
  }

  private void closeCursor(LineCursor cursor) {
    try {
      cursor.close();
    } catch (IOException e) {
      log.warn("Failed to close {}", cursor.source(), e);
    }
  }

  private static int indexOfWhitespace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
