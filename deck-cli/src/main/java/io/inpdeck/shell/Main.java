package io.inpdeck.shell;

import io.inpdeck.parser.DeckWriter;
import io.inpdeck.parser.api.BareIfPolicy;
import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.DeckParser;
import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.IncludeResolver;
import io.inpdeck.parser.api.ParserOptions;
import io.inpdeck.parser.api.SourceLine;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

@CommandLine.Command(
    name = "inpdeck",
    description = "Parse and preprocess an input deck",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  static final int EXIT_PARSE_ERROR = 1;

  @CommandLine.Spec private CommandSpec spec;

  @CommandLine.Parameters(index = "0", description = "Input deck to parse")
  private Path file;

  @CommandLine.Option(
      names = {"-D", "--define"},
      description = "Seed variable, behaves like @SET before the first line")
  private Map<String, String> defines = new LinkedHashMap<>();

  @CommandLine.Option(
      names = {"-f", "--format"},
      description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
      defaultValue = "TREE")
  private OutputFormat format;

  @CommandLine.Option(
      names = "--bare-if",
      description = "Handling of @IF without expression: ${COMPLETION-CANDIDATES}",
      defaultValue = "FAIL")
  private BareIfPolicy bareIfPolicy;

  @CommandLine.Option(names = "--no-includes", description = "Reject @INCLUDE directives")
  private boolean noIncludes;

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Log preprocessing details")
  private boolean verbose;

  public static void main(String[] args) {
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }

  static CommandLine newCommandLine() {
    return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
  }

  @Override
  public Integer call() throws Exception {
    if (verbose) {
      // must happen before the first logger is created
      System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }
    Logger log = LoggerFactory.getLogger(Main.class);
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    if (!Files.isRegularFile(file)) {
      err.println("Error: input file not found: " + file);
      return EXIT_PARSE_ERROR;
    }

    ParserOptions.Builder options = ParserOptions.builder().bareIfPolicy(bareIfPolicy);
    try {
      options.variables(defines);
    } catch (IllegalArgumentException e) {
      throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
    }
    if (!noIncludes) {
      Path base = file.toAbsolutePath().getParent();
      options.includeResolver(IncludeResolver.fromDirectory(base));
    }
    DeckParser parser = DeckParser.create(options.build());
    log.debug("Parsing {} as {} with {} seed variable(s)", file, format, defines.size());

    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      if (format == OutputFormat.PREPROCESSED) {
        for (SourceLine line : parser.preprocess(reader, file.toString())) {
          out.println(line.text());
        }
      } else {
        render(parser.parse(reader, file.toString()), out);
      }
    } catch (DeckParseException e) {
      printError(e, err);
      return EXIT_PARSE_ERROR;
    } catch (IOException e) {
      err.println("Error: cannot read " + file + ": " + e.getMessage());
      return EXIT_PARSE_ERROR;
    }
    out.flush();
    return 0;
  }

  private void render(Document document, PrintWriter out) throws IOException {
    switch (format) {
      case TREE -> TreeRenderer.render(document, out);
      case JSON -> out.println(new JsonTreeMapper().render(document));
      case CANONICAL -> new DeckWriter().write(document, out);
      default -> throw new IllegalStateException("Unhandled format: " + format);
    }
  }

  static void printError(DeckParseException e, PrintWriter err) {
    StringBuilder sb = new StringBuilder("Error [").append(e.getKind()).append("]");
    if (e.getLineNumber() > 0) {
      sb.append(" at ");
      if (e.getSource() != null) {
        sb.append(e.getSource()).append(':');
      }
      sb.append(e.getLineNumber());
    }
    sb.append(": ").append(e.getDescription());
    err.println(sb);
    if (e.getLine() != null) {
      err.println("  " + e.getLine().trim());
    }
    err.flush();
  }
}
