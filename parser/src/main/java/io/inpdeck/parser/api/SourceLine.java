package io.inpdeck.parser.api;

/**
 * One line travelling through the pipeline.
 *
 * @param source name of the document the line was read from
 * @param lineNumber 1-based line number within {@code source}
 * @param raw the line exactly as read, used for error reporting
 * @param text the line as transformed by the stages so far
 */
public record SourceLine(String source, int lineNumber, String raw, String text) {

  public SourceLine withText(String newText) {
    return new SourceLine(source, lineNumber, raw, newText);
  }

  /** Creates a parse exception pointing at this line. */
  public DeckParseException error(ErrorKind kind, String message) {
    return new DeckParseException(kind, message, source, lineNumber, raw);
  }
}
