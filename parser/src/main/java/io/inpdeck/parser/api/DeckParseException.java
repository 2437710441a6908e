package io.inpdeck.parser.api;

/**
 * Base exception for all input-deck parsing errors. Carries the error kind and the position of the
 * offending line so the fault can be located without re-reading the whole document.
 */
public class DeckParseException extends Exception {
  private final ErrorKind kind;
  private final String description;
  private final String source;
  private final int lineNumber;
  private final String line;

  public DeckParseException(
      ErrorKind kind, String message, String source, int lineNumber, String line) {
    this(kind, message, null, source, lineNumber, line);
  }

  public DeckParseException(
      ErrorKind kind,
      String message,
      Throwable cause,
      String source,
      int lineNumber,
      String line) {
    super(formatMessage(kind, message, source, lineNumber, line), cause);
    this.kind = kind;
    this.description = message;
    this.source = source;
    this.lineNumber = lineNumber;
    this.line = line;
  }

  private static String formatMessage(
      ErrorKind kind, String message, String source, int lineNumber, String line) {
    StringBuilder sb = new StringBuilder(message);
    if (lineNumber > 0) {
      sb.append(" [Context: ");
      if (source != null) {
        sb.append(source).append(':');
      }
      sb.append(lineNumber);
      if (line != null) {
        sb.append(": ").append(line);
      }
      sb.append("]");
    }
    sb.append(" [Error Code: ").append(kind).append("]");
    return sb.toString();
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** The human readable description without position details. */
  public String getDescription() {
    return description;
  }

  /** Name of the document the offending line belongs to, may be {@code null}. */
  public String getSource() {
    return source;
  }

  /** 1-based line number, or {@code 0} when the error is not tied to a line. */
  public int getLineNumber() {
    return lineNumber;
  }

  /** Text of the offending line as read from the input, may be {@code null}. */
  public String getLine() {
    return line;
  }
}
