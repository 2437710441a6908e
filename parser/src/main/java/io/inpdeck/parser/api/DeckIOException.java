package io.inpdeck.parser.api;

import java.io.IOException;

/** Exception thrown when the input or an included document cannot be read. */
public class DeckIOException extends DeckParseException {

  /**
   * Constructs a new DeckIOException.
   *
   * @param kind either {@link ErrorKind#IO_ERROR} or {@link ErrorKind#INCLUDE_FAILED}
   * @param message the detail message
   * @param cause the underlying failure, may be null
   * @param source the document being read
   * @param lineNumber the line that triggered the read, or 0
   * @param line the text of that line, may be null
   */
  public DeckIOException(
      ErrorKind kind,
      String message,
      Throwable cause,
      String source,
      int lineNumber,
      String line) {
    super(kind, message, cause, source, lineNumber, line);
  }

  /**
   * Creates a DeckIOException for a failure reading the top-level stream.
   *
   * @param source the name of the stream
   * @param lineNumber the last line successfully read
   * @param cause the underlying IOException
   * @return a new DeckIOException instance
   */
  public static DeckIOException readError(String source, int lineNumber, IOException cause) {
    return new DeckIOException(
        ErrorKind.IO_ERROR,
        "Failed to read input: " + cause.getMessage(),
        cause,
        source,
        lineNumber,
        null);
  }

  /**
   * Creates a DeckIOException for an {@code @INCLUDE} that could not be opened or read.
   *
   * @param target the requested include name
   * @param source the document containing the directive
   * @param lineNumber the line of the directive
   * @param line the text of the directive
   * @param cause the underlying failure, may be null
   * @return a new DeckIOException instance
   */
  public static DeckIOException includeError(
      String target, String source, int lineNumber, String line, Throwable cause) {
    String reason = cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
    return new DeckIOException(
        ErrorKind.INCLUDE_FAILED,
        "Failed to include '" + target + "'" + reason,
        cause,
        source,
        lineNumber,
        line);
  }
}
