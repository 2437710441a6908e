package io.inpdeck.parser.api;

/** Categories of fatal parse failures reported through {@link DeckParseException}. */
public enum ErrorKind {
  /** A preprocessor directive is unknown, incomplete or followed by unexpected text. */
  MALFORMED_DIRECTIVE,
  /** An {@code @ENDIF} without {@code @IF}, or an {@code @IF} never closed. */
  UNBALANCED_DIRECTIVE,
  /** A variable reference names a variable that was never set and has no default. */
  UNDEFINED_VARIABLE,
  /** A {@code ${...}} reference is unterminated or carries an invalid name. */
  MALFORMED_VARIABLE,
  /** A quoted string is not closed before the end of the line. */
  UNTERMINATED_STRING,
  /** A section open or close line is syntactically invalid. */
  MALFORMED_SECTION,
  /** A section close names a different section than the one being closed. */
  SECTION_MISMATCH,
  /** A section close appears while no section is open. */
  UNEXPECTED_CLOSE,
  /** The input ended while sections were still open. */
  UNCLOSED_SECTION,
  /** An included document could not be resolved or read. */
  INCLUDE_FAILED,
  /** The input stream could not be read. */
  IO_ERROR
}
