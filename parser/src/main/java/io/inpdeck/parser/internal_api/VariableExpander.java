package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.ErrorKind;
import io.inpdeck.parser.api.SourceLine;
import io.inpdeck.utils.Names;

/**
 * Substitutes variable references with values from a {@link VariableTable}. Supported forms:
 *
 * <ul>
 *   <li>${name} - value of {@code name}
 *   <li>${name-default} - value of {@code name}, or {@code default} when it is not set
 *   <li>$name - value of {@code name}, the name being the longest run of identifier characters
 * </ul>
 *
 * <p>Substitution is a single left-to-right pass; substituted text is never rescanned. A {@code $}
 * that starts neither form is copied as is.
 */
public final class VariableExpander {
  private final VariableTable variables;

  public VariableExpander(VariableTable variables) {
    this.variables = variables;
  }

  /**
   * Expands all references in {@code text}.
   *
   * @param text the text to expand
   * @param line the line the text belongs to, for error reporting
   * @return the expanded text
   * @throws DeckParseException if a reference is malformed or names an undefined variable
   */
  public String expand(String text, SourceLine line) throws DeckParseException {
    if (text.indexOf('$') < 0) {
      return text;
    }
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == '$' && i + 1 < n) {
        char next = text.charAt(i + 1);
        if (next == '{') {
          int close = text.indexOf('}', i + 2);
          if (close < 0) {
            throw line.error(
                ErrorKind.MALFORMED_VARIABLE,
                "Unterminated variable reference starting at column " + (i + 1));
          }
          String body = text.substring(i + 2, close);
          int dash = body.indexOf('-');
          String name = dash < 0 ? body : body.substring(0, dash);
          String fallback = dash < 0 ? null : body.substring(dash + 1);
          if (!Names.isIdentifier(name)) {
            throw line.error(
                ErrorKind.MALFORMED_VARIABLE, "Invalid variable name '" + name + "'");
          }
          out.append(lookup(name, fallback, line));
          i = close + 1;
          continue;
        }
        if (Names.isIdentifierStart(next)) {
          int end = i + 2;
          while (end < n && Names.isIdentifierPart(text.charAt(end))) {
            end++;
          }
          out.append(lookup(text.substring(i + 1, end), null, line));
          i = end;
          continue;
        }
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  private String lookup(String name, String fallback, SourceLine line) throws DeckParseException {
    String value = variables.get(name);
    if (value != null) {
      return value;
    }
    if (fallback != null) {
      return fallback;
    }
    throw line.error(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable: " + name);
  }
}
