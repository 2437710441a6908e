package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.ErrorKind;
import io.inpdeck.parser.api.SourceLine;
import io.inpdeck.utils.Names;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits preprocessed lines into tokens and classifies them.
 *
 * <p>Tokens are separated by whitespace. {@code '...'} and {@code "..."} delimit quoted regions
 * whose content is taken verbatim: whitespace does not split, the other quote character is plain
 * text and there are no escape sequences. A quoted region touching bare text belongs to the same
 * token, so {@code a"b c"} is the single token {@code ab c}. {@code ""} is an empty token.
 */
public final class Tokenizer {
  private static final String END = "END";

  /**
   * Classifies one line.
   *
   * <ul>
   *   <li>{@code &END [name]}: section close
   *   <li>{@code &name [parameter...]}: section open
   *   <li>{@code name [value...]}: keyword
   * </ul>
   *
   * @param line a non-blank preprocessed line
   * @return the tokenized line
   * @throws DeckParseException on unterminated quotes or malformed section lines
   * @throws IllegalArgumentException if the line holds no token
   */
  public TokenLine tokenize(SourceLine line) throws DeckParseException {
    List<String> tokens = split(line.text(), line);
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("Blank line " + line.source() + ":" + line.lineNumber());
    }
    String first = tokens.get(0);
    List<String> rest = tokens.subList(1, tokens.size());
    if (line.text().charAt(0) != '&') {
      return new TokenLine(TokenLine.Type.KEYWORD, first, rest, line);
    }
    String name = first.substring(1);
    if (name.isEmpty()) {
      throw line.error(ErrorKind.MALFORMED_SECTION, "Section name missing after '&'");
    }
    if (!END.equals(Names.key(name))) {
      return new TokenLine(TokenLine.Type.SECTION_OPEN, name, rest, line);
    }
    if (rest.size() > 1) {
      throw line.error(
          ErrorKind.MALFORMED_SECTION,
          "Unexpected text after &" + name + " " + rest.get(0) + ": " + rest.get(1));
    }
    return new TokenLine(
        TokenLine.Type.SECTION_CLOSE, rest.isEmpty() ? null : rest.get(0), List.of(), line);
  }

  /**
   * Splits text into tokens.
   *
   * @param text the text to split
   * @param line the line the text belongs to, for error reporting
   * @return the tokens, quotes removed
   * @throws DeckParseException if a quoted region is not closed
   */
  public static List<String> split(String text, SourceLine line) throws DeckParseException {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == '\'' || c == '"') {
        int close = text.indexOf(c, i + 1);
        if (close < 0) {
          throw line.error(
              ErrorKind.UNTERMINATED_STRING,
              "Unterminated " + (c == '"' ? "double" : "single") + "-quoted string at column "
                  + (i + 1));
        }
        current.append(text, i + 1, close);
        inToken = true;
        i = close + 1;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
        i++;
      } else {
        current.append(c);
        inToken = true;
        i++;
      }
    }
    if (inToken) {
      tokens.add(current.toString());
    }
    return tokens;
  }
}
