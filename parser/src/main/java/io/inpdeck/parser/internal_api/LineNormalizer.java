package io.inpdeck.parser.internal_api;

import java.util.Set;

/**
 * Strips trailing comments and surrounding whitespace from raw input lines. A comment introducer
 * inside a single or double quoted region does not start a comment. Whitespace is the set accepted
 * by {@link Character#isWhitespace(char)}, the same set the tokenizer splits on.
 */
public final class LineNormalizer {
  private final Set<Character> commentChars;

  public LineNormalizer(Set<Character> commentChars) {
    this.commentChars = Set.copyOf(commentChars);
  }

  /**
   * Normalizes one line.
   *
   * @param raw the line as read
   * @return the line without comment, trimmed; empty for blank and comment-only lines
   */
  public String normalize(String raw) {
    char quote = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (commentChars.contains(c)) {
        return raw.substring(0, i).strip();
      }
    }
    return raw.strip();
  }
}
