package io.inpdeck.parser;

import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.Keyword;
import io.inpdeck.parser.api.NodeVisitor;
import io.inpdeck.parser.api.ParserOptions;
import io.inpdeck.parser.api.Section;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;

/**
 * Writes a {@link Document} back as canonical deck text: two spaces of indentation per level, one
 * node per line, every section closed with its name. Formatting and comments of the original input
 * are not preserved, but parsing the output yields an equal document.
 *
 * <p>Tokens are quoted when they would otherwise not read back as one token: empty tokens, tokens
 * with whitespace, quotes or comment characters, and names starting with {@code &} or {@code @}.
 *
 * <p>Variable references are expanded on every line, quoted or not, so a literal {@code $} is
 * written as a reference to {@link #DOLLAR_VARIABLE}. When the document holds any {@code $}, the
 * output starts with {@code @SET _DOLLAR_ $}, which binds the variable to a lone {@code $}.
 */
public final class DeckWriter {
  /** Variable holding a literal {@code $} in written documents. */
  public static final String DOLLAR_VARIABLE = "_DOLLAR_";

  private static final String INDENT = "  ";
  private static final String DOLLAR_REFERENCE = "${" + DOLLAR_VARIABLE + "}";

  private final Set<Character> commentChars;

  public DeckWriter() {
    this(ParserOptions.defaults());
  }

  /**
   * @param options the options the output will be parsed with; their comment characters are
   *     quoted
   */
  public DeckWriter(ParserOptions options) {
    this.commentChars = options.commentChars();
  }

  public String write(Document document) {
    StringBuilder sb = new StringBuilder();
    write(document, sb);
    return sb.toString();
  }

  public void write(Document document, Appendable out) {
    StringBuilder sb = new StringBuilder();
    boolean[] dollar = new boolean[1];
    document.accept(
        new NodeVisitor() {
          int depth = 0;

          @Override
          public boolean enterSection(Section section) {
            dollar[0] |= hasDollar(section.name()) || hasDollar(section.parameters());
            indent(sb, depth).append('&').append(quote(section.name(), false));
            appendTokens(sb, section.parameters());
            sb.append('\n');
            depth++;
            return true;
          }

          @Override
          public void exitSection(Section section) {
            depth--;
            indent(sb, depth).append("&END ").append(quote(section.name(), false)).append('\n');
          }

          @Override
          public void visitKeyword(Keyword keyword) {
            dollar[0] |= hasDollar(keyword.name()) || hasDollar(keyword.values());
            indent(sb, depth).append(quote(keyword.name(), true));
            appendTokens(sb, keyword.values());
            sb.append('\n');
          }
        });
    try {
      if (dollar[0]) {
        out.append("@SET ").append(DOLLAR_VARIABLE).append(" $\n");
      }
      out.append(sb);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void appendTokens(StringBuilder sb, List<String> tokens) {
    for (String token : tokens) {
      sb.append(' ').append(quote(token, false));
    }
  }

  /**
   * Quotes a token if needed.
   *
   * @param token the token
   * @param leading whether the token starts the line, where {@code &} and {@code @} are special
   * @return the token as it must be written
   */
  String quote(String token, boolean leading) {
    if (!needsQuoting(token, leading)) {
      return token;
    }
    return quoteRegions(token).replace("$", DOLLAR_REFERENCE);
  }

  private static String quoteRegions(String token) {
    if (token.indexOf('"') < 0) {
      return '"' + token + '"';
    }
    if (token.indexOf('\'') < 0) {
      return '\'' + token + '\'';
    }
    // both quote characters: adjacent segments, each wrapped in the quote it does not contain
    StringBuilder sb = new StringBuilder();
    int start = 0;
    while (start < token.length()) {
      char wrap = token.charAt(start) == '"' ? '\'' : '"';
      int end = token.indexOf(wrap, start);
      if (end < 0) {
        end = token.length();
      }
      sb.append(wrap).append(token, start, end).append(wrap);
      start = end;
    }
    return sb.toString();
  }

  private boolean needsQuoting(String token, boolean leading) {
    if (token.isEmpty()) {
      return true;
    }
    char first = token.charAt(0);
    if (leading && (first == '&' || first == '@')) {
      return true;
    }
    for (int i = 0; i < token.length(); i++) {
      char c = token.charAt(i);
      if (Character.isWhitespace(c)
          || c == '"'
          || c == '\''
          || c == '$'
          || commentChars.contains(c)) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasDollar(String token) {
    return token.indexOf('$') >= 0;
  }

  private static boolean hasDollar(List<String> tokens) {
    return tokens.stream().anyMatch(DeckWriter::hasDollar);
  }

  private static StringBuilder indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    return sb;
  }
}
