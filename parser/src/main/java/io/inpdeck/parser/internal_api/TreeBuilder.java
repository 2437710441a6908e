package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.ErrorKind;
import io.inpdeck.parser.api.Keyword;
import io.inpdeck.parser.api.Node;
import io.inpdeck.parser.api.Section;
import io.inpdeck.parser.api.SourceLine;
import io.inpdeck.utils.Names;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the document tree from tokenized lines. Open sections are kept on a stack; nodes are only
 * ever appended to the innermost open section, or to the root when none is open.
 */
public final class TreeBuilder {

  public enum State {
    AT_ROOT,
    IN_SECTION
  }

  private static final class OpenSection {
    final TokenLine opening;
    final List<Node> children = new ArrayList<>();

    OpenSection(TokenLine opening) {
      this.opening = opening;
    }
  }

  private final List<Node> root = new ArrayList<>();
  private final Deque<OpenSection> open = new ArrayDeque<>();

  public State state() {
    return open.isEmpty() ? State.AT_ROOT : State.IN_SECTION;
  }

  /** Names of the currently open sections, outermost first. */
  public List<String> openSections() {
    List<String> names = new ArrayList<>(open.size());
    for (Iterator<OpenSection> it = open.descendingIterator(); it.hasNext(); ) {
      names.add(it.next().opening.name());
    }
    return names;
  }

  /**
   * Applies one tokenized line.
   *
   * @param token the line
   * @throws DeckParseException on a mismatched or unexpected section close
   */
  public void accept(TokenLine token) throws DeckParseException {
    SourceLine line = token.line();
    switch (token.type()) {
      case SECTION_OPEN -> open.push(new OpenSection(token));
      case SECTION_CLOSE -> close(token);
      case KEYWORD -> current().add(
          new Keyword(token.name(), token.values(), line.source(), line.lineNumber()));
    }
  }

  /**
   * Completes the tree.
   *
   * @param source name of the top-level document
   * @return the document
   * @throws DeckParseException if sections are still open
   */
  public Document finish(String source) throws DeckParseException {
    if (!open.isEmpty()) {
      StringJoiner names = new StringJoiner(" > ");
      openSections().forEach(names::add);
      throw open.peek()
          .opening
          .line()
          .error(ErrorKind.UNCLOSED_SECTION, "Unclosed section(s) at end of input: " + names);
    }
    return new Document(source, root);
  }

  private void close(TokenLine token) throws DeckParseException {
    SourceLine line = token.line();
    if (open.isEmpty()) {
      throw line.error(ErrorKind.UNEXPECTED_CLOSE, "Section close without open section");
    }
    TokenLine opening = open.peek().opening;
    if (token.name() != null && !Names.sameName(token.name(), opening.name())) {
      throw line.error(
          ErrorKind.SECTION_MISMATCH,
          "&END "
              + token.name()
              + " does not match open section &"
              + opening.name()
              + " (line "
              + opening.line().lineNumber()
              + ")");
    }
    OpenSection closed = open.pop();
    SourceLine at = opening.line();
    current()
        .add(
            new Section(
                opening.name(), opening.values(), closed.children, at.source(), at.lineNumber()));
  }

  private List<Node> current() {
    return open.isEmpty() ? root : open.peek().children;
  }
}
