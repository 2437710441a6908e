package io.inpdeck.parser.api;

import io.inpdeck.parser.impl.DeckParserImpl;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

/**
 * Parses input decks into {@link Document} trees.
 *
 * <p>A parser holds only its immutable {@link ParserOptions}; every call to {@code parse} uses its
 * own variable table, conditional stack and tree, so one instance may serve concurrent parses.
 *
 * <pre>{@code
 * DeckParser parser =
 *     DeckParser.create(ParserOptions.builder().variable("LATTICE", "2.8595").build());
 * Document doc = parser.parse(reader, "input.inp");
 * doc.find("FORCE_EVAL/SUBSYS/CELL").flatMap(c -> c.keyword("A")).ifPresent(System.out::println);
 * }</pre>
 */
public interface DeckParser {
  String DEFAULT_SOURCE = "<input>";

  static DeckParser create() {
    return new DeckParserImpl(ParserOptions.defaults());
  }

  static DeckParser create(ParserOptions options) {
    return new DeckParserImpl(options);
  }

  ParserOptions options();

  /**
   * Parses a document.
   *
   * @param reader the document text; not closed by the parser
   * @param source display name used in node positions and errors
   * @return the parsed document
   * @throws DeckParseException on the first structural or preprocessing fault
   */
  Document parse(Reader reader, String source) throws DeckParseException;

  default Document parse(String text) throws DeckParseException {
    return parse(new StringReader(text), DEFAULT_SOURCE);
  }

  /**
   * Runs only the preprocessing stage.
   *
   * @param reader the document text; not closed by the parser
   * @param source display name used in lines and errors
   * @return the emitted lines: comments stripped, directives resolved, variables expanded
   * @throws DeckParseException on the first preprocessing fault
   */
  List<SourceLine> preprocess(Reader reader, String source) throws DeckParseException;
}
