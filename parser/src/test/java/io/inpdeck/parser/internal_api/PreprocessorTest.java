package io.inpdeck.parser.internal_api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.inpdeck.parser.api.BareIfPolicy;
import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.ErrorKind;
import io.inpdeck.parser.api.ParserOptions;
import io.inpdeck.parser.api.SourceLine;
import java.io.StringReader;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class PreprocessorTest {

  private static List<SourceLine> lines(String text, ParserOptions options)
      throws DeckParseException {
    try (Preprocessor p =
        new Preprocessor(
            new StringReader(text), "deck.inp", options, new VariableTable(options.variables()))) {
      return p.readAll();
    }
  }

  private static List<String> texts(String text) throws DeckParseException {
    return texts(text, ParserOptions.defaults());
  }

  private static List<String> texts(String text, ParserOptions options)
      throws DeckParseException {
    return lines(text, options).stream().map(SourceLine::text).collect(Collectors.toList());
  }

  private static DeckParseException failure(String text) {
    return assertThrows(DeckParseException.class, () -> texts(text));
  }

  @Test
  void dropsCommentsBlankLinesAndDirectives() throws Exception {
    String deck = """
        # header
        @SET X 5

        A ${X}  ! five
        """;
    assertEquals(List.of("A 5"), texts(deck));
  }

  @Test
  void keepsOriginalLineNumbers() throws Exception {
    List<SourceLine> out = lines("! c\n\nA 1\n@SET Y 2\nB $Y\n", ParserOptions.defaults());
    assertEquals(3, out.get(0).lineNumber());
    assertEquals(5, out.get(1).lineNumber());
    assertEquals("B $Y", out.get(1).raw());
    assertEquals("deck.inp", out.get(1).source());
  }

  @Test
  void setIsNotRetroactive() throws Exception {
    String deck = """
        @SET X 5
        A ${X}
        @SET X 7
        B ${X}
        """;
    assertEquals(List.of("A 5", "B 7"), texts(deck));
  }

  @Test
  void setValueKeepsInnerSpacesAndExpandsReferences() throws Exception {
    String deck = """
        @SET BASE 2.0
        @set CELL ${BASE}   ${BASE} 0   # comment
        A ${cell}
        """;
    assertEquals(List.of("A 2.0   2.0 0"), texts(deck));
  }

  @Test
  void seedVariablesBehaveLikeLeadingSet() throws Exception {
    ParserOptions options = ParserOptions.builder().variable("cutoff", "400").build();
    assertEquals(List.of("CUTOFF 400"), texts("CUTOFF ${CUTOFF}\n", options));
  }

  @Test
  void ifZeroSuppressesIfOneIncludes() throws Exception {
    String deck = """
        @IF 0
        HIDDEN 1
        @ENDIF
        @IF 1
        SHOWN 1
        @ENDIF
        """;
    assertEquals(List.of("SHOWN 1"), texts(deck));
  }

  @Test
  void ifExpandsVariablesFirst() throws Exception {
    String deck = """
        @SET DEBUG 0
        @SET NAME PBE
        @IF ${DEBUG}
        A 1
        @ENDIF
        @IF ${NAME} == PBE
        B 1
        @ENDIF
        @IF $NAME /= PBE
        C 1
        @ENDIF
        """;
    assertEquals(List.of("B 1"), texts(deck));
  }

  @Test
  void nestedIfRequiresAllFramesTrue() throws Exception {
    String deck = """
        @IF 1
        A 1
        @IF 0
        B 1
        @IF 1
        C 1
        @ENDIF
        @ENDIF
        D 1
        @ENDIF
        """;
    assertEquals(List.of("A 1", "D 1"), texts(deck));
  }

  @Test
  void suppressedRegionsDoNotEvaluateOrSet() throws Exception {
    String deck = """
        @SET X 1
        @IF 0
        @SET X 2
        @IF ${UNDEFINED}
        @ENDIF
        A ${ALSO_UNDEFINED}
        @ENDIF
        B ${X}
        """;
    assertEquals(List.of("B 1"), texts(deck));
  }

  @Test
  void directivesAreCaseInsensitive() throws Exception {
    assertEquals(List.of("A 1"), texts("@Set v 1\n@if $V\nA $v\n@EndIf\n"));
  }

  @Test
  void bareIfFailsByDefault() {
    DeckParseException e = failure("A 1\n@IF\nB 1\n@ENDIF\n");
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void bareIfCanBeTreatedAsFalse() throws Exception {
    ParserOptions options = ParserOptions.builder().bareIfPolicy(BareIfPolicy.FALSE).build();
    assertEquals(List.of("A 1", "C 1"), texts("A 1\n@IF\nB 1\n@ENDIF\nC 1\n", options));
  }

  @Test
  void ifWithCommentOnlyIsBare() {
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, failure("@IF ! nothing here\n@ENDIF\n").getKind());
  }

  @Test
  void ifOnEmptyVariableIsFalse() throws Exception {
    ParserOptions options = ParserOptions.builder().variable("EMPTY", "").build();
    assertEquals(List.of(), texts("@IF ${EMPTY}\nA 1\n@ENDIF\n", options));
  }

  @Test
  void endifWithoutIfIsUnbalanced() {
    DeckParseException e = failure("A 1\n@ENDIF\n");
    assertEquals(ErrorKind.UNBALANCED_DIRECTIVE, e.getKind());
    assertEquals(2, e.getLineNumber());
  }

  @Test
  void unclosedIfIsUnbalancedAtItsLine() {
    DeckParseException e = failure("A 1\n@IF 1\nB 1\n");
    assertEquals(ErrorKind.UNBALANCED_DIRECTIVE, e.getKind());
    assertEquals(2, e.getLineNumber());
    assertEquals("@IF 1", e.getLine());
  }

  @Test
  void textAfterEndifIsMalformed() {
    DeckParseException e = failure("@IF 1\n@ENDIF junk\n");
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, e.getKind());
  }

  @Test
  void commentAfterEndifIsAllowed() throws Exception {
    assertEquals(List.of(), texts("@IF 1\n@ENDIF # done\n"));
  }

  @Test
  void setWithoutValueIsMalformed() {
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, failure("@SET X\n").getKind());
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, failure("@SET\n").getKind());
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, failure("@SET 1X 2\n").getKind());
  }

  @Test
  void unknownDirectiveIsMalformed() {
    DeckParseException e = failure("@ELSE\n");
    assertEquals(ErrorKind.MALFORMED_DIRECTIVE, e.getKind());
    assertTrue(e.getDescription().contains("@ELSE"));
  }

  @Test
  void undefinedVariableCitesReferencingLine() {
    DeckParseException e = failure("A 1\nB ${UNSET}\n");
    assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.getKind());
    assertEquals(2, e.getLineNumber());
    assertEquals("B ${UNSET}", e.getLine());
  }

  @Test
  void includeDisabledByDefault() {
    DeckParseException e = failure("@INCLUDE other.inp\n");
    assertEquals(ErrorKind.INCLUDE_FAILED, e.getKind());
  }

  @Test
  void includeInsideSuppressedBlockIsIgnored() throws Exception {
    assertEquals(List.of(), texts("@IF 0\n@INCLUDE other.inp\n@ENDIF\n"));
  }

  @Test
  void lineExpandingToNothingIsDropped() throws Exception {
    ParserOptions options = ParserOptions.builder().variable("NOTHING", "").build();
    assertEquals(List.of("A 1"), texts("${NOTHING}\nA 1\n", options));
  }
}
