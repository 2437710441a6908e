package io.inpdeck.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.inpdeck.parser.api.DeckParser;
import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.Keyword;
import io.inpdeck.parser.api.ParserOptions;
import io.inpdeck.parser.api.Section;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DeckWriterTest {
  private final DeckWriter writer = new DeckWriter();
  private final DeckParser parser = DeckParser.create();

  @Test
  void writesCanonicalLayout() throws Exception {
    Document doc =
        parser.parse(
            "&global   ! run settings\n"
                + "project   demo\n"
                + "&end\n"
                + "&Force_Eval\n"
                + "  &dft\n"
                + "    BASIS  'my basis.dat'\n"
                + "  &END dft\n"
                + "&END\n");

    assertEquals(
        "&global\n"
            + "  project demo\n"
            + "&END global\n"
            + "&Force_Eval\n"
            + "  &dft\n"
            + "    BASIS \"my basis.dat\"\n"
            + "  &END dft\n"
            + "&END Force_Eval\n",
        writer.write(doc));
  }

  @Test
  void sectionParametersFollowName() throws Exception {
    Document doc = parser.parse("&KIND Fe\nELEMENT Fe\n&END\n");
    assertEquals("&KIND Fe\n  ELEMENT Fe\n&END KIND\n", writer.write(doc));
  }

  @Test
  void emptyDocumentWritesNothing() throws Exception {
    assertEquals("", writer.write(parser.parse("! only a comment\n")));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      quoteCharacter = '`',
      value = {
        "plain|false|plain",
        "two words|false|\"two words\"",
        "say \"hi\"|false|'say \"hi\"'",
        "a!b|false|\"a!b\"",
        "x#1|false|\"x#1\"",
        "&NAME|true|\"&NAME\"",
        "&NAME|false|&NAME",
        "@SET|true|\"@SET\"",
      })
  void quotesOnlyWhenNeeded(String token, boolean leading, String expected) {
    assertEquals(expected, writer.quote(token, leading));
  }

  @Test
  void emptyTokenIsQuoted() {
    assertEquals("\"\"", writer.quote("", false));
  }

  @Test
  void tokenWithBothQuotesIsWrittenInSegments() throws Exception {
    String token = "it's \"odd\"";
    String quoted = writer.quote(token, false);
    Document doc = parser.parse("K " + quoted + "\n");
    assertEquals(List.of(token), doc.keyword("K").orElseThrow().values());
  }

  @Test
  void customCommentCharactersAreQuoted() {
    DeckWriter custom = new DeckWriter(ParserOptions.builder().commentChars(";").build());
    assertEquals("\"a;b\"", custom.quote("a;b", false));
    assertEquals("a!b", custom.quote("a!b", false));
  }

  @Test
  void builtDocumentReadsBackEqual() throws Exception {
    Document doc =
        new Document(
            "built",
            List.of(
                new Section(
                    "MOTION",
                    List.of(),
                    List.of(
                        new Keyword("RUN_TYPE", List.of("MD")),
                        new Section(
                            "PRINT",
                            List.of("on", "high"),
                            List.of(new Keyword("&odd", List.of("", "a b", "c!d")))))),
                new Keyword("@TOP", List.of())));

    assertEquals(doc, parser.parse(writer.write(doc)));
  }

  @Test
  void fixtureReadsBackEqual() throws Exception {
    Document doc;
    try (Reader reader =
        new InputStreamReader(
            DeckWriterTest.class.getResourceAsStream("/decks/fe_bcc.inp"),
            StandardCharsets.UTF_8)) {
      doc = parser.parse(reader, "fe_bcc.inp");
    }
    String text = writer.write(doc);
    assertEquals(doc, parser.parse(text));
    assertEquals(text, writer.write(parser.parse(text)));
  }

  @Test
  void appendsToGivenTarget() throws Exception {
    StringBuilder out = new StringBuilder("# header\n");
    writer.write(parser.parse("A 1\n"), out);
    assertEquals("# header\nA 1\n", out.toString());
  }

  @Test
  void literalDollarReadsBack() throws Exception {
    Document doc = parser.parse("K ${X-$Y} '$' cost$\n&S ${H-$HOME}\n&END\n");
    assertEquals(List.of("$Y", "$", "cost$"), doc.keyword("K").orElseThrow().values());

    String text = writer.write(doc);
    assertEquals(
        "@SET _DOLLAR_ $\n"
            + "K \"${_DOLLAR_}Y\" \"${_DOLLAR_}\" \"cost${_DOLLAR_}\"\n"
            + "&S \"${_DOLLAR_}HOME\"\n"
            + "&END S\n",
        text);
    assertEquals(doc, parser.parse(text));
  }

  @Test
  void noDollarVariableWithoutDollar() throws Exception {
    assertEquals("A 1\n", writer.write(parser.parse("A 1\n")));
  }
}
