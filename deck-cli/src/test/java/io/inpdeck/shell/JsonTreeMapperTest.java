package io.inpdeck.shell;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.inpdeck.parser.api.DeckParser;
import io.inpdeck.parser.api.Document;
import org.junit.jupiter.api.Test;

class JsonTreeMapperTest {
  private final JsonTreeMapper mapper = new JsonTreeMapper();

  private ObjectNode map(String deck) throws Exception {
    Document doc = DeckParser.create().parse(deck);
    return mapper.toJson(doc);
  }

  @Test
  void sectionsAndKeywordsUseSeparateKeys() throws Exception {
    ObjectNode json = map("&print\n&end\nprint on\n");
    assertTrue(json.has("+PRINT"));
    assertEquals("on", json.get("PRINT").asText());
  }

  @Test
  void multiValuedKeywordIsArray() throws Exception {
    JsonNode cell = map("&CELL\nABC 2.8 2.8 2.8\nPERIODIC XYZ\n&END\n").get("+CELL");
    assertTrue(cell.get("ABC").isArray());
    assertEquals(3, cell.get("ABC").size());
    assertEquals("XYZ", cell.get("PERIODIC").asText());
  }

  @Test
  void keywordWithoutValuesIsEmptyArray() throws Exception {
    JsonNode flag = map("VERBOSE\n").get("VERBOSE");
    assertTrue(flag.isArray());
    assertEquals(0, flag.size());
  }

  @Test
  void repeatedNamesCollectInOrder() throws Exception {
    ObjectNode json = map("&KIND H\n&END\n&KIND O\nELEMENT O\n&END\nkind 1\nKind 2\n");
    JsonNode kinds = json.get("+KIND");
    assertEquals(2, kinds.size());
    assertEquals("H", kinds.get(0).get("_").asText());
    assertEquals("O", kinds.get(1).get("ELEMENT").asText());
    assertEquals("1", json.get("KIND").get(0).asText());
    assertEquals("2", json.get("KIND").get(1).asText());
  }

  @Test
  void parametersAreJoined() throws Exception {
    JsonNode print = map("&PRINT on high\n&END\n&DFT\n&END\n");
    assertEquals("on high", print.get("+PRINT").get("_").asText());
    assertFalse(print.get("+DFT").has("_"));
  }

  @Test
  void renderProducesIndentedJson() throws Exception {
    String text = mapper.render(DeckParser.create().parse("A 1\n"));
    assertEquals("{\n  \"A\" : \"1\"\n}", text.replace(System.lineSeparator(), "\n"));
  }

  @Test
  void underscoreKeywordDoesNotHideParameter() throws Exception {
    JsonNode s = map("&S p\n_ k\n&END\n").get("+S");
    JsonNode entries = s.get("_");
    assertTrue(entries.isArray());
    assertEquals(2, entries.size());
    assertEquals("p", entries.get(0).asText());
    assertEquals("k", entries.get(1).asText());
  }

  @Test
  void underscoreKeywordWithoutParameterStaysScalar() throws Exception {
    assertEquals("k", map("&S\n_ k\n&END\n").get("+S").get("_").asText());
  }
}
