package io.inpdeck.parser.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ParserOptionsTest {

  @Test
  void defaults() {
    ParserOptions options = ParserOptions.defaults();
    assertEquals(Set.of('!', '#'), options.commentChars());
    assertEquals(Map.of(), options.variables());
    assertEquals(BareIfPolicy.FAIL, options.bareIfPolicy());
    assertSame(IncludeResolver.DISABLED, options.includeResolver());
    assertEquals(ParserOptions.DEFAULT_MAX_INCLUDE_DEPTH, options.maxIncludeDepth());
  }

  @Test
  void invalidVariableNameIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> ParserOptions.builder().variable("1X", "a"));
    assertThrows(
        IllegalArgumentException.class, () -> ParserOptions.builder().variable("A-B", "a"));
  }

  @Test
  void invalidCommentCharsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ParserOptions.builder().commentChars(""));
    assertThrows(IllegalArgumentException.class, () -> ParserOptions.builder().commentChars("'"));
    assertThrows(IllegalArgumentException.class, () -> ParserOptions.builder().commentChars(" "));
  }

  @Test
  void customCommentCharsApplyToParsing() throws Exception {
    ParserOptions options = ParserOptions.builder().commentChars(";").build();
    Document doc = DeckParser.create(options).parse("A 1 # 2 ; three\n");
    assertEquals(List.of("1", "#", "2"), doc.keyword("A").orElseThrow().values());
  }

  @Test
  void toBuilderCopies() {
    ParserOptions base = ParserOptions.builder().variable("X", "1").build();
    ParserOptions derived = base.toBuilder().variable("Y", "2").build();
    assertEquals(Map.of("X", "1"), base.variables());
    assertEquals(Map.of("X", "1", "Y", "2"), derived.variables());
  }
}
