package io.inpdeck.parser.impl;

import io.inpdeck.parser.api.DeckParseException;
import io.inpdeck.parser.api.DeckParser;
import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.ParserOptions;
import io.inpdeck.parser.api.SourceLine;
import io.inpdeck.parser.internal_api.Preprocessor;
import io.inpdeck.parser.internal_api.Tokenizer;
import io.inpdeck.parser.internal_api.TreeBuilder;
import io.inpdeck.parser.internal_api.VariableTable;
import java.io.Reader;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link DeckParser}: normalizer, preprocessor, tokenizer and tree builder in sequence. */
public final class DeckParserImpl implements DeckParser {
  private static final Logger log = LoggerFactory.getLogger(DeckParserImpl.class);

  private final ParserOptions options;

  public DeckParserImpl(ParserOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  @Override
  public ParserOptions options() {
    return options;
  }

  @Override
  public Document parse(Reader reader, String source) throws DeckParseException {
    Objects.requireNonNull(reader, "reader");
    long start = System.nanoTime();
    Tokenizer tokenizer = new Tokenizer();
    TreeBuilder builder = new TreeBuilder();
    VariableTable variables;
    try (Preprocessor preprocessor = newPreprocessor(reader, source)) {
      SourceLine line;
      while ((line = preprocessor.next()) != null) {
        builder.accept(tokenizer.tokenize(line));
      }
      variables = preprocessor.variables();
    } catch (DeckParseException e) {
      log.debug("Parsing {} failed: {}", source, e.getMessage());
      throw e;
    }
    Document document = builder.finish(source);
    if (log.isDebugEnabled()) {
      log.debug(
          "Parsed {}: {} sections, {} keywords, {} variables in {} us",
          source,
          document.sectionCount(),
          document.keywordCount(),
          variables.size(),
          (System.nanoTime() - start) / 1000);
    }
    if (log.isTraceEnabled()) {
      log.trace("Variables of {}: {}", source, variables.asMap());
    }
    return document;
  }

  @Override
  public List<SourceLine> preprocess(Reader reader, String source) throws DeckParseException {
    Objects.requireNonNull(reader, "reader");
    try (Preprocessor preprocessor = newPreprocessor(reader, source)) {
      return preprocessor.readAll();
    }
  }

  private Preprocessor newPreprocessor(Reader reader, String source) {
    return new Preprocessor(reader, source, options, new VariableTable(options.variables()));
  }
}
