package io.inpdeck.shell;

/** Output formats of the command line driver. */
public enum OutputFormat {
  /** Summary plus an indented outline. */
  TREE,
  /** Nested JSON object, see {@link JsonTreeMapper}. */
  JSON,
  /** Canonical deck text, see {@link io.inpdeck.parser.DeckWriter}. */
  CANONICAL,
  /** Lines after preprocessing, before tokenization. */
  PREPROCESSED
}
