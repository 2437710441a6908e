package io.inpdeck.parser.api;

/** A node of the document tree: either a {@link Section} or a {@link Keyword}. */
public sealed interface Node permits Section, Keyword {
  /** The name as written in the input, original casing preserved. */
  String name();

  /** Name of the document the node was declared in. */
  String source();

  /** 1-based line number of the declaring line. */
  int lineNumber();

  void accept(NodeVisitor visitor);
}
