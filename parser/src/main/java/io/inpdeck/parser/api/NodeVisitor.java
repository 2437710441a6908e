package io.inpdeck.parser.api;

/** Depth-first visitor over a document tree. Nodes are visited in declaration order. */
public interface NodeVisitor {
  /**
   * Called when a section is entered.
   *
   * @param section the section
   * @return {@code true} to visit the section's children
   */
  default boolean enterSection(Section section) {
    return true;
  }

  /** Called after the children of a section, also when {@link #enterSection} skipped them. */
  default void exitSection(Section section) {}

  default void visitKeyword(Keyword keyword) {}
}
