package io.inpdeck.parser.api;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed input deck. Owns the top-level sequence of sections and keywords and is
 * immutable once built.
 */
public final class Document implements NodeContainer {
  private final String source;
  private final List<Node> children;

  public Document(String source, List<Node> children) {
    this.source = source;
    this.children = List.copyOf(children);
  }

  /** Name of the top-level stream this document was parsed from, may be null. */
  public String source() {
    return source;
  }

  @Override
  public List<Node> children() {
    return children;
  }

  public void accept(NodeVisitor visitor) {
    for (Node child : children) {
      child.accept(visitor);
    }
  }

  /** Number of sections at any depth. */
  public int sectionCount() {
    int[] count = {0};
    accept(
        new NodeVisitor() {
          @Override
          public boolean enterSection(Section section) {
            count[0]++;
            return true;
          }
        });
    return count[0];
  }

  /** Number of keywords at any depth. */
  public int keywordCount() {
    int[] count = {0};
    accept(
        new NodeVisitor() {
          @Override
          public void visitKeyword(Keyword keyword) {
            count[0]++;
          }
        });
    return count[0];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Document other)) return false;
    return children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(children);
  }

  @Override
  public String toString() {
    return "Document{" + children + "}";
  }
}
