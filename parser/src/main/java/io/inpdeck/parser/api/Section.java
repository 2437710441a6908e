package io.inpdeck.parser.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named container node opened with {@code &NAME} and closed with {@code &END}. Holds the
 * optional parameter tokens written after the name and its children in declaration order.
 *
 * <p>Equality is structural: name, parameters and children. Source position is ignored.
 */
public final class Section implements Node, NodeContainer {
  private final String name;
  private final List<String> parameters;
  private final List<Node> children;
  private final String source;
  private final int lineNumber;

  public Section(
      String name, List<String> parameters, List<Node> children, String source, int lineNumber) {
    this.name = Objects.requireNonNull(name, "name");
    this.parameters = List.copyOf(parameters);
    this.children = List.copyOf(children);
    this.source = source;
    this.lineNumber = lineNumber;
  }

  public Section(String name, List<String> parameters, List<Node> children) {
    this(name, parameters, children, null, 0);
  }

  @Override
  public String name() {
    return name;
  }

  /** Parameter tokens following the section name on the opening line. */
  public List<String> parameters() {
    return parameters;
  }

  /** The parameter tokens joined by a single space, or empty when none were given. */
  public Optional<String> parameter() {
    return parameters.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", parameters));
  }

  @Override
  public List<Node> children() {
    return children;
  }

  @Override
  public String source() {
    return source;
  }

  @Override
  public int lineNumber() {
    return lineNumber;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    if (visitor.enterSection(this)) {
      for (Node child : children) {
        child.accept(visitor);
      }
    }
    visitor.exitSection(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Section other)) return false;
    return name.equals(other.name)
        && parameters.equals(other.parameters)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters, children);
  }

  @Override
  public String toString() {
    String params = parameters.isEmpty() ? "" : " " + parameters;
    return "Section{" + name + params + " " + children + "}";
  }
}
