package io.inpdeck.parser.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named leaf holding an ordered list of raw value tokens. Values are kept as written (quotes
 * stripped); see {@link Values} for interpretation helpers.
 *
 * <p>Equality is structural: name and values. Source position is ignored.
 */
public final class Keyword implements Node {
  private final String name;
  private final List<String> values;
  private final String source;
  private final int lineNumber;

  public Keyword(String name, List<String> values, String source, int lineNumber) {
    this.name = Objects.requireNonNull(name, "name");
    this.values = List.copyOf(values);
    this.source = source;
    this.lineNumber = lineNumber;
  }

  public Keyword(String name, List<String> values) {
    this(name, values, null, 0);
  }

  @Override
  public String name() {
    return name;
  }

  public List<String> values() {
    return values;
  }

  /** Returns the value at {@code index}, if present. */
  public Optional<String> value(int index) {
    return index >= 0 && index < values.size() ? Optional.of(values.get(index)) : Optional.empty();
  }

  /** All values joined by a single space; empty if the keyword has no values. */
  public String text() {
    return String.join(" ", values);
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
    visitor.visitKeyword(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Keyword other)) return false;
    return name.equals(other.name) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, values);
  }

  @Override
  public String toString() {
    return "Keyword{" + name + " " + values + "}";
  }
}
