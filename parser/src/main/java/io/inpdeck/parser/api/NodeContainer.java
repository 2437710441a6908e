package io.inpdeck.parser.api;

import io.inpdeck.utils.Names;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Query methods shared by {@link Document} and {@link Section}. Name arguments are matched
 * case-insensitively; results keep declaration order.
 */
public interface NodeContainer {

  /** Direct children in declaration order. */
  List<Node> children();

  default List<Section> sections() {
    List<Section> result = new ArrayList<>();
    for (Node n : children()) {
      if (n instanceof Section s) {
        result.add(s);
      }
    }
    return result;
  }

  default List<Section> sections(String name) {
    List<Section> result = new ArrayList<>();
    for (Node n : children()) {
      if (n instanceof Section s && Names.sameName(s.name(), name)) {
        result.add(s);
      }
    }
    return result;
  }

  /** First direct child section called {@code name}. */
  default Optional<Section> section(String name) {
    for (Node n : children()) {
      if (n instanceof Section s && Names.sameName(s.name(), name)) {
        return Optional.of(s);
      }
    }
    return Optional.empty();
  }

  default List<Keyword> keywords() {
    List<Keyword> result = new ArrayList<>();
    for (Node n : children()) {
      if (n instanceof Keyword k) {
        result.add(k);
      }
    }
    return result;
  }

  default List<Keyword> keywords(String name) {
    List<Keyword> result = new ArrayList<>();
    for (Node n : children()) {
      if (n instanceof Keyword k && Names.sameName(k.name(), name)) {
        result.add(k);
      }
    }
    return result;
  }

  /** First direct keyword called {@code name}. */
  default Optional<Keyword> keyword(String name) {
    for (Node n : children()) {
      if (n instanceof Keyword k && Names.sameName(k.name(), name)) {
        return Optional.of(k);
      }
    }
    return Optional.empty();
  }

  /** Last direct keyword called {@code name}, i.e. the one overriding earlier ones. */
  default Optional<Keyword> lastKeyword(String name) {
    List<Keyword> all = keywords(name);
    return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
  }

  /**
   * Follows a slash separated path of section names, taking the first match at every level.
   *
   * @param path e.g. {@code "FORCE_EVAL/DFT/SCF"}
   * @return the section at the end of the path
   */
  default Optional<Section> find(String path) {
    NodeContainer current = this;
    Section found = null;
    for (String segment : path.split("/")) {
      if (segment.isBlank()) {
        continue;
      }
      Optional<Section> next = current.section(segment.trim());
      if (next.isEmpty()) {
        return Optional.empty();
      }
      found = next.get();
      current = found;
    }
    return Optional.ofNullable(found);
  }
}
