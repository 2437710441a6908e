package io.inpdeck.parser.internal_api;

import io.inpdeck.utils.Names;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Preprocessor variables. Names are case-insensitive; the casing of the most recent definition is
 * kept for display. There is no way to remove a variable.
 */
public final class VariableTable {

  private record Entry(String name, String value) {}

  private final Map<String, Entry> variables = new LinkedHashMap<>();

  public VariableTable() {}

  /**
   * Creates a table seeded with {@code seed}. The map is copied.
   *
   * @param seed initial name to value mapping
   */
  public VariableTable(Map<String, String> seed) {
    seed.forEach(this::set);
  }

  /**
   * Sets a variable, replacing any previous value.
   *
   * @param name variable name
   * @param value the new value
   */
  public void set(String name, String value) {
    variables.put(Names.key(name), new Entry(name, value));
  }

  /**
   * Gets a variable value.
   *
   * @param name variable name
   * @return the value, or null if not set
   */
  public String get(String name) {
    Entry e = variables.get(Names.key(name));
    return e == null ? null : e.value();
  }

  public int size() {
    return variables.size();
  }

  /** Snapshot of all variables in definition order, keyed by their last written name. */
  public Map<String, String> asMap() {
    Map<String, String> out = new LinkedHashMap<>();
    for (Entry e : variables.values()) {
      out.put(e.name(), e.value());
    }
    return Collections.unmodifiableMap(out);
  }
}
