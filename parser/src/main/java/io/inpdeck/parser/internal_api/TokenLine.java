package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.SourceLine;
import java.util.List;

/**
 * A tokenized line.
 *
 * @param type the line kind
 * @param name section or keyword name; for {@link Type#SECTION_CLOSE} the optional close name
 *     (null when omitted)
 * @param values section parameter tokens or keyword values; empty for closes
 * @param line the originating line
 */
public record TokenLine(Type type, String name, List<String> values, SourceLine line) {

  public enum Type {
    SECTION_OPEN,
    SECTION_CLOSE,
    KEYWORD
  }

  public TokenLine {
    values = List.copyOf(values);
  }
}
