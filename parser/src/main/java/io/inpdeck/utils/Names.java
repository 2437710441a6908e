package io.inpdeck.utils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive name handling. Stored names keep their original casing; comparisons go through
 * {@link #key(String)}.
 */
public final class Names {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private Names() {}

  /**
   * Returns the comparison key for a section, keyword or variable name.
   *
   * @param name the name as written
   * @return the upper-cased key
   */
  public static String key(String name) {
    return name.toUpperCase(Locale.ROOT);
  }

  public static boolean sameName(String a, String b) {
    return key(a).equals(key(b));
  }

  /** Whether {@code name} is a valid preprocessor variable name. */
  public static boolean isIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }

  public static boolean isIdentifierStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  public static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }
}
