package io.inpdeck.parser.api;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Helpers interpreting raw value tokens. The parser never applies them; consumers decide which
 * keyword values are booleans or numbers.
 *
 * <ul>
 *   <li>booleans: {@code T, TRUE, .TRUE., Y, YES, ON} and {@code F, FALSE, .FALSE., N, NO, OFF},
 *       case-insensitive
 *   <li>reals: Java floating point syntax plus Fortran {@code D} exponents ({@code 1.0D-6})
 *   <li>integers: optional sign followed by decimal digits
 * </ul>
 */
public final class Values {
  private static final Set<String> TRUE_WORDS = Set.of("T", "TRUE", ".TRUE.", "Y", "YES", "ON");
  private static final Set<String> FALSE_WORDS =
      Set.of("F", "FALSE", ".FALSE.", "N", "NO", "OFF");

  private Values() {}

  public static boolean isBoolean(String token) {
    String key = token.trim().toUpperCase(Locale.ROOT);
    return TRUE_WORDS.contains(key) || FALSE_WORDS.contains(key);
  }

  /**
   * Interprets a token as a boolean.
   *
   * @param token the raw token
   * @return the boolean, or empty if the token is not a recognized boolean literal
   */
  public static Optional<Boolean> asBoolean(String token) {
    String key = token.trim().toUpperCase(Locale.ROOT);
    if (TRUE_WORDS.contains(key)) {
      return Optional.of(Boolean.TRUE);
    }
    if (FALSE_WORDS.contains(key)) {
      return Optional.of(Boolean.FALSE);
    }
    return Optional.empty();
  }

  /**
   * Interprets a token as a real number.
   *
   * @param token the raw token
   * @return the value, or empty if the token is not numeric
   */
  public static Optional<Double> asDouble(String token) {
    String s = token.trim().replace('d', 'e').replace('D', 'E');
    if (s.isEmpty() || !isNumericSyntax(s)) {
      return Optional.empty();
    }
    return Optional.of(Double.parseDouble(s));
  }

  /**
   * Interprets a token as an integer.
   *
   * @param token the raw token
   * @return the value, or empty if the token is not an integer that fits in a long
   */
  public static Optional<Long> asLong(String token) {
    String s = token.trim();
    int start = s.startsWith("+") || s.startsWith("-") ? 1 : 0;
    if (s.length() == start || s.length() - start > 18) {
      return Optional.empty();
    }
    for (int i = start; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return Optional.empty();
      }
    }
    return Optional.of(Long.parseLong(s));
  }

  // [+-]? (digits [. digits?] | . digits) ([eE] [+-]? digits)?
  private static boolean isNumericSyntax(String s) {
    int i = 0;
    int n = s.length();
    if (s.charAt(i) == '+' || s.charAt(i) == '-') i++;
    int digits = 0;
    while (i < n && Character.isDigit(s.charAt(i))) {
      i++;
      digits++;
    }
    if (i < n && s.charAt(i) == '.') {
      i++;
      while (i < n && Character.isDigit(s.charAt(i))) {
        i++;
        digits++;
      }
    }
    if (digits == 0) return false;
    if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
      i++;
      if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;
      int exp = 0;
      while (i < n && Character.isDigit(s.charAt(i))) {
        i++;
        exp++;
      }
      if (exp == 0) return false;
    }
    return i == n;
  }
}
