package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.Values;

/**
 * Evaluates already expanded {@code @IF} expressions.
 *
 * <pre>
 * expr := lhs '==' rhs     ; true if the trimmed sides are equal text
 *       | lhs '/=' rhs     ; true if the trimmed sides differ
 *       | text             ; false if empty or a numeric zero, true otherwise
 * </pre>
 */
public final class ConditionEvaluator {

  public boolean evaluate(String expression) {
    String expr = expression.strip();
    int eq = expr.indexOf("==");
    if (eq >= 0) {
      return expr.substring(0, eq).strip().equals(expr.substring(eq + 2).strip());
    }
    int ne = expr.indexOf("/=");
    if (ne >= 0) {
      return !expr.substring(0, ne).strip().equals(expr.substring(ne + 2).strip());
    }
    return isTruthy(expr);
  }

  static boolean isTruthy(String value) {
    if (value.isEmpty()) {
      return false;
    }
    if (Values.asDouble(value).isEmpty()) {
      return true;
    }
    // numeric: false only when every mantissa digit is zero
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == 'e' || c == 'E' || c == 'd' || c == 'D') {
        break;
      }
      if (c >= '1' && c <= '9') {
        return true;
      }
    }
    return false;
  }
}
