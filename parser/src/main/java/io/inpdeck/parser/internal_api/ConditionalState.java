package io.inpdeck.parser.internal_api;

import io.inpdeck.parser.api.SourceLine;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks nested {@code @IF} blocks. A block is active only when its own condition and the
 * conditions of all enclosing blocks are true.
 */
public final class ConditionalState {

  /**
   * One open {@code @IF}.
   *
   * @param active whether lines inside the block are emitted
   * @param opening the {@code @IF} line
   */
  public record Frame(boolean active, SourceLine opening) {}

  private final Deque<Frame> stack = new ArrayDeque<>();

  /**
   * Returns whether lines should currently be emitted. True outside of any block, or if the
   * innermost block is active.
   */
  public boolean isActive() {
    if (stack.isEmpty()) {
      return true;
    }
    return stack.peek().active();
  }

  /**
   * Enters a new block.
   *
   * @param condition the result of evaluating the condition, ignored when already inactive
   * @param opening the {@code @IF} line
   */
  public void enterIf(boolean condition, SourceLine opening) {
    // an inactive parent makes the whole nested block inactive
    stack.push(new Frame(isActive() && condition, opening));
  }

  /**
   * Exits the innermost block.
   *
   * @return the frame that was closed
   * @throws IllegalStateException if not inside a block
   */
  public Frame exitIf() {
    if (stack.isEmpty()) {
      throw new IllegalStateException("@ENDIF without @IF");
    }
    return stack.pop();
  }

  public boolean inConditional() {
    return !stack.isEmpty();
  }

  /** The innermost open block, or null. */
  public Frame innermost() {
    return stack.peek();
  }

  public int depth() {
    return stack.size();
  }
}
