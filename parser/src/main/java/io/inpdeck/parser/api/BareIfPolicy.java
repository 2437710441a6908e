package io.inpdeck.parser.api;

/** How an {@code @IF} directive without any expression text is handled. */
public enum BareIfPolicy {
  /** Reject the document with {@link ErrorKind#MALFORMED_DIRECTIVE}. */
  FAIL,
  /** Treat the missing expression as false and suppress the block. */
  FALSE
}
