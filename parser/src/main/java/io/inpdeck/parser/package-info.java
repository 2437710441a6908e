/**
 * Output helpers built on top of the parser API.
 *
 * <p>{@link io.inpdeck.parser.DeckWriter} serializes a document back to canonical deck text.
 */
package io.inpdeck.parser;
