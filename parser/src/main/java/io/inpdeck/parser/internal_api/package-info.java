/**
 * Pipeline stages: {@link io.inpdeck.parser.internal_api.LineNormalizer}, {@link
 * io.inpdeck.parser.internal_api.Preprocessor}, {@link io.inpdeck.parser.internal_api.Tokenizer}
 * and {@link io.inpdeck.parser.internal_api.TreeBuilder}. Not intended for direct use.
 */
package io.inpdeck.parser.internal_api;
