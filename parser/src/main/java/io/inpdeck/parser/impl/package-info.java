/** Implementation of {@link io.inpdeck.parser.api.DeckParser}. */
package io.inpdeck.parser.impl;
