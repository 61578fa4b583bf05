package org.pragmatica.svelte.parser;

import org.pragmatica.svelte.tree.Root;

/**
 * Turns preprocessed component source into a syntax tree.
 *
 * <p>Implementations report failures by throwing
 * {@link org.pragmatica.svelte.error.FormatException} carrying a
 * {@link org.pragmatica.svelte.error.ParseError}.
 */
@FunctionalInterface
public interface MarkupParser {
    Root parse(String source);
}
