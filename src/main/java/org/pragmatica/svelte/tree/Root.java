package org.pragmatica.svelte.tree;

import org.pragmatica.svelte.tree.Node.Fragment;
import org.pragmatica.svelte.tree.Node.Script;
import org.pragmatica.svelte.tree.Node.Style;

import java.util.Optional;

/**
 * Parsed component: module script, instance script and style slots plus the
 * markup fragment. {@code source} is the text the parser saw; node spans index
 * into it.
 */
public record Root(Optional<Script> module,
                   Optional<Script> instance,
                   Optional<Style> css,
                   Fragment html,
                   String source) {
}
