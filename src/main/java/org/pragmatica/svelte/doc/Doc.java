package org.pragmatica.svelte.doc;

import java.util.List;

/**
 * Layout document: an immutable tree describing text together with the places
 * where it may break. Rendered by {@link DocRenderer}; built with {@link Docs}.
 */
public sealed interface Doc {

    /**
     * Literal text. May contain newlines only when taken verbatim from the source.
     */
    record Text(String text) implements Doc {}

    record Concat(List<Doc> parts) implements Doc {
        public Concat {
            parts = List.copyOf(parts);
        }
    }

    /**
     * Contents rendered one indentation level deeper.
     */
    record Indent(Doc contents) implements Doc {}

    /**
     * Contents rendered one indentation level shallower, never below zero.
     */
    record Dedent(Doc contents) implements Doc {}

    /**
     * Region rendered on one line when it fits, with all its lines broken
     * otherwise.
     */
    record Group(Doc contents, boolean shouldBreak) implements Doc {}

    /**
     * Potential line break. {@code keepIfLonely} marks a blank-line separator
     * that survives when it is the only thing between two children.
     */
    record Line(LineKind kind, boolean keepIfLonely) implements Doc {}

    /**
     * Alternating content and separator parts; each separator breaks only when
     * the content after it does not fit.
     */
    record Fill(List<Doc> parts) implements Doc {
        public Fill {
            parts = List.copyOf(parts);
        }
    }

    /**
     * Forces every enclosing group to break.
     */
    record BreakParent() implements Doc {}

    enum LineKind {
        /** Nothing when flat, newline when broken. */
        SOFT,
        /** Space when flat, newline when broken. */
        NORMAL,
        /** Always a newline. */
        HARD,
        /** Always a newline, without indentation. */
        LITERAL
    }
}
