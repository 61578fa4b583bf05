package org.pragmatica.svelte.tree;

/**
 * Flavours of tag-like nodes. All of them print with the element rules, except
 * {@link #OPTIONS} and {@link #BODY} which always self-close.
 */
public enum ElementKind {
    ELEMENT,
    INLINE_COMPONENT,
    SLOT,
    WINDOW,
    HEAD,
    TITLE,
    OPTIONS,
    BODY
}
