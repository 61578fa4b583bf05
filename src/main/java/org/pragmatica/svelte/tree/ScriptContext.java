package org.pragmatica.svelte.tree;

/**
 * Evaluation context of a top-level script region.
 */
public enum ScriptContext {
    /** Runs once per component module ({@code context="module"}). */
    MODULE,
    /** Runs once per component instance. */
    INSTANCE
}
