package org.pragmatica.svelte.error;

import org.pragmatica.svelte.tree.SourceLocation;

/**
 * Component source the markup parser could not turn into a syntax tree.
 * Locations refer to the source after script and style bodies were snipped.
 */
public sealed interface ParseError extends FormatError {

    /**
     * Input other than the token the grammar requires, e.g. a closing tag
     * where {@code {/if}} was expected.
     */
    record UnexpectedInput(SourceLocation location, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Expected " + expected + " but found '" + found + "' at " + location;
        }
    }

    /**
     * Input ended inside an element, block or tag.
     */
    record UnexpectedEof(SourceLocation location, String expected) implements ParseError {
        @Override
        public String message() {
            return "Input ended at " + location + " while looking for " + expected;
        }
    }

    /**
     * Well-formed input the component model does not allow, such as a second
     * instance script or a mismatched closing tag.
     */
    record SemanticError(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
