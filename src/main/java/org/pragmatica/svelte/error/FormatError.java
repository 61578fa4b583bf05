package org.pragmatica.svelte.error;

import org.pragmatica.svelte.tree.SourceLocation;

/**
 * Failure of a formatting run.
 */
public sealed interface FormatError permits ParseError, FormatError.EmbeddedContentError {

    SourceLocation location();

    String message();

    /**
     * Formatted script or style body that can not be put back into the markup
     * without breaking it, e.g. because it contains the closing tag.
     */
    record EmbeddedContentError(SourceLocation location, String tag, String reason) implements FormatError {
        @Override
        public String message() {
            return "Cannot embed formatted <" + tag + "> content at " + location + ": " + reason;
        }
    }
}
