package org.pragmatica.svelte.embed;

/**
 * Thrown by an {@link EmbeddedFormatter} that can not format its input.
 */
public class EmbeddedFormatException extends RuntimeException {
    public EmbeddedFormatException(String message) {
        super(message);
    }

    public EmbeddedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
