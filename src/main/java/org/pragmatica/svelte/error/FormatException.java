package org.pragmatica.svelte.error;

/**
 * Unchecked carrier of a {@link FormatError}; the only failure surfaced by the
 * formatter.
 */
public final class FormatException extends RuntimeException {

    private final FormatError error;

    public FormatException(FormatError error) {
        super(error.message());
        this.error = error;
    }

    public FormatException(FormatError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public FormatError error() {
        return error;
    }
}
