package org.pragmatica.svelte.embed;

/**
 * Formats the body of a script or style region.
 *
 * <p>Implementations return the formatted body without surrounding blank lines
 * and signal failure with {@link EmbeddedFormatException}.
 */
@FunctionalInterface
public interface EmbeddedFormatter {
    String format(String content);
}
