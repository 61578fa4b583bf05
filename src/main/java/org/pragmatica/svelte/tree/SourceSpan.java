package org.pragmatica.svelte.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /**
     * Span of the offsets {@code [start, end)} of {@code source}, with line and
     * column computed from the text.
     */
    public static SourceSpan of(String source, int start, int end) {
        return new SourceSpan(SourceLocation.of(source, start), SourceLocation.of(source, end));
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
