package org.pragmatica.svelte.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceSpanTest {

    private static final String SOURCE = "<div>\n  <p>x</p>\n</div>";

    @Test
    void of_offsets_computesLinesAndColumns() {
        var span = SourceSpan.of(SOURCE, 8, 16);

        assertEquals(SourceLocation.at(2, 3, 8), span.start());
        assertEquals(SourceLocation.at(2, 11, 16), span.end());
        assertEquals("<p>x</p>", span.extract(SOURCE));
    }

    @Test
    void toString_showsLineAndColumnRange() {
        assertEquals("2:3-2:11", SourceSpan.of(SOURCE, 8, 16).toString());
    }

    @Test
    void at_isEmptyRange() {
        var span = SourceSpan.at(SourceLocation.START);

        assertEquals("", span.extract(SOURCE));
    }

    @Test
    void locationOf_offsetPastNewline_startsNextLine() {
        assertEquals(SourceLocation.at(2, 1, 6), SourceLocation.of(SOURCE, 6));
        assertEquals(SourceLocation.START, SourceLocation.of(SOURCE, 0));
    }
}
