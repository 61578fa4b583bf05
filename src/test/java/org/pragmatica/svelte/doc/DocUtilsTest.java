package org.pragmatica.svelte.doc;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.svelte.doc.Docs.KEEP_IF_LONELY_LINE;
import static org.pragmatica.svelte.doc.Docs.LINE;
import static org.pragmatica.svelte.doc.Docs.SOFTLINE;
import static org.pragmatica.svelte.doc.Docs.concat;
import static org.pragmatica.svelte.doc.Docs.dedent;
import static org.pragmatica.svelte.doc.Docs.fill;
import static org.pragmatica.svelte.doc.Docs.group;
import static org.pragmatica.svelte.doc.Docs.text;

class DocUtilsTest {

    // === Trimming ===

    @Test
    void trim_removesLinesAtBothEnds() {
        var docs = List.of(LINE, text("a"), LINE, text("b"), SOFTLINE);

        assertEquals(List.of(text("a"), LINE, text("b")), DocUtils.trim(docs, DocUtils::isLine));
    }

    @Test
    void trimLeft_looksInsideLeadingConcat() {
        var docs = List.of(concat(LINE, text("a")), text("b"));

        var trimmed = DocUtils.trimLeft(docs, DocUtils::isLine);

        assertTrue(trimmed.changed());
        assertEquals(List.of(concat(text("a")), text("b")), trimmed.docs());
        assertEquals(List.of(LINE), trimmed.removed());
    }

    @Test
    void trimRight_looksInsideTrailingFill_andKeepsItAFill() {
        var docs = List.of(fill(List.of(text("a"), LINE)));

        var trimmed = DocUtils.trimRight(docs, DocUtils::isLine);

        assertEquals(List.of(fill(List.of(text("a")))), trimmed.docs());
    }

    @Test
    void trim_doesNotModifyInput() {
        var docs = new ArrayList<Doc>(List.of(LINE, text("a"), LINE));

        DocUtils.trim(docs, DocUtils::isLine);

        assertThat(docs).hasSize(3);
    }

    @Test
    void trim_withoutMatches_returnsSameContent() {
        var docs = List.of(text("a"), group(text("b")));

        var trimmed = DocUtils.trimLeft(docs, DocUtils::isLine);

        assertFalse(trimmed.changed());
        assertEquals(docs, trimmed.docs());
    }

    // === Line extraction ===

    @Test
    void extractOutermostLines_wrapsMiddleInFill() {
        var docs = List.of(LINE, text("a"), LINE, text("b"), SOFTLINE);

        var result = DocUtils.extractOutermostLines(docs);

        assertEquals(List.of(LINE, fill(List.of(text("a"), LINE, text("b"))), SOFTLINE), result);
    }

    @Test
    void extractOutermostLines_onlyLines_producesNoFill() {
        var result = DocUtils.extractOutermostLines(List.of(LINE, SOFTLINE));

        assertEquals(List.of(LINE, SOFTLINE), result);
    }

    @Test
    void dedentFinalLine_movesTrailingLineIntoDedent() {
        var result = DocUtils.dedentFinalLine(List.of(text("a"), LINE));

        assertEquals(List.of(text("a"), dedent(LINE)), result);
    }

    @Test
    void dedentFinalLine_withoutTrailingLine_isUnchanged() {
        var docs = List.of(text("a"));

        assertEquals(docs, DocUtils.dedentFinalLine(docs));
    }

    // === Predicates ===

    @Test
    void isEmpty_nestedEmptyTextAndLines() {
        assertTrue(DocUtils.isEmpty(concat(text(""), group(text("")), LINE)));
        assertFalse(DocUtils.isEmpty(concat(text(""), text("x"))));
    }

    @Test
    void isEmpty_keepIfLonelyLineIsContent() {
        assertFalse(DocUtils.isEmpty(KEEP_IF_LONELY_LINE));
    }

    @Test
    void isLineDiscardedIfLonely_distinguishesKeptLines() {
        assertTrue(DocUtils.isLineDiscardedIfLonely(LINE));
        assertFalse(DocUtils.isLineDiscardedIfLonely(KEEP_IF_LONELY_LINE));
        assertFalse(DocUtils.isLineDiscardedIfLonely(text("a")));
    }
}
