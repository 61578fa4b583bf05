package org.pragmatica.svelte.embed;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.svelte.embed.SnippedContentCodec.MARKER_ATTRIBUTE;

class SnippedContentCodecTest {

    // === Snipping ===

    @Test
    void snip_replacesScriptBodyWithMarker() {
        var snipped = SnippedContentCodec.snip("<script>let a = 1;</script>");

        assertEquals("<script " + MARKER_ATTRIBUTE + "=\"" + SnippedContentCodec.encode("let a = 1;") + "\">{}</script>",
                     snipped);
    }

    @Test
    void snip_styleGetsEmptyPlaceholder_andKeepsAttributes() {
        var snipped = SnippedContentCodec.snip("<style lang=\"scss\">a { b: c }</style>");

        assertThat(snipped).startsWith("<style lang=\"scss\" " + MARKER_ATTRIBUTE + "=\"");
        assertThat(snipped).endsWith("\"></style>");
    }

    @Test
    void snip_consumesSurroundingWhitespace() {
        var snipped = SnippedContentCodec.snip("<p>a</p>\n\n<style>x</style>\n\n<p>b</p>\n");

        assertThat(snipped).startsWith("<p>a</p><style ");
        assertThat(snipped).endsWith("</style><p>b</p>");
    }

    @Test
    void snip_tagLikeTextInsideScript_isPartOfTheBody() {
        var source = "<script>const s = '<style>x</style>';</script>";

        var snipped = SnippedContentCodec.snip(source);

        assertThat(snipped).doesNotContain("<style");
        assertEquals(source, SnippedContentCodec.unsnip(snipped));
    }

    @Test
    void snip_capitalizedTags_areComponentsAndStayUntouched() {
        var source = "<Style color=\"red\">hi</Style><Script name=\"x\"></Script>";

        assertEquals(source, SnippedContentCodec.snip(source));
    }

    @Test
    void snip_quotedGreaterThanInStartTag_staysInAttributes() {
        var source = "<script data-x=\"a>b\" data-y='c>\"d'>let x = 1;</script>";

        var snipped = SnippedContentCodec.snip(source);

        assertThat(snipped).startsWith("<script data-x=\"a>b\" data-y='c>\"d' " + MARKER_ATTRIBUTE + "=\""
                                       + SnippedContentCodec.encode("let x = 1;") + "\">");
        assertEquals(source, SnippedContentCodec.unsnip(snipped));
    }

    @Test
    void snip_withoutRegions_onlyStrips() {
        assertEquals("<p>x</p>", SnippedContentCodec.snip("  <p>x</p>\n"));
    }

    // === Unsnipping ===

    @Test
    void unsnip_restoresBodiesAndAttributes() {
        var source = "<script lang=\"ts\">let a: number = 1;</script><div>x</div><style>p { color: red; }</style>";

        assertEquals(source, SnippedContentCodec.unsnip(SnippedContentCodec.snip(source)));
    }

    @Test
    void unsnip_handlesReplacementCharactersInBody() {
        var source = "<script>const re = /\\$1/; const s = \"$&\";</script>";

        assertEquals(source, SnippedContentCodec.unsnip(SnippedContentCodec.snip(source)));
    }

    @Test
    void unsnip_textWithoutMarker_isReturnedAsIs() {
        assertEquals("<p>plain</p>", SnippedContentCodec.unsnip("<p>plain</p>"));
    }

    @Test
    void hasSnippedContent_detectsMarker() {
        assertTrue(SnippedContentCodec.hasSnippedContent(SnippedContentCodec.snip("<style>a</style>")));
        assertFalse(SnippedContentCodec.hasSnippedContent("<p>a</p>"));
    }

    // === Offsets ===

    @Test
    void originalOffset_markupAfterRegion_mapsPastTheBody() {
        var source = "<p>a</p>\n<style>\n  p{}\n</style>\n<b>x</b>";
        var snipped = SnippedContentCodec.snip(source);

        assertEquals(2, SnippedContentCodec.originalOffset(source, 2));
        assertEquals(source.indexOf("<b>"), SnippedContentCodec.originalOffset(source, snipped.indexOf("<b>")));
        assertEquals(source.indexOf("x</b>"), SnippedContentCodec.originalOffset(source, snipped.indexOf("x</b>")));
    }

    @Test
    void originalOffset_insideRegion_mapsToItsStartTag() {
        var source = "<p>a</p>\n<script>let a;</script>";
        var snipped = SnippedContentCodec.snip(source);

        assertEquals(source.indexOf("<script"),
                     SnippedContentCodec.originalOffset(source, snipped.indexOf(MARKER_ATTRIBUTE)));
    }

    @Test
    void originalOffset_accountsForStrippedLeadingWhitespace() {
        var source = "  \n<p>x</p>";

        assertEquals(source.indexOf("<p>"), SnippedContentCodec.originalOffset(source, 0));
    }

    // === Encoding ===

    @Test
    void encode_isUtf8Base64() {
        assertEquals("w6k=", SnippedContentCodec.encode("é"));
        assertEquals("é", SnippedContentCodec.decode("w6k="));
    }

    @Test
    void snippedContent_emptyValue_isAbsent() {
        assertTrue(SnippedContentCodec.snippedContent("").isEmpty());
        assertEquals("x", SnippedContentCodec.snippedContent(SnippedContentCodec.encode("x")).orElseThrow());
    }
}
