package org.pragmatica.svelte.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.svelte.tree.SourceLocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_pointsCaretAtLocation() {
        var source = "<div>\n  </span>\n";
        var error = new ParseError.UnexpectedInput(SourceLocation.at(2, 3, 8), "</span>", "'</div>'");

        var output = Diagnostic.of(error, source).format(source, "App.svelte");

        assertEquals("error: expected '</div>'\n"
                     + "  --> App.svelte:2:3\n"
                     + "  |\n"
                     + "2 |   </span>\n"
                     + "  |   ^ found '</span>'\n"
                     + "  |\n", output);
    }

    @Test
    void of_recomputesLocationFromOffset() {
        var source = "a\nbc";
        var error = new ParseError.SemanticError(SourceLocation.at(1, 1, 3), "bad");

        var diagnostic = Diagnostic.of(error, source);

        assertEquals(2, diagnostic.location().line());
        assertEquals(2, diagnostic.location().column());
    }

    @Test
    void of_explicitOffset_overridesErrorLocation() {
        var source = "<script>\n</script>\n<div>\n  </span>";
        var error = new ParseError.SemanticError(SourceLocation.at(1, 9, 8), "bad");

        var diagnostic = Diagnostic.of(error, source, source.indexOf("</span>"));

        assertEquals(SourceLocation.at(4, 3, source.indexOf("</span>")), diagnostic.location());
    }

    @Test
    void of_embeddedContentError_addsHelpNote() {
        var error = new FormatError.EmbeddedContentError(SourceLocation.START, "script", "bad body");

        var diagnostic = Diagnostic.of(error, "<script></script>");

        assertThat(diagnostic.notes()).containsExactly("help: the formatted content must not contain </script>");
        assertThat(diagnostic.format("<script></script>", null)).contains("= help:");
    }

    @Test
    void formatSimple_isSingleLine() {
        var error = new ParseError.UnexpectedEof(SourceLocation.at(3, 5, 20), "'}'");
        var source = "x\n".repeat(10);

        var simple = Diagnostic.of(error, source).formatSimple("A.svelte");

        assertThat(simple).isEqualTo("A.svelte:11:1: error: unexpected end of input");
    }
}
