package org.pragmatica.svelte.embed;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReindentFormatterTest {

    private final ReindentFormatter formatter = ReindentFormatter.reindentFormatter(2);

    @Test
    void format_removesCommonIndentation() {
        var content = "\n    let a = 1;\n    if (a) {\n      go();\n    }\n";

        assertThat(formatter.format(content)).isEqualTo("let a = 1;\nif (a) {\n  go();\n}");
    }

    @Test
    void format_expandsLeadingTabs() {
        assertThat(formatter.format("\tfoo {\n\t\tbar: 1;\n\t}")).isEqualTo("foo {\n  bar: 1;\n}");
    }

    @Test
    void format_collapsesBlankLineRuns_andStripsTrailingWhitespace() {
        var content = "a;   \n\n\n\nb;\n   \n";

        assertThat(formatter.format(content)).isEqualTo("a;\n\nb;");
    }

    @Test
    void format_blankContent_isEmpty() {
        assertThat(formatter.format("\n   \n\t\n")).isEmpty();
    }

    @Test
    void format_isIdempotent() {
        var once = formatter.format("\n  x = 1;\n\n\n    y = 2;\n");

        assertThat(formatter.format(once)).isEqualTo(once);
    }
}
