package org.pragmatica.svelte.embed;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddedFormattersTest {

    @Test
    void formatterFor_registeredLanguage_usesIt() {
        var formatters = EmbeddedFormatters.builder()
                                           .register(EmbeddedLanguage.CSS, content -> "css:" + content)
                                           .fallback(content -> "other:" + content)
                                           .build();

        assertThat(formatters.formatterFor(EmbeddedLanguage.CSS).format("a")).isEqualTo("css:a");
        assertThat(formatters.formatterFor(EmbeddedLanguage.TYPESCRIPT).format("a")).isEqualTo("other:a");
    }

    @Test
    void defaults_reindentEveryLanguage() {
        var formatters = EmbeddedFormatters.defaults(2);

        for (var language : EmbeddedLanguage.values()) {
            assertThat(formatters.formatterFor(language).format("\n    a\n")).isEqualTo("a");
        }
    }
}
