package org.pragmatica.svelte.embed;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddedLanguageTest {

    @ParameterizedTest
    @CsvSource({
        "script, js, JAVASCRIPT",
        "script, babel, JAVASCRIPT",
        "script, text/javascript, JAVASCRIPT",
        "script, TS, TYPESCRIPT",
        "script, typescript, TYPESCRIPT",
        "style, css, CSS",
        "style, text/css, CSS",
        "style, postcss, CSS",
        "style, scss, SCSS",
        "style, less, LESS"
    })
    void resolve_allowListedLanguage(String tag, String lang, EmbeddedLanguage expected) {
        assertThat(EmbeddedLanguage.resolve(tag, Optional.of(lang))).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"script", "style"})
    void resolve_withoutLang_usesTagDefault(String tag) {
        var language = EmbeddedLanguage.resolve(tag, Optional.empty());

        assertThat(language).isPresent();
        assertThat(language.get().tag()).isEqualTo(tag);
    }

    @ParameterizedTest
    @CsvSource({
        "script, coffee",
        "style, stylus",
        "style, sass",
        "style, js",
        "script, css"
    })
    void resolve_otherLanguages_areNotFormatted(String tag, String lang) {
        assertThat(EmbeddedLanguage.resolve(tag, Optional.of(lang))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"pug", "coffee", "text/coffeescript", "stylus"})
    void isKnownUnsupported_recognizesTemplateLanguages(String lang) {
        assertThat(EmbeddedLanguage.isKnownUnsupported(Optional.of(lang))).isTrue();
    }
}
