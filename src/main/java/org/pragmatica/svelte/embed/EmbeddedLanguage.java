package org.pragmatica.svelte.embed;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Sublanguages whose bodies are handed to an {@link EmbeddedFormatter}.
 * Anything else is passed through verbatim.
 */
public enum EmbeddedLanguage {
    JAVASCRIPT("script", "", "js", "javascript", "babel", "module"),
    TYPESCRIPT("script", "ts", "typescript"),
    CSS("style", "", "css", "postcss"),
    SCSS("style", "scss"),
    LESS("style", "less");

    private static final Set<String> UNSUPPORTED = Set.of("coffee", "coffeescript", "pug", "styl", "stylus", "sass");

    private final String tag;
    private final Set<String> names;

    EmbeddedLanguage(String tag, String... names) {
        this.tag = tag;
        this.names = Set.of(names);
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolve the language of a region from its tag and its {@code lang} or
     * {@code type} value ({@code text/} prefix stripped). Empty when the
     * combination is not on the allow-list.
     */
    public static Optional<EmbeddedLanguage> resolve(String tag, Optional<String> lang) {
        var name = normalize(lang);
        for (var language : values()) {
            if (language.tag.equalsIgnoreCase(tag) && language.names.contains(name)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * True for languages known to have no formatter, e.g. {@code pug} templates.
     */
    public static boolean isKnownUnsupported(Optional<String> lang) {
        return UNSUPPORTED.contains(normalize(lang));
    }

    private static String normalize(Optional<String> lang) {
        return lang.map(value -> value.strip().toLowerCase(Locale.ROOT).replaceFirst("^text/", ""))
                   .orElse("");
    }
}
