package org.pragmatica.svelte.embed;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of formatters per {@link EmbeddedLanguage}. Languages without an
 * explicit formatter fall back to the default one.
 */
public final class EmbeddedFormatters {

    private final Map<EmbeddedLanguage, EmbeddedFormatter> formatters;
    private final EmbeddedFormatter fallback;

    private EmbeddedFormatters(Map<EmbeddedLanguage, EmbeddedFormatter> formatters, EmbeddedFormatter fallback) {
        this.formatters = formatters;
        this.fallback = fallback;
    }

    /**
     * Every supported language handled by {@link ReindentFormatter}.
     */
    public static EmbeddedFormatters defaults(int tabWidth) {
        return builder().fallback(ReindentFormatter.reindentFormatter(tabWidth)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public EmbeddedFormatter formatterFor(EmbeddedLanguage language) {
        return Optional.ofNullable(formatters.get(language)).orElse(fallback);
    }

    public static final class Builder {
        private final Map<EmbeddedLanguage, EmbeddedFormatter> formatters = new EnumMap<>(EmbeddedLanguage.class);
        private EmbeddedFormatter fallback = ReindentFormatter.reindentFormatter(2);

        private Builder() {}

        public Builder register(EmbeddedLanguage language, EmbeddedFormatter formatter) {
            formatters.put(language, formatter);
            return this;
        }

        public Builder fallback(EmbeddedFormatter formatter) {
            this.fallback = formatter;
            return this;
        }

        public EmbeddedFormatters build() {
            return new EmbeddedFormatters(Map.copyOf(formatters), fallback);
        }
    }
}
