package org.pragmatica.svelte;

import java.util.List;
import java.util.Locale;

/**
 * Order in which the top-level sections of a component are printed.
 */
public enum SortOrder {
    SCRIPTS_STYLES_MARKUP(Section.SCRIPTS, Section.STYLES, Section.MARKUP),
    SCRIPTS_MARKUP_STYLES(Section.SCRIPTS, Section.MARKUP, Section.STYLES),
    MARKUP_STYLES_SCRIPTS(Section.MARKUP, Section.STYLES, Section.SCRIPTS),
    MARKUP_SCRIPTS_STYLES(Section.MARKUP, Section.SCRIPTS, Section.STYLES),
    STYLES_MARKUP_SCRIPTS(Section.STYLES, Section.MARKUP, Section.SCRIPTS),
    STYLES_SCRIPTS_MARKUP(Section.STYLES, Section.SCRIPTS, Section.MARKUP);

    public enum Section {
        SCRIPTS,
        STYLES,
        MARKUP
    }

    private final List<Section> sections;

    SortOrder(Section... sections) {
        this.sections = List.of(sections);
    }

    public List<Section> sections() {
        return sections;
    }

    /**
     * Parse the dashed form used on the command line, e.g. {@code scripts-styles-markup}.
     */
    public static SortOrder parse(String value) {
        return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return name().replace('_', '-').toLowerCase(Locale.ROOT);
    }
}
