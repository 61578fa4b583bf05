package org.pragmatica.svelte;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class FormatOptionsTest {

    @Test
    void default_values() {
        var options = FormatOptions.DEFAULT;

        assertEquals(80, options.printWidth());
        assertEquals(2, options.tabWidth());
        assertFalse(options.useTabs());
        assertEquals(SortOrder.SCRIPTS_STYLES_MARKUP, options.sortOrder());
        assertFalse(options.strictMode());
        assertFalse(options.bracketNewLine());
        assertTrue(options.allowShorthand());
        assertTrue(options.indentScriptAndStyle());
    }

    @Test
    void withers_changeOnlyTheirField() {
        var options = FormatOptions.DEFAULT.withPrintWidth(100)
                                           .withUseTabs(true)
                                           .withStrictMode(true);

        assertEquals(100, options.printWidth());
        assertTrue(options.useTabs());
        assertTrue(options.strictMode());
        assertEquals(FormatOptions.DEFAULT.tabWidth(), options.tabWidth());
        assertEquals(FormatOptions.DEFAULT.sortOrder(), options.sortOrder());
        assertThat(FormatOptions.DEFAULT.printWidth()).isEqualTo(80);
    }

    @Test
    void constructor_rejectsNonPositiveWidth() {
        assertThatThrownBy(() -> FormatOptions.DEFAULT.withPrintWidth(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("printWidth");
    }

    @Test
    void constructor_rejectsNegativeTabWidth() {
        assertThatThrownBy(() -> FormatOptions.DEFAULT.withTabWidth(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tabWidth");
    }

    @Test
    void constructor_requiresSortOrder() {
        assertThrows(IllegalArgumentException.class, () -> FormatOptions.DEFAULT.withSortOrder(null));
    }
}
