package org.pragmatica.svelte;

/**
 * Formatter configuration options.
 *
 * @param printWidth           line width the printer tries to stay within
 * @param tabWidth             columns per indentation level
 * @param useTabs              indent with tabs instead of spaces
 * @param sortOrder            order of scripts, styles and markup in the output
 * @param strictMode           quote every attribute value, {@code name="{expr}"}, and
 *                             self-close only void elements
 * @param bracketNewLine       put the {@code >} of a broken start tag on its own line
 * @param allowShorthand       print {@code name={name}} as {@code {name}}
 * @param indentScriptAndStyle indent the bodies of script and style regions
 */
public record FormatOptions(
    int printWidth,
    int tabWidth,
    boolean useTabs,
    SortOrder sortOrder,
    boolean strictMode,
    boolean bracketNewLine,
    boolean allowShorthand,
    boolean indentScriptAndStyle
) {
    public static final FormatOptions DEFAULT = new FormatOptions(
        80,
        2,
        false,
        SortOrder.SCRIPTS_STYLES_MARKUP,
        false,
        false,
        true,
        true
    );

    public FormatOptions {
        if (printWidth < 1) {
            throw new IllegalArgumentException("printWidth must be positive, got " + printWidth);
        }
        if (tabWidth < 0) {
            throw new IllegalArgumentException("tabWidth must not be negative, got " + tabWidth);
        }
        if (sortOrder == null) {
            throw new IllegalArgumentException("sortOrder is required");
        }
    }

    public FormatOptions withPrintWidth(int value) {
        return new FormatOptions(value, tabWidth, useTabs, sortOrder, strictMode, bracketNewLine, allowShorthand,
                                 indentScriptAndStyle);
    }

    public FormatOptions withTabWidth(int value) {
        return new FormatOptions(printWidth, value, useTabs, sortOrder, strictMode, bracketNewLine, allowShorthand,
                                 indentScriptAndStyle);
    }

    public FormatOptions withUseTabs(boolean value) {
        return new FormatOptions(printWidth, tabWidth, value, sortOrder, strictMode, bracketNewLine, allowShorthand,
                                 indentScriptAndStyle);
    }

    public FormatOptions withSortOrder(SortOrder value) {
        return new FormatOptions(printWidth, tabWidth, useTabs, value, strictMode, bracketNewLine, allowShorthand,
                                 indentScriptAndStyle);
    }

    public FormatOptions withStrictMode(boolean value) {
        return new FormatOptions(printWidth, tabWidth, useTabs, sortOrder, value, bracketNewLine, allowShorthand,
                                 indentScriptAndStyle);
    }

    public FormatOptions withBracketNewLine(boolean value) {
        return new FormatOptions(printWidth, tabWidth, useTabs, sortOrder, strictMode, value, allowShorthand,
                                 indentScriptAndStyle);
    }

    public FormatOptions withAllowShorthand(boolean value) {
        return new FormatOptions(printWidth, tabWidth, useTabs, sortOrder, strictMode, bracketNewLine, value,
                                 indentScriptAndStyle);
    }

    public FormatOptions withIndentScriptAndStyle(boolean value) {
        return new FormatOptions(printWidth, tabWidth, useTabs, sortOrder, strictMode, bracketNewLine, allowShorthand,
                                 value);
    }
}
