package org.pragmatica.svelte.tree;

import java.util.regex.Pattern;

/**
 * Embedded script code, kept as raw text.
 *
 * <p>Expressions are opaque to the markup printer: they are rendered by an
 * {@code ExpressionPrinter}, never by the node rules.
 */
public record Expression(SourceSpan span, String text) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    public static Expression of(SourceSpan span, String text) {
        return new Expression(span, text);
    }

    /**
     * Source text without surrounding whitespace.
     */
    public String code() {
        return text.strip();
    }

    public boolean isIdentifier() {
        return IDENTIFIER.matcher(code()).matches();
    }

    /**
     * True when this expression is a bare identifier with the given name.
     */
    public boolean isIdentifier(String name) {
        return isIdentifier() && code().equals(name);
    }
}
