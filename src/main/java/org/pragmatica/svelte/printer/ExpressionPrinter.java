package org.pragmatica.svelte.printer;

import org.pragmatica.svelte.doc.Doc;
import org.pragmatica.svelte.doc.Docs;
import org.pragmatica.svelte.tree.Expression;

/**
 * Prints embedded script expressions. The markup printer never looks inside an
 * {@link Expression}; plugging in a real script formatter happens here.
 */
@FunctionalInterface
public interface ExpressionPrinter {

    Doc print(Expression expression);

    /**
     * Source text without surrounding whitespace; continuation lines are kept
     * exactly as written.
     */
    static ExpressionPrinter verbatim() {
        return expression -> Docs.literalLines(expression.code());
    }
}
