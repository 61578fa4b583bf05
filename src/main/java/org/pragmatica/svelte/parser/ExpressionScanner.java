package org.pragmatica.svelte.parser;

import java.util.ArrayDeque;
import java.util.function.IntPredicate;

/**
 * Finds positions in script code that are outside of brackets, string and
 * template literals and comments.
 */
final class ExpressionScanner {
    private ExpressionScanner() {}

    private static final char TEMPLATE = '`';
    private static final char TEMPLATE_EXPRESSION = '$';

    /**
     * Index of the first top-level position at or after {@code from} accepted by
     * {@code stop}, or -1. An unbalanced closing bracket also stops the scan.
     */
    static int scan(String text, int from, IntPredicate stop) {
        var stack = new ArrayDeque<Character>();
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';

            if (!stack.isEmpty() && stack.peek() == TEMPLATE) {
                if (c == '\\') {
                    i += 2;
                } else if (c == '`') {
                    stack.pop();
                    i++;
                } else if (c == '$' && next == '{') {
                    stack.push(TEMPLATE_EXPRESSION);
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                i = skipString(text, i, c);
                continue;
            }
            if (c == '/' && next == '/') {
                int newline = text.indexOf('\n', i);
                i = newline < 0 ? text.length() : newline;
                continue;
            }
            if (c == '/' && next == '*') {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? text.length() : close + 2;
                continue;
            }
            if (stack.isEmpty() && stop.test(i)) {
                return i;
            }
            switch (c) {
                case '`' -> stack.push(TEMPLATE);
                case '(', '[', '{' -> stack.push(c);
                case ')', ']', '}' -> {
                    if (stack.isEmpty()) {
                        return i;
                    }
                    stack.pop();
                }
                default -> {
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Index of the top-level character {@code c}, or -1.
     */
    static int indexOf(String text, int from, char c) {
        int index = scan(text, from, i -> text.charAt(i) == c);
        return index >= 0 && text.charAt(index) == c ? index : -1;
    }

    /**
     * Index of a top-level keyword surrounded by whitespace, or -1.
     */
    static int keywordIndex(String text, int from, String keyword) {
        int index = scan(text, from, i -> isKeywordAt(text, i, keyword));
        return index >= 0 && isKeywordAt(text, index, keyword) ? index : -1;
    }

    private static boolean isKeywordAt(String text, int i, String keyword) {
        int end = i + keyword.length();
        return i > 0
               && text.startsWith(keyword, i)
               && Character.isWhitespace(text.charAt(i - 1))
               && (end == text.length() || Character.isWhitespace(text.charAt(end)));
    }

    private static int skipString(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote || c == '\n') {
                return i + 1;
            }
            i++;
        }
        return text.length();
    }
}
