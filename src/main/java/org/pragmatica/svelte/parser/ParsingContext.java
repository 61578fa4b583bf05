package org.pragmatica.svelte.parser;

import org.pragmatica.svelte.error.FormatException;
import org.pragmatica.svelte.error.ParseError;
import org.pragmatica.svelte.tree.SourceLocation;
import org.pragmatica.svelte.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Mutable cursor over the input that tracks line and column while parsing.
 */
public final class ParsingContext {

    private final String input;
    private final int[] lineStarts;

    private int pos;
    private int line;
    private int column;

    private ParsingContext(String input) {
        this.input = input;
        this.lineStarts = lineStarts(input);
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static ParsingContext create(String input) {
        return new ParsingContext(input);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    /**
     * Location of an arbitrary offset of the input.
     */
    public SourceLocation locationAt(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        return SourceLocation.at(lineIndex + 1, offset - lineStarts[lineIndex] + 1, offset);
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }

    public SourceSpan span(int startOffset, int endOffset) {
        return SourceSpan.of(locationAt(startOffset), locationAt(endOffset));
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public String input() {
        return input;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    /**
     * Character at {@code offset} from the cursor, {@code '\0'} past the end.
     */
    public char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * Move the cursor forward to {@code offset}.
     */
    public void advanceTo(int offset) {
        while (pos < offset) {
            advance();
        }
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // === Matching ===

    public boolean startsWith(String text) {
        return input.startsWith(text, pos);
    }

    /**
     * Consume {@code text} when the input continues with it.
     */
    public boolean match(String text) {
        if (!startsWith(text)) {
            return false;
        }
        advanceTo(pos + text.length());
        return true;
    }

    public void expect(String text) {
        if (!match(text)) {
            throw unexpected("'" + text + "'");
        }
    }

    public String readWhile(IntPredicate predicate) {
        int start = pos;
        while (!isAtEnd() && predicate.test(peek())) {
            advance();
        }
        return input.substring(start, pos);
    }

    public boolean skipWhitespace() {
        return !readWhile(Character::isWhitespace).isEmpty();
    }

    // === Errors ===

    /**
     * Error for input that does not continue with {@code expected}.
     */
    public FormatException unexpected(String expected) {
        if (isAtEnd()) {
            return new FormatException(new ParseError.UnexpectedEof(location(), expected));
        }
        return new FormatException(new ParseError.UnexpectedInput(location(), foundToken(), expected));
    }

    public FormatException semanticError(SourceLocation location, String reason) {
        return new FormatException(new ParseError.SemanticError(location, reason));
    }

    private String foundToken() {
        int end = pos + 1;
        while (end < input.length() && end - pos < 20 && !Character.isWhitespace(input.charAt(end))
               && input.charAt(end - 1) != '>' && input.charAt(end - 1) != '}') {
            end++;
        }
        return input.substring(pos, end);
    }

    private static int[] lineStarts(String input) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
