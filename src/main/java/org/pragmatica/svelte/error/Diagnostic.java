package org.pragmatica.svelte.error;

import org.pragmatica.svelte.tree.SourceLocation;

import java.util.List;

/**
 * Rust-style rendering of a {@link FormatError} against the source it refers to.
 *
 * <p>Example output:
 * <pre>
 * error: Expected '&lt;/div&gt;'
 *   --> App.svelte:3:1
 *    |
 *  3 | &lt;/span&gt;
 *    | ^ found '&lt;/span&gt;'
 *    |
 * </pre>
 *
 * @param message  primary message
 * @param location position the caret points at
 * @param label    text printed after the caret, may be empty
 * @param notes    trailing notes
 */
public record Diagnostic(String message, SourceLocation location, String label, List<String> notes) {

    /**
     * Build a diagnostic for an error, locating it in {@code source}.
     */
    public static Diagnostic of(FormatError error, String source) {
        return of(error, source, error.location().offset());
    }

    /**
     * Build a diagnostic for an error whose position in {@code source} is
     * {@code offset}, e.g. an error found in preprocessed text and mapped back
     * to what the user wrote.
     */
    public static Diagnostic of(FormatError error, String source, int offset) {
        var location = SourceLocation.of(source, Math.min(offset, source.length()));
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return new Diagnostic("expected " + unexpected.expected(),
                                  location,
                                  "found '" + unexpected.found() + "'",
                                  List.of());
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return new Diagnostic("unexpected end of input", location, "expected " + eof.expected(), List.of());
        }
        if (error instanceof ParseError.SemanticError semantic) {
            return new Diagnostic(semantic.reason(), location, "", List.of());
        }
        var embedded = (FormatError.EmbeddedContentError) error;
        return new Diagnostic(embedded.reason(),
                              location,
                              "in <" + embedded.tag() + ">",
                              List.of("help: the formatted content must not contain </" + embedded.tag() + ">"));
    }

    /**
     * Format this diagnostic.
     *
     * @param source   the source text
     * @param filename file name for the location line, may be null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        int lineNumber = location.line();
        int gutterWidth = String.valueOf(lineNumber).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append("error: ").append(message).append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(location.line()).append(":").append(location.column()).append("\n");
        sb.append(gutter).append("|\n");

        if (lineNumber <= lines.length) {
            sb.append(String.format("%" + gutterWidth + "d", lineNumber))
              .append(" | ")
              .append(lines[lineNumber - 1])
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(location.column() - 1))
              .append("^");
            if (!label.isEmpty()) {
                sb.append(" ").append(label);
            }
            sb.append("\n");
        }

        sb.append(gutter).append("|\n");
        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        return String.format("%s:%d:%d: error: %s", filename, location.line(), location.column(), message);
    }
}
