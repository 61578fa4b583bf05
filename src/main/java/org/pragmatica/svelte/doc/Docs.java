package org.pragmatica.svelte.doc;

import org.pragmatica.svelte.doc.Doc.BreakParent;
import org.pragmatica.svelte.doc.Doc.Concat;
import org.pragmatica.svelte.doc.Doc.Dedent;
import org.pragmatica.svelte.doc.Doc.Fill;
import org.pragmatica.svelte.doc.Doc.Group;
import org.pragmatica.svelte.doc.Doc.Indent;
import org.pragmatica.svelte.doc.Doc.Line;
import org.pragmatica.svelte.doc.Doc.LineKind;
import org.pragmatica.svelte.doc.Doc.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for {@link Doc} values.
 */
public final class Docs {
    private Docs() {}

    public static final Doc EMPTY = new Text("");
    public static final Doc BREAK_PARENT = new BreakParent();
    public static final Doc LINE = new Line(LineKind.NORMAL, false);
    public static final Doc SOFTLINE = new Line(LineKind.SOFT, false);
    public static final Doc HARDLINE = new Concat(List.of(new Line(LineKind.HARD, false), BREAK_PARENT));
    public static final Doc LITERALLINE = new Concat(List.of(new Line(LineKind.LITERAL, false), BREAK_PARENT));

    /**
     * Hard line preserved as a blank-line separator; carries no break-parent.
     */
    public static final Doc KEEP_IF_LONELY_LINE = new Line(LineKind.HARD, true);

    public static Doc text(String text) {
        return new Text(text);
    }

    public static Doc line(boolean keepIfLonely) {
        return new Line(LineKind.NORMAL, keepIfLonely);
    }

    public static Doc concat(Doc... parts) {
        return new Concat(List.of(parts));
    }

    public static Doc concat(List<Doc> parts) {
        return new Concat(parts);
    }

    public static Doc group(Doc contents) {
        return new Group(contents, false);
    }

    public static Doc group(Doc... parts) {
        return new Group(concat(parts), false);
    }

    public static Doc indent(Doc contents) {
        return new Indent(contents);
    }

    public static Doc dedent(Doc contents) {
        return new Dedent(contents);
    }

    public static Doc fill(List<Doc> parts) {
        return new Fill(parts);
    }

    /**
     * Interleave {@code separator} between {@code docs}.
     */
    public static Doc join(Doc separator, List<Doc> docs) {
        var parts = new ArrayList<Doc>(docs.size() * 2);
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(docs.get(i));
        }
        return new Concat(parts);
    }

    /**
     * Text whose lines are separated by literal lines, so that re-indentation
     * never touches them.
     */
    public static Doc literalLines(String text) {
        var lines = text.split("\n", -1);
        var docs = new ArrayList<Doc>(lines.length);
        for (var line : lines) {
            docs.add(new Text(line));
        }
        return join(LITERALLINE, docs);
    }
}
