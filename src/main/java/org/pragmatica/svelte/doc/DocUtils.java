package org.pragmatica.svelte.doc;

import org.pragmatica.svelte.doc.Doc.Concat;
import org.pragmatica.svelte.doc.Doc.Dedent;
import org.pragmatica.svelte.doc.Doc.Fill;
import org.pragmatica.svelte.doc.Doc.Group;
import org.pragmatica.svelte.doc.Doc.Indent;
import org.pragmatica.svelte.doc.Doc.Line;
import org.pragmatica.svelte.doc.Doc.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Queries and pure rewrites over document sequences.
 *
 * <p>Trimming looks through nesting: when the first (or last) element of a
 * sequence is a {@link Concat} or {@link Fill}, its parts are trimmed instead
 * and the container is rebuilt. Inputs are never modified.
 */
public final class DocUtils {
    private DocUtils() {}

    /**
     * Result of a trim: the remaining documents and the removed ones, in order.
     */
    public record Trimmed(List<Doc> docs, List<Doc> removed) {
        public boolean changed() {
            return !removed.isEmpty();
        }
    }

    public static boolean isLine(Doc doc) {
        return doc instanceof Line;
    }

    public static boolean isLineDiscardedIfLonely(Doc doc) {
        return doc instanceof Line line && !line.keepIfLonely();
    }

    /**
     * True when the document renders nothing but empty text, possibly nested.
     * Lines count as empty unless they are kept when lonely.
     */
    public static boolean isEmpty(Doc doc) {
        if (doc instanceof Text text) {
            return text.text().isEmpty();
        }
        if (doc instanceof Line line) {
            return !line.keepIfLonely();
        }
        if (doc instanceof Group group) {
            return isEmpty(group.contents());
        }
        if (doc instanceof Indent indent) {
            return isEmpty(indent.contents());
        }
        if (doc instanceof Dedent dedent) {
            return isEmpty(dedent.contents());
        }
        if (doc instanceof Concat concat) {
            return isEmptyGroup(concat.parts());
        }
        if (doc instanceof Fill fill) {
            return isEmptyGroup(fill.parts());
        }
        return false;
    }

    public static boolean isEmptyGroup(List<Doc> docs) {
        return docs.stream().allMatch(DocUtils::isEmpty);
    }

    /**
     * Remove leading documents matching {@code isWhitespace}.
     */
    public static Trimmed trimLeft(List<Doc> docs, Predicate<Doc> isWhitespace) {
        if (docs.isEmpty()) {
            return unchanged(docs);
        }
        int first = 0;
        while (first < docs.size() && isWhitespace.test(docs.get(first))) {
            first++;
        }
        if (first > 0) {
            return new Trimmed(List.copyOf(docs.subList(first, docs.size())), List.copyOf(docs.subList(0, first)));
        }
        return parts(docs.get(0))
            .map(parts -> trimLeft(parts, isWhitespace))
            .filter(Trimmed::changed)
            .map(inner -> new Trimmed(replace(docs, 0, withParts(docs.get(0), inner.docs())), inner.removed()))
            .orElseGet(() -> unchanged(docs));
    }

    /**
     * Remove trailing documents matching {@code isWhitespace}.
     */
    public static Trimmed trimRight(List<Doc> docs, Predicate<Doc> isWhitespace) {
        if (docs.isEmpty()) {
            return unchanged(docs);
        }
        int last = docs.size() - 1;
        while (last >= 0 && isWhitespace.test(docs.get(last))) {
            last--;
        }
        if (last < docs.size() - 1) {
            return new Trimmed(List.copyOf(docs.subList(0, last + 1)), List.copyOf(docs.subList(last + 1, docs.size())));
        }
        int lastIndex = docs.size() - 1;
        return parts(docs.get(lastIndex))
            .map(parts -> trimRight(parts, isWhitespace))
            .filter(Trimmed::changed)
            .map(inner -> new Trimmed(replace(docs, lastIndex, withParts(docs.get(lastIndex), inner.docs())),
                                      inner.removed()))
            .orElseGet(() -> unchanged(docs));
    }

    /**
     * Remove both leading and trailing documents matching {@code isWhitespace}.
     */
    public static List<Doc> trim(List<Doc> docs, Predicate<Doc> isWhitespace) {
        return trimRight(trimLeft(docs, isWhitespace).docs(), isWhitespace).docs();
    }

    /**
     * Pull leading and trailing lines, however deeply nested, to the top level
     * and wrap the rest in a {@link Fill}.
     */
    public static List<Doc> extractOutermostLines(List<Doc> docs) {
        var leading = trimLeft(docs, DocUtils::isLine);
        var trailing = trimRight(leading.docs(), DocUtils::isLine);
        var result = new ArrayList<>(leading.removed());
        if (!isEmptyGroup(trailing.docs())) {
            result.add(Docs.fill(trailing.docs()));
        }
        result.addAll(trailing.removed());
        return result;
    }

    /**
     * Move a trailing line out of the sequence into a {@link Dedent}, so the
     * closing tag after it lands at the parent's indentation.
     */
    public static List<Doc> dedentFinalLine(List<Doc> docs) {
        var trimmed = trimRight(docs, DocUtils::isLine);
        if (!trimmed.changed()) {
            return docs;
        }
        var result = new ArrayList<>(trimmed.docs());
        result.add(Docs.dedent(trimmed.removed().get(trimmed.removed().size() - 1)));
        return result;
    }

    private static Optional<List<Doc>> parts(Doc doc) {
        if (doc instanceof Concat concat) {
            return Optional.of(concat.parts());
        }
        if (doc instanceof Fill fill) {
            return Optional.of(fill.parts());
        }
        return Optional.empty();
    }

    private static Doc withParts(Doc container, List<Doc> parts) {
        return container instanceof Fill ? new Fill(parts) : new Concat(parts);
    }

    private static List<Doc> replace(List<Doc> docs, int index, Doc doc) {
        var result = new ArrayList<>(docs);
        result.set(index, doc);
        return List.copyOf(result);
    }

    private static Trimmed unchanged(List<Doc> docs) {
        return new Trimmed(docs, List.of());
    }
}
