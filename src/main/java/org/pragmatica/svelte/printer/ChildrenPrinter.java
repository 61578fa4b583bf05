package org.pragmatica.svelte.printer;

import org.pragmatica.svelte.doc.Doc;
import org.pragmatica.svelte.doc.DocUtils;
import org.pragmatica.svelte.doc.Docs;
import org.pragmatica.svelte.tree.Node;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.svelte.doc.DocUtils.isLine;
import static org.pragmatica.svelte.doc.DocUtils.isLineDiscardedIfLonely;
import static org.pragmatica.svelte.printer.NodeClassifier.canBreakAfter;
import static org.pragmatica.svelte.printer.NodeClassifier.canBreakBefore;
import static org.pragmatica.svelte.printer.NodeClassifier.isEmptyNode;
import static org.pragmatica.svelte.printer.NodeClassifier.isIgnoreDirective;
import static org.pragmatica.svelte.printer.NodeClassifier.isInlineNode;

/**
 * Turns a list of sibling nodes into a list of documents.
 *
 * <p>Runs of inline siblings are printed as one {@link Doc.Fill}, so that a
 * block sibling breaking does not break running text. Between children a
 * soft line is added only where both sides allow a break; documents between two
 * legal break points are collapsed into one unit. A
 * {@code <!-- prettier-ignore -->} comment makes the directly following
 * sibling print as its original source.
 */
final class ChildrenPrinter {
    private ChildrenPrinter() {}

    /**
     * Callbacks into the node printer.
     */
    interface ChildPrinter {
        Doc print(NodePath path);

        /**
         * The node's original source, lines separated by literal lines.
         */
        Doc printVerbatim(Node node);

        /**
         * Nodes printed elsewhere and skipped among the children.
         */
        boolean isDetached(Node node);
    }

    static List<Doc> printChildren(NodePath parent, List<Node> children, ChildPrinter printer) {
        var output = new ChildDocs(parent.isPreformatted());
        var inlineDocs = new ArrayList<Doc>();
        var inlineNodes = new ArrayList<Node>();
        boolean ignoreNext = false;

        for (var child : children) {
            if (printer.isDetached(child)) {
                continue;
            }
            Doc doc;
            if (ignoreNext && !isEmptyNode(child)) {
                doc = printer.printVerbatim(child);
                ignoreNext = false;
            } else {
                doc = printer.print(parent.child(child));
            }
            if (isIgnoreDirective(child) && hasAdjacentSibling(children, child)) {
                ignoreNext = true;
            }

            if (isInlineNode(child)) {
                inlineDocs.add(doc);
                inlineNodes.add(child);
            } else {
                output.flush(inlineDocs, inlineNodes);
                output.add(isLine(doc) ? doc : Docs.concat(Docs.BREAK_PARENT, doc), List.of(child));
            }
        }
        output.flush(inlineDocs, inlineNodes);
        output.finish();
        return output.docs();
    }

    /**
     * Children indented, on their own lines when the enclosing group breaks.
     */
    static Doc printIndentedWithNewlines(NodePath parent, List<Node> children, ChildPrinter printer) {
        var docs = new ArrayList<Doc>();
        docs.add(Docs.SOFTLINE);
        docs.addAll(DocUtils.trim(printChildren(parent, children, printer), DocUtils::isLine));
        docs.add(Docs.dedent(Docs.SOFTLINE));
        return Docs.indent(Docs.concat(docs));
    }

    /**
     * Children indented without adding whitespace that is not in the source.
     */
    static Doc printIndentedPreservingWhitespace(NodePath parent, List<Node> children, ChildPrinter printer) {
        return Docs.indent(Docs.concat(DocUtils.dedentFinalLine(printChildren(parent, children, printer))));
    }

    private static boolean hasAdjacentSibling(List<Node> siblings, Node node) {
        return siblings.stream().anyMatch(sibling -> sibling.start() == node.end());
    }

    /**
     * Documents produced so far plus the position after which a break became
     * illegal.
     */
    private static final class ChildDocs {
        private final boolean preformatted;
        private List<Doc> docs = new ArrayList<>();
        private int lastBreakIndex = -1;

        private ChildDocs(boolean preformatted) {
            this.preformatted = preformatted;
        }

        List<Doc> docs() {
            return List.copyOf(docs);
        }

        void flush(List<Doc> inlineDocs, List<Node> inlineNodes) {
            if (inlineDocs.isEmpty()) {
                return;
            }
            var nodes = List.copyOf(inlineNodes);
            for (var doc : DocUtils.extractOutermostLines(inlineDocs)) {
                add(doc, nodes);
            }
            inlineDocs.clear();
            inlineNodes.clear();
        }

        void add(Doc doc, List<Node> fromNodes) {
            if (!preformatted) {
                var first = fromNodes.get(0);
                var last = fromNodes.get(fromNodes.size() - 1);
                if (canBreakBefore(first)) {
                    linebreakPossible();
                    if (!isLineDiscardedIfLonely(doc) && !docs.isEmpty() && !isLine(docs.get(docs.size() - 1))) {
                        docs.add(Docs.SOFTLINE);
                    }
                }
                if (lastBreakIndex < 0 && !canBreakAfter(last)) {
                    lastBreakIndex = docs.size();
                }
            }
            docs.add(doc);
        }

        /**
         * A break is always allowed after the last child.
         */
        void finish() {
            if (!preformatted) {
                linebreakPossible();
            }
        }

        private void linebreakPossible() {
            if (lastBreakIndex >= 0 && lastBreakIndex < docs.size() - 1) {
                docs = collapseFrom(docs, lastBreakIndex);
            }
            lastBreakIndex = -1;
        }

        private static List<Doc> collapseFrom(List<Doc> docs, int index) {
            var result = new ArrayList<>(docs.subList(0, index));
            result.add(Docs.concat(List.copyOf(docs.subList(index, docs.size()))));
            return result;
        }
    }
}
