package org.pragmatica.svelte.printer;

import org.pragmatica.svelte.tree.ElementKind;
import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.Node.AwaitBlock;
import org.pragmatica.svelte.tree.Node.Comment;
import org.pragmatica.svelte.tree.Node.DebugTag;
import org.pragmatica.svelte.tree.Node.EachBlock;
import org.pragmatica.svelte.tree.Node.Element;
import org.pragmatica.svelte.tree.Node.IfBlock;
import org.pragmatica.svelte.tree.Node.MustacheTag;
import org.pragmatica.svelte.tree.Node.RawMustacheTag;
import org.pragmatica.svelte.tree.Node.Text;

import java.util.Set;

/**
 * Inline/block classification of nodes and the break rules derived from it.
 */
final class NodeClassifier {
    private NodeClassifier() {}

    static final String IGNORE_DIRECTIVE = "prettier-ignore";

    // https://developer.mozilla.org/en-US/docs/Web/HTML/Inline_elements#Elements
    private static final Set<String> INLINE_ELEMENTS = Set.of(
        "a", "abbr", "audio", "b", "bdi", "bdo", "br", "button", "canvas", "cite",
        "code", "data", "datalist", "del", "dfn", "em", "embed", "i", "iframe", "img",
        "input", "ins", "kbd", "label", "map", "mark", "meter", "noscript", "object", "output",
        "picture", "progress", "q", "ruby", "s", "samp", "select", "slot", "small", "span",
        "strong", "sub", "sup", "svg", "template", "textarea", "time", "u", "var", "video",
        "wbr");

    static boolean isInlineElement(Node node) {
        return node instanceof Element element
               && element.kind() == ElementKind.ELEMENT
               && INLINE_ELEMENTS.contains(element.name());
    }

    /**
     * Inline nodes are batched with their inline neighbours into one fill.
     */
    static boolean isInlineNode(Node node) {
        if (node instanceof Text text) {
            return !text.isBlank() || text.raw().isEmpty();
        }
        return node instanceof MustacheTag
               || node instanceof RawMustacheTag
               || node instanceof DebugTag
               || node instanceof IfBlock
               || node instanceof EachBlock
               || node instanceof AwaitBlock
               || isInlineElement(node);
    }

    static boolean canBreakBefore(Node node) {
        if (node instanceof Text text) {
            return !text.raw().isEmpty() && isWhitespace(text.raw().charAt(0));
        }
        if (node instanceof Element element && element.kind() == ElementKind.ELEMENT) {
            return !isInlineElement(node);
        }
        return true;
    }

    static boolean canBreakAfter(Node node) {
        if (node instanceof Text text) {
            return !text.raw().isEmpty() && isWhitespace(text.raw().charAt(text.raw().length() - 1));
        }
        if (node instanceof Element element && element.kind() == ElementKind.ELEMENT) {
            return !isInlineElement(node);
        }
        return true;
    }

    static boolean isEmptyNode(Node node) {
        return node instanceof Text text && text.isBlank();
    }

    static boolean isIgnoreDirective(Node node) {
        return node instanceof Comment comment && comment.data().strip().equals(IGNORE_DIRECTIVE);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }
}
