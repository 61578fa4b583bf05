package org.pragmatica.svelte.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.svelte.tree.ElementKind;
import org.pragmatica.svelte.tree.Expression;
import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.SourceLocation;
import org.pragmatica.svelte.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NodeClassifierTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    private static Node text(String raw) {
        return new Node.Text(SPAN, raw);
    }

    private static Node element(ElementKind kind, String name) {
        return new Node.Element(SPAN, kind, name, List.of(), List.of(), Optional.empty());
    }

    private static Node mustache() {
        return new Node.MustacheTag(SPAN, Expression.of(SPAN, "value"));
    }

    // === Inline classification ===

    @Test
    void isInlineElement_knownInlineTag_true() {
        assertTrue(NodeClassifier.isInlineElement(element(ElementKind.ELEMENT, "span")));
        assertTrue(NodeClassifier.isInlineElement(element(ElementKind.ELEMENT, "button")));
    }

    @Test
    void isInlineElement_blockTagOrComponent_false() {
        assertFalse(NodeClassifier.isInlineElement(element(ElementKind.ELEMENT, "div")));
        assertFalse(NodeClassifier.isInlineElement(element(ElementKind.INLINE_COMPONENT, "Span")));
        assertFalse(NodeClassifier.isInlineElement(element(ElementKind.TITLE, "title")));
    }

    @Test
    void isInlineNode_textAndTags() {
        assertTrue(NodeClassifier.isInlineNode(text("hello")));
        assertTrue(NodeClassifier.isInlineNode(text("")));
        assertFalse(NodeClassifier.isInlineNode(text(" \n ")));
        assertTrue(NodeClassifier.isInlineNode(mustache()));
        assertTrue(NodeClassifier.isInlineNode(new Node.DebugTag(SPAN, List.of(Expression.of(SPAN, "a")))));
        assertFalse(NodeClassifier.isInlineNode(element(ElementKind.ELEMENT, "p")));
        assertFalse(NodeClassifier.isInlineNode(new Node.Comment(SPAN, " note ")));
    }

    // === Break rules ===

    @Test
    void canBreakBefore_textDependsOnLeadingWhitespace() {
        assertTrue(NodeClassifier.canBreakBefore(text(" word")));
        assertTrue(NodeClassifier.canBreakBefore(text("\nword")));
        assertFalse(NodeClassifier.canBreakBefore(text("word ")));
        assertFalse(NodeClassifier.canBreakBefore(text("")));
    }

    @Test
    void canBreakAfter_textDependsOnTrailingWhitespace() {
        assertTrue(NodeClassifier.canBreakAfter(text("word ")));
        assertFalse(NodeClassifier.canBreakAfter(text(" word")));
    }

    @Test
    void canBreak_inlineElementsNeverBreak_blockAndTagsAlwaysDo() {
        var span = element(ElementKind.ELEMENT, "span");
        var div = element(ElementKind.ELEMENT, "div");

        assertFalse(NodeClassifier.canBreakBefore(span));
        assertFalse(NodeClassifier.canBreakAfter(span));
        assertTrue(NodeClassifier.canBreakBefore(div));
        assertTrue(NodeClassifier.canBreakAfter(div));
        assertTrue(NodeClassifier.canBreakBefore(mustache()));
        assertTrue(NodeClassifier.canBreakAfter(element(ElementKind.INLINE_COMPONENT, "Widget")));
    }

    // === Misc predicates ===

    @Test
    void isEmptyNode_onlyBlankText() {
        assertTrue(NodeClassifier.isEmptyNode(text("  ")));
        assertFalse(NodeClassifier.isEmptyNode(text("x")));
        assertFalse(NodeClassifier.isEmptyNode(mustache()));
    }

    @Test
    void isIgnoreDirective_matchesTrimmedCommentData() {
        assertTrue(NodeClassifier.isIgnoreDirective(new Node.Comment(SPAN, " prettier-ignore ")));
        assertTrue(NodeClassifier.isIgnoreDirective(new Node.Comment(SPAN, "prettier-ignore")));
        assertFalse(NodeClassifier.isIgnoreDirective(new Node.Comment(SPAN, " prettier-ignore-next ")));
        assertFalse(NodeClassifier.isIgnoreDirective(text("prettier-ignore")));
    }
}
