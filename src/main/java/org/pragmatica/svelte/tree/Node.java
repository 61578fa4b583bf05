package org.pragmatica.svelte.tree;

import java.util.List;
import java.util.Optional;

/**
 * Syntax tree of a component's markup.
 *
 * <p>Nodes are immutable and never modified after parsing. Every kind is handled
 * through {@link NodeVisitor}, so a kind without a printing rule does not compile.
 */
public sealed interface Node {

    SourceSpan span();

    <R, C> R accept(NodeVisitor<R, C> visitor, C context);

    default int start() {
        return span().start().offset();
    }

    default int end() {
        return span().end().offset();
    }

    /**
     * Node holding an ordered list of child nodes.
     */
    sealed interface Parent extends Node {
        List<Node> children();
    }

    // === Markup ===

    record Fragment(SourceSpan span, List<Node> children) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitFragment(this, context);
        }
    }

    /**
     * Any tag-like node. {@code expression} holds the {@code this} of
     * {@code <svelte:component>}.
     */
    record Element(SourceSpan span,
                   ElementKind kind,
                   String name,
                   List<Node> attributes,
                   List<Node> children,
                   Optional<Expression> expression) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitElement(this, context);
        }
    }

    record Text(SourceSpan span, String raw) implements Node {
        /**
         * True for text consisting only of whitespace.
         */
        public boolean isBlank() {
            return raw.isBlank();
        }

        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitText(this, context);
        }
    }

    record Comment(SourceSpan span, String data) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitComment(this, context);
        }
    }

    // === Expression tags ===

    record MustacheTag(SourceSpan span, Expression expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitMustacheTag(this, context);
        }
    }

    record RawMustacheTag(SourceSpan span, Expression expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitRawMustacheTag(this, context);
        }
    }

    record DebugTag(SourceSpan span, List<Expression> identifiers) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitDebugTag(this, context);
        }
    }

    // === Logic blocks ===

    /**
     * {@code elseIf} marks an if-block opened by {@code {:else if ...}}; such a
     * block is always the sole child of an {@link ElseBlock}.
     */
    record IfBlock(SourceSpan span,
                   Expression expression,
                   List<Node> children,
                   Optional<ElseBlock> elseBlock,
                   boolean elseIf) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitIfBlock(this, context);
        }
    }

    record ElseBlock(SourceSpan span, List<Node> children) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitElseBlock(this, context);
        }
    }

    record EachBlock(SourceSpan span,
                     Expression expression,
                     Expression context,
                     Optional<String> index,
                     Optional<Expression> key,
                     List<Node> children,
                     Optional<ElseBlock> elseBlock) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitEachBlock(this, context);
        }
    }

    record AwaitBlock(SourceSpan span,
                      Expression expression,
                      Optional<Expression> value,
                      Optional<Expression> error,
                      PendingBlock pending,
                      ThenBlock then,
                      CatchBlock catchBlock) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitAwaitBlock(this, context);
        }
    }

    record PendingBlock(SourceSpan span, List<Node> children) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitPendingBlock(this, context);
        }
    }

    record ThenBlock(SourceSpan span, List<Node> children) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitThenBlock(this, context);
        }
    }

    record CatchBlock(SourceSpan span, List<Node> children) implements Parent {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitCatchBlock(this, context);
        }
    }

    // === Attributes and directives ===

    /**
     * Plain attribute. An empty {@code value} is a boolean attribute; otherwise
     * the value is a sequence of {@link Text}, {@link MustacheTag} and
     * {@link AttributeShorthand} nodes (quotes not included).
     */
    record Attribute(SourceSpan span, String name, Optional<List<Node>> value) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitAttribute(this, context);
        }
    }

    /**
     * Value of an attribute written as {@code {name}}.
     */
    record AttributeShorthand(SourceSpan span, Expression expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitAttributeShorthand(this, context);
        }
    }

    record Spread(SourceSpan span, Expression expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitSpread(this, context);
        }
    }

    record EventHandler(SourceSpan span,
                        String name,
                        List<String> modifiers,
                        Optional<Expression> expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitEventHandler(this, context);
        }
    }

    record Binding(SourceSpan span, String name, Expression expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitBinding(this, context);
        }
    }

    record ClassDirective(SourceSpan span, String name, Expression expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitClassDirective(this, context);
        }
    }

    record LetDirective(SourceSpan span, String name, Optional<Expression> expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitLetDirective(this, context);
        }
    }

    record RefDirective(SourceSpan span, String name) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitRefDirective(this, context);
        }
    }

    record Transition(SourceSpan span,
                      String name,
                      boolean intro,
                      boolean outro,
                      List<String> modifiers,
                      Optional<Expression> expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitTransition(this, context);
        }
    }

    record Action(SourceSpan span, String name, Optional<Expression> expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitAction(this, context);
        }
    }

    record Animation(SourceSpan span, String name, Optional<Expression> expression) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitAnimation(this, context);
        }
    }

    // === Hoisted top-level regions ===

    record Script(SourceSpan span, ScriptContext context) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitScript(this, context);
        }
    }

    record Style(SourceSpan span) implements Node {
        @Override
        public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
            return visitor.visitStyle(this, context);
        }
    }
}
