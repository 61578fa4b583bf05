package org.pragmatica.svelte.tree;

import org.pragmatica.svelte.tree.Node.*;

/**
 * One method per node kind.
 *
 * @param <R> result of visiting a node
 * @param <C> context passed down the traversal
 */
public interface NodeVisitor<R, C> {
    R visitFragment(Fragment node, C context);

    R visitElement(Element node, C context);

    R visitText(Text node, C context);

    R visitComment(Comment node, C context);

    R visitMustacheTag(MustacheTag node, C context);

    R visitRawMustacheTag(RawMustacheTag node, C context);

    R visitDebugTag(DebugTag node, C context);

    R visitIfBlock(IfBlock node, C context);

    R visitElseBlock(ElseBlock node, C context);

    R visitEachBlock(EachBlock node, C context);

    R visitAwaitBlock(AwaitBlock node, C context);

    R visitPendingBlock(PendingBlock node, C context);

    R visitThenBlock(ThenBlock node, C context);

    R visitCatchBlock(CatchBlock node, C context);

    R visitAttribute(Attribute node, C context);

    R visitAttributeShorthand(AttributeShorthand node, C context);

    R visitSpread(Spread node, C context);

    R visitEventHandler(EventHandler node, C context);

    R visitBinding(Binding node, C context);

    R visitClassDirective(ClassDirective node, C context);

    R visitLetDirective(LetDirective node, C context);

    R visitRefDirective(RefDirective node, C context);

    R visitTransition(Transition node, C context);

    R visitAction(Action node, C context);

    R visitAnimation(Animation node, C context);

    R visitScript(Script node, C context);

    R visitStyle(Style node, C context);
}
