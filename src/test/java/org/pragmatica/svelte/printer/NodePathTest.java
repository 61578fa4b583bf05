package org.pragmatica.svelte.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.svelte.tree.ElementKind;
import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.SourceLocation;
import org.pragmatica.svelte.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodePathTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    private static Node element(String name) {
        return new Node.Element(SPAN, ElementKind.ELEMENT, name, List.of(), List.of(), Optional.empty());
    }

    private static Node attribute(String name) {
        return new Node.Attribute(SPAN, name, Optional.of(List.of()));
    }

    @Test
    void root_hasNoParent() {
        var path = NodePath.root(element("div"));

        assertThat(path.parentNode()).isEmpty();
    }

    @Test
    void child_exposesParentNode() {
        var div = element("div");
        var text = new Node.Text(SPAN, "x");

        var path = NodePath.root(div).child(text);

        assertSame(text, path.node());
        assertThat(path.parentNode()).containsSame(div);
    }

    @Test
    void isPreformatted_insidePre_true() {
        var path = NodePath.root(element("section"))
                           .child(element("pre"))
                           .child(element("b"))
                           .child(new Node.Text(SPAN, " a  b "));

        assertTrue(path.isPreformatted());
    }

    @Test
    void isPreformatted_preNameIsCaseInsensitive() {
        assertTrue(NodePath.root(element("PRE")).isPreformatted());
    }

    @Test
    void isPreformatted_attributeValue_trueUnlessClass() {
        var div = NodePath.root(element("div"));

        assertTrue(div.child(attribute("title")).isPreformatted());
        assertFalse(div.child(attribute("class")).isPreformatted());
    }

    @Test
    void isPreformatted_ordinaryElement_false() {
        var path = NodePath.root(element("div")).child(element("p"));

        assertFalse(path.isPreformatted());
    }

    @Test
    void isFormattableAttribute_onlyClass() {
        assertTrue(NodePath.isFormattableAttribute("class"));
        assertFalse(NodePath.isFormattableAttribute("style"));
    }
}
