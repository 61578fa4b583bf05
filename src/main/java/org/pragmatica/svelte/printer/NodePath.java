package org.pragmatica.svelte.printer;

import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.Node.Attribute;
import org.pragmatica.svelte.tree.Node.Element;

import java.util.Optional;
import java.util.Set;

/**
 * Immutable cursor: the node being printed and the chain of its ancestors.
 * Each recursive print call receives a new path.
 */
public final class NodePath {

    private static final Set<String> FORMATTABLE_ATTRIBUTES = Set.of("class");

    private final Node node;
    private final NodePath parent;

    private NodePath(Node node, NodePath parent) {
        this.node = node;
        this.parent = parent;
    }

    public static NodePath root(Node node) {
        return new NodePath(node, null);
    }

    public NodePath child(Node child) {
        return new NodePath(child, this);
    }

    public Node node() {
        return node;
    }

    public Optional<Node> parentNode() {
        return Optional.ofNullable(parent).map(NodePath::node);
    }

    /**
     * True inside whitespace-preserving content: a {@code <pre>} element or the
     * value of any attribute whose value may not be reformatted. The current
     * node counts.
     */
    public boolean isPreformatted() {
        for (var path = this; path != null; path = path.parent) {
            if (path.node instanceof Element element && element.name().equalsIgnoreCase("pre")) {
                return true;
            }
            if (path.node instanceof Attribute attribute && !isFormattableAttribute(attribute.name())) {
                return true;
            }
        }
        return false;
    }

    public static boolean isFormattableAttribute(String name) {
        return FORMATTABLE_ATTRIBUTES.contains(name);
    }
}
