package org.pragmatica.svelte.printer;

import org.pragmatica.svelte.FormatOptions;
import org.pragmatica.svelte.doc.Doc;
import org.pragmatica.svelte.doc.DocUtils;
import org.pragmatica.svelte.doc.Docs;
import org.pragmatica.svelte.embed.EmbeddedFormatters;
import org.pragmatica.svelte.embed.EmbeddedLanguage;
import org.pragmatica.svelte.embed.SnippedContentCodec;
import org.pragmatica.svelte.tree.ElementKind;
import org.pragmatica.svelte.tree.Expression;
import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.Node.*;
import org.pragmatica.svelte.tree.NodeVisitor;
import org.pragmatica.svelte.tree.Root;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.pragmatica.svelte.doc.Docs.BREAK_PARENT;
import static org.pragmatica.svelte.doc.Docs.EMPTY;
import static org.pragmatica.svelte.doc.Docs.HARDLINE;
import static org.pragmatica.svelte.doc.Docs.LINE;
import static org.pragmatica.svelte.doc.Docs.SOFTLINE;
import static org.pragmatica.svelte.doc.Docs.concat;
import static org.pragmatica.svelte.doc.Docs.dedent;
import static org.pragmatica.svelte.doc.Docs.group;
import static org.pragmatica.svelte.doc.Docs.indent;
import static org.pragmatica.svelte.doc.Docs.text;

/**
 * Prints a parsed component as a {@link Doc}.
 *
 * <p>One printer serves one {@link Root}; it keeps no state between nodes, so
 * separate instances may run concurrently.
 */
public final class SveltePrinter implements NodeVisitor<Doc, NodePath>, ChildrenPrinter.ChildPrinter {

    // http://xahlee.info/js/html5_non-closing_tag.html
    private static final Set<String> SELF_CLOSING_TAGS = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input",
        "link", "meta", "param", "source", "track", "wbr");

    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\r?\\s*\\n\\r?");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\t\\n\\f\\r ]+");
    private static final Pattern LEADING_BLANK_LINE = Pattern.compile("^([\\t\\f\\r ]*\\n){2}");
    private static final Pattern TRAILING_BLANK_LINE = Pattern.compile("(\\n[\\t\\f\\r ]*){2}\\z");

    private final Root root;
    private final FormatOptions options;
    private final ExpressionPrinter expressions;
    private final EmbeddedRegionPrinter regions;
    private final Doc open;
    private final Doc close;

    private SveltePrinter(Root root, FormatOptions options, ExpressionPrinter expressions, EmbeddedFormatters formatters) {
        this.root = root;
        this.options = options;
        this.expressions = expressions;
        this.regions = new EmbeddedRegionPrinter(options, formatters);
        this.open = text(options.strictMode() ? "\"{" : "{");
        this.close = text(options.strictMode() ? "}\"" : "}");
    }

    public static SveltePrinter create(Root root,
                                       FormatOptions options,
                                       ExpressionPrinter expressions,
                                       EmbeddedFormatters formatters) {
        return new SveltePrinter(root, options, expressions, formatters);
    }

    /**
     * Print the sections in the configured order, separated by a blank line.
     */
    public Doc print() {
        var parts = new ArrayList<Doc>();
        for (var section : options.sortOrder().sections()) {
            switch (section) {
                case SCRIPTS -> {
                    root.module().ifPresent(script -> parts.add(script.accept(this, NodePath.root(script))));
                    root.instance().ifPresent(script -> parts.add(script.accept(this, NodePath.root(script))));
                }
                case STYLES -> root.css().ifPresent(style -> parts.add(style.accept(this, NodePath.root(style))));
                case MARKUP -> {
                    var html = root.html().accept(this, NodePath.root(root.html()));
                    if (html != EMPTY) {
                        parts.add(html);
                    }
                }
            }
        }
        return group(Docs.join(HARDLINE, parts));
    }

    // === Children callbacks ===

    @Override
    public Doc print(NodePath path) {
        return path.node().accept(this, path);
    }

    @Override
    public Doc printVerbatim(Node node) {
        return Docs.literalLines(SnippedContentCodec.unsnip(node.span().extract(root.source())));
    }

    /**
     * An ignore comment directly before a hoisted script or style is printed
     * together with that region.
     */
    @Override
    public boolean isDetached(Node node) {
        return node instanceof Comment comment && attachedIgnoreComment(comment.end()).isPresent();
    }

    private Optional<Comment> attachedIgnoreComment(int regionStart) {
        return root.html().children().stream()
                   .filter(NodeClassifier::isIgnoreDirective)
                   .map(Comment.class::cast)
                   .filter(comment -> comment.end() == regionStart)
                   .filter(comment -> regionStarts().anyMatch(start -> start == regionStart))
                   .findFirst();
    }

    private Stream<Integer> regionStarts() {
        return Stream.of(root.module().map(Node::start), root.instance().map(Node::start), root.css().map(Node::start))
                     .flatMap(Optional::stream);
    }

    // === Markup ===

    @Override
    public Doc visitFragment(Fragment node, NodePath path) {
        var children = node.children();
        if (children.stream().allMatch(child -> NodeClassifier.isEmptyNode(child) || isDetached(child))) {
            return EMPTY;
        }
        var docs = ChildrenPrinter.printChildren(path, children, this);
        if (path.isPreformatted()) {
            return concat(docs);
        }
        var result = new ArrayList<>(DocUtils.trim(docs, DocUtils::isLine));
        result.add(HARDLINE);
        return concat(result);
    }

    @Override
    public Doc visitElement(Element node, NodePath path) {
        if (node.kind() == ElementKind.OPTIONS || node.kind() == ElementKind.BODY) {
            return group(text("<" + node.name()), indent(group(concat(printAll(node.attributes(), path)))), text(" />"));
        }
        if (isEmbeddedRegion(node)) {
            return printRegion(node.name(), node.attributes(), path);
        }

        boolean supportedLanguage = !(node.name().equals("template")
                                      && EmbeddedLanguage.isKnownUnsupported(attributeText(node.attributes(), "lang")));
        boolean empty = node.children().stream().allMatch(NodeClassifier::isEmptyNode);
        boolean selfClosing = empty && (!options.strictMode()
                                        || node.kind() != ElementKind.ELEMENT
                                        || SELF_CLOSING_TAGS.contains(node.name()));

        Doc body;
        if (empty) {
            body = EMPTY;
        } else if (!supportedLanguage) {
            body = rawBody(node);
        } else if (NodeClassifier.isInlineElement(node) || path.isPreformatted()) {
            body = ChildrenPrinter.printIndentedPreservingWhitespace(path, node.children(), this);
        } else {
            body = ChildrenPrinter.printIndentedWithNewlines(path, node.children(), this);
        }

        var attributes = new ArrayList<Doc>();
        node.expression().ifPresent(expression -> attributes.add(concat(LINE, text("this="), open, expr(expression), close)));
        attributes.addAll(printAll(node.attributes(), path));
        if (options.bracketNewLine()) {
            attributes.add(dedent(selfClosing ? LINE : SOFTLINE));
        }

        var parts = new ArrayList<Doc>();
        parts.add(text("<" + node.name()));
        parts.add(indent(group(concat(attributes))));
        if (selfClosing) {
            parts.add(text(options.bracketNewLine() ? "/>" : " />"));
        } else {
            parts.add(text(">"));
            parts.add(body);
            parts.add(text("</" + node.name() + ">"));
        }
        return group(concat(parts));
    }

    private Doc rawBody(Element node) {
        var children = node.children();
        int start = children.get(0).start();
        int end = children.get(children.size() - 1).end();
        return Docs.literalLines(SnippedContentCodec.unsnip(root.source().substring(start, end)));
    }

    @Override
    public Doc visitText(Text node, NodePath path) {
        if (path.isPreformatted()) {
            return text(node.raw());
        }
        if (node.isBlank()) {
            return Docs.line(BLANK_LINE.matcher(node.raw()).find());
        }
        return Docs.fill(splitWords(node.raw()));
    }

    /**
     * Words joined by lines. Two line breaks at either end become a line that
     * is kept as a blank line.
     */
    private static List<Doc> splitWords(String raw) {
        var words = WORD_SEPARATOR.split(raw, -1);
        var docs = new ArrayList<Doc>();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                docs.add(LINE);
            }
            if (!words[i].isEmpty()) {
                docs.add(text(words[i]));
            }
        }
        if (LEADING_BLANK_LINE.matcher(raw).find()) {
            docs.set(0, Docs.KEEP_IF_LONELY_LINE);
        }
        if (TRAILING_BLANK_LINE.matcher(raw).find()) {
            docs.set(docs.size() - 1, Docs.KEEP_IF_LONELY_LINE);
        }
        return docs;
    }

    @Override
    public Doc visitComment(Comment node, NodePath path) {
        return group(text("<!--"), text(SnippedContentCodec.unsnip(node.data())), text("-->"));
    }

    // === Expression tags ===

    @Override
    public Doc visitMustacheTag(MustacheTag node, NodePath path) {
        return concat(text("{"), expr(node.expression()), text("}"));
    }

    @Override
    public Doc visitRawMustacheTag(RawMustacheTag node, NodePath path) {
        return concat(text("{@html "), expr(node.expression()), text("}"));
    }

    @Override
    public Doc visitDebugTag(DebugTag node, NodePath path) {
        if (node.identifiers().isEmpty()) {
            return text("{@debug}");
        }
        var identifiers = node.identifiers().stream().map(this::expr).toList();
        return concat(text("{@debug "), Docs.join(text(", "), identifiers), text("}"));
    }

    // === Logic blocks ===

    @Override
    public Doc visitIfBlock(IfBlock node, NodePath path) {
        var def = new ArrayList<Doc>();
        def.add(text("{#if "));
        def.add(expr(node.expression()));
        def.add(text("}"));
        def.add(ChildrenPrinter.printIndentedWithNewlines(path, node.children(), this));
        node.elseBlock().ifPresent(elseBlock -> def.add(elseBlock.accept(this, path.child(elseBlock))));
        def.add(text("{/if}"));
        return concat(group(concat(def)), BREAK_PARENT);
    }

    /**
     * An else block holding nothing but an if block prints as
     * {@code {:else if ...}}, except in each blocks.
     */
    @Override
    public Doc visitElseBlock(ElseBlock node, NodePath path) {
        boolean inEach = path.parentNode().filter(EachBlock.class::isInstance).isPresent();
        if (node.children().size() == 1 && node.children().get(0) instanceof IfBlock ifBlock && !inEach) {
            var ifPath = path.child(ifBlock);
            var def = new ArrayList<Doc>();
            def.add(text("{:else if "));
            def.add(expr(ifBlock.expression()));
            def.add(text("}"));
            def.add(ChildrenPrinter.printIndentedWithNewlines(ifPath, ifBlock.children(), this));
            ifBlock.elseBlock().ifPresent(elseBlock -> def.add(elseBlock.accept(this, ifPath.child(elseBlock))));
            return group(concat(def));
        }
        return group(text("{:else}"), ChildrenPrinter.printIndentedWithNewlines(path, node.children(), this));
    }

    @Override
    public Doc visitEachBlock(EachBlock node, NodePath path) {
        var def = new ArrayList<Doc>();
        def.add(text("{#each "));
        def.add(expr(node.expression()));
        def.add(text(" as "));
        def.add(expr(node.context()));
        node.index().ifPresent(index -> def.add(text(", " + index)));
        node.key().ifPresent(key -> def.add(concat(text(" ("), expr(key), text(")"))));
        def.add(text("}"));
        def.add(ChildrenPrinter.printIndentedWithNewlines(path, node.children(), this));
        node.elseBlock().ifPresent(elseBlock -> def.add(elseBlock.accept(this, path.child(elseBlock))));
        def.add(text("{/each}"));
        return concat(group(concat(def)), BREAK_PARENT);
    }

    @Override
    public Doc visitAwaitBlock(AwaitBlock node, NodePath path) {
        boolean hasPending = hasContent(node.pending().children());
        boolean hasThen = hasContent(node.then().children());
        boolean hasCatch = hasContent(node.catchBlock().children());
        var block = new ArrayList<Doc>();
        if (!hasPending && hasThen) {
            block.add(group(text("{#await "), expr(node.expression()), text(" then"), binding(node.value()), text("}")));
            block.add(indent(node.then().accept(this, path.child(node.then()))));
        } else {
            block.add(group(text("{#await "), expr(node.expression()), text("}")));
            if (hasPending) {
                block.add(indent(node.pending().accept(this, path.child(node.pending()))));
            }
            if (hasThen) {
                block.add(group(text("{:then"), binding(node.value()), text("}")));
                block.add(indent(node.then().accept(this, path.child(node.then()))));
            }
        }
        if (hasCatch) {
            block.add(group(text("{:catch"), binding(node.error()), text("}")));
            block.add(indent(node.catchBlock().accept(this, path.child(node.catchBlock()))));
        }
        block.add(text("{/await}"));
        return concat(group(concat(block)), BREAK_PARENT);
    }

    private static boolean hasContent(List<Node> children) {
        return children.stream().anyMatch(child -> !NodeClassifier.isEmptyNode(child));
    }

    private Doc binding(Optional<Expression> value) {
        return value.map(expression -> concat(text(" "), expr(expression))).orElse(EMPTY);
    }

    @Override
    public Doc visitPendingBlock(PendingBlock node, NodePath path) {
        return awaitSection(node.children(), path);
    }

    @Override
    public Doc visitThenBlock(ThenBlock node, NodePath path) {
        return awaitSection(node.children(), path);
    }

    @Override
    public Doc visitCatchBlock(CatchBlock node, NodePath path) {
        return awaitSection(node.children(), path);
    }

    private Doc awaitSection(List<Node> children, NodePath path) {
        var docs = new ArrayList<Doc>();
        docs.add(SOFTLINE);
        docs.addAll(DocUtils.trim(ChildrenPrinter.printChildren(path, children, this), DocUtils::isLine));
        docs.add(dedent(SOFTLINE));
        return concat(docs);
    }

    // === Attributes ===

    @Override
    public Doc visitAttribute(Attribute node, NodePath path) {
        var name = node.name();
        if (isShorthandCandidate(node)) {
            if (options.strictMode()) {
                return concat(LINE, text(name + "=\"{" + name + "}\""));
            }
            if (options.allowShorthand()) {
                return concat(LINE, text("{" + name + "}"));
            }
            return concat(LINE, text(name + "={" + name + "}"));
        }
        if (node.value().isEmpty()) {
            return concat(LINE, text(name));
        }
        var value = node.value().get();
        boolean quotes = !isLoneMustacheTag(value) || options.strictMode();
        var valueDocs = printAll(value, path);
        Doc valueDoc = quotes && NodePath.isFormattableAttribute(name)
                       ? indent(group(concat(DocUtils.trim(valueDocs, DocUtils::isLine))))
                       : concat(valueDocs);
        if (!quotes) {
            return concat(LINE, text(name + "="), valueDoc);
        }
        var quote = text(quoteFor(value));
        return concat(LINE, text(name + "="), quote, valueDoc, quote);
    }

    /**
     * Single quotes only when the value contains a double quote but no single one.
     */
    private static String quoteFor(List<Node> value) {
        var raw = new StringBuilder();
        value.stream()
             .filter(Text.class::isInstance)
             .forEach(part -> raw.append(((Text) part).raw()));
        return raw.indexOf("\"") >= 0 && raw.indexOf("'") < 0 ? "'" : "\"";
    }

    private static boolean isLoneMustacheTag(List<Node> value) {
        return value.size() == 1 && value.get(0) instanceof MustacheTag;
    }

    /**
     * {@code {name}} or {@code name={name}}.
     */
    private static boolean isShorthandCandidate(Attribute node) {
        var value = node.value().orElse(List.of());
        if (value.size() != 1) {
            return false;
        }
        if (value.get(0) instanceof AttributeShorthand) {
            return true;
        }
        return value.get(0) instanceof MustacheTag tag && tag.expression().isIdentifier(node.name());
    }

    @Override
    public Doc visitAttributeShorthand(AttributeShorthand node, NodePath path) {
        return expr(node.expression());
    }

    @Override
    public Doc visitSpread(Spread node, NodePath path) {
        return concat(LINE, text("{..."), expr(node.expression()), text("}"));
    }

    @Override
    public Doc visitEventHandler(EventHandler node, NodePath path) {
        return directive("on:", node.name(), node.modifiers(), node.expression());
    }

    @Override
    public Doc visitBinding(Binding node, NodePath path) {
        return directive("bind:", node.name(), List.of(), unlessNamedAfter(node.name(), Optional.of(node.expression())));
    }

    @Override
    public Doc visitClassDirective(ClassDirective node, NodePath path) {
        return directive("class:", node.name(), List.of(), unlessNamedAfter(node.name(), Optional.of(node.expression())));
    }

    @Override
    public Doc visitLetDirective(LetDirective node, NodePath path) {
        return directive("let:", node.name(), List.of(), unlessNamedAfter(node.name(), node.expression()));
    }

    @Override
    public Doc visitRefDirective(RefDirective node, NodePath path) {
        return directive("ref:", node.name(), List.of(), Optional.empty());
    }

    @Override
    public Doc visitTransition(Transition node, NodePath path) {
        var kind = node.intro() && node.outro() ? "transition:" : node.intro() ? "in:" : "out:";
        return directive(kind, node.name(), node.modifiers(), node.expression());
    }

    @Override
    public Doc visitAction(Action node, NodePath path) {
        return directive("use:", node.name(), List.of(), node.expression());
    }

    @Override
    public Doc visitAnimation(Animation node, NodePath path) {
        return directive("animate:", node.name(), List.of(), node.expression());
    }

    private Doc directive(String prefix, String name, List<String> modifiers, Optional<Expression> expression) {
        var parts = new ArrayList<Doc>();
        parts.add(LINE);
        parts.add(text(prefix + name));
        if (!modifiers.isEmpty()) {
            parts.add(text("|" + String.join("|", modifiers)));
        }
        expression.ifPresent(value -> parts.add(concat(text("="), open, expr(value), close)));
        return concat(parts);
    }

    /**
     * Bindings, class toggles and let directives may drop a value that repeats their name.
     */
    private static Optional<Expression> unlessNamedAfter(String name, Optional<Expression> expression) {
        return expression.filter(value -> !value.isIdentifier(name));
    }

    // === Embedded regions ===

    @Override
    public Doc visitScript(Script node, NodePath path) {
        return printRootRegion(node, "script", path);
    }

    @Override
    public Doc visitStyle(Style node, NodePath path) {
        return printRootRegion(node, "style", path);
    }

    private Doc printRootRegion(Node node, String tag, NodePath path) {
        var regionSource = node.span().extract(root.source());
        var ignore = attachedIgnoreComment(node.start());
        if (ignore.isPresent()) {
            return concat(text(ignore.get().span().extract(root.source())),
                          HARDLINE,
                          Docs.literalLines(SnippedContentCodec.unsnip(regionSource)),
                          HARDLINE);
        }
        var attributes = EmbeddedRegionPrinter.extractAttributes(regionSource, node.start(), root.source());
        return concat(printRegion(tag, attributes, path), HARDLINE);
    }

    private boolean isEmbeddedRegion(Element node) {
        return node.kind() == ElementKind.ELEMENT
               && (node.name().equals("script") || node.name().equals("style"))
               && attributeText(node.attributes(), SnippedContentCodec.MARKER_ATTRIBUTE).isPresent();
    }

    private Doc printRegion(String tag, List<Node> attributes, NodePath path) {
        var printed = attributes.stream()
                                .filter(attribute -> !isMarker(attribute))
                                .map(attribute -> attribute.accept(this, path.child(attribute)))
                                .toList();
        var lang = attributeText(attributes, "lang").or(() -> attributeText(attributes, "type"));
        var content = attributeText(attributes, SnippedContentCodec.MARKER_ATTRIBUTE)
            .flatMap(SnippedContentCodec::snippedContent);
        return regions.print(tag, printed, lang, content, path.node().span().start());
    }

    private static boolean isMarker(Node attribute) {
        return attribute instanceof Attribute plain && plain.name().equals(SnippedContentCodec.MARKER_ATTRIBUTE);
    }

    /**
     * Text value of a plain attribute; empty string for a boolean one.
     */
    private static Optional<String> attributeText(List<Node> attributes, String name) {
        return attributes.stream()
                         .filter(Attribute.class::isInstance)
                         .map(Attribute.class::cast)
                         .filter(attribute -> attribute.name().equals(name))
                         .findFirst()
                         .map(attribute -> attribute.value()
                                                    .flatMap(value -> value.stream()
                                                                           .filter(Text.class::isInstance)
                                                                           .map(part -> ((Text) part).raw())
                                                                           .findFirst())
                                                    .orElse(""));
    }

    // === Helpers ===

    private List<Doc> printAll(List<Node> nodes, NodePath parent) {
        return nodes.stream().map(child -> child.accept(this, parent.child(child))).toList();
    }

    private Doc expr(Expression expression) {
        return expressions.print(expression);
    }
}
