package org.pragmatica.svelte.parser;

import org.pragmatica.svelte.tree.ElementKind;
import org.pragmatica.svelte.tree.Expression;
import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.Node.*;
import org.pragmatica.svelte.tree.Root;
import org.pragmatica.svelte.tree.ScriptContext;
import org.pragmatica.svelte.tree.SourceLocation;
import org.pragmatica.svelte.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Recursive-descent parser for component markup.
 *
 * <p>Top-level {@code <script>} and {@code <style>} elements are hoisted into
 * the {@link Root} slots; their bodies are read as raw text and never parsed.
 * Everything else, including nested script and style elements, stays in the
 * markup fragment.
 */
public final class SvelteParser implements MarkupParser {
    private static final Logger log = LoggerFactory.getLogger(SvelteParser.class);

    private static final Set<String> VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "command", "embed", "hr", "img", "input",
        "keygen", "link", "meta", "param", "source", "track", "wbr");

    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

    private static final Set<String> DIRECTIVES = Set.of(
        "on", "bind", "class", "let", "ref", "in", "out", "transition", "use", "animate");

    private SvelteParser() {}

    public static SvelteParser svelteParser() {
        return new SvelteParser();
    }

    @Override
    public Root parse(String source) {
        var run = new Run(ParsingContext.create(source));
        var root = run.parseRoot();
        log.debug("Parsed {} top-level markup nodes", root.html().children().size());
        return root;
    }

    /**
     * State of a single parse.
     */
    private static final class Run {
        private final ParsingContext ctx;
        private Optional<Script> module = Optional.empty();
        private Optional<Script> instance = Optional.empty();
        private Optional<Style> css = Optional.empty();

        private Run(ParsingContext ctx) {
            this.ctx = ctx;
        }

        Root parseRoot() {
            var start = ctx.location();
            var children = parseChildren(ElementKind.ELEMENT, true);
            if (!ctx.isAtEnd()) {
                throw ctx.unexpected("end of input");
            }
            return new Root(module, instance, css, new Fragment(ctx.spanFrom(start), children), ctx.input());
        }

        // === Children ===

        private List<Node> parseChildren(ElementKind parentKind, boolean topLevel) {
            var children = new ArrayList<Node>();
            while (!ctx.isAtEnd()) {
                if (ctx.startsWith("</") || ctx.startsWith("{/") || ctx.startsWith("{:")) {
                    break;
                }
                if (ctx.startsWith("<!--")) {
                    children.add(parseComment());
                } else if (isTagStart()) {
                    parseElement(parentKind, topLevel).ifPresent(children::add);
                } else if (ctx.peek() == '{') {
                    children.add(parseTag());
                } else {
                    children.add(parseText());
                }
            }
            return children;
        }

        private boolean isTagStart() {
            return ctx.peek() == '<' && Character.isLetter(ctx.peek(1));
        }

        private Text parseText() {
            var start = ctx.location();
            int from = ctx.pos();
            do {
                ctx.advance();
            } while (!ctx.isAtEnd() && ctx.peek() != '{' && !isTagStart()
                     && !ctx.startsWith("</") && !ctx.startsWith("<!--"));
            return new Text(ctx.spanFrom(start), ctx.substring(from, ctx.pos()));
        }

        private Comment parseComment() {
            var start = ctx.location();
            ctx.expect("<!--");
            int close = ctx.input().indexOf("-->", ctx.pos());
            if (close < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'-->'");
            }
            var data = ctx.substring(ctx.pos(), close);
            ctx.advanceTo(close + 3);
            return new Comment(ctx.spanFrom(start), data);
        }

        // === Elements ===

        private Optional<Node> parseElement(ElementKind parentKind, boolean topLevel) {
            var start = ctx.location();
            ctx.expect("<");
            var name = ctx.readWhile(c -> Character.isLetterOrDigit(c) || c == ':' || c == '-' || c == '.' || c == '_');
            var attributes = new ArrayList<Node>();
            boolean selfClosed = false;
            while (true) {
                ctx.skipWhitespace();
                if (ctx.match("/>")) {
                    selfClosed = true;
                    break;
                }
                if (ctx.match(">")) {
                    break;
                }
                if (ctx.isAtEnd()) {
                    throw ctx.unexpected("'>'");
                }
                attributes.add(parseAttribute());
            }

            var kind = kindOf(name, parentKind);
            List<Node> children = List.of();
            if (RAW_TEXT_ELEMENTS.contains(name) && !selfClosed) {
                children = parseRawText(name);
            } else if (!selfClosed && !VOID_ELEMENTS.contains(name)) {
                children = parseChildren(kind, false);
                expectClosingTag(name);
            }
            var span = ctx.spanFrom(start);

            if (topLevel && name.equals("script")) {
                hoistScript(new Script(span, scriptContext(attributes)), start);
                return Optional.empty();
            }
            if (topLevel && name.equals("style")) {
                if (css.isPresent()) {
                    throw ctx.semanticError(start, "A component can only have one <style> element");
                }
                css = Optional.of(new Style(span));
                return Optional.empty();
            }

            Optional<Expression> expression = Optional.empty();
            if (name.equals("svelte:component")) {
                expression = thisExpression(attributes, start);
                attributes.removeIf(attribute -> attribute instanceof Attribute plain && plain.name().equals("this"));
            }
            return Optional.of(new Element(span, kind, name, List.copyOf(attributes), children, expression));
        }

        private List<Node> parseRawText(String name) {
            var start = ctx.location();
            var closing = "</" + name;
            int end = ctx.input().indexOf(closing, ctx.pos());
            if (end < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'" + closing + ">'");
            }
            var content = ctx.substring(ctx.pos(), end);
            ctx.advanceTo(end);
            expectClosingTag(name);
            return content.isEmpty() ? List.of() : List.of(new Text(ctx.span(start.offset(), end), content));
        }

        private void expectClosingTag(String name) {
            var expected = "'</" + name + ">'";
            if (!ctx.startsWith("</")) {
                throw ctx.unexpected(expected);
            }
            var start = ctx.location();
            ctx.expect("</");
            var closing = ctx.readWhile(c -> !Character.isWhitespace(c) && c != '>');
            if (!closing.equalsIgnoreCase(name)) {
                throw ctx.semanticError(start, "Expected </" + name + "> but found </" + closing + ">");
            }
            ctx.skipWhitespace();
            ctx.expect(">");
        }

        private void hoistScript(Script script, SourceLocation start) {
            if (script.context() == ScriptContext.MODULE) {
                if (module.isPresent()) {
                    throw ctx.semanticError(start, "A component can only have one <script context=\"module\"> element");
                }
                module = Optional.of(script);
            } else {
                if (instance.isPresent()) {
                    throw ctx.semanticError(start, "A component can only have one instance-level <script> element");
                }
                instance = Optional.of(script);
            }
        }

        private static ScriptContext scriptContext(List<Node> attributes) {
            for (var attribute : attributes) {
                if (attribute instanceof Attribute plain && plain.name().equals("context")) {
                    var isModule = plain.value()
                                        .filter(value -> value.size() == 1 && value.get(0) instanceof Text)
                                        .map(value -> ((Text) value.get(0)).raw().equals("module"))
                                        .orElse(false);
                    if (isModule) {
                        return ScriptContext.MODULE;
                    }
                }
            }
            return ScriptContext.INSTANCE;
        }

        private Optional<Expression> thisExpression(List<Node> attributes, SourceLocation start) {
            for (var attribute : attributes) {
                if (attribute instanceof Attribute plain && plain.name().equals("this")) {
                    var value = plain.value().orElse(List.of());
                    if (value.size() == 1 && value.get(0) instanceof MustacheTag tag) {
                        return Optional.of(tag.expression());
                    }
                    throw ctx.semanticError(start, "<svelte:component> must have a 'this' attribute holding an expression");
                }
            }
            return Optional.empty();
        }

        private static ElementKind kindOf(String name, ElementKind parentKind) {
            switch (name) {
                case "svelte:window":
                    return ElementKind.WINDOW;
                case "svelte:head":
                    return ElementKind.HEAD;
                case "svelte:options":
                    return ElementKind.OPTIONS;
                case "svelte:body":
                    return ElementKind.BODY;
                case "svelte:component":
                case "svelte:self":
                    return ElementKind.INLINE_COMPONENT;
                case "slot":
                    return ElementKind.SLOT;
                case "title":
                    return parentKind == ElementKind.HEAD ? ElementKind.TITLE : ElementKind.ELEMENT;
                default:
                    return Character.isUpperCase(name.charAt(0)) || name.contains(".")
                           ? ElementKind.INLINE_COMPONENT
                           : ElementKind.ELEMENT;
            }
        }

        // === Attributes ===

        private Node parseAttribute() {
            var start = ctx.location();
            if (ctx.peek() == '{') {
                return parseBracedAttribute(start);
            }
            var name = ctx.readWhile(c -> !Character.isWhitespace(c) && c != '=' && c != '>' && c != '/'
                                          && c != '"' && c != '\'' && c != '{' && c != '}');
            if (name.isEmpty()) {
                throw ctx.unexpected("attribute name");
            }
            Optional<List<Node>> value = Optional.empty();
            var nameEnd = ctx.location();
            ctx.skipWhitespace();
            if (ctx.match("=")) {
                ctx.skipWhitespace();
                value = Optional.of(parseAttributeValue());
                nameEnd = ctx.location();
            }
            var span = SourceSpan.of(start, nameEnd);

            int colon = name.indexOf(':');
            if (colon > 0 && DIRECTIVES.contains(name.substring(0, colon))) {
                return directive(name.substring(0, colon), name.substring(colon + 1), value, span);
            }
            return new Attribute(span, name, value);
        }

        private Node parseBracedAttribute(SourceLocation start) {
            ctx.expect("{");
            ctx.skipWhitespace();
            if (ctx.match("...")) {
                var expression = readExpression(i -> ctx.input().charAt(i) == '}');
                ctx.expect("}");
                return new Spread(ctx.spanFrom(start), expression);
            }
            var expression = readExpression(i -> ctx.input().charAt(i) == '}');
            ctx.expect("}");
            if (!expression.isIdentifier()) {
                throw ctx.semanticError(start, "Attribute shorthand must be an identifier");
            }
            var span = ctx.spanFrom(start);
            return new Attribute(span, expression.code(), Optional.of(List.of(new AttributeShorthand(span, expression))));
        }

        private List<Node> parseAttributeValue() {
            char quote = ctx.isAtEnd() ? '\0' : ctx.peek();
            if (quote == '"' || quote == '\'') {
                ctx.advance();
                var parts = parseValueParts(c -> c == quote);
                ctx.expect(String.valueOf(quote));
                return parts;
            }
            if (quote == '{') {
                return List.of(parseMustache());
            }
            var parts = parseValueParts(c -> Character.isWhitespace(c) || c == '>');
            if (parts.isEmpty()) {
                throw ctx.unexpected("attribute value");
            }
            return parts;
        }

        private List<Node> parseValueParts(IntPredicate stop) {
            var parts = new ArrayList<Node>();
            var textStart = ctx.location();
            while (!ctx.isAtEnd() && !stop.test(ctx.peek())) {
                if (ctx.peek() == '{') {
                    addText(parts, textStart);
                    parts.add(parseMustache());
                    textStart = ctx.location();
                } else {
                    ctx.advance();
                }
            }
            addText(parts, textStart);
            if (parts.isEmpty()) {
                parts.add(new Text(ctx.spanFrom(textStart), ""));
            }
            return parts;
        }

        private void addText(List<Node> parts, SourceLocation textStart) {
            if (ctx.pos() > textStart.offset()) {
                parts.add(new Text(ctx.spanFrom(textStart), ctx.substring(textStart.offset(), ctx.pos())));
            }
        }

        private Node directive(String prefix,
                               String rest,
                               Optional<List<Node>> value,
                               SourceSpan span) {
            var segments = rest.split("\\|", -1);
            var name = segments[0];
            var modifiers = List.of(segments).subList(1, segments.length);
            if (name.isEmpty()) {
                throw ctx.semanticError(span.start(), "Directive '" + prefix + ":' requires a name");
            }
            if (!modifiers.isEmpty() && !prefix.equals("on") && !isTransition(prefix)) {
                throw ctx.semanticError(span.start(), "Directive '" + prefix + ":' does not accept modifiers");
            }
            var expression = value.map(parts -> directiveExpression(parts, span));
            var implicit = Expression.of(span, name);

            switch (prefix) {
                case "on":
                    return new EventHandler(span, name, modifiers, expression);
                case "bind":
                    return new Binding(span, name, expression.orElse(implicit));
                case "class":
                    return new ClassDirective(span, name, expression.orElse(implicit));
                case "let":
                    return new LetDirective(span, name, expression);
                case "ref":
                    return new RefDirective(span, name);
                case "in":
                    return new Transition(span, name, true, false, modifiers, expression);
                case "out":
                    return new Transition(span, name, false, true, modifiers, expression);
                case "transition":
                    return new Transition(span, name, true, true, modifiers, expression);
                case "use":
                    return new Action(span, name, expression);
                default:
                    return new Animation(span, name, expression);
            }
        }

        private static boolean isTransition(String prefix) {
            return prefix.equals("in") || prefix.equals("out") || prefix.equals("transition");
        }

        private Expression directiveExpression(List<Node> parts, SourceSpan span) {
            if (parts.size() == 1 && parts.get(0) instanceof MustacheTag tag) {
                return tag.expression();
            }
            throw ctx.semanticError(span.start(), "Directive value must be an expression enclosed in curly braces");
        }

        // === Tags and blocks ===

        private MustacheTag parseMustache() {
            var start = ctx.location();
            ctx.expect("{");
            var expression = readExpression(i -> ctx.input().charAt(i) == '}');
            ctx.expect("}");
            return new MustacheTag(ctx.spanFrom(start), expression);
        }

        private Node parseTag() {
            var start = ctx.location();
            if (ctx.startsWith("{#if")) {
                ctx.expect("{#if");
                requireWhitespace();
                var expression = readExpression(i -> ctx.input().charAt(i) == '}');
                ctx.expect("}");
                var block = parseIfBody(start, expression, false);
                expectBlockClose("if");
                return withEnd(block, start);
            }
            if (ctx.startsWith("{#each")) {
                return parseEach(start);
            }
            if (ctx.startsWith("{#await")) {
                return parseAwait(start);
            }
            if (ctx.match("{@html")) {
                requireWhitespace();
                var expression = readExpression(i -> ctx.input().charAt(i) == '}');
                ctx.expect("}");
                return new RawMustacheTag(ctx.spanFrom(start), expression);
            }
            if (ctx.match("{@debug")) {
                return parseDebug(start);
            }
            if (ctx.startsWith("{#") || ctx.startsWith("{@")) {
                throw ctx.unexpected("'{#if', '{#each', '{#await', '{@html' or '{@debug'");
            }
            return parseMustache();
        }

        private IfBlock parseIfBody(SourceLocation start, Expression expression, boolean elseIf) {
            var children = parseChildren(ElementKind.ELEMENT, false);
            Optional<ElseBlock> elseBlock = Optional.empty();
            if (ctx.startsWith("{:else")) {
                var elseStart = ctx.location();
                ctx.expect("{:else");
                if (ctx.skipWhitespace() && ctx.match("if")) {
                    requireWhitespace();
                    var nestedExpression = readExpression(i -> ctx.input().charAt(i) == '}');
                    ctx.expect("}");
                    var nested = parseIfBody(elseStart, nestedExpression, true);
                    elseBlock = Optional.of(new ElseBlock(ctx.spanFrom(elseStart), List.of(nested)));
                } else {
                    ctx.skipWhitespace();
                    ctx.expect("}");
                    var elseChildren = parseChildren(ElementKind.ELEMENT, false);
                    elseBlock = Optional.of(new ElseBlock(ctx.spanFrom(elseStart), elseChildren));
                }
            }
            return new IfBlock(ctx.spanFrom(start), expression, children, elseBlock, elseIf);
        }

        private IfBlock withEnd(IfBlock block, SourceLocation start) {
            return new IfBlock(ctx.spanFrom(start), block.expression(), block.children(), block.elseBlock(), false);
        }

        private EachBlock parseEach(SourceLocation start) {
            ctx.expect("{#each");
            requireWhitespace();
            int headerStart = ctx.pos();
            int headerEnd = ExpressionScanner.indexOf(ctx.input(), headerStart, '}');
            if (headerEnd < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'}'");
            }
            var text = ctx.input();
            int as = ExpressionScanner.keywordIndex(text.substring(0, headerEnd), headerStart, "as");
            if (as < 0) {
                ctx.advanceTo(headerEnd);
                throw ctx.unexpected("'as'");
            }
            var expression = expression(headerStart, as);

            int contextStart = as + 2;
            var header = text.substring(0, headerEnd);
            int contextEnd = ExpressionScanner.scan(header, contextStart, i -> header.charAt(i) == ',' || header.charAt(i) == '(');
            contextEnd = contextEnd < 0 ? headerEnd : contextEnd;
            var context = expression(contextStart, contextEnd);

            Optional<String> index = Optional.empty();
            Optional<Expression> key = Optional.empty();
            int cursor = contextEnd;
            if (cursor < headerEnd && header.charAt(cursor) == ',') {
                int indexEnd = header.indexOf('(', cursor);
                indexEnd = indexEnd < 0 ? headerEnd : indexEnd;
                var indexName = header.substring(cursor + 1, indexEnd).strip();
                if (indexName.isEmpty()) {
                    ctx.advanceTo(cursor + 1);
                    throw ctx.unexpected("index name");
                }
                index = Optional.of(indexName);
                cursor = indexEnd;
            }
            if (cursor < headerEnd && header.charAt(cursor) == '(') {
                int keyEnd = ExpressionScanner.indexOf(header, cursor + 1, ')');
                if (keyEnd < 0) {
                    ctx.advanceTo(headerEnd);
                    throw ctx.unexpected("')'");
                }
                key = Optional.of(expression(cursor + 1, keyEnd));
            }
            ctx.advanceTo(headerEnd);
            ctx.expect("}");

            var children = parseChildren(ElementKind.ELEMENT, false);
            Optional<ElseBlock> elseBlock = Optional.empty();
            if (ctx.startsWith("{:else")) {
                var elseStart = ctx.location();
                ctx.expect("{:else");
                ctx.skipWhitespace();
                ctx.expect("}");
                var elseChildren = parseChildren(ElementKind.ELEMENT, false);
                elseBlock = Optional.of(new ElseBlock(ctx.spanFrom(elseStart), elseChildren));
            }
            expectBlockClose("each");
            return new EachBlock(ctx.spanFrom(start), expression, context, index, key, children, elseBlock);
        }

        private AwaitBlock parseAwait(SourceLocation start) {
            ctx.expect("{#await");
            requireWhitespace();
            int headerStart = ctx.pos();
            int headerEnd = ExpressionScanner.indexOf(ctx.input(), headerStart, '}');
            if (headerEnd < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'}'");
            }
            var header = ctx.input().substring(0, headerEnd);
            int then = ExpressionScanner.keywordIndex(header, headerStart, "then");
            int catchAt = then < 0 ? ExpressionScanner.keywordIndex(header, headerStart, "catch") : -1;
            int expressionEnd = then >= 0 ? then : catchAt >= 0 ? catchAt : headerEnd;
            var expression = expression(headerStart, expressionEnd);
            Optional<Expression> value = then >= 0 ? optionalExpression(then + 4, headerEnd) : Optional.empty();
            Optional<Expression> error = catchAt >= 0 ? optionalExpression(catchAt + 5, headerEnd) : Optional.empty();
            ctx.advanceTo(headerEnd);
            ctx.expect("}");

            var sectionStart = ctx.location();
            var empty = ctx.spanFrom(sectionStart);
            var pending = new PendingBlock(empty, List.of());
            var thenBlock = new ThenBlock(empty, List.of());
            var catchBlock = new CatchBlock(empty, List.of());
            var children = parseChildren(ElementKind.ELEMENT, false);
            if (then >= 0) {
                thenBlock = new ThenBlock(ctx.spanFrom(sectionStart), children);
            } else if (catchAt >= 0) {
                catchBlock = new CatchBlock(ctx.spanFrom(sectionStart), children);
            } else {
                pending = new PendingBlock(ctx.spanFrom(sectionStart), children);
            }

            while (true) {
                if (ctx.match("{:then")) {
                    value = sectionValue();
                    var thenStart = ctx.location();
                    thenBlock = new ThenBlock(ctx.spanFrom(thenStart), parseChildren(ElementKind.ELEMENT, false));
                } else if (ctx.match("{:catch")) {
                    error = sectionValue();
                    var catchStart = ctx.location();
                    catchBlock = new CatchBlock(ctx.spanFrom(catchStart), parseChildren(ElementKind.ELEMENT, false));
                } else {
                    break;
                }
            }
            expectBlockClose("await");
            return new AwaitBlock(ctx.spanFrom(start), expression, value, error, pending, thenBlock, catchBlock);
        }

        private Optional<Expression> sectionValue() {
            int end = ExpressionScanner.indexOf(ctx.input(), ctx.pos(), '}');
            if (end < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'}'");
            }
            var value = optionalExpression(ctx.pos(), end);
            ctx.advanceTo(end);
            ctx.expect("}");
            return value;
        }

        private DebugTag parseDebug(SourceLocation start) {
            var identifiers = new ArrayList<Expression>();
            int end = ExpressionScanner.indexOf(ctx.input(), ctx.pos(), '}');
            if (end < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'}'");
            }
            int from = ctx.pos();
            while (from < end) {
                int comma = ExpressionScanner.indexOf(ctx.input().substring(0, end), from, ',');
                int to = comma < 0 ? end : comma;
                optionalExpression(from, to).ifPresent(identifiers::add);
                from = to + 1;
            }
            ctx.advanceTo(end);
            ctx.expect("}");
            return new DebugTag(ctx.spanFrom(start), identifiers);
        }

        private void expectBlockClose(String name) {
            var closing = "{/" + name;
            if (!ctx.match(closing)) {
                throw ctx.unexpected("'" + closing + "}'");
            }
            ctx.skipWhitespace();
            ctx.expect("}");
        }

        private void requireWhitespace() {
            if (!ctx.skipWhitespace()) {
                throw ctx.unexpected("whitespace");
            }
        }

        // === Expressions ===

        private Expression readExpression(IntPredicate stop) {
            var start = ctx.location();
            int end = ExpressionScanner.scan(ctx.input(), ctx.pos(), stop);
            if (end < 0) {
                ctx.advanceTo(ctx.input().length());
                throw ctx.unexpected("'}'");
            }
            var text = ctx.substring(ctx.pos(), end);
            if (text.isBlank()) {
                throw ctx.unexpected("expression");
            }
            ctx.advanceTo(end);
            return Expression.of(ctx.spanFrom(start), text);
        }

        private Expression expression(int from, int to) {
            return optionalExpression(from, to).orElseThrow(() -> {
                ctx.advanceTo(from);
                return ctx.unexpected("expression");
            });
        }

        private Optional<Expression> optionalExpression(int from, int to) {
            var text = ctx.substring(from, to);
            if (text.isBlank()) {
                return Optional.empty();
            }
            int leading = text.length() - text.stripLeading().length();
            int trailing = text.length() - text.stripTrailing().length();
            return Optional.of(Expression.of(ctx.span(from + leading, to - trailing), text.strip()));
        }
    }
}
