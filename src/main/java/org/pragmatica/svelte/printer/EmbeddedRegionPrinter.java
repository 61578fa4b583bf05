package org.pragmatica.svelte.printer;

import org.pragmatica.svelte.FormatOptions;
import org.pragmatica.svelte.doc.Doc;
import org.pragmatica.svelte.doc.Docs;
import org.pragmatica.svelte.embed.EmbeddedFormatException;
import org.pragmatica.svelte.embed.EmbeddedFormatters;
import org.pragmatica.svelte.embed.EmbeddedLanguage;
import org.pragmatica.svelte.error.FormatError.EmbeddedContentError;
import org.pragmatica.svelte.error.FormatException;
import org.pragmatica.svelte.tree.Node;
import org.pragmatica.svelte.tree.Node.Attribute;
import org.pragmatica.svelte.tree.Node.Text;
import org.pragmatica.svelte.tree.SourceLocation;
import org.pragmatica.svelte.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Prints script and style regions: the start tag, then the body handed to the
 * formatter of its language and put back on its own lines.
 *
 * <p>Bodies in languages outside the allow-list, and bodies whose formatter
 * fails, are reproduced exactly as written.
 */
final class EmbeddedRegionPrinter {
    private static final Logger log = LoggerFactory.getLogger(EmbeddedRegionPrinter.class);

    private static final Pattern START_TAG = Pattern.compile("<[a-z]+((?:\"[^\"]*\"|'[^']*'|[^>\"'])*)>");
    private static final Pattern ATTRIBUTE = Pattern.compile("([^\\s=]+)(?:=(\"|')(.*?)\\2)?", Pattern.DOTALL);

    private final FormatOptions options;
    private final EmbeddedFormatters formatters;

    EmbeddedRegionPrinter(FormatOptions options, EmbeddedFormatters formatters) {
        this.options = options;
        this.formatters = formatters;
    }

    /**
     * @param tag            {@code script} or {@code style}
     * @param attributeDocs  printed attributes, marker attribute excluded
     * @param lang           value of the {@code lang} or {@code type} attribute
     * @param content        decoded body
     * @param location       start of the region, for error reporting
     */
    Doc print(String tag, List<Doc> attributeDocs, Optional<String> lang, Optional<String> content,
              SourceLocation location) {
        var body = content.filter(text -> !text.isBlank())
                          .map(text -> printBody(tag, lang, text, location))
                          .orElse(Docs.EMPTY);
        return Docs.group(Docs.text("<" + tag),
                          Docs.indent(Docs.group(Docs.concat(attributeDocs))),
                          Docs.text(">"),
                          body,
                          Docs.text("</" + tag + ">"));
    }

    private Doc printBody(String tag, Optional<String> lang, String content, SourceLocation location) {
        var language = EmbeddedLanguage.resolve(tag, lang);
        if (language.isEmpty()) {
            log.debug("Passing <{}> with lang {} through unchanged", tag, lang.orElse("<none>"));
            return Docs.literalLines(content);
        }
        String formatted;
        try {
            formatted = formatters.formatterFor(language.get()).format(content);
        } catch (EmbeddedFormatException e) {
            log.warn("Cannot format <{}> at {}, keeping it unchanged: {}", tag, location, e.getMessage());
            return Docs.literalLines(content);
        }
        if (formatted.toLowerCase(Locale.ROOT).contains("</" + tag)) {
            throw new FormatException(new EmbeddedContentError(location, tag, "formatted content contains </" + tag));
        }
        if (formatted.isBlank()) {
            return Docs.EMPTY;
        }
        var lines = new ArrayList<Doc>();
        for (var line : formatted.strip().split("\n", -1)) {
            lines.add(Docs.text(line));
        }
        var lineBlock = Docs.concat(Docs.HARDLINE, Docs.join(Docs.HARDLINE, lines));
        return Docs.concat(options.indentScriptAndStyle() ? Docs.indent(lineBlock) : lineBlock, Docs.HARDLINE);
    }

    /**
     * Attributes of a region's start tag, read from its source text.
     *
     * @param regionSource source of the whole region, starting with its start tag
     * @param regionStart  offset of the region in {@code source}
     * @param source       the full source, used to compute locations
     */
    static List<Node> extractAttributes(String regionSource, int regionStart, String source) {
        var tag = START_TAG.matcher(regionSource);
        if (!tag.find()) {
            return List.of();
        }
        var attributesText = tag.group(1);
        int attributesOffset = regionStart + tag.start(1);
        var attributes = new ArrayList<Node>();
        var matcher = ATTRIBUTE.matcher(attributesText);
        while (matcher.find()) {
            var name = matcher.group(1);
            int start = attributesOffset + matcher.start();
            var span = SourceSpan.of(source, start, attributesOffset + matcher.end());
            Optional<List<Node>> value = Optional.empty();
            if (matcher.group(2) != null) {
                int valueStart = attributesOffset + matcher.start(3);
                var valueSpan = SourceSpan.of(source, valueStart, attributesOffset + matcher.end(3));
                value = Optional.of(List.of(new Text(valueSpan, matcher.group(3))));
            }
            attributes.add(new Attribute(span, name, value));
        }
        return attributes;
    }
}
