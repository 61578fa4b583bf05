package org.pragmatica.svelte;

import org.pragmatica.svelte.doc.DocRenderer;
import org.pragmatica.svelte.embed.EmbeddedFormatters;
import org.pragmatica.svelte.embed.SnippedContentCodec;
import org.pragmatica.svelte.parser.MarkupParser;
import org.pragmatica.svelte.parser.SvelteParser;
import org.pragmatica.svelte.printer.ExpressionPrinter;
import org.pragmatica.svelte.printer.SveltePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for formatting component sources.
 *
 * <p>Example usage:
 * <pre>{@code
 * var formatter = SvelteFormatter.svelteFormatter();
 * var formatted = formatter.format("<div><p>Hello</p></div>");
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class SvelteFormatter {
    private static final Logger log = LoggerFactory.getLogger(SvelteFormatter.class);

    private final FormatOptions options;
    private final MarkupParser parser;
    private final EmbeddedFormatters embeddedFormatters;
    private final ExpressionPrinter expressionPrinter;

    private SvelteFormatter(FormatOptions options,
                            MarkupParser parser,
                            EmbeddedFormatters embeddedFormatters,
                            ExpressionPrinter expressionPrinter) {
        this.options = options;
        this.parser = parser;
        this.embeddedFormatters = embeddedFormatters;
        this.expressionPrinter = expressionPrinter;
    }

    /**
     * Formatter with default options.
     */
    public static SvelteFormatter svelteFormatter() {
        return svelteFormatter(FormatOptions.DEFAULT);
    }

    public static SvelteFormatter svelteFormatter(FormatOptions options) {
        return builder().options(options).build();
    }

    /**
     * Create a builder for replacing the parser or the embedded formatters.
     */
    public static Builder builder() {
        return new Builder();
    }

    public FormatOptions options() {
        return options;
    }

    /**
     * Format a component.
     *
     * @throws org.pragmatica.svelte.error.FormatException if the source cannot be parsed
     *                                                     or an embedded region cannot be put back
     */
    public String format(String source) {
        var normalized = source.replace("\r\n", "\n");
        var snipped = SnippedContentCodec.snip(normalized);
        log.debug("Snipped source: {} -> {} characters", normalized.length(), snipped.length());
        var root = parser.parse(snipped);
        var doc = SveltePrinter.create(root, options, expressionPrinter, embeddedFormatters).print();
        return DocRenderer.create(options.printWidth(), options.tabWidth(), options.useTabs())
                          .render(doc);
    }

    /**
     * True if formatting would leave the source unchanged.
     */
    public boolean isFormatted(String source) {
        return format(source).equals(source);
    }

    public static final class Builder {
        private FormatOptions options = FormatOptions.DEFAULT;
        private MarkupParser parser = SvelteParser.svelteParser();
        private EmbeddedFormatters embeddedFormatters;
        private ExpressionPrinter expressionPrinter = ExpressionPrinter.verbatim();

        private Builder() {}

        public Builder options(FormatOptions options) {
            this.options = options;
            return this;
        }

        public Builder parser(MarkupParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder embeddedFormatters(EmbeddedFormatters formatters) {
            this.embeddedFormatters = formatters;
            return this;
        }

        public Builder expressionPrinter(ExpressionPrinter printer) {
            this.expressionPrinter = printer;
            return this;
        }

        public SvelteFormatter build() {
            var formatters = embeddedFormatters != null
                             ? embeddedFormatters
                             : EmbeddedFormatters.defaults(options.tabWidth());
            return new SvelteFormatter(options, parser, formatters, expressionPrinter);
        }
    }
}
