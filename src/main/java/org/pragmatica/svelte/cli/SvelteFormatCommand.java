package org.pragmatica.svelte.cli;

import org.pragmatica.svelte.FormatOptions;
import org.pragmatica.svelte.SortOrder;
import org.pragmatica.svelte.SvelteFormatter;
import org.pragmatica.svelte.embed.SnippedContentCodec;
import org.pragmatica.svelte.error.Diagnostic;
import org.pragmatica.svelte.error.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.PropertiesDefaultProvider;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Format command - prints, rewrites or checks component files.
 *
 * <p>Defaults for every option may be put in {@code ~/.svelte-format.properties},
 * keyed by the long option name without dashes, e.g. {@code print-width=100}.
 */
@Command(
        name = "svelte-format",
        description = "Format Svelte component files",
        mixinStandardHelpOptions = true,
        version = "svelte-format 0.1.0",
        defaultValueProvider = PropertiesDefaultProvider.class
)
public class SvelteFormatCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SvelteFormatCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_UNFORMATTED = 1;
    static final int EXIT_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to format",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--check", "-c"},
            description = "List files that are not formatted and exit with 1 if there are any"
    )
    boolean check;

    @Option(
            names = {"--write", "-w"},
            description = "Rewrite files in place"
    )
    boolean write;

    @Option(
            names = "--print-width",
            description = "Line width to stay within (default: ${DEFAULT-VALUE})",
            defaultValue = "80"
    )
    int printWidth;

    @Option(
            names = "--tab-width",
            description = "Columns per indentation level (default: ${DEFAULT-VALUE})",
            defaultValue = "2"
    )
    int tabWidth;

    @Option(
            names = "--use-tabs",
            description = "Indent with tabs"
    )
    boolean useTabs;

    @Option(
            names = "--sort-order",
            description = "Order of scripts, styles and markup (default: ${DEFAULT-VALUE})",
            defaultValue = "scripts-styles-markup"
    )
    String sortOrder;

    @Option(
            names = "--strict-mode",
            description = "Quote every attribute value and self-close only void elements"
    )
    boolean strictMode;

    @Option(
            names = "--bracket-new-line",
            description = "Put the closing bracket of a broken start tag on its own line"
    )
    boolean bracketNewLine;

    @Option(
            names = "--allow-shorthand",
            negatable = true,
            defaultValue = "true",
            fallbackValue = "true",
            description = "Print name={name} as {name} (default: ${DEFAULT-VALUE})"
    )
    boolean allowShorthand;

    @Option(
            names = "--indent-script-and-style",
            negatable = true,
            defaultValue = "true",
            fallbackValue = "true",
            description = "Indent the bodies of script and style tags (default: ${DEFAULT-VALUE})"
    )
    boolean indentScriptAndStyle;

    public static void main(String[] args) {
        System.exit(new CommandLine(new SvelteFormatCommand()).execute(args));
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        if (check && write) {
            err.println("--check and --write cannot be used together");
            return EXIT_ERROR;
        }

        FormatOptions options;
        try {
            options = options();
        } catch (IllegalArgumentException e) {
            err.println("Invalid option: " + e.getMessage());
            return EXIT_ERROR;
        }

        var collectionErrors = new ArrayList<String>();
        var files = FileCollector.collectSvelteFiles(paths, collectionErrors::add);
        collectionErrors.forEach(err::println);
        log.debug("Collected {} files", files.size());

        var formatter = SvelteFormatter.svelteFormatter(options);
        int unformatted = 0;
        boolean errors = !collectionErrors.isEmpty();

        for (var file : files) {
            String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Cannot read " + file + ": " + e.getMessage());
                errors = true;
                continue;
            }

            String formatted;
            try {
                formatted = formatter.format(source);
            } catch (FormatException e) {
                var normalized = source.replace("\r\n", "\n");
                int offset = SnippedContentCodec.originalOffset(normalized, e.error().location().offset());
                err.print(Diagnostic.of(e.error(), normalized, offset).format(normalized, file.toString()));
                log.error("Failed to format {}", file);
                errors = true;
                continue;
            }

            if (check) {
                if (!formatted.equals(source)) {
                    out.println(file);
                    unformatted++;
                }
            } else if (write) {
                if (!formatted.equals(source)) {
                    try {
                        Files.writeString(file, formatted, StandardCharsets.UTF_8);
                        log.info("Formatted {}", file);
                    } catch (IOException e) {
                        err.println("Cannot write " + file + ": " + e.getMessage());
                        errors = true;
                    }
                }
            } else {
                out.print(formatted);
            }
        }
        out.flush();
        err.flush();

        if (errors) {
            return EXIT_ERROR;
        }
        if (unformatted > 0) {
            log.info("{} of {} files are not formatted", unformatted, files.size());
            return EXIT_UNFORMATTED;
        }
        return EXIT_OK;
    }

    FormatOptions options() {
        return new FormatOptions(printWidth,
                                 tabWidth,
                                 useTabs,
                                 SortOrder.parse(sortOrder),
                                 strictMode,
                                 bracketNewLine,
                                 allowShorthand,
                                 indentScriptAndStyle);
    }
}
