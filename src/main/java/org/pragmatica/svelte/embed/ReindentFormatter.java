package org.pragmatica.svelte.embed;

import java.util.ArrayList;
import java.util.List;

/**
 * Language-agnostic layout cleanup used when no real formatter is plugged in.
 *
 * <p>Expands tabs in the indentation, removes the indentation common to all
 * non-blank lines, strips trailing whitespace, drops leading and trailing blank
 * lines and collapses runs of blank lines into one. Applying it twice gives the
 * same result as applying it once.
 */
public final class ReindentFormatter implements EmbeddedFormatter {

    private final int tabWidth;

    private ReindentFormatter(int tabWidth) {
        this.tabWidth = tabWidth;
    }

    public static ReindentFormatter reindentFormatter(int tabWidth) {
        return new ReindentFormatter(tabWidth);
    }

    @Override
    public String format(String content) {
        var lines = new ArrayList<String>();
        for (var line : content.split("\r?\n", -1)) {
            lines.add(expandLeadingTabs(line).stripTrailing());
        }
        int common = commonIndent(lines);
        var result = new ArrayList<String>();
        boolean previousBlank = true;
        for (var line : lines) {
            boolean blank = line.isEmpty();
            if (blank && previousBlank) {
                continue;
            }
            result.add(blank ? "" : line.substring(common));
            previousBlank = blank;
        }
        if (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return String.join("\n", result);
    }

    private String expandLeadingTabs(String line) {
        int i = 0;
        var indent = new StringBuilder();
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            indent.append(line.charAt(i) == '\t' ? " ".repeat(tabWidth) : " ");
            i++;
        }
        return indent + line.substring(i);
    }

    private static int commonIndent(List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (var line : lines) {
            if (line.isEmpty()) {
                continue;
            }
            int indent = 0;
            while (indent < line.length() && line.charAt(indent) == ' ') {
                indent++;
            }
            common = Math.min(common, indent);
        }
        return common == Integer.MAX_VALUE ? 0 : common;
    }
}
