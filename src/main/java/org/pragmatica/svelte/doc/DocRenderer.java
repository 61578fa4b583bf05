package org.pragmatica.svelte.doc;

import org.pragmatica.svelte.doc.Doc.BreakParent;
import org.pragmatica.svelte.doc.Doc.Concat;
import org.pragmatica.svelte.doc.Doc.Dedent;
import org.pragmatica.svelte.doc.Doc.Fill;
import org.pragmatica.svelte.doc.Doc.Group;
import org.pragmatica.svelte.doc.Doc.Indent;
import org.pragmatica.svelte.doc.Doc.Line;
import org.pragmatica.svelte.doc.Doc.LineKind;
import org.pragmatica.svelte.doc.Doc.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link Doc} to a string for a target line width.
 *
 * <p>Works on an explicit stack of commands (indentation, mode, document).
 * A group is printed flat when its flat rendering, followed by the rest of the
 * current line, fits in the remaining width; otherwise its lines break.
 * Rendering is deterministic: equal documents and widths give equal output.
 */
public final class DocRenderer {

    private enum Mode {
        BREAK,
        FLAT
    }

    private record Command(int indent, Mode mode, Doc doc) {}

    private final int width;
    private final int tabWidth;
    private final boolean useTabs;

    private DocRenderer(int width, int tabWidth, boolean useTabs) {
        this.width = width;
        this.tabWidth = tabWidth;
        this.useTabs = useTabs;
    }

    public static DocRenderer create(int width, int tabWidth, boolean useTabs) {
        if (width < 1 || tabWidth < 0) {
            throw new IllegalArgumentException("Invalid layout: width " + width + ", tab width " + tabWidth);
        }
        return new DocRenderer(width, tabWidth, useTabs);
    }

    /**
     * Render with two-space indentation.
     */
    public static String render(Doc doc, int width) {
        return create(width, 2, false).render(doc);
    }

    public String render(Doc doc) {
        var out = new StringBuilder();
        var commands = new ArrayList<Command>();
        commands.add(new Command(0, Mode.BREAK, propagateBreaks(doc)));
        int pos = 0;
        boolean shouldRemeasure = false;

        while (!commands.isEmpty()) {
            var command = commands.remove(commands.size() - 1);
            int ind = command.indent();
            var mode = command.mode();
            var current = command.doc();

            if (current instanceof Text text) {
                out.append(text.text());
                pos = advance(pos, text.text());
            } else if (current instanceof Concat concat) {
                pushAll(commands, ind, mode, concat.parts());
            } else if (current instanceof Indent indent) {
                commands.add(new Command(ind + 1, mode, indent.contents()));
            } else if (current instanceof Dedent dedent) {
                commands.add(new Command(Math.max(0, ind - 1), mode, dedent.contents()));
            } else if (current instanceof Group group) {
                if (mode == Mode.FLAT && !shouldRemeasure) {
                    commands.add(new Command(ind, group.shouldBreak() ? Mode.BREAK : Mode.FLAT, group.contents()));
                } else {
                    shouldRemeasure = false;
                    var flat = new Command(ind, Mode.FLAT, group.contents());
                    if (!group.shouldBreak() && fits(flat, commands, width - pos, false)) {
                        commands.add(flat);
                    } else {
                        commands.add(new Command(ind, Mode.BREAK, group.contents()));
                    }
                }
            } else if (current instanceof Fill fill) {
                pushFill(commands, ind, mode, fill, width - pos);
            } else if (current instanceof Line line) {
                if (mode == Mode.FLAT) {
                    if (line.kind() == LineKind.NORMAL) {
                        out.append(' ');
                        pos++;
                        continue;
                    }
                    if (line.kind() == LineKind.SOFT) {
                        continue;
                    }
                    shouldRemeasure = true;
                }
                if (line.kind() == LineKind.LITERAL) {
                    out.append('\n');
                    pos = 0;
                } else {
                    trimTrailingBlanks(out);
                    out.append('\n').append(indentation(ind));
                    pos = ind * tabWidth;
                }
            } else if (!(current instanceof BreakParent)) {
                throw new IllegalStateException("Unsupported document " + current);
            }
        }
        return out.toString();
    }

    /**
     * Fill: measure each content/separator pair independently.
     */
    private void pushFill(List<Command> commands, int ind, Mode mode, Fill fill, int remaining) {
        var parts = fill.parts();
        if (parts.isEmpty()) {
            return;
        }
        var content = parts.get(0);
        var contentFlat = new Command(ind, Mode.FLAT, content);
        var contentBreak = new Command(ind, Mode.BREAK, content);
        boolean contentFits = fits(contentFlat, List.of(), remaining, true);

        if (parts.size() == 1) {
            commands.add(contentFits ? contentFlat : contentBreak);
            return;
        }

        var separator = parts.get(1);
        var separatorFlat = new Command(ind, Mode.FLAT, separator);
        var separatorBreak = new Command(ind, Mode.BREAK, separator);

        if (parts.size() == 2) {
            if (contentFits) {
                commands.add(separatorFlat);
                commands.add(contentFlat);
            } else {
                commands.add(separatorBreak);
                commands.add(contentBreak);
            }
            return;
        }

        var rest = new Command(ind, mode, new Fill(parts.subList(2, parts.size())));
        var pairFlat = new Command(ind, Mode.FLAT, new Concat(List.of(content, separator, parts.get(2))));
        commands.add(rest);
        if (fits(pairFlat, List.of(), remaining, true)) {
            commands.add(separatorFlat);
            commands.add(contentFlat);
        } else if (contentFits) {
            commands.add(separatorBreak);
            commands.add(contentFlat);
        } else {
            commands.add(separatorBreak);
            commands.add(contentBreak);
        }
    }

    /**
     * Check whether {@code next} followed by the pending commands fits in
     * {@code remaining} columns up to the next line break.
     */
    private boolean fits(Command next, List<Command> rest, int remaining, boolean mustBeFlat) {
        int restIndex = rest.size();
        var stack = new ArrayList<Command>();
        stack.add(next);

        while (remaining >= 0) {
            if (stack.isEmpty()) {
                if (restIndex == 0) {
                    return true;
                }
                stack.add(rest.get(--restIndex));
                continue;
            }
            var command = stack.remove(stack.size() - 1);
            int ind = command.indent();
            var mode = command.mode();
            var current = command.doc();

            if (current instanceof Text text) {
                var value = text.text();
                int newline = value.indexOf('\n');
                if (newline >= 0) {
                    return remaining - width(value.substring(0, newline)) >= 0;
                }
                remaining -= width(value);
            } else if (current instanceof Concat concat) {
                pushAll(stack, ind, mode, concat.parts());
            } else if (current instanceof Fill fill) {
                pushAll(stack, ind, mode, fill.parts());
            } else if (current instanceof Indent indent) {
                stack.add(new Command(ind + 1, mode, indent.contents()));
            } else if (current instanceof Dedent dedent) {
                stack.add(new Command(Math.max(0, ind - 1), mode, dedent.contents()));
            } else if (current instanceof Group group) {
                if (mustBeFlat && group.shouldBreak()) {
                    return false;
                }
                stack.add(new Command(ind, group.shouldBreak() ? Mode.BREAK : mode, group.contents()));
            } else if (current instanceof Line line) {
                if (mode == Mode.BREAK || line.kind() == LineKind.HARD || line.kind() == LineKind.LITERAL) {
                    return true;
                }
                if (line.kind() == LineKind.NORMAL) {
                    remaining--;
                }
            }
        }
        return false;
    }

    /**
     * Mark every group that contains a break-parent, directly or through a
     * broken nested group, as broken. Returns a new document.
     */
    static Doc propagateBreaks(Doc doc) {
        return propagate(doc).doc();
    }

    private record Propagated(Doc doc, boolean breaks) {}

    private static Propagated propagate(Doc doc) {
        if (doc instanceof BreakParent) {
            return new Propagated(doc, true);
        }
        if (doc instanceof Concat concat) {
            var parts = propagateAll(concat.parts());
            return new Propagated(new Concat(parts.docs()), parts.breaks());
        }
        if (doc instanceof Fill fill) {
            var parts = propagateAll(fill.parts());
            return new Propagated(new Fill(parts.docs()), parts.breaks());
        }
        if (doc instanceof Indent indent) {
            var inner = propagate(indent.contents());
            return new Propagated(new Indent(inner.doc()), inner.breaks());
        }
        if (doc instanceof Dedent dedent) {
            var inner = propagate(dedent.contents());
            return new Propagated(new Dedent(inner.doc()), inner.breaks());
        }
        if (doc instanceof Group group) {
            var inner = propagate(group.contents());
            boolean breaks = group.shouldBreak() || inner.breaks();
            return new Propagated(new Group(inner.doc(), breaks), breaks);
        }
        return new Propagated(doc, false);
    }

    private record PropagatedParts(List<Doc> docs, boolean breaks) {}

    private static PropagatedParts propagateAll(List<Doc> docs) {
        var result = new ArrayList<Doc>(docs.size());
        boolean breaks = false;
        for (var part : docs) {
            var propagated = propagate(part);
            result.add(propagated.doc());
            breaks |= propagated.breaks();
        }
        return new PropagatedParts(result, breaks);
    }

    private static void pushAll(List<Command> stack, int ind, Mode mode, List<Doc> parts) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            stack.add(new Command(ind, mode, parts.get(i)));
        }
    }

    private String indentation(int level) {
        return useTabs ? "\t".repeat(level) : " ".repeat(level * tabWidth);
    }

    private static int advance(int pos, String text) {
        int newline = text.lastIndexOf('\n');
        return newline < 0 ? pos + width(text) : width(text.substring(newline + 1));
    }

    private static int width(String text) {
        return text.codePointCount(0, text.length());
    }

    private static void trimTrailingBlanks(StringBuilder out) {
        int length = out.length();
        while (length > 0 && (out.charAt(length - 1) == ' ' || out.charAt(length - 1) == '\t')) {
            length--;
        }
        out.setLength(length);
    }
}
