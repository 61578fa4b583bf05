package org.pragmatica.svelte.embed;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hides {@code <script>} and {@code <style>} bodies from the markup parser.
 *
 * <p>Each region is rewritten to its opening tag plus a marker attribute
 * holding the Base64 (UTF-8) encoded body, and a placeholder body: {@code {}}
 * for scripts, nothing for styles. Whitespace around a region is consumed.
 * Regions are found in a single left-to-right scan, so tag-like text inside
 * an earlier region's body is never snipped on its own.
 */
public final class SnippedContentCodec {
    private SnippedContentCodec() {}

    public static final String MARKER_ATTRIBUTE = "✂prettier:content✂";

    // Start-tag attributes, with '>' allowed inside quoted values.
    private static final String TAG_ATTRIBUTES = "(?:\"[^\"]*\"|'[^']*'|[^>\"'])";

    // Capitalized names are components, so only the lowercase tags are regions.
    private static final Pattern REGION = Pattern.compile(
        "\\s*<(script|style)(\\s" + TAG_ATTRIBUTES + "*)?>(.*?)</\\1\\s*>\\s*",
        Pattern.DOTALL);

    private static final Pattern SNIPPED = Pattern.compile(
        "(<\\w+" + TAG_ATTRIBUTES + "*?)\\s*" + Pattern.quote(MARKER_ATTRIBUTE) + "=\"([^\"]*)\">[^<]*(?=</)",
        Pattern.DOTALL);

    /**
     * Replace every script and style body with the marker form and trim the result.
     */
    public static String snip(String source) {
        return snipUntrimmed(source).strip();
    }

    /**
     * Offset in {@code source} of the character at {@code snippedOffset} in
     * {@code snip(source)}. Offsets inside a snipped region map to the start
     * of its opening tag.
     */
    public static int originalOffset(String source, int snippedOffset) {
        int target = snippedOffset + leadingWhitespace(snipUntrimmed(source));
        var matcher = REGION.matcher(source);
        int snippedPos = 0;
        int last = 0;
        while (matcher.find()) {
            int copied = matcher.start() - last;
            if (target < snippedPos + copied) {
                return last + target - snippedPos;
            }
            snippedPos += copied;
            int replaced = replacement(matcher).length();
            if (target < snippedPos + replaced) {
                return matcher.start(1) - 1;
            }
            snippedPos += replaced;
            last = matcher.end();
        }
        return Math.min(last + target - snippedPos, source.length());
    }

    private static String snipUntrimmed(String source) {
        var matcher = REGION.matcher(source);
        var result = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            result.append(source, last, matcher.start()).append(replacement(matcher));
            last = matcher.end();
        }
        result.append(source, last, source.length());
        return result.toString();
    }

    private static String replacement(Matcher region) {
        var tag = region.group(1);
        var attributes = region.group(2) == null ? "" : region.group(2);
        var placeholder = tag.equals("script") ? "{}" : "";
        return "<" + tag + attributes
               + " " + MARKER_ATTRIBUTE + "=\"" + encode(region.group(3)) + "\">"
               + placeholder
               + "</" + tag + ">";
    }

    private static int leadingWhitespace(String text) {
        int count = 0;
        while (count < text.length() && Character.isWhitespace(text.charAt(count))) {
            count++;
        }
        return count;
    }

    public static boolean hasSnippedContent(String text) {
        return text.contains(MARKER_ATTRIBUTE);
    }

    /**
     * Put original bodies back into any text containing snipped regions.
     */
    public static String unsnip(String text) {
        if (!hasSnippedContent(text)) {
            return text;
        }
        var matcher = SNIPPED.matcher(text);
        var result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group(1) + ">" + decode(matcher.group(2))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static String encode(String content) {
        return Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static String decode(String encoded) {
        return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    /**
     * Decode the marker value, empty when absent or blank.
     */
    public static Optional<String> snippedContent(String markerValue) {
        return Optional.ofNullable(markerValue)
                       .filter(value -> !value.isEmpty())
                       .map(SnippedContentCodec::decode);
    }
}
