package com.heritagesync.core.merge;

import java.util.regex.Pattern;

/**
 * Normalizes free text taken from the source exports.
 *
 * <p>Descriptions and justifications arrive with embedded markup and a handful of HTML
 * entities. Cleaning removes tags, decodes the common named entities, drops hexadecimal
 * numeric entities and collapses whitespace.
 */
public final class TextCleaner {

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#x[0-9a-fA-F]+;");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextCleaner() {
        // Utility class
    }

    /**
     * Cleans a text value.
     *
     * @param text raw text, may be null
     * @return cleaned text, never null
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = TAG.matcher(text).replaceAll("");
        result = result
            .replace("&nbsp;", " ")
            .replace("&middot;", "·")
            .replace("&rsquo;", "'")
            .replace("&amp;", "&");
        result = HEX_ENTITY.matcher(result).replaceAll("");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }
}
