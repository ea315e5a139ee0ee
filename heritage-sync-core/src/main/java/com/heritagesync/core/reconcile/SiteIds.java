package com.heritagesync.core.reconcile;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier helpers shared by the reconciler and the validator.
 */
public final class SiteIds {

    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)");

    private SiteIds() {
        // Utility class
    }

    /**
     * Normalizes a component-source property reference to the canonical property id.
     *
     * <p>The external source qualifies property ids with extension and serial suffixes.
     * The canonical id is the leading run of digits:
     * <pre>
     * "1133"        -&gt; "1133"
     * "1133bis"     -&gt; "1133"
     * "1133ter-034" -&gt; "1133"
     * "1133-001"    -&gt; "1133"
     * </pre>
     * A reference that does not start with a digit is returned trimmed and otherwise unchanged.
     *
     * @param rawReference property reference as found in the component source
     * @return canonical property id, empty for a null reference
     */
    public static String extractBaseId(String rawReference) {
        if (rawReference == null) {
            return "";
        }
        String trimmed = rawReference.trim();
        Matcher matcher = LEADING_DIGITS.matcher(trimmed);
        return matcher.find() ? matcher.group(1) : trimmed;
    }

    /**
     * Derives the component id from its external URI (the last path segment).
     *
     * <p>{@code http://www.wikidata.org/entity/Q29583927} becomes {@code Q29583927}.
     *
     * @param uri external URI
     * @return last non-empty path segment, or the trimmed URI when it has none
     */
    public static String componentIdOf(String uri) {
        String trimmed = uri == null ? "" : uri.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        String withoutSlash = trimmed.substring(0, end);
        int slash = withoutSlash.lastIndexOf('/');
        String segment = slash >= 0 ? withoutSlash.substring(slash + 1) : withoutSlash;
        return segment.isEmpty() ? trimmed : segment;
    }

    /**
     * Compares property ids numerically, placing non-numeric ids after numeric ones.
     *
     * @param a first id
     * @param b second id
     * @return comparison result
     */
    public static int compareNumeric(String a, String b) {
        Long left = asNumber(a);
        Long right = asNumber(b);
        if (left != null && right != null) {
            int byValue = Long.compare(left, right);
            return byValue != 0 ? byValue : a.compareTo(b);
        }
        if (left != null) {
            return -1;
        }
        if (right != null) {
            return 1;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static Long asNumber(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
