package com.williamcallahan.research_engine.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for text normalization of provider titles and web snippets.
 */
public class TextUtils {

    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^a-z0-9 ]");
    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*]\\([^)]*\\)");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final int DEFAULT_SNIPPET_LENGTH = 200;

    private TextUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Reduces a title to the form used as a dedup key: lower-case, only {@code [a-z0-9 ]}, trimmed.
     *
     * @param title raw title, may be null
     * @return normalized key, empty string when nothing survives
     */
    public static String normalizeTitleKey(String title) {
        if (title == null) {
            return "";
        }
        return NON_KEY_CHARS.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("").trim();
    }

    public static String cleanSnippet(String text) {
        return cleanSnippet(text, DEFAULT_SNIPPET_LENGTH);
    }

    /**
     * Strips markdown images, unwraps markdown links to their text, removes HTML tags and collapses
     * whitespace. Text longer than {@code maxLength} is cut at the last word boundary and suffixed
     * with {@code ...}.
     */
    public static String cleanSnippet(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = MARKDOWN_IMAGE.matcher(text).replaceAll("");
        cleaned = MARKDOWN_LINK.matcher(cleaned).replaceAll("$1");
        cleaned = HTML_TAG.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.length() > maxLength) {
            String cut = cleaned.substring(0, maxLength);
            int lastSpace = cut.lastIndexOf(' ');
            if (lastSpace > 0) {
                cut = cut.substring(0, lastSpace);
            }
            cleaned = cut + "...";
        }
        return cleaned;
    }

    /**
     * Host portion of an absolute URL ({@code https://host/path -> host}); empty when the URL has no host.
     */
    public static String domainOf(String url) {
        if (url == null) {
            return "";
        }
        String[] parts = url.split("/");
        return parts.length > 2 ? parts[2] : "";
    }
}
