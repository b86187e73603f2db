package com.williamcallahan.research_engine.util;

import java.util.List;
import java.util.Locale;

/**
 * DOI normalization shared by the provider adapters and the merge engine.
 */
public final class DoiUtils {

    private static final List<String> PREFIXES = List.of("https://doi.org/", "http://doi.org/", "doi:");

    private DoiUtils() {
    }

    /**
     * Trims, lower-cases and strips resolver prefixes.
     *
     * @param doi raw DOI as a provider reported it
     * @return the bare DOI, or {@code null} when nothing remains
     */
    public static String normalize(String doi) {
        if (doi == null) {
            return null;
        }
        String value = doi.trim().toLowerCase(Locale.ROOT);
        for (String prefix : PREFIXES) {
            if (value.startsWith(prefix)) {
                value = value.substring(prefix.length());
            }
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }
}
