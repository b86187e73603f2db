package com.williamcallahan.research_engine.util;

import java.util.Collection;
import java.util.Map;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static String nullIfBlank(String value) {
        return hasText(value) ? value : null;
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }

    /**
     * Truthiness check used when folding provider values together: absent or zero counts as empty.
     */
    public static boolean isPositive(Integer value) {
        return value != null && value != 0;
    }
}
