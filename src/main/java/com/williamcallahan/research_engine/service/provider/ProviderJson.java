package com.williamcallahan.research_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Null-tolerant field readers for provider payloads. Missing, null or blank values read as {@code null}.
 */
final class ProviderJson {

    private ProviderJson() {
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static Integer integer(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asInt() : null;
    }

    /**
     * First textual element of an array field such as Crossref's {@code title: ["..."]}.
     */
    static String firstText(JsonNode node, String field) {
        JsonNode array = node == null ? null : node.path(field);
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        String text = array.get(0).asText(null);
        return text == null || text.isBlank() ? null : text;
    }

    static <T> List<T> mapArray(JsonNode array, Function<JsonNode, T> mapper) {
        List<T> results = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return results;
        }
        for (JsonNode element : array) {
            if (element == null || !element.isObject()) {
                continue;
            }
            T mapped = mapper.apply(element);
            if (mapped != null) {
                results.add(mapped);
            }
        }
        return results;
    }
}
